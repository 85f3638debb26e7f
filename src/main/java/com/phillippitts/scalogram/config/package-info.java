/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.scalogram.config.ScalogramConfig} - wiring of the transform,
 *       render and output services into the batch orchestrator</li>
 *   <li>{@link com.phillippitts.scalogram.config.ThreadPoolConfig} - batch and scale executors</li>
 *   <li>{@link com.phillippitts.scalogram.config.MetricsConfig} - fallback meter registry</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - validated {@code @ConfigurationProperties} classes bound
 *       from {@code application.properties}</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.scalogram.config;
