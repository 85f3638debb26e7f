/**
 * Scalogram rendering: time-axis max-pooling, percentile clipping, amplitude mapping,
 * palette lookup and axis ticks.
 *
 * <p>Everything here is deterministic; rendering the same matrix twice yields identical pixels.
 */
package com.phillippitts.scalogram.service.render;
