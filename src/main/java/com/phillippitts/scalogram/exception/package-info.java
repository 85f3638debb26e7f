/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.scalogram.exception.ScalogramException},
 * which is unchecked and carries an {@link com.phillippitts.scalogram.exception.ErrorKind}.
 * The batch orchestrator converts them into per-file failure results; nothing in the core
 * aborts the process.
 *
 * <ul>
 *   <li>{@link com.phillippitts.scalogram.exception.InvalidWaveletFamilyException} - unknown
 *       mother-wavelet identifier</li>
 *   <li>{@link com.phillippitts.scalogram.exception.InvalidScaleException} - non-positive scale
 *       or unusable scale bounds</li>
 *   <li>{@link com.phillippitts.scalogram.exception.EmptySignalException} and
 *       {@link com.phillippitts.scalogram.exception.NonFiniteInputException} - rejected input</li>
 *   <li>{@link com.phillippitts.scalogram.exception.EmptyMatrixException} and
 *       {@link com.phillippitts.scalogram.exception.RenderFailureException} - rendering</li>
 *   <li>{@link com.phillippitts.scalogram.exception.LoadFailureException} and
 *       {@link com.phillippitts.scalogram.exception.OutputFailureException} - collaborators</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.scalogram.exception;
