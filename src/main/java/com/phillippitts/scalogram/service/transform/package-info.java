/**
 * Continuous wavelet transform.
 *
 * <p>{@link com.phillippitts.scalogram.service.transform.CwtEngine} correlates a padded signal
 * with one kernel per scale, directly or through commons-math3 FFTs, and returns a
 * {@link com.phillippitts.scalogram.domain.CoefficientMatrix}. Kernels and their spectra are
 * shared through a per-run {@link com.phillippitts.scalogram.service.transform.KernelCache}.
 */
package com.phillippitts.scalogram.service.transform;
