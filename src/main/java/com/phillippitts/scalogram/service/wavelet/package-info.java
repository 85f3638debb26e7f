/**
 * Mother wavelets and the generator of scale-dilated kernels.
 *
 * <p>Two families are available: the complex Morlet wavelet
 * ({@link com.phillippitts.scalogram.service.wavelet.MorletWavelet}) and the real
 * Mexican-hat derivative of Gaussian
 * ({@link com.phillippitts.scalogram.service.wavelet.DerivativeOfGaussianWavelet}).
 * {@link com.phillippitts.scalogram.service.wavelet.WaveletBasisGenerator} samples them at
 * integer offsets with {@code 1 / sqrt(scale)} normalisation.
 */
package com.phillippitts.scalogram.service.wavelet;
