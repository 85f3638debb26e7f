package com.phillippitts.scalogram.service.wavelet;

import com.phillippitts.scalogram.domain.WaveletFamily;
import com.phillippitts.scalogram.domain.WaveletKernel;
import com.phillippitts.scalogram.exception.InvalidScaleException;

import java.util.EnumMap;
import java.util.Map;

/**
 * Produces sampled, energy-normalised wavelet kernels.
 *
 * <p>For scale {@code s} the kernel has {@code 2 * half + 1} samples with
 * {@code half = ceil(supportHalfWidth * s)}; sample {@code k} is
 * {@code psi((k - half) / s) / sqrt(s)}. Kernels are generated from closed-form expressions,
 * so their discrete L2 norm stays close to one at every scale above about two samples.
 *
 * <p>Thread-safe.
 */
public class WaveletBasisGenerator {

    private final Map<WaveletFamily, MotherWavelet> wavelets = new EnumMap<>(WaveletFamily.class);

    public WaveletBasisGenerator() {
        this(MorletWavelet.DEFAULT_OMEGA0);
    }

    /**
     * @param morletOmega0 central angular frequency used for the Morlet family
     */
    public WaveletBasisGenerator(double morletOmega0) {
        wavelets.put(WaveletFamily.MORLET, new MorletWavelet(morletOmega0));
        wavelets.put(WaveletFamily.DERIVATIVE_OF_GAUSSIAN, new DerivativeOfGaussianWavelet());
    }

    public MotherWavelet motherWavelet(WaveletFamily family) {
        return wavelets.get(family);
    }

    /**
     * @param family wavelet family
     * @return centre frequency in cycles per sample at unit scale
     */
    public double centerFrequency(WaveletFamily family) {
        return motherWavelet(family).centerFrequency();
    }

    /**
     * Resolves a family identifier and builds its kernel.
     *
     * @param familyId family identifier, e.g. {@code morlet} or {@code mexh}
     * @param scale    dilation in samples
     * @return kernel for that scale
     * @throws com.phillippitts.scalogram.exception.InvalidWaveletFamilyException for unknown identifiers
     * @throws InvalidScaleException for non-positive or non-finite scales
     */
    public WaveletKernel kernel(String familyId, double scale) {
        return kernel(WaveletFamily.fromId(familyId), scale);
    }

    /**
     * Builds the kernel of one family at one scale.
     *
     * @param family wavelet family
     * @param scale  dilation in samples
     * @return kernel for that scale
     * @throws InvalidScaleException for non-positive or non-finite scales
     */
    public WaveletKernel kernel(WaveletFamily family, double scale) {
        if (!Double.isFinite(scale) || scale <= 0.0) {
            throw new InvalidScaleException(scale);
        }
        MotherWavelet wavelet = motherWavelet(family);
        int half = halfWidth(wavelet, scale);
        int length = 2 * half + 1;
        double norm = 1.0 / Math.sqrt(scale);
        double[] real = new double[length];
        double[] imag = wavelet.isComplex() ? new double[length] : null;
        for (int k = 0; k < length; k++) {
            double t = (k - half) / scale;
            real[k] = wavelet.real(t) * norm;
            if (imag != null) {
                imag[k] = wavelet.imag(t) * norm;
            }
        }
        return new WaveletKernel(family, scale, real, imag);
    }

    /**
     * @return number of kernel samples on each side of the centre for this scale
     */
    public int halfWidth(WaveletFamily family, double scale) {
        return halfWidth(motherWavelet(family), scale);
    }

    private static int halfWidth(MotherWavelet wavelet, double scale) {
        return (int) Math.ceil(wavelet.supportHalfWidth() * scale);
    }
}
