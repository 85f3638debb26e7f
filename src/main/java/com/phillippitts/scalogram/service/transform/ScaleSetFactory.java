package com.phillippitts.scalogram.service.transform;

import com.phillippitts.scalogram.config.properties.TransformProperties;
import com.phillippitts.scalogram.domain.ScaleSet;
import com.phillippitts.scalogram.domain.WaveletFamily;
import com.phillippitts.scalogram.service.wavelet.WaveletBasisGenerator;

import java.util.Objects;

/**
 * Builds the scale bank for a signal from {@code scalogram.transform.*} settings.
 *
 * <p>When both frequency bounds are configured the bank covers that band at the signal's
 * sample rate; otherwise it spans {@code scale-min .. scale-max}. Both are geometric with
 * {@code points-per-octave} scales per doubling.
 */
public class ScaleSetFactory {

    private final TransformProperties properties;
    private final WaveletBasisGenerator basis;

    public ScaleSetFactory(TransformProperties properties, WaveletBasisGenerator basis) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.basis = Objects.requireNonNull(basis, "basis must not be null");
    }

    /**
     * @param family     wavelet family, whose centre frequency converts Hz to scales
     * @param sampleRate sample rate of the signal in Hz
     * @return the scale bank
     * @throws com.phillippitts.scalogram.exception.InvalidScaleException if the bounds are unusable
     */
    public ScaleSet create(WaveletFamily family, double sampleRate) {
        if (properties.usesFrequencyBand()) {
            return ScaleSet.forFrequencyBand(properties.getFrequencyMin(), properties.getFrequencyMax(),
                    properties.getPointsPerOctave(), basis.centerFrequency(family), sampleRate);
        }
        return ScaleSet.geometric(properties.getScaleMin(), properties.getScaleMax(),
                properties.getPointsPerOctave());
    }
}
