package com.phillippitts.scalogram.domain;

import com.phillippitts.scalogram.exception.InvalidWaveletFamilyException;

import java.util.List;
import java.util.Locale;

/**
 * Supported mother-wavelet families.
 */
public enum WaveletFamily {

    /** Complex analytic Morlet wavelet. */
    MORLET("morlet", List.of("morl", "cmor")),

    /** Real second derivative of a Gaussian ("Mexican hat", Ricker). */
    DERIVATIVE_OF_GAUSSIAN("derivative_of_gaussian", List.of("dog", "mexh", "ricker", "derivative-of-gaussian"));

    private final String id;
    private final List<String> aliases;

    WaveletFamily(String id, List<String> aliases) {
        this.id = id;
        this.aliases = aliases;
    }

    public String getId() {
        return id;
    }

    /**
     * Resolves a configuration identifier, case-insensitively, including common aliases.
     *
     * @param identifier family identifier such as {@code morlet} or {@code mexh}
     * @return the matching family
     * @throws InvalidWaveletFamilyException if nothing matches
     */
    public static WaveletFamily fromId(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new InvalidWaveletFamilyException(String.valueOf(identifier));
        }
        String normalized = identifier.trim().toLowerCase(Locale.ROOT);
        for (WaveletFamily family : values()) {
            if (family.id.equals(normalized) || family.aliases.contains(normalized)
                    || family.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return family;
            }
        }
        throw new InvalidWaveletFamilyException(identifier);
    }
}
