package com.phillippitts.scalogram.domain;

/**
 * Mapping from clipped magnitude to the unit interval.
 */
public enum AmplitudeScale {
    LINEAR,
    LOGARITHMIC
}
