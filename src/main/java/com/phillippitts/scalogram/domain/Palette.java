package com.phillippitts.scalogram.domain;

/**
 * Colour maps available to the renderer.
 */
public enum Palette {

    /** White for low magnitudes, black for high. */
    GREYS,

    /** Black for low magnitudes, white for high. */
    GRAYSCALE,

    VIRIDIS,

    MAGMA,

    JET
}
