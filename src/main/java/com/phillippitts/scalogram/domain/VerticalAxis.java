package com.phillippitts.scalogram.domain;

/**
 * Quantity shown on the vertical axis of a scalogram.
 */
public enum VerticalAxis {

    /** Scale in samples; the largest scale is the top row. */
    SCALE,

    /** Equivalent frequency in Hz; the highest frequency is the top row. */
    FREQUENCY
}
