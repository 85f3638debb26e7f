package com.phillippitts.scalogram.domain;

/**
 * One labelled tick along an image axis.
 *
 * @param pixel pixel offset along the axis (column for time, row from the top for vertical)
 * @param value axis value at that pixel (seconds, samples or Hz)
 * @param label formatted value
 */
public record AxisTick(int pixel, double value, String label) {
}
