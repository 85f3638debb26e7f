package com.phillippitts.scalogram.service.render;

import com.phillippitts.scalogram.domain.Palette;

import java.util.EnumMap;
import java.util.Map;

/**
 * 256-entry ARGB lookup tables for every {@link Palette}.
 *
 * <p>Colour maps are piecewise-linear interpolations of a few anchor colours; anchors for
 * viridis and magma are taken from the matplotlib tables at quarter steps.
 */
public final class ColorMaps {

    /** Number of entries in every lookup table. */
    public static final int SIZE = 256;

    private static final Map<Palette, int[]> TABLES = new EnumMap<>(Palette.class);

    static {
        TABLES.put(Palette.GREYS, build(new double[] {0.0, 1.0},
                new int[][] {{255, 255, 255}, {0, 0, 0}}));
        TABLES.put(Palette.GRAYSCALE, build(new double[] {0.0, 1.0},
                new int[][] {{0, 0, 0}, {255, 255, 255}}));
        TABLES.put(Palette.VIRIDIS, build(new double[] {0.0, 0.25, 0.5, 0.75, 1.0},
                new int[][] {{68, 1, 84}, {59, 82, 139}, {33, 145, 140}, {94, 201, 98}, {253, 231, 37}}));
        TABLES.put(Palette.MAGMA, build(new double[] {0.0, 0.25, 0.5, 0.75, 1.0},
                new int[][] {{0, 0, 4}, {81, 18, 124}, {183, 55, 121}, {252, 137, 97}, {252, 253, 191}}));
        TABLES.put(Palette.JET, build(new double[] {0.0, 0.125, 0.375, 0.625, 0.875, 1.0},
                new int[][] {{0, 0, 127}, {0, 0, 255}, {0, 255, 255}, {255, 255, 0}, {255, 0, 0}, {127, 0, 0}}));
    }

    private ColorMaps() {
        // Utility class - prevent instantiation
    }

    /**
     * @param palette colour map
     * @return a copy of its lookup table, index 0 is the lowest value
     */
    public static int[] lookupTable(Palette palette) {
        return TABLES.get(palette).clone();
    }

    /**
     * Maps a value in {@code [0, 1]} to a colour using {@code index = round(v * 255)}.
     * Values outside the interval are clamped.
     *
     * @param palette colour map
     * @param value   normalised magnitude
     * @return packed ARGB colour, fully opaque
     */
    public static int color(Palette palette, double value) {
        return TABLES.get(palette)[index(value)];
    }

    static int index(double value) {
        double clamped = Double.isNaN(value) ? 0.0 : Math.max(0.0, Math.min(1.0, value));
        return (int) Math.round(clamped * (SIZE - 1));
    }

    private static int[] build(double[] positions, int[][] anchors) {
        int[] table = new int[SIZE];
        for (int i = 0; i < SIZE; i++) {
            double v = (double) i / (SIZE - 1);
            int segment = 0;
            while (segment < positions.length - 2 && v > positions[segment + 1]) {
                segment++;
            }
            double span = positions[segment + 1] - positions[segment];
            double f = (v - positions[segment]) / span;
            int r = lerp(anchors[segment][0], anchors[segment + 1][0], f);
            int g = lerp(anchors[segment][1], anchors[segment + 1][1], f);
            int b = lerp(anchors[segment][2], anchors[segment + 1][2], f);
            table[i] = 0xFF000000 | (r << 16) | (g << 8) | b;
        }
        return table;
    }

    private static int lerp(int from, int to, double f) {
        return (int) Math.round(from + (to - from) * f);
    }
}
