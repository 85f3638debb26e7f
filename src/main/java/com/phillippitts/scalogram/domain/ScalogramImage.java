package com.phillippitts.scalogram.domain;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;

/**
 * Rendered scalogram: an ARGB raster plus everything needed to annotate it.
 *
 * <p>Row 0 of the raster is the top of the image. Pixels are packed {@code 0xAARRGGBB}.
 */
public final class ScalogramImage {

    private final int width;
    private final int height;
    private final int[] pixels;
    private final Palette palette;
    private final AmplitudeScale amplitudeScale;
    private final double clipPercentile;
    private final double clipCeiling;
    private final double logDynamicRangeDb;
    private final VerticalAxis verticalAxis;
    private final List<AxisTick> timeTicks;
    private final List<AxisTick> verticalTicks;
    private final double durationSeconds;
    private final TransformMetadata transformMetadata;

    private ScalogramImage(Builder builder) {
        if (builder.width <= 0 || builder.height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: "
                    + builder.width + "x" + builder.height);
        }
        Objects.requireNonNull(builder.pixels, "pixels must not be null");
        if (builder.pixels.length != builder.width * builder.height) {
            throw new IllegalArgumentException("Pixel count " + builder.pixels.length
                    + " does not match " + builder.width + "x" + builder.height);
        }
        this.width = builder.width;
        this.height = builder.height;
        this.pixels = builder.pixels.clone();
        this.palette = Objects.requireNonNull(builder.palette, "palette must not be null");
        this.amplitudeScale = Objects.requireNonNull(builder.amplitudeScale, "amplitudeScale must not be null");
        this.clipPercentile = builder.clipPercentile;
        this.clipCeiling = builder.clipCeiling;
        this.logDynamicRangeDb = builder.logDynamicRangeDb;
        this.verticalAxis = Objects.requireNonNull(builder.verticalAxis, "verticalAxis must not be null");
        this.timeTicks = List.copyOf(builder.timeTicks);
        this.verticalTicks = List.copyOf(builder.verticalTicks);
        this.durationSeconds = builder.durationSeconds;
        this.transformMetadata = Objects.requireNonNull(builder.transformMetadata,
                "transformMetadata must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * @param x column, 0 is the earliest time
     * @param y row, 0 is the top of the image
     * @return packed ARGB value
     */
    public int pixel(int x, int y) {
        return pixels[y * width + x];
    }

    /**
     * @return a copy of the row-major pixel array
     */
    public int[] pixels() {
        return pixels.clone();
    }

    public Palette palette() {
        return palette;
    }

    public AmplitudeScale amplitudeScale() {
        return amplitudeScale;
    }

    public double clipPercentile() {
        return clipPercentile;
    }

    /**
     * @return magnitude that maps to the top of the colour scale
     */
    public double clipCeiling() {
        return clipCeiling;
    }

    /**
     * @return decibels below the ceiling that map to the bottom colour in logarithmic mode
     */
    public double logDynamicRangeDb() {
        return logDynamicRangeDb;
    }

    public VerticalAxis verticalAxis() {
        return verticalAxis;
    }

    public List<AxisTick> timeTicks() {
        return timeTicks;
    }

    public List<AxisTick> verticalTicks() {
        return verticalTicks;
    }

    public double durationSeconds() {
        return durationSeconds;
    }

    public TransformMetadata transformMetadata() {
        return transformMetadata;
    }

    /**
     * Copies the raster into a new AWT image.
     *
     * @return an {@code TYPE_INT_ARGB} image of the same size
     */
    public BufferedImage toBufferedImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, width, height, pixels, 0, width);
        return image;
    }

    /**
     * Builder for {@link ScalogramImage}.
     */
    public static final class Builder {
        private int width;
        private int height;
        private int[] pixels;
        private Palette palette = Palette.GREYS;
        private AmplitudeScale amplitudeScale = AmplitudeScale.LINEAR;
        private double clipPercentile = 100.0;
        private double clipCeiling;
        private double logDynamicRangeDb = 60.0;
        private VerticalAxis verticalAxis = VerticalAxis.SCALE;
        private List<AxisTick> timeTicks = List.of();
        private List<AxisTick> verticalTicks = List.of();
        private double durationSeconds;
        private TransformMetadata transformMetadata;

        private Builder() {
        }

        public Builder width(int width) {
            this.width = width;
            return this;
        }

        public Builder height(int height) {
            this.height = height;
            return this;
        }

        public Builder pixels(int[] pixels) {
            this.pixels = pixels;
            return this;
        }

        public Builder palette(Palette palette) {
            this.palette = palette;
            return this;
        }

        public Builder amplitudeScale(AmplitudeScale amplitudeScale) {
            this.amplitudeScale = amplitudeScale;
            return this;
        }

        public Builder clipPercentile(double clipPercentile) {
            this.clipPercentile = clipPercentile;
            return this;
        }

        public Builder clipCeiling(double clipCeiling) {
            this.clipCeiling = clipCeiling;
            return this;
        }

        public Builder logDynamicRangeDb(double logDynamicRangeDb) {
            this.logDynamicRangeDb = logDynamicRangeDb;
            return this;
        }

        public Builder verticalAxis(VerticalAxis verticalAxis) {
            this.verticalAxis = verticalAxis;
            return this;
        }

        public Builder timeTicks(List<AxisTick> timeTicks) {
            this.timeTicks = timeTicks;
            return this;
        }

        public Builder verticalTicks(List<AxisTick> verticalTicks) {
            this.verticalTicks = verticalTicks;
            return this;
        }

        public Builder durationSeconds(double durationSeconds) {
            this.durationSeconds = durationSeconds;
            return this;
        }

        public Builder transformMetadata(TransformMetadata transformMetadata) {
            this.transformMetadata = transformMetadata;
            return this;
        }

        public ScalogramImage build() {
            return new ScalogramImage(this);
        }
    }
}
