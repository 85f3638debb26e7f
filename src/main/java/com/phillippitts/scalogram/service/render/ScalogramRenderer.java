package com.phillippitts.scalogram.service.render;

import com.phillippitts.scalogram.config.properties.RenderProperties;
import com.phillippitts.scalogram.domain.AxisTick;
import com.phillippitts.scalogram.domain.CoefficientMatrix;
import com.phillippitts.scalogram.domain.ScaleSet;
import com.phillippitts.scalogram.domain.ScalogramImage;
import com.phillippitts.scalogram.exception.EmptyMatrixException;
import com.phillippitts.scalogram.exception.RenderFailureException;
import com.phillippitts.scalogram.exception.ScalogramException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Turns a coefficient matrix into a colour image.
 *
 * <p>The pipeline runs in a fixed order and is a pure function of its inputs:
 * <ol>
 *   <li>max-pool the time axis down to {@code target-image-width}</li>
 *   <li>clip at the {@code clip-percentile} of the pooled magnitudes</li>
 *   <li>map to {@code [0, 1]} linearly or in decibels</li>
 *   <li>look the value up in the palette</li>
 *   <li>place rows so that the vertical value grows upwards</li>
 * </ol>
 */
public class ScalogramRenderer {

    private static final Logger LOG = LogManager.getLogger(ScalogramRenderer.class);

    private final RenderProperties defaults;

    public ScalogramRenderer(RenderProperties defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
    }

    /**
     * Renders with the configured settings.
     */
    public ScalogramImage render(CoefficientMatrix matrix, ScaleSet scales, double sampleRate) {
        return render(matrix, scales, sampleRate, defaults);
    }

    /**
     * Renders a coefficient matrix.
     *
     * @param matrix     magnitudes, one row per scale
     * @param scales     scale bank the matrix was computed with
     * @param sampleRate sample rate of the signal in Hz
     * @param settings   render settings
     * @return rendered image; height = number of scales
     * @throws EmptyMatrixException   if the matrix has no rows or no columns
     * @throws RenderFailureException for any other rendering problem
     */
    public ScalogramImage render(CoefficientMatrix matrix, ScaleSet scales, double sampleRate,
                                 RenderProperties settings) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        if (matrix.isEmpty()) {
            throw new EmptyMatrixException(matrix.rows(), matrix.columns());
        }
        try {
            return doRender(matrix, scales, sampleRate, settings);
        } catch (ScalogramException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RenderFailureException("Rendering failed: " + e.getMessage(), e);
        }
    }

    private ScalogramImage doRender(CoefficientMatrix matrix, ScaleSet scales, double sampleRate,
                                    RenderProperties settings) {
        if (scales.size() != matrix.rows()) {
            throw new RenderFailureException("Scale set has " + scales.size()
                    + " scales but matrix has " + matrix.rows() + " rows");
        }
        if (!Double.isFinite(sampleRate) || sampleRate <= 0.0) {
            throw new RenderFailureException("Sample rate must be positive and finite, got: " + sampleRate);
        }

        double[][] pooled = TimeAxisDownsampler.maxPool(matrix, settings.getTargetImageWidth());
        int height = pooled.length;
        int width = pooled[0].length;

        double ceiling = AmplitudeMapper.clipCeiling(pooled, settings.getClipPercentile());
        int[] lut = ColorMaps.lookupTable(settings.getPalette());

        int[] pixels = new int[width * height];
        for (int y = 0; y < height; y++) {
            double[] row = pooled[AxisTickCalculator.scaleIndexForRow(y, height, settings.getVerticalAxis())];
            for (int x = 0; x < width; x++) {
                double v = AmplitudeMapper.map(row[x], ceiling, settings.getAmplitudeScale(),
                        settings.getLogDynamicRangeDb());
                pixels[y * width + x] = lut[ColorMaps.index(v)];
            }
        }

        double centerFrequency = matrix.metadata().centerFrequency();
        List<AxisTick> timeTicks = AxisTickCalculator.timeTicks(matrix.columns(), sampleRate, width);
        List<AxisTick> verticalTicks = AxisTickCalculator.verticalTicks(scales, settings.getVerticalAxis(),
                centerFrequency, sampleRate);

        LOG.debug("Rendered {}x{} scalogram (clip ceiling {} at p{})", width, height, ceiling,
                settings.getClipPercentile());
        return ScalogramImage.builder()
                .width(width)
                .height(height)
                .pixels(pixels)
                .palette(settings.getPalette())
                .amplitudeScale(settings.getAmplitudeScale())
                .clipPercentile(settings.getClipPercentile())
                .clipCeiling(ceiling)
                .logDynamicRangeDb(settings.getLogDynamicRangeDb())
                .verticalAxis(settings.getVerticalAxis())
                .timeTicks(timeTicks)
                .verticalTicks(verticalTicks)
                .durationSeconds(matrix.columns() / sampleRate)
                .transformMetadata(matrix.metadata())
                .build();
    }
}
