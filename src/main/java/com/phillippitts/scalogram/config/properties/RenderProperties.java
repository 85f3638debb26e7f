package com.phillippitts.scalogram.config.properties;

import com.phillippitts.scalogram.domain.AmplitudeScale;
import com.phillippitts.scalogram.domain.Palette;
import com.phillippitts.scalogram.domain.VerticalAxis;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Scalogram rendering settings.
 *
 * <p>A {@code target-image-width} of zero or less keeps one column per sample.
 */
@ConfigurationProperties(prefix = "scalogram.render")
@Validated
public class RenderProperties {

    @NotNull(message = "Amplitude scale must not be null")
    private AmplitudeScale amplitudeScale = AmplitudeScale.LINEAR;

    @NotNull(message = "Palette must not be null")
    private Palette palette = Palette.GREYS;

    @DecimalMin(value = "0.0", inclusive = false, message = "Clip percentile must be above 0")
    @DecimalMax(value = "100.0", message = "Clip percentile must not exceed 100")
    private double clipPercentile = 99.5;

    @Positive(message = "Log dynamic range must be positive")
    private double logDynamicRangeDb = 60.0;

    private int targetImageWidth = 1024;

    @NotNull(message = "Vertical axis must not be null")
    private VerticalAxis verticalAxis = VerticalAxis.SCALE;

    public AmplitudeScale getAmplitudeScale() {
        return amplitudeScale;
    }

    public void setAmplitudeScale(AmplitudeScale amplitudeScale) {
        this.amplitudeScale = amplitudeScale;
    }

    public Palette getPalette() {
        return palette;
    }

    public void setPalette(Palette palette) {
        this.palette = palette;
    }

    public double getClipPercentile() {
        return clipPercentile;
    }

    public void setClipPercentile(double clipPercentile) {
        this.clipPercentile = clipPercentile;
    }

    public double getLogDynamicRangeDb() {
        return logDynamicRangeDb;
    }

    public void setLogDynamicRangeDb(double logDynamicRangeDb) {
        this.logDynamicRangeDb = logDynamicRangeDb;
    }

    public int getTargetImageWidth() {
        return targetImageWidth;
    }

    public void setTargetImageWidth(int targetImageWidth) {
        this.targetImageWidth = targetImageWidth;
    }

    public VerticalAxis getVerticalAxis() {
        return verticalAxis;
    }

    public void setVerticalAxis(VerticalAxis verticalAxis) {
        this.verticalAxis = verticalAxis;
    }
}
