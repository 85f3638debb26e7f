package com.phillippitts.scalogram.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * PNG figure annotation settings.
 *
 * <p>When {@code vertical-axis-label} is unset it follows the vertical axis: {@code Scale} or
 * {@code Frequency (Hz)}.
 */
@ConfigurationProperties(prefix = "scalogram.output")
public class OutputProperties {

    private boolean annotate = true;
    private String timeAxisLabel = "Time (s)";
    private String verticalAxisLabel;
    private String colorbarLabel = "Magnitude";

    public boolean isAnnotate() {
        return annotate;
    }

    public void setAnnotate(boolean annotate) {
        this.annotate = annotate;
    }

    public String getTimeAxisLabel() {
        return timeAxisLabel;
    }

    public void setTimeAxisLabel(String timeAxisLabel) {
        this.timeAxisLabel = timeAxisLabel;
    }

    public String getVerticalAxisLabel() {
        return verticalAxisLabel;
    }

    public void setVerticalAxisLabel(String verticalAxisLabel) {
        this.verticalAxisLabel = verticalAxisLabel;
    }

    public String getColorbarLabel() {
        return colorbarLabel;
    }

    public void setColorbarLabel(String colorbarLabel) {
        this.colorbarLabel = colorbarLabel;
    }
}
