package com.phillippitts.scalogram.domain;

import java.util.Locale;

/**
 * Steps every input goes through, in order.
 */
public enum PipelineStage {
    LOAD,
    TRANSFORM,
    RENDER,
    EMIT;

    /**
     * @return lower-case name, used as a metric tag
     */
    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
