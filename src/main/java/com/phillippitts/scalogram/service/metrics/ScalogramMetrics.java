package com.phillippitts.scalogram.service.metrics;

import com.phillippitts.scalogram.domain.PipelineStage;
import com.phillippitts.scalogram.exception.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the scalogram pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Duration of each pipeline stage (load, transform, render, emit)</li>
 *   <li>Files processed successfully</li>
 *   <li>Failed files per error kind</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ScalogramMetrics {

    private static final String METRIC_PREFIX = "scalogram.pipeline";

    private final MeterRegistry registry;

    public ScalogramMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the duration of one stage for one file.
     *
     * @param stage         pipeline stage
     * @param durationNanos duration in nanoseconds
     */
    public void recordStage(PipelineStage stage, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".stage")
                .description("Time spent in one pipeline stage for one file")
                .tag("stage", stage.tagValue())
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the counter of files written successfully.
     */
    public void incrementSuccess() {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of files rendered and emitted")
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter for one error kind.
     *
     * @param kind classification of the failure
     */
    public void incrementFailure(ErrorKind kind) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of files that failed")
                .tag("kind", kind.getDisplayName())
                .register(registry)
                .increment();
    }
}
