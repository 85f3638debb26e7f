package com.phillippitts.scalogram.service.orchestration;

import com.phillippitts.scalogram.service.io.ScalogramSink;
import com.phillippitts.scalogram.service.metrics.ScalogramMetrics;
import com.phillippitts.scalogram.service.render.ScalogramRenderer;
import com.phillippitts.scalogram.service.transform.CwtEngine;
import com.phillippitts.scalogram.service.transform.ScaleSetFactory;

import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultBatchOrchestrator}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BatchOrchestrator orchestrator = BatchOrchestratorBuilder.builder()
 *     .engine(engine)
 *     .scaleSetFactory(scaleSetFactory)
 *     .renderer(renderer)
 *     .sink(sink)
 *     .batchExecutor(batchExecutor)
 *     .waveletFamily("morlet")
 *     .metrics(metrics)          // optional
 *     .build();
 * }</pre>
 *
 * @since 1.0
 */
public final class BatchOrchestratorBuilder {

    // Required dependencies
    private CwtEngine engine;
    private ScaleSetFactory scaleSetFactory;
    private ScalogramRenderer renderer;
    private ScalogramSink sink = ScalogramSink.NOOP;
    private Executor batchExecutor;
    private String waveletFamily = "morlet";

    // Optional dependencies
    private ScalogramMetrics metrics;

    private BatchOrchestratorBuilder() {
        // Private constructor - use builder() factory method
    }

    public static BatchOrchestratorBuilder builder() {
        return new BatchOrchestratorBuilder();
    }

    public BatchOrchestratorBuilder engine(CwtEngine engine) {
        this.engine = engine;
        return this;
    }

    public BatchOrchestratorBuilder scaleSetFactory(ScaleSetFactory scaleSetFactory) {
        this.scaleSetFactory = scaleSetFactory;
        return this;
    }

    public BatchOrchestratorBuilder renderer(ScalogramRenderer renderer) {
        this.renderer = renderer;
        return this;
    }

    public BatchOrchestratorBuilder sink(ScalogramSink sink) {
        this.sink = sink;
        return this;
    }

    public BatchOrchestratorBuilder batchExecutor(Executor batchExecutor) {
        this.batchExecutor = batchExecutor;
        return this;
    }

    /**
     * @param waveletFamily family identifier, resolved per input so that an unknown identifier
     *                      fails each input instead of the whole batch
     */
    public BatchOrchestratorBuilder waveletFamily(String waveletFamily) {
        this.waveletFamily = waveletFamily;
        return this;
    }

    public BatchOrchestratorBuilder metrics(ScalogramMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    /**
     * @return the orchestrator
     * @throws NullPointerException if a required dependency is missing
     */
    public DefaultBatchOrchestrator build() {
        return new DefaultBatchOrchestrator(this);
    }

    CwtEngine engine() {
        return engine;
    }

    ScaleSetFactory scaleSetFactory() {
        return scaleSetFactory;
    }

    ScalogramRenderer renderer() {
        return renderer;
    }

    ScalogramSink sink() {
        return sink;
    }

    Executor batchExecutor() {
        return batchExecutor;
    }

    String waveletFamily() {
        return waveletFamily;
    }

    ScalogramMetrics metrics() {
        return metrics;
    }
}
