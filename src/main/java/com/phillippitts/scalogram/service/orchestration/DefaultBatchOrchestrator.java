package com.phillippitts.scalogram.service.orchestration;

import com.phillippitts.scalogram.domain.BatchSummary;
import com.phillippitts.scalogram.domain.CoefficientMatrix;
import com.phillippitts.scalogram.domain.PipelineStage;
import com.phillippitts.scalogram.domain.ProcessingResult;
import com.phillippitts.scalogram.domain.ScaleSet;
import com.phillippitts.scalogram.domain.ScalogramImage;
import com.phillippitts.scalogram.domain.Signal;
import com.phillippitts.scalogram.domain.WaveletFamily;
import com.phillippitts.scalogram.exception.ErrorKind;
import com.phillippitts.scalogram.exception.ScalogramException;
import com.phillippitts.scalogram.service.io.ScalogramSink;
import com.phillippitts.scalogram.service.io.SignalSource;
import com.phillippitts.scalogram.service.metrics.ScalogramMetrics;
import com.phillippitts.scalogram.service.render.ScalogramRenderer;
import com.phillippitts.scalogram.service.transform.CwtEngine;
import com.phillippitts.scalogram.service.transform.KernelCache;
import com.phillippitts.scalogram.service.transform.ScaleSetFactory;
import com.phillippitts.scalogram.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Default implementation of {@link BatchOrchestrator}.
 *
 * <p>Each input runs as one task on the batch executor and walks a {@link FileStateMachine}
 * through load, transform, render and emit. Results are index-tagged and collected in input
 * order, whatever order the tasks finish in.
 *
 * <p><b>Error Handling:</b> every exception or error raised by a stage is converted into a
 * {@link ProcessingResult.Failure}. Exceptions outside the {@link ScalogramException}
 * hierarchy are classified by the stage they came from.
 *
 * <p><b>Logging:</b> the input identifier is put into the Log4j2 ThreadContext under
 * {@value #SIGNAL_ID_KEY} while the input is processed.
 *
 * @since 1.0
 */
public class DefaultBatchOrchestrator implements BatchOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultBatchOrchestrator.class);

    /** ThreadContext key holding the identifier of the input being processed. */
    public static final String SIGNAL_ID_KEY = "signalId";

    private final CwtEngine engine;
    private final ScaleSetFactory scaleSetFactory;
    private final ScalogramRenderer renderer;
    private final ScalogramSink sink;
    private final Executor batchExecutor;
    private final String waveletFamily;
    private final ScalogramMetrics metrics;

    DefaultBatchOrchestrator(BatchOrchestratorBuilder builder) {
        this.engine = Objects.requireNonNull(builder.engine(), "engine must not be null");
        this.scaleSetFactory = Objects.requireNonNull(builder.scaleSetFactory(), "scaleSetFactory must not be null");
        this.renderer = Objects.requireNonNull(builder.renderer(), "renderer must not be null");
        this.sink = Objects.requireNonNull(builder.sink(), "sink must not be null");
        this.batchExecutor = Objects.requireNonNull(builder.batchExecutor(), "batchExecutor must not be null");
        this.waveletFamily = Objects.requireNonNull(builder.waveletFamily(), "waveletFamily must not be null");
        this.metrics = builder.metrics();
    }

    @Override
    public List<ProcessingResult> processAll(List<? extends SignalSource> sources, BatchCancellation cancellation) {
        Objects.requireNonNull(sources, "sources must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        long startNanos = System.nanoTime();
        KernelCache kernels = engine.newKernelCache();
        List<CompletableFuture<ProcessingResult>> futures = new ArrayList<>(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            int index = i;
            SignalSource source = sources.get(i);
            if (cancellation.isCancelled()) {
                futures.add(CompletableFuture.completedFuture(cancelled(index, source.identifier())));
                continue;
            }
            try {
                futures.add(CompletableFuture.supplyAsync(
                        () -> processOne(index, source, kernels, cancellation), batchExecutor));
            } catch (RejectedExecutionException e) {
                LOG.warn("Batch executor rejected {}: {}", source.identifier(), e.getMessage());
                futures.add(CompletableFuture.completedFuture(record(new ProcessingResult.Failure(index,
                        source.identifier(), PipelineStage.LOAD, ErrorKind.LOAD_FAILURE,
                        "Rejected by batch executor: " + e.getMessage()))));
            }
        }

        List<ProcessingResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ProcessingResult> future : futures) {
            results.add(future.join());
        }

        BatchSummary summary = BatchSummary.of(results);
        LOG.info("Batch finished: {} succeeded, {} failed of {} in {}ms ({} cached kernels)",
                summary.succeeded(), summary.failed(), summary.total(),
                TimeUtils.elapsedMillis(startNanos), kernels.size());
        return results;
    }

    private ProcessingResult processOne(int index, SignalSource source, KernelCache kernels,
                                        BatchCancellation cancellation) {
        String identifier = source.identifier();
        if (cancellation.isCancelled()) {
            return cancelled(index, identifier);
        }

        ThreadContext.put(SIGNAL_ID_KEY, identifier);
        FileStateMachine state = new FileStateMachine(identifier);
        PipelineStage stage = PipelineStage.LOAD;
        try {
            long t0 = System.nanoTime();
            Signal signal = source.load();
            timed(stage, t0);
            state.advance(FileStateMachine.State.LOADED);
            LOG.debug("Loaded {} samples at {} Hz", signal.length(), signal.sampleRate());

            stage = PipelineStage.TRANSFORM;
            t0 = System.nanoTime();
            WaveletFamily family = WaveletFamily.fromId(waveletFamily);
            ScaleSet scales = scaleSetFactory.create(family, signal.sampleRate());
            CoefficientMatrix matrix = engine.transform(signal, scales, family, kernels);
            timed(stage, t0);
            state.advance(FileStateMachine.State.TRANSFORMED);

            stage = PipelineStage.RENDER;
            t0 = System.nanoTime();
            ScalogramImage image = renderer.render(matrix, scales, signal.sampleRate());
            timed(stage, t0);
            state.advance(FileStateMachine.State.RENDERED);

            stage = PipelineStage.EMIT;
            t0 = System.nanoTime();
            sink.emit(identifier, image);
            timed(stage, t0);
            state.advance(FileStateMachine.State.EMITTED);

            if (metrics != null) {
                metrics.incrementSuccess();
            }
            LOG.info("Processed {} ({} scales, {}x{} image)", identifier, scales.size(),
                    image.width(), image.height());
            return new ProcessingResult.Success(index, identifier, image);
        } catch (Throwable e) { // include OutOfMemoryError from oversized inputs or kernels
            if (!state.isTerminal()) {
                state.fail();
            }
            ProcessingResult.Failure failure = classify(index, identifier, stage, e);
            LOG.warn("Failed {} at {}: {} - {}", identifier, stage,
                    failure.errorKind().getDisplayName(), failure.reason());
            return record(failure);
        } finally {
            ThreadContext.remove(SIGNAL_ID_KEY);
        }
    }

    /**
     * Converts an exception or error raised by one stage into a failure result. Anything outside
     * the {@link ScalogramException} hierarchy, errors included, is classified by stage.
     */
    static ProcessingResult.Failure classify(int index, String identifier, PipelineStage stage, Throwable e) {
        ErrorKind kind;
        if (e instanceof ScalogramException scalogramException) {
            kind = scalogramException.getErrorKind();
        } else {
            kind = switch (stage) {
                case LOAD -> ErrorKind.LOAD_FAILURE;
                case TRANSFORM -> ErrorKind.TRANSFORM_FAILURE;
                case RENDER -> ErrorKind.RENDER_FAILURE;
                case EMIT -> ErrorKind.OUTPUT_FAILURE;
            };
        }
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new ProcessingResult.Failure(index, identifier, stage, kind, reason);
    }

    private ProcessingResult.Failure cancelled(int index, String identifier) {
        LOG.debug("Skipping {}: batch cancelled", identifier);
        return record(new ProcessingResult.Failure(index, identifier, PipelineStage.LOAD,
                ErrorKind.CANCELLED, "Batch cancelled before processing started"));
    }

    private ProcessingResult.Failure record(ProcessingResult.Failure failure) {
        if (metrics != null) {
            metrics.incrementFailure(failure.errorKind());
        }
        return failure;
    }

    private void timed(PipelineStage stage, long startNanos) {
        if (metrics != null) {
            metrics.recordStage(stage, TimeUtils.elapsedNanos(startNanos));
        }
    }
}
