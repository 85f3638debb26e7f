package com.phillippitts.scalogram.service.orchestration;

import com.phillippitts.scalogram.config.properties.RenderProperties;
import com.phillippitts.scalogram.config.properties.TransformProperties;
import com.phillippitts.scalogram.domain.PipelineStage;
import com.phillippitts.scalogram.domain.ProcessingResult;
import com.phillippitts.scalogram.domain.Signal;
import com.phillippitts.scalogram.exception.ErrorKind;
import com.phillippitts.scalogram.exception.LoadFailureException;
import com.phillippitts.scalogram.service.io.AaaFileSignalSource;
import com.phillippitts.scalogram.service.io.InMemorySignalSource;
import com.phillippitts.scalogram.service.io.ScalogramSink;
import com.phillippitts.scalogram.service.io.SignalSource;
import com.phillippitts.scalogram.service.metrics.ScalogramMetrics;
import com.phillippitts.scalogram.service.render.ScalogramRenderer;
import com.phillippitts.scalogram.service.transform.CwtEngine;
import com.phillippitts.scalogram.service.transform.ScaleSetFactory;
import com.phillippitts.scalogram.service.wavelet.WaveletBasisGenerator;
import com.phillippitts.scalogram.testutil.SignalFixtures;
import com.phillippitts.scalogram.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultBatchOrchestratorTest {

    @TempDir
    Path dir;

    private CwtEngine engine;
    private ScaleSetFactory scaleSetFactory;
    private ScalogramRenderer renderer;

    @BeforeEach
    void setUp() {
        TransformProperties transform = new TransformProperties();
        transform.setScaleMin(1.0);
        transform.setScaleMax(8.0);
        transform.setPointsPerOctave(2);
        WaveletBasisGenerator basis = new WaveletBasisGenerator();
        engine = new CwtEngine(basis, transform);
        scaleSetFactory = new ScaleSetFactory(transform, basis);
        renderer = new ScalogramRenderer(new RenderProperties());
    }

    private BatchOrchestratorBuilder builder(Executor executor) {
        return BatchOrchestratorBuilder.builder()
                .engine(engine)
                .scaleSetFactory(scaleSetFactory)
                .renderer(renderer)
                .batchExecutor(executor);
    }

    private static SignalSource source(String id) {
        return new InMemorySignalSource(SignalFixtures.noise(id, 100.0, 128, id.hashCode()));
    }

    private static SignalSource unreadable(String id) {
        return new SignalSource() {
            @Override
            public String identifier() {
                return id;
            }

            @Override
            public Signal load() {
                throw new LoadFailureException(id, "header declares 5 entries but file has 4");
            }
        };
    }

    @Test
    void failingInputShouldNotStopBatch() {
        BatchOrchestrator orchestrator = builder(new SyncExecutor()).build();

        List<ProcessingResult> results = orchestrator.processAll(
                List.of(source("a.aaa"), unreadable("b.aaa"), source("c.aaa")));

        assertThat(results).hasSize(3);
        assertThat(results.get(0)).isInstanceOf(ProcessingResult.Success.class);
        assertThat(results.get(2)).isInstanceOf(ProcessingResult.Success.class);
        ProcessingResult.Failure failure = (ProcessingResult.Failure) results.get(1);
        assertThat(failure.index()).isEqualTo(1);
        assertThat(failure.identifier()).isEqualTo("b.aaa");
        assertThat(failure.stage()).isEqualTo(PipelineStage.LOAD);
        assertThat(failure.errorKind()).isEqualTo(ErrorKind.LOAD_FAILURE);
        assertThat(failure.reason()).contains("header declares 5 entries");
    }

    @Test
    void successShouldCarryRenderedImage() {
        List<ProcessingResult> results = builder(new SyncExecutor()).build().processAll(List.of(source("a.aaa")));

        ProcessingResult.Success success = (ProcessingResult.Success) results.get(0);
        // scales 1, 1.41, 2, 2.83, 4, 5.66, 8
        assertThat(success.image().height()).isEqualTo(7);
        assertThat(success.image().width()).isEqualTo(128);
    }

    @Test
    void emptySignalShouldFailAtTransform() {
        List<ProcessingResult> results = builder(new SyncExecutor()).build()
                .processAll(List.of(new InMemorySignalSource("e.aaa", new double[0], 100.0)));

        ProcessingResult.Failure failure = (ProcessingResult.Failure) results.get(0);
        assertThat(failure.stage()).isEqualTo(PipelineStage.TRANSFORM);
        assertThat(failure.errorKind()).isEqualTo(ErrorKind.EMPTY_SIGNAL);
    }

    @Test
    void nonFiniteSampleShouldFailAtTransform() {
        List<ProcessingResult> results = builder(new SyncExecutor()).build()
                .processAll(List.of(new InMemorySignalSource("n.aaa",
                        new double[] {1.0, Double.POSITIVE_INFINITY}, 100.0)));

        ProcessingResult.Failure failure = (ProcessingResult.Failure) results.get(0);
        assertThat(failure.errorKind()).isEqualTo(ErrorKind.NON_FINITE_INPUT);
        assertThat(failure.reason()).contains("index 1");
    }

    @Test
    void unknownFamilyShouldFailEveryInputAtTransform() {
        List<ProcessingResult> results = builder(new SyncExecutor()).waveletFamily("haar").build()
                .processAll(List.of(source("a.aaa"), source("b.aaa")));

        assertThat(results).allSatisfy(result -> {
            ProcessingResult.Failure failure = (ProcessingResult.Failure) result;
            assertThat(failure.stage()).isEqualTo(PipelineStage.TRANSFORM);
            assertThat(failure.errorKind()).isEqualTo(ErrorKind.INVALID_WAVELET_FAMILY);
        });
    }

    @Test
    void sinkErrorsShouldBeClassifiedAsOutputFailures() {
        ScalogramSink broken = (id, image) -> {
            throw new IllegalStateException("disk full");
        };

        List<ProcessingResult> results = builder(new SyncExecutor()).sink(broken).build()
                .processAll(List.of(source("a.aaa")));

        ProcessingResult.Failure failure = (ProcessingResult.Failure) results.get(0);
        assertThat(failure.stage()).isEqualTo(PipelineStage.EMIT);
        assertThat(failure.errorKind()).isEqualTo(ErrorKind.OUTPUT_FAILURE);
        assertThat(failure.reason()).isEqualTo("disk full");
    }

    @Test
    void classifyShouldUseStageForForeignExceptions() {
        ProcessingResult.Failure render = DefaultBatchOrchestrator.classify(3, "x", PipelineStage.RENDER,
                new IllegalArgumentException("bad"));
        ProcessingResult.Failure noMessage = DefaultBatchOrchestrator.classify(0, "x", PipelineStage.TRANSFORM,
                new ArithmeticException());

        assertThat(render.errorKind()).isEqualTo(ErrorKind.RENDER_FAILURE);
        assertThat(render.index()).isEqualTo(3);
        assertThat(noMessage.errorKind()).isEqualTo(ErrorKind.TRANSFORM_FAILURE);
        assertThat(noMessage.reason()).isEqualTo("ArithmeticException");
    }

    @Test
    void classifyShouldAcceptErrors() {
        ProcessingResult.Failure failure = DefaultBatchOrchestrator.classify(2, "x", PipelineStage.LOAD,
                new OutOfMemoryError("Java heap space"));

        assertThat(failure.stage()).isEqualTo(PipelineStage.LOAD);
        assertThat(failure.errorKind()).isEqualTo(ErrorKind.LOAD_FAILURE);
        assertThat(failure.reason()).isEqualTo("Java heap space");
    }

    private Path aaaFile(String name, int declared, int rows) throws IOException {
        StringBuilder content = new StringBuilder("h,").append(declared).append(",0.01\n");
        for (int i = 0; i < rows; i++) {
            content.append(Math.sin(i * 0.3)).append('\n');
        }
        return Files.writeString(dir.resolve(name), content);
    }

    @Test
    void oversizedHeaderShouldFailOnlyItsOwnFile() throws IOException {
        Path ok1 = aaaFile("ok1.aaa", 64, 64);
        Path huge = aaaFile("huge.aaa", 2_147_483_000, 2);
        Path ok2 = aaaFile("ok2.aaa", 96, 96);

        List<ProcessingResult> results = builder(new SyncExecutor()).build().processAll(List.of(
                new AaaFileSignalSource(ok1), new AaaFileSignalSource(huge), new AaaFileSignalSource(ok2)));

        assertThat(results).hasSize(3);
        assertThat(results.get(0)).isInstanceOf(ProcessingResult.Success.class);
        assertThat(results.get(2)).isInstanceOf(ProcessingResult.Success.class);
        ProcessingResult.Failure failure = (ProcessingResult.Failure) results.get(1);
        assertThat(failure.identifier()).isEqualTo("huge.aaa");
        assertThat(failure.stage()).isEqualTo(PipelineStage.LOAD);
        assertThat(failure.errorKind()).isEqualTo(ErrorKind.LOAD_FAILURE);
        assertThat(failure.reason()).contains("header declares 2147483000 entries");
    }

    @Test
    void errorRaisedByOneInputShouldNotStopBatch() {
        SignalSource exhausted = new SignalSource() {
            @Override
            public String identifier() {
                return "oom.aaa";
            }

            @Override
            public Signal load() {
                throw new OutOfMemoryError("Java heap space");
            }
        };
        ScalogramSink failingSink = (id, image) -> {
            if (id.equals("c.aaa")) {
                throw new StackOverflowError();
            }
        };

        List<ProcessingResult> results = builder(new SyncExecutor()).sink(failingSink).build()
                .processAll(List.of(source("a.aaa"), exhausted, source("c.aaa"), source("d.aaa")));

        assertThat(results).hasSize(4);
        assertThat(results.get(0)).isInstanceOf(ProcessingResult.Success.class);
        assertThat(results.get(3)).isInstanceOf(ProcessingResult.Success.class);
        ProcessingResult.Failure load = (ProcessingResult.Failure) results.get(1);
        assertThat(load.stage()).isEqualTo(PipelineStage.LOAD);
        assertThat(load.errorKind()).isEqualTo(ErrorKind.LOAD_FAILURE);
        assertThat(load.reason()).isEqualTo("Java heap space");
        ProcessingResult.Failure emit = (ProcessingResult.Failure) results.get(2);
        assertThat(emit.stage()).isEqualTo(PipelineStage.EMIT);
        assertThat(emit.errorKind()).isEqualTo(ErrorKind.OUTPUT_FAILURE);
        assertThat(emit.reason()).isEqualTo("StackOverflowError");
    }

    @Test
    void resultsShouldFollowInputOrderOnThreadPool() {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<SignalSource> sources = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                sources.add(i % 4 == 3 ? unreadable("f" + i + ".aaa") : source("s" + i + ".aaa"));
            }
            List<String> emitted = Collections.synchronizedList(new ArrayList<>());

            List<ProcessingResult> results = builder(pool).sink((id, image) -> emitted.add(id)).build()
                    .processAll(sources);

            assertThat(results).hasSize(12);
            for (int i = 0; i < 12; i++) {
                assertThat(results.get(i).index()).isEqualTo(i);
                assertThat(results.get(i).identifier()).isEqualTo(sources.get(i).identifier());
                assertThat(results.get(i).isSuccess()).isEqualTo(i % 4 != 3);
            }
            assertThat(emitted).hasSize(9);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void cancellationShouldSkipInputsNotYetStarted() {
        BatchCancellation cancellation = new BatchCancellation();
        SyncExecutor executor = new SyncExecutor();
        BatchOrchestrator orchestrator = builder(executor).sink((id, image) -> cancellation.cancel()).build();

        List<ProcessingResult> results = orchestrator.processAll(
                List.of(source("a.aaa"), source("b.aaa"), source("c.aaa")), cancellation);

        assertThat(results.get(0).isSuccess()).isTrue();
        assertThat(results.subList(1, 3)).allSatisfy(result -> {
            ProcessingResult.Failure failure = (ProcessingResult.Failure) result;
            assertThat(failure.errorKind()).isEqualTo(ErrorKind.CANCELLED);
            assertThat(failure.stage()).isEqualTo(PipelineStage.LOAD);
        });
        assertThat(executor.executedCount()).isEqualTo(1);
    }

    @Test
    void preCancelledBatchShouldDispatchNothing() {
        BatchCancellation cancellation = new BatchCancellation();
        cancellation.cancel();
        SyncExecutor executor = new SyncExecutor();

        List<ProcessingResult> results = builder(executor).build()
                .processAll(List.of(source("a.aaa"), source("b.aaa")), cancellation);

        assertThat(results).noneMatch(ProcessingResult::isSuccess);
        assertThat(executor.executedCount()).isZero();
    }

    @Test
    void rejectedTaskShouldBecomeLoadFailure() {
        Executor rejecting = command -> {
            throw new RejectedExecutionException("queue full");
        };

        List<ProcessingResult> results = builder(rejecting).build().processAll(List.of(source("a.aaa")));

        ProcessingResult.Failure failure = (ProcessingResult.Failure) results.get(0);
        assertThat(failure.errorKind()).isEqualTo(ErrorKind.LOAD_FAILURE);
        assertThat(failure.reason()).contains("queue full");
    }

    @Test
    void emptyBatchShouldYieldNoResults() {
        assertThat(builder(new SyncExecutor()).build().processAll(List.of())).isEmpty();
    }

    @Test
    void shouldRecordMetricsPerStageAndOutcome() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        BatchOrchestrator orchestrator = builder(new SyncExecutor())
                .metrics(new ScalogramMetrics(registry))
                .build();

        orchestrator.processAll(List.of(source("a.aaa"), unreadable("b.aaa"), source("c.aaa")));

        assertThat(registry.get("scalogram.pipeline.success").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("scalogram.pipeline.failure").tag("kind", "LoadFailure").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("scalogram.pipeline.stage").tag("stage", "emit").timer().count()).isEqualTo(2L);
    }

    @Test
    void signalIdShouldBeInThreadContextWhileProcessing() {
        List<String> seen = new ArrayList<>();
        AtomicInteger calls = new AtomicInteger();
        ScalogramSink sink = (id, image) -> {
            calls.incrementAndGet();
            seen.add(ThreadContext.get(DefaultBatchOrchestrator.SIGNAL_ID_KEY));
        };

        builder(new SyncExecutor()).sink(sink).build().processAll(List.of(source("a.aaa"), source("b.aaa")));

        assertThat(calls.get()).isEqualTo(2);
        assertThat(seen).containsExactly("a.aaa", "b.aaa");
        assertThat(ThreadContext.get(DefaultBatchOrchestrator.SIGNAL_ID_KEY)).isNull();
    }
}
