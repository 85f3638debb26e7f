package com.phillippitts.scalogram.presentation.cli;

import com.phillippitts.scalogram.config.properties.BatchProperties;
import com.phillippitts.scalogram.config.properties.RenderProperties;
import com.phillippitts.scalogram.config.properties.TransformProperties;
import com.phillippitts.scalogram.domain.PipelineStage;
import com.phillippitts.scalogram.domain.ProcessingResult;
import com.phillippitts.scalogram.exception.ErrorKind;
import com.phillippitts.scalogram.service.io.SignalDirectoryScanner;
import com.phillippitts.scalogram.service.orchestration.BatchOrchestrator;
import com.phillippitts.scalogram.service.orchestration.BatchOrchestratorBuilder;
import com.phillippitts.scalogram.service.render.ScalogramRenderer;
import com.phillippitts.scalogram.service.transform.CwtEngine;
import com.phillippitts.scalogram.service.transform.ScaleSetFactory;
import com.phillippitts.scalogram.service.wavelet.WaveletBasisGenerator;
import com.phillippitts.scalogram.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScalogramBatchRunnerTest {

    @TempDir
    Path dir;

    private final List<String> emitted = Collections.synchronizedList(new ArrayList<>());

    private BatchProperties properties(Path input) {
        BatchProperties properties = new BatchProperties();
        properties.setInputDirectory(input.toString());
        properties.setOutputDirectory(dir.resolve("out").toString());
        return properties;
    }

    private BatchOrchestrator orchestrator() {
        TransformProperties transform = new TransformProperties();
        transform.setScaleMin(1.0);
        transform.setScaleMax(4.0);
        transform.setPointsPerOctave(2);
        WaveletBasisGenerator basis = new WaveletBasisGenerator();
        return BatchOrchestratorBuilder.builder()
                .engine(new CwtEngine(basis, transform))
                .scaleSetFactory(new ScaleSetFactory(transform, basis))
                .renderer(new ScalogramRenderer(new RenderProperties()))
                .sink((id, image) -> emitted.add(id))
                .batchExecutor(new SyncExecutor())
                .build();
    }

    private static void writeSignal(Path file, int count) throws IOException {
        StringBuilder content = new StringBuilder("station,").append(count).append(",0.01\n");
        for (int i = 0; i < count; i++) {
            content.append(Math.sin(i * 0.3)).append('\n');
        }
        Files.writeString(file, content.toString());
    }

    @Test
    void missingInputDirectoryShouldEndNormally() {
        BatchOrchestrator orchestrator = mock(BatchOrchestrator.class);
        ScalogramBatchRunner runner = new ScalogramBatchRunner(properties(dir.resolve("absent")),
                new SignalDirectoryScanner(), orchestrator);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isZero();
        assertThat(runner.getLastSummary()).isNull();
        verify(orchestrator, never()).processAll(any());
    }

    @Test
    void shouldProcessEveryMatchingFile() throws IOException {
        Path input = Files.createDirectory(dir.resolve("in"));
        writeSignal(input.resolve("b.aaa"), 64);
        writeSignal(input.resolve("a.aaa"), 32);
        Files.writeString(input.resolve("readme.txt"), "ignored");
        ScalogramBatchRunner runner = new ScalogramBatchRunner(properties(input), new SignalDirectoryScanner(),
                orchestrator());

        runner.run(new DefaultApplicationArguments());

        assertThat(emitted).containsExactly("a.aaa", "b.aaa");
        assertThat(runner.getLastSummary().succeeded()).isEqualTo(2);
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void failedFileShouldSetExitCodeWhenFailOnError() throws IOException {
        Path input = Files.createDirectory(dir.resolve("in"));
        writeSignal(input.resolve("good.aaa"), 16);
        Files.writeString(input.resolve("bad.aaa"), "station,3,0.01\n1\n");
        ScalogramBatchRunner runner = new ScalogramBatchRunner(properties(input), new SignalDirectoryScanner(),
                orchestrator());

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getLastSummary().failed()).isEqualTo(1);
        assertThat(runner.getLastSummary().failureLines())
                .containsExactly("bad.aaa [LOAD] LoadFailure: Failed to load bad.aaa: "
                        + "header declares 3 entries but file has 1");
        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    void failuresShouldNotChangeExitCodeWhenTolerated() throws IOException {
        Path input = Files.createDirectory(dir.resolve("in"));
        Files.writeString(input.resolve("x.aaa"), "");
        BatchProperties properties = properties(input);
        properties.setFailOnError(false);
        BatchOrchestrator orchestrator = mock(BatchOrchestrator.class);
        when(orchestrator.processAll(any())).thenReturn(List.of(new ProcessingResult.Failure(0, "x.aaa",
                PipelineStage.LOAD, ErrorKind.LOAD_FAILURE, "missing header line")));
        ScalogramBatchRunner runner = new ScalogramBatchRunner(properties, new SignalDirectoryScanner(), orchestrator);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getLastSummary().hasFailures()).isTrue();
        assertThat(runner.getExitCode()).isZero();
    }
}
