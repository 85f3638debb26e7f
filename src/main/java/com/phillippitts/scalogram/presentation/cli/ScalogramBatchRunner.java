package com.phillippitts.scalogram.presentation.cli;

import com.phillippitts.scalogram.config.properties.BatchProperties;
import com.phillippitts.scalogram.domain.BatchSummary;
import com.phillippitts.scalogram.domain.ProcessingResult;
import com.phillippitts.scalogram.service.io.SignalDirectoryScanner;
import com.phillippitts.scalogram.service.io.SignalSource;
import com.phillippitts.scalogram.service.orchestration.BatchOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one batch over the input directory on application startup.
 *
 * <p>A missing input directory is reported and ends the run normally. When
 * {@code scalogram.batch.fail-on-error} is set, any failed file makes the exit code 1.
 */
@Component
@ConditionalOnProperty(prefix = "scalogram.batch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScalogramBatchRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger LOG = LogManager.getLogger(ScalogramBatchRunner.class);

    private final BatchProperties properties;
    private final SignalDirectoryScanner scanner;
    private final BatchOrchestrator orchestrator;
    private volatile int exitCode;
    private volatile BatchSummary lastSummary;

    public ScalogramBatchRunner(BatchProperties properties,
                                SignalDirectoryScanner scanner,
                                BatchOrchestrator orchestrator) {
        this.properties = properties;
        this.scanner = scanner;
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(ApplicationArguments args) {
        Path input = Path.of(properties.getInputDirectory());
        if (!Files.isDirectory(input)) {
            LOG.warn("The directory {} does not exist.", input);
            exitCode = 0;
            return;
        }

        List<SignalSource> sources = scanner.scan(input, properties.getFileExtension());
        if (sources.isEmpty()) {
            LOG.info("No {} files found in {}", properties.getFileExtension(), input);
        }
        for (SignalSource source : sources) {
            LOG.info("Processing file: {}", input.resolve(source.identifier()));
        }

        List<ProcessingResult> results = orchestrator.processAll(sources);
        BatchSummary summary = BatchSummary.of(results);
        lastSummary = summary;
        LOG.info("Scalograms written to {}: {} of {} file(s) succeeded",
                properties.getOutputDirectory(), summary.succeeded(), summary.total());
        for (String line : summary.failureLines()) {
            LOG.error("Failed: {}", line);
        }
        exitCode = summary.hasFailures() && properties.isFailOnError() ? 1 : 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * @return summary of the last run, or {@code null} if no batch ran
     */
    public BatchSummary getLastSummary() {
        return lastSummary;
    }
}
