package com.phillippitts.scalogram.config;

import com.phillippitts.scalogram.config.properties.BatchProperties;
import com.phillippitts.scalogram.config.properties.OutputProperties;
import com.phillippitts.scalogram.config.properties.RenderProperties;
import com.phillippitts.scalogram.config.properties.TransformProperties;
import com.phillippitts.scalogram.service.io.PngScalogramSink;
import com.phillippitts.scalogram.service.io.ScalogramSink;
import com.phillippitts.scalogram.service.io.SignalDirectoryScanner;
import com.phillippitts.scalogram.service.metrics.ScalogramMetrics;
import com.phillippitts.scalogram.service.orchestration.BatchOrchestrator;
import com.phillippitts.scalogram.service.orchestration.BatchOrchestratorBuilder;
import com.phillippitts.scalogram.service.render.ScalogramRenderer;
import com.phillippitts.scalogram.service.transform.CwtEngine;
import com.phillippitts.scalogram.service.transform.ScaleSetFactory;
import com.phillippitts.scalogram.service.wavelet.WaveletBasisGenerator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.Executor;

/**
 * Wires the transform, render and output services into the batch orchestrator.
 * Uses constructor injection for the property classes shared across bean methods.
 */
@Configuration
public class ScalogramConfig {

    private final TransformProperties transformProperties;
    private final RenderProperties renderProperties;
    private final BatchProperties batchProperties;
    private final OutputProperties outputProperties;

    public ScalogramConfig(TransformProperties transformProperties,
                           RenderProperties renderProperties,
                           BatchProperties batchProperties,
                           OutputProperties outputProperties) {
        this.transformProperties = transformProperties;
        this.renderProperties = renderProperties;
        this.batchProperties = batchProperties;
        this.outputProperties = outputProperties;
    }

    @Bean
    public WaveletBasisGenerator waveletBasisGenerator() {
        return new WaveletBasisGenerator(transformProperties.getMorletOmega0());
    }

    @Bean
    public CwtEngine cwtEngine(WaveletBasisGenerator basis, @Qualifier("scaleExecutor") Executor scaleExecutor) {
        return new CwtEngine(basis, transformProperties, scaleExecutor);
    }

    @Bean
    public ScaleSetFactory scaleSetFactory(WaveletBasisGenerator basis) {
        return new ScaleSetFactory(transformProperties, basis);
    }

    @Bean
    public ScalogramRenderer scalogramRenderer() {
        return new ScalogramRenderer(renderProperties);
    }

    /**
     * PNG sink writing into {@code scalogram.batch.output-directory}.
     */
    @Bean
    public ScalogramSink scalogramSink() {
        return new PngScalogramSink(Path.of(batchProperties.getOutputDirectory()), outputProperties);
    }

    @Bean
    public SignalDirectoryScanner signalDirectoryScanner() {
        return new SignalDirectoryScanner();
    }

    @Bean
    public BatchOrchestrator batchOrchestrator(CwtEngine engine,
                                               ScaleSetFactory scaleSetFactory,
                                               ScalogramRenderer renderer,
                                               ScalogramSink sink,
                                               @Qualifier("batchExecutor") Executor batchExecutor,
                                               ScalogramMetrics metrics) {
        return BatchOrchestratorBuilder.builder()
                .engine(engine)
                .scaleSetFactory(scaleSetFactory)
                .renderer(renderer)
                .sink(sink)
                .batchExecutor(batchExecutor)
                .waveletFamily(transformProperties.getWaveletFamily())
                .metrics(metrics)
                .build();
    }
}
