package com.ssau.analyzer.service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import com.ssau.analyzer.exception.ExportException;
import com.ssau.analyzer.model.AnalyzerConfig;
import com.ssau.analyzer.model.ImageAnalysis;
import com.ssau.analyzer.model.ImageSource;
import com.ssau.analyzer.model.OutputSettings;
import com.ssau.analyzer.model.RunReport;
import com.ssau.analyzer.model.TimedAnalysis;
import com.ssau.analyzer.sink.JsonReportExporter;
import com.ssau.analyzer.sink.PreviewRenderer;
import com.ssau.analyzer.sink.WorkbookExporter;

/**
 * One analysis run: enumerate, analyze in groups, aggregate, export.
 */
@Slf4j
public class EdgeAnalysisPipeline {

    private final AnalyzerConfig config;
    private final OutputSettings output;
    private final BatchOrchestrator.ProgressListener progressListener;

    public EdgeAnalysisPipeline(AnalyzerConfig config, OutputSettings output) {
        this(config, output, null);
    }

    public EdgeAnalysisPipeline(AnalyzerConfig config,
                                OutputSettings output,
                                BatchOrchestrator.ProgressListener progressListener) {
        this.config = config;
        this.output = output;
        this.progressListener = progressListener;
    }

    public RunReport run(Path folder) throws IOException, InterruptedException {
        List<ImageSource> sources = ImageSources.fromFolder(folder);
        if (sources.isEmpty()) {
            log.error("No PNG files found in {}", folder.toAbsolutePath());
        }
        return run(folderLabel(folder), sources);
    }

    /**
     * Absolute, normalized form of {@code folder} with forward slashes, so {@code .} names the real directory.
     */
    static String folderLabel(Path folder) {
        return folder.toAbsolutePath().normalize().toString().replace('\\', '/');
    }

    public RunReport run(String folder, List<ImageSource> sources) throws ExportException, InterruptedException {
        log.info("Starting batch processing of {} images (smooth={}, window={}, minSpacing={}, maxEdges={})",
            sources.size(), config.isSmoothProfile(), config.getWindowSize(),
            config.getMinSpacing(), config.getMaxEdges());
        long startNanos = System.nanoTime();

        List<ImageAnalysis> analyses;
        try (BatchOrchestrator orchestrator = new BatchOrchestrator(new ImageAnalyzer(config), config.getConcurrencyLimit())) {
            analyses = orchestrator.process(sources, progressListener);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        RunReport.RunReportBuilder report = RunReport.builder()
            .folder(folder)
            .totalFiles(sources.size())
            .analyzed(analyses.size())
            .elapsed(elapsed);

        if (analyses.isEmpty()) {
            log.error("No valid images processed, nothing to export");
            return report.status(RunReport.Status.NOTHING_TO_EXPORT).build();
        }

        List<TimedAnalysis> timed = TemporalAggregator.aggregate(analyses);
        Path workbook = new WorkbookExporter(output.getZone())
            .export(timed, folder, config, output.getOutputDir());

        if (output.isJsonEnabled()) {
            new JsonReportExporter().export(timed, folder, config, output.getOutputDir());
        }
        if (output.isPreviewEnabled()) {
            renderPreviews(timed, sources);
        }

        log.info("Processed {} images in {} s", analyses.size(), String.format("%.2f", elapsed.toMillis() / 1000.0));
        return report
            .status(RunReport.Status.EXPORTED)
            .workbook(workbook)
            .results(timed)
            .build();
    }

    private void renderPreviews(List<TimedAnalysis> timed, List<ImageSource> sources) {
        Map<String, ImageSource> byName = new LinkedHashMap<>();
        for (ImageSource source : sources) {
            byName.put(source.getName(), source);
        }
        try {
            new PreviewRenderer(output.getPreviewDir()).renderAll(timed, byName);
        } catch (ExportException e) {
            log.error("Preview rendering failed", e);
        }
    }
}
