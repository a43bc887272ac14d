package com.ssau.analyzer.sink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import com.ssau.analyzer.exception.ExportException;
import com.ssau.analyzer.model.AnalyzerConfig;
import com.ssau.analyzer.model.ImageAnalysis;
import com.ssau.analyzer.model.TimedAnalysis;

/**
 * Writes aggregated results as a JSON document next to the workbook.
 */
@Slf4j
public class JsonReportExporter {

    private static final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    public Path export(List<TimedAnalysis> results, String folder, AnalyzerConfig config, Path outputDir)
            throws ExportException {
        Path target = outputDir.resolve(OutputNames.baseName(folder) + ".json");
        Report report = new Report(
            folder,
            config,
            results.stream().map(ResultEntry::from).collect(Collectors.toList()));
        try {
            Files.createDirectories(outputDir);
            objectMapper.writeValue(target.toFile(), report);
        } catch (IOException e) {
            throw new ExportException("Failed to write JSON report " + target, e);
        }
        log.info("Wrote JSON report to {}", target.toAbsolutePath());
        return target;
    }

    static ObjectMapper mapper() {
        return objectMapper;
    }

    @Value
    public static class Report {
        String folder;
        AnalyzerConfig config;
        List<ResultEntry> results;
    }

    @Value
    public static class ResultEntry {
        int step;
        int imageNo;
        int speed;
        int bucket;
        Instant capturedAt;
        long cumulativeSeconds;
        long incrementalSeconds;
        List<Integer> edges;
        int width;
        int height;
        String sourceId;

        static ResultEntry from(TimedAnalysis timed) {
            ImageAnalysis a = timed.getAnalysis();
            return new ResultEntry(a.getStep(), a.getImageNo(), a.getSpeed(), a.getBucket(),
                a.getCapturedAt(), timed.getCumulativeSeconds(), timed.getIncrementalSeconds(),
                a.getEdges().toNullableList(), a.getWidth(), a.getHeight(), a.getSourceId());
        }
    }
}
