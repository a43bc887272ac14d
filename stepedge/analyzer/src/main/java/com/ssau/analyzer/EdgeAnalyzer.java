package com.ssau.analyzer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import lombok.extern.slf4j.Slf4j;

import com.ssau.analyzer.model.AnalyzerConfig;
import com.ssau.analyzer.model.OutputSettings;
import com.ssau.analyzer.model.RunReport;
import com.ssau.analyzer.service.EdgeAnalysisPipeline;
import com.ssau.analyzer.utils.ConfigLoader;

@Slf4j
public class EdgeAnalyzer {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 1 || args.length > 2) {
            log.error("Usage: EdgeAnalyzer <imageFolder> [outputDir]");
            return EXIT_USAGE;
        }

        try {
            Properties props = ConfigLoader.loadDefault();
            AnalyzerConfig config = AnalyzerConfig.fromProperties(props);
            OutputSettings output = OutputSettings.fromProperties(props);
            if (args.length == 2) {
                output = output.toBuilder().outputDir(Paths.get(args[1])).build();
            }

            Path folder = Paths.get(args[0]);
            RunReport report = new EdgeAnalysisPipeline(config, output).run(folder);

            if (report.getStatus() == RunReport.Status.NOTHING_TO_EXPORT) {
                log.error("No valid images processed in {} ({} files examined)", folder, report.getTotalFiles());
                return EXIT_FAILURE;
            }
            log.info("Analyzed {} of {} images, workbook written to {}",
                report.getAnalyzed(), report.getTotalFiles(), report.getWorkbook());
            return EXIT_OK;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Processing interrupted");
            return EXIT_FAILURE;
        } catch (Exception e) {
            log.error("Application error: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }
}
