package com.ssau.analyzer.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class RunReport {

    public enum Status {
        EXPORTED,
        NOTHING_TO_EXPORT
    }

    String folder;
    int totalFiles;
    int analyzed;
    Duration elapsed;
    Status status;
    Path workbook;
    @Singular
    List<TimedAnalysis> results;

    public int getSkipped() {
        return totalFiles - analyzed;
    }

    public Optional<Path> workbookPath() {
        return Optional.ofNullable(workbook);
    }
}
