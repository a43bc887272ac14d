package com.ssau.analyzer.model;

import java.util.Properties;

import lombok.Builder;
import lombok.Value;

import com.ssau.analyzer.utils.ConfigLoader;

@Value
public class AnalyzerConfig {

    public static final boolean DEFAULT_SMOOTH_PROFILE = true;
    public static final int DEFAULT_WINDOW_SIZE = 5;
    public static final int DEFAULT_MIN_SPACING = 10;
    public static final int DEFAULT_MAX_EDGES = 4;
    public static final int DEFAULT_CONCURRENCY_LIMIT = 4;

    boolean smoothProfile;
    int windowSize;
    int minSpacing;
    int maxEdges;
    int concurrencyLimit;

    @Builder(toBuilder = true)
    private AnalyzerConfig(Boolean smoothProfile,
                           Integer windowSize,
                           Integer minSpacing,
                           Integer maxEdges,
                           Integer concurrencyLimit) {
        this.smoothProfile = smoothProfile != null ? smoothProfile : DEFAULT_SMOOTH_PROFILE;
        this.windowSize = windowSize != null ? windowSize : DEFAULT_WINDOW_SIZE;
        this.minSpacing = minSpacing != null ? minSpacing : DEFAULT_MIN_SPACING;
        this.maxEdges = maxEdges != null ? maxEdges : DEFAULT_MAX_EDGES;
        this.concurrencyLimit = concurrencyLimit != null ? concurrencyLimit : DEFAULT_CONCURRENCY_LIMIT;

        requireAtLeast("analysis.window.size", this.windowSize, 1);
        requireAtLeast("analysis.min.spacing", this.minSpacing, 0);
        requireAtLeast("analysis.max.edges", this.maxEdges, 1);
        requireAtLeast("batch.concurrency", this.concurrencyLimit, 1);
    }

    public static AnalyzerConfig defaults() {
        return AnalyzerConfig.builder().build();
    }

    public static AnalyzerConfig fromProperties(Properties props) {
        return AnalyzerConfig.builder()
            .smoothProfile(ConfigLoader.getBoolean(props, "analysis.smooth.profile", DEFAULT_SMOOTH_PROFILE))
            .windowSize(ConfigLoader.getInt(props, "analysis.window.size", DEFAULT_WINDOW_SIZE))
            .minSpacing(ConfigLoader.getInt(props, "analysis.min.spacing", DEFAULT_MIN_SPACING))
            .maxEdges(ConfigLoader.getInt(props, "analysis.max.edges", DEFAULT_MAX_EDGES))
            .concurrencyLimit(ConfigLoader.getInt(props, "batch.concurrency", DEFAULT_CONCURRENCY_LIMIT))
            .build();
    }

    private static void requireAtLeast(String key, int value, int min) {
        if (value < min) {
            throw new IllegalArgumentException(
                String.format("%s must be >= %d, got %d", key, min, value));
        }
    }
}
