package com.ssau.analyzer.sink;

public final class OutputNames {

    public static final String DEFAULT_BASE_NAME = "edge_results";

    private OutputNames() {}

    /**
     * Base name for run output, derived from the last segment of the folder path.
     */
    public static String baseName(String folder) {
        if (folder == null || folder.isBlank()) {
            return DEFAULT_BASE_NAME;
        }
        String normalized = folder.replace('\\', '/');
        while (normalized.endsWith("/") && normalized.length() > 1) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        String lastSegment = normalized.substring(normalized.lastIndexOf('/') + 1);
        if (lastSegment.isEmpty()) {
            lastSegment = normalized;
        }
        String cleaned = lastSegment.replaceAll("[^a-zA-Z0-9\\-_]", "_");
        return cleaned.isEmpty() ? DEFAULT_BASE_NAME : cleaned;
    }
}
