package com.ssau.analyzer.model;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * An {@link ImageAnalysis} placed on the run's timeline.
 */
@Value
public class TimedAnalysis {

    ImageAnalysis analysis;
    long cumulativeSeconds;
    long incrementalSeconds;

    public int getStep() {
        return analysis.getStep();
    }

    public EdgeSet getEdges() {
        return analysis.getEdges();
    }

    public String summaryLine() {
        return String.format("Step: %d | Bucket: %d | Cumulative: %ds | Incremental: %ds",
            analysis.getStep(), analysis.getBucket(), cumulativeSeconds, incrementalSeconds);
    }

    public String edgeDescription() {
        List<Integer> edges = analysis.getEdges().populated();
        if (edges.isEmpty()) {
            return "No edges detected";
        }
        return "Detected Edges: " + joinEdges(edges) + " (X-coordinates)";
    }

    public static String joinEdges(List<Integer> edges) {
        return edges.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
