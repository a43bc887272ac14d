package com.ssau.analyzer.support;

import java.time.Instant;
import java.util.List;

import com.ssau.analyzer.model.EdgeSet;
import com.ssau.analyzer.model.ImageAnalysis;
import com.ssau.analyzer.model.TimedAnalysis;

public final class TestResults {

    private TestResults() {}

    public static TimedAnalysis timed(int step, int imageNo, Instant capturedAt, List<Integer> edges,
                                      int maxEdges, long cumulative, long incremental) {
        ImageAnalysis analysis = ImageAnalysis.builder()
            .step(step)
            .imageNo(imageNo)
            .speed(500)
            .bucket(2)
            .capturedAt(capturedAt)
            .edges(EdgeSet.of(edges, maxEdges))
            .width(100)
            .height(20)
            .sourceId(String.format("Step%d_%d_500_B2_1.png", step, imageNo))
            .build();
        return new TimedAnalysis(analysis, cumulative, incremental);
    }
}
