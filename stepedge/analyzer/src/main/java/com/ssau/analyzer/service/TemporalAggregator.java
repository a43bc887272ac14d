package com.ssau.analyzer.service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.ssau.analyzer.model.ImageAnalysis;
import com.ssau.analyzer.model.TimedAnalysis;

/**
 * Orders analyses by capture time and derives elapsed seconds.
 *
 * <p>Cumulative time counts from the earliest capture, rounded to whole
 * seconds. Incremental time counts from the last image of the previous step,
 * so it restarts whenever the step changes between neighbours.
 */
public final class TemporalAggregator {

    private TemporalAggregator() {}

    public static List<TimedAnalysis> aggregate(List<ImageAnalysis> analyses) {
        List<ImageAnalysis> sorted = new ArrayList<>(analyses);
        sorted.sort(Comparator.comparing(ImageAnalysis::getCapturedAt));
        List<TimedAnalysis> timed = new ArrayList<>(sorted.size());
        if (sorted.isEmpty()) {
            return timed;
        }

        Instant t0 = sorted.get(0).getCapturedAt();
        long baseline = 0;
        long previousCumulative = 0;
        for (int i = 0; i < sorted.size(); i++) {
            ImageAnalysis current = sorted.get(i);
            long cumulative = toWholeSeconds(Duration.between(t0, current.getCapturedAt()));
            if (i > 0 && current.getStep() != sorted.get(i - 1).getStep()) {
                baseline = previousCumulative;
            }
            timed.add(new TimedAnalysis(current, cumulative, cumulative - baseline));
            previousCumulative = cumulative;
        }
        return timed;
    }

    static long toWholeSeconds(Duration elapsed) {
        return Math.round(elapsed.toMillis() / 1000.0);
    }
}
