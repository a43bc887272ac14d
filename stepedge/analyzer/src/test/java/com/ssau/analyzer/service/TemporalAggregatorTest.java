package com.ssau.analyzer.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.ssau.analyzer.model.EdgeSet;
import com.ssau.analyzer.model.ImageAnalysis;
import com.ssau.analyzer.model.TimedAnalysis;

import static org.assertj.core.api.Assertions.assertThat;

class TemporalAggregatorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static ImageAnalysis analysis(int step, int imageNo, long offsetMillis) {
        return ImageAnalysis.builder()
            .step(step)
            .imageNo(imageNo)
            .speed(500)
            .bucket(2)
            .capturedAt(T0.plusMillis(offsetMillis))
            .edges(EdgeSet.of(List.of(10, 40), 4))
            .width(100)
            .height(20)
            .sourceId("Step" + step + "_" + imageNo + "_500_B2_1.png")
            .build();
    }

    private static List<Long> cumulative(List<TimedAnalysis> timed) {
        return timed.stream().map(TimedAnalysis::getCumulativeSeconds).collect(Collectors.toList());
    }

    private static List<Long> incremental(List<TimedAnalysis> timed) {
        return timed.stream().map(TimedAnalysis::getIncrementalSeconds).collect(Collectors.toList());
    }

    @Test
    void incrementalTimeRestartsAtEachStep() {
        List<TimedAnalysis> timed = TemporalAggregator.aggregate(List.of(
            analysis(1, 1, 0),
            analysis(1, 2, 5_000),
            analysis(2, 1, 5_300),
            analysis(2, 2, 8_000)));

        assertThat(cumulative(timed)).containsExactly(0L, 5L, 5L, 8L);
        assertThat(incremental(timed)).containsExactly(0L, 5L, 0L, 3L);
    }

    @Test
    void sortsByCaptureTimeBeforeComputing() {
        List<ImageAnalysis> input = new ArrayList<>(List.of(
            analysis(1, 1, 0),
            analysis(1, 2, 4_000),
            analysis(2, 1, 10_000),
            analysis(2, 2, 13_000),
            analysis(3, 1, 20_000)));
        Collections.shuffle(input, new Random(11));

        List<TimedAnalysis> timed = TemporalAggregator.aggregate(input);

        assertThat(timed).extracting(t -> t.getAnalysis().getImageNo()).containsExactly(1, 2, 1, 2, 1);
        assertThat(cumulative(timed)).containsExactly(0L, 4L, 10L, 13L, 20L);
        assertThat(incremental(timed)).containsExactly(0L, 4L, 6L, 9L, 7L);
    }

    @Test
    void firstResultIsTimeZeroAndCumulativeNeverDecreases() {
        Random random = new Random(3);
        List<ImageAnalysis> input = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            input.add(analysis(1 + random.nextInt(4), i, 1_000L + random.nextInt(600_000)));
        }

        List<TimedAnalysis> timed = TemporalAggregator.aggregate(input);

        assertThat(timed.get(0).getCumulativeSeconds()).isZero();
        assertThat(cumulative(timed)).isSorted();
        for (int i = 1; i < timed.size(); i++) {
            TimedAnalysis previous = timed.get(i - 1);
            TimedAnalysis current = timed.get(i);
            if (current.getStep() != previous.getStep()) {
                assertThat(current.getIncrementalSeconds())
                    .isEqualTo(current.getCumulativeSeconds() - previous.getCumulativeSeconds())
                    .isGreaterThanOrEqualTo(0);
            }
        }
    }

    @Test
    void returningToAnEarlierStepAlsoResetsTheBaseline() {
        List<TimedAnalysis> timed = TemporalAggregator.aggregate(List.of(
            analysis(1, 1, 0),
            analysis(2, 1, 3_000),
            analysis(1, 2, 7_000),
            analysis(1, 3, 9_000)));

        assertThat(incremental(timed)).containsExactly(0L, 3L, 4L, 6L);
    }

    @Test
    void roundsToNearestSecond() {
        List<TimedAnalysis> timed = TemporalAggregator.aggregate(List.of(
            analysis(1, 1, 0),
            analysis(1, 2, 1_499),
            analysis(1, 3, 1_500),
            analysis(1, 4, 2_501)));

        assertThat(cumulative(timed)).containsExactly(0L, 1L, 2L, 3L);
    }

    @Test
    void wrapsAnalysisWithoutCopying() {
        ImageAnalysis only = analysis(4, 9, 0);

        List<TimedAnalysis> timed = TemporalAggregator.aggregate(List.of(only));

        assertThat(timed).singleElement().satisfies(t -> {
            assertThat(t.getAnalysis()).isSameAs(only);
            assertThat(t.getCumulativeSeconds()).isZero();
            assertThat(t.getIncrementalSeconds()).isZero();
        });
    }

    @Test
    void emptyInputGivesEmptyTimeline() {
        assertThat(TemporalAggregator.aggregate(List.of())).isEmpty();
    }
}
