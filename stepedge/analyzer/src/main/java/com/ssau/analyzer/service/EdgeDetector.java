package com.ssau.analyzer.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.ssau.analyzer.model.AnalyzerConfig;

/**
 * Picks the columns of strongest intensity change in a profile.
 */
public final class EdgeDetector {

    private EdgeDetector() {}

    public static List<Integer> detect(double[] profile, AnalyzerConfig config) {
        double[] working = profile;
        if (config.isSmoothProfile() && config.getWindowSize() > 1) {
            working = MovingAverageSmoother.smooth(profile, config.getWindowSize());
        }
        return selectEdges(magnitudes(derivative(working)), config.getMinSpacing(), config.getMaxEdges());
    }

    /**
     * Centered difference inside the profile, one-sided differences at the two ends.
     */
    public static double[] derivative(double[] profile) {
        int n = profile.length;
        double[] d1 = new double[n];
        if (n < 2) {
            return d1;
        }
        d1[0] = profile[1] - profile[0];
        for (int i = 1; i < n - 1; i++) {
            d1[i] = (profile[i + 1] - profile[i - 1]) * 0.5;
        }
        d1[n - 1] = profile[n - 1] - profile[n - 2];
        return d1;
    }

    public static double[] magnitudes(double[] derivative) {
        double[] abs = new double[derivative.length];
        for (int i = 0; i < derivative.length; i++) {
            abs[i] = Math.abs(derivative[i]);
        }
        return abs;
    }

    /**
     * Greedy peak picking: take the strongest unconsumed column (lowest index
     * on ties), keep it unless an accepted column lies closer than
     * {@code minSpacing}, and consume it either way. Stops at {@code maxEdges}
     * accepted columns or when every column has been considered.
     *
     * @return accepted columns in ascending order
     */
    public static List<Integer> selectEdges(double[] magnitudes, int minSpacing, int maxEdges) {
        int n = magnitudes.length;
        boolean[] consumed = new boolean[n];
        List<Integer> edges = new ArrayList<>(maxEdges);

        for (int considered = 0; considered < n && edges.size() < maxEdges; considered++) {
            int candidate = -1;
            for (int j = 0; j < n; j++) {
                if (!consumed[j] && (candidate < 0 || magnitudes[j] > magnitudes[candidate])) {
                    candidate = j;
                }
            }
            consumed[candidate] = true;

            boolean valid = true;
            for (int edge : edges) {
                if (Math.abs(candidate - edge) < minSpacing) {
                    valid = false;
                    break;
                }
            }
            if (valid) {
                edges.add(candidate);
            }
        }

        Collections.sort(edges);
        return edges;
    }
}
