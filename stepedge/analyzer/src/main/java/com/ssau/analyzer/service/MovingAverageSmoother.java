package com.ssau.analyzer.service;

/**
 * Centered moving average over a column profile.
 *
 * <p>Even windows are widened to the next odd size. The first and last
 * {@code half} samples are copied unchanged; interior samples are the mean of
 * the window centred on them, computed with a running sum.
 */
public final class MovingAverageSmoother {

    private MovingAverageSmoother() {}

    public static double[] smooth(double[] data, int windowSize) {
        int window = oddWindow(windowSize);
        int n = data.length;
        if (window <= 1 || window > n) {
            return data;
        }
        int half = (window - 1) / 2;
        double[] smoothed = new double[n];

        for (int i = 0; i < half; i++) {
            smoothed[i] = data[i];
            smoothed[n - 1 - i] = data[n - 1 - i];
        }

        double windowSum = 0;
        for (int i = 0; i < window; i++) {
            windowSum += data[i];
        }
        smoothed[half] = windowSum / window;

        for (int i = half + 1; i < n - half; i++) {
            windowSum += data[i + half] - data[i - half - 1];
            smoothed[i] = windowSum / window;
        }
        return smoothed;
    }

    static int oddWindow(int windowSize) {
        return windowSize % 2 == 1 ? windowSize : windowSize + 1;
    }
}
