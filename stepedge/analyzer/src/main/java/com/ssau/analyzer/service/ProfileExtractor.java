package com.ssau.analyzer.service;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Reduces an image to one intensity value per column.
 */
public final class ProfileExtractor {

    /** Red in OpenCV's BGR channel order. */
    static final int RED_CHANNEL = 2;

    private ProfileExtractor() {}

    /**
     * Sum of the red channel down each column. Single-channel images are summed as is.
     */
    public static double[] columnSums(Mat image) {
        Mat channel = image;
        Mat sums = new Mat();
        try {
            if (image.channels() > 1) {
                channel = new Mat();
                opencv_core.extractChannel(image, channel, Math.min(RED_CHANNEL, image.channels() - 1));
            }
            opencv_core.reduce(channel, sums, 0, opencv_core.REDUCE_SUM, opencv_core.CV_64F);

            double[] profile = new double[image.cols()];
            try (DoubleIndexer indexer = sums.createIndexer()) {
                for (int col = 0; col < profile.length; col++) {
                    profile[col] = indexer.get(0, col);
                }
            }
            return profile;
        } finally {
            sums.release();
            if (channel != image) {
                channel.release();
            }
        }
    }

    /**
     * Scales the profile in place so its maximum becomes 1.
     *
     * @return false when the maximum is 0 and the profile was left as is
     */
    public static boolean normalize(double[] profile) {
        double maxVal = 0;
        for (double value : profile) {
            if (value > maxVal) {
                maxVal = value;
            }
        }
        if (maxVal == 0) {
            return false;
        }
        for (int i = 0; i < profile.length; i++) {
            profile[i] /= maxVal;
        }
        return true;
    }
}
