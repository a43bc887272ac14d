package com.ssau.analyzer.model;

import java.time.Instant;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class ImageAnalysis {
    int step;
    int imageNo;
    int speed;
    int bucket;
    @NonNull Instant capturedAt;
    @NonNull EdgeSet edges;
    int width;
    int height;
    @NonNull String sourceId;

    public static ImageAnalysisBuilder forFrame(FrameName frame) {
        return ImageAnalysis.builder()
            .step(frame.getStep())
            .imageNo(frame.getImageNo())
            .speed(frame.getSpeed())
            .bucket(frame.getBucket());
    }
}
