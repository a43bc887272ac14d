package com.ssau.analyzer.service;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import org.bytedeco.opencv.opencv_core.Mat;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import com.ssau.analyzer.exception.ImageDecodeException;
import com.ssau.analyzer.model.AnalyzerConfig;
import com.ssau.analyzer.model.EdgeSet;
import com.ssau.analyzer.model.FrameName;
import com.ssau.analyzer.model.ImageAnalysis;
import com.ssau.analyzer.model.ImageSource;

@Slf4j
@RequiredArgsConstructor
public class ImageAnalyzer {

    @Getter
    private final AnalyzerConfig config;

    /**
     * Runs name decoding, profile extraction and edge detection for one image.
     *
     * @return empty when the file name does not follow the step naming scheme
     */
    public Optional<ImageAnalysis> analyze(ImageSource source) throws IOException, ImageDecodeException {
        Optional<FrameName> frame = FilenameDecoder.decode(source.getName());
        if (frame.isEmpty()) {
            return Optional.empty();
        }

        Mat image = ImageDecoder.decode(source.readBytes(), source.getName());
        try {
            EdgeSet edges = findEdges(image, source.getName());
            return Optional.of(ImageAnalysis.forFrame(frame.get())
                .capturedAt(source.getLastModified())
                .edges(edges)
                .width(image.cols())
                .height(image.rows())
                .sourceId(source.getName())
                .build());
        } finally {
            image.release();
        }
    }

    private EdgeSet findEdges(Mat image, String sourceId) {
        double[] profile = ProfileExtractor.columnSums(image);
        if (!ProfileExtractor.normalize(profile)) {
            log.warn("Image {} has zero intensity in every column, no edges reported", sourceId);
            return EdgeSet.empty(config.getMaxEdges());
        }
        List<Integer> edges = EdgeDetector.detect(profile, config);
        log.debug("Edges for {}: {}", sourceId, edges);
        return EdgeSet.of(edges, config.getMaxEdges());
    }
}
