package com.ssau.analyzer.sink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;

import lombok.extern.slf4j.Slf4j;

import com.ssau.analyzer.exception.ExportException;
import com.ssau.analyzer.exception.ImageDecodeException;
import com.ssau.analyzer.model.ImageAnalysis;
import com.ssau.analyzer.model.ImageSource;
import com.ssau.analyzer.model.TimedAnalysis;
import com.ssau.analyzer.service.ImageDecoder;

/**
 * Saves a copy of each analyzed image with its edges drawn as red vertical
 * lines and the timing metadata in a box at the top left.
 */
@Slf4j
public class PreviewRenderer {

    private static final Scalar EDGE_COLOR = new Scalar(0, 0, 255, 0);
    private static final Scalar TEXT_COLOR = new Scalar(255, 255, 255, 0);
    private static final Scalar BOX_COLOR = new Scalar(0, 0, 0, 0);
    private static final double BOX_OPACITY = 0.7;
    private static final int EDGE_THICKNESS = 2;

    private final Path outputDir;

    public PreviewRenderer(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * Renders one preview per result. Images that fail to render are logged and skipped.
     *
     * @return paths of the previews written
     */
    public List<Path> renderAll(List<TimedAnalysis> results, Map<String, ImageSource> sources) throws ExportException {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ExportException("Cannot create preview directory " + outputDir, e);
        }

        List<Path> written = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            TimedAnalysis result = results.get(i);
            ImageSource source = sources.get(result.getAnalysis().getSourceId());
            if (source == null) {
                log.warn("No source image for {}, preview skipped", result.getAnalysis().getSourceId());
                continue;
            }
            try {
                written.add(render(i + 1, result, source));
            } catch (IOException | ImageDecodeException | RuntimeException e) {
                log.warn("Failed to render preview for {}", source.getName(), e);
            }
        }
        log.info("Rendered {} previews to {}", written.size(), outputDir.toAbsolutePath());
        return written;
    }

    public Path render(int index, TimedAnalysis result, ImageSource source)
            throws IOException, ImageDecodeException {
        ImageAnalysis analysis = result.getAnalysis();
        Mat image = ImageDecoder.decode(source.readBytes(), source.getName());
        try {
            for (int edge : analysis.getEdges().populated()) {
                opencv_imgproc.line(image, new Point(edge, 0), new Point(edge, image.rows()),
                    EDGE_COLOR, EDGE_THICKNESS, opencv_imgproc.LINE_8, 0);
            }
            drawOverlay(image, overlayLines(result));

            Path target = outputDir.resolve(previewName(index, analysis.getSourceId()));
            String pathStr = target.toAbsolutePath().normalize().toString().replace("\\", "/");
            if (!opencv_imgcodecs.imwrite(pathStr, image)) {
                throw new ExportException("OpenCV could not write " + pathStr, null);
            }
            log.debug("Preview saved to {}", pathStr);
            return target;
        } finally {
            image.release();
        }
    }

    static List<String> overlayLines(TimedAnalysis result) {
        ImageAnalysis a = result.getAnalysis();
        return List.of(
            String.format("Step: %d | Image: %d", a.getStep(), a.getImageNo()),
            String.format("Bucket: %d | Speed: %d", a.getBucket(), a.getSpeed()),
            String.format("Cumulative: %ds", result.getCumulativeSeconds()),
            String.format("Incremental: %ds", result.getIncrementalSeconds()),
            "Edges: " + TimedAnalysis.joinEdges(a.getEdges().populated()));
    }

    static String previewName(int index, String sourceId) {
        int dot = sourceId.lastIndexOf('.');
        String stem = dot > 0 ? sourceId.substring(0, dot) : sourceId;
        return String.format("%04d_%s_edges.png", index, stem.replaceAll("[^a-zA-Z0-9\\-_]", "_"));
    }

    private static void drawOverlay(Mat image, List<String> lines) {
        int boxWidth = Math.min(300, Math.max(0, image.cols() - 10));
        int boxHeight = Math.min(120, Math.max(0, image.rows() - 10));
        if (boxWidth == 0 || boxHeight == 0) {
            return;
        }

        Mat overlay = image.clone();
        try {
            opencv_imgproc.rectangle(overlay, new Rect(10, 10, boxWidth, boxHeight), BOX_COLOR,
                opencv_imgproc.FILLED, opencv_imgproc.LINE_8, 0);
            opencv_core.addWeighted(overlay, BOX_OPACITY, image, 1 - BOX_OPACITY, 0, image);
        } finally {
            overlay.release();
        }

        int y = 30;
        for (String line : lines) {
            opencv_imgproc.putText(image, line, new Point(20, y),
                opencv_imgproc.FONT_HERSHEY_SIMPLEX, 0.45, TEXT_COLOR);
            y += 20;
        }
    }
}
