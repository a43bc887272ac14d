package com.ssau.analyzer.service;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;

import lombok.extern.slf4j.Slf4j;

import com.ssau.analyzer.exception.ImageDecodeException;

/**
 * Decodes encoded image bytes into a fresh BGR {@link Mat}. Every call returns
 * its own buffer; callers release it when done.
 */
@Slf4j
public final class ImageDecoder {

    private ImageDecoder() {}

    public static Mat decode(byte[] encoded, String sourceId) throws ImageDecodeException {
        if (encoded == null || encoded.length == 0) {
            throw new ImageDecodeException(String.format("Image '%s' is empty", sourceId));
        }

        Mat buffer = new Mat(1, encoded.length, opencv_core.CV_8UC1);
        Mat image;
        try {
            buffer.data().put(encoded);
            image = opencv_imgcodecs.imdecode(buffer, opencv_imgcodecs.IMREAD_COLOR);
        } catch (RuntimeException e) {
            throw new ImageDecodeException(String.format("Failed to decode image '%s'", sourceId), e);
        } finally {
            buffer.release();
        }

        if (image == null || image.empty()) {
            if (image != null) {
                image.release();
            }
            throw ImageDecodeException.emptyImage(sourceId);
        }
        log.debug("Decoded {} ({}x{}, {} channels)", sourceId, image.cols(), image.rows(), image.channels());
        return image;
    }
}
