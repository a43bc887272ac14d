package com.ssau.analyzer.exception;

/**
 * Raised when image bytes cannot be turned into a pixel grid.
 */
public class ImageDecodeException extends Exception {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ImageDecodeException emptyImage(String sourceId) {
        return new ImageDecodeException(
            String.format("Image '%s' could not be decoded or has no pixels", sourceId));
    }
}
