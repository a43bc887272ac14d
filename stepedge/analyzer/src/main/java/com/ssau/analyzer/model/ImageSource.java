package com.ssau.analyzer.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A named image resource and its last-modified time. Content is read on
 * demand so that a batch never holds more encoded buffers than it has tasks in
 * flight.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ImageSource {

    @FunctionalInterface
    public interface ContentReader {
        byte[] read() throws IOException;
    }

    private final String name;
    private final Instant lastModified;

    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    private final ContentReader content;

    public static ImageSource ofFile(Path file) throws IOException {
        Instant modified = Files.getLastModifiedTime(file).toInstant();
        return new ImageSource(file.getFileName().toString(), modified, () -> Files.readAllBytes(file));
    }

    public static ImageSource ofBytes(String name, Instant lastModified, byte[] bytes) {
        byte[] copy = bytes.clone();
        return new ImageSource(name, lastModified, () -> copy);
    }

    public byte[] readBytes() throws IOException {
        return content.read();
    }
}
