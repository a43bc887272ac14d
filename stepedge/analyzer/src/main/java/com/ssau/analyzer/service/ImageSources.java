package com.ssau.analyzer.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.extern.slf4j.Slf4j;

import com.ssau.analyzer.model.ImageSource;

@Slf4j
public final class ImageSources {

    private static final String IMAGE_EXTENSION = ".png";

    private ImageSources() {}

    /**
     * PNG files directly inside {@code folder}, ordered by file name ignoring case.
     */
    public static List<ImageSource> fromFolder(Path folder) throws IOException {
        if (!Files.isDirectory(folder)) {
            throw new NotDirectoryException(folder.toString());
        }

        List<Path> files;
        try (Stream<Path> entries = Files.list(folder)) {
            files = entries
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(IMAGE_EXTENSION))
                .sorted(Comparator.comparing((Path p) -> p.getFileName().toString(), String.CASE_INSENSITIVE_ORDER)
                    .thenComparing(p -> p.getFileName().toString()))
                .collect(Collectors.toList());
        }

        List<ImageSource> sources = new ArrayList<>(files.size());
        for (Path file : files) {
            sources.add(ImageSource.ofFile(file));
        }
        log.info("Found {} PNG files in {}", sources.size(), folder.toAbsolutePath());
        return sources;
    }
}
