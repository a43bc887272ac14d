package com.ssau.analyzer.service;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;

import com.ssau.analyzer.model.FrameName;

/**
 * Decodes names of the form {@code [End]Step<step>_<imageNo>_<speed>_B<bucket>_1.png},
 * case-insensitively. Anything else is not an analyzable file.
 */
@Slf4j
public final class FilenameDecoder {

    private static final Pattern FILE_NAME = Pattern.compile(
        "^(?:End)?Step(\\d+)_(\\d+)_(\\d+)_B(\\d+)_1\\.png$", Pattern.CASE_INSENSITIVE);

    private FilenameDecoder() {}

    public static Optional<FrameName> decode(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher matcher = FILE_NAME.matcher(fileName);
        if (!matcher.matches()) {
            log.debug("Skipping non-conforming file name: {}", fileName);
            return Optional.empty();
        }
        try {
            return Optional.of(new FrameName(
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)),
                Integer.parseInt(matcher.group(4))));
        } catch (NumberFormatException e) {
            log.debug("Skipping file name with out-of-range number: {}", fileName);
            return Optional.empty();
        }
    }
}
