package com.ssau.analyzer.utils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class ConfigLoader {

    public static final String DEFAULT_FILE = "analyzer.properties";

    private static final String[] OVERRIDABLE_PREFIXES = {"analysis.", "batch.", "export.", "preview."};

    private static Properties props = null;

    private ConfigLoader() {}

    public static synchronized Properties loadDefault() throws IOException {
        return load(DEFAULT_FILE);
    }

    public static synchronized Properties load(String fileName) throws IOException {
        if (props == null) {
            Properties loaded = readFile(fileName);
            applySystemOverrides(loaded, System.getProperties());
            props = loaded;
        }
        return props;
    }

    /**
     * Reads {@code fileName} from the working directory, then {@code config/}, then the classpath.
     * An unreadable external file falls through to the classpath copy.
     */
    static Properties readFile(String fileName) throws IOException {
        Optional<Path> external = externalFile(fileName);
        if (external.isPresent()) {
            Path path = external.get();
            try (InputStream in = Files.newInputStream(path)) {
                Properties loaded = parse(in);
                log.info("Configuration loaded from {}", path.toAbsolutePath());
                return loaded;
            } catch (IOException ex) {
                log.warn("Cannot read {}, falling back to classpath", path, ex);
            }
        }

        InputStream resource = ConfigLoader.class.getClassLoader().getResourceAsStream(fileName);
        if (resource == null) {
            throw new IOException("Configuration file '" + fileName + "' not found in classpath or external directory");
        }
        try (InputStream in = resource) {
            Properties loaded = parse(in);
            log.info("Configuration loaded from classpath: {}", fileName);
            return loaded;
        }
    }

    private static Optional<Path> externalFile(String fileName) {
        for (Path candidate : new Path[] {Paths.get(fileName), Paths.get("config", fileName)}) {
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static Properties parse(InputStream in) throws IOException {
        Properties loaded = new Properties();
        loaded.load(in);
        return loaded;
    }

    /**
     * Copies analyzer keys from {@code overrides} into {@code target}, replacing file values.
     */
    static void applySystemOverrides(Properties target, Properties overrides) {
        for (String key : overrides.stringPropertyNames()) {
            for (String prefix : OVERRIDABLE_PREFIXES) {
                if (key.startsWith(prefix)) {
                    log.info("Overriding {} from system properties", key);
                    target.setProperty(key, overrides.getProperty(key));
                    break;
                }
            }
        }
    }

    /**
     * Integer value of {@code key}; blank or unparseable values give {@code defaultValue}, the latter with a warning.
     */
    public static int getInt(Properties props, String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer '{}' for {}, using default {}", raw, key, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Accepts true/false and yes/no in any case. Anything else gives {@code defaultValue} with a warning.
     */
    public static boolean getBoolean(Properties props, String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(value) || "yes".equals(value)) {
            return true;
        }
        if ("false".equals(value) || "no".equals(value)) {
            return false;
        }
        log.warn("Invalid boolean '{}' for {}, using default {}", raw, key, defaultValue);
        return defaultValue;
    }
}
