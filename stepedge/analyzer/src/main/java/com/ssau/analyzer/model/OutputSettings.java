package com.ssau.analyzer.model;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Properties;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import com.ssau.analyzer.utils.ConfigLoader;

@Slf4j
@Value
@Builder(toBuilder = true)
public class OutputSettings {

    @Builder.Default
    Path outputDir = Paths.get(".");
    @Builder.Default
    boolean jsonEnabled = false;
    @Builder.Default
    boolean previewEnabled = false;
    @Builder.Default
    Path previewDir = Paths.get("previews");
    @Builder.Default
    ZoneId zone = ZoneId.systemDefault();

    public static OutputSettings fromProperties(Properties props) {
        return OutputSettings.builder()
            .outputDir(Paths.get(props.getProperty("export.output.dir", ".").trim()))
            .jsonEnabled(ConfigLoader.getBoolean(props, "export.json.enabled", false))
            .previewEnabled(ConfigLoader.getBoolean(props, "preview.enabled", false))
            .previewDir(Paths.get(props.getProperty("preview.output.dir", "previews").trim()))
            .zone(parseZone(props.getProperty("export.time.zone")))
            .build();
    }

    private static ZoneId parseZone(String raw) {
        if (raw == null || raw.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            log.warn("Unknown time zone '{}', using system default", raw);
            return ZoneId.systemDefault();
        }
    }
}
