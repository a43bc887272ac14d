package com.ssau.analyzer.utils;

import java.util.Properties;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @Test
    void readsBundledDefaultsFromClasspath() throws Exception {
        Properties props = ConfigLoader.readFile(ConfigLoader.DEFAULT_FILE);

        assertThat(props.getProperty("analysis.window.size")).isEqualTo("5");
        assertThat(props.getProperty("analysis.max.edges")).isEqualTo("4");
        assertThat(props.getProperty("batch.concurrency")).isEqualTo("4");
    }

    @Test
    void missingFileIsAnError() {
        assertThatThrownBy(() -> ConfigLoader.readFile("does-not-exist.properties"))
            .isInstanceOf(java.io.IOException.class)
            .hasMessageContaining("does-not-exist.properties");
    }

    @Test
    void systemPropertiesOverrideOnlyAnalyzerKeys() {
        Properties target = new Properties();
        target.setProperty("analysis.window.size", "5");
        Properties overrides = new Properties();
        overrides.setProperty("analysis.window.size", "9");
        overrides.setProperty("preview.enabled", "true");
        overrides.setProperty("java.version", "17");

        ConfigLoader.applySystemOverrides(target, overrides);

        assertThat(target.getProperty("analysis.window.size")).isEqualTo("9");
        assertThat(target.getProperty("preview.enabled")).isEqualTo("true");
        assertThat(target.getProperty("java.version")).isNull();
    }

    @Test
    void typedGettersParseAndFallBack() {
        Properties props = new Properties();
        props.setProperty("a.int", " 12 ");
        props.setProperty("a.bad.int", "twelve");
        props.setProperty("a.flag", "Yes");
        props.setProperty("a.bad.flag", "maybe");

        assertThat(ConfigLoader.getInt(props, "a.int", 3)).isEqualTo(12);
        assertThat(ConfigLoader.getInt(props, "a.bad.int", 3)).isEqualTo(3);
        assertThat(ConfigLoader.getInt(props, "a.missing", 3)).isEqualTo(3);
        assertThat(ConfigLoader.getBoolean(props, "a.flag", false)).isTrue();
        assertThat(ConfigLoader.getBoolean(props, "a.bad.flag", true)).isTrue();
        assertThat(ConfigLoader.getBoolean(props, "a.missing", false)).isFalse();
    }
}
