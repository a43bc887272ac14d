package com.ssau.analyzer.service;

import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ssau.analyzer.model.ImageSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageSourcesTest {

    @TempDir
    Path tempDir;

    @Test
    void listsPngFilesSortedByNameWithModificationTimes() throws Exception {
        Instant modified = Instant.parse("2024-05-01T10:00:00Z");
        Files.write(tempDir.resolve("Step2_1_1_B1_1.png"), new byte[] {1, 2});
        Files.write(tempDir.resolve("Step1_1_1_B1_1.PNG"), new byte[] {3});
        Files.write(tempDir.resolve("notes.txt"), new byte[] {4});
        Files.createDirectory(tempDir.resolve("nested.png"));
        Files.setLastModifiedTime(tempDir.resolve("Step2_1_1_B1_1.png"), FileTime.from(modified));

        List<ImageSource> sources = ImageSources.fromFolder(tempDir);

        assertThat(sources).extracting(ImageSource::getName)
            .containsExactly("Step1_1_1_B1_1.PNG", "Step2_1_1_B1_1.png");
        assertThat(sources.get(1).getLastModified()).isEqualTo(modified);
        assertThat(sources.get(1).readBytes()).containsExactly(1, 2);
    }

    @Test
    void ordersNamesIgnoringCase() throws Exception {
        Files.write(tempDir.resolve("Step1_1_1_B1_1.png"), new byte[] {1});
        Files.write(tempDir.resolve("endStep2_1_1_B1_1.png"), new byte[] {2});
        Files.write(tempDir.resolve("EndStep3_1_1_B1_1.png"), new byte[] {3});

        List<ImageSource> sources = ImageSources.fromFolder(tempDir);

        assertThat(sources).extracting(ImageSource::getName)
            .containsExactly("endStep2_1_1_B1_1.png", "EndStep3_1_1_B1_1.png", "Step1_1_1_B1_1.png");
    }

    @Test
    void emptyFolderGivesNoSources() throws Exception {
        assertThat(ImageSources.fromFolder(tempDir)).isEmpty();
    }

    @Test
    void rejectsMissingFolder() {
        assertThatThrownBy(() -> ImageSources.fromFolder(tempDir.resolve("missing")))
            .isInstanceOf(NotDirectoryException.class);
    }
}
