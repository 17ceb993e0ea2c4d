/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigFilesTest {

    @TempDir
    Path tmpDir;

    @Test
    void locateInDirectory() throws IOException {
        Path config = Files.writeString(tmpDir.resolve("render.json5"), "{}");

        assertThat(ConfigFiles.locate(tmpDir)).contains(config);
    }

    @Test
    void locatePrefersJson() throws IOException {
        Files.writeString(tmpDir.resolve("render.jsonc"), "{}");
        Path json = Files.writeString(tmpDir.resolve("render.json"), "{}");

        assertThat(ConfigFiles.locate(tmpDir)).contains(json);
    }

    @Test
    void locateNone() throws IOException {
        Files.writeString(tmpDir.resolve("other.json"), "{}");
        Files.createDirectory(tmpDir.resolve("render.json5"));

        assertThat(ConfigFiles.locate(tmpDir)).isEmpty();
    }

    @Test
    void inputFileIsConfig() throws IOException {
        Path config = Files.writeString(tmpDir.resolve("render.json"), "{}");

        assertThat(ConfigFiles.locate(config)).contains(config);
    }

    @Test
    void sourceFileInput() throws IOException {
        Files.writeString(tmpDir.resolve("render.json"), "{}");
        Path source = Files.writeString(tmpDir.resolve("icon.svg"), "<svg/>");

        assertThat(ConfigFiles.locate(source))
                .as("sibling configuration not used for a single source")
                .isEmpty();
    }

}
