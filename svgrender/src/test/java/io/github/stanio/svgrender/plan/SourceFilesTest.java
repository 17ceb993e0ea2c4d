/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SourceFilesTest {

    @TempDir
    Path tmpDir;

    private Path touch(String name) throws IOException {
        Path file = tmpDir.resolve(name);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, "<svg/>");
    }

    @Test
    void discoverSingleFile() throws IOException {
        Path source = touch("icon.svg");

        assertThat(SourceFiles.discover(source)).containsExactly(source);
    }

    @Test
    void discoverDirectoryChildren() throws IOException {
        Path a = touch("a.svg");
        Path b = touch("b.svg");
        touch("notes.txt");
        touch("upper.SVG");
        touch("nested/c.svg");
        Files.createDirectory(tmpDir.resolve("dir.svg"));

        assertThat(SourceFiles.discover(tmpDir))
                .as("immediate regular .svg files only")
                .containsExactlyInAnyOrder(a, b);
    }

    @Test
    void discoverEmptyDirectory() throws IOException {
        assertThat(SourceFiles.discover(tmpDir)).isEmpty();
    }

    @Test
    void discoverNonSourceFile() throws IOException {
        assertThat(SourceFiles.discover(touch("readme.md"))).isEmpty();
    }

    @Test
    void discoverMissingPath() {
        Path missing = tmpDir.resolve("missing");

        assertThatThrownBy(() -> SourceFiles.discover(missing))
                .isInstanceOf(NoSuchFileException.class)
                .hasMessageContaining(missing.toString());
    }

    @ParameterizedTest
    @CsvSource({
        "name.svg, name.png",
        "name, name.png",
        "name.tar.svg, name.tar.png",
        ".hidden, .hidden.png",
        "dir/logo.svg, logo.png"
    })
    void rasterFileName(String source, String expected) {
        assertThat(SourceFiles.rasterFileName(Path.of(source)))
                .isEqualTo(Path.of(expected));
    }

}
