/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.plan;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OutputTargetTest {

    @TempDir
    Path tmpDir;

    @Test
    void existingDirectory() {
        OutputTarget target = OutputTarget.of(tmpDir);

        assertThat(target.isDirectory()).isTrue();
        assertThat(target.path()).isEqualTo(tmpDir);
    }

    @Test
    void existingFile() throws IOException {
        Path file = Files.createFile(tmpDir.resolve("image.png"));

        assertThat(OutputTarget.of(file).isDirectory()).isFalse();
    }

    @Test
    void missingPathIsFile() {
        assertThat(OutputTarget.of(tmpDir.resolve("new-dir")).isDirectory())
                .as("not yet existing path").isFalse();
    }

}
