/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.github.stanio.cli.CommandLine.ArgumentException;
import io.github.stanio.png.PNGEncoder;
import io.github.stanio.svgrender.SvgRender.CommandArgs;
import io.github.stanio.svgrender.render.Rasterizer;

class SvgRenderTest {

    @TempDir
    Path tmpDir;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();

    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();

    private SvgRender command;

    @BeforeEach
    void setUp() {
        command = new SvgRender(new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                                new PrintStream(errBuf, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBuf.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBuf.toString(StandardCharsets.UTF_8);
    }

    private Path source(Path dir, String name) throws IOException {
        return Files.writeString(Files.createDirectories(dir).resolve(name),
                RenderSessionTest.SQUARE_SVG);
    }

    @Test
    void commandArgs() {
        CommandArgs args = new CommandArgs("-i", "icons", "--output=out",
                "-s", "1,2", "--scales", "3", "-t4", "--renderer=batik",
                "--zopfli", "--fail-fast");

        assertThat(args.input).isEqualTo(Path.of("icons"));
        assertThat(args.output).isEqualTo(Path.of("out"));
        assertThat(args.scales()).containsExactly(1, 2, 3);
        assertThat(args.threads).isEqualTo(4);
        assertThat(args.renderer).isEqualTo(Rasterizer.BATIK);
        assertThat(args.pngEncoder).isEqualTo(PNGEncoder.ZOPFLI);
        assertThat(args.failFast).isTrue();
    }

    @Test
    void commandArgsDefaults() {
        CommandArgs args = new CommandArgs("--input", "a.svg", "-o", "a.png");

        assertThat(args.scales()).as("scales").isNull();
        assertThat(args.threads).as("threads").isNull();
        assertThat(args.renderer).isEqualTo(Rasterizer.JSVG);
        assertThat(args.pngEncoder).isEqualTo(PNGEncoder.IMAGEIO);
        assertThat(args.failFast).isFalse();
    }

    @Test
    void commandArgsInvalid() {
        assertThatThrownBy(() -> new CommandArgs("-o", "out"))
                .isInstanceOf(ArgumentException.class)
                .hasMessage("Specify -i");
        assertThatThrownBy(() -> new CommandArgs("-i", "in", "-o", "out", "-s", "0"))
                .isInstanceOf(ArgumentException.class)
                .hasMessageStartingWith("-s: ");
        assertThatThrownBy(() -> new CommandArgs("-i", "in", "-o", "out", "-t", "many"))
                .isInstanceOf(ArgumentException.class)
                .hasMessageStartingWith("-t: NumberFormat: ");
        assertThatThrownBy(() -> new CommandArgs("-i", "in", "-o", "out", "extra"))
                .isInstanceOf(ArgumentException.class)
                .hasMessageContaining("too many argument");
    }

    @Test
    void help() {
        assertThat(command.execute("--help")).isZero();
        assertThat(out()).startsWith("USAGE: svgrender");
    }

    @Test
    void renderDirectory() throws Exception {
        Path input = tmpDir.resolve("icons");
        source(input, "a.svg");
        source(input, "b.svg");
        Path output = Files.createDirectory(tmpDir.resolve("out"));

        int status = command.execute("-i", input.toString(),
                "-o", output.toString(), "-s", "1,2");

        assertThat(status).as("exit status").isZero();
        assertThat(out()).startsWith("Done - rendered 4 PNGs to: " + output.toRealPath())
                         .contains("(Time taken: ");
        assertThat(output.resolve("2.0x/b.png")).isRegularFile();
    }

    @Test
    void argumentError() {
        assertThat(command.execute("-i", "in")).isEqualTo(SvgRender.STATUS_ARGUMENTS);
        assertThat(err()).startsWith("Error: Argument: Specify -o")
                         .contains("USAGE: ");
    }

    @Test
    void unknownRenderer() {
        int status = command.execute("-i", "in", "-o", "out", "--renderer=inkscape");

        assertThat(status).isEqualTo(SvgRender.STATUS_ARGUMENTS);
        assertThat(err()).contains("Unknown renderer: inkscape");
    }

    @Test
    void missingInput() {
        int status = command.execute("-i", tmpDir.resolve("missing").toString(),
                "-o", tmpDir.resolve("out").toString());

        assertThat(status).isEqualTo(SvgRender.STATUS_PLANNING);
        assertThat(err()).startsWith("Error: NoSuchFile: ");
    }

    @Test
    void ambiguousOutput() throws Exception {
        Path input = tmpDir.resolve("icons");
        source(input, "a.svg");

        int status = command.execute("-i", input.toString(),
                "-o", tmpDir.resolve("a.png").toString(), "-s", "1,2");

        assertThat(status).isEqualTo(SvgRender.STATUS_PLANNING);
        assertThat(err()).startsWith("Error: AmbiguousOutput: Attempted to write 2 images")
                         .contains("(1x)", "(2x)");
    }

    @Test
    void renderFailures() throws Exception {
        Path input = tmpDir.resolve("icons");
        source(input, "a.svg");
        Files.writeString(input.resolve("broken.svg"), "<svg");

        int status = command.execute("-i", input.toString(),
                "-o", Files.createDirectory(tmpDir.resolve("out")).toString());

        assertThat(status).isEqualTo(SvgRender.STATUS_RENDERING);
        assertThat(err()).startsWith("Error: 1 of 2 job(s) failed")
                         .contains("broken.svg (1x): Raster: ");
    }

}
