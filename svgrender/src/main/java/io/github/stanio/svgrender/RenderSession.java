/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import io.github.stanio.svgrender.config.ConfigParseException;
import io.github.stanio.svgrender.config.RenderConfig;
import io.github.stanio.svgrender.plan.AmbiguousOutputException;
import io.github.stanio.svgrender.plan.JobPlanner;
import io.github.stanio.svgrender.plan.OutputTarget;
import io.github.stanio.svgrender.plan.RenderJob;
import io.github.stanio.svgrender.plan.SourceFiles;
import io.github.stanio.svgrender.render.DirectoryCreationException;
import io.github.stanio.svgrender.render.Dispatcher;
import io.github.stanio.svgrender.render.Rasterizer;
import io.github.stanio.svgrender.render.RenderFailedException;

/**
 * Renders the SVG sources of an input path to PNG files under an output
 * path.  Implements the complete render invocation independent from the
 * user UI (the {@code SvgRender} CLI tool):
 * <ol>
 * <li>Discovers the sources and resolves the configuration;</li>
 * <li>Plans the render jobs, validating the output is unambiguous;</li>
 * <li>Creates the destination directories, and renders the jobs
 * concurrently.</li>
 * </ol>
 * <p>
 * Planning errors abort the session before any directory or file is
 * created.</p>
 *
 * @see  SvgRender
 */
public class RenderSession {

    static final Logger log = Logger.getLogger(RenderSession.class.getName());

    private final Rasterizer rasterizer;

    private boolean failFast;

    public RenderSession(Rasterizer rasterizer) {
        this.rasterizer = Objects.requireNonNull(rasterizer);
    }

    public RenderSession withFailFast(boolean failFast) {
        this.failFast = failFast;
        return this;
    }

    /**
     * Plans the render jobs without executing them.
     *
     * @param   input  SVG source file or directory
     * @param   output  output directory or file
     * @param   config  effective configuration
     * @return  the planned jobs, sources in sorted order
     * @throws  java.nio.file.NoSuchFileException  if {@code input} doesn't
     *          exist
     * @throws  AmbiguousOutputException  if more than one job would write
     *          to a single output file
     * @throws  IOException  if an I/O error occurs listing the sources
     */
    public List<RenderJob> plan(Path input, Path output, RenderConfig config)
            throws IOException, AmbiguousOutputException {
        List<Path> sources = new ArrayList<>(SourceFiles.discover(input));
        Collections.sort(sources);

        OutputTarget target = OutputTarget.of(output);
        if (Files.isDirectory(input) && !target.isDirectory()) {
            log.warning(() -> "Attempting to write a directory to a single file:"
                    + "\n\tinput directory: " + input
                    + "\n\toutput file: " + output);
        }
        return JobPlanner.plan(sources, config.scales(), target);
    }

    /**
     * Performs a complete render invocation.
     *
     * @param   input  SVG source file or directory
     * @param   output  output directory or file
     * @param   scales  explicit scale factors, or {@code null} to use the
     *          configured ones
     * @param   threads  explicit worker thread count, or {@code null} to use
     *          the configured one
     * @throws  java.nio.file.NoSuchFileException  if {@code input} doesn't
     *          exist
     * @throws  ConfigParseException  if the configuration file is malformed
     * @throws  AmbiguousOutputException  if more than one job would write
     *          to a single output file
     * @throws  DirectoryCreationException  if a destination directory
     *          couldn't be created
     * @throws  RenderFailedException  if any of the jobs failed
     * @throws  IOException  if other I/O error occurs
     */
    public RenderSummary render(Path input, Path output,
                                List<Integer> scales, Integer threads)
            throws IOException, AmbiguousOutputException, RenderFailedException {
        long startTime = System.nanoTime();

        if (Files.notExists(input)) {
            // Report before looking for configuration
            SourceFiles.discover(input);
        }
        RenderConfig config = RenderConfig.resolve(input, scales, threads);
        log.fine(() -> String.valueOf(config));

        List<RenderJob> jobs = plan(input, output, config);
        int rendered = new Dispatcher(rasterizer,
                config.threads().orElse(null), failFast).run(jobs);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startTime);
        return new RenderSummary(rendered, elapsed, canonicalPath(output));
    }

    private static Path canonicalPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }

}
