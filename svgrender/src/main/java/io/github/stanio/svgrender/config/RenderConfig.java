/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.gson.Gson;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

/**
 * Scale factors and worker thread count for a render invocation.
 * <p>
 * Resolved from explicit (command-line) values, falling back to a
 * {@code render.json} file found with the input, falling back to the
 * defaults: scale 1, and available processors worth of threads.  Each
 * setting falls back independently.</p>
 * <pre>
 * {
 *   "scales": [1, 2, 3],
 *   "threads": 4
 * }</pre>
 *
 * @see  ConfigFiles
 */
public final class RenderConfig {

    static final Logger log = Logger.getLogger(RenderConfig.class.getName());

    public static final List<Integer> DEFAULT_SCALES = List.of(1);

    private static final RenderConfig DEFAULTS = new RenderConfig(DEFAULT_SCALES, null);

    private final List<Integer> scales;

    private final Integer threads;

    /**
     * @param   scales  positive scale factors; duplicates are dropped
     * @param   threads  positive thread count, or {@code null} for the
     *          default
     * @throws  IllegalArgumentException  if {@code scales} is empty, or
     *          contains a non-positive value, or {@code threads} is not
     *          positive
     */
    public RenderConfig(List<Integer> scales, Integer threads) {
        this.scales = validScales(scales);
        if (threads != null && threads < 1)
            throw new IllegalArgumentException("Thread count must be positive: " + threads);

        this.threads = threads;
    }

    public static RenderConfig defaults() {
        return DEFAULTS;
    }

    private static List<Integer> validScales(List<Integer> scales) {
        if (scales.isEmpty())
            throw new IllegalArgumentException("No scales specified");

        for (Integer value : scales) {
            if (value == null || value < 1)
                throw new IllegalArgumentException("Scale must be positive: " + value);
        }
        return List.copyOf(new LinkedHashSet<>(scales));
    }

    /**
     * {@return the distinct scale factors in their specified order}
     */
    public List<Integer> scales() {
        return scales;
    }

    /**
     * {@return the worker thread count, if specified}
     */
    public Optional<Integer> threads() {
        return Optional.ofNullable(threads);
    }

    /**
     * Resolves the effective configuration for the given input root.
     *
     * @param   inputRoot  input source file or directory
     * @param   scales  explicitly specified scales, or {@code null}
     * @param   threads  explicitly specified thread count, or {@code null}
     * @throws  ConfigParseException  if a configuration file is found but
     *          it is malformed
     * @throws  IOException  if an I/O error occurs reading the file
     * @see     ConfigFiles#locate(Path)
     */
    public static RenderConfig resolve(Path inputRoot,
                                       List<Integer> scales,
                                       Integer threads)
            throws IOException
    {
        Optional<Path> configFile = ConfigFiles.locate(inputRoot);
        RenderConfig fileConfig = DEFAULTS;
        if (configFile.isPresent()) {
            log.fine(() -> "Using configuration: " + configFile.get());
            fileConfig = load(configFile.get());
        }
        return fileConfig.overriddenBy(scales, threads);
    }

    /**
     * {@return this configuration with the non-null given values replacing
     * the current ones}
     */
    public RenderConfig overriddenBy(List<Integer> scales, Integer threads) {
        if (scales == null && threads == null)
            return this;

        return new RenderConfig(scales == null ? this.scales : scales,
                                threads == null ? this.threads : threads);
    }

    /**
     * Reads a configuration file.  Absent settings assume the defaults; an
     * empty file is all defaults.
     *
     * @throws  ConfigParseException  if the file content is malformed
     * @throws  IOException  if an I/O error occurs reading the file
     */
    public static RenderConfig load(Path file) throws IOException {
        FileConfig content;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            content = new Gson().fromJson(reader, FileConfig.class);
        } catch (JsonIOException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new ConfigParseException(file, e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new ConfigParseException(file, e.getMessage(), e);
        }

        if (content == null) {
            log.log(Level.FINE, "Empty configuration: {0}", file);
            return DEFAULTS;
        }

        try {
            return new RenderConfig(content.scales == null
                                    ? DEFAULT_SCALES
                                    : new ArrayList<>(content.scales),
                                    content.threads);
        } catch (IllegalArgumentException e) {
            throw new ConfigParseException(file, e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "RenderConfig(scales: " + scales + ", threads: "
                + (threads == null ? "default" : threads) + ")";
    }


    static class FileConfig {
        List<Integer> scales;
        @SerializedName(value = "threads", alternate = { "threadCount", "thread_count" })
        Integer threads;
    }


}
