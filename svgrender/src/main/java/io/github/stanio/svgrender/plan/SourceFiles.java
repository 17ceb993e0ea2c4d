/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.plan;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Finds SVG source files and derives their raster file names.
 */
public final class SourceFiles {

    public static final String SOURCE_EXT = ".svg";

    public static final String RASTER_EXT = ".png";

    private SourceFiles() {/* no instances */}

    /**
     * Lists the source files for the given root.
     * <ul>
     * <li>A {@code root} that is a source file itself yields just it;</li>
     * <li>A directory {@code root} yields its immediate children that are
     * regular source files, in directory-listing order (not sorted);</li>
     * <li>Any other existing {@code root} yields an empty list.</li>
     * </ul>
     *
     * @throws  NoSuchFileException  if {@code root} doesn't exist
     * @throws  IOException  if an I/O error occurs listing the directory
     */
    public static List<Path> discover(Path root) throws IOException {
        if (Files.notExists(root)) {
            throw new NoSuchFileException(root.toString(), null, "Path doesn't exist");
        }

        if (isSource(root)) {
            return Collections.singletonList(root);
        }

        if (!Files.isDirectory(root)) {
            return Collections.emptyList();
        }

        List<Path> sources = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
            for (Path entry : entries) {
                if (isSource(entry)) {
                    sources.add(entry);
                }
            }
        }
        return sources;
    }

    /**
     * {@return whether the given path is an existing regular file with a
     * {@code .svg} name suffix (case-sensitive)}
     */
    public static boolean isSource(Path path) {
        Path fileName = path.getFileName();
        return fileName != null
                && fileName.toString().endsWith(SOURCE_EXT)
                && Files.isRegularFile(path);
    }

    /**
     * Replaces the file name extension of the given path with {@code .png},
     * or appends {@code .png} if the file name has no extension.  A leading
     * dot alone doesn't constitute an extension.
     *
     * @return  the raster file name (without parent directories)
     */
    public static Path rasterFileName(Path source) {
        Path fileName = source.getFileName();
        if (fileName == null)
            throw new IllegalArgumentException("No file name: " + source);

        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        String baseName = (dot > 0) ? name.substring(0, dot) : name;
        return fileName.resolveSibling(baseName + RASTER_EXT);
    }

}
