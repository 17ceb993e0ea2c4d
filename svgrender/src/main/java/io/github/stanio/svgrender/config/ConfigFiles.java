/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Locates the declarative render configuration by its naming convention:
 * <code>render.json</code>, <code>render.jsonc</code>, or
 * <code>render.json5</code>.
 */
public final class ConfigFiles {

    public static final String BASE_NAME = "render";

    public static final String[] JSON_EXTS = { ".json", ".jsonc", ".json5" };

    private ConfigFiles() {/* no instances */}

    /**
     * Finds the configuration file for the given input root: the root
     * itself if it is a configuration file, or the first existing
     * configuration file directly in the root directory.
     */
    public static Optional<Path> locate(Path inputRoot) {
        if (Files.isDirectory(inputRoot)) {
            return Optional.ofNullable(resolveExisting(inputRoot, BASE_NAME, JSON_EXTS));
        }
        return isConfigFile(inputRoot) ? Optional.of(inputRoot)
                                       : Optional.empty();
    }

    static boolean isConfigFile(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null || !Files.isRegularFile(path))
            return false;

        String name = fileName.toString();
        for (String ext : JSON_EXTS) {
            if (name.equals(BASE_NAME + ext))
                return true;
        }
        return false;
    }

    static Path resolveExisting(Path parent, String name, String... extensions) {
        for (String ext : extensions) {
            Path path = parent.resolve(name + ext);
            if (Files.isRegularFile(path))
                return path;
        }
        return null;
    }

}
