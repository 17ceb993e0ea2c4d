/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.render;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Signals a destination directory could not be created.
 */
public class DirectoryCreationException extends IOException {

    private static final long serialVersionUID = 4487512034370659013L;

    private final transient Path directory;

    public DirectoryCreationException(Path directory, IOException cause) {
        super("Could not create directory: " + directory, cause);
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

}
