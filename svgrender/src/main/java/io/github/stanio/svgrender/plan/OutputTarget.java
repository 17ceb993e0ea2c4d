/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.plan;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * The output path of a render invocation, classified once as either an
 * existing directory or a (possibly non-existing) single file.
 *
 * @see  #of(Path)
 */
public abstract class OutputTarget {

    final Path path;

    private OutputTarget(Path path) {
        this.path = Objects.requireNonNull(path);
    }

    /**
     * Classifies the given path by its current state on the file system.
     */
    public static OutputTarget of(Path path) {
        return Files.isDirectory(path) ? new DirectoryTarget(path)
                                       : new FileTarget(path);
    }

    public Path path() {
        return path;
    }

    public abstract boolean isDirectory();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + path + ")";
    }


    /**
     * An existing directory accepting any number of outputs.
     */
    public static final class DirectoryTarget extends OutputTarget {

        public DirectoryTarget(Path directory) {
            super(directory);
        }

        @Override
        public boolean isDirectory() {
            return true;
        }

    } // class DirectoryTarget


    /**
     * An explicit output file accepting at most one output.
     */
    public static final class FileTarget extends OutputTarget {

        public FileTarget(Path file) {
            super(file);
            if (file.getFileName() == null)
                throw new IllegalArgumentException("Not a file path: " + file);
        }

        @Override
        public boolean isDirectory() {
            return false;
        }

    } // class FileTarget


}
