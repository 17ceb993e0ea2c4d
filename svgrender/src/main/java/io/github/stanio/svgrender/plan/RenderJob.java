/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.plan;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A single unit of rendering work: one source file, rendered at one scale,
 * to one destination file.
 */
public final class RenderJob {

    private final Path source;
    private final Path destination;
    private final int scale;

    public RenderJob(Path source, Path destination, int scale) {
        if (scale < 1)
            throw new IllegalArgumentException("Scale must be positive: " + scale);

        this.source = Objects.requireNonNull(source, "null source");
        this.destination = Objects.requireNonNull(destination, "null destination");
        this.scale = scale;
    }

    public Path source() {
        return source;
    }

    public Path destination() {
        return destination;
    }

    public int scale() {
        return scale;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof RenderJob))
            return false;

        RenderJob other = (RenderJob) obj;
        return scale == other.scale
                && source.equals(other.source)
                && destination.equals(other.destination);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, destination, scale);
    }

    @Override
    public String toString() {
        return source + " -> " + destination + " (" + scale + "x)";
    }

}
