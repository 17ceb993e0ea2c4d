/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Outcome of a successful render session.
 */
public final class RenderSummary {

    private final int renderedCount;

    private final Duration elapsed;

    private final Path outputPath;

    RenderSummary(int renderedCount, Duration elapsed, Path outputPath) {
        this.renderedCount = renderedCount;
        this.elapsed = elapsed;
        this.outputPath = outputPath;
    }

    public int renderedCount() {
        return renderedCount;
    }

    public Duration elapsed() {
        return elapsed;
    }

    /**
     * {@return the canonical output path, or the absolute one if it doesn't
     * exist}
     */
    public Path outputPath() {
        return outputPath;
    }

    @Override
    public String toString() {
        return "Rendered " + renderedCount + " PNGs to: " + outputPath
                + " (" + elapsed.toMillis() + "ms)";
    }

}
