/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.render;

import java.util.Objects;

import io.github.stanio.svgrender.plan.RenderJob;

/**
 * A render job paired with the reason it failed.
 */
public final class JobFailure {

    private final RenderJob job;

    private final Throwable cause;

    public JobFailure(RenderJob job, Throwable cause) {
        this.job = Objects.requireNonNull(job);
        this.cause = Objects.requireNonNull(cause);
    }

    public RenderJob job() {
        return job;
    }

    public Throwable cause() {
        return cause;
    }

    @Override
    public String toString() {
        return job.source() + " (" + job.scale() + "x): " + cause;
    }

}
