/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.render;

import java.util.Collections;
import java.util.List;

/**
 * Signals one or more render jobs failed.  Carries every observed failure.
 */
public class RenderFailedException extends Exception {

    private static final long serialVersionUID = 7092337546310924215L;

    private final transient List<JobFailure> failures;

    private final int jobCount;

    private final int notAttempted;

    public RenderFailedException(List<JobFailure> failures, int jobCount, int notAttempted) {
        super(failures.size() + " of " + jobCount + " job(s) failed"
                + (notAttempted > 0 ? ", " + notAttempted + " not attempted" : ""));
        this.failures = List.copyOf(failures);
        this.jobCount = jobCount;
        this.notAttempted = notAttempted;
        if (!failures.isEmpty()) {
            initCause(failures.get(0).cause());
        }
    }

    public List<JobFailure> failures() {
        return (failures == null) ? Collections.emptyList() : failures;
    }

    public int jobCount() {
        return jobCount;
    }

    /**
     * {@return the number of jobs skipped after the first failure, in
     * fail-fast mode}
     */
    public int notAttempted() {
        return notAttempted;
    }

}
