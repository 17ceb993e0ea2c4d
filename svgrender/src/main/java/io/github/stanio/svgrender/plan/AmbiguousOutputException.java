/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.plan;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Signals more than one render job would write to the same explicit output
 * file.
 */
public class AmbiguousOutputException extends Exception {

    private static final long serialVersionUID = -3615020921784433206L;

    private final transient Path outputFile;

    private final transient List<RenderJob> conflictingJobs;

    public AmbiguousOutputException(Path outputFile, List<RenderJob> conflictingJobs) {
        super("Attempted to write " + conflictingJobs.size()
                + " images to a single file: " + outputFile);
        this.outputFile = outputFile;
        this.conflictingJobs = List.copyOf(conflictingJobs);
    }

    public Path outputFile() {
        return outputFile;
    }

    /**
     * {@return all the jobs targeting the output file}
     */
    public List<RenderJob> conflictingJobs() {
        return (conflictingJobs == null) ? Collections.emptyList()
                                         : conflictingJobs;
    }

}
