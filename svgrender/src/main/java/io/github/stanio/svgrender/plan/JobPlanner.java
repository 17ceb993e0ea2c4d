/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.plan;

import static io.github.stanio.svgrender.plan.SourceFiles.rasterFileName;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps source files and scale factors to render jobs with unambiguous
 * destination paths.
 * <p>
 * Scale {@code 1} outputs go directly to the target location.  Outputs of
 * any other scale <var>N</var> go to a <code><var>N</var>.0x</code>
 * subdirectory next to where the scale-1 output would be:</p>
 * <pre>
 * out/icon.png
 * out/2.0x/icon.png
 * out/3.0x/icon.png</pre>
 */
public final class JobPlanner {

    private JobPlanner() {/* no instances */}

    /**
     * Plans a job for each (source, scale) pair, sources in the given order,
     * scales varying fastest.
     * <p>
     * A directory target accepts any number of jobs.  A file target accepts
     * at most one: the single job's destination is the target file itself
     * (relocated to a scale subdirectory next to it, for scales other than
     * 1).</p>
     *
     * @param   sources  source files
     * @param   scales  positive scale factors
     * @param   target  output target
     * @return  the planned jobs; empty if there are no sources or no scales
     * @throws  AmbiguousOutputException  if more than one job would write
     *          to a file target
     */
    public static List<RenderJob> plan(List<Path> sources,
                                       List<Integer> scales,
                                       OutputTarget target)
            throws AmbiguousOutputException
    {
        List<RenderJob> jobs = new ArrayList<>(sources.size() * scales.size());
        for (Path source : sources) {
            for (Integer scale : scales) {
                jobs.add(new RenderJob(source,
                        destination(source, scale, target), scale));
            }
        }

        if (target.isDirectory() || jobs.size() <= 1) {
            return Collections.unmodifiableList(jobs);
        }
        throw new AmbiguousOutputException(target.path(), jobs);
    }

    private static Path destination(Path source, int scale, OutputTarget target) {
        Path unscaled = target.isDirectory()
                        ? target.path().resolve(rasterFileName(source).toString())
                        : target.path();
        return scaled(unscaled, scale);
    }

    /**
     * Relocates the given file path to the scale subdirectory next to it,
     * or returns it as is for scale 1.
     */
    static Path scaled(Path file, int scale) {
        if (scale == 1)
            return file;

        Path scaleDir = file.resolveSibling(scaleDirectoryName(scale));
        return scaleDir.resolve(file.getFileName().toString());
    }

    /**
     * {@return the name of the subdirectory for outputs of the given scale,
     * f.e. {@code "2.0x"}}
     */
    public static String scaleDirectoryName(int scale) {
        return scale + ".0x";
    }

}
