/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.github.stanio.svgrender.plan.OutputTarget.DirectoryTarget;
import io.github.stanio.svgrender.plan.OutputTarget.FileTarget;

class JobPlannerTest {

    private static final Path OUT = Path.of("out");

    private static final List<Path> SOURCES =
            List.of(Path.of("in/a.svg"), Path.of("in/b.svg"));

    @Test
    void directoryTargetAllScales() throws Exception {
        List<RenderJob> jobs = JobPlanner
                .plan(SOURCES, List.of(1, 2), new DirectoryTarget(OUT));

        assertThat(jobs).containsExactly(
                new RenderJob(Path.of("in/a.svg"), Path.of("out/a.png"), 1),
                new RenderJob(Path.of("in/a.svg"), Path.of("out/2.0x/a.png"), 2),
                new RenderJob(Path.of("in/b.svg"), Path.of("out/b.png"), 1),
                new RenderJob(Path.of("in/b.svg"), Path.of("out/2.0x/b.png"), 2));
    }

    @Test
    void planSizeIsCrossProduct() throws Exception {
        List<Integer> scales = List.of(1, 2, 3, 4);

        List<RenderJob> jobs = JobPlanner
                .plan(SOURCES, scales, new DirectoryTarget(OUT));

        assertThat(jobs).hasSize(SOURCES.size() * scales.size());
        for (RenderJob job : jobs) {
            Path parent = job.destination().getParent();
            if (job.scale() == 1) {
                assertThat(parent).as("scale 1 parent").isEqualTo(OUT);
            } else {
                assertThat(parent.getFileName().toString()).as("scale dir")
                        .isEqualTo(job.scale() + ".0x");
                assertThat(parent.getParent()).as("scale dir parent").isEqualTo(OUT);
            }
        }
    }

    @Test
    void singleJobFileTarget() throws Exception {
        Path target = Path.of("out/picture.png");

        List<RenderJob> jobs = JobPlanner.plan(SOURCES.subList(0, 1),
                List.of(1), new FileTarget(target));

        assertThat(jobs).extracting(RenderJob::destination).containsExactly(target);
    }

    @Test
    void singleJobFileTargetScaled() throws Exception {
        List<RenderJob> jobs = JobPlanner.plan(SOURCES.subList(0, 1),
                List.of(10), new FileTarget(Path.of("out/picture.png")));

        assertThat(jobs).extracting(RenderJob::destination)
                .containsExactly(Path.of("out/10.0x/picture.png"));
    }

    @Test
    void fileTargetWithoutParent() throws Exception {
        List<RenderJob> jobs = JobPlanner.plan(SOURCES.subList(1, 2),
                List.of(2), new FileTarget(Path.of("picture.png")));

        assertThat(jobs).extracting(RenderJob::destination)
                .containsExactly(Path.of("2.0x/picture.png"));
    }

    @Test
    void ambiguousFileTarget() {
        Path target = Path.of("out.png");

        assertThatThrownBy(() -> JobPlanner
                .plan(SOURCES, List.of(1), new FileTarget(target)))
                .isInstanceOfSatisfying(AmbiguousOutputException.class, e -> {
                    assertThat(e.outputFile()).isEqualTo(target);
                    assertThat(e.conflictingJobs()).hasSize(2);
                })
                .hasMessageContaining("2 images");
    }

    @Test
    void ambiguousFileTargetMultipleScales() {
        assertThatThrownBy(() -> JobPlanner.plan(SOURCES.subList(0, 1),
                List.of(1, 2), new FileTarget(Path.of("out.png"))))
                .isInstanceOf(AmbiguousOutputException.class);
    }

    @Test
    void noSourcesEmptyPlan() throws Exception {
        assertThat(JobPlanner.plan(Collections.emptyList(), List.of(1, 2),
                new FileTarget(Path.of("out.png")))).isEmpty();
        assertThat(JobPlanner.plan(Collections.emptyList(), List.of(1, 2),
                new DirectoryTarget(OUT))).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(ints = { 2, 3, 10, 128 })
    void scaleDirectoryName(int scale) {
        assertThat(JobPlanner.scaleDirectoryName(scale)).isEqualTo(scale + ".0x");
        assertThat(JobPlanner.scaled(Path.of("a/b.png"), scale))
                .isEqualTo(Path.of("a", scale + ".0x", "b.png"));
    }

    @Test
    void scaleOneUnchanged() {
        Path file = Path.of("a/b.png");

        assertThat(JobPlanner.scaled(file, 1)).isSameAs(file);
    }

}
