/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.render;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.github.stanio.svgrender.plan.RenderJob;

/**
 * Executes render jobs on a bounded pool of worker threads.
 * <p>
 * Destination directories are created up front, sequentially, before any
 * job starts.  Jobs are independent of each other and complete in no
 * particular order.  By default every job runs to completion and all
 * failures are reported together; in fail-fast mode jobs not yet started
 * when the first failure is observed are skipped.</p>
 */
public class Dispatcher {

    static final Logger log = Logger.getLogger(Dispatcher.class.getName());

    private final Rasterizer rasterizer;

    private final int threads;

    private final boolean failFast;

    /**
     * @param   rasterizer  renders the individual jobs
     * @param   threads  maximum number of worker threads; {@code null} for
     *          the number of available processors
     * @param   failFast  whether to skip pending jobs after a failure
     */
    public Dispatcher(Rasterizer rasterizer, Integer threads, boolean failFast) {
        if (threads != null && threads < 1)
            throw new IllegalArgumentException("Thread count must be positive: " + threads);

        this.rasterizer = Objects.requireNonNull(rasterizer);
        this.threads = (threads == null)
                       ? Math.max(1, Runtime.getRuntime().availableProcessors())
                       : threads;
        this.failFast = failFast;
    }

    public Dispatcher(Rasterizer rasterizer, Integer threads) {
        this(rasterizer, threads, false);
    }

    public int threads() {
        return threads;
    }

    /**
     * Creates the missing parent directories of the jobs' destinations.
     * Jobs whose destination already exists are skipped.  Existing
     * directories are not an error.
     *
     * @throws  DirectoryCreationException  at the first directory that
     *          couldn't be created
     */
    public static void ensureDirectories(List<RenderJob> jobs)
            throws DirectoryCreationException {
        Set<Path> ensured = new HashSet<>();
        for (RenderJob job : jobs) {
            Path destination = job.destination();
            if (Files.exists(destination))
                continue;

            Path parent = destination.toAbsolutePath().getParent();
            if (parent == null || !ensured.add(parent))
                continue;

            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new DirectoryCreationException(parent, e);
            }
        }
    }

    /**
     * Creates the destination directories, then renders all the jobs.
     *
     * @return  the number of rendered jobs
     * @throws  DirectoryCreationException  if a destination directory
     *          couldn't be created; no job has been started then
     * @throws  RenderFailedException  if one or more jobs failed
     * @throws  InterruptedIOException  if interrupted waiting for the jobs
     *          to complete
     */
    public int run(List<RenderJob> jobs)
            throws IOException, RenderFailedException {
        ensureDirectories(jobs);
        if (jobs.isEmpty())
            return 0;

        int poolSize = Math.min(threads, jobs.size());
        log.fine(() -> "Rendering " + jobs.size() + " job(s) using "
                       + poolSize + " thread(s)");

        ExecutorService executor = Executors
                .newFixedThreadPool(poolSize, daemonThreadFactory());
        try {
            return execute(jobs, executor);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw (IOException) new InterruptedIOException().initCause(e);
        } finally {
            executor.shutdownNow();
        }
    }

    private int execute(List<RenderJob> jobs, ExecutorService executor)
            throws InterruptedException, RenderFailedException {
        AtomicBoolean aborted = new AtomicBoolean();
        CompletionService<Boolean> completion = new ExecutorCompletionService<>(executor);
        Map<Future<Boolean>, RenderJob> pending = new HashMap<>(jobs.size() * 4 / 3 + 1);
        for (RenderJob job : jobs) {
            pending.put(completion.submit(() -> {
                if (aborted.get())
                    return false;

                try {
                    renderJob(job);
                } catch (Exception | Error e) {
                    // Skip the jobs not started yet
                    if (failFast) {
                        aborted.set(true);
                    }
                    throw e;
                }
                return true;
            }), job);
        }

        List<JobFailure> failures = new ArrayList<>();
        int rendered = 0;
        int skipped = 0;
        while (!pending.isEmpty()) {
            Future<Boolean> done = completion.take();
            RenderJob job = pending.remove(done);
            try {
                if (done.get()) {
                    rendered++;
                    log.fine(() -> "Rendered " + job);
                } else {
                    skipped++;
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                log.warning(() -> "Failed " + job + ": " + cause);
                log.log(Level.FINE, job.toString(), cause);
                failures.add(new JobFailure(job, cause));
            }
        }

        if (!failures.isEmpty()) {
            throw new RenderFailedException(failures, jobs.size(), skipped);
        }
        return rendered;
    }

    private void renderJob(RenderJob job) throws IOException, RasterException {
        byte[] svgSource = Files.readAllBytes(job.source());
        byte[] png = rasterizer.render(svgSource, job.scale());
        Files.write(job.destination(), png);
    }

    static ThreadFactory daemonThreadFactory() {
        ThreadFactory dtf = Executors.defaultThreadFactory();
        return r -> {
            Thread th = dtf.newThread(r);
            th.setDaemon(true);
            return th;
        };
    }

}
