/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender;

import static io.github.stanio.cli.CommandLine.splitOnComma;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import io.github.stanio.cli.CommandLine;
import io.github.stanio.cli.CommandLine.ArgumentException;
import io.github.stanio.png.PNGEncoder;

import io.github.stanio.svgrender.plan.AmbiguousOutputException;
import io.github.stanio.svgrender.plan.RenderJob;
import io.github.stanio.svgrender.render.JobFailure;
import io.github.stanio.svgrender.render.Rasterizer;
import io.github.stanio.svgrender.render.RenderFailedException;

/**
 * Command-line interface for rendering SVG sources to PNG images.
 *
 * @see  RenderSession
 */
public final class SvgRender {

    static final int STATUS_ARGUMENTS = 1;
    static final int STATUS_PLANNING = 2;
    static final int STATUS_RENDERING = 3;

    private final PrintStream out;

    private final PrintStream err;

    SvgRender(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * Runs a complete render invocation.
     *
     * @return  the exit status
     */
    int execute(String... args) {
        CommandArgs cmdArgs;
        Rasterizer rasterizer;
        try {
            cmdArgs = new CommandArgs(args);
            if (cmdArgs.help) {
                CommandArgs.printHelp(out);
                return 0;
            }
            rasterizer = Rasterizer.newInstance(cmdArgs.renderer, cmdArgs.pngEncoder);
        } catch (ArgumentException | IllegalArgumentException e) {
            return exitMessage(STATUS_ARGUMENTS, CommandArgs::printHelp, "Error: ", e);
        }

        RenderSummary summary;
        try {
            summary = new RenderSession(rasterizer)
                    .withFailFast(cmdArgs.failFast)
                    .render(cmdArgs.input, cmdArgs.output,
                            cmdArgs.scales(), cmdArgs.threads);
        } catch (AmbiguousOutputException e) {
            List<Object> message = new ArrayList<>();
            message.add("Error: ");
            message.add(e);
            for (RenderJob job : e.conflictingJobs()) {
                message.add("\n\t" + job);
            }
            return exitMessage(STATUS_PLANNING, message.toArray());
        } catch (RenderFailedException e) {
            List<Object> message = new ArrayList<>();
            message.add("Error: " + e.getMessage());
            for (JobFailure failure : e.failures()) {
                message.add("\n\t" + failure.job().source()
                        + " (" + failure.job().scale() + "x): ");
                message.add(failure.cause());
            }
            return exitMessage(STATUS_RENDERING, message.toArray());
        } catch (IOException e) {
            return exitMessage(STATUS_PLANNING, "Error: ", e);
        }

        out.println("Done - rendered " + summary.renderedCount()
                + " PNGs to: " + summary.outputPath());
        out.println("(Time taken: " + summary.elapsed().toMillis() + "ms)");
        return 0;
    }

    private int exitMessage(int status, Object... message) {
        return exitMessage(status, (Consumer<PrintStream>) null, message);
    }

    private int exitMessage(int status,
            Consumer<PrintStream> help, Object... message) {
        PrintStream stream = (status == 0) ? out : err;
        for (Object item : message) {
            if (item instanceof Throwable) {
                printMessage(stream, (Throwable) item);
            } else {
                stream.print(item);
            }
        }
        if (message.length > 0) {
            stream.println();
        }

        if (help != null) {
            if (message.length > 0) {
                stream.println();
            }
            help.accept(stream);
        }
        return status;
    }

    private static void printMessage(PrintStream stream, Throwable e) {
        Throwable current = e;
        boolean first = true;
        while (current != null) {
            if (first) {
                first = false;
            } else {
                stream.print(" (Caused by: ");
            }

            String type = current.getClass().getSimpleName()
                                 .replaceFirst("Exception$", "");
            String formatted = current.getMessage();
            stream.print(formatted == null ? type : type + ": " + formatted);
            if (current != e) {
                stream.print(")");
            }
            current = current.getCause();
        }
    }

    public static void main(String[] args) {
        int status = new SvgRender(System.out, System.err).execute(args);
        if (status != 0) {
            System.exit(status);
        }
    }


    static class CommandArgs {

        Path input;
        Path output;
        private final List<Integer> scales = new ArrayList<>();
        Integer threads;

        String renderer = Rasterizer.JSVG;
        String pngEncoder = PNGEncoder.IMAGEIO;
        boolean failFast;
        boolean help;

        CommandArgs(String... args) {
            CommandLine cmd = CommandLine.ofUnixStyle()
                    .acceptOption("-i", v -> input = v, Path::of)
                    .acceptSynonyms("-i", "--input")
                    .acceptOption("-o", v -> output = v, Path::of)
                    .acceptSynonyms("-o", "--output")
                    .acceptOption("-s", scales::addAll, splitOnComma(CommandArgs::positiveInt))
                    .acceptSynonyms("-s", "--scales")
                    .acceptOption("-t", v -> threads = v, CommandArgs::positiveInt)
                    .acceptSynonyms("-t", "--threads")
                    .acceptOption("--renderer", v -> renderer = v)
                    .acceptFlag("--zopfli", () -> pngEncoder = PNGEncoder.ZOPFLI)
                    .acceptFlag("--fail-fast", () -> failFast = true)
                    .acceptFlag("-h", () -> help = true)
                    .acceptSynonyms("-h", "--help")
                    .parseOptions(args);

            if (help)
                return;

            cmd.requireOptions("-i", "-o").withMaxArgs(0);
        }

        /**
         * {@return the explicitly specified scales, or {@code null}}
         */
        List<Integer> scales() {
            return scales.isEmpty() ? null : scales;
        }

        static Integer positiveInt(String value) {
            int number = Integer.parseInt(value);
            if (number < 1)
                throw new IllegalArgumentException("Not a positive number: " + value);

            return number;
        }

        static void printHelp(PrintStream out) {
            out.println("USAGE: svgrender -i <input> -o <output>"
                    + " [-s <scale>[,<scale>...]]... [-t <threads>]"
                    + " [--renderer=jsvg|batik] [--zopfli] [--fail-fast]");
            out.println();
            out.println("  -i, --input     SVG file or directory of SVG files");
            out.println("  -o, --output    output directory, or a PNG file for a single image");
            out.println("  -s, --scales    integer scale factors (default: from render.json, or 1)");
            out.println("  -t, --threads   worker threads (default: available processors)");
            out.println("  --renderer      SVG renderer: jsvg (default) or batik");
            out.println("  --zopfli        smaller PNG output using Zopfli compression (slow)");
            out.println("  --fail-fast     stop starting new jobs after the first failure");
        }

    } // class CommandArgs


}
