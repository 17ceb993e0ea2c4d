/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.render;

/**
 * Signals the rasterizer rejected or failed to process an SVG source:
 * malformed content, unsupported feature, or too large an image.
 */
public class RasterException extends Exception {

    private static final long serialVersionUID = -1270633843585962137L;

    public RasterException(String message) {
        super(message);
    }

    public RasterException(String message, Throwable cause) {
        super(message, cause);
    }

}
