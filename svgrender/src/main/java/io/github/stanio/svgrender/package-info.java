/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */

/**
 * Renders SVG documents to PNG images at integer scale factors.  Scaled
 * outputs go to <code>&lt;N&gt;.0x</code> subdirectories next to the
 * unscaled ones:
 * <pre>
 * out/
 *     icon.png
 *     2.0x/
 *         icon.png</pre>
 *
 * @see  SvgRender
 * @see  RenderSession
 */
package io.github.stanio.svgrender;
