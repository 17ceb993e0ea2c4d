/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */

/**
 * Rasterizer back-ends (JSVG, Batik) and the concurrent job dispatcher.
 */
package io.github.stanio.svgrender.render;
