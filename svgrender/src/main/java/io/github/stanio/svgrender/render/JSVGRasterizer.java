/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.render;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.function.Supplier;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Dimension2D;
import java.awt.image.BufferedImage;

import javax.swing.JComponent;

import com.github.weisj.jsvg.SVGDocument;
import com.github.weisj.jsvg.SVGRenderingHints;
import com.github.weisj.jsvg.parser.LoaderContext;
import com.github.weisj.jsvg.parser.SVGLoader;

import io.github.stanio.png.PNGEncoder;

/**
 * Implements rendering using the JSVG (Java SVG renderer) library.
 *
 * @see  <a href="https://github.com/weisJ/jsvg">JSVG - Java SVG renderer</a>
 */
class JSVGRasterizer extends Rasterizer {

    JSVGRasterizer(Supplier<PNGEncoder> pngEncoder) {
        super(pngEncoder);
    }

    private static SVGDocument load(byte[] svgSource) throws RasterException {
        SVGDocument svg;
        try (InputStream input = new ByteArrayInputStream(svgSource)) {
            svg = new SVGLoader().load(input, null, LoaderContext.createDefault());
        } catch (IOException | RuntimeException e) {
            throw new RasterException("Could not load SVG document: " + e, e);
        }
        if (svg == null) {
            // JSVG logs the actual cause
            throw new RasterException("Could not load SVG document (malformed source)");
        }
        return svg;
    }

    @Override
    protected BufferedImage renderImage(byte[] svgSource, int scale)
            throws RasterException {
        SVGDocument svg = load(svgSource);
        Dimension2D size = svg.size();
        int[] scaledSize = scaledSize(size.getWidth(), size.getHeight(), scale);

        BufferedImage image;
        try {
            image = new BufferedImage(scaledSize[0], scaledSize[1],
                                      BufferedImage.TYPE_INT_ARGB);
        } catch (OutOfMemoryError e) {
            throw new RasterException("Not enough memory for a "
                    + scaledSize[0] + "x" + scaledSize[1] + " image", e);
        }

        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_RENDERING,
                               RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING,
                               RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL,
                               RenderingHints.VALUE_STROKE_PURE);
            g.setRenderingHint(RenderingHints.KEY_FRACTIONALMETRICS,
                               RenderingHints.VALUE_FRACTIONALMETRICS_ON);
            g.setRenderingHint(SVGRenderingHints.KEY_SOFT_CLIPPING,
                               SVGRenderingHints.VALUE_SOFT_CLIPPING_ON);
            g.scale(scaledSize[0] / size.getWidth(),
                    scaledSize[1] / size.getHeight());
            svg.render((JComponent) null, g);
        } catch (RuntimeException e) {
            throw new RasterException("Rendering failed: " + e, e);
        } finally {
            g.dispose();
        }
        return image;
    }

}
