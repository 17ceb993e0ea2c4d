/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.render;

import java.io.ByteArrayInputStream;
import java.util.function.Supplier;

import java.awt.image.BufferedImage;

import org.apache.batik.transcoder.TranscoderException;
import org.apache.batik.transcoder.TranscoderInput;
import org.apache.batik.transcoder.TranscoderOutput;
import org.apache.batik.transcoder.image.ImageTranscoder;

import io.github.stanio.png.PNGEncoder;

/**
 * Implements rendering using the Batik SVG Toolkit.
 *
 * @see  <a href="https://xmlgraphics.apache.org/batik/">Apache Batik SVG Toolkit</a>
 */
class BatikRasterizer extends Rasterizer {

    BatikRasterizer(Supplier<PNGEncoder> pngEncoder) {
        super(pngEncoder);
    }

    @Override
    protected BufferedImage renderImage(byte[] svgSource, int scale)
            throws RasterException {
        ScaledImageTranscoder transcoder = new ScaledImageTranscoder(scale);
        try {
            transcoder.transcode(new TranscoderInput(new ByteArrayInputStream(svgSource)),
                                 new TranscoderOutput());
        } catch (TranscoderException | RuntimeException e) {
            if (transcoder.sizeError != null) {
                throw transcoder.sizeError;
            }
            throw new RasterException("Could not render SVG document: " + e, e);
        }

        if (transcoder.sizeError != null) {
            throw transcoder.sizeError;
        }
        if (transcoder.image == null) {
            throw new RasterException("No image produced");
        }
        return transcoder.image;
    }


    /**
     * Sizes the output image to the document's intrinsic size multiplied by
     * the scale factor, and captures the rendered image instead of writing
     * it out.
     */
    static class ScaledImageTranscoder extends ImageTranscoder {

        private final int scale;

        BufferedImage image;

        RasterException sizeError;

        ScaledImageTranscoder(int scale) {
            this.scale = scale;
        }

        @Override
        protected void setImageSize(float docWidth, float docHeight) {
            int[] scaledSize;
            try {
                scaledSize = scaledSize(docWidth, docHeight, scale);
            } catch (RasterException e) {
                sizeError = e;
                scaledSize = new int[] { 1, 1 };
            }
            super.setImageSize(scaledSize[0], scaledSize[1]);
        }

        @Override
        public BufferedImage createImage(int width, int height) {
            if (sizeError != null) {
                width = height = 1;
            }
            return new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        }

        @Override
        public void writeImage(BufferedImage img, TranscoderOutput output) {
            this.image = img;
        }

    } // class ScaledImageTranscoder


}
