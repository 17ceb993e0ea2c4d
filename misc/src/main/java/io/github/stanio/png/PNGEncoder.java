/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.png;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Locale;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;

/**
 * Encodes images in the PNG format.  Instances are not thread-safe, use one
 * per thread.
 *
 * @see  ZopfliPNGEncoder
 */
public abstract class PNGEncoder {

    public static final String IMAGEIO = "imageio";

    public static final String ZOPFLI = "zopfli";

    protected PNGEncoder() {
        // For implicit invocation by subclasses.
    }

    /**
     * Creates an encoder by name: {@value #IMAGEIO} (also the empty string),
     * or {@value #ZOPFLI}.
     *
     * @throws  IllegalArgumentException  if the name is not recognized
     */
    public static PNGEncoder newInstance(String name) {
        switch (name.strip().toLowerCase(Locale.ROOT)) {
        case "":
        case IMAGEIO:
            return new ImageIOPNGEncoder();
        case ZOPFLI:
            return new ZopfliPNGEncoder();
        default:
            throw new IllegalArgumentException("Unknown PNG encoder: " + name);
        }
    }

    public byte[] encode(BufferedImage image) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(
                Math.max(1024, image.getWidth() * image.getHeight()));
        try {
            encode(image, buf);
        } catch (IOException e) {
            // ByteArrayOutputStream doesn't fail
            throw new UncheckedIOException(e);
        }
        return buf.toByteArray();
    }

    public abstract void encode(BufferedImage image, OutputStream out)
            throws IOException;

    /**
     * {@return the given image if it is {@code TYPE_INT_ARGB}, or a copy
     * converted to that type}
     */
    protected static BufferedImage toIntARGB(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_ARGB)
            return image;

        BufferedImage argb = new BufferedImage(image.getWidth(),
                image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = argb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return argb;
    }

}


class ImageIOPNGEncoder extends PNGEncoder {

    private final ImageWriter pngWriter;

    ImageIOPNGEncoder() {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("png");
        if (!writers.hasNext()) {
            throw new IllegalStateException("PNG image writer not available");
        }
        pngWriter = writers.next();
    }

    @Override
    public void encode(BufferedImage image, OutputStream target) throws IOException {
        try (ImageOutputStream out = new MemoryCacheImageOutputStream(target)) {
            pngWriter.setOutput(out);
            pngWriter.write(null, new IIOImage(image, null, null), null);
        } finally {
            pngWriter.setOutput(null);
        }
    }

}
