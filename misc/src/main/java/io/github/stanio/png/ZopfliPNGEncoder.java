/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.png;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.zip.CRC32;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;

import com.googlecode.pngtastic.core.processing.zopfli.Options;
import com.googlecode.pngtastic.core.processing.zopfli.Options.BlockSplitting;
import com.googlecode.pngtastic.core.processing.zopfli.Options.OutputFormat;
import com.googlecode.pngtastic.core.processing.zopfli.Zopfli;

/**
 * Compresses PNG image data using Zopfli.  Always produces truecolor+alpha
 * (32-bit, 8 bits/sample) images, converting the source as necessary.
 * Considerably slower than the ImageIO encoder, for smaller output.
 *
 * @see  <a href="https://github.com/google/zopfli">Zopfli</a>
 * @see  <a href="https://github.com/depsypher/pngtastic">pngtastic</a>
 */
public class ZopfliPNGEncoder extends PNGEncoder {

    private static final byte[] PNG_MAGIC = {
        (byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A
    };
    private static final byte[] IHDR_TAG = { 'I', 'H', 'D', 'R' };
    private static final byte[] IDAT_TAG = { 'I', 'D', 'A', 'T' };
    private static final byte[] IEND_TAG = { 'I', 'E', 'N', 'D' };

    // bit depth, color type (RGBA), compression, filter, interlace
    private static final byte[] IMAGE_TYPE = { 8, 6, 0, 0, 0 };

    private static final int MASTER_BLOCK_SIZE = 64 * 1024;

    private static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

    private final Zopfli zopfli;
    private final Options options;

    private final CRC32 crc = new CRC32();

    public ZopfliPNGEncoder() {
        this(1);
    }

    public ZopfliPNGEncoder(int numIterations) {
        zopfli = new Zopfli(MASTER_BLOCK_SIZE);
        options = new Options(OutputFormat.ZLIB, BlockSplitting.NONE, numIterations);
    }

    @Override
    public void encode(BufferedImage image, OutputStream out) throws IOException {
        BufferedImage argb = toIntARGB(image);

        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        zopfli.compress(options, pngDataFor(argb), compressed);

        ByteBuffer header = ByteBuffer.allocate(13);
        header.putInt(argb.getWidth())
              .putInt(argb.getHeight())
              .put(IMAGE_TYPE);

        DataOutputStream png = new DataOutputStream(out);
        png.write(PNG_MAGIC);
        writeChunk(png, IHDR_TAG, header.array());
        writeChunk(png, IDAT_TAG, compressed.toByteArray());
        writeChunk(png, IEND_TAG, new byte[0]);
        png.flush();
    }

    private void writeChunk(DataOutputStream out, byte[] tag, byte[] data)
            throws IOException {
        out.writeInt(data.length);
        out.write(tag);
        out.write(data);
        crc.reset();
        crc.update(tag);
        crc.update(data);
        out.writeInt((int) crc.getValue());
    }

    /**
     * {@return the size of the filtered scanlines for an RGBA image of the
     * given dimensions}
     *
     * @throws  IllegalArgumentException  if the data wouldn't fit in an array
     */
    static int rawDataSize(int width, int height) {
        // One filter-type byte per scanline
        long size = height + (long) width * height * Integer.BYTES;
        if (size > MAX_ARRAY_SIZE)
            throw new IllegalArgumentException("Image too large for Zopfli encoding: "
                                               + width + "x" + height);

        return (int) size;
    }

    private static byte[] pngDataFor(BufferedImage image) {
        DataBufferInt dataBuffer = (DataBufferInt) image.getRaster().getDataBuffer();
        int[] sourcePixels = dataBuffer.getData();

        int width = image.getWidth();
        int height = image.getHeight();
        ByteBuffer pngData = ByteBuffer.allocate(rawDataSize(width, height));

        final byte filterType = 0; // None
        for (int y = 0, off = 0; y < height; y++) {
            pngData.put(filterType);
            for (int x = 0; x < width; x++, off++) {
                pngData.putInt(Integer // ARGB -> RGBA
                        .rotateLeft(sourcePixels[off], Byte.SIZE));
            }
        }
        return pngData.array();
    }

}
