/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.render;

import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

import java.awt.image.BufferedImage;

import io.github.stanio.png.PNGEncoder;

/**
 * Renders SVG documents to PNG images at an integer scale factor.
 * Implementations are safe for concurrent use by multiple threads.
 *
 * @see  #newInstance(String, String)
 */
public abstract class Rasterizer {

    public static final String JSVG = "jsvg";

    public static final String BATIK = "batik";

    private static final Map<String, Function<Supplier<PNGEncoder>, Rasterizer>>
            BACKENDS = Map.of(JSVG, JSVGRasterizer::new,
                              BATIK, BatikRasterizer::new);

    private final ThreadLocal<PNGEncoder> pngEncoder;

    protected Rasterizer(Supplier<PNGEncoder> pngEncoder) {
        this.pngEncoder = ThreadLocal.withInitial(pngEncoder);
    }

    /**
     * Creates a rasterizer using the named rendering back-end and PNG
     * encoder.
     *
     * @param   backend  {@value #JSVG} (the default, also for an empty
     *          string), or {@value #BATIK}
     * @param   pngEncoder  the {@code PNGEncoder} name
     * @throws  IllegalArgumentException  if a name is not recognized
     * @see     PNGEncoder#newInstance(String)
     */
    public static Rasterizer newInstance(String backend, String pngEncoder) {
        String key = backend.strip().toLowerCase(Locale.ROOT);
        Function<Supplier<PNGEncoder>, Rasterizer> ctor =
                BACKENDS.get(key.isEmpty() ? JSVG : key);
        if (ctor == null)
            throw new IllegalArgumentException("Unknown renderer: " + backend);

        // Fail early on unknown encoder name.
        PNGEncoder.newInstance(pngEncoder);
        return ctor.apply(() -> PNGEncoder.newInstance(pngEncoder));
    }

    public static Rasterizer newInstance() {
        return newInstance(JSVG, PNGEncoder.IMAGEIO);
    }

    /**
     * Renders the given SVG source, scaling its intrinsic size by the given
     * factor, and encodes the result as PNG.
     *
     * @param   svgSource  SVG document bytes
     * @param   scale  positive scale factor
     * @return  PNG image bytes
     * @throws  RasterException  if the source could not be rendered
     */
    public byte[] render(byte[] svgSource, int scale) throws RasterException {
        if (scale < 1)
            throw new IllegalArgumentException("Scale must be positive: " + scale);

        BufferedImage image = renderImage(svgSource, scale);
        return pngEncoder.get().encode(image);
    }

    /**
     * Renders the given SVG source to an image of its intrinsic size
     * multiplied by {@code scale}.
     */
    protected abstract BufferedImage renderImage(byte[] svgSource, int scale)
            throws RasterException;

    /**
     * Computes the scaled image dimension for an intrinsic document size.
     *
     * @throws  RasterException  if the scaled image would be too large
     */
    static int[] scaledSize(double width, double height, int scale)
            throws RasterException {
        if (!(width > 0 && height > 0))
            throw new RasterException("Invalid document size: " + width + "x" + height);

        // Both dimensions fit in an int, so the long products don't overflow.
        long scaledWidth = Math.max(1L, Math.round(Math.min(width, Integer.MAX_VALUE))) * scale;
        long scaledHeight = Math.max(1L, Math.round(Math.min(height, Integer.MAX_VALUE))) * scale;
        if (scaledWidth > Integer.MAX_VALUE
                || scaledHeight > Integer.MAX_VALUE
                || scaledWidth * scaledHeight > Integer.MAX_VALUE) {
            throw new RasterException("Image too large: " + scaledWidth
                    + "x" + scaledHeight + " at scale " + scale);
        }
        return new int[] { (int) scaledWidth, (int) scaledHeight };
    }

}
