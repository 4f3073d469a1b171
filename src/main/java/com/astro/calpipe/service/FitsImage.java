package com.astro.calpipe.service;

import ij.process.FloatProcessor;
import nom.tam.fits.Header;

/**
 * Pixel data of a primary HDU in physical units (BZERO/BSCALE applied), row-major,
 * together with the header it came with.
 */
public class FitsImage {
    public final float[][] data;
    public final Header header;

    public FitsImage(float[][] data, Header header) {
        this.data = data;
        this.header = header;
    }

    public int width() {
        return data.length == 0 ? 0 : data[0].length;
    }

    public int height() {
        return data.length;
    }

    public boolean sameShape(FitsImage other) {
        return width() == other.width() && height() == other.height();
    }

    public FloatProcessor toProcessor() {
        int w = width(), h = height();
        float[] px = new float[w * h];
        for (int y = 0; y < h; y++) System.arraycopy(data[y], 0, px, y * w, w);
        return new FloatProcessor(w, h, px);
    }

    public static float[][] fromProcessor(FloatProcessor ip) {
        int w = ip.getWidth(), h = ip.getHeight();
        float[] px = (float[]) ip.getPixels();
        float[][] d = new float[h][w];
        for (int y = 0; y < h; y++) System.arraycopy(px, y * w, d[y], 0, w);
        return d;
    }
}
