package com.astro.calpipe.service;

import nom.tam.fits.Header;
import nom.tam.fits.HeaderCardException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keywords the pipeline writes to its products. All fit the 8 character FITS limit.
 */
public final class HeaderKeys {
    private HeaderKeys() {}

    /** Raw file as stored on the telescope side. */
    public static final String TRAW = "KW-TRAW";
    /** Raw file as stored on the pipeline side. */
    public static final String PRAW = "KW-PRAW";
    /** Reduced file on the pipeline side. */
    public static final String PRED = "KW-PRED";
    /** Number of frames combined into a master. */
    public static final String SOURCE_COUNT = "KW-SRCN";
    /** Prefix of the per-source keywords, followed by a 4 digit 1-based index. */
    public static final String SOURCE_PREFIX = "KW-S";
    /** Set once a frame has been plate solved. */
    public static final String ASTROMETRY = "KW-ASTRO";

    public static String sourceKey(int oneBasedIndex) {
        return SOURCE_PREFIX + String.format(Locale.ROOT, "%04d", oneBasedIndex);
    }

    public static void put(Header h, String key, String value, String comment) throws IOException {
        try {
            h.deleteKey(key);
            h.addValue(key, value, comment);
        } catch (HeaderCardException e) {
            throw new IOException("Cannot write header keyword " + key, e);
        }
    }

    public static void put(Header h, String key, int value, String comment) throws IOException {
        try {
            h.deleteKey(key);
            h.addValue(key, value, comment);
        } catch (HeaderCardException e) {
            throw new IOException("Cannot write header keyword " + key, e);
        }
    }

    public static void put(Header h, String key, double value, String comment) throws IOException {
        try {
            h.deleteKey(key);
            h.addValue(key, value, comment);
        } catch (HeaderCardException e) {
            throw new IOException("Cannot write header keyword " + key, e);
        }
    }

    public static void put(Header h, String key, boolean value, String comment) throws IOException {
        try {
            h.deleteKey(key);
            h.addValue(key, value, comment);
        } catch (HeaderCardException e) {
            throw new IOException("Cannot write header keyword " + key, e);
        }
    }

    public static void putSources(Header h, List<Path> sources) throws IOException {
        put(h, SOURCE_COUNT, sources.size(), "Frames combined");
        for (int i = 0; i < sources.size(); i++) {
            put(h, sourceKey(i + 1), sources.get(i).toString(), "Source frame " + (i + 1));
        }
    }

    public static List<Path> readSources(Header h) {
        int n = h.getIntValue(SOURCE_COUNT, 0);
        List<Path> sources = new ArrayList<>(n);
        for (int i = 1; i <= n; i++) {
            String v = h.getStringValue(sourceKey(i));
            if (v != null) sources.add(Path.of(v));
        }
        return sources;
    }
}
