package com.astro.calpipe.service;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.BufferedFile;
import nom.tam.util.Cursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Set;

/**
 * Reads FITS images as float pixels and writes pipeline products as 32-bit float images.
 * Products are written to a temp file next to the target and moved into place, so a reader
 * never sees a half-written frame.
 */
public class FitsImageService {
    private static final Logger log = LoggerFactory.getLogger(FitsImageService.class);

    // Keywords owned by the data layout of the written HDU, never copied from a source header.
    private static final Set<String> STRUCTURAL = Set.of(
            "SIMPLE", "XTENSION", "BITPIX", "NAXIS", "NAXIS1", "NAXIS2", "NAXIS3", "EXTEND",
            "PCOUNT", "GCOUNT", "BZERO", "BSCALE", "BLANK", "CHECKSUM", "DATASUM", "END");

    static {
        FitsFactory.setLongStringsEnabled(true);
    }

    public FitsImage read(Path file) throws IOException {
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new IOException("No primary HDU in " + file);
            Header header = hdu.getHeader();
            double bzero = header.getDoubleValue("BZERO", 0);
            double bscale = header.getDoubleValue("BSCALE", 1);
            float[][] data = toFloat(hdu.getKernel(), bzero, bscale, file);
            return new FitsImage(data, header);
        } catch (FitsException e) {
            throw new IOException("Cannot read FITS image " + file + ": " + e.getMessage(), e);
        }
    }

    /** Header carrying every non-structural card of {@code source}, in order. */
    public Header copyHeader(Header source) throws IOException {
        Header copy = new Header();
        Cursor<String, HeaderCard> it = source.iterator();
        while (it.hasNext()) {
            HeaderCard card = it.next();
            String key = card.getKey();
            if (key == null || STRUCTURAL.contains(key)) continue;
            copy.addLine(card);
        }
        return copy;
    }

    /**
     * Writes {@code data} as a float image. All cards of {@code cards} except structural ones
     * end up in the primary header.
     */
    public void write(Path target, float[][] data, Header cards) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        Path tmp = Files.createTempFile(target.toAbsolutePath().getParent(), "." + target.getFileName(), ".tmp");
        try {
            try (Fits fits = new Fits()) {
                BasicHDU<?> hdu = Fits.makeHDU(data);
                Header out = hdu.getHeader();
                Cursor<String, HeaderCard> it = cards.iterator();
                while (it.hasNext()) {
                    HeaderCard card = it.next();
                    String key = card.getKey();
                    if (key == null || STRUCTURAL.contains(key)) continue;
                    if (!isCommentary(key)) out.deleteKey(key);
                    out.addLine(card);
                }
                fits.addHDU(hdu);
                try (BufferedFile bf = new BufferedFile(tmp.toFile(), "rw")) {
                    fits.write(bf);
                }
            } catch (FitsException e) {
                throw new IOException("Cannot write FITS image " + target + ": " + e.getMessage(), e);
            }
            move(tmp, target);
            log.debug("Wrote {}", target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /** Edits the primary header of a copy. */
    @FunctionalInterface
    public interface HeaderEdit {
        void apply(Header header) throws IOException;
    }

    /**
     * Writes {@code source} to {@code target} with its primary header edited, keeping every HDU
     * and the original data layout. {@code source} and {@code target} may be the same file.
     */
    public void rewriteHeader(Path source, Path target, HeaderEdit edit) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        Path tmp = Files.createTempFile(target.toAbsolutePath().getParent(), "." + target.getFileName(), ".tmp");
        try {
            try (Fits in = new Fits(source.toFile()); Fits out = new Fits()) {
                BasicHDU<?>[] hdus = in.read();
                if (hdus == null || hdus.length == 0) throw new IOException("No HDU in " + source);
                for (BasicHDU<?> hdu : hdus) {
                    hdu.getKernel();
                    out.addHDU(hdu);
                }
                edit.apply(hdus[0].getHeader());
                try (BufferedFile bf = new BufferedFile(tmp.toFile(), "rw")) {
                    out.write(bf);
                }
            } catch (FitsException e) {
                throw new IOException("Cannot rewrite " + source + ": " + e.getMessage(), e);
            }
            move(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static boolean isCommentary(String key) {
        return key.isEmpty() || key.equals("COMMENT") || key.equals("HISTORY");
    }

    static void move(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private float[][] toFloat(Object k, double bzero, double bscale, Path file) throws IOException {
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            if (bzero == 0 && bscale == 1) return f;
            float[][] d = new float[f.length][f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[0].length; j++) d[i][j] = (float) (f[i][j] * bscale + bzero);
            return d;
        }
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            float[][] d = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) (s[i][j] * bscale + bzero);
            return d;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            float[][] d = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) (s[i][j] * bscale + bzero);
            return d;
        }
        if (k instanceof double[][]) {
            double[][] s = (double[][]) k;
            float[][] d = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) (s[i][j] * bscale + bzero);
            return d;
        }
        if (k instanceof byte[][]) {
            byte[][] s = (byte[][]) k;
            float[][] d = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) ((s[i][j] & 0xFF) * bscale + bzero);
            return d;
        }
        throw new IOException("Unsupported image layout in " + file + ": "
                + (k == null ? "no data" : k.getClass().getSimpleName()));
    }
}
