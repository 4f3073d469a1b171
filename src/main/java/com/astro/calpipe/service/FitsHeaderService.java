package com.astro.calpipe.service;

import com.astro.calpipe.model.FrameType;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

public class FitsHeaderService {

    public static class FitsMetadata {
        public String imageType;
        public FrameType frameType;
        public String binning = "1x1";
        public String filter;
        public LocalDateTime dateObs;
        public double exposureTime = 0;
        public Header header;
    }

    public FitsMetadata readHeader(Path file) throws IOException {
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new IOException("No primary HDU in " + file);
            return describe(hdu.getHeader(), file);
        } catch (FitsException e) {
            throw new IOException("Cannot read FITS header of " + file + ": " + e.getMessage(), e);
        }
    }

    public FitsMetadata describe(Header header, Path file) throws IOException {
        FitsMetadata meta = new FitsMetadata();
        meta.header = header;
        meta.imageType = header.getStringValue("IMAGETYP");
        meta.frameType = FrameType.fromImageType(meta.imageType);

        int xbin = header.getIntValue("XBINNING", 1);
        int ybin = header.getIntValue("YBINNING", xbin);
        meta.binning = xbin + "x" + ybin;

        String filter = header.getStringValue("FILTER");
        meta.filter = filter != null ? filter.trim() : null;

        // EXPTIME is standard, EXPOSURE is what some capture software writes
        meta.exposureTime = header.getDoubleValue("EXPTIME", 0);
        if (meta.exposureTime == 0) meta.exposureTime = header.getDoubleValue("EXPOSURE", 0);

        meta.dateObs = parseDateObs(header, file);
        return meta;
    }

    private LocalDateTime parseDateObs(Header header, Path file) throws IOException {
        String raw = header.getStringValue("DATE-OBS");
        if (raw == null || raw.isBlank()) throw new IOException("DATE-OBS missing in " + file);
        String value = raw.trim();
        // Old FITS writers split date and time over DATE-OBS / TIME-OBS
        if (!value.contains("T")) {
            String time = header.getStringValue("TIME-OBS");
            value = value + "T" + (time != null ? time.trim() : "00:00:00");
        }
        try {
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new IOException("Unparseable DATE-OBS '" + raw + "' in " + file, e);
        }
    }
}
