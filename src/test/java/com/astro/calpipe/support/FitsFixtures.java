package com.astro.calpipe.support;

import com.astro.calpipe.model.FrameType;
import com.astro.calpipe.model.MasterFrameName;
import com.astro.calpipe.model.NightDirectory;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.Header;
import nom.tam.util.BufferedFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Writes small FITS frames for tests, straight through nom-tam-fits so fixtures do not depend
 * on the code under test.
 */
public final class FitsFixtures {
    private FitsFixtures() {}

    public static final int WIDTH = 4;
    public static final int HEIGHT = 3;

    public static NightDirectory night(Path root, String yyMMdd) throws Exception {
        NightDirectory night = new NightDirectory(root, LocalDate.parse(yyMMdd, NightDirectory.NAME_FORMAT));
        Files.createDirectories(night.rawDir());
        return night;
    }

    public static Frame frame(Path dir, String fileName) {
        return new Frame(dir.resolve(fileName));
    }

    public static Frame raw(NightDirectory night, String fileName) {
        return new Frame(night.rawDir().resolve(fileName));
    }

    /** A master written as the pipeline would name it, without running a build. */
    public static Frame master(NightDirectory night, FrameType type, String binning, String filter, int index) {
        String name = new MasterFrameName(type, binning, filter, index).fileName();
        return new Frame(night.correctionDir().resolve(name)).type(type.label()).binning(binning).filter(filter);
    }

    public static float[][] filled(float value) {
        float[][] d = new float[HEIGHT][WIDTH];
        for (float[] row : d) java.util.Arrays.fill(row, value);
        return d;
    }

    public static float[][] pixels(Path file) throws Exception {
        try (Fits fits = new Fits(file.toFile())) {
            return (float[][]) fits.getHDU(0).getKernel();
        }
    }

    public static Header header(Path file) throws Exception {
        try (Fits fits = new Fits(file.toFile())) {
            return fits.getHDU(0).getHeader();
        }
    }

    public static final class Frame {
        private final Path path;
        private String imageType = "Light Frame";
        private String binning = "1x1";
        private String filter;
        private LocalDateTime time = LocalDateTime.of(2021, 3, 10, 22, 0);
        private double exposure = 10;
        private Object data = filled(100f);

        private Frame(Path path) {
            this.path = path;
        }

        public Frame type(String imageType) { this.imageType = imageType; return this; }

        public Frame binning(String binning) { this.binning = binning; return this; }

        public Frame filter(String filter) { this.filter = filter; return this; }

        public Frame at(LocalDateTime time) { this.time = time; return this; }

        public Frame exposure(double seconds) { this.exposure = seconds; return this; }

        public Frame value(float v) { this.data = filled(v); return this; }

        public Frame data(float[][] data) { this.data = data; return this; }

        public Frame data(short[][] data) { this.data = data; return this; }

        public Path write() throws Exception {
            Files.createDirectories(path.getParent());
            try (Fits fits = new Fits()) {
                BasicHDU<?> hdu = Fits.makeHDU(data);
                Header h = hdu.getHeader();
                h.addValue("IMAGETYP", imageType, "Type of image");
                String[] bin = binning.split("x");
                h.addValue("XBINNING", Integer.parseInt(bin[0]), "Binning factor in width");
                h.addValue("YBINNING", Integer.parseInt(bin[1]), "Binning factor in height");
                if (filter != null) h.addValue("FILTER", filter, "Filter used");
                h.addValue("DATE-OBS", time.toString(), "Start of exposure");
                h.addValue("EXPTIME", exposure, "Exposure time in seconds");
                fits.addHDU(hdu);
                Files.deleteIfExists(path);
                try (BufferedFile bf = new BufferedFile(path.toFile(), "rw")) {
                    fits.write(bf);
                }
            }
            return path;
        }
    }
}
