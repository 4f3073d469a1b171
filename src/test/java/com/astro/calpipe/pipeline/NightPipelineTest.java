package com.astro.calpipe.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.astro.calpipe.error.PipelinePlanException;
import com.astro.calpipe.model.FrameType;
import com.astro.calpipe.model.NightDirectory;
import com.astro.calpipe.model.PipelineConfig;
import com.astro.calpipe.model.RunSummary;
import com.astro.calpipe.service.FrameIndexService;
import com.astro.calpipe.service.HeaderKeys;
import com.astro.calpipe.support.FitsFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import nom.tam.fits.Header;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NightPipelineTest {
    private static final LocalDate DATE = LocalDate.of(2021, 3, 10);

    @TempDir
    Path tmp;

    private PipelineConfig config;
    private NightDirectory night;
    private Path telescopeNight;

    @BeforeEach
    void setUp() throws Exception {
        config = PipelineConfig.defaults();
        config.setDataRoot(tmp.resolve("data"));
        config.setTelescopeRoot(tmp.resolve("telescope"));
        config.setThreads(2);
        night = new NightDirectory(config.getDataRoot(), DATE);
        telescopeNight = config.getTelescopeRoot().resolve("210310");

        series("bias", "Bias Frame", null, DATE.atTime(18, 0), 0, 100f);
        series("dark", "Dark Frame", null, DATE.atTime(18, 30), 30, 160f);
        series("flat", "Flat Field", "R", DATE.atTime(19, 0), 1, 20000f);
        for (int i = 1; i <= 2; i++) {
            FitsFixtures.frame(telescopeNight, "m42_00" + i + ".fits").filter("R").exposure(30)
                    .at(DATE.atTime(23, i)).value(1300f).write();
        }
    }

    private void series(String prefix, String imageType, String filter, LocalDateTime start, double exposure,
                        float value) throws Exception {
        for (int i = 0; i < 3; i++) {
            FitsFixtures.frame(telescopeNight, prefix + i + ".fits").type(imageType).filter(filter)
                    .at(start.plusMinutes(i)).exposure(exposure).value(value).write();
        }
    }

    private RunSummary run(List<String> steps) throws Exception {
        try (PipelineServices services = new PipelineServices(config)) {
            return new NightPipeline(services).run(night, steps);
        }
    }

    @Test
    void runsBackupCorrectionAndReduction() throws Exception {
        RunSummary summary = run(config.getSteps());

        assertEquals(0, summary.exitCode(), summary.failures().toString());
        assertEquals(3, summary.mastersBuilt.get());
        assertEquals(2, summary.lightsReduced.get());
        assertEquals(0, summary.pendingLogged.get());

        List<Path> raw = FrameIndexService.listFits(night.rawDir());
        assertEquals(11, raw.size());
        Header copied = FitsFixtures.header(night.rawDir().resolve("m42_001.fits"));
        assertEquals(telescopeNight.resolve("m42_001.fits").toAbsolutePath().toString(),
                copied.getStringValue(HeaderKeys.TRAW));

        assertTrue(Files.exists(night.correctionDir().resolve("master_bias1x1C1.fits")));
        assertTrue(Files.exists(night.correctionDir().resolve("master_dark1x1C1.fits")));
        assertTrue(Files.exists(night.correctionDir().resolve("master_flat1x1RC1.fits")));

        Path reduced = night.reducedDir().resolve("m42_002.fits");
        // (1300 - 100 - 2 * 30) / 1
        assertEquals(1140f, FitsFixtures.pixels(reduced)[2][3], 1e-2);
        assertEquals(0, FitsFixtures.header(reduced).getIntValue(FrameType.FLAT.ageKey()));
        assertFalse(Files.exists(config.getPendingLog()));
    }

    @Test
    void secondRunKeepsTheBackupAndSkipsReducedFrames() throws Exception {
        run(config.getSteps());
        Path reduced = night.reducedDir().resolve("m42_001.fits");
        long modified = Files.getLastModifiedTime(reduced).toMillis();

        config.setSkipReduced(true);
        RunSummary again = run(config.getSteps());

        assertEquals(0, again.exitCode());
        assertEquals(0, again.lightsReduced.get());
        assertEquals(modified, Files.getLastModifiedTime(reduced).toMillis());
        assertEquals(11, FrameIndexService.listFits(night.rawDir()).size());
    }

    @Test
    void missingFlatsLeaveLedgerRows() throws Exception {
        for (int i = 0; i < 3; i++) Files.delete(telescopeNight.resolve("flat" + i + ".fits"));

        RunSummary summary = run(config.getSteps());

        assertEquals(2, summary.mastersBuilt.get());
        assertEquals(2, summary.lightsReduced.get());
        assertEquals(2, summary.pendingLogged.get());
        assertEquals(3, Files.readAllLines(config.getPendingLog()).size());
    }

    @Test
    void rejectsPlanBeforeTouchingTheNight() {
        assertThrows(PipelinePlanException.class, () -> run(List.of("reduction")));
        assertFalse(Files.exists(night.path()));
    }

    @Test
    void failedStepIsRecordedAndLaterStepsStillRun() throws Exception {
        List<String> ran = new ArrayList<>();
        Map<String, PipelineStep> available = new LinkedHashMap<>();
        available.put("broken", new RecordingStep("broken", ran, true));
        available.put("after", new RecordingStep("after", ran, false));

        RunSummary summary;
        try (PipelineServices services = new PipelineServices(config)) {
            summary = new NightPipeline(services, available).run(night, List.of("broken", "after"));
        }

        assertEquals(List.of("broken", "after"), ran);
        assertEquals(1, summary.count(RunSummary.ErrorKind.IO));
        assertEquals(1, summary.exitCode());
    }

    private static final class RecordingStep implements PipelineStep {
        private final String name;
        private final List<String> ran;
        private final boolean fail;

        RecordingStep(String name, List<String> ran, boolean fail) {
            this.name = name;
            this.ran = ran;
            this.fail = fail;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Set<Product> requires() {
            return EnumSet.noneOf(Product.class);
        }

        @Override
        public Set<Product> provides() {
            return EnumSet.noneOf(Product.class);
        }

        @Override
        public void run(NightContext context) throws IOException {
            ran.add(name);
            if (fail) throw new IOException("disk full");
        }
    }
}
