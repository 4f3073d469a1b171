package com.astro.calpipe.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class PipelineConfigTest {
    @Test
    void defaultsApplyToAnEmptyFile() {
        PipelineConfig c = PipelineConfig.parse("");
        assertEquals(1.0, c.getGapHours());
        assertEquals(365, c.getMaxSearchDays());
        assertEquals("median", c.getCombine());
        assertEquals(Duration.ofMinutes(10), c.getBuildTimeout());
        assertEquals(List.of("backup", "correction", "reduction"), c.getSteps());
        assertTrue(c.isAllowPartial());
    }

    @Test
    void readsAllSections() {
        PipelineConfig c = PipelineConfig.parse(String.join("\n",
                "[paths]",
                "data_root = \"/data\"",
                "[clustering]",
                "gap_hours = 2.5",
                "min_frames = 3",
                "[matching]",
                "max_search_days = 30",
                "[masters]",
                "combine = \"sigma-clipped-mean\"",
                "threads = 2",
                "build_timeout = \"90s\"",
                "[reduction]",
                "use_flat = false",
                "[ledger]",
                "lock_backoff = \"50ms\"",
                "[pipeline]",
                "steps = [\"correction\", \"reduction\", \"astrometry\"]"));
        assertEquals(Path.of("/data"), c.getDataRoot());
        assertEquals(Path.of("/data").resolve("pending_log.csv"), c.getPendingLog());
        assertEquals(Duration.ofMinutes(150), c.gap());
        assertEquals(3, c.getMinFrames());
        assertEquals(30, c.getMaxSearchDays());
        assertEquals("sigma-clipped-mean", c.getCombine());
        assertEquals(2, c.getThreads());
        assertEquals(Duration.ofSeconds(90), c.getBuildTimeout());
        assertFalse(c.calibrationTypes().contains(FrameType.FLAT));
        assertEquals(Duration.ofMillis(50), c.getLockBackoff());
        assertEquals(List.of("correction", "reduction", "astrometry"), c.getSteps());
    }

    @Test
    void parsesDurations() {
        assertEquals(Duration.ofMillis(500), PipelineConfig.parseDuration("500ms"));
        assertEquals(Duration.ofHours(1), PipelineConfig.parseDuration("1h"));
        assertEquals(Duration.ofDays(3), PipelineConfig.parseDuration("3d"));
        assertEquals(Duration.ofMillis(1500), PipelineConfig.parseDuration("1500"));
    }

    @Test
    void rejectsSyntaxErrorsAndBadValues() {
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.parse("[paths\ndata_root = 1"));
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.parse("[clustering]\ngap_hours = 0"));
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.parse("[masters]\nsigma = 0"));
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.parse("[reduction]\nuse_dark = \"yes\""));
    }
}
