package com.astro.calpipe.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.astro.calpipe.model.CalibrationMatch;
import com.astro.calpipe.model.CalibrationTarget;
import com.astro.calpipe.model.FrameType;
import com.astro.calpipe.model.MatchResult;
import com.astro.calpipe.model.NightDirectory;
import com.astro.calpipe.support.FitsFixtures;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FrameMatcherServiceTest {
    private static final LocalDateTime LIGHT_TIME = LocalDateTime.of(2021, 3, 10, 23, 0);

    @TempDir
    Path root;

    private NightDirectory night;
    private FrameMatcherService matcher;

    @BeforeEach
    void setUp() throws Exception {
        night = FitsFixtures.night(root, "210310");
        matcher = new FrameMatcherService(new FrameIndexService(new FitsHeaderService()), 365);
    }

    private CalibrationTarget target(String filter) {
        return new CalibrationTarget(night, LIGHT_TIME, "1x1", filter);
    }

    private void flat(int offset, String filter, int index, LocalDateTime time) throws Exception {
        FitsFixtures.master(night.neighbor(offset), FrameType.FLAT, "1x1", filter, index).at(time).write();
    }

    @Test
    void nearerFutureBeatsFartherPast() throws Exception {
        flat(-2, "R", 1, LIGHT_TIME.minusDays(2));
        flat(1, "R", 1, LIGHT_TIME.plusDays(1));

        CalibrationMatch m = matcher.find(target("R"), FrameType.FLAT, 365).orElseThrow();
        assertEquals(1, m.ageDays());
        assertEquals("210311", m.master().night.name());
    }

    @Test
    void equalOffsetsPreferThePast() throws Exception {
        flat(-1, "R", 1, LIGHT_TIME.minusDays(1));
        flat(1, "R", 1, LIGHT_TIME.plusDays(1));

        CalibrationMatch m = matcher.find(target("R"), FrameType.FLAT, 365).orElseThrow();
        assertEquals(-1, m.ageDays());
    }

    @Test
    void equalOffsetsPreferTheCloserTime() throws Exception {
        // past flat taken early evening, future flat right before the light's time of day
        flat(-1, "R", 1, LIGHT_TIME.minusDays(1).minusHours(5));
        flat(1, "R", 1, LIGHT_TIME.plusDays(1).minusHours(6));

        CalibrationMatch m = matcher.find(target("R"), FrameType.FLAT, 365).orElseThrow();
        assertEquals(1, m.ageDays());
    }

    @Test
    void sameNightWinsAndPicksClosestCluster() throws Exception {
        flat(0, "R", 1, LIGHT_TIME.minusHours(5));
        flat(0, "R", 2, LIGHT_TIME.plusHours(1));
        flat(-1, "R", 1, LIGHT_TIME.minusDays(1));

        CalibrationMatch m = matcher.find(target("R"), FrameType.FLAT, 365).orElseThrow();
        assertEquals(0, m.ageDays());
        assertEquals(2, m.master().clusterIndex);
    }

    @Test
    void tiedTimesFallBackToLowerClusterIndex() throws Exception {
        flat(0, "R", 2, LIGHT_TIME.minusHours(1));
        flat(0, "R", 1, LIGHT_TIME.plusHours(1));

        assertEquals(1, matcher.find(target("R"), FrameType.FLAT, 365).orElseThrow().master().clusterIndex);
    }

    @Test
    void flatsMustMatchTheFilter() throws Exception {
        flat(0, "V", 1, LIGHT_TIME);
        flat(3, "R", 1, LIGHT_TIME.plusDays(3));

        assertEquals(3, matcher.find(target("R"), FrameType.FLAT, 365).orElseThrow().ageDays());
    }

    @Test
    void radiusLimitsTheSearch() throws Exception {
        flat(-4, "R", 1, LIGHT_TIME.minusDays(4));

        assertFalse(matcher.find(target("R"), FrameType.FLAT, 3).isPresent());
        assertTrue(matcher.find(target("R"), FrameType.FLAT, 4).isPresent());
    }

    @Test
    void reportsUnresolvedTypesPerType() throws Exception {
        FitsFixtures.master(night, FrameType.BIAS, "1x1", null, 1).at(LIGHT_TIME).write();
        FitsFixtures.master(night.neighbor(-2), FrameType.DARK, "1x1", null, 1).at(LIGHT_TIME.minusDays(2)).write();

        MatchResult result = matcher.match(target("R"), EnumSet.of(FrameType.BIAS, FrameType.DARK, FrameType.FLAT));
        assertEquals(0, result.get(FrameType.BIAS).orElseThrow().ageDays());
        assertEquals(-2, result.get(FrameType.DARK).orElseThrow().ageDays());
        assertEquals(EnumSet.of(FrameType.FLAT), result.unresolved());
        assertNull(result.ages().get(FrameType.FLAT));
    }

    @Test
    void binningMustMatch() throws Exception {
        FitsFixtures.master(night, FrameType.BIAS, "2x2", null, 1).binning("2x2").at(LIGHT_TIME).write();

        Optional<CalibrationMatch> m = matcher.find(target("R"), FrameType.BIAS, 10);
        assertFalse(m.isPresent());
    }

    @Test
    void forgetPicksUpNewMasters() throws Exception {
        assertFalse(matcher.find(target("R"), FrameType.BIAS, 0).isPresent());
        FitsFixtures.master(night, FrameType.BIAS, "1x1", null, 1).at(LIGHT_TIME).write();
        matcher.forget(night);
        assertTrue(matcher.find(target("R"), FrameType.BIAS, 0).isPresent());
    }
}
