package com.astro.calpipe.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.astro.calpipe.error.PipelinePlanException;
import com.astro.calpipe.model.NightDirectory;
import com.astro.calpipe.support.FitsFixtures;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PipelinePlanTest {
    private final Map<String, PipelineStep> steps = PipelinePlan.standardSteps();

    @Test
    void acceptsTheStandardOrder() throws Exception {
        PipelinePlan plan = PipelinePlan.of(List.of("backup", "correction", "reduction", "astrometry"), steps,
                EnumSet.noneOf(Product.class));
        assertEquals(4, plan.steps().size());
        assertEquals("backup -> correction -> reduction -> astrometry", plan.toString());
    }

    @Test
    void stepNamesIgnoreCaseAndSpaces() throws Exception {
        PipelinePlan plan = PipelinePlan.of(List.of(" Correction", "REDUCTION "), steps, EnumSet.of(Product.RAW_FRAMES));
        assertEquals("correction -> reduction", plan.toString());
    }

    @Test
    void rejectsUnknownStep() {
        PipelinePlanException e = assertThrows(PipelinePlanException.class,
                () -> PipelinePlan.of(List.of("backup", "stacking"), steps, EnumSet.noneOf(Product.class)));
        assertTrue(e.getMessage().contains("stacking"), e.getMessage());
    }

    @Test
    void rejectsStepBeforeItsInputs() {
        assertThrows(PipelinePlanException.class,
                () -> PipelinePlan.of(List.of("reduction", "correction"), steps, EnumSet.of(Product.RAW_FRAMES)));
        assertThrows(PipelinePlanException.class,
                () -> PipelinePlan.of(List.of("correction"), steps, EnumSet.noneOf(Product.class)));
    }

    @Test
    void productsOnDiskSatisfyRequirements() throws Exception {
        Set<Product> onDisk = EnumSet.of(Product.RAW_FRAMES, Product.MASTER_FRAMES, Product.REDUCED_FRAMES);
        assertEquals("astrometry", PipelinePlan.of(List.of("astrometry"), steps, onDisk).toString());
        assertEquals("reduction", PipelinePlan.of(List.of("reduction"), steps, onDisk).toString());
    }

    @Test
    void rejectsDuplicatesAndEmptyPlans() {
        assertThrows(PipelinePlanException.class,
                () -> PipelinePlan.of(List.of("backup", "backup"), steps, EnumSet.noneOf(Product.class)));
        assertThrows(PipelinePlanException.class,
                () -> PipelinePlan.of(List.of(), steps, EnumSet.noneOf(Product.class)));
    }

    @Test
    void readsProductsFromTheNightDirectory(@TempDir Path root) throws Exception {
        NightDirectory night = FitsFixtures.night(root, "210310");
        assertEquals(EnumSet.noneOf(Product.class), PipelinePlan.onDisk(night));

        FitsFixtures.raw(night, "m42_001.fits").write();
        Files.createDirectories(night.correctionDir());
        assertEquals(EnumSet.of(Product.RAW_FRAMES, Product.MASTER_FRAMES), PipelinePlan.onDisk(night));

        FitsFixtures.frame(night.reducedDir(), "m42_001.fits").write();
        assertEquals(EnumSet.of(Product.RAW_FRAMES, Product.MASTER_FRAMES, Product.REDUCED_FRAMES),
                PipelinePlan.onDisk(night));
    }
}
