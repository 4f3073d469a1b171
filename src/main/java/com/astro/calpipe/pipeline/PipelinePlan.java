package com.astro.calpipe.pipeline;

import com.astro.calpipe.error.PipelinePlanException;
import com.astro.calpipe.model.NightDirectory;
import com.astro.calpipe.service.FrameIndexService;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * An ordered list of steps, checked before anything runs: every name must be known and every
 * step's requirements must be met by products already on disk or by an earlier step.
 */
public final class PipelinePlan {

    private final List<PipelineStep> steps;

    private PipelinePlan(List<PipelineStep> steps) {
        this.steps = List.copyOf(steps);
    }

    public List<PipelineStep> steps() {
        return steps;
    }

    public static Map<String, PipelineStep> standardSteps() {
        Map<String, PipelineStep> steps = new LinkedHashMap<>();
        for (PipelineStep s : List.of(new BackupStep(), new CorrectionStep(), new ReductionStep(), new PlateSolveStep())) {
            steps.put(s.name(), s);
        }
        return steps;
    }

    public static PipelinePlan of(List<String> names, Map<String, PipelineStep> available, Set<Product> onDisk)
            throws PipelinePlanException {
        if (names.isEmpty()) throw new PipelinePlanException("No steps configured");
        Set<Product> satisfied = onDisk.isEmpty() ? EnumSet.noneOf(Product.class) : EnumSet.copyOf(onDisk);
        List<PipelineStep> ordered = new ArrayList<>();
        for (String raw : names) {
            String name = raw.trim().toLowerCase(Locale.ROOT);
            PipelineStep step = available.get(name);
            if (step == null) {
                throw new PipelinePlanException("Unknown step '" + raw + "' (known: " + String.join(", ", available.keySet()) + ")");
            }
            if (ordered.contains(step)) throw new PipelinePlanException("Step '" + name + "' listed twice");
            Set<Product> missing = EnumSet.noneOf(Product.class);
            for (Product p : step.requires()) {
                if (!satisfied.contains(p)) missing.add(p);
            }
            if (!missing.isEmpty()) {
                throw new PipelinePlanException("Step '" + name + "' needs " + missing
                        + ", which neither an earlier step nor the night directory provides");
            }
            satisfied.addAll(step.provides());
            ordered.add(step);
        }
        return new PipelinePlan(ordered);
    }

    /** Products a night directory already holds. */
    public static Set<Product> onDisk(NightDirectory night) throws IOException {
        Set<Product> products = EnumSet.noneOf(Product.class);
        if (!FrameIndexService.listFits(night.rawDir()).isEmpty()) products.add(Product.RAW_FRAMES);
        if (Files.isDirectory(night.correctionDir())) products.add(Product.MASTER_FRAMES);
        if (!FrameIndexService.listFits(night.reducedDir()).isEmpty()) products.add(Product.REDUCED_FRAMES);
        return products;
    }

    @Override
    public String toString() {
        List<String> names = new ArrayList<>();
        for (PipelineStep s : steps) names.add(s.name());
        return String.join(" -> ", names);
    }
}
