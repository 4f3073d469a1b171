package com.astro.calpipe.service.combine;

import com.astro.calpipe.error.InsufficientFramesException;
import ij.plugin.ZProjector;
import java.util.List;

public class MeanCombine implements CombineStrategy {

    @Override
    public String name() {
        return "mean";
    }

    @Override
    public float[][] combine(List<float[][]> frames) throws InsufficientFramesException {
        ImageStacks.checkShapes(frames);
        if (frames.size() == 1) return ImageStacks.copy(frames.get(0));
        return ImageStacks.project(frames, ZProjector.AVG_METHOD);
    }
}
