package com.astro.calpipe.service.combine;

import com.astro.calpipe.error.InsufficientFramesException;
import ij.plugin.ZProjector;
import java.util.List;

/** Per-pixel median. Robust against cosmic rays and satellite trails in single frames. */
public class MedianCombine implements CombineStrategy {

    @Override
    public String name() {
        return "median";
    }

    @Override
    public float[][] combine(List<float[][]> frames) throws InsufficientFramesException {
        ImageStacks.checkShapes(frames);
        if (frames.size() == 1) return ImageStacks.copy(frames.get(0));
        return ImageStacks.project(frames, ZProjector.MEDIAN_METHOD);
    }
}
