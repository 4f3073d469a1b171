package com.astro.calpipe.service.combine;

import com.astro.calpipe.error.InsufficientFramesException;
import java.util.List;

/**
 * Stacks same-shaped frames into one. Implementations must be deterministic: the same frames
 * in the same order always give the same pixels.
 */
public interface CombineStrategy {

    String name();

    float[][] combine(List<float[][]> frames) throws InsufficientFramesException;
}
