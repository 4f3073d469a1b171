package com.astro.calpipe.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Classified content of one night's {@code Raw} directory. Empty for a night that does not exist.
 *
 * @param unreadable files that could not be classified, with the reason
 */
public record NightIndex(NightDirectory night, List<RawFrame> calibrationFrames,
                         List<LightFrame> lightFrames, Map<Path, String> unreadable) {

    public static NightIndex empty(NightDirectory night) {
        return new NightIndex(night, List.of(), List.of(), Map.of());
    }

    public boolean isEmpty() {
        return calibrationFrames.isEmpty() && lightFrames.isEmpty();
    }

    public List<RawFrame> framesOf(FrameType type) {
        return calibrationFrames.stream().filter(f -> f.type() == type).toList();
    }
}
