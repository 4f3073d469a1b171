package com.astro.calpipe.service.combine;

import com.astro.calpipe.error.InsufficientFramesException;
import java.util.List;

/**
 * Per-pixel mean after iteratively rejecting values farther than {@code sigma} standard
 * deviations from the mean of the remaining values.
 */
public class SigmaClippedMeanCombine implements CombineStrategy {

    private static final int MAX_ITERATIONS = 5;

    private final double sigma;

    public SigmaClippedMeanCombine(double sigma) {
        if (sigma <= 0) throw new IllegalArgumentException("sigma must be positive: " + sigma);
        this.sigma = sigma;
    }

    @Override
    public String name() {
        return "sigma-clipped-mean";
    }

    @Override
    public float[][] combine(List<float[][]> frames) throws InsufficientFramesException {
        ImageStacks.checkShapes(frames);
        if (frames.size() == 1) return ImageStacks.copy(frames.get(0));

        int n = frames.size();
        int h = frames.get(0).length;
        int w = frames.get(0)[0].length;
        float[][] out = new float[h][w];
        double[] values = new double[n];
        boolean[] kept = new boolean[n];

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                for (int i = 0; i < n; i++) {
                    values[i] = frames.get(i)[y][x];
                    kept[i] = true;
                }
                out[y][x] = (float) clippedMean(values, kept);
            }
        }
        return out;
    }

    double clippedMean(double[] values, boolean[] kept) {
        double mean = 0;
        for (int iter = 0; iter < MAX_ITERATIONS; iter++) {
            double sum = 0;
            int count = 0;
            for (int i = 0; i < values.length; i++) {
                if (kept[i]) { sum += values[i]; count++; }
            }
            mean = sum / count;
            if (count <= 2) return mean;

            double sq = 0;
            for (int i = 0; i < values.length; i++) {
                if (kept[i]) sq += (values[i] - mean) * (values[i] - mean);
            }
            double limit = sigma * Math.sqrt(sq / (count - 1));
            if (limit == 0) return mean;

            int rejected = 0;
            for (int i = 0; i < values.length; i++) {
                if (kept[i] && Math.abs(values[i] - mean) > limit) rejected++;
            }
            // a narrow sigma can reject everything; keep the last mean then
            if (rejected == 0 || rejected == count) return mean;
            for (int i = 0; i < values.length; i++) {
                if (kept[i] && Math.abs(values[i] - mean) > limit) kept[i] = false;
            }
        }
        double sum = 0;
        int count = 0;
        for (int i = 0; i < values.length; i++) {
            if (kept[i]) { sum += values[i]; count++; }
        }
        return count == 0 ? mean : sum / count;
    }
}
