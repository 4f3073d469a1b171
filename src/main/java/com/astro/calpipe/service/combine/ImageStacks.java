package com.astro.calpipe.service.combine;

import com.astro.calpipe.error.InsufficientFramesException;
import com.astro.calpipe.service.FitsImage;
import ij.ImagePlus;
import ij.ImageStack;
import ij.plugin.ZProjector;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import java.util.List;

final class ImageStacks {
    private ImageStacks() {}

    static void checkShapes(List<float[][]> frames) throws InsufficientFramesException {
        if (frames.isEmpty()) throw new InsufficientFramesException("Nothing to combine");
        int h = frames.get(0).length;
        int w = h == 0 ? 0 : frames.get(0)[0].length;
        for (float[][] f : frames) {
            if (f.length != h || (h > 0 && f[0].length != w)) {
                throw new IllegalArgumentException("Frames differ in size: expected " + w + "x" + h
                        + ", got " + (f.length == 0 ? 0 : f[0].length) + "x" + f.length);
            }
        }
    }

    static float[][] copy(float[][] frame) {
        float[][] d = new float[frame.length][];
        for (int y = 0; y < frame.length; y++) d[y] = frame[y].clone();
        return d;
    }

    static ImagePlus stack(List<float[][]> frames) {
        int h = frames.get(0).length;
        int w = frames.get(0)[0].length;
        ImageStack stack = new ImageStack(w, h);
        int i = 0;
        for (float[][] f : frames) {
            stack.addSlice("frame" + (++i), new FitsImage(f, null).toProcessor());
        }
        return new ImagePlus("stack", stack);
    }

    /** Runs an ImageJ z-projection over all slices and returns the float result. */
    static float[][] project(List<float[][]> frames, int method) {
        ZProjector projector = new ZProjector(stack(frames));
        projector.setMethod(method);
        projector.setStartSlice(1);
        projector.setStopSlice(frames.size());
        projector.doProjection();
        ImageProcessor ip = projector.getProjection().getProcessor();
        FloatProcessor fp = ip instanceof FloatProcessor ? (FloatProcessor) ip : ip.convertToFloatProcessor();
        return FitsImage.fromProcessor(fp);
    }
}
