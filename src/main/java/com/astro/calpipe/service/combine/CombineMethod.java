package com.astro.calpipe.service.combine;

import java.util.Locale;

/** Names accepted by {@code masters.combine}. */
public enum CombineMethod {
    MEDIAN("median"),
    MEAN("mean"),
    SIGMA_CLIPPED_MEAN("sigma-clipped-mean");

    private final String configName;

    CombineMethod(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public CombineStrategy create(double sigma) {
        switch (this) {
            case MEAN: return new MeanCombine();
            case SIGMA_CLIPPED_MEAN: return new SigmaClippedMeanCombine(sigma);
            default: return new MedianCombine();
        }
    }

    public static CombineMethod fromName(String name) {
        String n = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (CombineMethod m : values()) {
            if (m.configName.equals(n)) return m;
        }
        throw new IllegalArgumentException("Unknown combine method '" + name
                + "' (expected median, mean or sigma-clipped-mean)");
    }

    public static CombineStrategy strategy(String name, double sigma) {
        return fromName(name).create(sigma);
    }
}
