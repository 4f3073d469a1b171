package com.astro.calpipe.pipeline;

/** What a step leaves on disk for later steps. */
public enum Product {
    RAW_FRAMES,
    MASTER_FRAMES,
    REDUCED_FRAMES,
    ASTROMETRY
}
