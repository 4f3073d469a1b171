package com.astro.calpipe.model;

/** Plate-solved field centre in degrees. */
public record CelestialPoint(double ra, double dec) {
}
