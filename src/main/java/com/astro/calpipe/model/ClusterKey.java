package com.astro.calpipe.model;

import java.util.Comparator;

/** Type/binning/filter combination that clusters and masters are grouped by. */
public record ClusterKey(FrameType type, String binning, String filter) {

    public static final Comparator<ClusterKey> ORDER = Comparator
            .comparing(ClusterKey::type)
            .thenComparing(ClusterKey::binning)
            .thenComparing(k -> k.filter() == null ? "" : k.filter());

    @Override
    public String toString() {
        return type.label() + " " + binning + (filter != null ? " " + filter : "");
    }
}
