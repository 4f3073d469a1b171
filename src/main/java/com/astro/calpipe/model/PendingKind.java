package com.astro.calpipe.model;

import java.util.EnumSet;
import java.util.Set;

/** What a pending ledger row points at, and which calibration ages apply to it. */
public enum PendingKind {
    LIGHT(EnumSet.of(FrameType.BIAS, FrameType.DARK, FrameType.FLAT)),
    MASTER_DARK(EnumSet.of(FrameType.BIAS)),
    MASTER_FLAT(EnumSet.of(FrameType.BIAS, FrameType.DARK));

    private final Set<FrameType> calibrationTypes;

    PendingKind(Set<FrameType> calibrationTypes) {
        this.calibrationTypes = calibrationTypes;
    }

    public Set<FrameType> calibrationTypes() {
        return EnumSet.copyOf(calibrationTypes);
    }

    public static PendingKind forMaster(FrameType type) {
        switch (type) {
            case DARK: return MASTER_DARK;
            case FLAT: return MASTER_FLAT;
            default: throw new IllegalArgumentException("Masters of type " + type + " never wait on other masters");
        }
    }
}
