package com.astro.calpipe.model;

import java.util.Locale;

public enum FrameType {
    BIAS("bias", "KW-MBIAS", "KW-MBAGE"),
    DARK("dark", "KW-MDARK", "KW-MDAGE"),
    FLAT("flat", "KW-MFLAT", "KW-MFAGE"),
    LIGHT("light", null, null);

    private final String label;
    private final String masterKey;
    private final String ageKey;

    FrameType(String label, String masterKey, String ageKey) {
        this.label = label;
        this.masterKey = masterKey;
        this.ageKey = ageKey;
    }

    /** Lower-case name used in master file names and ledger columns. */
    public String label() { return label; }

    /** Header keyword holding the path of the master of this type used on a product. */
    public String masterKey() { return masterKey; }

    /** Header keyword holding the relative age (days) of that master. */
    public String ageKey() { return ageKey; }

    public boolean isCalibration() { return this != LIGHT; }

    /**
     * Classifies an IMAGETYP header value. SBIG/MaxIm write "Bias Frame", "Dark Frame",
     * "Flat Field", "Light Frame"; other software uses "zero" or "object".
     */
    public static FrameType fromImageType(String imageType) {
        if (imageType == null) return null;
        String t = imageType.toLowerCase(Locale.ROOT);
        if (t.contains("bias") || t.contains("zero")) return BIAS;
        if (t.contains("dark")) return DARK;
        if (t.contains("flat")) return FLAT;
        if (t.contains("light") || t.contains("object") || t.contains("science")) return LIGHT;
        return null;
    }

    public static FrameType fromLabel(String label) {
        for (FrameType type : values()) {
            if (type.label.equalsIgnoreCase(label)) return type;
        }
        throw new IllegalArgumentException("Unknown frame type: " + label);
    }
}
