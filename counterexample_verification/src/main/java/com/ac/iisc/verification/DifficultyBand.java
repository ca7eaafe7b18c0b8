package com.ac.iisc.verification;

import java.util.Locale;

/** Difficulty label of a question, as shipped with the benchmark. */
public enum DifficultyBand
{
    SIMPLE("simple"),
    MODERATE("moderate"),
    CHALLENGING("challenging");

    private final String label;

    DifficultyBand(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /** Band for a label (case-insensitive), or null when the label is unknown or missing. */
    public static DifficultyBand fromLabel(String raw) {
        if (raw == null) return null;
        String t = raw.trim().toLowerCase(Locale.ROOT);
        for (DifficultyBand b : values()) {
            if (b.label.equals(t)) return b;
        }
        return null;
    }
}
