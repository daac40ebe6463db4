package com.unlistedjobs.archetype;

import java.util.Locale;

/**
 * Seniority band of an archetype. The inference engine emits {@link #MID}; observed rows may carry any band.
 */
public enum Seniority {
    ENTRY("entry"),
    MID("mid"),
    SENIOR("senior"),
    LEAD("lead"),
    EXECUTIVE("executive");

    private final String dbValue;

    Seniority(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() { return dbValue; }

    public static Seniority fromDbValue(String value) {
        if (value == null || value.isBlank()) return MID;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Seniority s : values()) {
            if (s.dbValue.equals(normalized)) return s;
        }
        throw new EstimationException(ErrorKind.INVALID_INPUT, "Unknown seniority: " + value);
    }
}
