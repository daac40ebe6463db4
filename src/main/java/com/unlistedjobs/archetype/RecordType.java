package com.unlistedjobs.archetype;

import java.util.Locale;

/**
 * Confidence tier of an archetype. Closed: inference is never labelled as observation.
 * <p>
 * Each tier owns a confidence band; {@link #confidence(double, double)} places a record inside its band
 * according to how much evidence backs it, so observed always outranks known-inferred, which always
 * outranks synthetic.
 */
public enum RecordType {
    OBSERVED("observed", 0.85, 0.95),
    KNOWN_EMPLOYER_INFERRED("known_employer_inferred", 0.20, 0.45),
    CBP_SYNTHETIC("cbp_synthetic", 0.10, 0.20);

    private final String dbValue;
    private final double minConfidence;
    private final double maxConfidence;

    RecordType(String dbValue, double minConfidence, double maxConfidence) {
        this.dbValue = dbValue;
        this.minConfidence = minConfidence;
        this.maxConfidence = maxConfidence;
    }

    public String dbValue() { return dbValue; }

    public double minConfidence() { return minConfidence; }

    public double maxConfidence() { return maxConfidence; }

    /**
     * Composite confidence for a record of this tier backed by {@code evidence} weighted evidence units.
     * Saturates toward the top of the band as {@code 1 - exp(-evidence / scale)}.
     *
     * @param evidence weighted evidence volume (negative treated as 0)
     * @param scale    evidence volume at which ~63% of the band is reached
     * @return confidence within [minConfidence, maxConfidence]
     */
    public double confidence(double evidence, double scale) {
        double volume = Math.max(0.0, evidence);
        double saturation = scale > 0 ? 1.0 - Math.exp(-volume / scale) : 1.0;
        double c = minConfidence + (maxConfidence - minConfidence) * saturation;
        return Math.max(0.0, Math.min(1.0, c));
    }

    /**
     * Pulls an externally supplied confidence into this tier's band.
     */
    public double clamp(double confidence) {
        if (Double.isNaN(confidence)) return minConfidence;
        return Math.max(minConfidence, Math.min(maxConfidence, confidence));
    }

    public static RecordType fromDbValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (RecordType t : values()) {
                if (t.dbValue.equals(normalized)) return t;
            }
        }
        throw new EstimationException(ErrorKind.INVALID_INPUT, "Unknown record type: " + value);
    }
}
