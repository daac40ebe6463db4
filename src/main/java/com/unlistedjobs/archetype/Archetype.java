package com.unlistedjobs.archetype;

import java.util.Map;
import java.util.Objects;

/**
 * Persisted, merged estimate for one (company, metro, role, seniority) combination in one confidence tier.
 * <p>
 * Upserted by its natural key {@link #naturalKey()}. Salary fields are nullable (synthetic rows without a
 * wage prior). {@code evidenceSummary} is stored as JSON.
 */
public record Archetype(
    String companyId,
    String companyName,
    MetroRoleKey key,
    Seniority seniority,
    RecordType recordType,
    String industry,
    int headcountP10,
    int headcountP50,
    int headcountP90,
    Double salaryP25,
    Double salaryP50,
    Double salaryP75,
    double compositeConfidence,
    Map<String, Object> evidenceSummary
) {
    public Archetype {
        Objects.requireNonNull(companyId, "companyId");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(seniority, "seniority");
        Objects.requireNonNull(recordType, "recordType");
        industry = industry == null || industry.isBlank() ? EvidenceRow.UNKNOWN_INDUSTRY : industry;
        if (headcountP10 < 0 || headcountP10 > headcountP50 || headcountP50 > headcountP90) {
            throw new EstimationException(ErrorKind.INVALID_INPUT, "Invalid headcount range "
                + headcountP10 + "/" + headcountP50 + "/" + headcountP90, companyId + "@" + key);
        }
        if (compositeConfidence < 0.0 || compositeConfidence > 1.0) {
            throw new EstimationException(ErrorKind.INVALID_INPUT,
                "Composite confidence outside [0,1]: " + compositeConfidence, companyId + "@" + key);
        }
        evidenceSummary = evidenceSummary == null ? Map.of() : Map.copyOf(evidenceSummary);
    }

    /**
     * Natural upsert key: company, metro, role, seniority and tier.
     */
    public record NaturalKey(String companyId, String metroAreaId, int canonicalRoleId,
                             Seniority seniority, RecordType recordType) {}

    public NaturalKey naturalKey() {
        return new NaturalKey(companyId, key.metroAreaId(), key.canonicalRoleId(), seniority, recordType);
    }

    /**
     * Copy with scaled headcount and confidence. Used only for the synthetic tier's residual adjustment.
     */
    public Archetype withHeadcountAndConfidence(int p10, int p50, int p90, double confidence) {
        return new Archetype(companyId, companyName, key, seniority, recordType, industry, p10, p50, p90,
            salaryP25, salaryP50, salaryP75, confidence, evidenceSummary);
    }
}
