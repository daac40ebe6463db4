package com.unlistedjobs.archetype;

import java.util.Objects;

/**
 * One raw evidence row as produced by the collection connectors (postings, visa filings, payroll extracts).
 * <p>
 * A row can contribute to headcount (via {@code headcountContribution}), to salary inference (via any of
 * the salary fields), or both. Salary fields are nullable.
 *
 * @param companyId             company identity
 * @param companyName           display name, may be null
 * @param industry              industry category used for tier reconciliation, "other" when unknown
 * @param key                   metro x role cell the row belongs to
 * @param source                closed source type
 * @param headcountContribution number of records this row stands for (usually 1)
 * @param salaryMin             posted/declared minimum, nullable
 * @param salaryMax             posted/declared maximum, nullable
 * @param salaryPoint           exact salary, nullable
 */
public record EvidenceRow(
    String companyId,
    String companyName,
    String industry,
    MetroRoleKey key,
    SalarySource source,
    int headcountContribution,
    Double salaryMin,
    Double salaryMax,
    Double salaryPoint
) {
    public static final String UNKNOWN_INDUSTRY = "other";

    public EvidenceRow {
        Objects.requireNonNull(companyId, "companyId");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(source, "source");
        if (headcountContribution < 0) {
            throw new EstimationException(ErrorKind.INVALID_INPUT,
                "Negative headcount contribution " + headcountContribution, companyId);
        }
        industry = industry == null || industry.isBlank() ? UNKNOWN_INDUSTRY : industry.trim();
    }

    /**
     * @return true when the row carries at least one salary figure
     */
    public boolean hasSalary() {
        return salaryMin != null || salaryMax != null || salaryPoint != null;
    }
}
