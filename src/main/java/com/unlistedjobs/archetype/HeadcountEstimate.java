package com.unlistedjobs.archetype;

/**
 * Allocated headcount for one company in one cell. {@code p10 <= p50 <= p90}; within a cell the p50 values sum
 * to the OEWS employment total.
 */
public record HeadcountEstimate(
    String companyId,
    MetroRoleKey key,
    int p10,
    int p50,
    int p90,
    double evidenceScore,
    double shareOfMetro,
    int employmentTotal,
    int companiesInCell,
    String method
) {
    public static final String METHOD = "dirichlet_shrinkage";

    public HeadcountEstimate {
        if (p10 > p50 || p50 > p90) {
            throw new IllegalStateException("Headcount percentiles out of order for " + companyId
                + ": " + p10 + "/" + p50 + "/" + p90);
        }
    }
}
