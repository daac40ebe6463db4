package com.unlistedjobs.archetype;

/**
 * Posterior wage distribution for one company in one cell.
 * <p>
 * {@code shrinkageFactor} is the fraction of posterior precision contributed by company observations
 * (0 = pure OEWS prior). {@code discardedCount} counts observations dropped as degenerate.
 */
public record SalaryEstimate(
    String companyId,
    MetroRoleKey key,
    double p10,
    double p25,
    double p50,
    double p75,
    double p90,
    double mean,
    double stddev,
    int observationCount,
    int discardedCount,
    double effectiveSampleSize,
    double shrinkageFactor,
    double oewsMedian,
    String method
) {
    public static final String METHOD = "bayesian_shrinkage";

    public SalaryEstimate {
        if (!(p10 <= p25 && p25 <= p50 && p50 <= p75 && p75 <= p90)) {
            throw new IllegalStateException("Salary percentiles out of order for " + companyId + " in " + key);
        }
        if (shrinkageFactor < 0.0 || shrinkageFactor > 1.0) {
            throw new IllegalStateException("Shrinkage factor outside [0,1]: " + shrinkageFactor);
        }
    }

    /**
     * @return true when no company observation survived and the estimate is the OEWS prior itself
     */
    public boolean isPriorOnly() {
        return effectiveSampleSize == 0.0;
    }
}
