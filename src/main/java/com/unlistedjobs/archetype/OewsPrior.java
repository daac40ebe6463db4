package com.unlistedjobs.archetype;

/**
 * OEWS macro prior for one metro x role cell and reference year.
 * <p>
 * Read-only input. Wages are annual. {@code employmentTotal} may be zero or negative when the
 * survey suppressed the employment figure; the batch runner treats that as a missing prior.
 */
public record OewsPrior(
    MetroRoleKey key,
    String areaName,
    String roleName,
    int referenceYear,
    int employmentTotal,
    double wageP10,
    double wageP25,
    double wageP50,
    double wageP75,
    double wageP90,
    double wageMean
) {

    /**
     * @return true when the wage distribution is usable as a salary prior
     */
    public boolean hasWagePrior() {
        return wageP50 > 0;
    }

    /**
     * @return true when the employment total can be allocated
     */
    public boolean hasEmploymentPrior() {
        return employmentTotal > 0;
    }
}
