package com.unlistedjobs.archetype;

import java.util.Objects;

/**
 * A single company salary observation in one cell. At least one of min/max/point is present; the weight is
 * fixed per {@link SalarySource} by the {@link EstimationConfig} in use.
 */
public record SalaryObservation(
    String companyId,
    SalarySource source,
    Double salaryMin,
    Double salaryMax,
    Double salaryPoint,
    double weight
) {
    public SalaryObservation {
        Objects.requireNonNull(companyId, "companyId");
        Objects.requireNonNull(source, "source");
        if (salaryMin == null && salaryMax == null && salaryPoint == null) {
            throw new EstimationException(ErrorKind.INVALID_INPUT,
                "Salary observation needs at least one of min, max or point", companyId);
        }
        if (!(weight > 0)) {
            throw new EstimationException(ErrorKind.INVALID_INPUT, "Observation weight must be positive: " + weight, companyId);
        }
    }

    /**
     * Reduces the observation to one value: the point if present, else the range midpoint, else a
     * one-sided estimate from whichever bound is present.
     *
     * @param minOnlyUplift   multiplier applied to a lone minimum (min is taken as ~10% below the median)
     * @param maxOnlyDiscount multiplier applied to a lone maximum
     * @return point estimate
     */
    public double pointValue(double minOnlyUplift, double maxOnlyDiscount) {
        if (salaryPoint != null) return salaryPoint;
        if (salaryMin != null && salaryMax != null) return (salaryMin + salaryMax) / 2.0;
        if (salaryMin != null) return salaryMin * minOnlyUplift;
        return salaryMax * maxOnlyDiscount;
    }
}
