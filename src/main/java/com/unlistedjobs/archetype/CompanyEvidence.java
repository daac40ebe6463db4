package com.unlistedjobs.archetype;

/**
 * Per-company headcount evidence summary for one metro x role cell.
 * <p>
 * {@code evidenceShare} is {@code totalWeightedEvidence / sum(all companies in the cell)}; across a cell the
 * shares sum to 1, or the company list is empty.
 */
public record CompanyEvidence(
    String companyId,
    String companyName,
    String industry,
    int postingCount,
    int visaCount,
    int payrollCount,
    double totalWeightedEvidence,
    double evidenceShare
) {
    public CompanyEvidence {
        if (postingCount < 0 || visaCount < 0 || payrollCount < 0) {
            throw new EstimationException(ErrorKind.INVALID_INPUT, "Evidence counts cannot be negative", companyId);
        }
        if (totalWeightedEvidence < 0 || Double.isNaN(totalWeightedEvidence)) {
            throw new EstimationException(ErrorKind.INVALID_INPUT,
                "Weighted evidence must be a non-negative number: " + totalWeightedEvidence, companyId);
        }
    }

    public CompanyEvidence withEvidenceShare(double share) {
        return new CompanyEvidence(companyId, companyName, industry, postingCount, visaCount, payrollCount,
            totalWeightedEvidence, share);
    }

}
