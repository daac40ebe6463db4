package com.unlistedjobs.archetype;

import java.util.List;
import java.util.Map;

/**
 * Evidence lookup for one metro x role cell. Pure read, no side effects.
 */
public interface EvidenceAggregatorInterface {
    /**
     * Headcount evidence for every company that clears the minimum-evidence threshold in the cell.
     * Shares are normalised over the returned companies and sum to 1 (or the list is empty).
     * @param key metro x role cell
     * @return company evidence, ordered by company id
     */
    List<CompanyEvidence> companyEvidence(MetroRoleKey key);

    /**
     * Salary observations in the cell grouped by company id, including companies below the headcount threshold.
     * @param key metro x role cell
     * @return observations per company, ordered by company id
     */
    Map<String, List<SalaryObservation>> salaryObservations(MetroRoleKey key);
}
