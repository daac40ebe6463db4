package com.unlistedjobs.archetype;

import java.util.List;

/**
 * Everything one metro x role cell produced in a run. Computed in full before anything is persisted.
 *
 * @param key          cell
 * @param headcounts   one estimate per company that cleared the evidence threshold
 * @param salaries     one estimate per company with evidence or salary observations
 * @param archetypes   known-employer-inferred archetypes, one per headcount estimate
 */
public record CellResult(
    MetroRoleKey key,
    List<HeadcountEstimate> headcounts,
    List<SalaryEstimate> salaries,
    List<Archetype> archetypes
) {
    public CellResult {
        headcounts = List.copyOf(headcounts);
        salaries = List.copyOf(salaries);
        archetypes = List.copyOf(archetypes);
    }

    /**
     * @return true when no company cleared the evidence threshold, leaving the total unattributed
     */
    public boolean insufficientEvidence() {
        return headcounts.isEmpty();
    }
}
