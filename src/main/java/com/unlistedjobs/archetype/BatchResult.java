package com.unlistedjobs.archetype;

import java.util.List;

/**
 * Output of one batch run: counters plus everything that was estimated, for export.
 *
 * @param summary    run counters
 * @param archetypes all three tiers, the synthetic tier already reconciled
 * @param salaries   salary estimates, including those of salary-only companies
 */
public record BatchResult(BatchSummary summary, List<Archetype> archetypes, List<SalaryEstimate> salaries) {
    public BatchResult {
        archetypes = List.copyOf(archetypes);
        salaries = List.copyOf(salaries);
    }
}
