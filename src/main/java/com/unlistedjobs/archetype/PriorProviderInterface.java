package com.unlistedjobs.archetype;

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookup of OEWS macro priors keyed by metro x role.
 */
public interface PriorProviderInterface {
    /**
     * Returns every cell with a prior for the reference year, in a stable order (area, then role).
     * @param referenceYear OEWS reference year
     * @return priors; rows with unusable employment are included and left to the caller to skip
     */
    List<OewsPrior> loadPriors(int referenceYear);

    /**
     * Looks up a single cell.
     * @param key metro x role cell
     * @param referenceYear OEWS reference year
     * @return prior if present
     */
    Optional<OewsPrior> getPrior(MetroRoleKey key, int referenceYear);
}
