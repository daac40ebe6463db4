package com.unlistedjobs.archetype;

/**
 * Batch control surface.
 *
 * @param referenceYear    OEWS reference year of the priors to use
 * @param limitMetroAreas  debug cap on the number of metro areas (first N by area code), null for all
 * @param limitRoles       debug cap on the number of canonical roles (first N by id), null for all
 * @param persist          write archetypes to the store; false is a dry run
 */
public record BatchOptions(int referenceYear, Integer limitMetroAreas, Integer limitRoles, boolean persist) {
    public BatchOptions {
        if (limitMetroAreas != null && limitMetroAreas < 1) {
            throw new EstimationException(ErrorKind.INVALID_INPUT, "limitMetroAreas must be >= 1");
        }
        if (limitRoles != null && limitRoles < 1) {
            throw new EstimationException(ErrorKind.INVALID_INPUT, "limitRoles must be >= 1");
        }
    }

    public static BatchOptions dryRun(int referenceYear) {
        return new BatchOptions(referenceYear, null, null, false);
    }
}
