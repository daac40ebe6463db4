package com.unlistedjobs.archetype;

/**
 * Error taxonomy of the inference engine. Used by {@link EstimationException} and in run summaries.
 */
public enum ErrorKind {
    /** A metro x role cell has no usable macro data. The cell is skipped. */
    MISSING_PRIOR,
    /** No company clears the minimum-evidence threshold. Expected state, not a failure. */
    INSUFFICIENT_EVIDENCE,
    /** A salary or headcount value outside sane numeric bounds. Only the observation is discarded. */
    DEGENERATE_OBSERVATION,
    /** An archetype write failed after retries. The batch continues. */
    PERSISTENCE_FAILURE,
    /** Malformed input rows or arguments. */
    INVALID_INPUT
}
