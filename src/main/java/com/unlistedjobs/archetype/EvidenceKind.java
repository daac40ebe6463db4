package com.unlistedjobs.archetype;

/**
 * Headcount evidence categories. Each carries a distinct reliability weight in {@link EstimationConfig}.
 */
public enum EvidenceKind {
    /** Job posting (weakest: a posting is not a hire). */
    POSTING,
    /** Visa filing (an actual offer). */
    VISA,
    /** Payroll row (a confirmed employee). */
    PAYROLL
}
