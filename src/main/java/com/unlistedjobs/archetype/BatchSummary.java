package com.unlistedjobs.archetype;

import java.util.EnumMap;
import java.util.Map;

/**
 * Counters of one batch run.
 *
 * @param cellsProcessed          cells fully estimated (including those with no qualifying company)
 * @param cellsSkipped            cells skipped for a missing prior
 * @param cellsFailed             cells that threw; their output was discarded
 * @param cellsInsufficient       processed cells where no company cleared the evidence threshold
 * @param persistenceFailures     writes that still failed after retries (cells or the synthetic tier)
 * @param metrosCovered           distinct metro areas with at least one headcount estimate
 * @param headcountEstimates      headcount estimates produced
 * @param salaryEstimates         salary estimates produced
 * @param discardedObservations   salary observations dropped as degenerate across all estimates
 * @param headcountByRecordType   total attributed p50 headcount per tier after reconciliation
 * @param syntheticBefore         synthetic headcount before reconciliation
 * @param syntheticAfter          synthetic headcount after reconciliation
 * @param cancelled               true when the run was stopped between cells
 */
public record BatchSummary(
    int cellsProcessed,
    int cellsSkipped,
    int cellsFailed,
    int cellsInsufficient,
    int persistenceFailures,
    int metrosCovered,
    int headcountEstimates,
    int salaryEstimates,
    int discardedObservations,
    Map<RecordType, Long> headcountByRecordType,
    long syntheticBefore,
    long syntheticAfter,
    boolean cancelled
) {
    public BatchSummary {
        headcountByRecordType = Map.copyOf(headcountByRecordType);
    }

    /**
     * Non-fatal conditions of the run by kind. Failed cells are not broken down.
     */
    public Map<ErrorKind, Integer> conditionCounts() {
        Map<ErrorKind, Integer> counts = new EnumMap<>(ErrorKind.class);
        counts.put(ErrorKind.MISSING_PRIOR, cellsSkipped);
        counts.put(ErrorKind.INSUFFICIENT_EVIDENCE, cellsInsufficient);
        counts.put(ErrorKind.DEGENERATE_OBSERVATION, discardedObservations);
        counts.put(ErrorKind.PERSISTENCE_FAILURE, persistenceFailures);
        return counts;
    }
}
