package com.unlistedjobs.archetype;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Runs a full inference batch over every metro x role cell with a prior.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Cells are estimated independently on a fixed worker pool; a cell that throws is logged and counted,
 *       never aborting the batch. Missing priors are skipped.</li>
 *   <li>With persistence on, each cell's archetypes are upserted in one transaction, retried with backoff.</li>
 *   <li>Once every cell is done, the synthetic tier is generated from establishment data, reconciled against
 *       the observed and known-inferred tiers, and replaces the stored synthetic tier as a whole.</li>
 *   <li>The run ends with headcount and salary summaries.</li>
 * </ul>
 * {@link #cancel()} stops the batch between cells; the synthetic tier is then left untouched.
 *
 * @author Archetype Inference Team
 * @since 1.0
 */
public class ArchetypeBatchRunner {
    private static final Logger logger = LoggerFactory.getLogger(ArchetypeBatchRunner.class);

    private final EstimationConfig config;
    private final PriorProviderInterface priorProvider;
    private final CellEstimator cellEstimator;
    private final ArchetypeStoreInterface store;
    private final SyntheticTierGenerator syntheticTierGenerator;
    private final TierReconciler tierReconciler;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private enum Status { PROCESSED, SKIPPED, FAILED, CANCELLED }

    private record CellOutcome(MetroRoleKey key, Status status, CellResult result, boolean persistFailed) {}

    /**
     * @param store may be null for dry runs only
     */
    public ArchetypeBatchRunner(EstimationConfig config,
                                PriorProviderInterface priorProvider,
                                EvidenceAggregatorInterface evidenceAggregator,
                                ArchetypeStoreInterface store,
                                SyntheticTierGenerator syntheticTierGenerator) {
        this.config = config;
        this.priorProvider = priorProvider;
        this.cellEstimator = new CellEstimator(config, evidenceAggregator);
        this.store = store;
        this.syntheticTierGenerator = syntheticTierGenerator;
        this.tierReconciler = new TierReconciler(config);
    }

    /**
     * Requests a stop. Cells already running finish; no new cell starts.
     */
    public void cancel() {
        cancelled.set(true);
    }

    /**
     * Runs the batch.
     *
     * @param options        batch control surface
     * @param observedTier   externally produced observed archetypes
     * @param establishments establishment classes feeding the synthetic tier
     * @return summary plus every estimate, for export
     */
    public BatchResult run(BatchOptions options, List<Archetype> observedTier, List<CbpEstablishment> establishments) {
        if (options.persist() && store == null) {
            throw new EstimationException(ErrorKind.INVALID_INPUT, "Persistence requested without an archetype store");
        }
        List<OewsPrior> cells = selectCells(priorProvider.loadPriors(options.referenceYear()), options);
        logger.info("Starting batch for {}: {} cells, {} worker(s), persist={}",
            options.referenceYear(), cells.size(), config.workerThreads, options.persist());

        int persistenceFailures = 0;
        if (options.persist() && !observedTier.isEmpty()) {
            if (Utils.retryAction(() -> store.upsertAll(observedTier), config.persistMaxAttempts,
                    config.persistBackoffMillis, "upsert of observed tier") == null) {
                persistenceFailures++;
            }
        }

        List<CellOutcome> outcomes = runCells(cells, options.persist());

        int processed = 0, skipped = 0, failed = 0, insufficient = 0;
        List<HeadcountEstimate> headcounts = new ArrayList<>();
        List<SalaryEstimate> salaries = new ArrayList<>();
        List<Archetype> knownTier = new ArrayList<>();
        for (CellOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
                case CANCELLED -> { }
                case PROCESSED -> {
                    processed++;
                    CellResult r = outcome.result();
                    if (r.insufficientEvidence()) insufficient++;
                    headcounts.addAll(r.headcounts());
                    salaries.addAll(r.salaries());
                    knownTier.addAll(r.archetypes());
                }
            }
            if (outcome.persistFailed()) persistenceFailures++;
        }

        List<Archetype> all = new ArrayList<>(observedTier);
        all.addAll(knownTier);
        long syntheticBefore = 0;
        long syntheticAfter = 0;
        boolean stopped = cancelled.get();
        if (stopped) {
            logger.warn("Batch cancelled; synthetic tier not regenerated");
        } else {
            List<Archetype> rawSynthetic = syntheticTierGenerator.generate(establishments);
            List<Archetype> reconcileInput = new ArrayList<>(all);
            reconcileInput.addAll(rawSynthetic);
            TierReconciler.Result reconciled = tierReconciler.reconcile(reconcileInput);
            syntheticBefore = rawSynthetic.stream().mapToLong(Archetype::headcountP50).sum();
            syntheticAfter = reconciled.adjustedSynthetic().stream().mapToLong(Archetype::headcountP50).sum();
            all.addAll(reconciled.adjustedSynthetic());
            if (options.persist()) {
                Integer written = Utils.retryAction(
                    () -> store.replaceTier(RecordType.CBP_SYNTHETIC, reconciled.adjustedSynthetic()),
                    config.persistMaxAttempts, config.persistBackoffMillis, "replace of synthetic tier");
                if (written == null) persistenceFailures++;
            }
        }

        Map<RecordType, Long> byType = new EnumMap<>(RecordType.class);
        for (RecordType t : RecordType.values()) byType.put(t, 0L);
        for (Archetype a : all) byType.merge(a.recordType(), (long) a.headcountP50(), Long::sum);
        Set<String> metros = headcounts.stream().map(h -> h.key().metroAreaId()).collect(Collectors.toSet());

        int discarded = salaries.stream().mapToInt(SalaryEstimate::discardedCount).sum();

        BatchSummary summary = new BatchSummary(processed, skipped, failed, insufficient, persistenceFailures,
            metros.size(), headcounts.size(), salaries.size(), discarded, byType, syntheticBefore, syntheticAfter,
            stopped);
        logSummary(summary, salaries);
        return new BatchResult(summary, all, salaries);
    }

    private List<CellOutcome> runCells(List<OewsPrior> cells, boolean persist) {
        ExecutorService pool = Executors.newFixedThreadPool(config.workerThreads);
        try {
            List<Future<CellOutcome>> futures = new ArrayList<>(cells.size());
            for (OewsPrior prior : cells) {
                futures.add(pool.submit(() -> processCell(prior, persist)));
            }
            List<CellOutcome> outcomes = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                MetroRoleKey key = cells.get(i).key();
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    logger.error("Cell {} failed: {}", key, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
                    outcomes.add(new CellOutcome(key, Status.FAILED, null, false));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancel();
                    outcomes.add(new CellOutcome(key, Status.CANCELLED, null, false));
                }
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    private CellOutcome processCell(OewsPrior prior, boolean persist) {
        MetroRoleKey key = prior.key();
        if (cancelled.get()) {
            return new CellOutcome(key, Status.CANCELLED, null, false);
        }
        CellResult result;
        try {
            result = cellEstimator.estimate(prior);
        } catch (EstimationException e) {
            if (e.getErrorKind() == ErrorKind.MISSING_PRIOR) {
                logger.warn("Skipping cell: {}", e.getMessage());
                return new CellOutcome(key, Status.SKIPPED, null, false);
            }
            logger.error("Cell {} failed ({}): {}", key, e.getErrorKind(), e.getMessage());
            return new CellOutcome(key, Status.FAILED, null, false);
        } catch (RuntimeException e) {
            logger.error("Cell {} failed: {}", key, e.getMessage(), e);
            return new CellOutcome(key, Status.FAILED, null, false);
        }

        boolean persistFailed = false;
        if (persist && !result.archetypes().isEmpty()) {
            Integer written = Utils.retryAction(() -> store.upsertAll(result.archetypes()),
                config.persistMaxAttempts, config.persistBackoffMillis, "upsert of cell " + key);
            persistFailed = written == null;
        }
        return new CellOutcome(key, Status.PROCESSED, result, persistFailed);
    }

    /**
     * Applies the metro and role caps: the first N distinct area codes and role ids, in sorted order.
     */
    static List<OewsPrior> selectCells(List<OewsPrior> priors, BatchOptions options) {
        Set<String> metros = firstN(priors.stream().map(p -> p.key().metroAreaId())
            .collect(Collectors.toCollection(TreeSet::new)), options.limitMetroAreas());
        Set<Integer> roles = firstN(priors.stream().map(p -> p.key().canonicalRoleId())
            .collect(Collectors.toCollection(TreeSet::new)), options.limitRoles());
        return priors.stream()
            .filter(p -> metros.contains(p.key().metroAreaId()) && roles.contains(p.key().canonicalRoleId()))
            .collect(Collectors.toList());
    }

    private static <T> Set<T> firstN(TreeSet<T> sorted, Integer limit) {
        if (limit == null) return sorted;
        return sorted.stream().limit(limit).collect(Collectors.toCollection(HashSet::new));
    }

    private static void logSummary(BatchSummary s, List<SalaryEstimate> salaries) {
        logger.info("Cells: {} processed ({} without qualifying evidence), {} skipped, {} failed, {} persistence failures{}",
            s.cellsProcessed(), s.cellsInsufficient(), s.cellsSkipped(), s.cellsFailed(), s.persistenceFailures(),
            s.cancelled() ? " (cancelled)" : "");
        logger.info("Headcount: {} estimates across {} metros; attributed by tier {}",
            s.headcountEstimates(), s.metrosCovered(), s.headcountByRecordType());
        logger.info("Synthetic tier: {} -> {} positions after reconciliation", s.syntheticBefore(), s.syntheticAfter());
        logger.info("Conditions: {}", s.conditionCounts());
        if (salaries.isEmpty()) {
            logger.info("Salary: no estimates");
            return;
        }
        SummaryStatistics shrinkage = new SummaryStatistics();
        salaries.forEach(e -> shrinkage.addValue(e.shrinkageFactor()));
        long priorOnly = salaries.stream().filter(SalaryEstimate::isPriorOnly).count();
        logger.info("Salary: {} estimates ({} prior-only); shrinkage mean {} min {} max {}",
            salaries.size(), priorOnly, String.format("%.3f", shrinkage.getMean()),
            String.format("%.3f", shrinkage.getMin()), String.format("%.3f", shrinkage.getMax()));
    }
}
