package com.unlistedjobs.archetype;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ArchetypeBatchRunnerTest {

    private static final int YEAR = 2023;
    private static final MetroRoleKey BOSTON_DEVS = new MetroRoleKey("14460", 75);
    private static final MetroRoleKey BOSTON_NURSES = new MetroRoleKey("14460", 67);
    private static final MetroRoleKey NYC_DEVS = new MetroRoleKey("35620", 75);
    private static final MetroRoleKey SEATTLE_DEVS = new MetroRoleKey("42660", 75);

    private static final List<OewsPrior> PRIORS = List.of(
        new OewsPrior(BOSTON_DEVS, "Boston", "Software developers", YEAR, 1000,
            80_000, 100_000, 125_000, 150_000, 175_000, 128_000),
        new OewsPrior(BOSTON_NURSES, "Boston", "Registered nurses", YEAR, 0,
            70_000, 80_000, 95_000, 110_000, 125_000, 96_000),
        new OewsPrior(NYC_DEVS, "New York", "Software developers", YEAR, 400,
            85_000, 105_000, 130_000, 160_000, 190_000, 135_000),
        new OewsPrior(SEATTLE_DEVS, "Seattle", "Software developers", YEAR, 300,
            90_000, 110_000, 140_000, 170_000, 200_000, 143_000));

    private static final PriorProviderInterface PRIOR_PROVIDER = new PriorProviderInterface() {
        @Override
        public List<OewsPrior> loadPriors(int referenceYear) {
            return PRIORS;
        }

        @Override
        public Optional<OewsPrior> getPrior(MetroRoleKey key, int referenceYear) {
            return PRIORS.stream().filter(p -> p.key().equals(key)).findFirst();
        }
    };

    private static EvidenceRow row(String company, MetroRoleKey key, SalarySource source, int contribution, Double point) {
        return new EvidenceRow(company, company, "technology", key, source, contribution, null, null, point);
    }

    private static final List<EvidenceRow> EVIDENCE = List.of(
        row("akamai", BOSTON_DEVS, SalarySource.PAYROLL, 30, 140_000.0),
        row("hubspot", BOSTON_DEVS, SalarySource.H1B_VISA, 5, 132_000.0),
        row("tinyco", BOSTON_DEVS, SalarySource.POSTING, 1, 110_000.0),
        row("datadog", NYC_DEVS, SalarySource.POSTING, 8, null),
        row("etsy", NYC_DEVS, SalarySource.H1B_VISA, 2, 150_000.0));

    private static final List<CbpEstablishment> ESTABLISHMENTS = List.of(
        new CbpEstablishment("14460", "5112", "Software publishers", "technology", SizeClass.FROM_100_TO_249, 20, 3000),
        new CbpEstablishment("14460", "6221", "General hospitals", "healthcare", SizeClass.OVER_1000, 3, 9000));

    private static final Map<String, Map<Integer, Double>> MIX = Map.of(
        "technology", Map.of(75, 0.4, 2, 0.1),
        "healthcare", Map.of(67, 0.25, 2, 0.15));

    private static final List<Archetype> OBSERVED = List.of(new Archetype("hubspot", "HubSpot",
        new MetroRoleKey("14460", 2), Seniority.MID, RecordType.OBSERVED, "technology",
        40, 50, 60, null, null, null, 0.9, Map.of("source", "observed")));

    private static EstimationConfig config(int workers) {
        return EstimationConfig.builder()
            .monteCarloSamples(300)
            .randomSeed(11L)
            .workerThreads(workers)
            .persistMaxAttempts(2)
            .persistBackoffMillis(0)
            .build();
    }

    private static ArchetypeBatchRunner runner(EstimationConfig config, ArchetypeStoreInterface store,
                                               EvidenceAggregatorInterface aggregator) {
        SyntheticTierGenerator generator = new SyntheticTierGenerator(MIX, key -> PRIOR_PROVIDER.getPrior(key, YEAR));
        return new ArchetypeBatchRunner(config, PRIOR_PROVIDER, aggregator, store, generator);
    }

    private static ArchetypeBatchRunner runner(EstimationConfig config, ArchetypeStoreInterface store) {
        return runner(config, store, new EvidenceAggregator(config, EVIDENCE));
    }

    private static BatchOptions persisting() {
        return new BatchOptions(YEAR, null, null, true);
    }

    @Test
    public void testFullBatchProducesAllTiers() {
        InMemoryArchetypeStore store = new InMemoryArchetypeStore();

        BatchResult result = runner(config(1), store).run(persisting(), OBSERVED, ESTABLISHMENTS);
        BatchSummary summary = result.summary();

        assertEquals(3, summary.cellsProcessed());
        assertEquals(1, summary.cellsSkipped(), "nurses cell has no employment total");
        assertEquals(0, summary.cellsFailed());
        assertEquals(1, summary.cellsInsufficient(), "seattle has no evidence");
        assertEquals(0, summary.persistenceFailures());
        assertEquals(2, summary.metrosCovered());
        assertFalse(summary.cancelled());

        Map<MetroRoleKey, Integer> p50ByCell = result.archetypes().stream()
            .filter(a -> a.recordType() == RecordType.KNOWN_EMPLOYER_INFERRED)
            .collect(Collectors.groupingBy(Archetype::key, Collectors.summingInt(Archetype::headcountP50)));
        assertEquals(1000, p50ByCell.get(BOSTON_DEVS));
        assertEquals(400, p50ByCell.get(NYC_DEVS));
        assertEquals(1400L, summary.headcountByRecordType().get(RecordType.KNOWN_EMPLOYER_INFERRED));
        assertEquals(50L, summary.headcountByRecordType().get(RecordType.OBSERVED));

        assertEquals(result.archetypes().size(), store.rows.size());
        assertEquals(1, store.loadTier(RecordType.OBSERVED).size());
        assertEquals(4, store.loadTier(RecordType.KNOWN_EMPLOYER_INFERRED).size());
    }

    @Test
    public void testSyntheticTierIsReconciledAgainstKnownTiers() {
        BatchResult result = runner(config(1), new InMemoryArchetypeStore()).run(persisting(), OBSERVED, ESTABLISHMENTS);
        BatchSummary summary = result.summary();

        // technology: synthetic 1200 + 300; known 1400 + observed 50
        assertEquals(1500 + 2250 + 1350, summary.syntheticBefore());
        List<Archetype> synthetic = result.archetypes().stream()
            .filter(a -> a.recordType() == RecordType.CBP_SYNTHETIC).toList();
        long tech = synthetic.stream().filter(a -> a.industry().equals("technology"))
            .mapToLong(Archetype::headcountP50).sum();
        long health = synthetic.stream().filter(a -> a.industry().equals("healthcare"))
            .mapToLong(Archetype::headcountP50).sum();
        assertEquals(50, tech, 1);
        assertEquals(3600, health, "healthcare has no known evidence and passes through");
        assertEquals(summary.syntheticAfter(), tech + health);
        assertTrue(synthetic.stream().filter(a -> a.industry().equals("technology"))
            .allMatch(a -> a.compositeConfidence() < RecordType.CBP_SYNTHETIC.maxConfidence()));
    }

    @Test
    public void testSalaryOnlyCompanyGetsEstimateButNoArchetype() {
        BatchResult result = runner(config(1), null).run(BatchOptions.dryRun(YEAR), List.of(), List.of());

        assertTrue(result.salaries().stream()
            .anyMatch(s -> s.companyId().equals("tinyco") && s.key().equals(BOSTON_DEVS)));
        assertTrue(result.archetypes().stream().noneMatch(a -> a.companyId().equals("tinyco")));
        SalaryEstimate datadog = result.salaries().stream()
            .filter(s -> s.companyId().equals("datadog")).findFirst().orElseThrow();
        assertTrue(datadog.isPriorOnly(), "headcount evidence without salary keeps the prior");
    }

    @Test
    public void testRerunIsIdempotent() {
        InMemoryArchetypeStore store = new InMemoryArchetypeStore();
        EstimationConfig config = config(1);

        runner(config, store).run(persisting(), OBSERVED, ESTABLISHMENTS);
        Map<Archetype.NaturalKey, Archetype> first = Map.copyOf(store.rows);
        runner(config, store).run(persisting(), OBSERVED, ESTABLISHMENTS);

        assertEquals(first, Map.copyOf(store.rows));
    }

    @Test
    public void testWorkerPoolDoesNotChangeResults() {
        BatchResult serial = runner(config(1), null).run(BatchOptions.dryRun(YEAR), OBSERVED, ESTABLISHMENTS);
        BatchResult parallel = runner(config(4), null).run(BatchOptions.dryRun(YEAR), OBSERVED, ESTABLISHMENTS);

        Comparator<Archetype> order = Comparator.comparing((Archetype a) -> a.naturalKey().toString());
        List<Archetype> a = new ArrayList<>(serial.archetypes());
        List<Archetype> b = new ArrayList<>(parallel.archetypes());
        a.sort(order);
        b.sort(order);
        assertEquals(a, b);
    }

    @Test
    public void testFailingCellDoesNotAbortBatch() {
        EstimationConfig config = config(2);
        EvidenceAggregator real = new EvidenceAggregator(config, EVIDENCE);
        EvidenceAggregatorInterface flaky = new EvidenceAggregatorInterface() {
            @Override
            public List<CompanyEvidence> companyEvidence(MetroRoleKey key) {
                if (key.equals(NYC_DEVS)) throw new IllegalStateException("evidence source unavailable");
                return real.companyEvidence(key);
            }

            @Override
            public Map<String, List<SalaryObservation>> salaryObservations(MetroRoleKey key) {
                return real.salaryObservations(key);
            }
        };
        InMemoryArchetypeStore store = new InMemoryArchetypeStore();

        BatchSummary summary = runner(config, store, flaky).run(persisting(), List.of(), List.of()).summary();

        assertEquals(1, summary.cellsFailed());
        assertEquals(2, summary.cellsProcessed());
        assertTrue(store.rows.keySet().stream().noneMatch(k -> k.metroAreaId().equals("35620")),
            "nothing of the failed cell is written");
        assertEquals(2, store.loadTier(RecordType.KNOWN_EMPLOYER_INFERRED).size());
    }

    @Test
    public void testTransientWriteFailureIsRetried() {
        InMemoryArchetypeStore store = new InMemoryArchetypeStore(1);

        BatchSummary summary = runner(config(1), store).run(persisting(), List.of(), List.of()).summary();

        assertEquals(0, summary.persistenceFailures());
        assertEquals(4, store.loadTier(RecordType.KNOWN_EMPLOYER_INFERRED).size());
    }

    @Test
    public void testPersistentWriteFailureIsCountedAndBatchContinues() {
        InMemoryArchetypeStore store = new InMemoryArchetypeStore(Integer.MAX_VALUE);

        BatchSummary summary = runner(config(1), store).run(persisting(), OBSERVED, ESTABLISHMENTS).summary();

        // observed tier, two cells with archetypes, synthetic tier
        assertEquals(4, summary.persistenceFailures());
        assertEquals(3, summary.cellsProcessed());
        assertTrue(store.rows.isEmpty());
    }

    @Test
    public void testLimitsRestrictCells() {
        BatchSummary summary = runner(config(1), null)
            .run(new BatchOptions(YEAR, 1, 1, false), List.of(), List.of()).summary();

        // first metro 14460, first role 67 (nurses, skipped)
        assertEquals(0, summary.cellsProcessed());
        assertEquals(1, summary.cellsSkipped());

        List<OewsPrior> selected = ArchetypeBatchRunner.selectCells(PRIORS, new BatchOptions(YEAR, 2, null, false));
        assertEquals(3, selected.size());
        assertTrue(selected.stream().noneMatch(p -> p.key().equals(SEATTLE_DEVS)));
    }

    @Test
    public void testCancelledBatchStopsBetweenCells() {
        InMemoryArchetypeStore store = new InMemoryArchetypeStore();
        ArchetypeBatchRunner runner = runner(config(1), store);
        runner.cancel();

        BatchSummary summary = runner.run(persisting(), List.of(), ESTABLISHMENTS).summary();

        assertTrue(summary.cancelled());
        assertEquals(0, summary.cellsProcessed());
        assertTrue(store.rows.isEmpty());
    }

    @Test
    public void testPersistWithoutStoreIsRejected() {
        EstimationException ex = assertThrows(EstimationException.class,
            () -> runner(config(1), null).run(persisting(), List.of(), List.of()));
        assertEquals(ErrorKind.INVALID_INPUT, ex.getErrorKind());
    }

    @Test
    public void testSummaryCountsConditionsByKind() {
        EstimationConfig config = config(1);
        List<EvidenceRow> evidence = new ArrayList<>(EVIDENCE);
        evidence.add(row("etsy", NYC_DEVS, SalarySource.H1B_VISA, 0, 5_000.0));

        BatchSummary summary = runner(config, null, new EvidenceAggregator(config, evidence))
            .run(BatchOptions.dryRun(YEAR), OBSERVED, ESTABLISHMENTS).summary();

        assertEquals(1, summary.discardedObservations());
        Map<ErrorKind, Integer> conditions = summary.conditionCounts();
        assertEquals(1, conditions.get(ErrorKind.MISSING_PRIOR));
        assertEquals(1, conditions.get(ErrorKind.INSUFFICIENT_EVIDENCE));
        assertEquals(1, conditions.get(ErrorKind.DEGENERATE_OBSERVATION));
        assertEquals(0, conditions.get(ErrorKind.PERSISTENCE_FAILURE));
        assertFalse(conditions.containsKey(ErrorKind.INVALID_INPUT));
    }
}
