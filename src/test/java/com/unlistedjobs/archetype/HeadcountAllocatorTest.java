package com.unlistedjobs.archetype;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HeadcountAllocatorTest {

    private static final MetroRoleKey CELL = new MetroRoleKey("14460", 75);

    private static CompanyEvidence evidence(String id, double weighted) {
        return new CompanyEvidence(id, id.toUpperCase(), "technology", 0, 0, 0, weighted, 0.0);
    }

    private static List<CompanyEvidence> normalised(List<CompanyEvidence> raw) {
        double total = raw.stream().mapToDouble(CompanyEvidence::totalWeightedEvidence).sum();
        List<CompanyEvidence> out = new ArrayList<>();
        raw.forEach(ce -> out.add(ce.withEvidenceShare(ce.totalWeightedEvidence() / total)));
        return out;
    }

    private static void assertInvariants(List<HeadcountEstimate> estimates, int total) {
        int sum = 0;
        for (HeadcountEstimate e : estimates) {
            assertTrue(e.p10() <= e.p50(), "p10 <= p50 for " + e.companyId());
            assertTrue(e.p50() <= e.p90(), "p50 <= p90 for " + e.companyId());
            assertTrue(e.p10() >= 0, "non-negative p10 for " + e.companyId());
            sum += e.p50();
        }
        assertEquals(total, sum, "p50 column must sum to the employment total");
    }

    @Test
    public void testTwoCompanyScenarioFollowsDirichletShares() {
        HeadcountAllocator allocator = new HeadcountAllocator(EstimationConfig.defaults());
        List<CompanyEvidence> evidence = normalised(List.of(evidence("big", 90.0), evidence("small", 10.0)));

        List<HeadcountEstimate> estimates = allocator.allocate(CELL, 1000, evidence);

        assertEquals(2, estimates.size());
        assertInvariants(estimates, 1000);
        HeadcountEstimate big = estimates.get(0);
        HeadcountEstimate small = estimates.get(1);
        assertEquals("big", big.companyId());
        assertEquals(881, big.p50(), 15);
        assertEquals(119, small.p50(), 15);
        assertTrue(big.p10() < big.p50() && big.p50() < big.p90(), "posterior spread expected for a two-way split");
        assertEquals(HeadcountEstimate.METHOD, big.method());
        assertEquals(2, big.companiesInCell());
        assertEquals(0.9, big.shareOfMetro(), 1e-9);
        assertEquals(90.0, big.evidenceScore(), 1e-9);
    }

    @Test
    public void testAllocationIsDeterministicForFixedSeed() {
        EstimationConfig config = EstimationConfig.builder().randomSeed(42L).build();
        List<CompanyEvidence> evidence = normalised(List.of(
            evidence("a", 3.0), evidence("b", 7.5), evidence("c", 1.0), evidence("d", 12.0)));

        List<HeadcountEstimate> first = new HeadcountAllocator(config).allocate(CELL, 437, evidence);
        List<HeadcountEstimate> second = new HeadcountAllocator(config).allocate(CELL, 437, evidence);

        assertEquals(first, second);
    }

    @Test
    public void testSeedDependsOnCellAndBaseSeed() {
        HeadcountAllocator unseeded = new HeadcountAllocator(EstimationConfig.defaults());
        HeadcountAllocator seeded = new HeadcountAllocator(EstimationConfig.builder().randomSeed(7L).build());

        assertEquals(unseeded.seedFor(CELL), unseeded.seedFor(new MetroRoleKey("14460", 75)));
        assertNotEquals(unseeded.seedFor(CELL), unseeded.seedFor(new MetroRoleKey("14460", 76)));
        assertNotEquals(unseeded.seedFor(CELL), seeded.seedFor(CELL));
    }

    @Test
    public void testSingleCompanyReceivesFullTotal() {
        HeadcountAllocator allocator = new HeadcountAllocator(EstimationConfig.defaults());

        List<HeadcountEstimate> estimates = allocator.allocate(CELL, 250, normalised(List.of(evidence("only", 2.0))));

        assertEquals(1, estimates.size());
        HeadcountEstimate only = estimates.get(0);
        assertEquals(250, only.p10());
        assertEquals(250, only.p50());
        assertEquals(250, only.p90());
        assertEquals(1.0, only.shareOfMetro(), 1e-9);
    }

    @Test
    public void testNoQualifyingCompanyProducesNoRows() {
        HeadcountAllocator allocator = new HeadcountAllocator(EstimationConfig.defaults());

        assertTrue(allocator.allocate(CELL, 500, List.of()).isEmpty());
    }

    @Test
    public void testNonPositiveTotalIsMissingPrior() {
        HeadcountAllocator allocator = new HeadcountAllocator(EstimationConfig.defaults());
        List<CompanyEvidence> evidence = normalised(List.of(evidence("a", 2.0), evidence("b", 2.0)));

        EstimationException ex = assertThrows(EstimationException.class, () -> allocator.allocate(CELL, 0, evidence));
        assertEquals(ErrorKind.MISSING_PRIOR, ex.getErrorKind());
        assertEquals(CELL.toString(), ex.getWhere());
    }

    @Test
    public void testEverySampleSumsToTotal() {
        HeadcountAllocator allocator = new HeadcountAllocator(EstimationConfig.defaults());
        double[] alphas = {0.7, 3.2, 11.0, 0.05};

        double[][] draws = allocator.sampleHeadcounts(alphas, 97, 300, 123L);

        for (int s = 0; s < 300; s++) {
            double sum = 0;
            for (double[] company : draws) sum += company[s];
            assertEquals(97.0, sum, 0.0, "draw " + s);
        }
    }

    @Test
    public void testInvariantsAcrossCellShapes() {
        EstimationConfig config = EstimationConfig.builder().monteCarloSamples(200).randomSeed(5L).build();
        HeadcountAllocator allocator = new HeadcountAllocator(config);
        int[] totals = {2, 7, 50, 1234};
        int[] sizes = {2, 3, 10};
        for (int total : totals) {
            for (int n : sizes) {
                List<CompanyEvidence> raw = new ArrayList<>();
                for (int j = 0; j < n; j++) {
                    raw.add(evidence("c" + j, 1.0 + j * j * 0.5));
                }
                List<HeadcountEstimate> estimates =
                    allocator.allocate(new MetroRoleKey("M" + total, n), total, normalised(raw));
                assertEquals(n, estimates.size());
                assertInvariants(estimates, total);
            }
        }
    }

    @Test
    public void testFloorAppliesWhenPositionsSuffice() {
        EstimationConfig config = EstimationConfig.builder().monteCarloSamples(300).build();
        HeadcountAllocator allocator = new HeadcountAllocator(config);
        List<CompanyEvidence> evidence = normalised(List.of(
            evidence("dominant", 500.0), evidence("tiny1", 1.0), evidence("tiny2", 1.0)));

        List<HeadcountEstimate> estimates = allocator.allocate(CELL, 20, evidence);

        assertInvariants(estimates, 20);
        for (HeadcountEstimate e : estimates) {
            assertTrue(e.p50() >= 1, "every company with evidence keeps at least one position");
            assertTrue(e.p10() >= 1);
        }
    }
}
