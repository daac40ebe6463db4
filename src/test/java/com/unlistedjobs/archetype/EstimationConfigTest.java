package com.unlistedjobs.archetype;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class EstimationConfigTest {

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testDefaults() {
        EstimationConfig c = EstimationConfig.defaults();

        assertEquals(5.0, c.priorWeight, 0.0);
        assertEquals(1.0, c.concentrationScale, 0.0);
        assertEquals(1.0, c.minEvidenceThreshold, 0.0);
        assertEquals(1000, c.monteCarloSamples);
        assertNull(c.randomSeed);
        assertEquals(10.0, c.priorEffectiveN, 0.0);
        assertEquals(0.25, c.priorCv, 0.0);
        assertEquals(20_000, c.salaryFloor, 0.0);
        assertEquals(1_000_000, c.salaryCeiling, 0.0);
        assertEquals(0.9, c.syntheticConfidenceDiscount, 0.0);
        assertEquals(0.5, c.headcountWeight(EvidenceKind.POSTING), 0.0);
        assertEquals(2.0, c.headcountWeight(EvidenceKind.VISA), 0.0);
        assertEquals(3.0, c.headcountWeight(EvidenceKind.PAYROLL), 0.0);
        assertEquals(5.0, c.salaryWeight(SalarySource.STATE_PAYROLL), 0.0);
        assertEquals(4.0, c.salaryWeight(SalarySource.CBA_PAY_TABLE), 0.0);
        assertEquals(2.0, c.salaryWeight(SalarySource.ATS_SMARTRECRUITERS), 0.0);
        assertEquals(1.5, c.salaryWeight(SalarySource.POSTING), 0.0);
        for (SalarySource source : SalarySource.values()) {
            assertTrue(c.salaryWeight(source) > 0, source.code());
        }
    }

    @Test
    public void testJsonOverridesSubsetOfKeys() throws IOException {
        EstimationConfig c = EstimationConfig.fromJson(json("{"
            + "\"prior_weight\": 8.0,"
            + "\"random_seed\": 20240101,"
            + "\"salary_ceiling\": 750000,"
            + "\"headcount_weights\": {\"visa\": 2.5},"
            + "\"salary_weights\": {\"posting\": 1.0}"
            + "}"));

        assertEquals(8.0, c.priorWeight, 0.0);
        assertEquals(20240101L, c.randomSeed);
        assertEquals(20_000, c.salaryFloor, 0.0);
        assertEquals(750_000, c.salaryCeiling, 0.0);
        assertEquals(2.5, c.headcountWeight(EvidenceKind.VISA), 0.0);
        assertEquals(3.0, c.headcountWeight(EvidenceKind.PAYROLL), 0.0);
        assertEquals(1.0, c.salaryWeight(SalarySource.POSTING), 0.0);
        assertEquals(1000, c.monteCarloSamples);
    }

    @Test
    public void testUnknownKeyIsRejected() {
        EstimationException ex = assertThrows(EstimationException.class,
            () -> EstimationConfig.fromJson(json("{\"prior_wieght\": 8.0}")));
        assertEquals(ErrorKind.INVALID_INPUT, ex.getErrorKind());
        assertTrue(ex.getMessage().contains("prior_wieght"));
    }

    @Test
    public void testInvalidValuesAreRejected() {
        assertThrows(EstimationException.class, () -> EstimationConfig.builder().priorWeight(0).build());
        assertThrows(EstimationException.class, () -> EstimationConfig.builder().salaryRange(50_000, 40_000).build());
        assertThrows(EstimationException.class, () -> EstimationConfig.builder().monteCarloSamples(0).build());
        assertThrows(EstimationException.class,
            () -> EstimationConfig.builder().salaryWeight(SalarySource.PAYROLL, -1).build());
        assertThrows(EstimationException.class, () -> EstimationConfig.fromJson(json("[1, 2]")));
        assertThrows(EstimationException.class,
            () -> EstimationConfig.fromJson(json("{\"headcount_weights\": {\"rumour\": 1.0}}")));
    }

    @Test
    public void testToBuilderKeepsEveryValue() {
        EstimationConfig original = EstimationConfig.builder()
            .randomSeed(9L)
            .workerThreads(4)
            .salaryWeight(SalarySource.ATS_LEVER, 1.75)
            .headcountWeight(EvidenceKind.POSTING, 0.25)
            .build();

        EstimationConfig copy = original.toBuilder().monteCarloSamples(250).build();

        assertEquals(9L, copy.randomSeed);
        assertEquals(4, copy.workerThreads);
        assertEquals(1.75, copy.salaryWeight(SalarySource.ATS_LEVER), 0.0);
        assertEquals(0.25, copy.headcountWeight(EvidenceKind.POSTING), 0.0);
        assertEquals(250, copy.monteCarloSamples);
        assertEquals(1000, original.monteCarloSamples);
    }
}
