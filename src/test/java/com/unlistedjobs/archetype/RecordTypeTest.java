package com.unlistedjobs.archetype;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RecordTypeTest {

    @Test
    public void testTiersNeverOverlap() {
        double scale = 20.0;
        double observedFloor = RecordType.OBSERVED.confidence(0, scale);
        double knownCeiling = RecordType.KNOWN_EMPLOYER_INFERRED.confidence(1e9, scale);
        double knownFloor = RecordType.KNOWN_EMPLOYER_INFERRED.confidence(0, scale);
        double syntheticCeiling = RecordType.CBP_SYNTHETIC.confidence(1e9, scale);

        assertTrue(observedFloor > knownCeiling);
        assertTrue(knownFloor >= syntheticCeiling);
    }

    @Test
    public void testClampPullsIntoBand() {
        assertEquals(0.85, RecordType.OBSERVED.clamp(0.3), 0.0);
        assertEquals(0.95, RecordType.OBSERVED.clamp(1.0), 0.0);
        assertEquals(0.9, RecordType.OBSERVED.clamp(0.9), 0.0);
        assertEquals(0.85, RecordType.OBSERVED.clamp(Double.NaN), 0.0);
        assertEquals(0.20, RecordType.CBP_SYNTHETIC.clamp(0.204), 0.0);
    }

    @Test
    public void testConfidenceGrowsWithEvidenceInsideBand() {
        RecordType t = RecordType.KNOWN_EMPLOYER_INFERRED;

        assertEquals(0.20, t.confidence(0, 20), 1e-12);
        assertEquals(0.20, t.confidence(-5, 20), 1e-12);
        assertTrue(t.confidence(5, 20) < t.confidence(50, 20));
        assertEquals(0.45, t.confidence(1e6, 20), 1e-9);
    }

    @Test
    public void testDbValueRoundTrip() {
        for (RecordType t : RecordType.values()) {
            assertEquals(t, RecordType.fromDbValue(t.dbValue()));
        }
        assertEquals(RecordType.CBP_SYNTHETIC, RecordType.fromDbValue(" CBP_Synthetic "));
        assertThrows(EstimationException.class, () -> RecordType.fromDbValue("guessed"));
        assertEquals(Seniority.MID, Seniority.fromDbValue(""));
        assertEquals(Seniority.SENIOR, Seniority.fromDbValue("Senior"));
    }
}
