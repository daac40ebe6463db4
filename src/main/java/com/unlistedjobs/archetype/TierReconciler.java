package com.unlistedjobs.archetype;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Removes double counting between the three archetype tiers.
 * <p>
 * Per industry, the headcount already attributed by {@link RecordType#OBSERVED} and
 * {@link RecordType#KNOWN_EMPLOYER_INFERRED} rows is subtracted from the {@link RecordType#CBP_SYNTHETIC} tier by
 * scaling every synthetic row with {@code max(0, 1 - known / syntheticTotal)}. Scaled rows are confidence-discounted
 * as residual estimates; rows whose headcount rounds to zero are dropped. Industries with no known headcount
 * pass through unchanged. Observed and known-inferred rows are never modified.
 */
public class TierReconciler {
    private static final Logger logger = LoggerFactory.getLogger(TierReconciler.class);

    private final EstimationConfig config;

    public TierReconciler(EstimationConfig config) {
        this.config = config;
    }

    /**
     * Per-industry outcome of a reconciliation.
     */
    public record IndustryAdjustment(String industry, long knownHeadcount, long syntheticBefore,
                                     long syntheticAfter, double remainingFraction, int rowsDropped) {}

    /**
     * Adjusted synthetic tier plus per-industry bookkeeping.
     */
    public record Result(List<Archetype> adjustedSynthetic, Map<String, IndustryAdjustment> byIndustry) {
        public long syntheticHeadcountBefore() {
            return byIndustry.values().stream().mapToLong(IndustryAdjustment::syntheticBefore).sum();
        }

        public long syntheticHeadcountAfter() {
            return byIndustry.values().stream().mapToLong(IndustryAdjustment::syntheticAfter).sum();
        }
    }

    /**
     * Reconciles the synthetic tier against the other two.
     *
     * @param archetypes records of all three tiers across the whole dataset
     * @return the adjusted synthetic tier; the other tiers are not part of the result
     */
    public Result reconcile(Collection<Archetype> archetypes) {
        Map<String, Long> known = new TreeMap<>();
        Map<String, Long> syntheticTotals = new TreeMap<>();
        Map<String, List<Archetype>> synthetic = new TreeMap<>();
        for (Archetype a : archetypes) {
            switch (a.recordType()) {
                case OBSERVED, KNOWN_EMPLOYER_INFERRED -> known.merge(a.industry(), (long) a.headcountP50(), Long::sum);
                case CBP_SYNTHETIC -> {
                    syntheticTotals.merge(a.industry(), (long) a.headcountP50(), Long::sum);
                    synthetic.computeIfAbsent(a.industry(), k -> new ArrayList<>()).add(a);
                }
            }
        }

        List<Archetype> adjusted = new ArrayList<>();
        Map<String, IndustryAdjustment> report = new TreeMap<>();
        for (Map.Entry<String, List<Archetype>> e : synthetic.entrySet()) {
            String industry = e.getKey();
            long knownCount = known.getOrDefault(industry, 0L);
            long before = syntheticTotals.get(industry);

            if (knownCount == 0 || before == 0) {
                adjusted.addAll(e.getValue());
                report.put(industry, new IndustryAdjustment(industry, knownCount, before, before, 1.0, 0));
                continue;
            }

            double remaining = Math.max(0.0, 1.0 - (double) knownCount / before);
            long after = 0;
            int dropped = 0;
            for (Archetype row : e.getValue()) {
                int p50 = scale(row.headcountP50(), remaining);
                if (p50 == 0) {
                    dropped++;
                    continue;
                }
                int p10 = Math.min(scale(row.headcountP10(), remaining), p50);
                int p90 = Math.max(scale(row.headcountP90(), remaining), p50);
                double confidence = row.compositeConfidence() * config.syntheticConfidenceDiscount;
                adjusted.add(row.withHeadcountAndConfidence(p10, p50, p90, confidence));
                after += p50;
            }
            report.put(industry, new IndustryAdjustment(industry, knownCount, before, after, remaining, dropped));
            logger.info("Industry {}: known {}, synthetic {} -> {} (remaining {}, {} rows dropped)",
                industry, knownCount, before, after, String.format("%.3f", remaining), dropped);
        }
        return new Result(adjusted, report);
    }

    private static int scale(int headcount, double fraction) {
        return (int) Math.round(headcount * fraction);
    }
}
