package com.unlistedjobs.archetype;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Builds the {@link RecordType#CBP_SYNTHETIC} tier: macro employment of unnamed establishments split over canonical
 * roles by an industry-role mix.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Rows sharing metro, NAICS code and size class (one synthetic company) are summed first.</li>
 *   <li>Each establishment class with employment is split by the mix of its industry (the "other" mix when the
 *       industry has none); role shares are truncated to whole positions and zero rows dropped.</li>
 *   <li>P10/P90 follow the size-class bounds (establishments x min/max employees, scaled by the role share).</li>
 *   <li>Confidence grows with establishment size and stays inside the synthetic band.</li>
 *   <li>Salary P25/P50/P75 come from the OEWS prior of the metro x role when one exists.</li>
 * </ul>
 * The output is raw: {@link TierReconciler} removes the part already covered by the other tiers.
 */
public class SyntheticTierGenerator {
    private static final Logger logger = LoggerFactory.getLogger(SyntheticTierGenerator.class);

    static final String FALLBACK_INDUSTRY = "other";
    private static final double SALARY_CONFIDENCE = 0.85;
    private static final double LOCATION_CONFIDENCE = 0.50;
    private static final double STATISTICAL_DISCOUNT = 0.8;

    private final Map<String, Map<Integer, Double>> roleMix;
    private final Function<MetroRoleKey, Optional<OewsPrior>> priorLookup;

    /**
     * @param roleMix     industry -> (canonical role id -> share of industry employment)
     * @param priorLookup OEWS prior lookup for salary columns
     */
    public SyntheticTierGenerator(Map<String, Map<Integer, Double>> roleMix,
                                  Function<MetroRoleKey, Optional<OewsPrior>> priorLookup) {
        this.roleMix = roleMix;
        this.priorLookup = priorLookup;
    }

    public List<Archetype> generate(List<CbpEstablishment> establishments) {
        List<Archetype> out = new ArrayList<>();
        int unmixed = 0;
        for (CbpEstablishment est : combineDuplicates(establishments)) {
            if (est.employment() < 1) continue;
            Map<Integer, Double> mix = roleMix.getOrDefault(est.industry(), roleMix.get(FALLBACK_INDUSTRY));
            if (mix == null || mix.isEmpty()) {
                unmixed++;
                continue;
            }
            for (Map.Entry<Integer, Double> share : mix.entrySet()) {
                int headcount = (int) (est.employment() * share.getValue());
                if (headcount < 1) continue;
                out.add(toArchetype(est, share.getKey(), share.getValue(), headcount));
            }
        }
        if (unmixed > 0) {
            logger.warn("{} establishment classes skipped: no role mix for their industry and no '{}' mix",
                unmixed, FALLBACK_INDUSTRY);
        }
        logger.info("Generated {} synthetic archetypes, {} positions", out.size(),
            out.stream().mapToLong(Archetype::headcountP50).sum());
        return out;
    }

    /**
     * One row per (metro, NAICS, size class), the synthetic company identity; duplicates are summed in input order.
     */
    static List<CbpEstablishment> combineDuplicates(List<CbpEstablishment> establishments) {
        Map<String, CbpEstablishment> byIdentity = new LinkedHashMap<>();
        for (CbpEstablishment est : establishments) {
            byIdentity.merge(est.metroAreaId() + "|" + est.syntheticCompanyId(), est, CbpEstablishment::combine);
        }
        if (byIdentity.size() < establishments.size()) {
            logger.info("Combined {} establishment rows into {} classes", establishments.size(), byIdentity.size());
        }
        return new ArrayList<>(byIdentity.values());
    }

    private Archetype toArchetype(CbpEstablishment est, int roleId, double share, int headcount) {
        MetroRoleKey key = new MetroRoleKey(est.metroAreaId(), roleId);
        SizeClass size = est.sizeClass();
        int p10 = Math.min(headcount, (int) (est.establishments() * size.min() * share));
        int p90 = Math.max(headcount, (int) Math.ceil(est.establishments() * size.max() * share));

        Double salaryP25 = null;
        Double salaryP50 = null;
        Double salaryP75 = null;
        Optional<OewsPrior> prior = priorLookup.apply(key);
        if (prior.isPresent() && prior.get().hasWagePrior()) {
            OewsPrior p = prior.get();
            salaryP50 = p.wageP50();
            salaryP25 = p.wageP25() > 0 ? p.wageP25() : null;
            salaryP75 = p.wageP75() > 0 ? p.wageP75() : null;
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("source", "census_cbp:" + est.naicsCode());
        summary.put("size_class", size.label());
        summary.put("establishments", est.establishments());
        summary.put("industry_employment", est.employment());
        summary.put("role_share", share);

        String label = est.naicsLabel().length() > 30 ? est.naicsLabel().substring(0, 30) : est.naicsLabel();
        return new Archetype(est.syntheticCompanyId(), "[" + label + "] " + size.label(), key, Seniority.MID,
            RecordType.CBP_SYNTHETIC, est.industry(), Math.max(0, p10), headcount, p90,
            salaryP25, salaryP50, salaryP75, confidence(size), summary);
    }

    /**
     * Larger establishments are better covered by public data; the result never leaves the synthetic band.
     */
    static double confidence(SizeClass size) {
        double sizeConfidence = Math.min(0.60, 0.30 + (size.min() / 1000.0) * 0.3);
        double c = sizeConfidence * SALARY_CONFIDENCE * LOCATION_CONFIDENCE * STATISTICAL_DISCOUNT;
        return RecordType.CBP_SYNTHETIC.clamp(c);
    }
}
