package com.unlistedjobs.archetype;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs one metro x role cell end to end: evidence lookup, headcount allocation, salary inference and archetype
 * assembly.
 * <p>
 * Workflow:
 * <ul>
 *   <li>A cell without a positive OEWS employment total is rejected as a missing prior.</li>
 *   <li>Headcount is allocated over the companies that cleared the evidence threshold.</li>
 *   <li>Salary is estimated for every company with headcount evidence or salary observations, when the prior
 *       carries a wage median. Salary-only companies get an estimate but no archetype.</li>
 *   <li>Each headcount estimate becomes a {@link RecordType#KNOWN_EMPLOYER_INFERRED} archetype joined with the
 *       company's salary estimate.</li>
 * </ul>
 * Holds no mutable state; one instance may serve all worker threads.
 */
public class CellEstimator {
    private static final Logger logger = LoggerFactory.getLogger(CellEstimator.class);

    private final EstimationConfig config;
    private final EvidenceAggregatorInterface evidenceAggregator;
    private final HeadcountAllocator headcountAllocator;
    private final SalaryPosteriorEstimator salaryEstimator;

    public CellEstimator(EstimationConfig config, EvidenceAggregatorInterface evidenceAggregator) {
        this.config = config;
        this.evidenceAggregator = evidenceAggregator;
        this.headcountAllocator = new HeadcountAllocator(config);
        this.salaryEstimator = new SalaryPosteriorEstimator(config);
    }

    /**
     * @param prior OEWS prior of the cell
     * @return the cell's estimates and archetypes
     * @throws EstimationException with {@link ErrorKind#MISSING_PRIOR} when the prior has no employment total
     */
    public CellResult estimate(OewsPrior prior) {
        MetroRoleKey key = prior.key();
        if (!prior.hasEmploymentPrior()) {
            throw new EstimationException(ErrorKind.MISSING_PRIOR, "No OEWS employment total", key.toString());
        }

        List<CompanyEvidence> evidence = evidenceAggregator.companyEvidence(key);
        List<HeadcountEstimate> headcounts = headcountAllocator.allocate(key, prior.employmentTotal(), evidence);
        if (headcounts.isEmpty()) {
            logger.debug("{} in {}: no company cleared the evidence threshold; {} positions unattributed",
                ErrorKind.INSUFFICIENT_EVIDENCE, key, prior.employmentTotal());
        }

        Map<String, List<SalaryObservation>> observations = evidenceAggregator.salaryObservations(key);
        Map<String, SalaryEstimate> salaries = new LinkedHashMap<>();
        if (prior.hasWagePrior()) {
            Set<String> companies = new TreeSet<>(observations.keySet());
            evidence.forEach(ce -> companies.add(ce.companyId()));
            for (String companyId : companies) {
                salaries.put(companyId,
                    salaryEstimator.estimate(prior, companyId, observations.getOrDefault(companyId, List.of())));
            }
        } else {
            logger.debug("No OEWS wage median for {}; salary inference skipped", key);
        }

        Map<String, CompanyEvidence> evidenceById = new HashMap<>();
        evidence.forEach(ce -> evidenceById.put(ce.companyId(), ce));
        List<Archetype> archetypes = new ArrayList<>(headcounts.size());
        for (HeadcountEstimate h : headcounts) {
            archetypes.add(toArchetype(h, evidenceById.get(h.companyId()), salaries.get(h.companyId())));
        }
        return new CellResult(key, headcounts, new ArrayList<>(salaries.values()), archetypes);
    }

    private Archetype toArchetype(HeadcountEstimate h, CompanyEvidence ce, SalaryEstimate salary) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("oews_total", h.employmentTotal());
        summary.put("evidence_score", h.evidenceScore());
        summary.put("share_of_metro", h.shareOfMetro());
        summary.put("companies_in_metro", h.companiesInCell());
        summary.put("posting_count", ce.postingCount());
        summary.put("visa_count", ce.visaCount());
        summary.put("payroll_count", ce.payrollCount());
        summary.put("method", h.method());
        if (salary != null) {
            summary.put("salary_observations", salary.observationCount());
            summary.put("shrinkage_factor", salary.shrinkageFactor());
        }

        double confidence = RecordType.KNOWN_EMPLOYER_INFERRED.confidence(h.evidenceScore(),
            config.confidenceEvidenceScale);
        return new Archetype(h.companyId(), ce.companyName(), h.key(), Seniority.MID,
            RecordType.KNOWN_EMPLOYER_INFERRED, ce.industry(), h.p10(), h.p50(), h.p90(),
            salary == null ? null : salary.p25(),
            salary == null ? null : salary.p50(),
            salary == null ? null : salary.p75(),
            confidence, summary);
    }
}
