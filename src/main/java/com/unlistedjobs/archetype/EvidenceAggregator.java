package com.unlistedjobs.archetype;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Evidence aggregator over raw evidence rows loaded once per batch.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Rows are indexed by metro x role cell at construction; lookups never touch I/O.</li>
 *   <li>Headcount: per company, records are counted per {@link EvidenceKind} and weighted
 *       (posting 0.5, visa 2.0, payroll 3.0 by default). Companies below the minimum evidence are excluded,
 *       and shares are normalised over the remaining companies.</li>
 *   <li>Salary: every row with a salary figure becomes a {@link SalaryObservation} weighted by its source.</li>
 * </ul>
 */
public class EvidenceAggregator implements EvidenceAggregatorInterface {
    private static final Logger logger = LoggerFactory.getLogger(EvidenceAggregator.class);

    private final EstimationConfig config;
    private final Map<MetroRoleKey, List<EvidenceRow>> rowsByCell;

    public EvidenceAggregator(EstimationConfig config, Collection<EvidenceRow> rows) {
        this.config = config;
        Map<MetroRoleKey, List<EvidenceRow>> index = new HashMap<>();
        for (EvidenceRow row : rows) {
            index.computeIfAbsent(row.key(), k -> new ArrayList<>()).add(row);
        }
        index.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.rowsByCell = Collections.unmodifiableMap(index);
        logger.info("Indexed {} evidence rows across {} cells", rows.size(), rowsByCell.size());
    }

    @Override
    public List<CompanyEvidence> companyEvidence(MetroRoleKey key) {
        List<EvidenceRow> rows = rowsByCell.getOrDefault(key, List.of());
        Map<String, int[]> counts = new TreeMap<>();
        Map<String, EvidenceRow> firstRow = new HashMap<>();
        for (EvidenceRow row : rows) {
            int[] c = counts.computeIfAbsent(row.companyId(), id -> new int[EvidenceKind.values().length]);
            c[row.source().kind().ordinal()] += row.headcountContribution();
            firstRow.putIfAbsent(row.companyId(), row);
        }

        List<CompanyEvidence> qualifying = new ArrayList<>();
        double total = 0.0;
        for (Map.Entry<String, int[]> e : counts.entrySet()) {
            int[] c = e.getValue();
            double weighted = c[EvidenceKind.POSTING.ordinal()] * config.headcountWeight(EvidenceKind.POSTING)
                + c[EvidenceKind.VISA.ordinal()] * config.headcountWeight(EvidenceKind.VISA)
                + c[EvidenceKind.PAYROLL.ordinal()] * config.headcountWeight(EvidenceKind.PAYROLL);
            if (weighted < config.minEvidenceThreshold || weighted <= 0) {
                logger.debug("Company {} below evidence threshold in {} ({} < {})",
                    e.getKey(), key, weighted, config.minEvidenceThreshold);
                continue;
            }
            EvidenceRow first = firstRow.get(e.getKey());
            qualifying.add(new CompanyEvidence(e.getKey(), first.companyName(), first.industry(),
                c[EvidenceKind.POSTING.ordinal()], c[EvidenceKind.VISA.ordinal()], c[EvidenceKind.PAYROLL.ordinal()],
                weighted, 0.0));
            total += weighted;
        }

        List<CompanyEvidence> result = new ArrayList<>(qualifying.size());
        for (CompanyEvidence ce : qualifying) {
            result.add(ce.withEvidenceShare(ce.totalWeightedEvidence() / total));
        }
        return result;
    }

    @Override
    public Map<String, List<SalaryObservation>> salaryObservations(MetroRoleKey key) {
        Map<String, List<SalaryObservation>> byCompany = new TreeMap<>();
        for (EvidenceRow row : rowsByCell.getOrDefault(key, List.of())) {
            if (!row.hasSalary()) continue;
            byCompany.computeIfAbsent(row.companyId(), id -> new ArrayList<>()).add(new SalaryObservation(
                row.companyId(), row.source(), row.salaryMin(), row.salaryMax(), row.salaryPoint(),
                config.salaryWeight(row.source())));
        }
        return byCompany;
    }
}
