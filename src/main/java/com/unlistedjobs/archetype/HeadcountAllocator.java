package com.unlistedjobs.archetype;

import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Distributes an OEWS employment total over the companies of one cell in proportion to their evidence.
 * <p>
 * Company shares are modelled as {@code Dirichlet(alpha)} with
 * {@code alpha_i = priorWeight / n + evidence_i * concentrationScale}, which shrinks weakly-evidenced cells
 * toward a uniform split. Each Monte Carlo draw is scaled to the total, rounded half-to-even, and its rounding
 * drift is pushed onto the company with the largest share in that draw, so every draw sums to the total.
 * P10/P50/P90 are taken per company across draws (linear interpolation between order statistics, truncated).
 * <p>
 * After flooring p10/p50 at 1, the p50 column is corrected once more so that it sums exactly to the total.
 * Sampling is seeded from the cell key (and the optional base seed), so a cell always yields the same result.
 *
 * @author Archetype Inference Team
 * @since 1.0
 */
public class HeadcountAllocator {
    private static final Logger logger = LoggerFactory.getLogger(HeadcountAllocator.class);

    private final EstimationConfig config;

    public HeadcountAllocator(EstimationConfig config) {
        this.config = config;
    }

    /**
     * Allocates {@code employmentTotal} over the given companies.
     *
     * @param key             cell being allocated (also seeds the sampler)
     * @param employmentTotal OEWS employment total, must be positive
     * @param evidence        companies that cleared the evidence threshold; may be empty
     * @return one estimate per company, in input order; empty when {@code evidence} is empty
     * @throws EstimationException with {@link ErrorKind#MISSING_PRIOR} when the total is not positive
     */
    public List<HeadcountEstimate> allocate(MetroRoleKey key, int employmentTotal, List<CompanyEvidence> evidence) {
        if (employmentTotal <= 0) {
            throw new EstimationException(ErrorKind.MISSING_PRIOR,
                "Employment total must be positive, got " + employmentTotal, key.toString());
        }
        if (evidence == null || evidence.isEmpty()) {
            return List.of();
        }
        int n = evidence.size();
        if (n == 1) {
            CompanyEvidence only = evidence.get(0);
            return List.of(new HeadcountEstimate(only.companyId(), key, employmentTotal, employmentTotal,
                employmentTotal, only.totalWeightedEvidence(), 1.0, employmentTotal, 1, HeadcountEstimate.METHOD));
        }

        double[] alphas = new double[n];
        for (int j = 0; j < n; j++) {
            alphas[j] = config.priorWeight / n + evidence.get(j).totalWeightedEvidence() * config.concentrationScale;
        }

        int samples = config.monteCarloSamples;
        double[][] headcounts = sampleHeadcounts(alphas, employmentTotal, samples, seedFor(key));

        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        int[] p10 = new int[n];
        int[] p50 = new int[n];
        int[] p90 = new int[n];
        for (int j = 0; j < n; j++) {
            percentile.setData(headcounts[j]);
            p10[j] = Math.max(1, (int) percentile.evaluate(10.0));
            p50[j] = Math.max(1, (int) percentile.evaluate(50.0));
            p90[j] = Math.max(p50[j], (int) percentile.evaluate(90.0));
        }

        correctMedianSum(p50, employmentTotal, evidence);

        List<HeadcountEstimate> estimates = new ArrayList<>(n);
        for (int j = 0; j < n; j++) {
            CompanyEvidence ce = evidence.get(j);
            int lo = Math.min(p10[j], p50[j]);
            int hi = Math.max(p90[j], p50[j]);
            estimates.add(new HeadcountEstimate(ce.companyId(), key, lo, p50[j], hi, ce.totalWeightedEvidence(),
                ce.evidenceShare(), employmentTotal, n, HeadcountEstimate.METHOD));
        }
        logger.debug("Allocated {} over {} companies in {}", employmentTotal, n, key);
        return estimates;
    }

    /**
     * Draws {@code samples} Dirichlet share vectors and converts each to integer headcounts summing to the total.
     * @return headcounts indexed [company][sample]
     */
    double[][] sampleHeadcounts(double[] alphas, int total, int samples, long seed) {
        int n = alphas.length;
        RandomGenerator rng = new Well19937c(seed);
        GammaDistribution[] gammas = new GammaDistribution[n];
        for (int j = 0; j < n; j++) {
            gammas[j] = new GammaDistribution(rng, alphas[j], 1.0);
        }
        double alphaSum = 0.0;
        for (double a : alphas) alphaSum += a;

        double[][] headcounts = new double[n][samples];
        double[] shares = new double[n];
        for (int s = 0; s < samples; s++) {
            double sum = 0.0;
            for (int j = 0; j < n; j++) {
                shares[j] = gammas[j].sample();
                sum += shares[j];
            }
            int argMax = 0;
            long rounded = 0;
            for (int j = 0; j < n; j++) {
                // all draws underflowed; fall back to the Dirichlet mean
                shares[j] = sum > 0 ? shares[j] / sum : alphas[j] / alphaSum;
                if (shares[j] > shares[argMax]) argMax = j;
                headcounts[j][s] = Math.rint(shares[j] * total);
                rounded += (long) headcounts[j][s];
            }
            long drift = total - rounded;
            if (drift != 0) {
                headcounts[argMax][s] += drift;
            }
        }
        return headcounts;
    }

    /**
     * Pushes the residual between the p50 column and the total onto the largest companies, keeping every company
     * at 1 or more unless there are more companies than positions.
     */
    private static void correctMedianSum(int[] p50, int total, List<CompanyEvidence> evidence) {
        long sum = 0;
        for (int v : p50) sum += v;
        long residual = total - sum;
        if (residual == 0) return;

        Integer[] byMedianDesc = IntStream.range(0, p50.length).boxed()
            .sorted(Comparator.<Integer>comparingInt(j -> p50[j]).reversed().thenComparingInt(j -> j))
            .toArray(Integer[]::new);
        if (residual > 0) {
            p50[byMedianDesc[0]] += (int) residual;
            return;
        }
        for (int j : byMedianDesc) {
            if (residual == 0) return;
            int take = (int) Math.min(-residual, p50[j] - 1L);
            p50[j] -= take;
            residual += take;
        }
        // more companies than positions: weakest evidence gives up its floor first
        Integer[] byEvidenceAsc = IntStream.range(0, p50.length).boxed()
            .sorted(Comparator.<Integer>comparingDouble(j -> evidence.get(j).totalWeightedEvidence()).thenComparingInt(j -> j))
            .toArray(Integer[]::new);
        for (int j : byEvidenceAsc) {
            if (residual == 0) return;
            int take = (int) Math.min(-residual, p50[j]);
            p50[j] -= take;
            residual += take;
        }
    }

    long seedFor(MetroRoleKey key) {
        long base = config.randomSeed == null ? 0L : config.randomSeed;
        return (base * 0x9E3779B97F4A7C15L) ^ key.stableHash();
    }
}
