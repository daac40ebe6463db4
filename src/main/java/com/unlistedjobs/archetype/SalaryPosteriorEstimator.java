package com.unlistedjobs.archetype;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Updates an OEWS wage prior with company salary observations by precision-weighted (normal-normal) shrinkage.
 * <p>
 * Model:
 * <ul>
 *   <li>Prior: mean = OEWS median, sigma = median * priorCv, effective sample size priorEffectiveN.</li>
 *   <li>Observations: each reduced to one value (point, range midpoint, or one-sided bound), values outside the
 *       sane salary range discarded; weighted mean with n = sum of source weights; sigma from the population
 *       standard deviation when more than one value survives, else the prior sigma.</li>
 *   <li>Posterior: precisions add; the mean is the precision-weighted average. The posterior is moment-matched
 *       to a lognormal so reported percentiles stay positive.</li>
 * </ul>
 * With no surviving observation the prior's own percentiles are returned unchanged and the shrinkage factor is 0.
 *
 * @author Archetype Inference Team
 * @since 1.0
 */
public class SalaryPosteriorEstimator {
    private static final Logger logger = LoggerFactory.getLogger(SalaryPosteriorEstimator.class);

    private static final double VARIANCE_EPSILON = 1e-6;
    private static final double[] QUANTILES = {0.10, 0.25, 0.50, 0.75, 0.90};

    private final EstimationConfig config;

    public SalaryPosteriorEstimator(EstimationConfig config) {
        this.config = config;
    }

    /**
     * Computes the posterior wage distribution for one company.
     *
     * @param prior        OEWS prior of the cell; must carry a positive median
     * @param companyId    company being estimated
     * @param observations company observations in the cell, possibly empty
     * @return posterior estimate
     * @throws EstimationException with {@link ErrorKind#MISSING_PRIOR} if the prior has no wage median
     */
    public SalaryEstimate estimate(OewsPrior prior, String companyId, List<SalaryObservation> observations) {
        if (!prior.hasWagePrior()) {
            throw new EstimationException(ErrorKind.MISSING_PRIOR, "No OEWS wage median", prior.key().toString());
        }
        double muPrior = prior.wageP50();
        double sigmaPrior = muPrior * config.priorCv;
        double nPrior = config.priorEffectiveN;
        List<SalaryObservation> obs = observations == null ? List.of() : observations;

        List<Double> values = new ArrayList<>();
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        int discarded = 0;
        for (SalaryObservation o : obs) {
            double value = o.pointValue(config.minOnlyUplift, config.maxOnlyDiscount);
            if (Double.isNaN(value) || value < config.salaryFloor || value > config.salaryCeiling) {
                discarded++;
                logger.debug("{}: discarding salary {} from {} for {} in {}", ErrorKind.DEGENERATE_OBSERVATION,
                    value, o.source().code(), companyId, prior.key());
                continue;
            }
            values.add(value);
            weightedSum += value * o.weight();
            totalWeight += o.weight();
        }

        if (values.isEmpty()) {
            return priorOnly(prior, companyId, sigmaPrior, obs.size(), discarded);
        }

        double muObs = weightedSum / totalWeight;
        double nObs = totalWeight;
        double sigmaObs = sigmaPrior;
        if (values.size() > 1) {
            sigmaObs = new StandardDeviation(false).evaluate(values.stream().mapToDouble(Double::doubleValue).toArray());
        }

        double precisionPrior = nPrior / (sigmaPrior * sigmaPrior);
        double precisionObs = nObs / (sigmaObs * sigmaObs + VARIANCE_EPSILON);
        double precisionPost = precisionPrior + precisionObs;
        double muPost = (precisionPrior * muPrior + precisionObs * muObs) / precisionPost;
        double sigmaPost = Math.sqrt(1.0 / precisionPost);
        double shrinkage = precisionObs / precisionPost;

        double[] q = lognormalQuantiles(muPost, sigmaPost);
        return new SalaryEstimate(companyId, prior.key(), q[0], q[1], q[2], q[3], q[4], muPost, sigmaPost,
            obs.size(), discarded, nObs, shrinkage, muPrior, SalaryEstimate.METHOD);
    }

    private SalaryEstimate priorOnly(OewsPrior prior, String companyId, double sigmaPrior, int count, int discarded) {
        double mean = prior.wageMean() > 0 ? prior.wageMean() : prior.wageP50();
        double[] p = priorPercentiles(prior, sigmaPrior);
        return new SalaryEstimate(companyId, prior.key(), p[0], p[1], p[2], p[3], p[4], mean, sigmaPrior,
            count, discarded, 0.0, 0.0, prior.wageP50(), SalaryEstimate.METHOD);
    }

    /**
     * The prior's published percentiles. OEWS suppresses or top-codes some of them; a missing (non-positive)
     * or out-of-order value is replaced by the lognormal fit of the prior itself.
     */
    static double[] priorPercentiles(OewsPrior prior, double sigmaPrior) {
        double[] published = {prior.wageP10(), prior.wageP25(), prior.wageP50(), prior.wageP75(), prior.wageP90()};
        boolean complete = true;
        for (int i = 0; i < published.length; i++) {
            if (!(published[i] > 0) || (i > 0 && published[i] < published[i - 1])) {
                complete = false;
                break;
            }
        }
        if (complete) return published;

        double[] fitted = lognormalQuantiles(prior.wageP50(), sigmaPrior);
        double[] out = new double[published.length];
        for (int i = 0; i < published.length; i++) {
            double v = published[i] > 0 ? published[i] : fitted[i];
            out[i] = i > 0 ? Math.max(out[i - 1], v) : v;
        }
        return out;
    }

    /**
     * Moment-matches a normal (mean, sigma) to a lognormal and returns its P10/P25/P50/P75/P90
     * (exp of the normal quantile on the log scale).
     */
    static double[] lognormalQuantiles(double mean, double sigma) {
        double cv2 = (sigma / mean) * (sigma / mean);
        double logMu = Math.log(mean) - 0.5 * cv2;
        double logSigma = Math.sqrt(Math.log1p(cv2));
        NormalDistribution logScale = new NormalDistribution(null, logMu, logSigma);
        double[] out = new double[QUANTILES.length];
        for (int i = 0; i < QUANTILES.length; i++) {
            out[i] = Math.exp(logScale.inverseCumulativeProbability(QUANTILES[i]));
        }
        return out;
    }
}
