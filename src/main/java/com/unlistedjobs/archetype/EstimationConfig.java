package com.unlistedjobs.archetype;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Immutable set of every tunable of the inference engine. Passed into each component's constructor.
 * <p>
 * Defaults:
 * <ul>
 *   <li>Headcount: prior weight 5.0, concentration scale 1.0, minimum evidence 1.0,
 *       posting 0.5 / visa 2.0 / payroll 3.0 per record, 1,000 Monte Carlo samples.</li>
 *   <li>Salary: prior effective n 10.0, prior CV 0.25, sane range 20,000-1,000,000,
 *       payroll and visa sources 5.0, negotiated wage table 4.0, ATS posting 2.0, generic posting 1.5.</li>
 *   <li>Tiers: synthetic residual discount 0.9, confidence evidence scale 20.0.</li>
 *   <li>Batch: 3 persistence attempts with 500 ms base backoff, 1 worker thread.</li>
 * </ul>
 * Overrides can be read from a JSON document with {@link #fromJson(InputStream)}; any subset of keys may be given.
 */
public final class EstimationConfig {

    // Headcount allocation
    /** Effective sample size of the uniform prior over companies. */
    public final double priorWeight;
    /** Multiplier applied to weighted evidence when forming Dirichlet concentrations. */
    public final double concentrationScale;
    /** Companies below this weighted evidence are excluded from allocation. */
    public final double minEvidenceThreshold;
    /** Monte Carlo draws per cell. */
    public final int monteCarloSamples;
    /** Base seed mixed with the cell key; null means the key alone seeds the cell. */
    public final Long randomSeed;

    // Salary inference
    public final double priorEffectiveN;
    /** Assumed coefficient of variation of the OEWS wage distribution. */
    public final double priorCv;
    public final double salaryFloor;
    public final double salaryCeiling;
    /** A lone minimum is taken as ~10% below the median. */
    public final double minOnlyUplift;
    public final double maxOnlyDiscount;

    // Tiers
    public final double syntheticConfidenceDiscount;
    public final double confidenceEvidenceScale;

    // Batch
    public final int persistMaxAttempts;
    public final long persistBackoffMillis;
    public final int workerThreads;

    private final Map<EvidenceKind, Double> headcountWeights;
    private final Map<SalarySource, Double> salaryWeights;

    private EstimationConfig(Builder b) {
        this.priorWeight = b.priorWeight;
        this.concentrationScale = b.concentrationScale;
        this.minEvidenceThreshold = b.minEvidenceThreshold;
        this.monteCarloSamples = b.monteCarloSamples;
        this.randomSeed = b.randomSeed;
        this.priorEffectiveN = b.priorEffectiveN;
        this.priorCv = b.priorCv;
        this.salaryFloor = b.salaryFloor;
        this.salaryCeiling = b.salaryCeiling;
        this.minOnlyUplift = b.minOnlyUplift;
        this.maxOnlyDiscount = b.maxOnlyDiscount;
        this.syntheticConfidenceDiscount = b.syntheticConfidenceDiscount;
        this.confidenceEvidenceScale = b.confidenceEvidenceScale;
        this.persistMaxAttempts = b.persistMaxAttempts;
        this.persistBackoffMillis = b.persistBackoffMillis;
        this.workerThreads = b.workerThreads;
        this.headcountWeights = Collections.unmodifiableMap(new EnumMap<>(b.headcountWeights));
        this.salaryWeights = Collections.unmodifiableMap(new EnumMap<>(b.salaryWeights));
    }

    /**
     * Headcount weight of one record of the given kind.
     */
    public double headcountWeight(EvidenceKind kind) {
        return headcountWeights.get(kind);
    }

    /**
     * Salary observation weight of the given source.
     */
    public double salaryWeight(SalarySource source) {
        return salaryWeights.get(source);
    }

    public static EstimationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() { return new Builder(); }

    /**
     * Builder pre-populated with this configuration's values.
     */
    public Builder toBuilder() {
        Builder b = new Builder()
            .priorWeight(priorWeight)
            .concentrationScale(concentrationScale)
            .minEvidenceThreshold(minEvidenceThreshold)
            .monteCarloSamples(monteCarloSamples)
            .randomSeed(randomSeed)
            .priorEffectiveN(priorEffectiveN)
            .priorCv(priorCv)
            .salaryRange(salaryFloor, salaryCeiling)
            .minOnlyUplift(minOnlyUplift)
            .maxOnlyDiscount(maxOnlyDiscount)
            .syntheticConfidenceDiscount(syntheticConfidenceDiscount)
            .confidenceEvidenceScale(confidenceEvidenceScale)
            .persistMaxAttempts(persistMaxAttempts)
            .persistBackoffMillis(persistBackoffMillis)
            .workerThreads(workerThreads);
        headcountWeights.forEach(b::headcountWeight);
        salaryWeights.forEach(b::salaryWeight);
        return b;
    }

    private static final Set<String> JSON_KEYS = Set.of(
        "prior_weight", "concentration_scale", "min_evidence_threshold", "monte_carlo_samples", "random_seed",
        "prior_effective_n", "prior_cv", "salary_floor", "salary_ceiling", "min_only_uplift", "max_only_discount",
        "synthetic_confidence_discount", "confidence_evidence_scale", "persist_max_attempts",
        "persist_backoff_millis", "worker_threads", "headcount_weights", "salary_weights");

    /**
     * Reads a JSON object of overrides on top of the defaults. Unknown keys are rejected.
     *
     * @param in JSON document, e.g. {@code {"prior_weight": 8.0, "salary_weights": {"posting": 1.0}}}
     * @return configuration
     * @throws IOException if the document cannot be parsed
     */
    public static EstimationConfig fromJson(InputStream in) throws IOException {
        JsonNode root = new ObjectMapper().readTree(in);
        if (root == null || !root.isObject()) {
            throw new EstimationException(ErrorKind.INVALID_INPUT, "Configuration must be a JSON object");
        }
        Builder b = builder();
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!JSON_KEYS.contains(name)) {
                throw new EstimationException(ErrorKind.INVALID_INPUT, "Unknown configuration key: " + name);
            }
        }
        if (root.has("prior_weight")) b.priorWeight(root.get("prior_weight").asDouble());
        if (root.has("concentration_scale")) b.concentrationScale(root.get("concentration_scale").asDouble());
        if (root.has("min_evidence_threshold")) b.minEvidenceThreshold(root.get("min_evidence_threshold").asDouble());
        if (root.has("monte_carlo_samples")) b.monteCarloSamples(root.get("monte_carlo_samples").asInt());
        if (root.has("random_seed")) {
            JsonNode seed = root.get("random_seed");
            b.randomSeed(seed.isNull() ? null : seed.asLong());
        }
        if (root.has("prior_effective_n")) b.priorEffectiveN(root.get("prior_effective_n").asDouble());
        if (root.has("prior_cv")) b.priorCv(root.get("prior_cv").asDouble());
        double floor = root.has("salary_floor") ? root.get("salary_floor").asDouble() : b.salaryFloor;
        double ceiling = root.has("salary_ceiling") ? root.get("salary_ceiling").asDouble() : b.salaryCeiling;
        b.salaryRange(floor, ceiling);
        if (root.has("min_only_uplift")) b.minOnlyUplift(root.get("min_only_uplift").asDouble());
        if (root.has("max_only_discount")) b.maxOnlyDiscount(root.get("max_only_discount").asDouble());
        if (root.has("synthetic_confidence_discount")) {
            b.syntheticConfidenceDiscount(root.get("synthetic_confidence_discount").asDouble());
        }
        if (root.has("confidence_evidence_scale")) b.confidenceEvidenceScale(root.get("confidence_evidence_scale").asDouble());
        if (root.has("persist_max_attempts")) b.persistMaxAttempts(root.get("persist_max_attempts").asInt());
        if (root.has("persist_backoff_millis")) b.persistBackoffMillis(root.get("persist_backoff_millis").asLong());
        if (root.has("worker_threads")) b.workerThreads(root.get("worker_threads").asInt());
        if (root.has("headcount_weights")) {
            root.get("headcount_weights").fields().forEachRemaining(e ->
                b.headcountWeight(parseKind(e.getKey()), e.getValue().asDouble()));
        }
        if (root.has("salary_weights")) {
            root.get("salary_weights").fields().forEachRemaining(e ->
                b.salaryWeight(SalarySource.fromCode(e.getKey()), e.getValue().asDouble()));
        }
        return b.build();
    }

    private static EvidenceKind parseKind(String name) {
        try {
            return EvidenceKind.valueOf(name.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new EstimationException(ErrorKind.INVALID_INPUT, "Unknown headcount evidence kind: " + name, e);
        }
    }

    public static final class Builder {
        private double priorWeight = 5.0;
        private double concentrationScale = 1.0;
        private double minEvidenceThreshold = 1.0;
        private int monteCarloSamples = 1000;
        private Long randomSeed = null;
        private double priorEffectiveN = 10.0;
        private double priorCv = 0.25;
        private double salaryFloor = 20_000.0;
        private double salaryCeiling = 1_000_000.0;
        private double minOnlyUplift = 1.1;
        private double maxOnlyDiscount = 0.9;
        private double syntheticConfidenceDiscount = 0.9;
        private double confidenceEvidenceScale = 20.0;
        private int persistMaxAttempts = 3;
        private long persistBackoffMillis = 500;
        private int workerThreads = 1;
        private final Map<EvidenceKind, Double> headcountWeights = new EnumMap<>(EvidenceKind.class);
        private final Map<SalarySource, Double> salaryWeights = new EnumMap<>(SalarySource.class);

        private Builder() {
            for (EvidenceKind kind : EvidenceKind.values()) {
                headcountWeights.put(kind, defaultHeadcountWeight(kind));
            }
            for (SalarySource source : SalarySource.values()) {
                salaryWeights.put(source, defaultSalaryWeight(source));
            }
        }

        private static double defaultHeadcountWeight(EvidenceKind kind) {
            return switch (kind) {
                case POSTING -> 0.5;
                case VISA -> 2.0;
                case PAYROLL -> 3.0;
            };
        }

        private static double defaultSalaryWeight(SalarySource source) {
            return switch (source) {
                case H1B_VISA, PERM_VISA, PAYROLL, STATE_PAYROLL -> 5.0;
                case CBA_PAY_TABLE -> 4.0;
                case ATS_GREENHOUSE, ATS_LEVER, ATS_SMARTRECRUITERS, ATS_WORKDAY -> 2.0;
                case POSTING -> 1.5;
            };
        }

        public Builder priorWeight(double v)                 { priorWeight = v;                 return this; }
        public Builder concentrationScale(double v)          { concentrationScale = v;          return this; }
        public Builder minEvidenceThreshold(double v)        { minEvidenceThreshold = v;        return this; }
        public Builder monteCarloSamples(int v)              { monteCarloSamples = v;           return this; }
        public Builder randomSeed(Long v)                    { randomSeed = v;                  return this; }
        public Builder priorEffectiveN(double v)             { priorEffectiveN = v;             return this; }
        public Builder priorCv(double v)                     { priorCv = v;                     return this; }
        public Builder minOnlyUplift(double v)               { minOnlyUplift = v;               return this; }
        public Builder maxOnlyDiscount(double v)             { maxOnlyDiscount = v;             return this; }
        public Builder syntheticConfidenceDiscount(double v) { syntheticConfidenceDiscount = v; return this; }
        public Builder confidenceEvidenceScale(double v)     { confidenceEvidenceScale = v;     return this; }
        public Builder persistMaxAttempts(int v)             { persistMaxAttempts = v;          return this; }
        public Builder persistBackoffMillis(long v)          { persistBackoffMillis = v;        return this; }
        public Builder workerThreads(int v)                  { workerThreads = v;               return this; }
        public Builder salaryRange(double floor, double ceiling) {
            salaryFloor = floor;
            salaryCeiling = ceiling;
            return this;
        }
        public Builder headcountWeight(EvidenceKind kind, double weight) {
            headcountWeights.put(kind, weight);
            return this;
        }
        public Builder salaryWeight(SalarySource source, double weight) {
            salaryWeights.put(source, weight);
            return this;
        }

        public EstimationConfig build() {
            require(priorWeight > 0, "prior_weight must be positive");
            require(concentrationScale > 0, "concentration_scale must be positive");
            require(minEvidenceThreshold >= 0, "min_evidence_threshold cannot be negative");
            require(monteCarloSamples > 0, "monte_carlo_samples must be positive");
            require(priorEffectiveN > 0, "prior_effective_n must be positive");
            require(priorCv > 0, "prior_cv must be positive");
            require(salaryFloor >= 0 && salaryCeiling > salaryFloor, "salary range must satisfy 0 <= floor < ceiling");
            require(syntheticConfidenceDiscount >= 0 && syntheticConfidenceDiscount <= 1,
                "synthetic_confidence_discount must lie in [0,1]");
            require(confidenceEvidenceScale > 0, "confidence_evidence_scale must be positive");
            require(persistMaxAttempts > 0, "persist_max_attempts must be positive");
            require(persistBackoffMillis >= 0, "persist_backoff_millis cannot be negative");
            require(workerThreads > 0, "worker_threads must be positive");
            headcountWeights.forEach((k, w) -> require(w > 0, "headcount weight for " + k + " must be positive"));
            salaryWeights.forEach((s, w) -> require(w > 0, "salary weight for " + s.code() + " must be positive"));
            return new EstimationConfig(this);
        }

        private static void require(boolean condition, String message) {
            if (!condition) throw new EstimationException(ErrorKind.INVALID_INPUT, message);
        }
    }
}
