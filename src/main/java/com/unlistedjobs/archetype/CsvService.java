package com.unlistedjobs.archetype;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * File adapter for a batch run, using OpenCSV for tables and Jackson for JSON documents.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Reads OEWS priors, evidence rows, the observed tier and establishment classes from the data directory.
 *       Headers are matched by name; column order does not matter and unknown columns are ignored.</li>
 *   <li>Serves as the {@link PriorProviderInterface}: priors are parsed once per reference year and cached.</li>
 *   <li>Writes archetypes and salary estimates to the output directory.</li>
 * </ul>
 * Malformed values fail with {@link ErrorKind#INVALID_INPUT} naming file and line.
 *
 * @author Archetype Inference Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface, PriorProviderInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    public static final String PRIORS_FILE = "oews_priors.csv";
    public static final String EVIDENCE_FILE = "evidence.csv";
    public static final String OBSERVED_FILE = "observed_archetypes.csv";
    public static final String ESTABLISHMENTS_FILE = "cbp_establishments.csv";
    public static final String ROLE_MIX_FILE = "industry_role_mix.json";
    public static final String ARCHETYPES_FILE = "archetypes.csv";
    public static final String SALARY_ESTIMATES_FILE = "salary_estimates.csv";

    private static final String[] ARCHETYPE_HEADER = {
        "company_id", "company_name", "industry", "area_code", "canonical_role_id", "seniority", "record_type",
        "headcount_p10", "headcount_p50", "headcount_p90", "salary_p25", "salary_p50", "salary_p75",
        "composite_confidence", "evidence_summary"
    };
    private static final String[] SALARY_HEADER = {
        "company_id", "area_code", "canonical_role_id", "p10", "p25", "p50", "p75", "p90", "mean", "stddev",
        "observation_count", "discarded_count", "effective_sample_size", "shrinkage_factor", "oews_median", "method"
    };

    private final ObjectMapper mapper = new ObjectMapper();
    private final Path dataDir;
    private final Path outputDir;
    private final Map<Integer, List<OewsPrior>> priorsByYear = new ConcurrentHashMap<>();
    private final Map<Integer, Map<MetroRoleKey, OewsPrior>> priorIndexByYear = new ConcurrentHashMap<>();

    /**
     * @param dataDir   directory holding the input files
     * @param outputDir directory receiving exports; created on first write
     */
    public CsvService(Path dataDir, Path outputDir) {
        this.dataDir = dataDir;
        this.outputDir = outputDir;
    }

    @Override
    public List<OewsPrior> loadPriors(int referenceYear) {
        return priorsByYear.computeIfAbsent(referenceYear, year -> {
            try {
                return readPriors(year);
            } catch (IOException e) {
                throw new EstimationException(ErrorKind.INVALID_INPUT, "Cannot read priors: " + e.getMessage(),
                    dataDir.resolve(PRIORS_FILE).toString(), e);
            }
        });
    }

    @Override
    public Optional<OewsPrior> getPrior(MetroRoleKey key, int referenceYear) {
        Map<MetroRoleKey, OewsPrior> index = priorIndexByYear.computeIfAbsent(referenceYear, year -> {
            Map<MetroRoleKey, OewsPrior> byKey = new HashMap<>();
            // first row wins when a cell is listed twice
            loadPriors(year).forEach(p -> byKey.putIfAbsent(p.key(), p));
            return byKey;
        });
        return Optional.ofNullable(index.get(key));
    }

    private List<OewsPrior> readPriors(int referenceYear) throws IOException {
        List<OewsPrior> priors = new ArrayList<>();
        int otherYears = 0;
        for (Row row : readTable(dataDir.resolve(PRIORS_FILE))) {
            int year = row.intValue("year", referenceYear);
            if (year != referenceYear) {
                otherYears++;
                continue;
            }
            double median = row.doubleValue("wage_median", 0.0);
            priors.add(row.parse(() -> new OewsPrior(
                new MetroRoleKey(row.required("area_code"), row.requiredInt("canonical_role_id")),
                row.text("area_name"), row.text("role_name"), year,
                row.intValue("employment", 0),
                row.doubleValue("wage_p10", 0.0), row.doubleValue("wage_p25", 0.0), median,
                row.doubleValue("wage_p75", 0.0), row.doubleValue("wage_p90", 0.0),
                row.doubleValue("wage_mean", median))));
        }
        priors.sort(Comparator.comparing((OewsPrior p) -> p.key().metroAreaId())
            .thenComparingInt(p -> p.key().canonicalRoleId()));
        logger.info("Loaded {} OEWS priors for {} ({} rows of other years ignored)", priors.size(), referenceYear, otherYears);
        return List.copyOf(priors);
    }

    @Override
    public List<EvidenceRow> loadEvidence() throws IOException {
        List<EvidenceRow> rows = new ArrayList<>();
        for (Row row : readTable(dataDir.resolve(EVIDENCE_FILE))) {
            rows.add(row.parse(() -> new EvidenceRow(
                row.required("company_id"), row.text("company_name"), row.text("industry"),
                new MetroRoleKey(row.required("area_code"), row.requiredInt("canonical_role_id")),
                SalarySource.fromCode(row.required("source_type")),
                row.intValue("headcount_contribution", 1),
                row.optionalDouble("salary_min"), row.optionalDouble("salary_max"), row.optionalDouble("salary_point"))));
        }
        logger.info("Loaded {} evidence rows", rows.size());
        return rows;
    }

    @Override
    public List<Archetype> loadObservedArchetypes() throws IOException {
        Path file = dataDir.resolve(OBSERVED_FILE);
        if (!Files.exists(file)) {
            logger.info("No {} in {}; observed tier is empty", OBSERVED_FILE, dataDir);
            return List.of();
        }
        List<Archetype> observed = new ArrayList<>();
        for (Row row : readTable(file)) {
            int p50 = row.intValue("headcount_p50", 0);
            observed.add(row.parse(() -> new Archetype(
                row.required("company_id"), row.text("company_name"),
                new MetroRoleKey(row.required("area_code"), row.requiredInt("canonical_role_id")),
                Seniority.fromDbValue(row.text("seniority")), RecordType.OBSERVED, row.text("industry"),
                row.intValue("headcount_p10", p50), p50, row.intValue("headcount_p90", p50),
                row.optionalDouble("salary_p25"), row.optionalDouble("salary_p50"), row.optionalDouble("salary_p75"),
                RecordType.OBSERVED.clamp(row.doubleValue("composite_confidence", RecordType.OBSERVED.minConfidence())),
                Map.of("source", "observed"))));
        }
        logger.info("Loaded {} observed archetypes", observed.size());
        return observed;
    }

    @Override
    public List<CbpEstablishment> loadEstablishments() throws IOException {
        Path file = dataDir.resolve(ESTABLISHMENTS_FILE);
        if (!Files.exists(file)) {
            logger.info("No {} in {}; synthetic tier will be empty", ESTABLISHMENTS_FILE, dataDir);
            return List.of();
        }
        List<CbpEstablishment> establishments = new ArrayList<>();
        for (Row row : readTable(file)) {
            establishments.add(row.parse(() -> new CbpEstablishment(
                row.required("area_code"), row.required("naics_code"), row.text("naics_label"), row.text("industry"),
                SizeClass.fromCode(row.required("size_class")),
                row.intValue("establishments", 0), row.intValue("employment", 0))));
        }
        logger.info("Loaded {} establishment classes", establishments.size());
        return establishments;
    }

    @Override
    public Map<String, Map<Integer, Double>> loadRoleMix() throws IOException {
        Path override = dataDir.resolve(ROLE_MIX_FILE);
        Map<String, Map<String, Double>> raw;
        if (Files.exists(override)) {
            try (InputStream in = Files.newInputStream(override)) {
                raw = mapper.readValue(in, new TypeReference<Map<String, Map<String, Double>>>() {});
            }
            logger.info("Loaded role mix from {}", override);
        } else {
            try (InputStream in = CsvService.class.getResourceAsStream("/" + ROLE_MIX_FILE)) {
                if (in == null) throw new IOException("Bundled " + ROLE_MIX_FILE + " not found on classpath");
                raw = mapper.readValue(in, new TypeReference<Map<String, Map<String, Double>>>() {});
            }
            logger.info("Loaded bundled role mix");
        }
        Map<String, Map<Integer, Double>> mix = new TreeMap<>();
        for (Map.Entry<String, Map<String, Double>> industry : raw.entrySet()) {
            Map<Integer, Double> shares = new TreeMap<>();
            for (Map.Entry<String, Double> share : industry.getValue().entrySet()) {
                double value = share.getValue() == null ? 0.0 : share.getValue();
                if (value < 0 || value > 1) {
                    throw new EstimationException(ErrorKind.INVALID_INPUT,
                        "Role share outside [0,1]: " + value, industry.getKey() + "/" + share.getKey());
                }
                try {
                    shares.put(Integer.valueOf(share.getKey().trim()), value);
                } catch (NumberFormatException e) {
                    throw new EstimationException(ErrorKind.INVALID_INPUT,
                        "Role id is not numeric: " + share.getKey(), industry.getKey(), e);
                }
            }
            mix.put(industry.getKey().trim(), shares);
        }
        return mix;
    }

    @Override
    public void writeArchetypes(List<Archetype> archetypes) throws IOException {
        Path file = prepareOutput(ARCHETYPES_FILE);
        try (CSVWriter writer = new CSVWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
            writer.writeNext(ARCHETYPE_HEADER);
            for (Archetype a : archetypes) {
                writer.writeNext(new String[]{
                    a.companyId(),
                    safe(a.companyName()),
                    a.industry(),
                    a.key().metroAreaId(),
                    Integer.toString(a.key().canonicalRoleId()),
                    a.seniority().dbValue(),
                    a.recordType().dbValue(),
                    Integer.toString(a.headcountP10()),
                    Integer.toString(a.headcountP50()),
                    Integer.toString(a.headcountP90()),
                    number(a.salaryP25()),
                    number(a.salaryP50()),
                    number(a.salaryP75()),
                    String.format(Locale.ROOT, "%.4f", a.compositeConfidence()),
                    mapper.writeValueAsString(a.evidenceSummary())
                });
            }
        }
        logger.info("Wrote {} archetypes to CSV file: {}", archetypes.size(), file);
    }

    @Override
    public void writeSalaryEstimates(List<SalaryEstimate> estimates) throws IOException {
        Path file = prepareOutput(SALARY_ESTIMATES_FILE);
        try (CSVWriter writer = new CSVWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
            writer.writeNext(SALARY_HEADER);
            for (SalaryEstimate e : estimates) {
                writer.writeNext(new String[]{
                    e.companyId(),
                    e.key().metroAreaId(),
                    Integer.toString(e.key().canonicalRoleId()),
                    number(e.p10()), number(e.p25()), number(e.p50()), number(e.p75()), number(e.p90()),
                    number(e.mean()), number(e.stddev()),
                    Integer.toString(e.observationCount()),
                    Integer.toString(e.discardedCount()),
                    String.format(Locale.ROOT, "%.2f", e.effectiveSampleSize()),
                    String.format(Locale.ROOT, "%.4f", e.shrinkageFactor()),
                    number(e.oewsMedian()),
                    e.method()
                });
            }
        }
        logger.info("Wrote {} salary estimates to CSV file: {}", estimates.size(), file);
    }

    private Path prepareOutput(String filename) throws IOException {
        if (!Files.exists(outputDir)) Files.createDirectories(outputDir);
        return outputDir.resolve(filename);
    }

    private static String number(Double value) {
        return value == null ? "" : String.format(Locale.ROOT, "%.2f", value);
    }

    /**
     * Collapses CR/LF into a single space and trims.
     */
    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }

    private static List<Row> readTable(Path file) throws IOException {
        List<String[]> lines;
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8); CSVReader reader = new CSVReader(in)) {
            lines = reader.readAll();
        } catch (CsvException e) {
            throw new IOException("Malformed CSV " + file + " at line " + e.getLineNumber() + ": " + e.getMessage(), e);
        }
        if (lines.isEmpty()) return List.of();
        Map<String, Integer> columns = new HashMap<>();
        String[] header = lines.get(0);
        for (int i = 0; i < header.length; i++) {
            // strip a UTF-8 BOM on the first column
            columns.put(header[i].replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT), i);
        }
        List<Row> rows = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            String[] values = lines.get(i);
            if (values.length == 1 && values[0].isBlank()) continue;
            rows.add(new Row(file.getFileName().toString(), i + 1, columns, values));
        }
        return rows;
    }

    /**
     * One data line, addressed by header name.
     */
    private record Row(String file, int line, Map<String, Integer> columns, String[] values) {

        String text(String column) {
            Integer idx = columns.get(column);
            if (idx == null || idx >= values.length) return null;
            String v = values[idx].trim();
            return v.isEmpty() ? null : v;
        }

        String required(String column) {
            String v = text(column);
            if (v == null) throw invalid("missing " + column, null);
            return v;
        }

        int requiredInt(String column) {
            required(column);
            return intValue(column, 0);
        }

        int intValue(String column, int defaultValue) {
            String v = text(column);
            if (v == null) return defaultValue;
            try {
                return (int) Math.round(Double.parseDouble(v.replace(",", "")));
            } catch (NumberFormatException e) {
                throw invalid("not a number in " + column + ": " + v, e);
            }
        }

        double doubleValue(String column, double defaultValue) {
            Double v = optionalDouble(column);
            return v == null ? defaultValue : v;
        }

        Double optionalDouble(String column) {
            String v = text(column);
            if (v == null) return null;
            try {
                return Double.valueOf(v.replace(",", "").replace("$", ""));
            } catch (NumberFormatException e) {
                throw invalid("not a number in " + column + ": " + v, e);
            }
        }

        /**
         * Builds a record from this row, tagging validation failures with the file position.
         */
        <T> T parse(Supplier<T> factory) {
            try {
                return factory.get();
            } catch (EstimationException e) {
                throw e.getWhere() == null ? invalid(e.getMessage(), e) : e;
            } catch (IllegalArgumentException | NullPointerException e) {
                throw invalid(e.getMessage(), e);
            }
        }

        private EstimationException invalid(String message, Throwable cause) {
            return new EstimationException(ErrorKind.INVALID_INPUT, message, file + ":" + line, cause);
        }
    }
}
