package com.unlistedjobs.archetype;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Year;
import java.util.List;

/**
 * Main entry point for the archetype inference batch.
 * Estimates per-company headcount and salary for every metro x role cell from CSV inputs and optionally
 * persists the archetypes to PostgreSQL.
 * <p>
 * Modes: {@code run} (default) runs the batch; {@code db} starts the embedded PostgreSQL instance only, for
 * inspection with a DB client. Settings are read from system properties, then environment variables.
 *
 * @author Archetype Inference Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final String DEFAULT_PG_DATA_DIR = "archetype-data/pgdata";

    /**
     * Builds the estimation config from {@code CONFIG_FILE} (if set) plus the sample/seed overrides.
     */
    static EstimationConfig loadConfig() throws IOException {
        String configFile = Utils.envOrProp("CONFIG_FILE", null);
        EstimationConfig config;
        if (configFile != null) {
            try (InputStream in = Files.newInputStream(Paths.get(configFile))) {
                config = EstimationConfig.fromJson(in);
            }
            logger.info("Loaded estimation config from {}", configFile);
        } else {
            config = EstimationConfig.defaults();
        }
        Integer samples = Utils.envOrPropInt("MONTE_CARLO_SAMPLES", null);
        String seed = Utils.envOrProp("RANDOM_SEED", null);
        if (samples == null && seed == null) return config;
        EstimationConfig.Builder b = config.toBuilder();
        if (samples != null) b.monteCarloSamples(samples);
        if (seed != null) {
            try {
                b.randomSeed(Long.valueOf(seed));
            } catch (NumberFormatException e) {
                throw new EstimationException(ErrorKind.INVALID_INPUT, "RANDOM_SEED is not a number: " + seed, e);
            }
        }
        return b.build();
    }

    static BatchOptions loadOptions() {
        int year = Utils.envOrPropInt("REFERENCE_YEAR", Year.now().getValue() - 1);
        return new BatchOptions(year,
            Utils.envOrPropInt("LIMIT_METRO_AREAS", null),
            Utils.envOrPropInt("LIMIT_ROLES", null),
            Boolean.parseBoolean(Utils.envOrProp("PERSIST", "false")));
    }

    /**
     * Runs the batch end to end: load inputs, estimate, reconcile, persist and export.
     * @param config estimation config
     * @param options batch control surface
     * @param csvService input/output files
     * @param store archetype store, null for dry runs
     * @return batch result
     * @throws IOException if inputs cannot be read or exports written
     */
    static BatchResult runBatch(EstimationConfig config, BatchOptions options, CsvService csvService,
                                ArchetypeStoreInterface store) throws IOException {
        List<EvidenceRow> evidence = csvService.loadEvidence();
        EvidenceAggregatorInterface aggregator = new EvidenceAggregator(config, evidence);
        SyntheticTierGenerator generator = new SyntheticTierGenerator(csvService.loadRoleMix(),
            key -> csvService.getPrior(key, options.referenceYear()));
        ArchetypeBatchRunner runner = new ArchetypeBatchRunner(config, csvService, aggregator, store, generator);

        Thread stopper = new Thread(runner::cancel, "archetype-batch-cancel");
        Runtime.getRuntime().addShutdownHook(stopper);
        try {
            BatchResult result = runner.run(options, csvService.loadObservedArchetypes(), csvService.loadEstablishments());
            csvService.writeArchetypes(result.archetypes());
            csvService.writeSalaryEstimates(result.salaries());
            return result;
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(stopper);
            } catch (IllegalStateException e) {
                logger.debug("JVM already shutting down; cancel hook stays registered");
            }
        }
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments: optional mode ({@code run} or {@code db})
     */
    public static void main(String[] args) {
        String mode = (args != null && args.length > 0) ? args[0].trim().toLowerCase() : "run";
        String pgDataDir = Utils.envOrProp("EMBEDDED_PG_DATA_DIR", DEFAULT_PG_DATA_DIR);
        int embeddedPort = Utils.envOrPropInt("EMBEDDED_PG_PORT", 5432);
        EmbeddedPostgres postgres = null;
        try {
            if (mode.equals("db")) {
                postgres = PostgresService.startEmbedded(pgDataDir, embeddedPort);
                new PostgresService(PostgresService.jdbcUrl(postgres), "postgres", "postgres").createTables();
                System.out.println("Embedded Postgres started.");
                System.out.println("JDBC URL: " + PostgresService.jdbcUrl(postgres));
                System.out.println("DB user: postgres");
                System.out.println("DB password: postgres");
                System.out.println("Data directory: " + pgDataDir);
                System.out.println("Press Enter to stop the embedded DB and exit.");
                try {
                    System.in.read();
                } catch (IOException e) {
                    logger.warn("Could not read from stdin: {}", e.getMessage());
                }
                return;
            }
            if (!mode.equals("run")) {
                logger.error("Unknown mode '{}'; expected 'run' or 'db'", mode);
                return;
            }

            EstimationConfig config = loadConfig();
            BatchOptions options = loadOptions();
            Path dataDir = Paths.get(Utils.envOrProp("DATA_DIR", "data"));
            Path outputDir = Paths.get(Utils.envOrProp("OUTPUT_DIR", "archetype-data/output"));
            CsvService csvService = new CsvService(dataDir, outputDir);

            ArchetypeStoreInterface store = null;
            if (options.persist()) {
                String dbUrl = Utils.envOrProp("DB_URL", null);
                PostgresService postgresService;
                if (dbUrl != null) {
                    postgresService = new PostgresService(dbUrl,
                        Utils.envOrProp("DB_USER", "postgres"), Utils.envOrProp("DB_PASS", "postgres"));
                } else {
                    postgres = PostgresService.startEmbedded(pgDataDir, embeddedPort);
                    postgresService = new PostgresService(PostgresService.jdbcUrl(postgres), "postgres", "postgres");
                }
                postgresService.createTables();
                store = postgresService;
            }

            BatchSummary summary = runBatch(config, options, csvService, store).summary();
            logger.info("Batch complete: {} cells processed, {} skipped, {} failed. Output in {}",
                summary.cellsProcessed(), summary.cellsSkipped(), summary.cellsFailed(), outputDir.toAbsolutePath());
        } catch (Exception e) {
            logger.error("Batch aborted: {}", e.getMessage(), e);
        } finally {
            if (postgres != null) {
                try {
                    postgres.close();
                    logger.info("Embedded PostgreSQL stopped.");
                } catch (IOException e) {
                    logger.warn("Failed to stop embedded PostgreSQL: {}", e.getMessage());
                }
            }
        }
    }
}
