package com.unlistedjobs.archetype;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Archetype store backed by PostgreSQL.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Creates {@code job_archetypes} with the natural-key constraint
 *       {@code (company_id, metro_area_id, canonical_role_id, seniority, record_type)}.</li>
 *   <li>Upserts with {@code INSERT ... ON CONFLICT ... DO UPDATE}, one transaction per call.</li>
 *   <li>Stores the evidence summary as JSONB.</li>
 *   <li>Replaces a whole tier (delete then insert) in one transaction, so rows the reconciler dropped do not
 *       linger from an earlier run.</li>
 * </ul>
 * Write failures roll back and surface as {@link ErrorKind#PERSISTENCE_FAILURE}; retrying is the caller's call.
 *
 * @author Archetype Inference Team
 * @since 1.0
 */
@SuppressWarnings("SqlResolve")
public class PostgresService implements ArchetypeStoreInterface {
    private static final Logger logger = LoggerFactory.getLogger(PostgresService.class);

    private static final String COLUMNS = "company_id, company_name, industry, metro_area_id, canonical_role_id, "
        + "seniority, record_type, headcount_p10, headcount_p50, headcount_p90, salary_p25, salary_p50, salary_p75, "
        + "composite_confidence, evidence_summary";

    private static final String UPSERT_SQL = "INSERT INTO job_archetypes (" + COLUMNS + ") "
        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
        + "ON CONFLICT ON CONSTRAINT job_archetypes_natural_key DO UPDATE SET "
        + "company_name = EXCLUDED.company_name, industry = EXCLUDED.industry, "
        + "headcount_p10 = EXCLUDED.headcount_p10, headcount_p50 = EXCLUDED.headcount_p50, "
        + "headcount_p90 = EXCLUDED.headcount_p90, salary_p25 = EXCLUDED.salary_p25, "
        + "salary_p50 = EXCLUDED.salary_p50, salary_p75 = EXCLUDED.salary_p75, "
        + "composite_confidence = EXCLUDED.composite_confidence, evidence_summary = EXCLUDED.evidence_summary, "
        + "updated_at = now()";

    private final ObjectMapper mapper = new ObjectMapper();
    private final String url;
    private final String user;
    private final String password;

    /**
     * Constructs a PostgresService with the given connection parameters.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     */
    public PostgresService(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    @Override
    public void createTables() {
        String table = "CREATE TABLE IF NOT EXISTS job_archetypes ("
            + "id BIGSERIAL PRIMARY KEY, "
            + "company_id TEXT NOT NULL, company_name TEXT, industry TEXT NOT NULL, "
            + "metro_area_id TEXT NOT NULL, canonical_role_id INTEGER NOT NULL, "
            + "seniority TEXT NOT NULL, "
            + "record_type TEXT NOT NULL CHECK (record_type IN ('observed', 'known_employer_inferred', 'cbp_synthetic')), "
            + "headcount_p10 INTEGER NOT NULL, headcount_p50 INTEGER NOT NULL, headcount_p90 INTEGER NOT NULL, "
            + "salary_p25 DOUBLE PRECISION, salary_p50 DOUBLE PRECISION, salary_p75 DOUBLE PRECISION, "
            + "composite_confidence DOUBLE PRECISION NOT NULL CHECK (composite_confidence BETWEEN 0 AND 1), "
            + "evidence_summary JSONB, "
            + "updated_at TIMESTAMPTZ NOT NULL DEFAULT now(), "
            + "CONSTRAINT job_archetypes_natural_key "
            + "UNIQUE (company_id, metro_area_id, canonical_role_id, seniority, record_type)"
            + ")";
        String industryIndex = "CREATE INDEX IF NOT EXISTS job_archetypes_tier_industry "
            + "ON job_archetypes (record_type, industry)";
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(table);
            stmt.execute(industryIndex);
            logger.info("Ensured job_archetypes table exists.");
        } catch (SQLException e) {
            throw new EstimationException(ErrorKind.PERSISTENCE_FAILURE, "Error creating tables: " + e.getMessage(), e);
        }
    }

    @Override
    public int upsertAll(List<Archetype> archetypes) {
        if (archetypes == null || archetypes.isEmpty()) return 0;
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                int written = insertBatch(conn, archetypes);
                conn.commit();
                logger.debug("Upserted {} archetypes", written);
                return written;
            } catch (SQLException | JsonProcessingException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new EstimationException(ErrorKind.PERSISTENCE_FAILURE, "Upsert failed: " + e.getMessage(),
                archetypes.get(0).key().toString(), e);
        }
    }

    @Override
    public int replaceTier(RecordType recordType, List<Archetype> archetypes) {
        for (Archetype a : archetypes) {
            if (a.recordType() != recordType) {
                throw new EstimationException(ErrorKind.INVALID_INPUT,
                    "Archetype of tier " + a.recordType() + " in replacement of " + recordType, a.companyId());
            }
        }
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try (PreparedStatement delete = conn.prepareStatement("DELETE FROM job_archetypes WHERE record_type = ?")) {
                delete.setString(1, recordType.dbValue());
                int removed = delete.executeUpdate();
                int written = archetypes.isEmpty() ? 0 : insertBatch(conn, archetypes);
                conn.commit();
                logger.info("Replaced {} tier: {} rows removed, {} written", recordType.dbValue(), removed, written);
                return written;
            } catch (SQLException | JsonProcessingException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new EstimationException(ErrorKind.PERSISTENCE_FAILURE,
                "Replace of tier failed: " + e.getMessage(), recordType.dbValue(), e);
        }
    }

    @Override
    public List<Archetype> loadTier(RecordType recordType) {
        String sql = "SELECT " + COLUMNS + " FROM job_archetypes WHERE record_type = ? "
            + "ORDER BY company_id, metro_area_id, canonical_role_id, seniority";
        List<Archetype> out = new ArrayList<>();
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, recordType.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readArchetype(rs));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new EstimationException(ErrorKind.PERSISTENCE_FAILURE,
                "Loading tier failed: " + e.getMessage(), recordType.dbValue(), e);
        }
        return out;
    }

    private int insertBatch(Connection conn, List<Archetype> archetypes) throws SQLException, JsonProcessingException {
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            for (Archetype a : archetypes) {
                ps.setString(1, a.companyId());
                ps.setString(2, a.companyName());
                ps.setString(3, a.industry());
                ps.setString(4, a.key().metroAreaId());
                ps.setInt(5, a.key().canonicalRoleId());
                ps.setString(6, a.seniority().dbValue());
                ps.setString(7, a.recordType().dbValue());
                ps.setInt(8, a.headcountP10());
                ps.setInt(9, a.headcountP50());
                ps.setInt(10, a.headcountP90());
                setNullableDouble(ps, 11, a.salaryP25());
                setNullableDouble(ps, 12, a.salaryP50());
                setNullableDouble(ps, 13, a.salaryP75());
                ps.setDouble(14, a.compositeConfidence());
                ps.setObject(15, mapper.writeValueAsString(a.evidenceSummary()), Types.OTHER);
                ps.addBatch();
            }
            int written = 0;
            for (int count : ps.executeBatch()) {
                written += count == Statement.SUCCESS_NO_INFO ? 1 : count;
            }
            return written;
        }
    }

    private Archetype readArchetype(ResultSet rs) throws SQLException, JsonProcessingException {
        String json = rs.getString("evidence_summary");
        Map<String, Object> summary = json == null ? Map.of()
            : mapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        return new Archetype(
            rs.getString("company_id"),
            rs.getString("company_name"),
            new MetroRoleKey(rs.getString("metro_area_id"), rs.getInt("canonical_role_id")),
            Seniority.fromDbValue(rs.getString("seniority")),
            RecordType.fromDbValue(rs.getString("record_type")),
            rs.getString("industry"),
            rs.getInt("headcount_p10"),
            rs.getInt("headcount_p50"),
            rs.getInt("headcount_p90"),
            nullableDouble(rs, "salary_p25"),
            nullableDouble(rs, "salary_p50"),
            nullableDouble(rs, "salary_p75"),
            rs.getDouble("composite_confidence"),
            summary);
    }

    private static void setNullableDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value != null) ps.setDouble(index, value); else ps.setNull(index, Types.DOUBLE);
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double v = rs.getDouble(column);
        return rs.wasNull() ? null : v;
    }

    /**
     * Starts an embedded PostgreSQL instance on a specific port for local use and returns it.
     * @param dataDir directory under which to store DB data
     * @param port port number for the Postgres server
     * @return EmbeddedPostgres instance
     */
    public static EmbeddedPostgres startEmbedded(String dataDir, int port) {
        try {
            EmbeddedPostgres postgres = EmbeddedPostgres.builder()
                .setDataDirectory(Paths.get(dataDir))
                .setCleanDataDirectory(false)
                .setPort(port)
                .start();
            logger.info("Embedded PostgreSQL started at {} on port {}", dataDir, port);
            return postgres;
        } catch (Exception e) {
            logger.error("Failed to start embedded PostgreSQL on port {}: {}", port, e.getMessage());
            throw new EstimationException(ErrorKind.PERSISTENCE_FAILURE, "Embedded PostgreSQL did not start", e);
        }
    }

    /**
     * JDBC URL of an embedded instance.
     */
    public static String jdbcUrl(EmbeddedPostgres postgres) {
        return String.format("jdbc:postgresql://localhost:%d/postgres", postgres.getPort());
    }
}
