package it.aw.editalanalysis.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.editalanalysis.model.AnalysisRecord;
import it.aw.editalanalysis.model.AnalysisResult;
import it.aw.editalanalysis.model.AnalysisSummary;
import it.aw.editalanalysis.model.RegistryStats;
import it.aw.editalanalysis.model.ThresholdStatus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.*;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Storico delle analisi, persistito nella tabella {@code analyses} di un file DuckDB.
 * <p>
 * Un'unica connessione JDBC è condivisa da tutte le operazioni; l'accesso
 * è sincronizzato perché DuckDBConnection non è thread-safe.
 * <p>
 * Migrazione schema: se all'avvio mancano colonne dello schema corrente
 * la tabella viene ricreata e lo storico precedente va perso.
 */
@Component
public class AnalysisRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnalysisRegistry.class);

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS analyses (
                analysis_id     VARCHAR   PRIMARY KEY,
                bundle_path     VARCHAR   NOT NULL,
                target          VARCHAR   NOT NULL,
                threshold       INTEGER   NOT NULL,
                force_match     BOOLEAN   NOT NULL,
                bid_number      VARCHAR   NOT NULL,
                city            VARCHAR   NOT NULL,
                target_match    BOOLEAN   NOT NULL,
                threshold_match VARCHAR   NOT NULL,
                is_relevant     BOOLEAN   NOT NULL,
                summary         VARCHAR   NOT NULL,
                justification   VARCHAR   NOT NULL,
                metadata        VARCHAR   NOT NULL,
                has_error       BOOLEAN   NOT NULL,
                error_message   VARCHAR   NOT NULL,
                analyzed_at     TIMESTAMP NOT NULL
            )
            """;

    private static final Set<String> REQUIRED_COLUMNS = Set.of(
            "analysis_id", "bundle_path", "target", "threshold", "force_match", "bid_number", "city",
            "target_match", "threshold_match", "is_relevant", "summary", "justification", "metadata",
            "has_error", "error_message", "analyzed_at");

    private static final String SUMMARY_COLUMNS =
            "analysis_id, bundle_path, target, threshold, bid_number, is_relevant, has_error, analyzed_at";

    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private final String dbPath;
    private final ObjectMapper objectMapper;
    private Connection conn;

    public AnalysisRegistry(ObjectMapper objectMapper, @Value("${store.registry.path}") String dbPath) {
        this.objectMapper = objectMapper;
        this.dbPath = dbPath;
    }

    @PostConstruct
    void init() throws SQLException, IOException {
        Path path = Paths.get(dbPath).toAbsolutePath();
        Files.createDirectories(path.getParent());
        conn = DriverManager.getConnection("jdbc:duckdb:" + path);
        migrateIfNeeded();
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE);
        }
        log.info("AnalysisRegistry: tabella 'analyses' pronta su {}", path);
    }

    private void migrateIfNeeded() throws SQLException {
        Set<String> existing = new HashSet<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT column_name FROM information_schema.columns WHERE table_name = 'analyses'")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) existing.add(rs.getString(1));
            }
        }
        if (!existing.isEmpty() && !existing.containsAll(REQUIRED_COLUMNS)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("DROP TABLE IF EXISTS analyses");
            }
            log.warn("AnalysisRegistry: schema obsoleto rilevato, tabella 'analyses' ricreata");
        }
    }

    @PreDestroy
    void close() {
        try {
            if (conn != null && !conn.isClosed()) conn.close();
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione DuckDB registry: {}", e.getMessage());
        }
    }

    public synchronized void register(AnalysisRecord record) {
        String sql = """
                INSERT INTO analyses
                    (analysis_id, bundle_path, target, threshold, force_match, bid_number, city, target_match,
                     threshold_match, is_relevant, summary, justification, metadata, has_error, error_message, analyzed_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (analysis_id) DO UPDATE SET
                    bundle_path     = EXCLUDED.bundle_path,
                    target          = EXCLUDED.target,
                    threshold       = EXCLUDED.threshold,
                    force_match     = EXCLUDED.force_match,
                    bid_number      = EXCLUDED.bid_number,
                    city            = EXCLUDED.city,
                    target_match    = EXCLUDED.target_match,
                    threshold_match = EXCLUDED.threshold_match,
                    is_relevant     = EXCLUDED.is_relevant,
                    summary         = EXCLUDED.summary,
                    justification   = EXCLUDED.justification,
                    metadata        = EXCLUDED.metadata,
                    has_error       = EXCLUDED.has_error,
                    error_message   = EXCLUDED.error_message,
                    analyzed_at     = EXCLUDED.analyzed_at
                """;
        AnalysisResult result = record.result();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, record.analysisId());
            ps.setString(2, record.bundlePath());
            ps.setString(3, record.target());
            ps.setInt(4, record.threshold());
            ps.setBoolean(5, record.forceMatch());
            ps.setString(6, result.bidNumber());
            ps.setString(7, nullToEmpty(result.city()));
            ps.setBoolean(8, result.targetMatch());
            ps.setString(9, result.thresholdMatch().value());
            ps.setBoolean(10, result.isRelevant());
            ps.setString(11, nullToEmpty(result.summary()));
            ps.setString(12, nullToEmpty(result.justification()));
            ps.setString(13, objectMapper.writeValueAsString(result.metadata()));
            ps.setBoolean(14, record.hasError());
            ps.setString(15, nullToEmpty(record.errorMessage()));
            ps.setTimestamp(16, Timestamp.valueOf(record.analyzedAt()));
            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new RuntimeException("Errore salvataggio analisi nel registry", e);
        }
    }

    public synchronized Optional<AnalysisRecord> findById(String analysisId) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM analyses WHERE analysis_id = ?")) {
            ps.setString(1, analysisId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(toRecord(rs));
            }
        } catch (SQLException | IOException e) {
            throw new RuntimeException("Errore lettura analisi dal registry", e);
        }
        return Optional.empty();
    }

    public synchronized List<AnalysisSummary> findAllAsSummary() {
        List<AnalysisSummary> result = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT " + SUMMARY_COLUMNS + " FROM analyses ORDER BY analyzed_at DESC")) {
            while (rs.next()) result.add(toSummary(rs));
        } catch (SQLException e) {
            throw new RuntimeException("Errore lettura registry (summary)", e);
        }
        return result;
    }

    /** @return true se l'analisi esisteva ed è stata rimossa */
    public synchronized boolean remove(String analysisId) {
        try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM analyses WHERE analysis_id = ?")) {
            ps.setString(1, analysisId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Errore rimozione analisi dal registry", e);
        }
    }

    public synchronized RegistryStats stats() {
        String sql = """
                SELECT COUNT(*),
                       COUNT(CASE WHEN is_relevant THEN 1 END),
                       COUNT(CASE WHEN has_error THEN 1 END)
                FROM analyses
                """;
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return new RegistryStats(rs.getInt(1), rs.getInt(2), rs.getInt(3), "DuckDB");
        } catch (SQLException e) {
            throw new RuntimeException("Errore calcolo statistiche registry", e);
        }
    }

    private AnalysisRecord toRecord(ResultSet rs) throws SQLException, IOException {
        AnalysisResult result = new AnalysisResult(
                rs.getString("bid_number"),
                rs.getString("city"),
                objectMapper.readValue(rs.getString("metadata"), METADATA_TYPE),
                rs.getBoolean("target_match"),
                ThresholdStatus.fromValue(rs.getString("threshold_match")),
                rs.getBoolean("is_relevant"),
                rs.getString("summary"),
                rs.getString("justification"));
        return new AnalysisRecord(
                rs.getString("analysis_id"),
                rs.getString("bundle_path"),
                rs.getString("target"),
                rs.getInt("threshold"),
                rs.getBoolean("force_match"),
                rs.getTimestamp("analyzed_at").toLocalDateTime(),
                result,
                rs.getBoolean("has_error"),
                rs.getString("error_message"));
    }

    private AnalysisSummary toSummary(ResultSet rs) throws SQLException {
        return new AnalysisSummary(
                rs.getString("analysis_id"),
                rs.getString("bundle_path"),
                rs.getString("target"),
                rs.getInt("threshold"),
                rs.getString("bid_number"),
                rs.getBoolean("is_relevant"),
                rs.getBoolean("has_error"),
                rs.getTimestamp("analyzed_at").toLocalDateTime());
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
