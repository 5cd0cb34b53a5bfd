package exray.bridge.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import exray.bridge.error.DuplicateRunException;
import exray.bridge.model.RunPatch;
import exray.bridge.model.RunRecord;
import exray.bridge.repository.RunRepository;
import exray.bridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of RunRepository.
 * Writes to an existing run hold its row lock for the whole read-merge-write.
 */
public class JdbcRunRepository implements RunRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunRepository.class);

    private final Database db;
    private final Clock clock;

    public JdbcRunRepository(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcRunRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public RunRecord create(RunRecord record) {
        Instant now = clock.instant();
        RunRecord stored = record.toBuilder().createdAt(now).updatedAt(now).build();

        String sql = """
                    INSERT INTO runs (id, document, created_at, updated_at)
                    VALUES (?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            if (exists(conn, record.runId())) {
                throw new DuplicateRunException(record.runId());
            }
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, stored.runId());
                ps.setString(2, Jsons.toJson(RunRecordCodec.encode(stored)));
                ps.setTimestamp(3, Timestamp.from(now));
                ps.setTimestamp(4, Timestamp.from(now));
                ps.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                // lost a race on the primary key
                if (exists(conn, record.runId())) {
                    throw new DuplicateRunException(record.runId());
                }
                throw e;
            }
            log.debug("Created run: {}", stored.runId());
            return stored;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create run: " + record.runId(), e);
        }
    }

    @Override
    public Optional<RunRecord> get(String runId) {
        String sql = "SELECT id, document FROM runs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(readRow(conn, rs.getString("id"), rs.getString("document")));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to get run: " + runId, e);
        }
    }

    @Override
    public List<RunRecord> list() {
        String sql = "SELECT id, document FROM runs ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            List<String[]> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new String[] { rs.getString("id"), rs.getString("document") });
                }
            }
            List<RunRecord> runs = new ArrayList<>(rows.size());
            for (String[] row : rows) {
                runs.add(readRow(conn, row[0], row[1]));
            }
            return runs;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list runs", e);
        }
    }

    @Override
    public Optional<RunRecord> update(String runId, RunPatch patch) {
        try (Connection conn = db.getConnection()) {
            Optional<JsonNode> locked = selectForUpdate(conn, runId);
            if (locked.isEmpty()) {
                conn.rollback();
                return Optional.empty();
            }

            ObjectNode doc = RunRecordUpgrader.upgrade(runId, locked.get()).document();
            doc.setAll(RunRecordCodec.encodePatch(patch));
            Instant now = clock.instant();
            doc.put(RunRecordCodec.UPDATED_AT, now.toString());
            RunRecordUpgrader.backfillResultObject(doc);

            write(conn, runId, doc, now);
            conn.commit();

            log.debug("Updated run: {}", runId);
            return Optional.of(RunRecordCodec.decode(doc));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update run: " + runId, e);
        }
    }

    // --- Helpers ---

    /**
     * Decode a row, persisting the schema upgrade when it changed something.
     */
    private RunRecord readRow(Connection conn, String id, String json) throws SQLException {
        RunRecordUpgrader.Result upgraded = RunRecordUpgrader.upgrade(id, parse(id, json));
        if (!upgraded.changed()) {
            return RunRecordCodec.decode(upgraded.document());
        }

        // re-read under the row lock so a concurrent update is not overwritten
        Optional<JsonNode> locked = selectForUpdate(conn, id);
        if (locked.isEmpty()) {
            conn.rollback();
            return RunRecordCodec.decode(upgraded.document());
        }
        RunRecordUpgrader.Result current = RunRecordUpgrader.upgrade(id, locked.get());
        if (current.changed()) {
            write(conn, id, current.document(), null);
            log.info("Upgraded stored run {} to schema version {}", id, RunRecordUpgrader.CURRENT_VERSION);
        }
        conn.commit();
        return RunRecordCodec.decode(current.document());
    }

    private Optional<JsonNode> selectForUpdate(Connection conn, String id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT document FROM runs WHERE id = ? FOR UPDATE")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(parse(id, rs.getString("document")));
            }
        }
    }

    private void write(Connection conn, String id, ObjectNode doc, Instant updatedAt) throws SQLException {
        String sql = updatedAt != null
                ? "UPDATE runs SET document = ?, updated_at = ? WHERE id = ?"
                : "UPDATE runs SET document = ? WHERE id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, Jsons.toJson(doc));
            if (updatedAt != null) {
                ps.setTimestamp(2, Timestamp.from(updatedAt));
                ps.setString(3, id);
            } else {
                ps.setString(2, id);
            }
            ps.executeUpdate();
        }
    }

    private boolean exists(Connection conn, String id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM runs WHERE id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static JsonNode parse(String id, String json) {
        try {
            return Jsons.mapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Stored run " + id + " is not valid JSON", e);
        }
    }
}
