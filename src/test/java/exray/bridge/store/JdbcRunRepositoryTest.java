package exray.bridge.store;

import com.fasterxml.jackson.databind.JsonNode;
import exray.bridge.config.BridgeConfig;
import exray.bridge.error.DuplicateRunException;
import exray.bridge.model.RunPatch;
import exray.bridge.model.RunPhase;
import exray.bridge.model.RunRecord;
import exray.bridge.model.RunStatus;
import exray.bridge.model.WorkflowKind;
import exray.bridge.testing.MutableClock;
import exray.bridge.util.Jsons;
import org.junit.jupiter.api.*;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRunRepositoryTest {

    private static Database db;
    private static MutableClock clock;
    private static JdbcRunRepository repo;

    @BeforeAll
    static void setup() {
        // Use in-memory H2 for tests
        BridgeConfig config = BridgeConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-runs;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        repo = new JdbcRunRepository(db, clock);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanRuns() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM runs");
            conn.commit();
        }
    }

    private static RunRecord run(String id) {
        return RunRecord.builder()
                .runId(id)
                .workflowKind(WorkflowKind.CTGAN)
                .parameters(Map.of("no_of_epochs", "300"))
                .engineName("ctgan-" + id)
                .namespace("argo")
                .status(RunStatus.of(RunPhase.SUBMITTED))
                .inputObject("input/" + id + "_d.csv")
                .inputFileName(id + "_d.csv")
                .build();
    }

    private static void insertRaw(String id, String document, Instant createdAt) throws Exception {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "INSERT INTO runs (id, document, created_at, updated_at) VALUES (?, ?, ?, ?)")) {
            ps.setString(1, id);
            ps.setString(2, document);
            ps.setTimestamp(3, Timestamp.from(createdAt));
            ps.setTimestamp(4, Timestamp.from(createdAt));
            ps.executeUpdate();
            conn.commit();
        }
    }

    private static JsonNode rawDocument(String id) throws Exception {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT document FROM runs WHERE id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                assertTrue(rs.next());
                JsonNode doc = Jsons.mapper().readTree(rs.getString(1));
                conn.commit();
                return doc;
            }
        }
    }

    @Test
    void createAndGet() {
        RunRecord created = repo.create(run("r1"));

        assertEquals(clock.instant(), created.createdAt());
        assertEquals(clock.instant(), created.updatedAt());

        Optional<RunRecord> found = repo.get("r1");
        assertTrue(found.isPresent());
        assertEquals("ctgan", found.get().workflowKind());
        assertEquals("300", found.get().parameters().get("no_of_epochs"));
        assertEquals("Submitted", found.get().status().phase());
        assertEquals("output/r1_d.csv", found.get().resultObject(), "result object backfilled on read");
    }

    @Test
    void getMissing() {
        assertTrue(repo.get("nope").isEmpty());
        assertTrue(repo.update("nope", RunPatch.resultObject("x")).isEmpty());
    }

    @Test
    void duplicateCreateRejected() {
        RunRecord original = repo.create(run("dup"));

        RunRecord different = run("dup").toBuilder().engineName("other-wf").workflowKind(WorkflowKind.LLM).build();
        assertThrows(DuplicateRunException.class, () -> repo.create(different));
        assertEquals(1, repo.list().size());

        RunRecord stored = repo.get("dup").orElseThrow();
        assertEquals(original.engineName(), stored.engineName());
        assertEquals(original.workflowKind(), stored.workflowKind());
    }

    @Test
    void listOldestFirst() {
        repo.create(run("second-created-first"));
        clock.advance(Duration.ofMinutes(1));
        repo.create(run("a-later"));

        List<RunRecord> runs = repo.list();
        assertEquals(List.of("second-created-first", "a-later"), runs.stream().map(RunRecord::runId).toList());
    }

    @Test
    @DisplayName("Update replaces patched fields and bumps updated_at only")
    void updateMerges() {
        repo.create(run("r2"));
        clock.advance(Duration.ofSeconds(30));

        RunStatus done = new RunStatus("Succeeded", "2024-05-01T10:00:05Z", "2024-05-01T10:00:25Z", "1/1", null);
        RunRecord updated = repo.update("r2", RunPatch.status(done)).orElseThrow();

        assertEquals(done, updated.status());
        assertTrue(updated.createdAt().isBefore(updated.updatedAt()));
        assertEquals(clock.instant(), updated.updatedAt());
        assertEquals("ctgan-r2", updated.engineName());
        assertEquals(done, repo.get("r2").orElseThrow().status());
    }

    @Test
    @DisplayName("Legacy rows are upgraded and written back once")
    void upgradesLegacyRows() throws Exception {
        insertRaw("legacy", """
                {"runID": "legacy", "workflow": "llm", "argo_name": "llm-zz",
                 "parameters": {"parallelism": 2}, "input_file_name": "legacy_d.csv",
                 "status": {"phase": "Running"}}
                """, Instant.parse("2024-04-01T00:00:00Z"));

        RunRecord run = repo.get("legacy").orElseThrow();

        assertEquals("llm", run.workflowKind());
        assertEquals("llm-zz", run.engineName());
        assertEquals("2", run.parameters().get("parallelism"));
        assertEquals("output/legacy_d.csv", run.resultObject());

        JsonNode stored = rawDocument("legacy");
        assertEquals(RunRecordUpgrader.CURRENT_VERSION, stored.path("schema_version").asInt());
        assertEquals("llm-zz", stored.path("engine_name").asText());
        assertFalse(stored.has("argo_name"));
        assertFalse(stored.has("updated_at"), "upgrade does not count as an update");
    }

    @Test
    void databaseIsHealthy() {
        assertTrue(db.isHealthy());
    }
}
