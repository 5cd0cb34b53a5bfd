package exray.bridge.store;

import com.fasterxml.jackson.databind.JsonNode;
import exray.bridge.error.DuplicateRunException;
import exray.bridge.model.RunPatch;
import exray.bridge.model.RunPhase;
import exray.bridge.model.RunRecord;
import exray.bridge.model.RunStatus;
import exray.bridge.model.WorkflowKind;
import exray.bridge.testing.MutableClock;
import exray.bridge.util.Jsons;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileRunRepositoryTest {

    @TempDir
    Path dir;

    private Path file;
    private MutableClock clock;
    private JsonFileRunRepository repo;

    @BeforeEach
    void setUp() {
        file = dir.resolve("state").resolve("exray_data.json");
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        repo = new JsonFileRunRepository(file, clock);
    }

    private static RunRecord run(String id, WorkflowKind kind) {
        return RunRecord.builder()
                .runId(id)
                .workflowKind(kind)
                .engineName(kind.tag() + "-" + id)
                .status(RunStatus.of(RunPhase.SUBMITTED))
                .inputFileName(id + "_d.csv")
                .build();
    }

    private JsonNode readFile() throws Exception {
        return Jsons.mapper().readTree(file.toFile());
    }

    @Test
    @DisplayName("Runs survive a new repository instance over the same file")
    void persists() {
        repo.create(run("r1", WorkflowKind.LLM));

        JsonFileRunRepository reopened = new JsonFileRunRepository(file, clock);
        RunRecord found = reopened.get("r1").orElseThrow();

        assertEquals("llm-r1", found.engineName());
        assertEquals(clock.instant(), found.createdAt());
        assertTrue(Files.exists(file));
    }

    @Test
    void duplicateRejected() {
        repo.create(run("r1", WorkflowKind.CTGAN));

        RunRecord different = run("r1", WorkflowKind.LLM).toBuilder().engineName("other-wf").build();
        assertThrows(DuplicateRunException.class, () -> repo.create(different));

        RunRecord stored = new JsonFileRunRepository(file, clock).get("r1").orElseThrow();
        assertEquals("ctgan-r1", stored.engineName());
        assertEquals("ctgan", stored.workflowKind());
        assertEquals(1, repo.list().size());
    }

    @Test
    void missingFileIsEmpty() {
        assertTrue(repo.list().isEmpty());
        assertTrue(repo.get("x").isEmpty());
        assertFalse(Files.exists(file), "reads alone never create the registry");
    }

    @Test
    void listOldestFirst() {
        clock.advance(Duration.ofMinutes(5));
        repo.create(run("late", WorkflowKind.CTGAN));
        clock.advance(Duration.ofMinutes(-10));
        repo.create(run("early", WorkflowKind.CTGAN));

        assertEquals(List.of("early", "late"), repo.list().stream().map(RunRecord::runId).toList());
    }

    @Test
    @DisplayName("Updates merge, backfill and bump updated_at")
    void update() throws Exception {
        repo.create(run("r1", WorkflowKind.CUSTOM));
        clock.advance(Duration.ofSeconds(10));

        RunRecord updated = repo.update("r1", RunPatch.builder()
                .status(RunStatus.of(RunPhase.FAILED))
                .resultObject("output/custom.csv")
                .build()).orElseThrow();

        assertEquals("Failed", updated.status().phase());
        assertEquals("output/custom.csv", updated.resultObject());
        assertEquals(clock.instant(), updated.updatedAt());
        assertEquals("custom-r1", updated.engineName());
        assertEquals("output/custom.csv", readFile().path("runs").path("r1").path("result_object").asText());
        assertTrue(repo.update("nope", RunPatch.resultObject("x")).isEmpty());
    }

    @Test
    @DisplayName("A legacy registry is upgraded on first read and then left alone")
    void upgradesLegacyFile() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, """
                {"runs": {
                   "old-1": {"workflow": "ctgan", "argo_name": "ctgan-aa",
                             "input_file_name": "old-1_d.csv", "status": {"phase": "Succeeded"}},
                   "stale-key": {"runID": "renamed", "workflow": "llm"},
                   "broken": 42
                }}
                """);

        List<RunRecord> runs = repo.list();

        assertEquals(3, runs.size());
        RunRecord old = repo.get("old-1").orElseThrow();
        assertEquals("ctgan-aa", old.engineName());
        assertEquals("output/old-1_d.csv", old.resultObject());
        assertTrue(repo.get("renamed").isPresent(), "entries are re-keyed by run id");
        assertTrue(repo.get("stale-key").isEmpty());
        assertTrue(repo.get("broken").isPresent());

        JsonNode upgraded = readFile();
        assertEquals(RunRecordUpgrader.CURRENT_VERSION,
                upgraded.path("runs").path("old-1").path("schema_version").asInt());
        String snapshot = Files.readString(file);
        long modified = Files.getLastModifiedTime(file).toMillis();

        repo.list();
        assertEquals(snapshot, Files.readString(file));
        assertEquals(modified, Files.getLastModifiedTime(file).toMillis());
    }

    @Test
    @DisplayName("Concurrent writers from separate instances lose nothing")
    void concurrentWriters() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String id = "run-" + i;
                JsonFileRunRepository writer = new JsonFileRunRepository(file, clock);
                futures.add(pool.submit(() -> writer.create(run(id, WorkflowKind.CTGAN))));
            }
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(40, repo.list().size());
        assertEquals(40, readFile().path("runs").size());
    }
}
