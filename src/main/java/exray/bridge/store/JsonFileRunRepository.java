package exray.bridge.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import exray.bridge.error.DuplicateRunException;
import exray.bridge.model.RunPatch;
import exray.bridge.model.RunRecord;
import exray.bridge.repository.RunRepository;
import exray.bridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * RunRepository over a single JSON document of the form {"runs": {id: record}}.
 * <p>
 * One writer at a time: a lock per file within the process, an OS lock on a sidecar
 * {@code .lock} file across processes, and every rewrite goes through a temp file and an
 * atomic rename.
 */
public class JsonFileRunRepository implements RunRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileRunRepository.class);

    private static final String RUNS = "runs";
    private static final Map<Path, ReentrantLock> PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final Path file;
    private final Path lockFile;
    private final Clock clock;

    public JsonFileRunRepository(Path file) {
        this(file, Clock.systemUTC());
    }

    public JsonFileRunRepository(Path file, Clock clock) {
        this.file = file.toAbsolutePath().normalize();
        this.lockFile = this.file.resolveSibling(this.file.getFileName() + ".lock");
        this.clock = clock;
    }

    @Override
    public RunRecord create(RunRecord record) {
        return withState("create run " + record.runId(), state -> {
            ObjectNode runs = state.runs();
            if (runs.has(record.runId())) {
                throw new DuplicateRunException(record.runId());
            }
            Instant now = clock.instant();
            RunRecord stored = record.toBuilder().createdAt(now).updatedAt(now).build();
            runs.set(stored.runId(), RunRecordCodec.encode(stored));
            state.markDirty();
            log.debug("Created run: {}", stored.runId());
            return stored;
        });
    }

    @Override
    public Optional<RunRecord> get(String runId) {
        return withState("get run " + runId, state -> {
            JsonNode doc = state.runs().get(runId);
            return doc == null ? Optional.<RunRecord>empty() : Optional.of(RunRecordCodec.decode(doc));
        });
    }

    @Override
    public List<RunRecord> list() {
        return withState("list runs", state -> {
            List<RunRecord> runs = new ArrayList<>();
            state.runs().elements().forEachRemaining(doc -> runs.add(RunRecordCodec.decode(doc)));
            runs.sort(Comparator.comparing(RunRecord::createdAt, Comparator.nullsFirst(Comparator.naturalOrder())));
            return runs;
        });
    }

    @Override
    public Optional<RunRecord> update(String runId, RunPatch patch) {
        return withState("update run " + runId, state -> {
            JsonNode existing = state.runs().get(runId);
            if (existing == null) {
                return Optional.<RunRecord>empty();
            }
            ObjectNode doc = (ObjectNode) existing;
            doc.setAll(RunRecordCodec.encodePatch(patch));
            doc.put(RunRecordCodec.UPDATED_AT, clock.instant().toString());
            RunRecordUpgrader.backfillResultObject(doc);
            state.markDirty();
            log.debug("Updated run: {}", runId);
            return Optional.of(RunRecordCodec.decode(doc));
        });
    }

    // --- Helpers ---

    /**
     * Load and upgrade the document under both locks, run the action, and rewrite the file
     * if the upgrade or the action changed anything.
     */
    private <T> T withState(String operation, Function<State, T> action) {
        ReentrantLock lock = PROCESS_LOCKS.computeIfAbsent(file, p -> new ReentrantLock());
        lock.lock();
        try {
            Files.createDirectories(file.getParent());
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                    FileLock ignored = channel.lock()) {
                State state = load();
                T result = action.apply(state);
                if (state.dirty) {
                    save(state.root);
                }
                return result;
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to " + operation + " in " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private State load() throws IOException {
        ObjectNode root;
        boolean dirty = false;
        if (Files.exists(file) && Files.size(file) > 0) {
            JsonNode parsed = Jsons.mapper().readTree(file.toFile());
            if (parsed != null && parsed.isObject()) {
                root = (ObjectNode) parsed;
            } else {
                log.warn("Registry file {} does not hold a JSON object, starting empty", file);
                root = Jsons.mapper().createObjectNode();
                dirty = true;
            }
        } else {
            root = Jsons.mapper().createObjectNode();
        }

        JsonNode storedRuns = root.get(RUNS);
        if (storedRuns == null || !storedRuns.isObject()) {
            if (storedRuns != null) {
                dirty = true;
            }
            storedRuns = Jsons.mapper().createObjectNode();
        }

        // upgrade every entry and re-key it by its run id
        ObjectNode runs = Jsons.mapper().createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> it = storedRuns.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            RunRecordUpgrader.Result upgraded = RunRecordUpgrader.upgrade(e.getKey(), e.getValue());
            String runId = upgraded.runId();
            if (upgraded.changed() || !e.getKey().equals(runId)) {
                dirty = true;
            }
            runs.set(runId, upgraded.document());
        }
        root.set(RUNS, runs);

        if (dirty) {
            log.info("Upgraded run registry {} to schema version {}", file, RunRecordUpgrader.CURRENT_VERSION);
        }
        State state = new State(root, runs);
        state.dirty = dirty;
        return state;
    }

    private void save(ObjectNode root) throws IOException {
        Path tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
        try {
            Jsons.mapper().writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), root);
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static final class State {
        private final ObjectNode root;
        private final ObjectNode runs;
        private boolean dirty;

        State(ObjectNode root, ObjectNode runs) {
            this.root = root;
            this.runs = runs;
        }

        ObjectNode runs() {
            return runs;
        }

        void markDirty() {
            dirty = true;
        }
    }
}
