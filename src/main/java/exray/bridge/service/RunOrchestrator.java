package exray.bridge.service;

import exray.bridge.artifact.ArtifactResolver;
import exray.bridge.artifact.ArtifactStore;
import exray.bridge.config.BridgeConfig;
import exray.bridge.engine.LogAggregator;
import exray.bridge.engine.StatusNormalizer;
import exray.bridge.engine.WorkflowDocument;
import exray.bridge.engine.WorkflowEngineClient;
import exray.bridge.error.NoEngineNameException;
import exray.bridge.error.ObjectNotFoundException;
import exray.bridge.error.ResultUnavailableException;
import exray.bridge.error.RunNotCompleteException;
import exray.bridge.error.RunNotFoundException;
import exray.bridge.model.ResourceLimits;
import exray.bridge.model.ResultLink;
import exray.bridge.model.RunPatch;
import exray.bridge.model.RunPhase;
import exray.bridge.model.RunRecord;
import exray.bridge.model.RunStatus;
import exray.bridge.model.SubmissionReceipt;
import exray.bridge.model.WorkflowKind;
import exray.bridge.repository.RunRepository;
import exray.bridge.template.FilledSpec;
import exray.bridge.template.SpecTemplater;
import exray.bridge.util.FileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Run lifecycle: submission, status refresh, result links and logs.
 * Combines the registry, the templater, the workflow engine and the artifact store.
 */
public class RunOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RunOrchestrator.class);

    static final String INPUT_PREFIX = "input/";
    static final String SCRIPT_PREFIX = "python/";
    static final String OUTPUT_PREFIX = "output/";

    private final RunRepository runs;
    private final SpecTemplater templater;
    private final WorkflowEngineClient engine;
    private final ArtifactStore artifacts;
    private final LogAggregator logAggregator;
    private final Duration presignTtl;
    private final int defaultLogTailLines;
    private final Supplier<String> runIds;

    public RunOrchestrator(RunRepository runs, SpecTemplater templater, WorkflowEngineClient engine,
            ArtifactStore artifacts, BridgeConfig config) {
        this(runs, templater, engine, artifacts, config, () -> UUID.randomUUID().toString());
    }

    public RunOrchestrator(RunRepository runs, SpecTemplater templater, WorkflowEngineClient engine,
            ArtifactStore artifacts, BridgeConfig config, Supplier<String> runIds) {
        this.runs = runs;
        this.templater = templater;
        this.engine = engine;
        this.artifacts = artifacts;
        this.logAggregator = new LogAggregator(engine);
        this.presignTtl = config.presignTtl();
        this.defaultLogTailLines = config.defaultLogTailLines();
        this.runIds = runIds;
    }

    // ---- Submission ----

    /**
     * Upload the inputs, submit the workflow and record the run.
     * Nothing is recorded when submission fails; uploaded inputs are left in place.
     * The request's temporary files are not deleted here.
     */
    public RunRecord submit(SubmitRequest request) {
        WorkflowKind kind = request.kind();
        String runId = runIds.get();
        String inputFileName = runId + "_" + FileNames.sanitize(request.input().originalName());

        String scriptFileName = null;
        if (kind == WorkflowKind.CUSTOM) {
            if (request.script() == null) {
                throw new IllegalArgumentException("A Python file is required for custom runs");
            }
            scriptFileName = runId + "_"
                    + FileNames.sanitize(request.script().originalName(), FileNames.DEFAULT_SCRIPT_FILE);
        }

        Map<String, String> templateParams = new LinkedHashMap<>(request.parameters());
        templateParams.put("input_file_name", inputFileName);
        if (scriptFileName != null) {
            templateParams.put("python_file_name", scriptFileName);
        }
        FilledSpec spec = templater.fill(kind.tag(), templateParams, request.limits());

        String inputObject = INPUT_PREFIX + inputFileName;
        artifacts.upload(inputObject, request.input().path());
        if (scriptFileName != null) {
            artifacts.upload(SCRIPT_PREFIX + scriptFileName, request.script().path());
        }

        SubmissionReceipt receipt = engine.submit(spec);
        RunStatus status = initialStatus(receipt.engineName());

        RunRecord record = RunRecord.builder()
                .runId(runId)
                .workflowKind(kind)
                .parameters(recordedParameters(request.parameters(), request.limits()))
                .engineName(receipt.engineName())
                .namespace(receipt.namespace())
                .submittedAt(receipt.submittedAt())
                .status(status)
                .inputObject(inputObject)
                .resultObject(OUTPUT_PREFIX + inputFileName)
                .inputFileName(inputFileName)
                .originalFilename(originalOrDefault(request.input().originalName(), FileNames.DEFAULT_DATA_FILE))
                .scriptFileName(scriptFileName)
                .originalScriptFilename(request.script() != null
                        ? originalOrDefault(request.script().originalName(), FileNames.DEFAULT_SCRIPT_FILE)
                        : null)
                .build();

        RunRecord stored = runs.create(record);
        log.info("Submitted {} run {} as workflow {} (phase {})", kind.tag(), runId, receipt.engineName(),
                status.phase());
        return stored;
    }

    private RunStatus initialStatus(String engineName) {
        if (engineName == null || engineName.isBlank()) {
            return RunStatus.of(RunPhase.PENDING);
        }
        try {
            Optional<RunStatus> status = engine.fetch(engineName)
                    .map(StatusNormalizer::normalize)
                    .filter(s -> !s.isEmpty());
            return status.orElse(RunStatus.of(RunPhase.SUBMITTED));
        } catch (RuntimeException e) {
            log.debug("Initial status of {} unavailable: {}", engineName, e.getMessage());
            return RunStatus.of(RunPhase.SUBMITTED);
        }
    }

    private static Map<String, String> recordedParameters(Map<String, String> params, ResourceLimits limits) {
        Map<String, String> recorded = new LinkedHashMap<>(params);
        if (limits.cpu() != null) {
            recorded.put("cpu_limit", limits.cpu());
        }
        if (limits.memory() != null) {
            recorded.put("memory_limit", limits.memory());
        }
        return recorded;
    }

    private static String originalOrDefault(String name, String fallback) {
        return name != null && !name.isBlank() ? name : fallback;
    }

    // ---- Status ----

    /**
     * Refresh a run's status from the engine.
     *
     * @throws RunNotFoundException if the run does not exist
     */
    public RunRecord refresh(String runId) {
        RunRecord run = runs.get(runId).orElseThrow(() -> new RunNotFoundException(runId));
        return refreshRun(run);
    }

    public List<RunRecord> listRuns(boolean refresh) {
        List<RunRecord> all = runs.list();
        if (!refresh) {
            return all;
        }
        List<RunRecord> refreshed = new ArrayList<>(all.size());
        for (RunRecord run : all) {
            refreshed.add(refreshRun(run));
        }
        return refreshed;
    }

    public Optional<RunRecord> getRun(String runId, boolean refresh) {
        Optional<RunRecord> run = runs.get(runId);
        if (!refresh || run.isEmpty()) {
            return run;
        }
        return Optional.of(refreshRun(run.get()));
    }

    /**
     * Terminal runs and runs without an engine name are returned as stored. Engine failures
     * leave the stored record in place.
     */
    private RunRecord refreshRun(RunRecord run) {
        if (run.isTerminal() || !run.hasEngineName()) {
            return run;
        }
        try {
            Optional<WorkflowDocument> document = engine.fetch(run.engineName());
            if (document.isEmpty()) {
                log.debug("Workflow {} of run {} not found, keeping stored status", run.engineName(), run.runId());
                return run;
            }
            return applyStatus(run, StatusNormalizer.normalize(document.get()));
        } catch (RuntimeException e) {
            log.warn("Failed to refresh run {}: {}", run.runId(), e.getMessage());
            return run;
        }
    }

    private RunRecord applyStatus(RunRecord run, RunStatus status) {
        if (status.isEmpty() || status.equals(run.status())) {
            return run;
        }
        RunRecord updated = runs.update(run.runId(), RunPatch.status(status)).orElse(run);
        if (!run.isTerminal() && updated.isTerminal()) {
            log.info("Run {} finished with phase {}", run.runId(), status.phase());
        }
        return updated;
    }

    // ---- Results ----

    /**
     * Download link for a finished run's result.
     * <p>
     * Runs that ended {@code Failed} or {@code Error} are refused without resolving a key,
     * even when the workflow recorded outputs. A key taken from the workflow outputs is
     * stored on the run, so later calls do not query the engine.
     *
     * @throws RunNotFoundException       if the run does not exist
     * @throws RunNotCompleteException    if the run is still executing after a refresh
     * @throws ResultUnavailableException if the run failed or its result object cannot be found
     */
    public ResultLink getResult(String runId) {
        RunRecord run = runs.get(runId).orElseThrow(() -> new RunNotFoundException(runId));

        WorkflowDocument document = null;
        if (!run.isTerminal()) {
            if (run.hasEngineName()) {
                document = fetchQuietly(run);
                if (document != null) {
                    run = applyStatus(run, StatusNormalizer.normalize(document));
                }
            }
            if (!run.isTerminal()) {
                throw new RunNotCompleteException(runId, run.status().phase());
            }
        }

        Optional<RunPhase> phase = run.status().canonicalPhase();
        if (phase.isPresent() && phase.get().isUnsuccessful()) {
            throw new ResultUnavailableException(runId, "run ended with phase " + phase.get().label());
        }

        if (!run.hasResultObject() && document == null && run.hasEngineName()) {
            document = fetchQuietly(run);
        }
        String key = ArtifactResolver.resolveResultKey(run, document)
                .orElseThrow(() -> new ResultUnavailableException(runId, "no output artifact recorded"));
        if (!run.hasResultObject()) {
            run = runs.update(runId, RunPatch.resultObject(key)).orElse(run);
            log.info("Run {} result object backfilled from workflow outputs: {}", runId, key);
        }

        try {
            return link(runId, key);
        } catch (ObjectNotFoundException e) {
            log.info("Result object {} of run {} missing, resolving from workflow outputs", key, runId);
            return fallbackLink(run, key, e);
        }
    }

    private ResultLink fallbackLink(RunRecord run, String missingKey, ObjectNotFoundException cause) {
        String runId = run.runId();
        if (!run.hasEngineName()) {
            throw new ResultUnavailableException(runId, "result object " + missingKey + " not found", cause);
        }
        WorkflowDocument latest = fetchQuietly(run);
        Optional<String> fallbackKey = ArtifactResolver.keyFromOutputs(latest);
        if (fallbackKey.isEmpty() || fallbackKey.get().equals(missingKey)) {
            throw new ResultUnavailableException(runId, "result object " + missingKey + " not found", cause);
        }

        runs.update(runId, RunPatch.resultObject(fallbackKey.get()));
        log.info("Run {} result object re-resolved to {}", runId, fallbackKey.get());
        try {
            return link(runId, fallbackKey.get());
        } catch (ObjectNotFoundException e) {
            throw new ResultUnavailableException(runId, "result object " + fallbackKey.get() + " not found", e);
        }
    }

    private ResultLink link(String runId, String key) {
        URL url = artifacts.presignedGetUrl(key, presignTtl);
        return new ResultLink(runId, key, url.toString());
    }

    private WorkflowDocument fetchQuietly(RunRecord run) {
        try {
            return engine.fetch(run.engineName()).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Failed to fetch workflow {} of run {}: {}", run.engineName(), run.runId(), e.getMessage());
            return null;
        }
    }

    // ---- Logs ----

    /**
     * Aggregated logs of a run's workflow.
     *
     * @param tailLines trailing lines per pod; null or non-positive means the configured default
     * @throws RunNotFoundException  if the run does not exist
     * @throws NoEngineNameException if the run was never accepted by the engine
     */
    public String getLogs(String runId, Integer tailLines) {
        RunRecord run = runs.get(runId).orElseThrow(() -> new RunNotFoundException(runId));
        if (!run.hasEngineName()) {
            throw new NoEngineNameException(runId);
        }
        int tail = tailLines == null || tailLines <= 0 ? defaultLogTailLines : tailLines;
        return logAggregator.fetchLogs(run.engineName(), tail);
    }
}
