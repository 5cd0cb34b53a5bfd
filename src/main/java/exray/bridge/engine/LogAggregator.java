package exray.bridge.engine;

import exray.bridge.error.EngineQueryException;
import exray.bridge.error.WorkflowNotFoundException;
import exray.bridge.model.PodNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds one human-readable log text for a workflow out of per-pod logs.
 * A failing pod never prevents the others from being shown.
 */
public class LogAggregator {

    private static final Logger log = LoggerFactory.getLogger(LogAggregator.class);

    static final String AGGREGATE_HEADER = "=== Aggregated workflow logs ===";
    static final String NO_OUTPUT = "(no log output yet)";

    // Nodes without a start time first, the rest chronologically. List.sort is stable.
    private static final Comparator<PodNode> BY_START =
            Comparator.comparing(LogAggregator::startInstant, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final WorkflowEngineClient engine;

    public LogAggregator(WorkflowEngineClient engine) {
        this.engine = engine;
    }

    /**
     * @throws WorkflowNotFoundException when the engine has no such workflow
     * @throws EngineQueryException when the document itself cannot be read, or when
     *         there are no pod nodes and the aggregate request fails
     */
    public String fetchLogs(String engineName, Integer tailLines) {
        WorkflowDocument document = engine.fetch(engineName)
                .orElseThrow(() -> new WorkflowNotFoundException(engineName));

        List<PodNode> nodes = new ArrayList<>(document.podNodes());
        if (nodes.isEmpty()) {
            return engine.fetchLogs(engineName, null, WorkflowEngineClient.MAIN_CONTAINER, tailLines);
        }
        nodes.sort(BY_START);

        List<String> sections = new ArrayList<>();
        for (PodNode node : nodes) {
            sections.add(header(node) + "\n" + podBody(engineName, node.podName(), tailLines));
        }

        try {
            String aggregate = engine.fetchLogs(engineName, null, WorkflowEngineClient.MAIN_CONTAINER, tailLines);
            if (aggregate != null && !aggregate.isBlank()) {
                sections.add(AGGREGATE_HEADER + "\n" + aggregate.strip());
            }
        } catch (RuntimeException e) {
            log.debug("Aggregate logs for {} unavailable: {}", engineName, e.getMessage());
        }

        return String.join("\n\n", sections);
    }

    private String podBody(String engineName, String podName, Integer tailLines) {
        EngineQueryException lastFailure = null;
        int failures = 0;
        int attempts = 0;

        String[] order = {
                WorkflowEngineClient.MAIN_CONTAINER,
                WorkflowEngineClient.WAIT_CONTAINER,
                WorkflowEngineClient.MAIN_CONTAINER };
        for (String container : order) {
            attempts++;
            try {
                String body = engine.fetchLogs(engineName, podName, container, tailLines);
                if (body != null && !body.isBlank()) {
                    return body.strip();
                }
            } catch (EngineQueryException e) {
                failures++;
                lastFailure = e;
                log.debug("Logs for pod {} container {} failed: {}", podName, container, e.getMessage());
            }
        }

        if (failures == attempts && lastFailure != null) {
            return failurePlaceholder(podName, lastFailure);
        }
        return NO_OUTPUT;
    }

    static String header(PodNode node) {
        return "=== " + node.displayName() + " [" + node.podName() + "] (phase: " + node.phase() + ") ===";
    }

    static String failurePlaceholder(String podName, EngineQueryException failure) {
        if (failure.hasStatusCode()) {
            return "Failed to fetch logs for pod " + podName + " (HTTP " + failure.statusCode() + ").";
        }
        Throwable cause = failure.getCause() != null ? failure.getCause() : failure;
        return "Failed to fetch logs for pod " + podName + ": " + cause.getMessage();
    }

    private static Instant startInstant(PodNode node) {
        if (node.startedAt() == null) {
            return null;
        }
        try {
            return Instant.parse(node.startedAt());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
