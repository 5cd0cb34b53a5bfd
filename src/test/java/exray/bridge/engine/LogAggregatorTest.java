package exray.bridge.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import exray.bridge.error.EngineQueryException;
import exray.bridge.error.WorkflowNotFoundException;
import exray.bridge.testing.FakeWorkflowEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static exray.bridge.engine.WorkflowEngineClient.MAIN_CONTAINER;
import static exray.bridge.engine.WorkflowEngineClient.WAIT_CONTAINER;
import static org.junit.jupiter.api.Assertions.*;

class LogAggregatorTest {

    private static final String WF = "ctgan-abc";

    private FakeWorkflowEngine engine;
    private LogAggregator aggregator;

    @BeforeEach
    void setUp() {
        engine = new FakeWorkflowEngine();
        aggregator = new LogAggregator(engine);
    }

    private void node(String id, String displayName, String pod, String phase, String startedAt) {
        // fetch returns copies, so nodes are added to the stored document directly
        ObjectNode status = (ObjectNode) storedDoc().get("status");
        ObjectNode nodes = status.has("nodes") ? (ObjectNode) status.get("nodes") : status.putObject("nodes");
        ObjectNode n = nodes.putObject(id);
        n.put("displayName", displayName).put("podName", pod).put("phase", phase);
        if (startedAt != null) {
            n.put("startedAt", startedAt);
        }
    }

    private ObjectNode stored;

    private ObjectNode storedDoc() {
        if (stored == null) {
            stored = engine.workflow(WF, "Running");
        }
        return stored;
    }

    @Test
    @DisplayName("Unknown workflow raises WorkflowNotFound")
    void unknownWorkflow() {
        assertThrows(WorkflowNotFoundException.class, () -> aggregator.fetchLogs("missing", 10));
    }

    @Test
    @DisplayName("Without pod nodes the aggregate stream is returned as is")
    void noPods() {
        storedDoc();
        engine.putLogs(WF, null, MAIN_CONTAINER, "line 1\nline 2\n");

        assertEquals("line 1\nline 2\n", aggregator.fetchLogs(WF, 50));
    }

    @Test
    @DisplayName("Pods are ordered by start time, unstarted pods first")
    void ordersPodsByStart() {
        node("n1", "sample", "pod-b", "Running", "2024-05-01T10:05:00Z");
        node("n2", "train", "pod-a", "Succeeded", "2024-05-01T10:00:00Z");
        node("n3", "pending", "pod-c", "Pending", null);
        engine.putLogs(WF, "pod-a", MAIN_CONTAINER, "training\n");
        engine.putLogs(WF, "pod-b", MAIN_CONTAINER, "sampling\n");
        engine.putLogs(WF, "pod-c", MAIN_CONTAINER, "waiting\n");

        String text = aggregator.fetchLogs(WF, 100);

        int c = text.indexOf("[pod-c]");
        int a = text.indexOf("[pod-a]");
        int b = text.indexOf("[pod-b]");
        assertTrue(c >= 0 && a > c && b > a, text);
        assertTrue(text.contains("=== train [pod-a] (phase: Succeeded) ===\ntraining"));
        assertFalse(text.contains(LogAggregator.AGGREGATE_HEADER), "empty aggregate section is omitted");
    }

    @Test
    @DisplayName("Empty main output falls back to the wait container")
    void fallsBackToWaitContainer() {
        node("n1", "train", "pod-a", "Succeeded", "2024-05-01T10:00:00Z");
        engine.putLogs(WF, "pod-a", MAIN_CONTAINER, "  \n");
        engine.putLogs(WF, "pod-a", WAIT_CONTAINER, "uploaded output\n");

        String text = aggregator.fetchLogs(WF, 100);

        assertTrue(text.endsWith("uploaded output"), text);
        List<String> requests = engine.logRequests();
        assertTrue(requests.contains(FakeWorkflowEngine.logKey(WF, "pod-a", WAIT_CONTAINER)));
    }

    @Test
    @DisplayName("A pod with no output at all gets a placeholder")
    void emptyPod() {
        node("n1", "train", "pod-a", "Running", null);

        assertTrue(aggregator.fetchLogs(WF, 100).contains(LogAggregator.NO_OUTPUT));
    }

    @Test
    @DisplayName("A failing pod does not hide the others")
    void failingPodIsolated() {
        node("n1", "train", "pod-a", "Failed", "2024-05-01T10:00:00Z");
        node("n2", "sample", "pod-b", "Running", "2024-05-01T10:01:00Z");
        engine.failLogs(WF, "pod-a", MAIN_CONTAINER, 500);
        engine.failLogs(WF, "pod-a", WAIT_CONTAINER, 500);
        engine.putLogs(WF, "pod-b", MAIN_CONTAINER, "fine\n");

        String text = aggregator.fetchLogs(WF, 100);

        assertTrue(text.contains("Failed to fetch logs for pod pod-a (HTTP 500)."), text);
        assertTrue(text.contains("fine"));
    }

    @Test
    @DisplayName("Aggregate stream is appended after the pod sections")
    void appendsAggregate() {
        node("n1", "train", "pod-a", "Succeeded", "2024-05-01T10:00:00Z");
        engine.putLogs(WF, "pod-a", MAIN_CONTAINER, "pod line\n");
        engine.putLogs(WF, null, MAIN_CONTAINER, "all lines\n");

        String text = aggregator.fetchLogs(WF, 100);

        assertTrue(text.endsWith(LogAggregator.AGGREGATE_HEADER + "\nall lines"), text);
        assertTrue(text.indexOf("pod line") < text.indexOf(LogAggregator.AGGREGATE_HEADER));
    }

    @Test
    @DisplayName("Aggregate failure after pod sections is ignored")
    void aggregateFailureIgnored() {
        node("n1", "train", "pod-a", "Succeeded", "2024-05-01T10:00:00Z");
        engine.putLogs(WF, "pod-a", MAIN_CONTAINER, "pod line\n");
        engine.failLogs(WF, null, MAIN_CONTAINER, 502);

        assertEquals("=== train [pod-a] (phase: Succeeded) ===\npod line", aggregator.fetchLogs(WF, 100));
    }

    @Test
    @DisplayName("Transport failures name the cause in the placeholder")
    void transportPlaceholder() {
        EngineQueryException failure = new EngineQueryException("fetch logs", "pod-x", new IOException("reset"));

        assertEquals("Failed to fetch logs for pod pod-x: reset", LogAggregator.failurePlaceholder("pod-x", failure));
    }
}
