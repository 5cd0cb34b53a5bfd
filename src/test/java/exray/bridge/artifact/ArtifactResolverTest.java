package exray.bridge.artifact;

import exray.bridge.engine.WorkflowDocument;
import exray.bridge.model.RunRecord;
import exray.bridge.util.Jsons;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactResolverTest {

    private static WorkflowDocument doc(String json) throws Exception {
        return WorkflowDocument.of(Jsons.mapper().readTree(json));
    }

    private static final String OUTPUTS = """
            {"status": {"outputs": {"artifacts": [
               {"name": "logs", "http": {"url": "http://x"}},
               {"name": "result", "s3": {"key": "output/from-engine.csv"}}
            ]}}}
            """;

    @Test
    @DisplayName("A stored result key wins over engine outputs")
    void storedKeyWins() throws Exception {
        RunRecord run = RunRecord.builder().runId("r1").resultObject("output/stored.csv").build();

        assertEquals(Optional.of("output/stored.csv"), ArtifactResolver.resolveResultKey(run, doc(OUTPUTS)));
    }

    @Test
    @DisplayName("Without a stored key the first object-store output is used")
    void fallsBackToOutputs() throws Exception {
        RunRecord run = RunRecord.builder().runId("r1").resultObject(" ").build();

        assertEquals(Optional.of("output/from-engine.csv"), ArtifactResolver.resolveResultKey(run, doc(OUTPUTS)));
    }

    @Test
    @DisplayName("Node outputs are consulted when the workflow has none")
    void nodeOutputs() throws Exception {
        WorkflowDocument document = doc("""
                {"status": {"nodes": {"n": {"outputs": {"artifacts": [
                   {"name": "result", "s3": {"key": "output/node.csv"}}
                ]}}}}}
                """);

        assertEquals(Optional.of("output/node.csv"), ArtifactResolver.keyFromOutputs(document));
    }

    @Test
    void nothingToResolve() throws Exception {
        RunRecord run = RunRecord.builder().runId("r1").build();

        assertTrue(ArtifactResolver.resolveResultKey(run, null).isEmpty());
        assertTrue(ArtifactResolver.keyFromOutputs(doc("{\"status\": {}}")).isEmpty());
        assertTrue(ArtifactResolver.keyFromOutputs(doc("""
                {"status": {"outputs": {"artifacts": [{"name": "r", "s3": {"key": ""}}]}}}
                """)).isEmpty());
    }
}
