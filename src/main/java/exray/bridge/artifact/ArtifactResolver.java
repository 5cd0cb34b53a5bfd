package exray.bridge.artifact;

import exray.bridge.engine.WorkflowDocument;
import exray.bridge.model.OutputArtifact;
import exray.bridge.model.RunRecord;

import java.util.Optional;

/**
 * Decides which object-store key holds a run's result.
 */
public final class ArtifactResolver {

    private ArtifactResolver() {
    }

    /**
     * The stored result key when the run has one, otherwise the first object-store
     * output artifact the engine recorded.
     */
    public static Optional<String> resolveResultKey(RunRecord run, WorkflowDocument document) {
        if (run.hasResultObject()) {
            return Optional.of(run.resultObject());
        }
        return keyFromOutputs(document);
    }

    /**
     * Key recorded by the engine, ignoring whatever the run has stored.
     */
    public static Optional<String> keyFromOutputs(WorkflowDocument document) {
        if (document == null) {
            return Optional.empty();
        }
        return document.outputArtifacts().stream()
                .filter(OutputArtifact::isInObjectStore)
                .map(OutputArtifact::key)
                .findFirst();
    }
}
