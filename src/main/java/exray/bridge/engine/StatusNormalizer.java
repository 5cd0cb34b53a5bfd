package exray.bridge.engine;

import exray.bridge.model.RunStatus;

/**
 * Maps the engine's workflow document onto {@link RunStatus}.
 * Absent or non-scalar fields stay absent.
 */
public final class StatusNormalizer {

    private StatusNormalizer() {
    }

    public static RunStatus normalize(WorkflowDocument document) {
        if (document == null) {
            return RunStatus.empty();
        }
        return new RunStatus(
                document.statusField("phase"),
                document.statusField("startedAt"),
                document.statusField("finishedAt"),
                document.statusField("progress"),
                document.statusField("message"));
    }
}
