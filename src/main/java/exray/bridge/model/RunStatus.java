package exray.bridge.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Engine-independent view of a run's execution progress.
 * Every field is optional; an absent phase is not the same as "Pending".
 */
public final class RunStatus {

    private static final RunStatus EMPTY = new RunStatus(null, null, null, null, null);

    private final String phase;
    private final String startedAt;
    private final String finishedAt;
    private final String progress;
    private final String message;

    public RunStatus(String phase, String startedAt, String finishedAt, String progress, String message) {
        this.phase = phase;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.progress = progress;
        this.message = message;
    }

    public static RunStatus empty() {
        return EMPTY;
    }

    public static RunStatus of(RunPhase phase) {
        return new RunStatus(phase.label(), null, null, null, null);
    }

    public String phase() {
        return phase;
    }

    public String startedAt() {
        return startedAt;
    }

    public String finishedAt() {
        return finishedAt;
    }

    public String progress() {
        return progress;
    }

    public String message() {
        return message;
    }

    public Optional<RunPhase> canonicalPhase() {
        return RunPhase.parse(phase);
    }

    public boolean isTerminal() {
        return canonicalPhase().map(RunPhase::isTerminal).orElse(false);
    }

    public boolean isEmpty() {
        return phase == null && startedAt == null && finishedAt == null && progress == null && message == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RunStatus that))
            return false;
        return Objects.equals(phase, that.phase)
                && Objects.equals(startedAt, that.startedAt)
                && Objects.equals(finishedAt, that.finishedAt)
                && Objects.equals(progress, that.progress)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, startedAt, finishedAt, progress, message);
    }

    @Override
    public String toString() {
        return "RunStatus{phase=" + phase + ", startedAt=" + startedAt + ", finishedAt=" + finishedAt + "}";
    }
}
