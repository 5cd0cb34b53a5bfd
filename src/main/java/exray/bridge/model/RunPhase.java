package exray.bridge.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Canonical lifecycle phases of a run.
 * Engine-reported phase strings are matched case-insensitively.
 */
public enum RunPhase {
    /** Recorded, engine has not answered yet */
    PENDING("Pending"),
    /** Accepted by the engine, no status document yet */
    SUBMITTED("Submitted"),
    RUNNING("Running"),
    SUCCEEDED("Succeeded"),
    FAILED("Failed"),
    ERROR("Error"),
    SKIPPED("Skipped");

    private final String label;

    RunPhase(String label) {
        this.label = label;
    }

    /** Phase name as the engine and the API spell it */
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == ERROR || this == SKIPPED;
    }

    /** Terminal phases in which the workflow did not produce its output */
    public boolean isUnsuccessful() {
        return this == FAILED || this == ERROR;
    }

    public static Optional<RunPhase> parse(String phase) {
        if (phase == null || phase.isBlank()) {
            return Optional.empty();
        }
        String wanted = phase.trim().toLowerCase(Locale.ROOT);
        for (RunPhase p : values()) {
            if (p.label.toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
