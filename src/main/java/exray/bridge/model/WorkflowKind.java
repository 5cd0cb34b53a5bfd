package exray.bridge.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Workflow template families a run can be submitted with.
 * The tag doubles as the template name.
 */
public enum WorkflowKind {
    /** Synthetic tabular data generation (CTGAN training + sampling) */
    CTGAN("ctgan", true),
    /** LLM labelling of a dataset */
    LLM("llm", true),
    /** User-supplied Python function applied to a dataset */
    CUSTOM("custom", false);

    private final String tag;
    private final boolean outputNamedAfterInput;

    WorkflowKind(String tag, boolean outputNamedAfterInput) {
        this.tag = tag;
        this.outputNamedAfterInput = outputNamedAfterInput;
    }

    public String tag() {
        return tag;
    }

    /**
     * Whether the kind's template writes its result to {@code output/<input_file_name>}.
     * This is a naming convention of the shipped templates, not something checked
     * against the template itself.
     */
    public boolean outputNamedAfterInput() {
        return outputNamedAfterInput;
    }

    public static Optional<WorkflowKind> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String wanted = tag.trim().toLowerCase(Locale.ROOT);
        for (WorkflowKind kind : values()) {
            if (kind.tag.equals(wanted)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
