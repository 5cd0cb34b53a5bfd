package exray.bridge.api.v1.dto;

import exray.bridge.model.ResourceLimits;
import exray.bridge.model.WorkflowKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Form fields of a run submission, validated per workflow kind with defaults applied.
 * POST /api/v1/runs/{kind}
 *
 * @param parameters kind-specific parameters, in the order the template declares them
 */
public record SubmitRunForm(
        WorkflowKind kind,
        Map<String, String> parameters,
        ResourceLimits limits) {

    public static final int DEFAULT_EPOCHS = 300;
    public static final int DEFAULT_SAMPLES = 1000;
    public static final int DEFAULT_PARALLELISM = 1;
    public static final String DEFAULT_FUNCTION = "process";

    /** Multipart field holding the dataset */
    public static String dataFileField(WorkflowKind kind) {
        return kind == WorkflowKind.CUSTOM ? "data_file" : "file";
    }

    /** Multipart field holding the user script */
    public static final String SCRIPT_FILE_FIELD = "python_file";

    /**
     * @throws IllegalArgumentException on a missing or malformed field
     */
    public static SubmitRunForm parse(WorkflowKind kind, Map<String, String> fields) {
        Map<String, String> params = new LinkedHashMap<>();
        switch (kind) {
            case CTGAN -> {
                params.put("discrete_columns", optional(fields, "discrete_columns", ""));
                params.put("no_of_epochs", String.valueOf(positiveInt(fields, "no_of_epochs", DEFAULT_EPOCHS)));
                params.put("no_of_samples", String.valueOf(positiveInt(fields, "no_of_samples", DEFAULT_SAMPLES)));
            }
            case LLM -> {
                params.put("labels", required(fields, "labels"));
                params.put("model", required(fields, "model"));
                int parallelism = integer(fields, "parallelism", DEFAULT_PARALLELISM);
                if (parallelism < 1) {
                    throw new IllegalArgumentException("parallelism must be at least 1");
                }
                params.put("parallelism", String.valueOf(parallelism));
            }
            case CUSTOM -> {
                params.put("function_name", optional(fields, "function_name", DEFAULT_FUNCTION));
                params.put("pip_packages", optional(fields, "pip_packages", ""));
            }
        }
        ResourceLimits limits = new ResourceLimits(fields.get("cpu_limit"), fields.get("memory_limit"));
        return new SubmitRunForm(kind, params, limits);
    }

    /**
     * @throws IllegalArgumentException unless the name ends in .py
     */
    public static void validateScriptName(String filename) {
        if (filename != null && !filename.isEmpty() && !filename.endsWith(".py")) {
            throw new IllegalArgumentException("Python file must have .py extension");
        }
    }

    private static String required(Map<String, String> fields, String name) {
        String value = fields.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value.trim();
    }

    private static String optional(Map<String, String> fields, String name, String fallback) {
        String value = fields.get(name);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int integer(Map<String, String> fields, String name, int fallback) {
        String value = fields.get(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
    }

    private static int positiveInt(Map<String, String> fields, String name, int fallback) {
        int value = integer(fields, name, fallback);
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
