package exray.bridge.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update of a {@link RunRecord}.
 * Fields left unset are not touched; fields that are set replace the stored value wholesale.
 */
public final class RunPatch {
    private final RunStatus status;
    private final String resultObject;
    private final String engineName;
    private final String namespace;
    private final String submittedAt;
    private final String inputObject;
    private final Map<String, String> parameters;

    private RunPatch(Builder builder) {
        this.status = builder.status;
        this.resultObject = builder.resultObject;
        this.engineName = builder.engineName;
        this.namespace = builder.namespace;
        this.submittedAt = builder.submittedAt;
        this.inputObject = builder.inputObject;
        this.parameters = builder.parameters;
    }

    public static RunPatch status(RunStatus status) {
        return builder().status(status).build();
    }

    public static RunPatch resultObject(String resultObject) {
        return builder().resultObject(resultObject).build();
    }

    public RunStatus status() {
        return status;
    }

    public String resultObject() {
        return resultObject;
    }

    public String engineName() {
        return engineName;
    }

    public String namespace() {
        return namespace;
    }

    public String submittedAt() {
        return submittedAt;
    }

    public String inputObject() {
        return inputObject;
    }

    public Map<String, String> parameters() {
        return parameters;
    }

    public boolean isEmpty() {
        return status == null && resultObject == null && engineName == null && namespace == null
                && submittedAt == null && inputObject == null && parameters == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RunStatus status;
        private String resultObject;
        private String engineName;
        private String namespace;
        private String submittedAt;
        private String inputObject;
        private Map<String, String> parameters;

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder resultObject(String resultObject) {
            this.resultObject = resultObject;
            return this;
        }

        public Builder engineName(String engineName) {
            this.engineName = engineName;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder submittedAt(String submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public Builder inputObject(String inputObject) {
            this.inputObject = inputObject;
            return this;
        }

        public Builder parameters(Map<String, String> parameters) {
            this.parameters = parameters != null ? new LinkedHashMap<>(parameters) : null;
            return this;
        }

        public RunPatch build() {
            return new RunPatch(this);
        }
    }
}
