package exray.bridge.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of one submitted run, as kept in the run registry.
 */
public final class RunRecord {
    private final String runId;
    private final String workflowKind; // raw tag, unknown tags are kept as-is
    private final Map<String, String> parameters;
    private final String engineName;
    private final String namespace;
    private final String submittedAt;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final RunStatus status;
    private final String inputObject;
    private final String resultObject;
    private final String inputFileName;
    private final String originalFilename;
    private final String scriptFileName;
    private final String originalScriptFilename;

    private RunRecord(Builder builder) {
        this.runId = Objects.requireNonNull(builder.runId, "runId is required");
        this.workflowKind = builder.workflowKind;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.engineName = builder.engineName;
        this.namespace = builder.namespace;
        this.submittedAt = builder.submittedAt;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.status = builder.status != null ? builder.status : RunStatus.of(RunPhase.PENDING);
        this.inputObject = builder.inputObject;
        this.resultObject = builder.resultObject;
        this.inputFileName = builder.inputFileName;
        this.originalFilename = builder.originalFilename;
        this.scriptFileName = builder.scriptFileName;
        this.originalScriptFilename = builder.originalScriptFilename;
    }

    public String runId() {
        return runId;
    }

    public String workflowKind() {
        return workflowKind;
    }

    public Optional<WorkflowKind> kind() {
        return WorkflowKind.fromTag(workflowKind);
    }

    public Map<String, String> parameters() {
        return parameters;
    }

    public String engineName() {
        return engineName;
    }

    public boolean hasEngineName() {
        return engineName != null && !engineName.isBlank();
    }

    public String namespace() {
        return namespace;
    }

    public String submittedAt() {
        return submittedAt;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public RunStatus status() {
        return status;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public String inputObject() {
        return inputObject;
    }

    public String resultObject() {
        return resultObject;
    }

    public boolean hasResultObject() {
        return resultObject != null && !resultObject.isBlank();
    }

    public String inputFileName() {
        return inputFileName;
    }

    public String originalFilename() {
        return originalFilename;
    }

    public String scriptFileName() {
        return scriptFileName;
    }

    public String originalScriptFilename() {
        return originalScriptFilename;
    }

    public Builder toBuilder() {
        return new Builder()
                .runId(runId)
                .workflowKind(workflowKind)
                .parameters(parameters)
                .engineName(engineName)
                .namespace(namespace)
                .submittedAt(submittedAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .status(status)
                .inputObject(inputObject)
                .resultObject(resultObject)
                .inputFileName(inputFileName)
                .originalFilename(originalFilename)
                .scriptFileName(scriptFileName)
                .originalScriptFilename(originalScriptFilename);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String runId;
        private String workflowKind;
        private Map<String, String> parameters = new LinkedHashMap<>();
        private String engineName;
        private String namespace;
        private String submittedAt;
        private Instant createdAt;
        private Instant updatedAt;
        private RunStatus status;
        private String inputObject;
        private String resultObject;
        private String inputFileName;
        private String originalFilename;
        private String scriptFileName;
        private String originalScriptFilename;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder workflowKind(String workflowKind) {
            this.workflowKind = workflowKind;
            return this;
        }

        public Builder workflowKind(WorkflowKind kind) {
            this.workflowKind = kind.tag();
            return this;
        }

        public Builder parameters(Map<String, String> parameters) {
            this.parameters = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
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

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder inputObject(String inputObject) {
            this.inputObject = inputObject;
            return this;
        }

        public Builder resultObject(String resultObject) {
            this.resultObject = resultObject;
            return this;
        }

        public Builder inputFileName(String inputFileName) {
            this.inputFileName = inputFileName;
            return this;
        }

        public Builder originalFilename(String originalFilename) {
            this.originalFilename = originalFilename;
            return this;
        }

        public Builder scriptFileName(String scriptFileName) {
            this.scriptFileName = scriptFileName;
            return this;
        }

        public Builder originalScriptFilename(String originalScriptFilename) {
            this.originalScriptFilename = originalScriptFilename;
            return this;
        }

        public RunRecord build() {
            return new RunRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RunRecord run))
            return false;
        return Objects.equals(runId, run.runId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId);
    }

    @Override
    public String toString() {
        return "RunRecord{runId='" + runId + "', kind=" + workflowKind + ", engineName=" + engineName
                + ", phase=" + status.phase() + "}";
    }
}
