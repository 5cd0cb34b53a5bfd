package exray.bridge.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import exray.bridge.model.RunRecord;
import exray.bridge.model.RunStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for a run.
 * GET /api/v1/runs/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
        @JsonProperty("run_id") String runId,
        @JsonProperty("workflow_kind") String workflowKind,
        @JsonProperty("parameters") Map<String, String> parameters,
        @JsonProperty("engine_name") String engineName,
        @JsonProperty("namespace") String namespace,
        @JsonProperty("submitted_at") String submittedAt,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("status") StatusResponse status,
        @JsonProperty("input_object") String inputObject,
        @JsonProperty("result_object") String resultObject,
        @JsonProperty("input_file_name") String inputFileName,
        @JsonProperty("original_filename") String originalFilename,
        @JsonProperty("script_file_name") String scriptFileName,
        @JsonProperty("original_script_filename") String originalScriptFilename) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record StatusResponse(
            @JsonProperty("phase") String phase,
            @JsonProperty("startedAt") String startedAt,
            @JsonProperty("finishedAt") String finishedAt,
            @JsonProperty("progress") String progress,
            @JsonProperty("message") String message) {

        static StatusResponse from(RunStatus status) {
            return new StatusResponse(status.phase(), status.startedAt(), status.finishedAt(), status.progress(),
                    status.message());
        }
    }

    /** Create response from domain model */
    public static RunResponse from(RunRecord run) {
        return new RunResponse(
                run.runId(),
                run.workflowKind(),
                run.parameters(),
                run.engineName(),
                run.namespace(),
                run.submittedAt(),
                run.createdAt(),
                run.updatedAt(),
                StatusResponse.from(run.status()),
                run.inputObject(),
                run.resultObject(),
                run.inputFileName(),
                run.originalFilename(),
                run.scriptFileName(),
                run.originalScriptFilename());
    }
}
