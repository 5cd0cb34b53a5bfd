package exray.bridge.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import exray.bridge.model.RunRecord;

import java.util.List;

/**
 * GET /api/v1/runs
 */
public record RunListResponse(@JsonProperty("runs") List<RunResponse> runs) {

    public static RunListResponse from(List<RunRecord> runs) {
        return new RunListResponse(runs.stream().map(RunResponse::from).toList());
    }
}
