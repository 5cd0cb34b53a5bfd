package exray.bridge.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import exray.bridge.model.ResultLink;

/**
 * GET /api/v1/runs/{id}/result
 */
public record ResultResponse(
        @JsonProperty("run_id") String runId,
        @JsonProperty("download_url") String downloadUrl) {

    public static ResultResponse from(ResultLink link) {
        return new ResultResponse(link.runId(), link.downloadUrl());
    }
}
