package exray.bridge.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import exray.bridge.model.RunRecord;
import exray.bridge.model.RunStatus;
import exray.bridge.model.WorkflowKind;
import exray.bridge.util.Jsons;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunResponseTest {

    @Test
    void serializesSnakeCaseAndOmitsNulls() throws Exception {
        RunRecord run = RunRecord.builder()
                .runId("r1")
                .workflowKind(WorkflowKind.LLM)
                .parameters(Map.of("labels", "a,b"))
                .engineName("llm-abc")
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .status(new RunStatus("Running", "2024-05-01T10:00:01Z", null, "0/1", null))
                .resultObject("output/r1_d.csv")
                .build();

        JsonNode json = Jsons.mapper().readTree(Jsons.toJson(RunResponse.from(run)));

        assertEquals("r1", json.path("run_id").asText());
        assertEquals("llm", json.path("workflow_kind").asText());
        assertEquals("llm-abc", json.path("engine_name").asText());
        assertEquals("a,b", json.path("parameters").path("labels").asText());
        assertEquals("2024-05-01T10:00:00Z", json.path("created_at").asText());
        assertEquals("Running", json.path("status").path("phase").asText());
        assertEquals("2024-05-01T10:00:01Z", json.path("status").path("startedAt").asText());
        assertFalse(json.path("status").has("finishedAt"));
        assertFalse(json.has("script_file_name"));
        assertEquals("output/r1_d.csv", json.path("result_object").asText());
    }

    @Test
    void listWrapsRuns() throws Exception {
        RunListResponse list = RunListResponse.from(List.of(
                RunRecord.builder().runId("a").build(), RunRecord.builder().runId("b").build()));

        JsonNode json = Jsons.mapper().readTree(Jsons.toJson(list));
        assertEquals(2, json.path("runs").size());
        assertEquals("Pending", json.path("runs").get(0).path("status").path("phase").asText());
    }
}
