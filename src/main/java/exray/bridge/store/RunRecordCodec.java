package exray.bridge.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import exray.bridge.model.RunPatch;
import exray.bridge.model.RunRecord;
import exray.bridge.model.RunStatus;
import exray.bridge.util.Jsons;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted JSON form of {@link RunRecord}.
 * Field names are snake_case; the embedded status keeps the engine's camelCase names.
 */
public final class RunRecordCodec {

    public static final String RUN_ID = "run_id";
    public static final String WORKFLOW_KIND = "workflow_kind";
    public static final String PARAMETERS = "parameters";
    public static final String ENGINE_NAME = "engine_name";
    public static final String NAMESPACE = "namespace";
    public static final String SUBMITTED_AT = "submitted_at";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";
    public static final String STATUS = "status";
    public static final String INPUT_OBJECT = "input_object";
    public static final String RESULT_OBJECT = "result_object";
    public static final String INPUT_FILE_NAME = "input_file_name";
    public static final String ORIGINAL_FILENAME = "original_filename";
    public static final String SCRIPT_FILE_NAME = "script_file_name";
    public static final String ORIGINAL_SCRIPT_FILENAME = "original_script_filename";
    public static final String SCHEMA_VERSION = "schema_version";

    private RunRecordCodec() {
    }

    public static ObjectNode encode(RunRecord run) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put(RUN_ID, run.runId());
        putIfSet(node, WORKFLOW_KIND, run.workflowKind());
        ObjectNode params = node.putObject(PARAMETERS);
        run.parameters().forEach(params::put);
        putIfSet(node, ENGINE_NAME, run.engineName());
        putIfSet(node, NAMESPACE, run.namespace());
        putIfSet(node, SUBMITTED_AT, run.submittedAt());
        if (run.createdAt() != null) {
            node.put(CREATED_AT, run.createdAt().toString());
        }
        if (run.updatedAt() != null) {
            node.put(UPDATED_AT, run.updatedAt().toString());
        }
        node.set(STATUS, encodeStatus(run.status()));
        putIfSet(node, INPUT_OBJECT, run.inputObject());
        putIfSet(node, RESULT_OBJECT, run.resultObject());
        putIfSet(node, INPUT_FILE_NAME, run.inputFileName());
        putIfSet(node, ORIGINAL_FILENAME, run.originalFilename());
        putIfSet(node, SCRIPT_FILE_NAME, run.scriptFileName());
        putIfSet(node, ORIGINAL_SCRIPT_FILENAME, run.originalScriptFilename());
        node.put(SCHEMA_VERSION, RunRecordUpgrader.CURRENT_VERSION);
        return node;
    }

    /**
     * Decode an upgraded record. Unknown fields are ignored here but stay in the stored document.
     */
    public static RunRecord decode(JsonNode node) {
        return RunRecord.builder()
                .runId(Jsons.text(node, RUN_ID))
                .workflowKind(Jsons.text(node, WORKFLOW_KIND))
                .parameters(decodeParameters(node.get(PARAMETERS)))
                .engineName(Jsons.text(node, ENGINE_NAME))
                .namespace(Jsons.text(node, NAMESPACE))
                .submittedAt(Jsons.text(node, SUBMITTED_AT))
                .createdAt(parseInstant(Jsons.text(node, CREATED_AT)))
                .updatedAt(parseInstant(Jsons.text(node, UPDATED_AT)))
                .status(decodeStatus(node.get(STATUS)))
                .inputObject(Jsons.text(node, INPUT_OBJECT))
                .resultObject(Jsons.text(node, RESULT_OBJECT))
                .inputFileName(Jsons.text(node, INPUT_FILE_NAME))
                .originalFilename(Jsons.text(node, ORIGINAL_FILENAME))
                .scriptFileName(Jsons.text(node, SCRIPT_FILE_NAME))
                .originalScriptFilename(Jsons.text(node, ORIGINAL_SCRIPT_FILENAME))
                .build();
    }

    /**
     * Top-level fields a patch replaces.
     */
    public static ObjectNode encodePatch(RunPatch patch) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        if (patch.status() != null) {
            node.set(STATUS, encodeStatus(patch.status()));
        }
        putIfSet(node, RESULT_OBJECT, patch.resultObject());
        putIfSet(node, ENGINE_NAME, patch.engineName());
        putIfSet(node, NAMESPACE, patch.namespace());
        putIfSet(node, SUBMITTED_AT, patch.submittedAt());
        putIfSet(node, INPUT_OBJECT, patch.inputObject());
        if (patch.parameters() != null) {
            ObjectNode params = node.putObject(PARAMETERS);
            patch.parameters().forEach(params::put);
        }
        return node;
    }

    public static ObjectNode encodeStatus(RunStatus status) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        putIfSet(node, "phase", status.phase());
        putIfSet(node, "startedAt", status.startedAt());
        putIfSet(node, "finishedAt", status.finishedAt());
        putIfSet(node, "progress", status.progress());
        putIfSet(node, "message", status.message());
        return node;
    }

    public static RunStatus decodeStatus(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return new RunStatus(
                Jsons.text(node, "phase"),
                Jsons.text(node, "startedAt"),
                Jsons.text(node, "finishedAt"),
                Jsons.text(node, "progress"),
                Jsons.text(node, "message"));
    }

    // Older records hold numbers and nulls here
    private static Map<String, String> decodeParameters(JsonNode node) {
        Map<String, String> params = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return params;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode value = e.getValue();
            if (value == null || value.isNull()) {
                continue;
            }
            params.put(e.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return params;
    }

    static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(raw).toInstant();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private static void putIfSet(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
