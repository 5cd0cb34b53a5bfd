package exray.bridge.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import exray.bridge.model.WorkflowKind;
import exray.bridge.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Brings stored run documents up to {@link #CURRENT_VERSION}.
 * <p>
 * v1: legacy field names, run_id backfilled from the storage key, scalar values wrapped.
 * v2: result_object backfilled for kinds whose output is named after the input.
 * <p>
 * Upgrading an up-to-date document changes nothing, so repeated reads converge without writes.
 * updated_at is never touched here.
 */
public final class RunRecordUpgrader {

    public static final int CURRENT_VERSION = 2;

    private static final Map<String, String> LEGACY_FIELDS = new LinkedHashMap<>();

    static {
        LEGACY_FIELDS.put("runID", RunRecordCodec.RUN_ID);
        LEGACY_FIELDS.put("workflow", RunRecordCodec.WORKFLOW_KIND);
        LEGACY_FIELDS.put("argo_name", RunRecordCodec.ENGINE_NAME);
        LEGACY_FIELDS.put("python_file_name", RunRecordCodec.SCRIPT_FILE_NAME);
        LEGACY_FIELDS.put("original_python_filename", RunRecordCodec.ORIGINAL_SCRIPT_FILENAME);
    }

    /**
     * @param document the upgraded document (a new node when the stored value was not an object)
     * @param changed  whether anything differs from what was stored
     */
    public record Result(ObjectNode document, boolean changed) {

        public String runId() {
            return Jsons.text(document, RunRecordCodec.RUN_ID);
        }
    }

    private RunRecordUpgrader() {
    }

    /**
     * Upgrade a stored value in place where possible.
     *
     * @param storageKey key the value is stored under, used when the document carries no run id
     */
    public static Result upgrade(String storageKey, JsonNode stored) {
        boolean changed = false;
        ObjectNode doc;
        if (stored != null && stored.isObject()) {
            doc = (ObjectNode) stored;
        } else {
            doc = Jsons.mapper().createObjectNode();
            doc.set("value", stored == null ? Jsons.mapper().nullNode() : stored);
            changed = true;
        }

        int version = doc.path(RunRecordCodec.SCHEMA_VERSION).asInt(0);
        if (version < 1) {
            renameLegacyFields(doc);
            changed = true;
        }

        if (isBlank(Jsons.text(doc, RunRecordCodec.RUN_ID))) {
            doc.put(RunRecordCodec.RUN_ID, storageKey);
            changed = true;
        }

        if (backfillResultObject(doc)) {
            changed = true;
        }

        if (version != CURRENT_VERSION) {
            doc.put(RunRecordCodec.SCHEMA_VERSION, CURRENT_VERSION);
            changed = true;
        }
        return new Result(doc, changed);
    }

    private static void renameLegacyFields(ObjectNode doc) {
        for (Map.Entry<String, String> e : LEGACY_FIELDS.entrySet()) {
            JsonNode legacy = doc.remove(e.getKey());
            if (legacy == null) {
                continue;
            }
            JsonNode current = doc.get(e.getValue());
            if ((current == null || current.isNull()) && !legacy.isNull()) {
                doc.set(e.getValue(), legacy.isValueNode() ? Jsons.mapper().getNodeFactory().textNode(legacy.asText()) : legacy);
            }
        }
    }

    /**
     * The run's output location follows from its input name for ctgan and llm runs.
     * Runs of other kinds, and runs that already have a result object, are left alone.
     */
    static boolean backfillResultObject(ObjectNode doc) {
        if (!isBlank(Jsons.text(doc, RunRecordCodec.RESULT_OBJECT))) {
            return false;
        }
        String inputName = Jsons.text(doc, RunRecordCodec.INPUT_FILE_NAME);
        if (isBlank(inputName)) {
            return false;
        }
        boolean conventional = WorkflowKind.fromTag(Jsons.text(doc, RunRecordCodec.WORKFLOW_KIND))
                .map(WorkflowKind::outputNamedAfterInput)
                .orElse(false);
        if (!conventional) {
            return false;
        }
        doc.put(RunRecordCodec.RESULT_OBJECT, "output/" + inputName);
        return true;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
