package exray.bridge.engine;

import exray.bridge.model.SubmissionReceipt;
import exray.bridge.template.FilledSpec;

import java.util.Optional;

/**
 * Client for the external batch-workflow engine.
 */
public interface WorkflowEngineClient {

    /** Main container of a workflow step */
    String MAIN_CONTAINER = "main";
    /** Sidecar that waits for the step and uploads its outputs */
    String WAIT_CONTAINER = "wait";

    /**
     * Submit a filled workflow specification.
     *
     * @throws exray.bridge.error.EngineSubmissionException on any non-2xx answer or transport failure
     */
    SubmissionReceipt submit(FilledSpec spec);

    /**
     * Fetch a workflow document by engine name.
     *
     * @return empty when the engine reports 404
     * @throws exray.bridge.error.EngineQueryException for other failures
     */
    Optional<WorkflowDocument> fetch(String engineName);

    /**
     * Fetch log text for one container of one pod, or aggregate logs when podName is null.
     *
     * @param tailLines number of trailing lines, or null/non-positive for all
     * @throws exray.bridge.error.EngineQueryException on non-2xx answer or transport failure
     */
    String fetchLogs(String engineName, String podName, String container, Integer tailLines);

    /**
     * Probe whether the engine API answers at all.
     */
    boolean ping();
}
