package exray.bridge.model;

/**
 * Time-limited download link for a run's result object.
 */
public record ResultLink(String runId, String objectKey, String downloadUrl) {
}
