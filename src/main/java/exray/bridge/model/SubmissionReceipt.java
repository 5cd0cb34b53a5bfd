package exray.bridge.model;

/**
 * What the workflow engine reports back for an accepted submission.
 *
 * @param engineName  name the engine assigned to the execution (may be null)
 * @param namespace   namespace the execution lives in
 * @param submittedAt engine creation timestamp, verbatim
 */
public record SubmissionReceipt(String engineName, String namespace, String submittedAt) {
}
