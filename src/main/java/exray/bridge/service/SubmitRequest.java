package exray.bridge.service;

import exray.bridge.model.ResourceLimits;
import exray.bridge.model.WorkflowKind;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A validated request to start a run.
 *
 * @param parameters kind-specific parameters as the caller gave them; they are recorded on the
 *                   run and passed to the template
 * @param input      dataset to process
 * @param script     user script, required for {@link WorkflowKind#CUSTOM} only
 */
public record SubmitRequest(
        WorkflowKind kind,
        Map<String, String> parameters,
        UploadedFile input,
        UploadedFile script,
        ResourceLimits limits) {

    public SubmitRequest {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(input, "input");
        parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
        limits = limits != null ? limits : ResourceLimits.none();
    }

    /**
     * A file received from the caller, stored in a temporary location.
     *
     * @param originalName name the caller gave the file, may be null
     */
    public record UploadedFile(Path path, String originalName) {
        public UploadedFile {
            Objects.requireNonNull(path, "path");
        }
    }
}
