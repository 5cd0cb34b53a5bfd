package exray.bridge.repository;

import exray.bridge.model.RunPatch;
import exray.bridge.model.RunRecord;

import java.util.List;
import java.util.Optional;

/**
 * Repository for run records.
 * Every read passes records through the schema upgrade, persisting it when it changed something.
 */
public interface RunRepository {

    /**
     * Store a new run. Stamps created_at and updated_at.
     *
     * @return the stored record
     * @throws exray.bridge.error.DuplicateRunException if the run id is already taken; the
     *         existing record is left untouched
     */
    RunRecord create(RunRecord record);

    Optional<RunRecord> get(String runId);

    /**
     * All runs, oldest first.
     */
    List<RunRecord> list();

    /**
     * Shallow-merge the patch into the stored record and refresh updated_at.
     *
     * @return the updated record, or empty if the run does not exist
     */
    Optional<RunRecord> update(String runId, RunPatch patch);
}
