package com.intellibank.analysis.repositories;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import com.intellibank.analysis.entities.AnalysisJob;
import com.intellibank.analysis.entities.JobErrorDetail;
import com.intellibank.analysis.enums.AnalysisStage;

/**
 * Durable job store. Implementations must apply each update atomically per job id.
 */
public interface AnalysisJobRepository {

    AnalysisJob save(AnalysisJob job);

    Optional<AnalysisJob> findById(UUID jobId);

    /**
     * Moves the job to {@code stage}, stamping {@code at} in the same update.
     *
     * @return false when the job is unknown or the transition is not allowed (for example the job
     *         was cancelled in the meantime)
     */
    boolean updateJobStage(UUID jobId, AnalysisStage stage, Instant at);

    /**
     * Moves a non-terminal job to FAILED with the given detail.
     *
     * @return false when the job is unknown or already terminal
     */
    boolean markFailed(UUID jobId, JobErrorDetail detail, Instant at);

    /**
     * Records the number of records skipped during normalization without changing the stage.
     */
    void recordUnparsableRecords(UUID jobId, int count, String message);
}
