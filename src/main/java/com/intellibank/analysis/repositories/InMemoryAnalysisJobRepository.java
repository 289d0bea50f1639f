package com.intellibank.analysis.repositories;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.stereotype.Repository;

import com.intellibank.analysis.entities.AnalysisJob;
import com.intellibank.analysis.entities.JobErrorDetail;
import com.intellibank.analysis.enums.AnalysisStage;

/**
 * Process-local job store. Snapshots are replaced through {@link ConcurrentHashMap#computeIfPresent},
 * which serializes updates per job id while reads never block.
 */
@Repository
public class InMemoryAnalysisJobRepository implements AnalysisJobRepository {

    private final Map<UUID, AnalysisJob> jobs = new ConcurrentHashMap<>();

    @Override
    public AnalysisJob save(AnalysisJob job) {
        if (job == null || job.getId() == null) {
            throw new IllegalArgumentException("job with id is required");
        }
        jobs.put(job.getId(), job);
        return job;
    }

    @Override
    public Optional<AnalysisJob> findById(UUID jobId) {
        if (jobId == null) return Optional.empty();
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public boolean updateJobStage(UUID jobId, AnalysisStage stage, Instant at) {
        if (stage == AnalysisStage.FAILED) {
            throw new IllegalArgumentException("Use markFailed to fail a job");
        }
        AtomicBoolean applied = new AtomicBoolean(false);
        jobs.computeIfPresent(jobId, (id, current) -> {
            if (!current.getStage().canTransitionTo(stage)) {
                return current;
            }
            applied.set(true);
            return current.advanceTo(stage, at);
        });
        return applied.get();
    }

    @Override
    public boolean markFailed(UUID jobId, JobErrorDetail detail, Instant at) {
        AtomicBoolean applied = new AtomicBoolean(false);
        jobs.computeIfPresent(jobId, (id, current) -> {
            if (current.getStage().isTerminal()) {
                return current;
            }
            applied.set(true);
            return current.fail(detail, at);
        });
        return applied.get();
    }

    @Override
    public void recordUnparsableRecords(UUID jobId, int count, String message) {
        jobs.computeIfPresent(jobId, (id, current) -> {
            if (current.getStage().isTerminal()) {
                return current;
            }
            return current.withErrorDetail(JobErrorDetail.unparsableRecords(count, message));
        });
    }
}
