package com.intellibank.analysis.services.jobs;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import com.intellibank.analysis.exceptions.DuplicateJobException;

import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide record of active jobs: at most one per upload, and one run handle per job.
 * Entries are added on submit and removed when the job reaches a terminal stage.
 */
@Component
@Slf4j
public class ActiveJobRegistry {

    private final Map<String, UUID> activeByUpload = new ConcurrentHashMap<>();
    private final Map<UUID, JobRun> runs = new ConcurrentHashMap<>();

    /**
     * @throws DuplicateJobException when another job is active for the upload
     */
    public JobRun register(String uploadId, UUID jobId) {
        UUID existing = activeByUpload.putIfAbsent(uploadId, jobId);
        if (existing != null) {
            throw new DuplicateJobException(uploadId, existing);
        }
        JobRun run = new JobRun(jobId);
        runs.put(jobId, run);
        return run;
    }

    public Optional<JobRun> runOf(UUID jobId) {
        return Optional.ofNullable(runs.get(jobId));
    }

    public Optional<UUID> activeJobFor(String uploadId) {
        return Optional.ofNullable(activeByUpload.get(uploadId));
    }

    public boolean cancel(UUID jobId) {
        JobRun run = runs.get(jobId);
        if (run == null) return false;
        run.cancel();
        return true;
    }

    public void release(String uploadId, UUID jobId) {
        boolean removed = activeByUpload.remove(uploadId, jobId);
        runs.remove(jobId);
        if (removed) {
            log.debug("[ActiveJobRegistry] released uploadId={} jobId={}", uploadId, jobId);
        }
    }

    public int activeCount() {
        return activeByUpload.size();
    }
}
