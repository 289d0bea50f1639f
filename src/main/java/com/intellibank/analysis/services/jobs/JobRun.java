package com.intellibank.analysis.services.jobs;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import com.intellibank.analysis.exceptions.JobCancelledException;

/**
 * Handle of one in-flight pipeline run. Work done on other threads checks it before writing
 * anything, so a cancelled run leaves no trace.
 */
public final class JobRun {

    private final UUID jobId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    JobRun(UUID jobId) {
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isActive() {
        return !cancelled.get();
    }

    public void ensureActive() {
        if (cancelled.get()) {
            throw new JobCancelledException(jobId);
        }
    }
}
