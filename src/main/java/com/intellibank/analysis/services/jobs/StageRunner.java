package com.intellibank.analysis.services.jobs;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.intellibank.analysis.config.AnalysisProperties;
import com.intellibank.analysis.enums.AnalysisStage;
import com.intellibank.analysis.enums.ErrorKind;
import com.intellibank.analysis.exceptions.JobCancelledException;
import com.intellibank.analysis.exceptions.StageFailureException;
import com.intellibank.analysis.exceptions.StageTimeoutException;
import com.intellibank.analysis.exceptions.StatementAnalysisException;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs one stage body under the stage's time budget, retrying transient failures with
 * exponential backoff on the stages that allow it.
 */
@Component
@Slf4j
public class StageRunner {

    private final Executor stageExecutor;
    private final AnalysisProperties.Orchestration config;

    public StageRunner(@Qualifier("stageTaskExecutor") Executor stageExecutor, AnalysisProperties properties) {
        this.stageExecutor = stageExecutor;
        this.config = properties.orchestration();
    }

    /**
     * @throws StageFailureException when the stage cannot produce a value
     * @throws JobCancelledException when the run was cancelled
     */
    public <T> T run(JobRun run, AnalysisStage stage, Supplier<T> work) {
        Duration budget = config.stageTimeouts().forStage(stage);
        int maxAttempts = stage.isRetryable() ? config.maxAttempts() : 1;

        for (int attempt = 1; ; attempt++) {
            run.ensureActive();
            try {
                return runOnce(run, stage, work, budget);
            } catch (JobCancelledException e) {
                throw e;
            } catch (StatementAnalysisException e) {
                if (!e.isTransientFailure() || attempt >= maxAttempts) {
                    throw new StageFailureException(stage, attempt, e.getKind(), e);
                }
                Duration backoff = config.backoffFor(attempt);
                log.warn("[AnalysisJob] jobId={} stage={} attempt={}/{} kind={} retrying in {}ms: {}",
                        run.getJobId(), stage, attempt, maxAttempts, e.getKind(), backoff.toMillis(), e.getMessage());
                sleepBackoff(run, backoff);
            } catch (RuntimeException e) {
                throw new StageFailureException(stage, attempt, ErrorKind.INTERNAL, e);
            }
        }
    }

    private <T> T runOnce(JobRun run, AnalysisStage stage, Supplier<T> work, Duration budget) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(work, stageExecutor);
        try {
            return future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // the body keeps running; every write it makes checks the run first
            future.cancel(true);
            throw new StageTimeoutException(stage, budget);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Stage " + stage + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new JobCancelledException(run.getJobId());
        }
    }

    private static void sleepBackoff(JobRun run, Duration backoff) {
        if (backoff.isZero()) return;
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException(run.getJobId());
        }
    }
}
