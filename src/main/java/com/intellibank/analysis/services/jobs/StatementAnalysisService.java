package com.intellibank.analysis.services.jobs;

import java.time.Clock;
import java.util.UUID;

import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import com.intellibank.analysis.dto.JobStatusDTO;
import com.intellibank.analysis.entities.AnalysisJob;
import com.intellibank.analysis.entities.AnalysisResult;
import com.intellibank.analysis.entities.JobErrorDetail;
import com.intellibank.analysis.enums.AnalysisStage;
import com.intellibank.analysis.enums.ErrorKind;
import com.intellibank.analysis.enums.StatementFormat;
import com.intellibank.analysis.exceptions.JobNotFoundException;
import com.intellibank.analysis.exceptions.NotReadyException;
import com.intellibank.analysis.repositories.AnalysisJobRepository;
import com.intellibank.analysis.repositories.AnalysisResultRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the engine: submit statements, poll their jobs, fetch results, cancel.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementAnalysisService {

    private final AnalysisJobRepository jobRepository;
    private final AnalysisResultRepository resultRepository;
    private final ActiveJobRegistry registry;
    private final AnalysisJobProcessor processor;
    private final Clock clock;

    public UUID submitStatement(String uploadId, String declaredFormat) {
        return submitStatement(uploadId, null, declaredFormat);
    }

    /**
     * Creates a job for the upload and starts it asynchronously.
     *
     * @param accountId owning account, or null to analyze the statement without history
     * @return the new job id
     * @throws com.intellibank.analysis.exceptions.UnsupportedFormatException for an unknown format
     * @throws com.intellibank.analysis.exceptions.DuplicateJobException when a job for the upload
     *         is still active
     */
    public UUID submitStatement(String uploadId, String accountId, String declaredFormat) {
        if (uploadId == null || uploadId.isBlank()) {
            throw new IllegalArgumentException("uploadId is required");
        }
        StatementFormat format = StatementFormat.fromDeclared(declaredFormat);
        String account = accountId == null || accountId.isBlank() ? null : accountId.trim();

        AnalysisJob job = AnalysisJob.created(uploadId.trim(), account, format, clock.instant());
        registry.register(job.getUploadId(), job.getId());
        try {
            jobRepository.save(job);
        } catch (RuntimeException e) {
            registry.release(job.getUploadId(), job.getId());
            throw e;
        }
        log.info("[AnalysisJob] submitted jobId={} uploadId={} accountId={} format={}",
                job.getId(), job.getUploadId(), account, format);

        try {
            processor.startProcessing(job.getId());
        } catch (TaskRejectedException e) {
            jobRepository.markFailed(job.getId(),
                    JobErrorDetail.failure(AnalysisStage.CREATED, ErrorKind.INTERNAL, "Job queue is full: " + e.getMessage(), 0),
                    clock.instant());
            registry.release(job.getUploadId(), job.getId());
            log.error("[AnalysisJob] could not schedule jobId={}", job.getId(), e);
        }
        return job.getId();
    }

    public JobStatusDTO getJobStatus(UUID jobId) {
        return JobStatusDTO.from(loadJob(jobId));
    }

    /**
     * @throws NotReadyException unless the job is COMPLETED
     */
    public AnalysisResult getResult(UUID jobId) {
        AnalysisJob job = loadJob(jobId);
        if (job.getStage() != AnalysisStage.COMPLETED) {
            throw new NotReadyException(jobId, job.getStage());
        }
        return resultRepository.findByJobId(jobId)
                .orElseThrow(() -> new IllegalStateException("Completed job " + jobId + " has no stored result"));
    }

    /**
     * Moves a non-terminal job to FAILED with kind CANCELLED and stops its run.
     *
     * @return false when the job had already finished
     */
    public boolean cancel(UUID jobId) {
        AnalysisJob job = loadJob(jobId);
        if (job.getStage().isTerminal()) {
            return false;
        }
        boolean applied = jobRepository.markFailed(jobId,
                JobErrorDetail.failure(job.getStage(), ErrorKind.CANCELLED, "Cancelled on request", 0),
                clock.instant());
        if (!applied) {
            return false;
        }
        registry.cancel(jobId);
        registry.release(job.getUploadId(), jobId);
        resultRepository.deleteByJobId(jobId);
        log.info("[AnalysisJob] cancelled jobId={} at stage={}", jobId, job.getStage());
        return true;
    }

    private AnalysisJob loadJob(UUID jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId is required");
        }
        return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }
}
