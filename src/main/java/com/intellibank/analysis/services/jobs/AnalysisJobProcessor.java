package com.intellibank.analysis.services.jobs;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import com.intellibank.analysis.classification.CategorizationEngine;
import com.intellibank.analysis.classification.CategoryAssignment;
import com.intellibank.analysis.config.AnalysisProperties;
import com.intellibank.analysis.dto.StatementSummaryDTO;
import com.intellibank.analysis.entities.AnalysisJob;
import com.intellibank.analysis.entities.AnalysisResult;
import com.intellibank.analysis.entities.JobErrorDetail;
import com.intellibank.analysis.entities.StatementUpload;
import com.intellibank.analysis.entities.Transaction;
import com.intellibank.analysis.enums.AnalysisStage;
import com.intellibank.analysis.enums.ErrorKind;
import com.intellibank.analysis.exceptions.JobCancelledException;
import com.intellibank.analysis.exceptions.StageFailureException;
import com.intellibank.analysis.repositories.AnalysisJobRepository;
import com.intellibank.analysis.repositories.AnalysisResultRepository;
import com.intellibank.analysis.repositories.TransactionHistoryRepository;
import com.intellibank.analysis.services.aggregation.StatementAggregationService;
import com.intellibank.analysis.services.anomaly.AnomalyDetectionService;
import com.intellibank.analysis.services.extraction.FormatExtractionService;
import com.intellibank.analysis.services.extraction.RawRecord;
import com.intellibank.analysis.services.normalization.NormalizationResult;
import com.intellibank.analysis.services.normalization.TransactionNormalizer;
import com.intellibank.analysis.storage.StatementFileStorage;

import lombok.extern.slf4j.Slf4j;

/**
 * Drives one job through the pipeline. All or nothing: a result is stored only when every stage
 * succeeded and the job could be moved to COMPLETED.
 */
@Service
@Slf4j
public class AnalysisJobProcessor {

    private final AnalysisJobRepository jobRepository;
    private final AnalysisResultRepository resultRepository;
    private final TransactionHistoryRepository historyRepository;
    private final StatementFileStorage fileStorage;
    private final FormatExtractionService extractionService;
    private final TransactionNormalizer normalizer;
    private final CategorizationEngine categorizationEngine;
    private final AnomalyDetectionService anomalyDetectionService;
    private final StatementAggregationService aggregationService;
    private final StageRunner stageRunner;
    private final ActiveJobRegistry registry;
    private final Executor classifierExecutor;
    private final int maxClassifierCallsInFlight;
    private final Clock clock;

    public AnalysisJobProcessor(AnalysisJobRepository jobRepository,
                                AnalysisResultRepository resultRepository,
                                TransactionHistoryRepository historyRepository,
                                StatementFileStorage fileStorage,
                                FormatExtractionService extractionService,
                                TransactionNormalizer normalizer,
                                CategorizationEngine categorizationEngine,
                                AnomalyDetectionService anomalyDetectionService,
                                StatementAggregationService aggregationService,
                                StageRunner stageRunner,
                                ActiveJobRegistry registry,
                                @Qualifier("classifierTaskExecutor") Executor classifierExecutor,
                                AnalysisProperties properties,
                                Clock clock) {
        this.jobRepository = jobRepository;
        this.resultRepository = resultRepository;
        this.historyRepository = historyRepository;
        this.fileStorage = fileStorage;
        this.extractionService = extractionService;
        this.normalizer = normalizer;
        this.categorizationEngine = categorizationEngine;
        this.anomalyDetectionService = anomalyDetectionService;
        this.aggregationService = aggregationService;
        this.stageRunner = stageRunner;
        this.registry = registry;
        this.classifierExecutor = classifierExecutor;
        this.maxClassifierCallsInFlight = properties.categorization().maxConcurrency();
        this.clock = clock;
    }

    @Async("analysisJobTaskExecutor")
    public void startProcessing(UUID jobId) {
        if (jobId == null) return;
        processJob(jobId);
    }

    public void processJob(UUID jobId) {
        if (jobId == null) return;
        AnalysisJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("[AnalysisJob] job not found: {}", jobId);
            return;
        }
        // never run a job twice
        if (job.getStage() != AnalysisStage.CREATED) {
            log.debug("[AnalysisJob] jobId={} already at stage={}, skipping", jobId, job.getStage());
            return;
        }
        JobRun run = registry.runOf(jobId).orElse(null);
        if (run == null) {
            log.warn("[AnalysisJob] jobId={} has no active run, skipping", jobId);
            return;
        }

        Instant startedAt = clock.instant();
        AnalysisStage current = AnalysisStage.CREATED;
        try {
            current = enter(run, AnalysisStage.EXTRACTING);
            List<RawRecord> records = stageRunner.run(run, current, () -> extract(job));

            current = enter(run, AnalysisStage.NORMALIZING);
            NormalizationResult normalized = stageRunner.run(run, current,
                    () -> normalizer.normalize(job.getUploadId(), records));
            if (normalized.hasUnparsableRecords()) {
                jobRepository.recordUnparsableRecords(jobId, normalized.unparsableCount(), normalized.issueSummary());
            }
            List<Transaction> transactions = new ArrayList<>(normalized.transactions());

            current = enter(run, AnalysisStage.CATEGORIZING);
            List<CategoryAssignment> assignments = stageRunner.run(run, current,
                    () -> categorizeAll(run, transactions));
            applyAssignments(run, transactions, assignments);

            current = enter(run, AnalysisStage.DETECTING_ANOMALIES);
            List<Transaction> history = job.getAccountId() == null
                    ? List.of()
                    : historyRepository.findByAccountId(job.getAccountId());
            Set<UUID> flagged = stageRunner.run(run, current,
                    () -> anomalyDetectionService.detectAnomalies(history, transactions));

            current = enter(run, AnalysisStage.AGGREGATING);
            StatementSummaryDTO previous = job.getAccountId() == null
                    ? null
                    : historyRepository.findLatestSummary(job.getAccountId()).orElse(null);
            StatementSummaryDTO summary = stageRunner.run(run, current,
                    () -> aggregationService.aggregate(transactions, previous));

            complete(run, job, transactions, summary, flagged, startedAt);

        } catch (JobCancelledException e) {
            resultRepository.deleteByJobId(jobId);
            log.info("[AnalysisJob] jobId={} stopped at stage={}: cancelled", jobId, current);
        } catch (StageFailureException e) {
            fail(jobId, e.getStage(), e.getKind(), e.getMessage(), e.getAttempts(), e);
        } catch (RuntimeException e) {
            fail(jobId, current, ErrorKind.INTERNAL, e.getMessage(), 1, e);
        } finally {
            registry.release(job.getUploadId(), jobId);
        }
    }

    private List<RawRecord> extract(AnalysisJob job) {
        byte[] bytes = fileStorage.fetchFile(job.getUploadId());
        StatementUpload upload = new StatementUpload(
                job.getUploadId(), job.getAccountId(), job.getFormat(), bytes.length, clock.instant());
        log.debug("[AnalysisJob] jobId={} fetched uploadId={} bytes={}", job.getId(), upload.uploadId(), upload.byteSize());
        return extractionService.extract(bytes, upload.format());
    }

    /**
     * Fans out over the classifier pool and joins in the original order. At most
     * {@code maxConcurrency} calls of this job are submitted at any time, so a long statement never
     * fills the shared pool's queue.
     */
    private List<CategoryAssignment> categorizeAll(JobRun run, List<Transaction> transactions) {
        Semaphore inFlight = new Semaphore(maxClassifierCallsInFlight);
        AtomicBoolean failed = new AtomicBoolean();
        List<CompletableFuture<CategoryAssignment>> futures = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) {
            acquire(run, inFlight);
            if (failed.get()) {
                inFlight.release();
                break;
            }
            CompletableFuture<CategoryAssignment> future;
            try {
                future = CompletableFuture.supplyAsync(() -> {
                    run.ensureActive();
                    return categorizationEngine.categorize(tx);
                }, classifierExecutor);
            } catch (RuntimeException e) {
                inFlight.release();
                futures.forEach(f -> f.cancel(false));
                throw e;
            }
            futures.add(future.whenComplete((assignment, error) -> {
                if (error != null) failed.set(true);
                inFlight.release();
            }));
        }

        List<CategoryAssignment> assignments = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<CategoryAssignment> f : futures) {
                assignments.add(f.join());
            }
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(false));
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
        return assignments;
    }

    private static void acquire(JobRun run, Semaphore inFlight) {
        run.ensureActive();
        try {
            inFlight.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException(run.getJobId());
        }
    }

    private static void applyAssignments(JobRun run, List<Transaction> transactions, List<CategoryAssignment> assignments) {
        run.ensureActive();
        for (int i = 0; i < transactions.size(); i++) {
            Transaction tx = transactions.get(i);
            CategoryAssignment a = assignments.get(i);
            tx.setCategory(a.category());
            tx.setCategoryConfidence(a.confidence());
            tx.setCategorySource(a.source());
        }
    }

    private void complete(JobRun run, AnalysisJob job, List<Transaction> transactions,
                          StatementSummaryDTO summary, Set<UUID> flagged, Instant startedAt) {
        run.ensureActive();
        Instant now = clock.instant();
        AnalysisResult result = new AnalysisResult(
                job.getId(),
                job.getUploadId(),
                transactions,
                summary,
                List.copyOf(flagged),
                now,
                Duration.between(startedAt, now));

        resultRepository.saveResult(result);
        if (!jobRepository.updateJobStage(job.getId(), AnalysisStage.COMPLETED, clock.instant())) {
            resultRepository.deleteByJobId(job.getId());
            throw new JobCancelledException(job.getId());
        }

        if (job.getAccountId() != null) {
            historyRepository.append(job.getAccountId(), result.transactions(), summary);
        }
        log.info("[AnalysisJob] jobId={} completed transactions={} anomalies={} tookMs={}",
                job.getId(), transactions.size(), flagged.size(), result.processingTime().toMillis());
    }

    private AnalysisStage enter(JobRun run, AnalysisStage stage) {
        run.ensureActive();
        if (!jobRepository.updateJobStage(run.getJobId(), stage, clock.instant())) {
            throw new JobCancelledException(run.getJobId());
        }
        log.info("[AnalysisJob] jobId={} stage={}", run.getJobId(), stage);
        return stage;
    }

    private void fail(UUID jobId, AnalysisStage stage, ErrorKind kind, String message, int attempts, Exception e) {
        resultRepository.deleteByJobId(jobId);
        boolean applied = jobRepository.markFailed(jobId,
                JobErrorDetail.failure(stage, kind, message, attempts), clock.instant());
        if (applied) {
            log.error("[AnalysisJob] failed jobId={} stage={} kind={} attempts={}", jobId, stage, kind, attempts, e);
        } else {
            log.info("[AnalysisJob] jobId={} failure at stage={} ignored, job already terminal", jobId, stage);
        }
    }
}
