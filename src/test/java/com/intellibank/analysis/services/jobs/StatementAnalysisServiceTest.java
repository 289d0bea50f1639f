package com.intellibank.analysis.services.jobs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.intellibank.analysis.classification.Category;
import com.intellibank.analysis.classification.ClassifierBackend;
import com.intellibank.analysis.classification.ClassifierVerdict;
import com.intellibank.analysis.classification.KeywordScoringClassifierBackend;
import com.intellibank.analysis.dto.JobStatusDTO;
import com.intellibank.analysis.entities.AnalysisResult;
import com.intellibank.analysis.entities.Transaction;
import com.intellibank.analysis.enums.AnalysisStage;
import com.intellibank.analysis.enums.ErrorKind;
import com.intellibank.analysis.exceptions.ClassifierUnavailableException;
import com.intellibank.analysis.exceptions.DuplicateJobException;
import com.intellibank.analysis.exceptions.JobNotFoundException;
import com.intellibank.analysis.exceptions.NotReadyException;
import com.intellibank.analysis.exceptions.StorageUnavailableException;
import com.intellibank.analysis.exceptions.UnsupportedFormatException;
import com.intellibank.analysis.repositories.InMemoryAnalysisJobRepository;
import com.intellibank.analysis.repositories.InMemoryAnalysisResultRepository;
import com.intellibank.analysis.storage.InMemoryStatementFileStorage;
import com.intellibank.analysis.storage.StatementFileStorage;

class StatementAnalysisServiceTest {

    private static final String JANUARY_CSV = """
            Date,Description,Amount
            2024-01-05,STARBUCKS STORE #1234,-4.50
            2024-13-45,TARGET,-20.00
            2024-01-07,PAYROLL ACME INC,2500.00
            """;

    private final InMemoryStatementFileStorage storage = new InMemoryStatementFileStorage();

    @Test
    void submitStatement_completesAndCountsSkippedRecords() {
        PipelineFixture fx = new PipelineFixture(storage, new KeywordScoringClassifierBackend());
        storage.store("upload-jan", JANUARY_CSV.getBytes(StandardCharsets.UTF_8));

        UUID jobId = fx.service.submitStatement("upload-jan", "csv");

        JobStatusDTO status = fx.service.getJobStatus(jobId);
        assertThat(status.stage()).isEqualTo(AnalysisStage.COMPLETED);
        assertThat(status.uploadId()).isEqualTo("upload-jan");
        assertThat(status.errorDetail().unparsableRecordCount()).isEqualTo(1);
        assertThat(status.errorDetail().kind()).isEqualTo(ErrorKind.UNPARSABLE_RECORD);
        assertThat(status.errorDetail().isFailure()).isFalse();
        assertThat(status.stageEnteredAt()).containsKeys(
                AnalysisStage.CREATED, AnalysisStage.EXTRACTING, AnalysisStage.NORMALIZING,
                AnalysisStage.CATEGORIZING, AnalysisStage.DETECTING_ANOMALIES, AnalysisStage.AGGREGATING,
                AnalysisStage.COMPLETED);

        AnalysisResult result = fx.service.getResult(jobId);
        assertThat(result.transactions()).hasSize(2);
        assertThat(result.transactions()).extracting(Transaction::getCategory)
                .containsExactly(Category.FOOD, Category.INCOME);
        assertThat(result.transactions()).allSatisfy(t -> assertThat(t.getAnomaly()).isNotNull());
        assertThat(result.summary().getTotalIncome()).isEqualTo(250_000L);
        assertThat(result.summary().getTotalExpenses()).isEqualTo(450L);
        assertThat(fx.registry.activeCount()).isZero();
    }

    @Test
    void submitStatement_appendsToAccountHistory_andReportsDeltasNextTime() {
        PipelineFixture fx = new PipelineFixture(storage, new KeywordScoringClassifierBackend());
        storage.store("upload-jan", JANUARY_CSV.getBytes(StandardCharsets.UTF_8));
        storage.store("upload-feb", """
                Date,Description,Amount
                2024-02-05,STARBUCKS STORE #1234,-6.50
                """.getBytes(StandardCharsets.UTF_8));

        fx.service.submitStatement("upload-jan", "acct-1", "csv");
        UUID february = fx.service.submitStatement("upload-feb", "acct-1", "csv");

        AnalysisResult result = fx.service.getResult(february);
        assertThat(fx.historyRepository.findByAccountId("acct-1")).hasSize(3);
        assertThat(result.categoryTotals())
                .filteredOn(c -> c.getCategory().equals("Food"))
                .singleElement()
                .satisfies(c -> assertThat(c.getDeltaFromPrevious()).isEqualTo(-200L));
    }

    @Test
    void getResult_cannotBeChangedByCallers() {
        PipelineFixture fx = new PipelineFixture(storage, new KeywordScoringClassifierBackend());
        storage.store("upload-jan", JANUARY_CSV.getBytes(StandardCharsets.UTF_8));
        UUID jobId = fx.service.submitStatement("upload-jan", "acct-1", "csv");

        AnalysisResult handedOut = fx.service.getResult(jobId);
        handedOut.transactions().get(0).setAmount(999_999L);
        fx.historyRepository.findByAccountId("acct-1").get(0).setAmount(999_999L);

        assertThat(fx.service.getResult(jobId).transactions().get(0).getAmount()).isEqualTo(-450L);
        assertThat(fx.historyRepository.findByAccountId("acct-1").get(0).getAmount()).isEqualTo(-450L);
        assertThatThrownBy(() -> handedOut.summary().getCategoryTotals().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(fx.historyRepository.findLatestSummary("acct-1")).contains(handedOut.summary());
    }

    @Test
    void submitStatement_failsAtCategorization_whenClassifierStaysUnavailable() {
        ClassifierBackend backend = mock(ClassifierBackend.class);
        when(backend.classify(eq("MYSTERY VENDOR"), any()))
                .thenThrow(new ClassifierUnavailableException("classifier timed out"));
        PipelineFixture fx = new PipelineFixture(storage, backend);
        storage.store("upload-x", """
                Date,Description,Amount
                2024-01-05,MYSTERY VENDOR,-12.00
                """.getBytes(StandardCharsets.UTF_8));

        UUID jobId = fx.service.submitStatement("upload-x", "csv");

        JobStatusDTO status = fx.service.getJobStatus(jobId);
        assertThat(status.stage()).isEqualTo(AnalysisStage.FAILED);
        assertThat(status.errorDetail().failedStage()).isEqualTo(AnalysisStage.CATEGORIZING);
        assertThat(status.errorDetail().kind()).isEqualTo(ErrorKind.CLASSIFIER_UNAVAILABLE);
        assertThat(status.errorDetail().attempts()).isEqualTo(3);
        assertThat(status.errorDetail().message()).contains("classifier timed out");
        assertThat(fx.resultRepository.findByJobId(jobId)).isEmpty();
        assertThatThrownBy(() -> fx.service.getResult(jobId)).isInstanceOf(NotReadyException.class);
        verify(backend, times(3)).classify(eq("MYSTERY VENDOR"), any());
        assertThat(fx.categorizationEngine.cacheSize()).isZero();
    }

    @Test
    void submitStatement_completesStatementsLongerThanTheClassifierQueue() {
        ThreadPoolTaskExecutor classifierPool = new ThreadPoolTaskExecutor();
        classifierPool.setCorePoolSize(2);
        classifierPool.setMaxPoolSize(2);
        classifierPool.setQueueCapacity(4);
        classifierPool.initialize();
        try {
            PipelineFixture fx = new PipelineFixture(storage, new KeywordScoringClassifierBackend(), classifierPool);
            StringBuilder csv = new StringBuilder("Date,Description,Amount\n");
            for (int i = 0; i < 300; i++) {
                csv.append(LocalDate.of(2024, 1, 1).plusDays(i % 28)).append(",CORNER PIZZA,-10.00\n");
            }
            storage.store("upload-long", csv.toString().getBytes(StandardCharsets.UTF_8));

            UUID jobId = fx.service.submitStatement("upload-long", "csv");

            assertThat(fx.service.getJobStatus(jobId).stage()).isEqualTo(AnalysisStage.COMPLETED);
            AnalysisResult result = fx.service.getResult(jobId);
            assertThat(result.transactions()).hasSize(300);
            assertThat(result.transactions()).allSatisfy(t -> assertThat(t.getCategory()).isNotNull());
        } finally {
            classifierPool.shutdown();
        }
    }

    @Test
    void submitStatement_failsWithoutRetry_onCorruptInput() {
        PipelineFixture fx = new PipelineFixture(storage, new KeywordScoringClassifierBackend());
        storage.store("upload-bin", new byte[] {0x50, 0x4B, 0x03, 0x04, 0x00, 0x00});

        UUID jobId = fx.service.submitStatement("upload-bin", "csv");

        JobStatusDTO status = fx.service.getJobStatus(jobId);
        assertThat(status.stage()).isEqualTo(AnalysisStage.FAILED);
        assertThat(status.errorDetail().failedStage()).isEqualTo(AnalysisStage.EXTRACTING);
        assertThat(status.errorDetail().kind()).isEqualTo(ErrorKind.CORRUPT_INPUT);
        assertThat(status.errorDetail().attempts()).isEqualTo(1);
    }

    @Test
    void submitStatement_retriesTransientStorageErrors() {
        StatementFileStorage flaky = mock(StatementFileStorage.class);
        when(flaky.fetchFile("upload-jan"))
                .thenThrow(new StorageUnavailableException("503 from object store"))
                .thenReturn(JANUARY_CSV.getBytes(StandardCharsets.UTF_8));
        PipelineFixture fx = new PipelineFixture(flaky, new KeywordScoringClassifierBackend());

        UUID jobId = fx.service.submitStatement("upload-jan", "csv");

        assertThat(fx.service.getJobStatus(jobId).stage()).isEqualTo(AnalysisStage.COMPLETED);
        verify(flaky, times(2)).fetchFile("upload-jan");
    }

    @Test
    void submitStatement_rejectsUnknownFormats_beforeCreatingAJob() {
        PipelineFixture fx = new PipelineFixture(storage, new KeywordScoringClassifierBackend());

        assertThatThrownBy(() -> fx.service.submitStatement("upload-1", "docx"))
                .isInstanceOf(UnsupportedFormatException.class);
        assertThat(fx.registry.activeCount()).isZero();
    }

    @Test
    void submitStatement_rejectsSecondJobForAnActiveUpload() {
        Fixture fx = new Fixture();
        UUID first = fx.service.submitStatement("upload-1", "pdf");

        assertThatThrownBy(() -> fx.service.submitStatement("upload-1", "pdf"))
                .isInstanceOf(DuplicateJobException.class);
        assertThat(fx.service.getJobStatus(first).stage()).isEqualTo(AnalysisStage.CREATED);
    }

    @Test
    void submitStatement_failsTheJob_whenTheQueueIsFull() {
        Fixture fx = new Fixture();
        doThrow(new TaskRejectedException("queue full")).when(fx.processor).startProcessing(any());

        UUID jobId = fx.service.submitStatement("upload-1", "csv");

        JobStatusDTO status = fx.service.getJobStatus(jobId);
        assertThat(status.stage()).isEqualTo(AnalysisStage.FAILED);
        assertThat(status.errorDetail().kind()).isEqualTo(ErrorKind.INTERNAL);
        assertThat(fx.registry.activeCount()).isZero();
    }

    @Test
    void cancel_failsAPendingJob_andFreesTheUpload() {
        Fixture fx = new Fixture();
        UUID jobId = fx.service.submitStatement("upload-1", "csv");

        assertThat(fx.service.cancel(jobId)).isTrue();

        JobStatusDTO status = fx.service.getJobStatus(jobId);
        assertThat(status.stage()).isEqualTo(AnalysisStage.FAILED);
        assertThat(status.errorDetail().kind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(status.errorDetail().failedStage()).isEqualTo(AnalysisStage.CREATED);
        assertThat(fx.service.cancel(jobId)).isFalse();
        assertThatThrownBy(() -> fx.service.getResult(jobId)).isInstanceOf(NotReadyException.class);

        UUID again = fx.service.submitStatement("upload-1", "csv");
        assertThat(again).isNotEqualTo(jobId);
    }

    @Test
    void cancel_duringCategorization_leavesNoResult() {
        ClassifierBackend backend = mock(ClassifierBackend.class);
        PipelineFixture[] holder = new PipelineFixture[1];
        when(backend.classify(anyString(), any())).thenAnswer(invocation -> {
            PipelineFixture current = holder[0];
            current.service.cancel(current.registry.activeJobFor("upload-c").orElseThrow());
            return ClassifierVerdict.none();
        });
        PipelineFixture fx = new PipelineFixture(storage, backend);
        holder[0] = fx;
        storage.store("upload-c", """
                Date,Description,Amount
                2024-01-05,MYSTERY VENDOR,-12.00
                2024-01-06,ANOTHER VENDOR,-8.00
                """.getBytes(StandardCharsets.UTF_8));

        UUID jobId = fx.service.submitStatement("upload-c", "csv");

        JobStatusDTO status = fx.service.getJobStatus(jobId);
        assertThat(status.stage()).isEqualTo(AnalysisStage.FAILED);
        assertThat(status.errorDetail().kind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(status.errorDetail().failedStage()).isEqualTo(AnalysisStage.CATEGORIZING);
        assertThat(status.stageEnteredAt()).doesNotContainKey(AnalysisStage.DETECTING_ANOMALIES);
        assertThat(fx.resultRepository.findByJobId(jobId)).isEmpty();
        verify(backend, times(1)).classify(anyString(), any());
    }

    @Test
    void unknownJobIdsAreReported() {
        Fixture fx = new Fixture();
        UUID unknown = UUID.randomUUID();

        assertThatThrownBy(() -> fx.service.getJobStatus(unknown)).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> fx.service.getResult(unknown)).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> fx.service.cancel(unknown)).isInstanceOf(JobNotFoundException.class);
    }

    /**
     * Service with a mocked processor, so jobs stay where submit left them.
     */
    private static final class Fixture {
        final InMemoryAnalysisJobRepository jobRepository = new InMemoryAnalysisJobRepository();
        final ActiveJobRegistry registry = new ActiveJobRegistry();
        final AnalysisJobProcessor processor = mock(AnalysisJobProcessor.class);
        final StatementAnalysisService service = new StatementAnalysisService(jobRepository,
                new InMemoryAnalysisResultRepository(), registry, processor,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }
}
