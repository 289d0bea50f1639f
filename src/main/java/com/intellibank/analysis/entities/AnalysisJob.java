package com.intellibank.analysis.entities;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

import com.intellibank.analysis.enums.AnalysisStage;
import com.intellibank.analysis.enums.StatementFormat;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of an analysis job. Every change produces a new snapshot, so the stage and
 * its entry timestamp are always observed together.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisJob {

    UUID id;

    String uploadId;

    String accountId;

    StatementFormat format;

    AnalysisStage stage;

    JobErrorDetail errorDetail;

    Map<AnalysisStage, Instant> stageEnteredAt;

    public static AnalysisJob created(String uploadId, String accountId, StatementFormat format, Instant at) {
        Map<AnalysisStage, Instant> timestamps = new EnumMap<>(AnalysisStage.class);
        timestamps.put(AnalysisStage.CREATED, at);
        return AnalysisJob.builder()
                .id(UUID.randomUUID())
                .uploadId(uploadId)
                .accountId(accountId)
                .format(format)
                .stage(AnalysisStage.CREATED)
                .stageEnteredAt(Collections.unmodifiableMap(timestamps))
                .build();
    }

    public AnalysisJob advanceTo(AnalysisStage next, Instant at) {
        if (!stage.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal stage transition " + stage + " -> " + next + " for job " + id);
        }
        return toBuilder()
                .stage(next)
                .stageEnteredAt(withTimestamp(next, at))
                .build();
    }

    public AnalysisJob fail(JobErrorDetail detail, Instant at) {
        if (!stage.canTransitionTo(AnalysisStage.FAILED)) {
            throw new IllegalStateException("Job " + id + " is already terminal (" + stage + ")");
        }
        JobErrorDetail merged = detail;
        if (errorDetail != null && errorDetail.unparsableRecordCount() > 0) {
            merged = detail.withUnparsableRecordCount(errorDetail.unparsableRecordCount());
        }
        return toBuilder()
                .stage(AnalysisStage.FAILED)
                .errorDetail(merged)
                .stageEnteredAt(withTimestamp(AnalysisStage.FAILED, at))
                .build();
    }

    public AnalysisJob withErrorDetail(JobErrorDetail detail) {
        return toBuilder().errorDetail(detail).build();
    }

    public boolean isActive() {
        return !stage.isTerminal();
    }

    private Map<AnalysisStage, Instant> withTimestamp(AnalysisStage s, Instant at) {
        Map<AnalysisStage, Instant> timestamps = new EnumMap<>(AnalysisStage.class);
        timestamps.putAll(stageEnteredAt);
        timestamps.put(s, at);
        return Collections.unmodifiableMap(timestamps);
    }
}
