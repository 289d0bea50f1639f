package com.intellibank.analysis.dto;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import com.intellibank.analysis.entities.AnalysisJob;
import com.intellibank.analysis.entities.JobErrorDetail;
import com.intellibank.analysis.enums.AnalysisStage;

public record JobStatusDTO(
        UUID jobId,
        String uploadId,
        AnalysisStage stage,
        JobErrorDetail errorDetail,
        Map<AnalysisStage, Instant> stageEnteredAt
) {
    public static JobStatusDTO from(AnalysisJob job) {
        return new JobStatusDTO(
                job.getId(),
                job.getUploadId(),
                job.getStage(),
                job.getErrorDetail(),
                job.getStageEnteredAt());
    }
}
