package com.intellibank.analysis.repositories;

import java.util.Optional;
import java.util.UUID;

import com.intellibank.analysis.entities.AnalysisResult;

public interface AnalysisResultRepository {

    void saveResult(AnalysisResult result);

    Optional<AnalysisResult> findByJobId(UUID jobId);

    void deleteByJobId(UUID jobId);
}
