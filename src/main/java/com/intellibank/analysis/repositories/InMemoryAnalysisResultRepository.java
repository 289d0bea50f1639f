package com.intellibank.analysis.repositories;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Repository;

import com.intellibank.analysis.entities.AnalysisResult;

@Repository
public class InMemoryAnalysisResultRepository implements AnalysisResultRepository {

    private final Map<UUID, AnalysisResult> results = new ConcurrentHashMap<>();

    @Override
    public void saveResult(AnalysisResult result) {
        if (result == null) throw new IllegalArgumentException("result is required");
        if (results.putIfAbsent(result.jobId(), result) != null) {
            throw new IllegalStateException("Result already stored for job " + result.jobId());
        }
    }

    @Override
    public Optional<AnalysisResult> findByJobId(UUID jobId) {
        if (jobId == null) return Optional.empty();
        return Optional.ofNullable(results.get(jobId));
    }

    @Override
    public void deleteByJobId(UUID jobId) {
        if (jobId != null) results.remove(jobId);
    }
}
