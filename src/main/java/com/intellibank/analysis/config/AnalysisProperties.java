package com.intellibank.analysis.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.intellibank.analysis.enums.AnalysisStage;

@ConfigurationProperties(prefix = "intellibank.analysis")
public record AnalysisProperties(
        Extraction extraction,
        Normalization normalization,
        Categorization categorization,
        Anomaly anomaly,
        Orchestration orchestration,
        Classifier classifier
) {
    public AnalysisProperties {
        if (extraction == null) extraction = new Extraction(0, 0);
        if (normalization == null) normalization = new Normalization(null, null);
        if (categorization == null) categorization = new Categorization(0, 0, null, 0, null);
        if (anomaly == null) anomaly = new Anomaly(0, 0, 0);
        if (orchestration == null) orchestration = new Orchestration(0, null, 0, null);
        if (classifier == null) classifier = new Classifier(null);
    }

    public static AnalysisProperties defaults() {
        return new AnalysisProperties(null, null, null, null, null, null);
    }

    public record Extraction(int headerScanWindow, long maxFileBytes) {
        public Extraction {
            if (headerScanWindow <= 0) headerScanWindow = 30;
            if (maxFileBytes <= 0) maxFileBytes = 50L * 1024 * 1024;
        }
    }

    public record Normalization(String defaultCurrency, List<String> dateFormats) {
        public Normalization {
            if (defaultCurrency == null || defaultCurrency.isBlank()) defaultCurrency = "USD";
            if (dateFormats == null || dateFormats.isEmpty()) {
                dateFormats = List.of(
                        "yyyy-MM-dd",
                        "MM/dd/yyyy",
                        "M/d/yyyy",
                        "dd/MM/yyyy",
                        "dd.MM.yyyy",
                        "yyyy/MM/dd",
                        "dd-MM-yyyy",
                        "d MMM yyyy",
                        "MMM d, yyyy",
                        "d-MMM-yyyy",
                        "yyyyMMdd");
            }
        }
    }

    public record Categorization(
            double ruleConfidenceThreshold,
            int maxConcurrency,
            Boolean cacheEnabled,
            int cacheMaxEntries,
            Map<String, List<String>> extraCategories
    ) {
        public Categorization {
            if (ruleConfidenceThreshold <= 0) ruleConfidenceThreshold = 0.9;
            if (maxConcurrency <= 0) maxConcurrency = 4;
            if (cacheEnabled == null) cacheEnabled = Boolean.TRUE;
            if (cacheMaxEntries <= 0) cacheMaxEntries = 10_000;
            if (extraCategories == null) extraCategories = Map.of();
        }
    }

    public record Anomaly(double stddevMultiplier, int minCategorySamples, long unseenMerchantThresholdMinor) {
        public Anomaly {
            if (stddevMultiplier <= 0) stddevMultiplier = 3.0;
            if (minCategorySamples <= 0) minCategorySamples = 3;
            if (unseenMerchantThresholdMinor <= 0) unseenMerchantThresholdMinor = 100_000L;
        }
    }

    public record Orchestration(
            int maxAttempts,
            Duration initialBackoff,
            double backoffMultiplier,
            StageTimeouts stageTimeouts
    ) {
        public Orchestration {
            if (maxAttempts <= 0) maxAttempts = 3;
            if (initialBackoff == null || initialBackoff.isNegative()) initialBackoff = Duration.ofMillis(400);
            if (backoffMultiplier < 1.0) backoffMultiplier = 2.0;
            if (stageTimeouts == null) stageTimeouts = new StageTimeouts(null, null, null, null, null);
        }

        public Duration backoffFor(int attempt) {
            double factor = Math.pow(backoffMultiplier, Math.max(0, attempt - 1));
            return Duration.ofMillis((long) (initialBackoff.toMillis() * factor));
        }
    }

    public record StageTimeouts(
            Duration extracting,
            Duration normalizing,
            Duration categorizing,
            Duration detectingAnomalies,
            Duration aggregating
    ) {
        public StageTimeouts {
            if (extracting == null) extracting = Duration.ofMinutes(2);
            if (normalizing == null) normalizing = Duration.ofSeconds(30);
            if (categorizing == null) categorizing = Duration.ofMinutes(5);
            if (detectingAnomalies == null) detectingAnomalies = Duration.ofSeconds(30);
            if (aggregating == null) aggregating = Duration.ofSeconds(30);
        }

        public Duration forStage(AnalysisStage stage) {
            return switch (stage) {
                case EXTRACTING -> extracting;
                case NORMALIZING -> normalizing;
                case CATEGORIZING -> categorizing;
                case DETECTING_ANOMALIES -> detectingAnomalies;
                case AGGREGATING -> aggregating;
                default -> throw new IllegalArgumentException("No time budget for stage " + stage);
            };
        }
    }

    public record Classifier(Http http) {
        public Classifier {
            if (http == null) http = new Http(null, null);
        }

        public record Http(String baseUrl, Duration timeout) {
            public Http {
                if (baseUrl == null) baseUrl = "";
                if (timeout == null || timeout.isZero() || timeout.isNegative()) timeout = Duration.ofSeconds(10);
            }

            public boolean enabled() {
                return !baseUrl.isBlank();
            }
        }
    }
}
