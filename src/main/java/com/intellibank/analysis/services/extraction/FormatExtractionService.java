package com.intellibank.analysis.services.extraction;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.intellibank.analysis.config.AnalysisProperties;
import com.intellibank.analysis.enums.StatementFormat;
import com.intellibank.analysis.exceptions.CorruptInputException;
import com.intellibank.analysis.exceptions.UnsupportedFormatException;

import lombok.extern.slf4j.Slf4j;

/**
 * Selects the extraction strategy for a declared format and enforces the upload size limit.
 */
@Service
@Slf4j
public class FormatExtractionService {

    private final Map<StatementFormat, StatementExtractor> extractors = new EnumMap<>(StatementFormat.class);
    private final AnalysisProperties properties;

    public FormatExtractionService(List<StatementExtractor> extractors, AnalysisProperties properties) {
        this.properties = properties;
        for (StatementExtractor extractor : extractors) {
            StatementExtractor previous = this.extractors.put(extractor.format(), extractor);
            if (previous != null) {
                throw new IllegalStateException("Two extractors registered for " + extractor.format() + ": "
                        + previous.getClass().getSimpleName() + ", " + extractor.getClass().getSimpleName());
            }
        }
    }

    public List<RawRecord> extract(byte[] fileBytes, StatementFormat format) {
        StatementExtractor extractor = extractors.get(format);
        if (extractor == null) {
            throw new UnsupportedFormatException(String.valueOf(format));
        }
        if (fileBytes == null || fileBytes.length == 0) {
            throw new CorruptInputException("Statement file is empty");
        }
        long max = properties.extraction().maxFileBytes();
        if (fileBytes.length > max) {
            throw new CorruptInputException("Statement file exceeds the maximum size of " + max + " bytes");
        }

        long started = System.nanoTime();
        List<RawRecord> records = extractor.extract(fileBytes);
        log.debug("[Extraction] format={} bytes={} records={} tookMs={}",
                format, fileBytes.length, records.size(), (System.nanoTime() - started) / 1_000_000);
        return records;
    }
}
