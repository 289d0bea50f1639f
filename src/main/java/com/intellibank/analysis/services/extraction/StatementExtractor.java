package com.intellibank.analysis.services.extraction;

import java.util.List;

import com.intellibank.analysis.enums.StatementFormat;

/**
 * Extraction strategy for one statement format.
 */
public interface StatementExtractor {

    StatementFormat format();

    /**
     * @throws com.intellibank.analysis.exceptions.CorruptInputException   when the bytes are not a
     *         readable document of this format
     * @throws com.intellibank.analysis.exceptions.SchemaNotFoundException when no header row is found
     *         within the scan window
     */
    List<RawRecord> extract(byte[] fileBytes);
}
