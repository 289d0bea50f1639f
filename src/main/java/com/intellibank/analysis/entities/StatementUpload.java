package com.intellibank.analysis.entities;

import java.time.Instant;

import com.intellibank.analysis.enums.StatementFormat;

/**
 * One uploaded statement file. The account reference is null for uploads submitted without an
 * owning account.
 */
public record StatementUpload(
        String uploadId,
        String accountId,
        StatementFormat format,
        long byteSize,
        Instant uploadedAt
) {
    public StatementUpload {
        if (uploadId == null || uploadId.isBlank()) throw new IllegalArgumentException("uploadId is required");
        if (format == null) throw new IllegalArgumentException("format is required");
        if (byteSize < 0) throw new IllegalArgumentException("byteSize must be >= 0");
    }
}
