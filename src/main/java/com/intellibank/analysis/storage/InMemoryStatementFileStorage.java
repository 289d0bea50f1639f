package com.intellibank.analysis.storage;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

@Component
public class InMemoryStatementFileStorage implements StatementFileStorage {

    private final Map<String, byte[]> files = new ConcurrentHashMap<>();

    public void store(String uploadId, byte[] bytes) {
        if (uploadId == null || uploadId.isBlank()) throw new IllegalArgumentException("uploadId is required");
        if (bytes == null) throw new IllegalArgumentException("bytes are required");
        files.put(uploadId, bytes.clone());
    }

    @Override
    public byte[] fetchFile(String uploadId) {
        byte[] bytes = uploadId == null ? null : files.get(uploadId);
        if (bytes == null) {
            throw new IllegalArgumentException("No file stored for upload " + uploadId);
        }
        return bytes.clone();
    }
}
