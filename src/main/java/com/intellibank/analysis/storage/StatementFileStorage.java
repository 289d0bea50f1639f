package com.intellibank.analysis.storage;

/**
 * Object storage holding uploaded statement files.
 */
public interface StatementFileStorage {

    /**
     * @throws com.intellibank.analysis.exceptions.StorageUnavailableException when the store cannot
     *         serve the file right now
     * @throws IllegalArgumentException when nothing is stored under {@code uploadId}
     */
    byte[] fetchFile(String uploadId);
}
