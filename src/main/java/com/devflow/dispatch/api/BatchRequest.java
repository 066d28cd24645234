package com.devflow.dispatch.api;

import java.util.List;

/**
 * Request body for POST /api/v1/batches.
 */
public record BatchRequest(
    String label,
    List<FileEntry> files,
    boolean createBackup,
    boolean validateContent,
    boolean notifyUser,
    boolean trackHistory,
    Integer maxRetries
) {

    public record FileEntry(String type, String content) {}
}
