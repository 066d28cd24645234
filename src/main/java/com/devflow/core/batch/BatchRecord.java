package com.devflow.core.batch;

import com.devflow.core.model.OutputType;

import java.time.Instant;
import java.util.List;

/**
 * Bookkeeping entry for a tracked batch, evicted by age.
 */
public record BatchRecord(String id, String command, Instant timestamp, List<OutputType> files, boolean success) {

    public BatchRecord {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
