package com.devflow.core.batch;

import com.devflow.core.model.OutputType;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate outcome of one batch. {@code outputPaths} only holds files that were written.
 */
public record BatchOperationResult(
    String batchId,
    boolean success,
    int filesProcessed,
    List<String> errors,
    long duration,
    Map<OutputType, Path> outputPaths
) {

    public BatchOperationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        outputPaths = outputPaths == null || outputPaths.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(outputPaths));
    }
}
