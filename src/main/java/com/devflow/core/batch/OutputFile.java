package com.devflow.core.batch;

import com.devflow.core.model.OutputType;

import java.util.Objects;

/**
 * One file write requested as part of a batch.
 */
public record OutputFile(OutputType type, String content) {

    public OutputFile {
        Objects.requireNonNull(type, "type");
        content = content == null ? "" : content;
    }
}
