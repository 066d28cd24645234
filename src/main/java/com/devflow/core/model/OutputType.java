package com.devflow.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Generated output files a command can produce, with their on-disk file names.
 */
public enum OutputType {
    AI_DEBUG_CONTEXT("ai-debug-context", "ai-debug-context.txt"),
    JEST_OUTPUT("jest-output", "jest-output.txt"),
    DIFF("diff", "diff.txt"),
    PR_DESCRIPTION("pr-description", "pr-description-prompt.txt");

    private final String id;
    private final String fileName;

    OutputType(String id, String fileName) {
        this.id = id;
        this.fileName = fileName;
    }

    public String id() {
        return id;
    }

    public String fileName() {
        return fileName;
    }

    public static Optional<OutputType> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.trim();
        return Arrays.stream(values())
                .filter(t -> t.id.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v))
                .findFirst();
    }

    public static Optional<OutputType> fromFileName(String fileName) {
        return Arrays.stream(values())
                .filter(t -> t.fileName.equals(fileName))
                .findFirst();
    }
}
