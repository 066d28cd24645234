package com.devflow.core.batch;

import com.devflow.core.model.OutputType;

import java.util.Optional;

/**
 * Heuristics for whether generated content looks like its output type.
 * <p>
 * Two strengths: {@link #isContentValid} classifies files on disk after a run, while
 * {@link #writeWarning} is the looser check applied before a write, which only ever warns.
 */
public final class OutputContentRules {

    static final int MIN_AI_CONTEXT_LENGTH = 100;
    static final int MIN_PR_DESCRIPTION_LENGTH = 50;

    private OutputContentRules() {}

    public static boolean isContentValid(OutputType type, String content) {
        if (content == null) {
            return false;
        }
        return switch (type) {
            case JEST_OUTPUT -> content.contains("Test") || content.contains("PASS")
                    || content.contains("FAIL") || content.contains("SKIP");
            case DIFF -> content.isBlank() || content.contains("diff --git")
                    || content.contains("@@") || content.contains("No changes detected");
            case AI_DEBUG_CONTEXT -> content.contains("AI DEBUG CONTEXT")
                    || content.length() > MIN_AI_CONTEXT_LENGTH;
            case PR_DESCRIPTION -> content.contains("PR DESCRIPTION") || content.contains("Problem")
                    || content.contains("Solution");
        };
    }

    /** A warning for suspicious content about to be written, or empty if it looks fine. */
    public static Optional<String> writeWarning(OutputType type, String content) {
        String c = content == null ? "" : content;
        String warning = switch (type) {
            case JEST_OUTPUT -> !c.contains("Test") && !c.contains("PASS") && !c.contains("FAIL")
                    ? "Content may not be valid test output" : null;
            case DIFF -> !c.isBlank() && !c.contains("diff --git") && !c.contains("@@")
                    ? "Content may not be valid diff output" : null;
            case AI_DEBUG_CONTEXT -> !c.contains("AI DEBUG CONTEXT") && c.length() < MIN_AI_CONTEXT_LENGTH
                    ? "Content seems too short or invalid" : null;
            case PR_DESCRIPTION -> !c.contains("PR DESCRIPTION") && c.length() < MIN_PR_DESCRIPTION_LENGTH
                    ? "Content seems incomplete" : null;
        };
        return Optional.ofNullable(warning);
    }
}
