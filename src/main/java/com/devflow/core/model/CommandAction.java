package com.devflow.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Developer-workflow actions the scheduler knows how to run.
 * <p>
 * Each action carries its external id (as used by the API and CLI) and whether it
 * needs a target project to run.
 */
public enum CommandAction {
    AI_DEBUG("aiDebug", true),
    NX_TEST("nxTest", true),
    GIT_DIFF("gitDiff", false),
    PREPARE_TO_PUSH("prepareToPush", true);

    private final String id;
    private final boolean requiresProject;

    CommandAction(String id, boolean requiresProject) {
        this.id = id;
        this.requiresProject = requiresProject;
    }

    public String id() {
        return id;
    }

    public boolean requiresProject() {
        return requiresProject;
    }

    /**
     * Resolves an action from its external id ({@code nxTest}) or its enum name
     * ({@code NX_TEST}), case-insensitively.
     */
    public static Optional<CommandAction> fromId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.trim();
        return Arrays.stream(values())
                .filter(a -> a.id.equalsIgnoreCase(v) || a.name().equalsIgnoreCase(v))
                .findFirst();
    }
}
