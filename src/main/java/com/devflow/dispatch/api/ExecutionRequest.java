package com.devflow.dispatch.api;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/v1/executions.
 */
public record ExecutionRequest(
    String action,
    String project,
    String priority,
    Integer timeoutSeconds,
    List<String> extraArgs,
    Map<String, String> env
) {}
