package com.devflow.core.dispatch;

/**
 * Thrown when a command request is rejected before anything is enqueued or spawned:
 * unknown or missing action, or a missing project for an action that needs one.
 */
public class CommandValidationException extends RuntimeException {

    public CommandValidationException(String message) {
        super(message);
    }
}
