package com.devflow.core.batch;

/**
 * Receives the user-facing outcome line of a batch when {@link BatchOptions#notifyUser()} is set.
 */
@FunctionalInterface
public interface BatchNotifier {

    void notify(boolean success, String message);
}
