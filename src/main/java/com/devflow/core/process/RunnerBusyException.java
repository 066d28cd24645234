package com.devflow.core.process;

/**
 * Thrown when {@link ProcessRunner#execute} is called while the runner already has a
 * process in flight. Runners never queue; serialization belongs to the scheduler.
 */
public class RunnerBusyException extends IllegalStateException {

    public RunnerBusyException(String runnerId) {
        super("Command is already running on runner " + runnerId);
    }
}
