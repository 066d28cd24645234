package com.devflow.core.batch;

/**
 * Switches for a single {@link BatchCoordinator#executeBatch} call.
 *
 * @param createBackup    back up existing output files first; a failed backup is recorded, not fatal
 * @param validateContent warn about content that does not look like its type before writing it
 * @param notifyUser      report the outcome through the {@link BatchNotifier}
 * @param trackHistory    keep a {@link BatchRecord} until it ages out
 * @param maxRetries      extra attempts per file after the first failure
 */
public record BatchOptions(
    boolean createBackup,
    boolean validateContent,
    boolean notifyUser,
    boolean trackHistory,
    int maxRetries
) {

    public BatchOptions {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
    }

    public static BatchOptions defaults() {
        return new BatchOptions(false, false, false, false, 0);
    }

    public BatchOptions withMaxRetries(int retries) {
        return new BatchOptions(createBackup, validateContent, notifyUser, trackHistory, retries);
    }

    public BatchOptions withTrackHistory(boolean track) {
        return new BatchOptions(createBackup, validateContent, notifyUser, track, maxRetries);
    }
}
