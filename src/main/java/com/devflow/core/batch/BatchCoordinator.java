package com.devflow.core.batch;

import com.devflow.core.logging.MdcContext;
import com.devflow.core.metrics.DevflowMetrics;
import com.devflow.core.model.OutputType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes the output files of one logical command as a single reportable batch.
 *
 * <p>Each file gets up to {@code maxRetries + 1} attempts with a fixed pause between them.
 * A file that exhausts its attempts adds one entry to {@code errors} and the remaining files
 * are still written. Nothing here throws for a failed write.
 */
public class BatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    public static final long DEFAULT_RETRY_DELAY_MS = 100;
    public static final Duration DEFAULT_MAX_AGE = Duration.ofHours(1);

    private final OutputFileStore store;
    private final BatchNotifier notifier;
    private final BatchSummaryFormatter summaryFormatter;
    private final DevflowMetrics metrics;
    private final Clock clock;
    private final long retryDelayMs;
    private final Duration defaultMaxAge;

    private final Map<String, BatchRecord> batches = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public BatchCoordinator(OutputFileStore store, BatchNotifier notifier, BatchSummaryFormatter summaryFormatter,
                            DevflowMetrics metrics, Clock clock, long retryDelayMs, Duration defaultMaxAge) {
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("retryDelayMs must be >= 0");
        }
        this.store = store;
        this.notifier = notifier;
        this.summaryFormatter = summaryFormatter;
        this.metrics = metrics;
        this.clock = clock;
        this.retryDelayMs = retryDelayMs;
        this.defaultMaxAge = defaultMaxAge;
    }

    /**
     * Writes every file, optionally after a backup, and aggregates the outcome.
     *
     * @param label command the files belong to; prefixes the batch id and backup name
     */
    public BatchOperationResult executeBatch(String label, List<OutputFile> files, BatchOptions options) {
        BatchOptions opts = options == null ? BatchOptions.defaults() : options;
        Instant started = clock.instant();
        String batchId = label + "-" + started.toEpochMilli() + "-" + sequence.incrementAndGet();
        List<String> errors = new ArrayList<>();
        Map<OutputType, Path> outputPaths = new EnumMap<>(OutputType.class);
        int processed = 0;

        MdcContext.setBatch(batchId);
        try {
            if (opts.createBackup()) {
                try {
                    Path backup = store.createBackup(label + "-auto");
                    log.debug("Batch {} backed up to {}", batchId, backup);
                } catch (IOException | RuntimeException e) {
                    log.warn("Backup for batch {} failed: {}", batchId, e.getMessage());
                    errors.add("Backup failed: " + e.getMessage());
                }
            }

            for (OutputFile file : files) {
                Optional<Path> written = writeWithRetries(file, opts, errors);
                if (written.isPresent()) {
                    outputPaths.put(file.type(), written.get());
                    processed++;
                }
            }

            boolean success = errors.isEmpty();
            if (opts.trackHistory()) {
                List<OutputType> types = files.stream().map(OutputFile::type).toList();
                batches.put(batchId, new BatchRecord(batchId, label, clock.instant(), types, success));
            }
            if (opts.notifyUser()) {
                notifier.notify(success, success
                        ? label + ": Successfully processed " + processed + " files"
                        : label + ": Processed " + processed + " files with " + errors.size() + " errors");
            }

            long duration = Math.max(0, Duration.between(started, clock.instant()).toMillis());
            log.info("Batch {} finished: {} of {} files written, {} errors, {}ms",
                    batchId, processed, files.size(), errors.size(), duration);
            return new BatchOperationResult(batchId, success, processed, errors, duration, outputPaths);
        } finally {
            MdcContext.clear();
        }
    }

    private Optional<Path> writeWithRetries(OutputFile file, BatchOptions opts, List<String> errors) {
        if (opts.validateContent()) {
            OutputContentRules.writeWarning(file.type(), file.content())
                    .ifPresent(w -> log.warn("{} validation: {}", file.type().id(), w));
        }
        int attemptsLeft = opts.maxRetries() + 1;
        while (true) {
            try {
                Path path = store.write(file.type(), file.content());
                metrics.recordBatchFile("written");
                return Optional.of(path);
            } catch (IOException | RuntimeException e) {
                attemptsLeft--;
                if (attemptsLeft <= 0) {
                    log.warn("Failed to save {} after {} attempt(s): {}", file.type().id(),
                            opts.maxRetries() + 1, e.getMessage());
                    errors.add("Failed to save " + file.type().id() + ": " + e.getMessage());
                    metrics.recordBatchFile("failed");
                    return Optional.empty();
                }
                log.debug("Write of {} failed, retrying in {}ms: {}", file.type().id(), retryDelayMs, e.getMessage());
                metrics.recordBatchRetry();
                if (!pause()) {
                    errors.add("Failed to save " + file.type().id() + ": interrupted");
                    metrics.recordBatchFile("failed");
                    return Optional.empty();
                }
            }
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(retryDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Classifies each expected type as valid, missing or corrupt. Empty content, content
     * that fails the type's rules, and read errors all count as corrupt.
     */
    public OutputValidation validateCommandOutputs(Collection<OutputType> expectedTypes) {
        List<OutputType> valid = new ArrayList<>();
        List<OutputType> missing = new ArrayList<>();
        List<OutputType> corrupt = new ArrayList<>();
        for (OutputType type : expectedTypes) {
            if (!store.exists(type)) {
                missing.add(type);
                continue;
            }
            try {
                String content = store.read(type).orElse("");
                if (content.isBlank() || !OutputContentRules.isContentValid(type, content)) {
                    corrupt.add(type);
                } else {
                    valid.add(type);
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Cannot read {} output: {}", type.id(), e.getMessage());
                corrupt.add(type);
            }
        }
        return new OutputValidation(valid, missing, corrupt);
    }

    /** Ensures the output directory exists and returns where each type would be written. */
    public Map<OutputType, Path> prepareCommandOutputs(Collection<OutputType> types) throws IOException {
        store.ensureOutputDirectory();
        Map<OutputType, Path> paths = new EnumMap<>(OutputType.class);
        for (OutputType type : types) {
            paths.put(type, store.pathFor(type));
        }
        return paths;
    }

    public String createOperationSummary(String label, BatchOperationResult result, Map<String, ?> context) {
        return summaryFormatter.format(label, result, context);
    }

    /**
     * Drops batch records strictly older than {@code maxAge}.
     *
     * @return number of records removed
     */
    public int cleanupCompletedBatches(Duration maxAge) {
        Instant now = clock.instant();
        int before = batches.size();
        batches.values().removeIf(r -> Duration.between(r.timestamp(), now).compareTo(maxAge) > 0);
        int removed = before - batches.size();
        if (removed > 0) {
            log.debug("Evicted {} batch record(s) older than {}", removed, maxAge);
        }
        return removed;
    }

    public int cleanupCompletedBatches() {
        return cleanupCompletedBatches(defaultMaxAge);
    }

    public Map<String, BatchRecord> getActiveBatches() {
        return new LinkedHashMap<>(batches);
    }

    public Optional<BatchRecord> getBatch(String batchId) {
        return Optional.ofNullable(batches.get(batchId));
    }
}
