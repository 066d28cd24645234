package com.devflow.core.queue;

import com.devflow.core.model.CommandAction;
import com.devflow.core.model.CommandPriority;
import com.devflow.core.model.CommandResult;
import com.devflow.core.model.QueueStatus;
import com.devflow.core.model.QueuedCommand;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derived statistics computed on demand from a {@link QueueSnapshot}. Nothing is cached.
 */
public final class QueueAnalytics {

    /** Grouping key for results without a project. */
    public static final String NO_PROJECT = "(none)";

    static final int RECENT_ACTIVITY_LIMIT = 20;

    private QueueAnalytics() {}

    /** Fraction of history entries that succeeded, in [0, 1]; 0 for empty history. */
    public static double successRate(QueueSnapshot snapshot) {
        return successRate(snapshot.history());
    }

    /** Mean wall-clock milliseconds over history entries that have an end time; 0 if none. */
    public static double averageExecutionTime(QueueSnapshot snapshot) {
        return averageExecutionTime(snapshot.history());
    }

    public static Map<String, List<CommandResult>> byProject(QueueSnapshot snapshot) {
        Map<String, List<CommandResult>> grouped = new LinkedHashMap<>();
        for (CommandResult r : snapshot.history()) {
            String key = r.project() == null || r.project().isBlank() ? NO_PROJECT : r.project();
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
        }
        return grouped;
    }

    public static Map<CommandAction, List<CommandResult>> byAction(QueueSnapshot snapshot) {
        Map<CommandAction, List<CommandResult>> grouped = new EnumMap<>(CommandAction.class);
        for (CommandResult r : snapshot.history()) {
            grouped.computeIfAbsent(r.action(), k -> new ArrayList<>()).add(r);
        }
        return grouped;
    }

    /** Pending commands split by priority; every bucket is present, possibly empty. */
    public static Map<CommandPriority, List<QueuedCommand>> queueByPriority(QueueSnapshot snapshot) {
        Map<CommandPriority, List<QueuedCommand>> buckets = new EnumMap<>(CommandPriority.class);
        for (CommandPriority p : CommandPriority.values()) {
            buckets.put(p, new ArrayList<>());
        }
        for (QueuedCommand q : snapshot.pending()) {
            buckets.get(q.priority()).add(q);
        }
        return buckets;
    }

    public static QueueStatus currentStatus(QueueSnapshot snapshot) {
        if (!snapshot.active().isEmpty()) {
            return QueueStatus.RUNNING;
        }
        return snapshot.pending().isEmpty() ? QueueStatus.IDLE : QueueStatus.QUEUED;
    }

    /** The last 20 history entries, most recently started first. */
    public static List<CommandResult> recentActivity(QueueSnapshot snapshot) {
        List<CommandResult> history = snapshot.history();
        List<CommandResult> recent = new ArrayList<>(
                history.subList(Math.max(0, history.size() - RECENT_ACTIVITY_LIMIT), history.size()));
        recent.sort(Comparator.comparing(CommandResult::startTime).reversed());
        return recent;
    }

    public static double successRateByAction(QueueSnapshot snapshot, CommandAction action) {
        return successRate(byAction(snapshot).getOrDefault(action, List.of()));
    }

    public static double averageExecutionTimeByAction(QueueSnapshot snapshot, CommandAction action) {
        return averageExecutionTime(byAction(snapshot).getOrDefault(action, List.of()));
    }

    private static double successRate(List<CommandResult> results) {
        if (results.isEmpty()) {
            return 0;
        }
        long successful = results.stream().filter(CommandResult::success).count();
        return (double) successful / results.size();
    }

    private static double averageExecutionTime(List<CommandResult> results) {
        List<CommandResult> finished = results.stream().filter(r -> r.endTime() != null).toList();
        if (finished.isEmpty()) {
            return 0;
        }
        long total = 0;
        for (CommandResult r : finished) {
            total += Duration.between(r.startTime(), r.endTime()).toMillis();
        }
        return (double) total / finished.size();
    }
}
