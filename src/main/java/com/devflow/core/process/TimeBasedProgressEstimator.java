package com.devflow.core.process;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;

/**
 * Emits a steadily increasing percentage on a fixed tick, capped at {@value #CAP}.
 * Purely time based: the process's actual state is ignored.
 */
public class TimeBasedProgressEstimator implements ProgressEstimator {

    public static final int CAP = 90;
    public static final long DEFAULT_TICK_MS = 100;

    private final ScheduledExecutorService scheduler;
    private final long tickMs;
    private final long expectedDurationMs;

    public TimeBasedProgressEstimator(ScheduledExecutorService scheduler, long tickMs, long expectedDurationMs) {
        if (tickMs <= 0 || expectedDurationMs <= 0) {
            throw new IllegalArgumentException("tick and expected duration must be positive");
        }
        this.scheduler = scheduler;
        this.tickMs = tickMs;
        this.expectedDurationMs = expectedDurationMs;
    }

    @Override
    public Tracker begin(IntConsumer sink) {
        return new TickTracker(sink);
    }

    /** Percentage after {@code step} ticks out of {@code steps}, capped. */
    static int percentFor(long step, long steps) {
        return (int) Math.min(CAP, (step * 100) / steps);
    }

    private final class TickTracker implements Tracker {

        private final IntConsumer sink;
        private final long steps = Math.max(1, expectedDurationMs / tickMs);
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile ScheduledFuture<?> task;
        private long step;
        private int lastEmitted = -1;

        TickTracker(IntConsumer sink) {
            this.sink = sink;
            this.task = scheduler.scheduleAtFixedRate(this::tick, tickMs, tickMs, TimeUnit.MILLISECONDS);
        }

        private synchronized void tick() {
            if (closed.get()) {
                return;
            }
            step++;
            int percent = percentFor(step, steps);
            if (percent > lastEmitted) {
                lastEmitted = percent;
                sink.accept(percent);
            }
            if (step >= steps) {
                stopTicking();
            }
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                stopTicking();
            }
        }

        private void stopTicking() {
            ScheduledFuture<?> t = task;
            if (t != null) {
                t.cancel(false);
            }
        }
    }
}
