package com.devflow.core.process;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TimeBasedProgressEstimator}.
 */
class TimeBasedProgressEstimatorTest {

    private ScheduledExecutorService scheduler;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    @DisplayName("percentage grows with elapsed ticks and stops at the cap")
    void percentFor() {
        assertEquals(10, TimeBasedProgressEstimator.percentFor(1, 10));
        assertEquals(50, TimeBasedProgressEstimator.percentFor(5, 10));
        assertEquals(TimeBasedProgressEstimator.CAP, TimeBasedProgressEstimator.percentFor(10, 10));
        assertEquals(TimeBasedProgressEstimator.CAP, TimeBasedProgressEstimator.percentFor(50, 10));
    }

    @Test
    @DisplayName("emits increasing values never above 90")
    void monotonicAndCapped() throws Exception {
        List<Integer> emitted = new CopyOnWriteArrayList<>();
        var estimator = new TimeBasedProgressEstimator(scheduler, 5, 50);

        try (var tracker = estimator.begin(emitted::add)) {
            Thread.sleep(300);
        }

        assertFalse(emitted.isEmpty());
        for (int i = 1; i < emitted.size(); i++) {
            assertTrue(emitted.get(i) > emitted.get(i - 1), "not increasing: " + emitted);
        }
        assertEquals(TimeBasedProgressEstimator.CAP, emitted.get(emitted.size() - 1));
    }

    @Test
    @DisplayName("nothing is emitted after close")
    void stopsOnClose() throws Exception {
        List<Integer> emitted = new CopyOnWriteArrayList<>();
        var estimator = new TimeBasedProgressEstimator(scheduler, 5, 10_000);

        var tracker = estimator.begin(emitted::add);
        Thread.sleep(50);
        tracker.close();
        int count = emitted.size();
        Thread.sleep(100);

        assertEquals(count, emitted.size());
        assertDoesNotThrow(tracker::close);
    }

    @Test
    @DisplayName("rejects non-positive timings")
    void validatesArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TimeBasedProgressEstimator(scheduler, 0, 100));
        assertThrows(IllegalArgumentException.class, () -> new TimeBasedProgressEstimator(scheduler, 100, 0));
    }
}
