package com.devflow.core.events;

import com.devflow.core.model.ProcessResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Nested
    @DisplayName("ExecutionEvent")
    class ExecutionEventTests {

        @Test
        @DisplayName("progress factory clamps to 0..100")
        void progressIsClamped() {
            assertEquals(0, ExecutionEvent.progress("E-1", -5).progress());
            assertEquals(100, ExecutionEvent.progress("E-1", 250).progress());
            assertEquals(42, ExecutionEvent.progress("E-1", 42).progress());
        }

        @Test
        @DisplayName("complete carries the process result")
        void completeCarriesResult() {
            var result = ProcessResult.exited(0, "ok\n", "", 12);
            var event = ExecutionEvent.complete("E-1", result);

            assertEquals(ExecutionEventType.COMPLETE, event.type());
            assertSame(result, event.result());
            assertEquals("complete", event.type().wireName());
        }
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to execution subscriber")
        void deliversToExecutionSubscriber() {
            List<ExecutionEvent> received = new ArrayList<>();
            eventBus.subscribe("E-1", received::add);

            eventBus.publish(ExecutionEvent.output("E-1", "hello"));

            assertEquals(1, received.size());
            assertEquals("hello", received.get(0).text());
        }

        @Test
        @DisplayName("does not deliver events of other executions")
        void ignoresOtherExecutions() {
            List<ExecutionEvent> received = new ArrayList<>();
            eventBus.subscribe("E-1", received::add);

            eventBus.publish(ExecutionEvent.output("E-2", "other"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscribers receive every execution")
        void globalReceivesAll() {
            List<ExecutionEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(ExecutionEvent.output("E-1", "a"));
            eventBus.publish(ExecutionEvent.error("E-2", "b"));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("output events arrive in emission order")
        void preservesOrder() {
            List<String> texts = new ArrayList<>();
            eventBus.subscribe("E-1", e -> texts.add(e.text()));

            for (int i = 0; i < 20; i++) {
                eventBus.publish(ExecutionEvent.output("E-1", "chunk-" + i));
            }

            assertEquals(20, texts.size());
            assertEquals("chunk-0", texts.get(0));
            assertEquals("chunk-19", texts.get(19));
        }

        @Test
        @DisplayName("a throwing subscriber does not block the others")
        void isolatesFailingSubscriber() {
            List<ExecutionEvent> received = new ArrayList<>();
            eventBus.subscribe("E-1", e -> { throw new IllegalStateException("boom"); });
            eventBus.subscribe("E-1", received::add);

            eventBus.publish(ExecutionEvent.progress("E-1", 10));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("delivers events published from another thread")
        void deliversAcrossThreads() throws Exception {
            CountDownLatch latch = new CountDownLatch(1);
            eventBus.subscribe("E-1", e -> latch.countDown());

            Thread t = new Thread(() -> eventBus.publish(ExecutionEvent.output("E-1", "x")));
            t.start();

            assertTrue(latch.await(2, TimeUnit.SECONDS));
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("stops delivery and drops the execution entry")
        void unsubscribeStopsDelivery() {
            List<ExecutionEvent> received = new ArrayList<>();
            EventBus.Subscription sub = eventBus.subscribe("E-1", received::add);

            sub.unsubscribe();
            eventBus.publish(ExecutionEvent.output("E-1", "late"));

            assertTrue(received.isEmpty());
            assertEquals(0, eventBus.subscriberCount("E-1"));
            assertEquals(0, eventBus.subscriberCount());
        }

        @Test
        @DisplayName("unsubscribing twice is harmless")
        void doubleUnsubscribe() {
            EventBus.Subscription sub = eventBus.subscribe("E-1", e -> {});
            sub.unsubscribe();
            assertDoesNotThrow(sub::unsubscribe);
        }

        @Test
        @DisplayName("repeated executions do not leak listeners")
        void noLeakAcrossExecutions() {
            for (int i = 0; i < 100; i++) {
                EventBus.Subscription sub = eventBus.subscribe("E-" + i, e -> {});
                sub.unsubscribe();
            }
            assertEquals(0, eventBus.subscriberCount());
        }

        @Test
        @DisplayName("global unsubscribe")
        void globalUnsubscribe() {
            List<ExecutionEvent> received = new ArrayList<>();
            EventBus.Subscription sub = eventBus.subscribeAll(received::add);
            sub.unsubscribe();

            eventBus.publish(ExecutionEvent.output("E-1", "x"));

            assertTrue(received.isEmpty());
        }
    }
}
