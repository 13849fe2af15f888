package relay.dispatch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import relay.Batch;
import relay.SubmissionOutcome;
import relay.SubmissionOutcome.DeferReason;
import relay.TestRecords;
import relay.circuit.CircuitBreaker;
import relay.retry.ExponentialBackoffRetryPolicy;
import relay.sink.FailureInjector;
import relay.sink.InMemoryDeliverySink;
import relay.sink.SinkError;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeliveryDispatcherTest {

    private final InMemoryDeliverySink sink = new InMemoryDeliverySink();
    private final DeliveryCoordinator coordinator = DeliveryCoordinator.builder()
            .sink(sink)
            .retryPolicy(new ExponentialBackoffRetryPolicy(1, 10, 2, 0.0, null))
            .circuitBreaker(new CircuitBreaker(100, Duration.ofSeconds(30)))
            .build();

    @AfterEach
    void closeCoordinator() {
        coordinator.close();
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsNullCoordinator() {
        assertThrows(NullPointerException.class, () -> DeliveryDispatcher.builder().build());
    }

    @Test
    void builderRejectsNegativeWorkerCount() {
        assertThrows(IllegalArgumentException.class, () ->
                DeliveryDispatcher.builder().coordinator(coordinator).workerCount(-1).build());
    }

    @Test
    void builderRejectsZeroQueueCapacity() {
        assertThrows(IllegalArgumentException.class, () ->
                DeliveryDispatcher.builder().coordinator(coordinator).queueCapacity(0).build());
    }

    @Test
    void builderRejectsZeroMaxInFlight() {
        assertThrows(IllegalArgumentException.class, () ->
                DeliveryDispatcher.builder().coordinator(coordinator).maxInFlight(0).build());
    }

    // ── Queue behaviour ─────────────────────────────────────────────

    @Test
    void enqueueReturnsFalseWhenQueueFull() {
        DeliveryDispatcher dispatcher = DeliveryDispatcher.builder()
                .coordinator(coordinator)
                .workerCount(0)
                .queueCapacity(1)
                .drainTimeoutMs(100)
                .build();

        assertTrue(dispatcher.enqueue(QueuedBatch.of(TestRecords.batch(1))));
        assertFalse(dispatcher.enqueue(QueuedBatch.of(TestRecords.batch(1))));
        assertEquals(1, dispatcher.queueDepth());
        assertEquals(0, dispatcher.remainingCapacity());
        dispatcher.close();
    }

    @Test
    void enqueueReturnsFalseAfterClose() {
        DeliveryDispatcher dispatcher = DeliveryDispatcher.builder()
                .coordinator(coordinator)
                .workerCount(1)
                .build();
        dispatcher.close();

        assertFalse(dispatcher.enqueue(QueuedBatch.of(TestRecords.batch(1))));
        assertEquals(0, sink.invocationCount());
    }

    @Test
    void closeIsIdempotent() {
        DeliveryDispatcher dispatcher = DeliveryDispatcher.builder()
                .coordinator(coordinator)
                .workerCount(1)
                .build();

        dispatcher.close();
        assertDoesNotThrow(dispatcher::close);
    }

    // ── Delivery ────────────────────────────────────────────────────

    @Test
    void completionReceivesDeliveredOutcome() throws Exception {
        DeliveryDispatcher dispatcher = DeliveryDispatcher.builder()
                .coordinator(coordinator)
                .workerCount(1)
                .build();
        Batch batch = TestRecords.batch(3);
        QueuedBatch queued = QueuedBatch.of(batch);

        assertTrue(dispatcher.enqueue(queued));
        SubmissionOutcome outcome = queued.completion().get(2, TimeUnit.SECONDS);

        assertEquals(SubmissionOutcome.delivered(1), outcome);
        assertEquals(List.of(batch), sink.delivered());
        dispatcher.close();
    }

    @Test
    void completionReceivesDeferredOutcome() throws Exception {
        sink.setFailureInjector(FailureInjector.always(SinkError.TRANSIENT));
        DeliveryDispatcher dispatcher = DeliveryDispatcher.builder()
                .coordinator(coordinator)
                .workerCount(1)
                .build();
        QueuedBatch queued = QueuedBatch.of(TestRecords.batch(1));

        dispatcher.enqueue(queued);
        SubmissionOutcome outcome = queued.completion().get(2, TimeUnit.SECONDS);

        SubmissionOutcome.Deferred deferred = assertInstanceOf(SubmissionOutcome.Deferred.class, outcome);
        assertEquals(DeferReason.RETRIES_EXHAUSTED, deferred.reason());
        assertEquals(1, coordinator.deadLetterSize());
        dispatcher.close();
    }

    @Test
    void multiWorkerDeliversEveryBatchExactlyOnce() throws Exception {
        DeliveryDispatcher dispatcher = DeliveryDispatcher.builder()
                .coordinator(coordinator)
                .workerCount(4)
                .maxInFlight(3)
                .build();
        List<QueuedBatch> queued = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            QueuedBatch next = QueuedBatch.of(Batch.single(TestRecords.install("evt-" + i)));
            queued.add(next);
            assertTrue(dispatcher.enqueue(next));
        }

        for (QueuedBatch next : queued) {
            next.completion().get(5, TimeUnit.SECONDS);
        }
        dispatcher.close();

        assertEquals(50, sink.invocationCount());
        Set<String> ids = new HashSet<>();
        sink.deliveredRecords().forEach(r -> ids.add(r.eventId()));
        assertEquals(50, ids.size());
        assertEquals(0, dispatcher.inFlight());
    }

    @Test
    void closeDeliversBatchesLeftInQueue() throws Exception {
        DeliveryDispatcher dispatcher = DeliveryDispatcher.builder()
                .coordinator(coordinator)
                .workerCount(0)
                .drainTimeoutMs(50)
                .build();
        QueuedBatch first = QueuedBatch.of(Batch.single(TestRecords.install("a")));
        QueuedBatch second = QueuedBatch.of(Batch.single(TestRecords.install("b")));
        dispatcher.enqueue(first);
        dispatcher.enqueue(second);

        dispatcher.close();

        assertInstanceOf(SubmissionOutcome.Delivered.class, first.completion().get(2, TimeUnit.SECONDS));
        assertInstanceOf(SubmissionOutcome.Delivered.class, second.completion().get(2, TimeUnit.SECONDS));
        assertEquals(0, dispatcher.queueDepth());
    }

    @Test
    void closeKeepsBatchWaitingForInFlightPermit() throws Exception {
        sink.setLatency(Duration.ofMillis(500));
        DeliveryDispatcher dispatcher = DeliveryDispatcher.builder()
                .coordinator(coordinator)
                .workerCount(1)
                .maxInFlight(1)
                .drainTimeoutMs(100)
                .build();
        QueuedBatch first = QueuedBatch.of(Batch.single(TestRecords.install("a")));
        QueuedBatch second = QueuedBatch.of(Batch.single(TestRecords.install("b")));
        dispatcher.enqueue(first);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (sink.invocationCount() == 0 && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(1, dispatcher.inFlight());
        dispatcher.enqueue(second);
        Thread.sleep(50);

        dispatcher.close();

        assertInstanceOf(SubmissionOutcome.Delivered.class, first.completion().get(3, TimeUnit.SECONDS));
        assertInstanceOf(SubmissionOutcome.Delivered.class, second.completion().get(3, TimeUnit.SECONDS));
        assertEquals(2, sink.invocationCount());
        assertEquals(0, coordinator.deadLetterSize());
    }
}
