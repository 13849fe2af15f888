package relay.sink;

import org.junit.jupiter.api.Test;
import relay.Batch;
import relay.TestRecords;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDeliverySinkTest {

    @Test
    void acceptsAndRecordsBatches() throws SinkException {
        InMemoryDeliverySink sink = new InMemoryDeliverySink();
        Batch first = TestRecords.batch(2);
        Batch second = TestRecords.batch(1);

        sink.submit(first);
        sink.submit(second);

        assertEquals(2, sink.invocationCount());
        assertEquals(List.of(first, second), sink.delivered());
        assertEquals(3, sink.deliveredRecords().size());
    }

    @Test
    void alwaysInjectorFailsEveryCall() {
        InMemoryDeliverySink sink = new InMemoryDeliverySink(FailureInjector.always(SinkError.THROTTLED));

        SinkException ex = assertThrows(SinkException.class, () -> sink.submit(TestRecords.batch(1)));
        assertThrows(SinkException.class, () -> sink.submit(TestRecords.batch(1)));

        assertEquals(SinkError.THROTTLED, ex.error());
        assertEquals(2, sink.invocationCount());
        assertEquals(2, sink.invocations().size());
        assertTrue(sink.delivered().isEmpty());
    }

    @Test
    void firstNFailsThenAccepts() throws SinkException {
        InMemoryDeliverySink sink = new InMemoryDeliverySink(FailureInjector.firstN(2, SinkError.TRANSIENT));

        assertThrows(SinkException.class, () -> sink.submit(TestRecords.batch(1)));
        assertThrows(SinkException.class, () -> sink.submit(TestRecords.batch(1)));
        sink.submit(TestRecords.batch(1));

        assertEquals(3, sink.invocationCount());
        assertEquals(1, sink.delivered().size());
    }

    @Test
    void predicateInjectorFailsMatchingBatches() throws SinkException {
        InMemoryDeliverySink sink = new InMemoryDeliverySink(
                FailureInjector.when(batch -> batch.size() > 1, SinkError.PERMANENT));

        sink.submit(TestRecords.batch(1));
        SinkException ex = assertThrows(SinkException.class, () -> sink.submit(TestRecords.batch(2)));

        assertEquals(SinkError.PERMANENT, ex.error());
        assertFalse(ex.error().isRetryable());
    }

    @Test
    void sequencePlaysScriptThenSucceeds() throws SinkException {
        InMemoryDeliverySink sink = new InMemoryDeliverySink(
                FailureInjector.sequence(SinkError.TRANSIENT, null, SinkError.THROTTLED));

        assertThrows(SinkException.class, () -> sink.submit(TestRecords.batch(1)));
        sink.submit(TestRecords.batch(1));
        assertThrows(SinkException.class, () -> sink.submit(TestRecords.batch(1)));
        sink.submit(TestRecords.batch(1));

        assertEquals(2, sink.delivered().size());
    }

    @Test
    void injectorCanBeSwappedAndStateReset() throws SinkException {
        InMemoryDeliverySink sink = new InMemoryDeliverySink(FailureInjector.always(SinkError.TRANSIENT));
        assertThrows(SinkException.class, () -> sink.submit(TestRecords.batch(1)));

        sink.setFailureInjector(FailureInjector.never());
        sink.submit(TestRecords.batch(1));
        assertEquals(1, sink.delivered().size());

        sink.reset();
        assertEquals(0, sink.invocationCount());
        assertTrue(sink.invocations().isEmpty());
        assertTrue(sink.delivered().isEmpty());
    }

    @Test
    void latencyDelaysCall() throws SinkException {
        InMemoryDeliverySink sink = new InMemoryDeliverySink();
        sink.setLatency(Duration.ofMillis(50));

        long start = System.nanoTime();
        sink.submit(TestRecords.batch(1));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertTrue(elapsedMs >= 45, "elapsed: " + elapsedMs);
    }

    @Test
    void healthIsSettable() {
        InMemoryDeliverySink sink = new InMemoryDeliverySink();
        assertTrue(sink.isHealthy());

        sink.setHealthy(false);

        assertFalse(sink.isHealthy());
        assertEquals("in-memory", sink.name());
    }

    @Test
    void sinkExceptionDetailAndRetryAfter() {
        SinkException ex = new SinkException(SinkError.THROTTLED, "slow down",
                Duration.ofSeconds(2), null);

        assertEquals("THROTTLED: slow down", ex.detail());
        assertEquals(Duration.ofSeconds(2), ex.retryAfter());
        assertThrows(IllegalArgumentException.class, () ->
                new SinkException(SinkError.THROTTLED, "x", Duration.ofSeconds(-1), null));
    }

    @Test
    void errorTaxonomy() {
        assertTrue(SinkError.THROTTLED.isRetryable());
        assertTrue(SinkError.TRANSIENT.isRetryable());
        assertFalse(SinkError.PERMANENT.isRetryable());
        assertFalse(SinkError.PERMANENT.countsAgainstHealth());
        assertTrue(SinkError.TRANSIENT.countsAgainstHealth());
    }
}
