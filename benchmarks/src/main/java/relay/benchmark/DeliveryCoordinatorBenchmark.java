package relay.benchmark;

import org.openjdk.jmh.annotations.*;
import relay.Batch;
import relay.EventRecord;
import relay.EventType;
import relay.SubmissionOutcome;
import relay.dispatch.DeliveryCoordinator;
import relay.dispatch.DeliveryDispatcher;
import relay.dispatch.QueuedBatch;
import relay.sink.InMemoryDeliverySink;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Measures coordinator overhead against the in-memory sink: batch splitting, circuit gating
 * and the asynchronous hand-off, without network cost.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar DeliveryCoordinatorBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class DeliveryCoordinatorBenchmark {

  private InMemoryDeliverySink sink;
  private DeliveryCoordinator coordinator;
  private DeliveryDispatcher dispatcher;
  private Batch batch;

  @Param({"1", "100", "1000"})
  private int batchSize;

  @Setup(Level.Trial)
  public void setup() {
    sink = new InMemoryDeliverySink();
    coordinator = DeliveryCoordinator.builder()
        .sink(sink)
        .maxBatchSize(500)
        .build();
    dispatcher = DeliveryDispatcher.builder()
        .coordinator(coordinator)
        .workerCount(2)
        .queueCapacity(10_000)
        .build();

    List<EventRecord> records = new ArrayList<>(batchSize);
    for (int i = 0; i < batchSize; i++) {
      records.add(EventRecord.builder(EventType.INSTALL)
          .field("user_id", "user-" + i)
          .field("game_id", "bench")
          .field("platform", "ios")
          .field("app_version", "1.0.0")
          .field("session_id", "session-" + (i % 16))
          .field("timestamp", "2024-01-01T00:00:00Z")
          .build());
    }
    batch = Batch.of(records);
  }

  @Setup(Level.Iteration)
  public void resetSink() {
    sink.reset();
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    dispatcher.close();
    coordinator.close();
  }

  @Benchmark
  public SubmissionOutcome handle() {
    return coordinator.handle(batch);
  }

  @Benchmark
  public SubmissionOutcome enqueueAndAwait() throws Exception {
    QueuedBatch queued = QueuedBatch.of(batch);
    if (!dispatcher.enqueue(queued)) {
      throw new IllegalStateException("dispatcher queue full");
    }
    return queued.completion().get(5, TimeUnit.SECONDS);
  }
}
