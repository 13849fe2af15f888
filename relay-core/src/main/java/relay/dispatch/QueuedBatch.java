package relay.dispatch;

import relay.Batch;
import relay.SubmissionOutcome;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A batch waiting in the {@link DeliveryDispatcher} queue, paired with the future that
 * receives its outcome once delivery resolves.
 *
 * <p>The completion is a signal only: cancelling it does not withdraw the batch.
 */
public record QueuedBatch(Batch batch, CompletableFuture<SubmissionOutcome> completion) {

  public QueuedBatch {
    Objects.requireNonNull(batch, "batch");
    Objects.requireNonNull(completion, "completion");
  }

  public static QueuedBatch of(Batch batch) {
    return new QueuedBatch(batch, new CompletableFuture<>());
  }
}
