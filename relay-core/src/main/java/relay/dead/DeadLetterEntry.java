package relay.dead;

import relay.Batch;
import relay.SubmissionOutcome.DeferReason;

import java.time.Instant;
import java.util.Objects;

/**
 * A deferred sub-batch held for replay.
 *
 * @param batch      the undelivered records, in original order
 * @param reason     why delivery was deferred
 * @param lastError  last sink error detail, or {@code null} if the sink was never called
 * @param enqueuedAt when the entry first entered the buffer
 * @param retryCount failed replays so far
 */
public record DeadLetterEntry(Batch batch, DeferReason reason, String lastError,
    Instant enqueuedAt, int retryCount) {

  public DeadLetterEntry {
    Objects.requireNonNull(batch, "batch");
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0");
    }
  }

  /**
   * Returns a copy charged with one more failed replay.
   *
   * @param error the replay's failure detail, or {@code null} to keep the previous one
   * @return the updated entry
   */
  public DeadLetterEntry withFailedReplay(String error) {
    return new DeadLetterEntry(batch, reason, error != null ? error : lastError, enqueuedAt,
        retryCount + 1);
  }
}
