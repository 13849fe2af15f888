package relay.kafka;

import org.apache.kafka.clients.producer.BufferExhaustedException;
import org.apache.kafka.common.InvalidRecordException;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.InvalidTopicException;
import org.apache.kafka.common.errors.RecordBatchTooLargeException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.SerializationException;
import relay.sink.SinkError;
import relay.sink.SinkException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps Kafka producer failures onto {@link SinkError}.
 *
 * <ul>
 *   <li>{@code THROTTLED}: producer buffer exhausted</li>
 *   <li>{@code PERMANENT}: record too large, serialization, invalid topic or record,
 *       authorization and authentication failures</li>
 *   <li>{@code TRANSIENT}: everything else, including retriable errors, timeouts and
 *       interrupted waits</li>
 * </ul>
 *
 * <p>Broker produce quotas do not raise an exception. The broker delays its responses until
 * the producer's buffer backs up, and {@code send} then fails with
 * {@link BufferExhaustedException}.
 * {@code ThrottlingQuotaExceededException} belongs to the admin API and is treated like any
 * other retriable error. Kafka failures carry no retry-after hint, so the retry policy's own
 * backoff applies.
 */
public final class KafkaErrorClassifier {

  private KafkaErrorClassifier() {}

  public static SinkError classify(Throwable error) {
    Throwable cause = unwrap(error);
    // BufferExhaustedException is a TimeoutException; check it first.
    if (cause instanceof BufferExhaustedException) {
      return SinkError.THROTTLED;
    }
    if (cause instanceof RecordTooLargeException
        || cause instanceof RecordBatchTooLargeException
        || cause instanceof SerializationException
        || cause instanceof InvalidTopicException
        || cause instanceof InvalidRecordException
        || cause instanceof AuthorizationException
        || cause instanceof AuthenticationException) {
      return SinkError.PERMANENT;
    }
    return SinkError.TRANSIENT;
  }

  /**
   * Wraps a producer failure as a {@link SinkException}.
   *
   * @param error   the failure
   * @param context what was being attempted, used as the message prefix
   * @return the classified exception
   */
  public static SinkException toSinkException(Throwable error, String context) {
    Throwable cause = unwrap(error);
    return new SinkException(classify(cause), context + ": " + cause, cause);
  }

  static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof ExecutionException || current instanceof CompletionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
