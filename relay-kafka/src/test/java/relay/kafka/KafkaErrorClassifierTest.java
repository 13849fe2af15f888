package relay.kafka;

import org.apache.kafka.clients.producer.BufferExhaustedException;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.InvalidTopicException;
import org.apache.kafka.common.errors.NotLeaderOrFollowerException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.SaslAuthenticationException;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.errors.ThrottlingQuotaExceededException;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.errors.TopicAuthorizationException;
import org.junit.jupiter.api.Test;
import relay.sink.SinkError;
import relay.sink.SinkException;

import java.util.Set;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class KafkaErrorClassifierTest {

  @Test
  void bufferExhaustionIsThrottled() {
    assertEquals(SinkError.THROTTLED,
        KafkaErrorClassifier.classify(new BufferExhaustedException("buffer full")));
  }

  @Test
  void adminQuotaErrorIsOrdinaryRetriable() {
    assertEquals(SinkError.TRANSIENT,
        KafkaErrorClassifier.classify(new ThrottlingQuotaExceededException(250, "quota")));
  }

  @Test
  void payloadAndAccessErrorsArePermanent() {
    assertEquals(SinkError.PERMANENT, KafkaErrorClassifier.classify(new RecordTooLargeException("big")));
    assertEquals(SinkError.PERMANENT, KafkaErrorClassifier.classify(new SerializationException("bad")));
    assertEquals(SinkError.PERMANENT, KafkaErrorClassifier.classify(new InvalidTopicException("x")));
    assertEquals(SinkError.PERMANENT,
        KafkaErrorClassifier.classify(new TopicAuthorizationException(Set.of("events"))));
    assertEquals(SinkError.PERMANENT,
        KafkaErrorClassifier.classify(new SaslAuthenticationException("denied")));
  }

  @Test
  void retriableTimeoutAndUnknownErrorsAreTransient() {
    assertEquals(SinkError.TRANSIENT, KafkaErrorClassifier.classify(new NotLeaderOrFollowerException("moved")));
    assertEquals(SinkError.TRANSIENT, KafkaErrorClassifier.classify(new TimeoutException("slow")));
    InterruptException interrupted = new InterruptException(new InterruptedException());
    // the constructor re-asserts the interrupt flag
    Thread.interrupted();
    assertEquals(SinkError.TRANSIENT, KafkaErrorClassifier.classify(interrupted));
    assertEquals(SinkError.TRANSIENT, KafkaErrorClassifier.classify(new KafkaException("unknown")));
    assertEquals(SinkError.TRANSIENT, KafkaErrorClassifier.classify(new IllegalStateException("odd")));
  }

  @Test
  void classificationLooksThroughFutureWrappers() {
    ExecutionException wrapped = new ExecutionException(new RecordTooLargeException("big"));

    assertEquals(SinkError.PERMANENT, KafkaErrorClassifier.classify(wrapped));
  }

  @Test
  void throttledFailureCarriesNoRetryAfterHint() {
    SinkException e = KafkaErrorClassifier.toSinkException(
        new ExecutionException(new BufferExhaustedException("buffer full")), "publish failed");

    assertEquals(SinkError.THROTTLED, e.error());
    assertNull(e.retryAfter());
  }

  @Test
  void sinkExceptionKeepsUnwrappedCause() {
    RecordTooLargeException cause = new RecordTooLargeException("big");

    SinkException e = KafkaErrorClassifier.toSinkException(new ExecutionException(cause), "publish failed");

    assertSame(cause, e.getCause());
  }
}
