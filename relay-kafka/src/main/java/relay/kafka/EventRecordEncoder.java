package relay.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import relay.EventRecord;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes an {@link EventRecord} as a flat JSON object for the message value.
 *
 * <p>Layout: {@code ingestion_timestamp}, {@code source}, {@code event_id}, {@code event_type},
 * {@code occurred_at}, then the record's fields in insertion order. Instants are written as
 * ISO-8601 strings.
 */
public final class EventRecordEncoder {

  public static final String DEFAULT_SOURCE = "game_analytics_api";

  private final ObjectMapper objectMapper;
  private final String source;

  public EventRecordEncoder() {
    this(DEFAULT_SOURCE);
  }

  public EventRecordEncoder(String source) {
    this(defaultObjectMapper(), source);
  }

  public EventRecordEncoder(ObjectMapper objectMapper, String source) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.source = Objects.requireNonNull(source, "source");
  }

  static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  /**
   * @param record     the record to encode
   * @param ingestedAt value of {@code ingestion_timestamp}
   * @return UTF-8 JSON bytes
   * @throws JsonProcessingException if a field value cannot be serialized
   */
  public byte[] encode(EventRecord record, Instant ingestedAt) throws JsonProcessingException {
    Objects.requireNonNull(record, "record");
    Objects.requireNonNull(ingestedAt, "ingestedAt");
    Map<String, Object> value = new LinkedHashMap<>();
    value.put("ingestion_timestamp", ingestedAt);
    value.put("source", source);
    value.put("event_id", record.eventId());
    value.put("event_type", record.eventType().wireName());
    value.put("occurred_at", record.occurredAt());
    value.putAll(record.fields());
    return objectMapper.writeValueAsBytes(value);
  }

  public String source() {
    return source;
  }
}
