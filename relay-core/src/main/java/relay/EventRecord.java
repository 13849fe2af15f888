package relay;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, already-validated application event handed to the delivery core.
 *
 * <p>Each record is assigned a ULID-based {@code eventId} unless the caller supplies
 * one; downstream consumers deduplicate on it, since delivery is at-least-once.
 * Field values are limited to scalars ({@link String}, {@link Number}, {@link Boolean})
 * or {@code null}, and the field map keeps insertion order.
 *
 * @see Batch
 * @see EventType
 */
public final class EventRecord {
    private final String eventId;
    private final EventType eventType;
    private final Instant occurredAt;
    private final Map<String, Object> fields;

    private EventRecord(Builder builder) {
        this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
        this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
        if (this.eventId.isEmpty()) {
            throw new IllegalArgumentException("eventId cannot be empty");
        }
        this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;

        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : builder.fields.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isEmpty()) {
                throw new IllegalArgumentException("field names cannot be null or empty");
            }
            Object value = entry.getValue();
            if (value != null && !isScalar(value)) {
                throw new IllegalArgumentException("field '" + entry.getKey()
                        + "' must be a String, Number or Boolean, got: " + value.getClass().getName());
            }
            copy.put(entry.getKey(), value);
        }
        this.fields = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a builder for the given event type.
     *
     * @param eventType the event kind
     * @return a new builder
     */
    public static Builder builder(EventType eventType) {
        Objects.requireNonNull(eventType, "eventType");
        return new Builder(eventType);
    }

    /**
     * Creates a record with a caller-generated id and the given fields.
     *
     * @param eventId   the event identifier
     * @param eventType the event kind
     * @param fields    field values
     * @return a new record
     */
    public static EventRecord of(String eventId, EventType eventType, Map<String, ?> fields) {
        return builder(eventType).eventId(eventId).fields(fields).build();
    }

    public String eventId() {
        return eventId;
    }

    public EventType eventType() {
        return eventType;
    }

    public Instant occurredAt() {
        return occurredAt;
    }

    public Map<String, Object> fields() {
        return fields;
    }

    /**
     * Returns the value of a single field, or {@code null} if absent.
     *
     * @param name the field name
     * @return the field value, or {@code null}
     */
    public Object field(String name) {
        return fields.get(name);
    }

    /**
     * Returns the required fields of this record's {@link EventType} that are absent or null.
     *
     * @return missing field names, in catalogue order (empty when complete)
     */
    public Set<String> missingFields() {
        Set<String> missing = new LinkedHashSet<>();
        for (String name : eventType.requiredFields()) {
            if (fields.get(name) == null) {
                missing.add(name);
            }
        }
        return missing;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventRecord other)) return false;
        return eventId.equals(other.eventId)
                && eventType == other.eventType
                && occurredAt.equals(other.occurredAt)
                && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, eventType, occurredAt, fields);
    }

    @Override
    public String toString() {
        return "EventRecord{eventId=" + eventId + ", eventType=" + eventType.wireName()
                + ", fields=" + fields.size() + '}';
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private static String newEventId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    /**
     * Builder for {@link EventRecord}.
     */
    public static final class Builder {
        private final EventType eventType;
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private String eventId;
        private Instant occurredAt;

        private Builder(EventType eventType) {
            this.eventType = eventType;
        }

        /**
         * Sets a caller-generated event identifier.
         *
         * <p>Optional. Defaults to a monotonic ULID.
         *
         * @param eventId the event identifier
         * @return this builder
         */
        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        /**
         * Sets the event timestamp.
         *
         * <p>Optional. Defaults to {@link Instant#now()}.
         *
         * @param occurredAt the event timestamp
         * @return this builder
         */
        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        /**
         * Sets a single field value, replacing any previous value.
         *
         * @param name  the field name
         * @param value a scalar value or {@code null}
         * @return this builder
         */
        public Builder field(String name, Object value) {
            this.fields.put(name, value);
            return this;
        }

        /**
         * Copies all entries of the given map into the field set.
         *
         * @param fields field values
         * @return this builder
         */
        public Builder fields(Map<String, ?> fields) {
            Objects.requireNonNull(fields, "fields");
            this.fields.putAll(fields);
            return this;
        }

        /**
         * Builds the record.
         *
         * @return a new immutable record
         * @throws IllegalArgumentException if the id is empty or a field value is not a scalar
         */
        public EventRecord build() {
            return new EventRecord(this);
        }
    }
}
