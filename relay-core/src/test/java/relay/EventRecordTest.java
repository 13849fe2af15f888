package relay;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EventRecordTest {

    @Test
    void generatesUlidWhenEventIdAbsent() {
        EventRecord record = EventRecord.builder(EventType.INSTALL).build();

        assertNotNull(record.eventId());
        assertEquals(26, record.eventId().length());
    }

    @Test
    void generatedIdsAreUniqueAndOrdered() {
        EventRecord first = EventRecord.builder(EventType.INSTALL).build();
        EventRecord second = EventRecord.builder(EventType.INSTALL).build();

        assertNotEquals(first.eventId(), second.eventId());
        assertTrue(first.eventId().compareTo(second.eventId()) < 0);
    }

    @Test
    void keepsCallerSuppliedId() {
        EventRecord record = EventRecord.builder(EventType.PURCHASE).eventId("order-42").build();

        assertEquals("order-42", record.eventId());
        assertEquals(EventType.PURCHASE, record.eventType());
    }

    @Test
    void rejectsEmptyEventId() {
        assertThrows(IllegalArgumentException.class, () ->
                EventRecord.builder(EventType.INSTALL).eventId("").build());
    }

    @Test
    void rejectsNullEventType() {
        assertThrows(NullPointerException.class, () -> EventRecord.builder(null));
    }

    @Test
    void rejectsNonScalarFieldValue() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
                EventRecord.builder(EventType.INSTALL).field("tags", List.of("a")).build());

        assertTrue(ex.getMessage().contains("tags"));
    }

    @Test
    void rejectsEmptyFieldName() {
        assertThrows(IllegalArgumentException.class, () ->
                EventRecord.builder(EventType.INSTALL).field("", "x").build());
    }

    @Test
    void acceptsScalarsAndNull() {
        EventRecord record = EventRecord.builder(EventType.PURCHASE)
                .field("product_id", "sku-1")
                .field("price", 9.99)
                .field("quantity", 2)
                .field("gift", true)
                .field("store", null)
                .build();

        assertEquals(9.99, record.field("price"));
        assertEquals(2, record.field("quantity"));
        assertEquals(Boolean.TRUE, record.field("gift"));
        assertNull(record.field("store"));
        assertTrue(record.fields().containsKey("store"));
    }

    @Test
    void fieldsPreserveInsertionOrder() {
        EventRecord record = EventRecord.builder(EventType.INSTALL)
                .field("c", "3")
                .field("a", "1")
                .field("b", "2")
                .build();

        assertEquals(List.of("c", "a", "b"), new ArrayList<>(record.fields().keySet()));
    }

    @Test
    void fieldsAreImmutableAndDetachedFromSource() {
        Map<String, Object> source = new HashMap<>();
        source.put("user_id", "u-1");
        EventRecord record = EventRecord.of("evt-1", EventType.INSTALL, source);
        source.put("user_id", "changed");

        assertEquals("u-1", record.field("user_id"));
        assertThrows(UnsupportedOperationException.class, () -> record.fields().put("x", "y"));
    }

    @Test
    void occurredAtDefaultsToNow() {
        Instant before = Instant.now();
        EventRecord record = EventRecord.builder(EventType.INSTALL).build();

        assertFalse(record.occurredAt().isBefore(before));
    }

    @Test
    void missingFieldsListsAbsentRequiredFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("user_id", "u-1");
        fields.put("game_id", "g-1");
        fields.put("platform", "android");
        fields.put("app_version", "2.0");
        fields.put("session_id", "s-1");
        fields.put("timestamp", "2024-01-01T00:00:00Z");
        fields.put("product_id", "sku-1");
        fields.put("price", null);

        EventRecord record = EventRecord.of("evt-1", EventType.PURCHASE, fields);

        assertEquals(Set.of("product_name", "price", "currency", "quantity"), record.missingFields());
    }

    @Test
    void completeInstallHasNoMissingFields() {
        assertTrue(TestRecords.install("evt-1").missingFields().isEmpty());
    }

    @Test
    void equalityCoversAllComponents() {
        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        EventRecord a = EventRecord.builder(EventType.INSTALL).eventId("e").occurredAt(at)
                .field("k", "v").build();
        EventRecord b = EventRecord.builder(EventType.INSTALL).eventId("e").occurredAt(at)
                .field("k", "v").build();
        EventRecord c = EventRecord.builder(EventType.INSTALL).eventId("e").occurredAt(at)
                .field("k", "w").build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }
}
