package relay;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventTypeTest {

    @Test
    void wireNames() {
        assertEquals("install", EventType.INSTALL.wireName());
        assertEquals("purchase", EventType.PURCHASE.wireName());
    }

    @Test
    void fromWireNameIsCaseInsensitive() {
        assertEquals(EventType.PURCHASE, EventType.fromWireName("PURCHASE"));
        assertEquals(EventType.INSTALL, EventType.fromWireName("Install"));
    }

    @Test
    void fromWireNameRejectsUnknown() {
        assertThrows(IllegalArgumentException.class, () -> EventType.fromWireName("refund"));
    }

    @Test
    void requiredFieldsStartWithBaseFields() {
        List<String> base = EventType.baseFields();

        assertEquals(List.of("user_id", "game_id", "platform", "app_version", "session_id",
                "timestamp"), base);
        assertEquals(base, List.copyOf(EventType.INSTALL.requiredFields()));
        assertEquals(base, List.copyOf(EventType.PURCHASE.requiredFields()).subList(0, base.size()));
    }

    @Test
    void purchaseCatalogue() {
        assertTrue(EventType.PURCHASE.requiredFields().containsAll(
                List.of("product_id", "product_name", "price", "currency", "quantity")));
        assertEquals(List.of("store", "transaction_id"),
                List.copyOf(EventType.PURCHASE.optionalFields()));
    }

    @Test
    void installOptionalFields() {
        assertEquals(List.of("source", "country"), List.copyOf(EventType.INSTALL.optionalFields()));
    }
}
