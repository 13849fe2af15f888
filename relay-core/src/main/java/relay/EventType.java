package relay;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Closed set of event kinds accepted for delivery.
 *
 * <p>Each constant carries its wire name and the field catalogue callers populate
 * for that kind. The delivery path never inspects fields; the catalogue only backs
 * {@link EventRecord#missingFields()}.
 */
public enum EventType {
    INSTALL("install",
            List.of(),
            List.of("source", "country")),
    PURCHASE("purchase",
            List.of("product_id", "product_name", "price", "currency", "quantity"),
            List.of("store", "transaction_id"));

    private final String wireName;
    private final Set<String> requiredFields;
    private final Set<String> optionalFields;

    EventType(String wireName, List<String> required, List<String> optional) {
        this.wireName = wireName;
        Set<String> req = new LinkedHashSet<>(Fields.BASE);
        req.addAll(required);
        this.requiredFields = Collections.unmodifiableSet(req);
        this.optionalFields = Collections.unmodifiableSet(new LinkedHashSet<>(optional));
    }

    /**
     * Returns the fields every event kind carries.
     *
     * @return the shared base fields, in declaration order
     */
    public static List<String> baseFields() {
        return Fields.BASE;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Returns the base fields plus the fields specific to this kind.
     *
     * @return required field names, in declaration order
     */
    public Set<String> requiredFields() {
        return requiredFields;
    }

    public Set<String> optionalFields() {
        return optionalFields;
    }

    /**
     * Resolves an event type from its wire name, case-insensitively.
     *
     * @param wireName the wire name, e.g. {@code "purchase"}
     * @return the matching type
     * @throws IllegalArgumentException if no type matches
     */
    public static EventType fromWireName(String wireName) {
        Objects.requireNonNull(wireName, "wireName");
        for (EventType type : values()) {
            if (type.wireName.equalsIgnoreCase(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + wireName);
    }

    // Enum constructors run before the enum's own static fields are assigned.
    private static final class Fields {
        static final List<String> BASE = List.of(
                "user_id", "game_id", "platform", "app_version", "session_id", "timestamp");
    }
}
