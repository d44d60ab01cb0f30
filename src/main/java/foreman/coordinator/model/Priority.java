package foreman.coordinator.model;

import java.util.Locale;

/**
 * Dispatch priority of a task. Declaration order is dispatch order.
 */
public enum Priority {
    HIGH,
    MEDIUM,
    LOW;

    /** Wire form: lower-case name. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a priority leniently. Null or blank maps to MEDIUM.
     *
     * @throws IllegalArgumentException for unrecognised values
     */
    public static Priority parse(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown priority: " + value);
        }
    }
}
