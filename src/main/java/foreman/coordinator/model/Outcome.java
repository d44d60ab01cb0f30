package foreman.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome carried by a result report.
 */
public enum Outcome {
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Outcome parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("outcome is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
