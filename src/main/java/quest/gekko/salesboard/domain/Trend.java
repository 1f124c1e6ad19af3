package quest.gekko.salesboard.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Trend {
    UP,
    DOWN,
    FLAT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Trend fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
