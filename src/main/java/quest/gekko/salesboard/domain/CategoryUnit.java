package quest.gekko.salesboard.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CategoryUnit {
    COUNT,
    CURRENCY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CategoryUnit fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
