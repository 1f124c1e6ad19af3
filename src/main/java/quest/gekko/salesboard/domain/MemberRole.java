package quest.gekko.salesboard.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MemberRole {
    OWNER,
    MANAGER,
    SALES_JUNIOR,
    SALES_SENIOR;

    /** JSON form, lower snake case. */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MemberRole fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
