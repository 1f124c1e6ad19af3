package quest.gekko.salesboard.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PeriodStatus {
    DRAFT,
    PUBLISHED,
    LOCKED,
    ARCHIVED;

    /** JSON form, lower snake case. */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PeriodStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** Configuration and derived targets can no longer change. */
    public boolean isFrozen() {
        return this == LOCKED || this == ARCHIVED;
    }

    /** Entering this status requires every percentage split to be complete. */
    public boolean requiresCompleteConfiguration() {
        return this == PUBLISHED || this == LOCKED;
    }
}
