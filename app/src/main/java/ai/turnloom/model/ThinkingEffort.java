package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ThinkingEffort {
    MINIMAL,
    LOW,
    MEDIUM,
    HIGH,
    XHIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ThinkingEffort parse(String raw) {
        return ThinkingEffort.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
