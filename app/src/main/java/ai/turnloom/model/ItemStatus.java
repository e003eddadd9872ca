package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Progress of a command, file change or tool call item. */
public enum ItemStatus {
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ItemStatus parse(String raw) {
        return ItemStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
