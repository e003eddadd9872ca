package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle of the task a thread works on. */
public enum TaskStatus {
    BACKLOG,
    TODO,
    ITERATING,
    VALIDATING,
    DONE,
    CANCELED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Accepts the current names plus the older in_progress / in_review spellings. */
    @JsonCreator
    public static TaskStatus parse(String raw) {
        var normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "in_progress" -> ITERATING;
            case "in_review" -> VALIDATING;
            default -> TaskStatus.valueOf(normalized.toUpperCase(Locale.ROOT));
        };
    }
}
