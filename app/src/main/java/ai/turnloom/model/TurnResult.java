package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Outcome of the most recent finished run of a thread. */
public enum TurnResult {
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
