package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Derived activity of a thread, computed from persisted queue state.
 */
public enum TurnStatus {
    /** No run and nothing queued. */
    IDLE,
    /** A run has started and not finished. */
    RUNNING,
    /** Prompts are queued and the queue is not paused. */
    AWAITING,
    /** Prompts are queued behind a paused queue. */
    PAUSED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
