package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/**
 * Agent vendor that executes a turn.
 *
 * <p>Only {@link #CLAUDE} keeps a warm process between turns; the others are invoked one shot per turn.
 */
public enum RunnerKind {
    CODEX(false),
    AMP(false),
    CLAUDE(true),
    DROID(false);

    private final boolean reusesProcess;

    RunnerKind(boolean reusesProcess) {
        this.reusesProcess = reusesProcess;
    }

    public boolean reusesProcess() {
        return reusesProcess;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunnerKind parse(String raw) {
        return RunnerKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    /** Lenient variant used for configuration values; returns null when unrecognised. */
    public static @Nullable RunnerKind parseOrNull(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return parse(raw);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
