package ai.turnloom.runner;

import ai.turnloom.model.AgentItem;
import ai.turnloom.model.AgentThreadEvent;
import java.security.SecureRandom;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Qualifies vendor item ids with a per-turn scope id so that raw ids reused by successive turns never collide in a
 * thread's log.
 */
public final class TurnScope {
    private static final SecureRandom RANDOM = new SecureRandom();

    private TurnScope() {}

    /** A fresh scope id of the form {@code turn-<hex micros>-<hex random>}. */
    public static String generate() {
        long micros = ChronoUnit.MICROS.between(Instant.EPOCH, Instant.now());
        return "turn-" + Long.toHexString(micros) + "-" + Long.toHexString(RANDOM.nextLong());
    }

    /** Rewrite {@code item}'s id to {@code scope/rawId}. Already qualified ids are left alone. */
    public static AgentItem qualify(String scopeId, AgentItem item) {
        var rawId = item.id();
        if (rawId.startsWith(scopeId + "/")) {
            return item;
        }
        return item.withId(scopeId + "/" + rawId);
    }

    /** Qualify the item carried by an item event; every other event passes through unchanged. */
    public static AgentThreadEvent qualify(String scopeId, AgentThreadEvent event) {
        return AgentThreadEvent.mapItem(event, item -> qualify(scopeId, item));
    }
}
