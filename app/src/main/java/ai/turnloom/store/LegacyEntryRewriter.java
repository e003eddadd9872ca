package ai.turnloom.store;

import ai.turnloom.model.ConversationEntry;
import ai.turnloom.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Rewrites entries stored in the flat legacy shape ({@code user_message}, {@code codex_item}, {@code turn_*}) into
 * the tagged {@code user_event} / {@code agent_event} shape. Runs once, as part of one schema migration.
 */
final class LegacyEntryRewriter {
    private static final Logger logger = LogManager.getLogger(LegacyEntryRewriter.class);

    static final Set<String> LEGACY_TYPES =
            Set.of("user_message", "codex_item", "turn_usage", "turn_duration", "turn_canceled", "turn_error");

    private LegacyEntryRewriter() {}

    private record Row(long rowId, String entryId, String payloadJson) {}

    /** Rewrites every legacy row reachable through {@code conn}; returns the number of rows changed. */
    static int rewriteAll(Connection conn) throws SQLException, StoreException {
        var rows = new ArrayList<Row>();
        try (var ps = conn.prepareStatement("SELECT id, entry_id, payload_json FROM conversation_entries");
                var rs = ps.executeQuery()) {
            while (rs.next()) {
                rows.add(new Row(rs.getLong(1), rs.getString(2), rs.getString(3)));
            }
        }

        int rewritten = 0;
        try (var update =
                conn.prepareStatement("UPDATE conversation_entries SET payload_json = ?, kind = ? WHERE id = ?")) {
            for (var row : rows) {
                var legacy = Json.parseOrNull(row.payloadJson());
                if (legacy == null) {
                    throw new StoreException("unreadable entry payload in row " + row.rowId());
                }
                var replacement = rewrite(legacy, row.entryId());
                if (replacement == null) {
                    continue;
                }
                String json = replacement.toString();
                ConversationEntry entry;
                try {
                    entry = Json.read(json, ConversationEntry.class);
                } catch (JsonProcessingException e) {
                    throw new StoreException("legacy entry in row " + row.rowId() + " could not be converted", e);
                }
                update.setString(1, json);
                update.setString(2, entry.kind());
                update.setLong(3, row.rowId());
                update.executeUpdate();
                rewritten++;
            }
        }
        logger.info("Rewrote {} legacy conversation entries", rewritten);
        return rewritten;
    }

    /**
     * Returns the tagged form of a legacy payload, or null when the payload is already in the current shape.
     */
    static @Nullable ObjectNode rewrite(JsonNode legacy, String entryId) {
        var type = legacy.path("type").asText("");
        if (!LEGACY_TYPES.contains(type)) {
            return null;
        }

        var mapper = Json.mapper();
        var out = mapper.createObjectNode();
        var event = mapper.createObjectNode();

        if (type.equals("user_message")) {
            out.put("type", "user_event");
            out.put("entry_id", entryId);
            event.put("type", "message");
            event.put("text", legacy.path("text").asText(""));
            var attachments = legacy.get("attachments");
            event.set("attachments", attachments != null && attachments.isArray() ? attachments : mapper.createArrayNode());
            out.set("event", event);
            return out;
        }

        out.put("type", "agent_event");
        out.put("entry_id", entryId);
        switch (type) {
            case "codex_item" -> {
                var item = legacy.path("item");
                if (item.path("type").asText("").equals("agent_message")) {
                    event.put("type", "message");
                    event.put("id", item.path("id").asText(""));
                    event.put("text", item.path("text").asText(""));
                } else {
                    event.put("type", "item");
                    event.set("item", item);
                }
            }
            case "turn_usage" -> {
                event.put("type", "turn_usage");
                var usage = legacy.get("usage");
                if (usage != null && !usage.isNull()) {
                    event.set("usage", usage);
                }
            }
            case "turn_duration" -> {
                event.put("type", "turn_duration");
                event.put("duration_ms", legacy.path("duration_ms").asLong(0));
            }
            case "turn_canceled" -> event.put("type", "turn_canceled");
            case "turn_error" -> {
                event.put("type", "turn_error");
                event.put("message", legacy.path("message").asText(""));
            }
            default -> throw new IllegalStateException("unhandled legacy type " + type);
        }
        out.set("event", event);
        return out;
    }
}
