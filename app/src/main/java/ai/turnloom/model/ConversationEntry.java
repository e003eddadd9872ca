package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * One entry of a thread's append-only conversation log.
 *
 * <p>{@code entryId} is unique within a thread; an empty id is replaced with {@code e_<seq>} when the entry is
 * written.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ConversationEntry.SystemEvent.class, name = "system_event"),
    @JsonSubTypes.Type(value = ConversationEntry.UserEvent.class, name = "user_event"),
    @JsonSubTypes.Type(value = ConversationEntry.AgentEvent.class, name = "agent_event")
})
public sealed interface ConversationEntry
        permits ConversationEntry.SystemEvent, ConversationEntry.UserEvent, ConversationEntry.AgentEvent {

    /** Index kinds written to the {@code kind} column. */
    String KIND_SYSTEM_EVENT = "system_event";

    String KIND_USER_MESSAGE = "user_message";
    String KIND_AGENT_ITEM = "agent_item";
    String KIND_TURN_USAGE = "turn_usage";
    String KIND_TURN_DURATION = "turn_duration";
    String KIND_TURN_CANCELED = "turn_canceled";
    String KIND_TURN_ERROR = "turn_error";

    String entryId();

    ConversationEntry withEntryId(String newEntryId);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SystemEvent(
            @JsonProperty("entry_id") @JsonAlias("id") String entryId,
            @JsonProperty("created_at_unix_ms") long createdAtUnixMs,
            @JsonProperty("event") SystemPayload event)
            implements ConversationEntry {
        public SystemEvent {
            if (entryId == null) {
                entryId = "";
            }
        }

        @Override
        public SystemEvent withEntryId(String newEntryId) {
            return new SystemEvent(newEntryId, createdAtUnixMs, event);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UserEvent(@JsonProperty("entry_id") String entryId, @JsonProperty("event") UserPayload event)
            implements ConversationEntry {
        public UserEvent {
            if (entryId == null) {
                entryId = "";
            }
        }

        @Override
        public UserEvent withEntryId(String newEntryId) {
            return new UserEvent(newEntryId, event);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AgentEvent(@JsonProperty("entry_id") String entryId, @JsonProperty("event") AgentPayload event)
            implements ConversationEntry {
        public AgentEvent {
            if (entryId == null) {
                entryId = "";
            }
        }

        @Override
        public AgentEvent withEntryId(String newEntryId) {
            return new AgentEvent(newEntryId, event);
        }
    }

    static SystemEvent taskCreated(String entryId, long createdAtUnixMs) {
        return new SystemEvent(entryId, createdAtUnixMs, new SystemPayload.TaskCreated());
    }

    static SystemEvent taskStatusChanged(TaskStatus from, TaskStatus to, long createdAtUnixMs) {
        return new SystemEvent("", createdAtUnixMs, new SystemPayload.TaskStatusChanged(from, to));
    }

    static UserEvent userMessage(String text, List<AttachmentRef> attachments) {
        return new UserEvent("", new UserPayload.Message(text, attachments));
    }

    static AgentEvent agent(AgentPayload payload) {
        return new AgentEvent("", payload);
    }

    /** The value written to the {@code kind} index column. */
    @JsonIgnore
    default String kind() {
        if (this instanceof SystemEvent) {
            return KIND_SYSTEM_EVENT;
        }
        if (this instanceof UserEvent) {
            return KIND_USER_MESSAGE;
        }
        var payload = ((AgentEvent) this).event();
        if (payload instanceof AgentPayload.TurnUsage) {
            return KIND_TURN_USAGE;
        }
        if (payload instanceof AgentPayload.TurnDuration) {
            return KIND_TURN_DURATION;
        }
        if (payload instanceof AgentPayload.TurnCanceled) {
            return KIND_TURN_CANCELED;
        }
        if (payload instanceof AgentPayload.TurnError) {
            return KIND_TURN_ERROR;
        }
        return KIND_AGENT_ITEM;
    }

    /** Vendor item id of agent messages and items; null for every other entry. */
    @JsonIgnore
    default @Nullable String itemId() {
        if (this instanceof AgentEvent agent) {
            if (agent.event() instanceof AgentPayload.Message message) {
                return message.id();
            }
            if (agent.event() instanceof AgentPayload.Item item) {
                return item.item().id();
            }
        }
        return null;
    }

    /**
     * Whether two entries denote the same log entry. Entry ids are compared only when both sides carry one, so an
     * optimistic local entry that has not been written yet still matches its stored counterpart. Items are matched by
     * item id, since an item's content may be re-rendered between reads.
     */
    default boolean isSameAs(ConversationEntry other) {
        if (getClass() != other.getClass()) {
            return false;
        }
        if (!entryId().isEmpty() && !other.entryId().isEmpty() && !entryId().equals(other.entryId())) {
            return false;
        }
        if (this instanceof SystemEvent a && other instanceof SystemEvent b) {
            return a.event().equals(b.event());
        }
        if (this instanceof UserEvent a && other instanceof UserEvent b) {
            return a.event().equals(b.event());
        }
        var a = ((AgentEvent) this).event();
        var b = ((AgentEvent) other).event();
        if (a instanceof AgentPayload.Item itemA && b instanceof AgentPayload.Item itemB) {
            return itemA.item().id().equals(itemB.item().id());
        }
        return a.equals(b);
    }
}
