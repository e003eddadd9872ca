package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.jetbrains.annotations.Nullable;

/** What an agent entry records. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AgentPayload.Message.class, name = "message"),
    @JsonSubTypes.Type(value = AgentPayload.Item.class, name = "item"),
    @JsonSubTypes.Type(value = AgentPayload.TurnUsage.class, name = "turn_usage"),
    @JsonSubTypes.Type(value = AgentPayload.TurnDuration.class, name = "turn_duration"),
    @JsonSubTypes.Type(value = AgentPayload.TurnCanceled.class, name = "turn_canceled"),
    @JsonSubTypes.Type(value = AgentPayload.TurnError.class, name = "turn_error")
})
public sealed interface AgentPayload
        permits AgentPayload.Message,
                AgentPayload.Item,
                AgentPayload.TurnUsage,
                AgentPayload.TurnDuration,
                AgentPayload.TurnCanceled,
                AgentPayload.TurnError {

    /** A top-level agent message; stored apart from other items so the final answer is easy to find. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(@JsonProperty("id") String id, @JsonProperty("text") String text) implements AgentPayload {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Item(@JsonProperty("item") AgentItem item) implements AgentPayload {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TurnUsage(@JsonProperty("usage") @Nullable Usage usage) implements AgentPayload {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TurnDuration(@JsonProperty("duration_ms") long durationMs) implements AgentPayload {}

    record TurnCanceled() implements AgentPayload {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TurnError(@JsonProperty("message") String message) implements AgentPayload {}

    /** Wraps a completed vendor item, splitting agent messages out as {@link Message}. */
    static AgentPayload fromItem(AgentItem item) {
        if (item instanceof AgentItem.AgentMessage message) {
            return new Message(message.id(), message.text());
        }
        return new Item(item);
    }
}
