package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.function.UnaryOperator;
import org.jetbrains.annotations.Nullable;

/**
 * One normalized event of an agent turn, in the line-delimited wire shape every vendor stream is translated into.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AgentThreadEvent.ThreadStarted.class, name = "thread.started"),
    @JsonSubTypes.Type(value = AgentThreadEvent.TurnStarted.class, name = "turn.started"),
    @JsonSubTypes.Type(value = AgentThreadEvent.TurnCompleted.class, name = "turn.completed"),
    @JsonSubTypes.Type(value = AgentThreadEvent.TurnDuration.class, name = "turn.duration"),
    @JsonSubTypes.Type(value = AgentThreadEvent.TurnFailed.class, name = "turn.failed"),
    @JsonSubTypes.Type(value = AgentThreadEvent.ItemStarted.class, name = "item.started"),
    @JsonSubTypes.Type(value = AgentThreadEvent.ItemUpdated.class, name = "item.updated"),
    @JsonSubTypes.Type(value = AgentThreadEvent.ItemCompleted.class, name = "item.completed"),
    @JsonSubTypes.Type(value = AgentThreadEvent.StreamError.class, name = "error")
})
public sealed interface AgentThreadEvent
        permits AgentThreadEvent.ThreadStarted,
                AgentThreadEvent.TurnStarted,
                AgentThreadEvent.TurnCompleted,
                AgentThreadEvent.TurnDuration,
                AgentThreadEvent.TurnFailed,
                AgentThreadEvent.ItemStarted,
                AgentThreadEvent.ItemUpdated,
                AgentThreadEvent.ItemCompleted,
                AgentThreadEvent.StreamError {

    /** The vendor assigned (or confirmed) its own id for the conversation. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ThreadStarted(@JsonProperty("thread_id") String threadId) implements AgentThreadEvent {}

    record TurnStarted() implements AgentThreadEvent {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TurnCompleted(@JsonProperty("usage") @Nullable Usage usage) implements AgentThreadEvent {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TurnDuration(@JsonProperty("duration_ms") long durationMs) implements AgentThreadEvent {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TurnFailed(@JsonProperty("error") AgentItem.ErrorDetail error) implements AgentThreadEvent {
        public static TurnFailed of(String message) {
            return new TurnFailed(new AgentItem.ErrorDetail(message));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ItemStarted(@JsonProperty("item") AgentItem item) implements AgentThreadEvent {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ItemUpdated(@JsonProperty("item") AgentItem item) implements AgentThreadEvent {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ItemCompleted(@JsonProperty("item") AgentItem item) implements AgentThreadEvent {}

    /** Stream-level error reported outside a turn.failed event. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record StreamError(@JsonProperty("message") String message) implements AgentThreadEvent {}

    /** The item carried by item.started/updated/completed, or null for every other event. */
    static @Nullable AgentItem itemOf(AgentThreadEvent event) {
        if (event instanceof ItemStarted started) {
            return started.item();
        }
        if (event instanceof ItemUpdated updated) {
            return updated.item();
        }
        if (event instanceof ItemCompleted completed) {
            return completed.item();
        }
        return null;
    }

    /** Rewrites the carried item of an item event; any other event is returned unchanged. */
    static AgentThreadEvent mapItem(AgentThreadEvent event, UnaryOperator<AgentItem> fn) {
        if (event instanceof ItemStarted started) {
            return new ItemStarted(fn.apply(started.item()));
        }
        if (event instanceof ItemUpdated updated) {
            return new ItemUpdated(fn.apply(updated.item()));
        }
        if (event instanceof ItemCompleted completed) {
            return new ItemCompleted(fn.apply(completed.item()));
        }
        return event;
    }

    /** True for events that end a turn from the vendor's point of view. */
    static boolean isTerminal(AgentThreadEvent event) {
        return event instanceof TurnCompleted || event instanceof TurnFailed;
    }
}
