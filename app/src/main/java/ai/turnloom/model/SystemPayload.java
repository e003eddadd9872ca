package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** What a system entry records. Tagged by {@code event_type}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "event_type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SystemPayload.TaskCreated.class, name = "task_created"),
    @JsonSubTypes.Type(value = SystemPayload.TaskStatusChanged.class, name = "task_status_changed")
})
public sealed interface SystemPayload permits SystemPayload.TaskCreated, SystemPayload.TaskStatusChanged {

    record TaskCreated() implements SystemPayload {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TaskStatusChanged(@JsonProperty("from") TaskStatus from, @JsonProperty("to") TaskStatus to)
            implements SystemPayload {}
}
