package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

/** What a user entry records. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({@JsonSubTypes.Type(value = UserPayload.Message.class, name = "message")})
public sealed interface UserPayload permits UserPayload.Message {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(@JsonProperty("text") String text, @JsonProperty("attachments") List<AttachmentRef> attachments)
            implements UserPayload {
        public Message {
            attachments = attachments == null ? List.of() : List.copyOf(attachments);
        }
    }
}
