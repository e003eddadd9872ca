package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A prompt waiting behind the running turn of a thread.
 *
 * @param id per-thread identifier; monotonically increasing and never reused
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueuedPrompt(
        @JsonProperty("id") long id,
        @JsonProperty("text") String text,
        @JsonProperty("attachments") List<AttachmentRef> attachments,
        @JsonProperty("run_config") RunConfig runConfig) {

    public QueuedPrompt {
        if (id < 1) {
            throw new IllegalArgumentException("queued prompt id must be >= 1, got: " + id);
        }
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public QueuedPrompt withContent(String newText, List<AttachmentRef> newAttachments) {
        return new QueuedPrompt(id, newText, newAttachments, runConfig);
    }
}
