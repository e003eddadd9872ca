package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/**
 * Reference to an attachment blob owned by an external collaborator. The engine never reads the bytes itself.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AttachmentRef(
        @JsonProperty("id") String id,
        @JsonProperty("kind") Kind kind,
        @JsonProperty("name") String name,
        @JsonProperty("extension") String extension,
        @JsonProperty("mime") @Nullable String mime,
        @JsonProperty("byte_len") long byteLen) {

    public enum Kind {
        IMAGE,
        TEXT,
        FILE;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public AttachmentRef {
        if (id.isBlank()) {
            throw new IllegalArgumentException("attachment id must not be blank");
        }
        if (byteLen < 0) {
            throw new IllegalArgumentException("byteLen must be non-negative, got: " + byteLen);
        }
    }
}
