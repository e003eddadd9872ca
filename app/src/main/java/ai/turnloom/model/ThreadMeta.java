package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * Listing row for a thread. {@code turnStatus} and {@code lastTurnResult} are recomputed on every read.
 *
 * @param lastMessageSeq sequence of the newest user message, 0 when there is none
 */
public record ThreadMeta(
        @JsonProperty("thread") ThreadKey key,
        @JsonProperty("remote_thread_id") @Nullable String remoteThreadId,
        @JsonProperty("title") String title,
        @JsonProperty("created_at_unix_seconds") long createdAtUnixSeconds,
        @JsonProperty("updated_at_unix_seconds") long updatedAtUnixSeconds,
        @JsonProperty("task_status") TaskStatus taskStatus,
        @JsonProperty("last_message_seq") long lastMessageSeq,
        @JsonProperty("turn_status") TurnStatus turnStatus,
        @JsonProperty("last_turn_result") @Nullable TurnResult lastTurnResult) {}
