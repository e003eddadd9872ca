package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Authoritative view of one thread as read from the log store.
 *
 * @param title the thread title; never blank
 * @param remoteThreadId the vendor's conversation id, null until a turn reported one
 * @param entries the loaded slice of the log, ordered by sequence
 * @param entriesTotal total number of entries in the log
 * @param entriesStart number of entries preceding {@code entries}
 * @param nextQueuedPromptId the id the next queued prompt of this thread will receive
 */
public record ConversationSnapshot(
        @JsonProperty("title") String title,
        @JsonProperty("thread_id") @Nullable String remoteThreadId,
        @JsonProperty("task_status") TaskStatus taskStatus,
        @JsonProperty("run_config") @Nullable RunConfig runConfig,
        @JsonProperty("entries") List<ConversationEntry> entries,
        @JsonProperty("entries_total") long entriesTotal,
        @JsonProperty("entries_start") long entriesStart,
        @JsonProperty("pending_prompts") List<QueuedPrompt> pendingPrompts,
        @JsonProperty("queue_paused") boolean queuePaused,
        @JsonProperty("next_queued_prompt_id") long nextQueuedPromptId,
        @JsonProperty("run_started_at_unix_ms") @Nullable Long runStartedAtUnixMs,
        @JsonProperty("run_finished_at_unix_ms") @Nullable Long runFinishedAtUnixMs) {

    public ConversationSnapshot {
        entries = List.copyOf(entries);
        pendingPrompts = List.copyOf(pendingPrompts);
        if (entriesStart < 0 || entriesTotal < entriesStart + entries.size()) {
            throw new IllegalArgumentException("inconsistent slice: start=" + entriesStart + ", size="
                    + entries.size() + ", total=" + entriesTotal);
        }
    }

    /** True when the persisted timestamps describe a run that started and has not finished. */
    public boolean runInFlight() {
        return runStartedAtUnixMs != null
                && (runFinishedAtUnixMs == null || runFinishedAtUnixMs < runStartedAtUnixMs);
    }
}
