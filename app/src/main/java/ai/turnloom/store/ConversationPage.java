package ai.turnloom.store;

import ai.turnloom.model.ConversationEntry;
import java.util.List;

/**
 * A slice of a thread's log.
 *
 * @param entries the entries of the slice, oldest first
 * @param total the number of entries in the whole log
 * @param start the number of entries preceding the slice; the first entry of the slice has sequence {@code start + 1}
 */
public record ConversationPage(List<ConversationEntry> entries, long total, long start) {

    public ConversationPage {
        entries = List.copyOf(entries);
    }

    /** Whether older entries exist before this slice. */
    public boolean hasOlder() {
        return start > 0;
    }
}
