package ai.turnloom.orchestrator;

import ai.turnloom.model.ConversationEntry;
import java.util.List;

/**
 * Decides whether an authoritative log slice should replace an optimistic local copy.
 *
 * <p>One list "contains" another when the other is a prefix or a suffix of it, entry by entry under
 * {@link ConversationEntry#isSameAs}. The snapshot wins only when it contains the local list and the local list does
 * not contain it; in every other case the local list is kept.
 */
public final class EntryReconciler {

    public enum Decision {
        /** Local list was empty; take the snapshot as is. */
        ADOPT,
        /** Snapshot is strictly newer. */
        REPLACE,
        /** Local list is at least as new as the snapshot. */
        KEEP_LOCAL,
        /** Neither list contains the other. */
        DIVERGED
    }

    private EntryReconciler() {}

    public static Decision decide(List<ConversationEntry> local, List<ConversationEntry> snapshot) {
        if (local.isEmpty()) {
            return Decision.ADOPT;
        }
        boolean snapshotNewer = contains(snapshot, local);
        boolean localNewer = contains(local, snapshot);
        if (snapshotNewer && !localNewer) {
            return Decision.REPLACE;
        }
        if (localNewer) {
            return Decision.KEEP_LOCAL;
        }
        return Decision.DIVERGED;
    }

    static boolean contains(List<ConversationEntry> full, List<ConversationEntry> part) {
        return isPrefix(part, full) || isSuffix(part, full);
    }

    static boolean isPrefix(List<ConversationEntry> prefix, List<ConversationEntry> full) {
        if (prefix.size() > full.size()) {
            return false;
        }
        for (int i = 0; i < prefix.size(); i++) {
            if (!prefix.get(i).isSameAs(full.get(i))) {
                return false;
            }
        }
        return true;
    }

    static boolean isSuffix(List<ConversationEntry> suffix, List<ConversationEntry> full) {
        if (suffix.size() > full.size()) {
            return false;
        }
        int offset = full.size() - suffix.size();
        for (int i = 0; i < suffix.size(); i++) {
            if (!suffix.get(i).isSameAs(full.get(offset + i))) {
                return false;
            }
        }
        return true;
    }
}
