package ai.turnloom.orchestrator;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.turnloom.model.ConversationEntry;
import java.util.List;
import org.junit.jupiter.api.Test;

class EntryReconcilerTest {

    private static ConversationEntry user(String entryId, String text) {
        return ConversationEntry.userMessage(text, List.of()).withEntryId(entryId);
    }

    private final ConversationEntry a = user("e_1", "a");
    private final ConversationEntry b = user("e_2", "b");
    private final ConversationEntry c = user("e_3", "c");

    @Test
    void emptyLocalAdoptsSnapshot() {
        assertEquals(EntryReconciler.Decision.ADOPT, EntryReconciler.decide(List.of(), List.of(a)));
    }

    @Test
    void longerSnapshotReplacesLocal() {
        assertEquals(EntryReconciler.Decision.REPLACE, EntryReconciler.decide(List.of(a, b), List.of(a, b, c)));
    }

    @Test
    void localTailOfSnapshotIsReplaced() {
        assertEquals(EntryReconciler.Decision.REPLACE, EntryReconciler.decide(List.of(b, c), List.of(a, b, c)));
    }

    @Test
    void staleSnapshotKeepsLocal() {
        assertEquals(EntryReconciler.Decision.KEEP_LOCAL, EntryReconciler.decide(List.of(a, b, c), List.of(a, b)));
        assertEquals(EntryReconciler.Decision.KEEP_LOCAL, EntryReconciler.decide(List.of(a, b), List.of(a, b)));
    }

    @Test
    void optimisticEntryMatchesWrittenOne() {
        var optimistic = ConversationEntry.userMessage("c", List.of());
        assertEquals(
                EntryReconciler.Decision.KEEP_LOCAL, EntryReconciler.decide(List.of(a, optimistic), List.of(a)));
        assertEquals(
                EntryReconciler.Decision.KEEP_LOCAL,
                EntryReconciler.decide(List.of(a, b, optimistic), List.of(a, b, c)));
    }

    @Test
    void unrelatedListsDiverge() {
        var other = user("e_2", "something else");
        assertEquals(EntryReconciler.Decision.DIVERGED, EntryReconciler.decide(List.of(a, other), List.of(a, b)));
    }
}
