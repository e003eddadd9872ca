package ai.turnloom.runner;

import ai.turnloom.model.AgentThreadEvent;
import ai.turnloom.model.ConversationEntry;
import java.util.List;

/** Receives a turn's progress on the thread running the turn. */
public interface TurnObserver {

    /** A turn-scoped event, delivered before it is written to the log. */
    void onEvent(AgentThreadEvent event);

    /** Entries that were actually written to the log, with their assigned entry ids. */
    void onEntriesAppended(List<ConversationEntry> entries);

    static TurnObserver none() {
        return new TurnObserver() {
            @Override
            public void onEvent(AgentThreadEvent event) {}

            @Override
            public void onEntriesAppended(List<ConversationEntry> entries) {}
        };
    }
}
