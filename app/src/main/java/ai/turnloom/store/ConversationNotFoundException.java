package ai.turnloom.store;

import ai.turnloom.model.ThreadKey;

/** Raised when an operation references a thread that was never created. */
public final class ConversationNotFoundException extends StoreException {
    private final ThreadKey key;

    public ConversationNotFoundException(ThreadKey key) {
        super("conversation not found: " + key);
        this.key = key;
    }

    public ThreadKey key() {
        return key;
    }
}
