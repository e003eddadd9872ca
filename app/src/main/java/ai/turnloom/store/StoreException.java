package ai.turnloom.store;

/**
 * Failure reading or writing the conversation log store.
 */
public class StoreException extends Exception {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
