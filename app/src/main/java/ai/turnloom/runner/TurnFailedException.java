package ai.turnloom.runner;

/**
 * A turn ended without success. By the time this is thrown the failure has been written to the thread's log as a
 * turn error entry.
 */
public final class TurnFailedException extends Exception {

    public enum Reason {
        /** The turn ran past its wall-clock limit. */
        TIMEOUT,
        /** The vendor reported turn.failed or an error event. */
        VENDOR_ERROR,
        /** The vendor stream could not be used as expected. */
        PROTOCOL_ERROR,
        /** The vendor ended the turn without a top-level agent message. */
        NO_FINAL_MESSAGE,
        /** The agent process exited before the turn completed. */
        PROCESS_EXITED,
        /** The agent process could not be started or written to. */
        SPAWN_FAILED
    }

    private final Reason reason;

    public TurnFailedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TurnFailedException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
