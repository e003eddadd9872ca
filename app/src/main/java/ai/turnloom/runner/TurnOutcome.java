package ai.turnloom.runner;

/**
 * How a turn that did not fail ended.
 *
 * @param turnScopeId scope id the turn's item ids were qualified with
 * @param status whether the turn completed or was canceled
 * @param durationMs wall-clock duration recorded for the turn
 */
public record TurnOutcome(String turnScopeId, Status status, long durationMs) {

    public enum Status {
        COMPLETED,
        CANCELED
    }
}
