package ai.turnloom.orchestrator;

import ai.turnloom.model.TurnStatus;

/** Where a thread stands with respect to running turns. */
public sealed interface ThreadRunState {

    /** Nothing running; queued prompts, if any, start as soon as one is submitted or the thread is resumed. */
    record Idle() implements ThreadRunState {}

    /** A turn is in flight; only events carrying {@code runId} are accepted. */
    record Running(long runId) implements ThreadRunState {}

    /** The last turn failed or was canceled. Queued prompts wait for an explicit resume. */
    record QueuePaused() implements ThreadRunState {}

    default TurnStatus toTurnStatus(boolean queueEmpty) {
        if (this instanceof Running) {
            return TurnStatus.RUNNING;
        }
        if (queueEmpty) {
            return TurnStatus.IDLE;
        }
        return this instanceof QueuePaused ? TurnStatus.PAUSED : TurnStatus.AWAITING;
    }
}
