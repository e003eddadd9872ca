package ai.turnloom.orchestrator;

import ai.turnloom.model.QueuedPrompt;

/** Side effects a {@link TurnOrchestrator} transition asks its owner to carry out. */
public sealed interface OrchestratorEffect {

    /** Start a turn for {@code prompt}; every event and finish signal of that turn must carry {@code runId}. */
    record StartTurn(long runId, QueuedPrompt prompt) implements OrchestratorEffect {}

    /** Set the cancellation flag of the turn started under {@code runId}. */
    record CancelTurn(long runId) implements OrchestratorEffect {}
}
