package ai.turnloom.orchestrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.turnloom.model.AgentPayload;
import ai.turnloom.model.AgentThreadEvent;
import ai.turnloom.model.ConversationEntry;
import ai.turnloom.model.ConversationSnapshot;
import ai.turnloom.model.QueuedPrompt;
import ai.turnloom.model.RunConfig;
import ai.turnloom.model.RunnerKind;
import ai.turnloom.model.TaskStatus;
import ai.turnloom.model.ThreadKey;
import ai.turnloom.model.TurnStatus;
import ai.turnloom.model.UserPayload;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class TurnOrchestratorTest {
    private static final ThreadKey KEY = new ThreadKey("proj", "ws", 1);
    private static final RunConfig CONFIG = RunConfig.of(RunnerKind.CODEX, "");

    private final AtomicLong now = new AtomicLong(1_000);
    private final TurnOrchestrator orchestrator = new TurnOrchestrator(KEY, now::get);

    private List<OrchestratorEffect> submit(String text) {
        return orchestrator.submit(text, List.of(), CONFIG);
    }

    private static OrchestratorEffect.StartTurn started(List<OrchestratorEffect> effects) {
        assertEquals(1, effects.size(), effects::toString);
        return assertInstanceOf(OrchestratorEffect.StartTurn.class, effects.get(0));
    }

    private static String text(ConversationEntry entry) {
        var user = assertInstanceOf(ConversationEntry.UserEvent.class, entry);
        return ((UserPayload.Message) user.event()).text();
    }

    @Test
    void promptsRunInSubmissionOrder() {
        var a = started(submit("A"));
        assertTrue(submit("B").isEmpty());
        assertTrue(submit("C").isEmpty());
        assertEquals(
                List.of("B", "C"),
                orchestrator.queued().stream().map(QueuedPrompt::text).toList());

        var b = started(orchestrator.onTurnCompleted(a.runId()));
        assertEquals("B", b.prompt().text());
        var c = started(orchestrator.onTurnCompleted(b.runId()));
        assertEquals("C", c.prompt().text());
        assertTrue(orchestrator.onTurnCompleted(c.runId()).isEmpty());

        assertInstanceOf(ThreadRunState.Idle.class, orchestrator.state());
        assertEquals(List.of("A", "B", "C"), orchestrator.entries().stream().map(TurnOrchestratorTest::text).toList());
        assertTrue(a.runId() < b.runId() && b.runId() < c.runId());
    }

    @Test
    void runStateTracksTimestamps() {
        var run = started(submit("A"));
        assertEquals(new ThreadRunState.Running(run.runId()), orchestrator.state());
        assertEquals(1_000L, orchestrator.runStartedAtUnixMs());

        now.set(5_000);
        orchestrator.onTurnCompleted(run.runId());

        assertEquals(5_000L, orchestrator.runFinishedAtUnixMs());
        assertNull(orchestrator.activeRunId());
    }

    @Test
    void signalsOfStaleRunsAreIgnored() {
        var first = started(submit("A"));
        orchestrator.onTurnCompleted(first.runId());
        var second = started(submit("B"));

        assertFalse(orchestrator.onEvent(first.runId(), new AgentThreadEvent.ThreadStarted("late")));
        assertNull(orchestrator.remoteThreadId());
        assertFalse(orchestrator.onEntriesAppended(
                first.runId(), List.of(ConversationEntry.agent(new AgentPayload.TurnCanceled()))));
        assertTrue(orchestrator.onTurnCompleted(first.runId()).isEmpty());
        assertTrue(orchestrator.onTurnFailed(first.runId(), "late failure").isEmpty());
        assertTrue(orchestrator.cancel(first.runId()).isEmpty());

        assertEquals(new ThreadRunState.Running(second.runId()), orchestrator.state());
        assertEquals(2, orchestrator.entries().size());
    }

    @Test
    void threadStartedSetsRemoteIdOnce() {
        var run = started(submit("A"));
        assertTrue(orchestrator.onEvent(run.runId(), new AgentThreadEvent.ThreadStarted("vendor-1")));
        assertTrue(orchestrator.onEvent(run.runId(), new AgentThreadEvent.ThreadStarted("vendor-2")));
        assertEquals("vendor-1", orchestrator.remoteThreadId());
    }

    @Test
    void failurePausesQueueUntilResumed() {
        var a = started(submit("A"));
        submit("B");

        assertTrue(orchestrator.onTurnFailed(a.runId(), "boom").isEmpty());

        assertInstanceOf(ThreadRunState.QueuePaused.class, orchestrator.state());
        assertEquals(TurnStatus.PAUSED, orchestrator.state().toTurnStatus(false));
        var last = orchestrator.entries().get(orchestrator.entries().size() - 1);
        assertEquals(ConversationEntry.agent(new AgentPayload.TurnError("boom")), last);

        var b = started(orchestrator.resume());
        assertEquals("B", b.prompt().text());
        assertFalse(orchestrator.isQueuePaused());
    }

    @Test
    void failureAlreadyRecordedIsNotDuplicated() {
        var a = started(submit("A"));
        var written = ConversationEntry.agent(new AgentPayload.TurnError("boom")).withEntryId("e_3");
        orchestrator.onEntriesAppended(a.runId(), List.of(written));

        orchestrator.onTurnFailed(a.runId(), "boom");

        assertEquals(
                1,
                orchestrator.entries().stream()
                        .filter(e -> e.kind().equals(ConversationEntry.KIND_TURN_ERROR))
                        .count());
    }

    @Test
    void failureWithEmptyQueueStillPauses() {
        var a = started(submit("A"));
        orchestrator.onTurnFailed(a.runId(), "boom");
        assertTrue(orchestrator.isQueuePaused());
        assertInstanceOf(ThreadRunState.QueuePaused.class, orchestrator.state());
        assertEquals(TurnStatus.IDLE, orchestrator.state().toTurnStatus(true));
    }

    @Test
    void cancelRequiresTheActiveRun() {
        var run = started(submit("A"));
        submit("B");

        assertTrue(orchestrator.cancel(run.runId() + 1).isEmpty());
        assertEquals(new ThreadRunState.Running(run.runId()), orchestrator.state());

        var effects = orchestrator.cancel(run.runId());

        assertEquals(List.of(new OrchestratorEffect.CancelTurn(run.runId())), effects);
        assertInstanceOf(ThreadRunState.QueuePaused.class, orchestrator.state());
        var last = orchestrator.entries().get(orchestrator.entries().size() - 1);
        assertEquals(ConversationEntry.agent(new AgentPayload.TurnCanceled()), last);
        assertEquals(1, orchestrator.queued().size());
    }

    @Test
    void canceledRunStillMergesItsClosingEntries() {
        var run = started(submit("A"));
        orchestrator.onEntriesAppended(
                run.runId(), List.of(ConversationEntry.userMessage("A", List.of()).withEntryId("e_2")));
        orchestrator.cancel(run.runId());

        var duration = ConversationEntry.agent(new AgentPayload.TurnDuration(40)).withEntryId("e_3");
        var canceled = ConversationEntry.agent(new AgentPayload.TurnCanceled()).withEntryId("e_4");
        assertTrue(orchestrator.onEntriesAppended(run.runId(), List.of(duration)));
        assertTrue(orchestrator.onEntriesAppended(run.runId(), List.of(canceled)));

        var entries = orchestrator.entries();
        assertEquals(List.of("e_2", "e_3", "e_4"), entries.stream().map(ConversationEntry::entryId).toList());

        orchestrator.onRunExited(run.runId());
        assertFalse(orchestrator.onEntriesAppended(
                run.runId(), List.of(ConversationEntry.agent(new AgentPayload.TurnError("late")))));
    }

    @Test
    void submitWhilePausedStartsFrontOfQueue() {
        var a = started(submit("A"));
        submit("B");
        orchestrator.onTurnFailed(a.runId(), "boom");

        var next = started(submit("C"));

        assertEquals("B", next.prompt().text());
        assertEquals(List.of("C"), orchestrator.queued().stream().map(QueuedPrompt::text).toList());
        assertFalse(orchestrator.isQueuePaused());
    }

    @Test
    void pauseHoldsQueueAfterCurrentRun() {
        var a = started(submit("A"));
        submit("B");
        orchestrator.pause();

        assertTrue(orchestrator.onTurnCompleted(a.runId()).isEmpty());
        assertInstanceOf(ThreadRunState.QueuePaused.class, orchestrator.state());
        assertEquals(1, orchestrator.queued().size());
    }

    @Test
    void queueEdits() {
        started(submit("A"));
        submit("B");
        submit("C");
        submit("D");
        var ids = orchestrator.queued().stream().map(QueuedPrompt::id).toList();

        assertTrue(orchestrator.updateQueued(ids.get(0), "B2", List.of()));
        assertTrue(orchestrator.reorderQueued(ids.get(2), 0));
        assertEquals(List.of("D", "B2", "C"), orchestrator.queued().stream().map(QueuedPrompt::text).toList());

        assertTrue(orchestrator.removeQueued(ids.get(1)));
        assertFalse(orchestrator.removeQueued(ids.get(1)));
        assertFalse(orchestrator.updateQueued(99, "x", List.of()));
        assertFalse(orchestrator.reorderQueued(99, 0));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.reorderQueued(ids.get(0), 2));

        assertEquals(2, orchestrator.clearQueue());
        assertTrue(orchestrator.queued().isEmpty());
    }

    @Test
    void queuedPromptIdsAreNeverReused() {
        started(submit("A"));
        submit("B");
        var removed = orchestrator.queued().get(0).id();
        orchestrator.removeQueued(removed);
        submit("C");
        assertTrue(orchestrator.queued().get(0).id() > removed);
    }

    @Test
    void optimisticEntriesAreReplacedByWrittenOnes() {
        var run = started(submit("A"));
        var written = ConversationEntry.userMessage("A", List.of()).withEntryId("e_2");
        var duration = ConversationEntry.agent(new AgentPayload.TurnDuration(12)).withEntryId("e_3");

        assertTrue(orchestrator.onEntriesAppended(run.runId(), List.of(written, duration)));

        assertEquals(List.of(written, duration), orchestrator.entries());
    }

    @Test
    void restoreOfInterruptedRunComesBackPaused() {
        var queued = new QueuedPrompt(4, "later", List.of(), CONFIG);
        var entries = List.<ConversationEntry>of(
                ConversationEntry.taskCreated("sys_1", 10),
                ConversationEntry.userMessage("A", List.of()).withEntryId("e_2"));
        var snapshot = new ConversationSnapshot(
                "Thread 1",
                "vendor-1",
                TaskStatus.ITERATING,
                CONFIG,
                entries,
                2,
                0,
                List.of(queued),
                false,
                3,
                500L,
                null);

        var restored = TurnOrchestrator.restore(KEY, snapshot, now::get);

        assertInstanceOf(ThreadRunState.QueuePaused.class, restored.state());
        assertEquals(1_000L, restored.runFinishedAtUnixMs());
        assertEquals(5, restored.nextQueuedPromptId());
        assertEquals("vendor-1", restored.remoteThreadId());
        assertEquals(entries, restored.entries());

        var resumed = started(restored.resume());
        assertEquals("later", resumed.prompt().text());
    }

    @Test
    void applySnapshotReconcilesEntries() {
        var run = started(submit("A"));
        orchestrator.onTurnCompleted(run.runId());

        var entries = List.<ConversationEntry>of(
                ConversationEntry.userMessage("A", List.of()).withEntryId("e_2"),
                ConversationEntry.agent(new AgentPayload.TurnDuration(5)).withEntryId("e_3"));
        var snapshot = new ConversationSnapshot(
                "A", "vendor-9", TaskStatus.ITERATING, CONFIG, entries, 3, 1, List.of(), false, 1, 1L, 2L);

        assertEquals(EntryReconciler.Decision.REPLACE, orchestrator.applySnapshot(snapshot));
        assertEquals(entries, orchestrator.entries());
        assertEquals(1, orchestrator.entriesStart());
        assertEquals("vendor-9", orchestrator.remoteThreadId());

        assertEquals(EntryReconciler.Decision.KEEP_LOCAL, orchestrator.applySnapshot(snapshot));
    }
}
