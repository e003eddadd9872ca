package ai.turnloom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.turnloom.model.AgentPayload;
import ai.turnloom.model.AgentThreadEvent;
import ai.turnloom.model.ConversationEntry;
import ai.turnloom.model.QueuedPrompt;
import ai.turnloom.model.RunConfig;
import ai.turnloom.model.RunnerKind;
import ai.turnloom.model.ThreadKey;
import ai.turnloom.model.UserPayload;
import ai.turnloom.orchestrator.ConversationEventSink;
import ai.turnloom.orchestrator.EntryReconciler;
import ai.turnloom.orchestrator.ThreadRunState;
import ai.turnloom.pool.AgentProcessPool;
import ai.turnloom.runner.AttachmentResolver;
import ai.turnloom.runner.OneShotLauncher;
import ai.turnloom.runner.TurnRunner;
import ai.turnloom.store.ConversationLogStore;
import ai.turnloom.testutil.FakeAgentScripts;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TurnEngineTest {
    private static final ThreadKey KEY = new ThreadKey("proj", "ws", 1);
    private static final Duration TIMEOUT = Duration.ofSeconds(15);
    private static final RunConfig CLAUDE = RunConfig.of(RunnerKind.CLAUDE, "");
    private static final RunConfig CODEX = RunConfig.of(RunnerKind.CODEX, "");

    @TempDir
    Path tempDir;

    private TurnEngine engine;
    private final RecordingSink sink = new RecordingSink();

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private static final class RecordingSink implements ConversationEventSink {
        final List<AgentThreadEvent> events = new CopyOnWriteArrayList<>();
        final List<ConversationEntry> entries = new CopyOnWriteArrayList<>();
        final List<ThreadRunState> states = new CopyOnWriteArrayList<>();

        @Override
        public void onAgentEvent(ThreadKey key, AgentThreadEvent event) {
            events.add(event);
        }

        @Override
        public void onEntriesAppended(ThreadKey key, List<ConversationEntry> appended) {
            entries.addAll(appended);
        }

        @Override
        public void onRunStateChanged(ThreadKey key, ThreadRunState state, int queuedPrompts) {
            states.add(state);
        }
    }

    private TurnEngine engine(String persistentScript, String oneShotScript) throws Exception {
        var persistent = FakeAgentScripts.write(tempDir, "persistent.sh", persistentScript);
        var oneShot = FakeAgentScripts.write(tempDir, "oneshot.sh", oneShotScript);
        var store = ConversationLogStore.open(tempDir.resolve("turnloom.db"));
        var pool = new AgentProcessPool(FakeAgentScripts.shLauncher(persistent, new ArrayList<>()));
        OneShotLauncher launcher = (request, resumeId, images) -> new ProcessBuilder("/bin/sh", oneShot.toString())
                .directory(request.workdir().toFile())
                .start();
        var runner = new TurnRunner(
                store, pool, launcher, AttachmentResolver.none(), List.of(), Duration.ofMillis(10), TIMEOUT);
        engine = new TurnEngine(
                store,
                pool,
                runner,
                WorktreeLocator.fixed(tempDir),
                CLAUDE,
                Duration.ofMinutes(30),
                Duration.ofMinutes(1));
        engine.addSink(sink);
        return engine;
    }

    private List<String> storedUserMessages() throws Exception {
        return engine.store().loadConversation(KEY).entries().stream()
                .filter(e -> e instanceof ConversationEntry.UserEvent)
                .map(e -> ((UserPayload.Message) ((ConversationEntry.UserEvent) e).event()).text())
                .toList();
    }

    private List<String> storedAgentMessages() throws Exception {
        return engine.store().loadConversation(KEY).entries().stream()
                .filter(e -> e instanceof ConversationEntry.AgentEvent agent
                        && agent.event() instanceof AgentPayload.Message)
                .map(e -> ((AgentPayload.Message) ((ConversationEntry.AgentEvent) e).event()).text())
                .toList();
    }

    private ConversationEntry lastStored() throws Exception {
        var entries = engine.store().loadConversation(KEY).entries();
        return entries.get(entries.size() - 1);
    }

    @Test
    void queuedPromptsRunInOrder() throws Exception {
        engine(FakeAgentScripts.ECHOING_STREAM_AGENT, "exit 1");

        engine.submit(KEY, "A", List.of(), CLAUDE);
        engine.submit(KEY, "B", List.of(), CLAUDE);
        engine.submit(KEY, "C", List.of(), CLAUDE);

        assertTrue(engine.awaitIdle(KEY, TIMEOUT));
        assertEquals(List.of("A", "B", "C"), storedUserMessages());
        assertInstanceOf(ThreadRunState.Idle.class, engine.state(KEY));
        assertTrue(engine.queued(KEY).isEmpty());
        assertEquals(
                3,
                sink.events.stream()
                        .filter(e -> e instanceof AgentThreadEvent.TurnCompleted)
                        .count());
        assertEquals("sess-1", engine.store().getRemoteThreadId(KEY));
        assertFalse(engine.entries(KEY).stream().anyMatch(e -> e.entryId().isEmpty()));
        assertInstanceOf(ThreadRunState.Idle.class, sink.states.get(sink.states.size() - 1));
    }

    @Test
    void submitWithoutConfigUsesSavedOne() throws Exception {
        engine(FakeAgentScripts.ECHOING_STREAM_AGENT, """
                cat > /dev/null
                echo '{"type":"item.completed","item":{"type":"agent_message","id":"m","text":"from codex"}}'
                echo '{"type":"turn.completed"}'
                """);

        engine.submit(KEY, "first", List.of(), CODEX);
        assertTrue(engine.awaitIdle(KEY, TIMEOUT));
        engine.submit(KEY, "second", List.of());
        assertTrue(engine.awaitIdle(KEY, TIMEOUT));

        assertEquals(CODEX, engine.store().loadConversation(KEY).runConfig());
        var texts = engine.store().loadConversation(KEY).entries().stream()
                .filter(e -> e instanceof ConversationEntry.AgentEvent agent
                        && agent.event() instanceof AgentPayload.Message)
                .map(e -> ((AgentPayload.Message) ((ConversationEntry.AgentEvent) e).event()).text())
                .toList();
        assertEquals(List.of("from codex", "from codex"), texts);
    }

    @Test
    void failurePausesQueueUntilResumed() throws Exception {
        engine(FakeAgentScripts.ECHOING_STREAM_AGENT, """
                cat > /dev/null
                sleep 0.3
                echo '{"type":"turn.failed","error":{"message":"quota exceeded"}}'
                exit 1
                """);

        engine.submit(KEY, "A", List.of(), CODEX);
        engine.submit(KEY, "B", List.of(), CODEX);
        assertTrue(engine.awaitIdle(KEY, TIMEOUT));

        assertInstanceOf(ThreadRunState.QueuePaused.class, engine.state(KEY));
        assertEquals(List.of("B"), engine.queued(KEY).stream().map(QueuedPrompt::text).toList());
        assertEquals(List.of("A"), storedUserMessages());
        assertEquals(new AgentPayload.TurnError("quota exceeded"), ((ConversationEntry.AgentEvent) lastStored()).event());

        engine.resume(KEY);
        assertTrue(engine.awaitIdle(KEY, TIMEOUT));

        assertEquals(List.of("A", "B"), storedUserMessages());
        assertTrue(engine.queued(KEY).isEmpty());
        assertInstanceOf(ThreadRunState.QueuePaused.class, engine.state(KEY));
    }

    @Test
    void cancelStopsRunningTurn() throws Exception {
        engine(FakeAgentScripts.ECHOING_STREAM_AGENT, """
                cat > /dev/null
                echo '{"type":"thread.started","thread_id":"th-1"}'
                exec sleep 30
                """);
        assertFalse(engine.cancel(KEY));

        engine.submit(KEY, "long job", List.of(), CODEX);
        FakeAgentScripts.await(
                () -> sink.events.contains(new AgentThreadEvent.ThreadStarted("th-1")), TIMEOUT, "the turn to start");

        assertTrue(engine.cancel(KEY));
        assertTrue(engine.awaitIdle(KEY, TIMEOUT));

        assertInstanceOf(ThreadRunState.QueuePaused.class, engine.state(KEY));
        assertEquals(new AgentPayload.TurnCanceled(), ((ConversationEntry.AgentEvent) lastStored()).event());
    }

    @Test
    void promptAfterCancelIsNotAnsweredWithTheCanceledReply() throws Exception {
        engine(FakeAgentScripts.SLOW_FIRST_REPLY_STREAM_AGENT, "exit 1");

        engine.submit(KEY, "A", List.of(), CLAUDE);
        FakeAgentScripts.await(
                () -> sink.events.contains(new AgentThreadEvent.ThreadStarted("sess-1")),
                TIMEOUT,
                "the agent to pick up the first prompt");
        assertTrue(engine.cancel(KEY));
        assertTrue(engine.awaitIdle(KEY, TIMEOUT));

        engine.submit(KEY, "B", List.of(), CLAUDE);
        assertTrue(engine.awaitIdle(KEY, TIMEOUT));

        assertEquals(List.of("reply 2"), storedAgentMessages());
        assertEquals(List.of("A", "B"), storedUserMessages());
        assertInstanceOf(ThreadRunState.Idle.class, engine.state(KEY));
    }

    @Test
    void localEntriesMatchTheLogAfterCancel() throws Exception {
        engine(FakeAgentScripts.ECHOING_STREAM_AGENT, """
                cat > /dev/null
                echo '{"type":"thread.started","thread_id":"th-1"}'
                exec sleep 30
                """);

        engine.submit(KEY, "long job", List.of(), CODEX);
        FakeAgentScripts.await(
                () -> sink.events.contains(new AgentThreadEvent.ThreadStarted("th-1")), TIMEOUT, "the turn to start");
        assertTrue(engine.cancel(KEY));
        assertTrue(engine.awaitIdle(KEY, TIMEOUT));

        assertEquals(EntryReconciler.Decision.KEEP_LOCAL, engine.reload(KEY));
        var stored = engine.store().loadConversation(KEY).entries();
        assertEquals(
                stored.stream().map(ConversationEntry::entryId).toList(),
                engine.entries(KEY).stream().map(ConversationEntry::entryId).toList());
        assertEquals(new AgentPayload.TurnCanceled(), ((ConversationEntry.AgentEvent) lastStored()).event());
        assertFalse(engine.entries(KEY).stream().anyMatch(e -> e.entryId().isEmpty()));
    }

    @Test
    void interruptedRunIsRestoredPaused() throws Exception {
        var dbFile = tempDir.resolve("turnloom.db");
        try (var store = ConversationLogStore.open(dbFile)) {
            store.ensureConversation(KEY);
            store.saveQueueState(KEY, false, 500L, null, List.of(new QueuedPrompt(1, "waiting", List.of(), CLAUDE)));
        }
        engine(FakeAgentScripts.ECHOING_STREAM_AGENT, "exit 1");

        assertInstanceOf(ThreadRunState.QueuePaused.class, engine.state(KEY));
        assertEquals(List.of("waiting"), engine.queued(KEY).stream().map(QueuedPrompt::text).toList());
        assertTrue(engine.store().loadConversation(KEY).queuePaused());
        assertFalse(engine.store().loadConversation(KEY).runInFlight());
    }

    @Test
    void queueEditsArePersisted() throws Exception {
        engine(FakeAgentScripts.SILENT_STREAM_AGENT, "exit 1");
        engine.submit(KEY, "A", List.of(), CLAUDE);
        engine.submit(KEY, "B", List.of(), CLAUDE);
        engine.submit(KEY, "C", List.of(), CLAUDE);
        var ids = engine.queued(KEY).stream().map(QueuedPrompt::id).toList();

        assertTrue(engine.reorderQueued(KEY, ids.get(1), 0));
        assertTrue(engine.updateQueued(KEY, ids.get(0), "B2", List.of()));

        var stored = engine.store().loadConversation(KEY).pendingPrompts();
        assertEquals(List.of("C", "B2"), stored.stream().map(QueuedPrompt::text).toList());

        assertTrue(engine.removeQueued(KEY, ids.get(1)));
        assertEquals(1, engine.clearQueue(KEY));
        assertTrue(engine.store().loadConversation(KEY).pendingPrompts().isEmpty());
    }

    @Test
    void closedEngineRejectsSubmissions() throws Exception {
        engine(FakeAgentScripts.ECHOING_STREAM_AGENT, "exit 1");
        engine.close();
        assertThrows(IllegalStateException.class, () -> engine.submit(KEY, "late", List.of(), CLAUDE));
    }
}
