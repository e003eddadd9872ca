package ai.turnloom;

import ai.turnloom.model.AgentThreadEvent;
import ai.turnloom.model.AttachmentRef;
import ai.turnloom.model.ConversationEntry;
import ai.turnloom.model.QueuedPrompt;
import ai.turnloom.model.RunConfig;
import ai.turnloom.model.ThreadKey;
import ai.turnloom.orchestrator.ConversationEventSink;
import ai.turnloom.orchestrator.EntryReconciler;
import ai.turnloom.orchestrator.OrchestratorEffect;
import ai.turnloom.orchestrator.ThreadRunState;
import ai.turnloom.orchestrator.TurnOrchestrator;
import ai.turnloom.pool.AgentProcessPool;
import ai.turnloom.pool.StreamJsonProcessLauncher;
import ai.turnloom.runner.AttachmentResolver;
import ai.turnloom.runner.CodexOneShotLauncher;
import ai.turnloom.runner.TurnFailedException;
import ai.turnloom.runner.TurnObserver;
import ai.turnloom.runner.TurnOutcome;
import ai.turnloom.runner.TurnRequest;
import ai.turnloom.runner.TurnRunner;
import ai.turnloom.store.ConversationLogStore;
import ai.turnloom.store.StoreException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs agent turns for any number of threads.
 *
 * <p>Each thread has a {@link TurnOrchestrator} guarded by its own monitor. Transitions are applied under that
 * monitor, the resulting queue state is written to the store, and the requested effects are carried out: turns are
 * executed on a shared worker pool, at most one per thread, and different threads run in parallel. Every event and
 * log write is forwarded to the registered {@link ConversationEventSink}s.
 */
public final class TurnEngine implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TurnEngine.class);

    private final ConversationLogStore store;
    private final AgentProcessPool pool;
    private final TurnRunner runner;
    private final WorktreeLocator worktrees;
    private final RunConfig defaultRunConfig;
    private final Duration idleTimeout;
    private final Duration evictionInterval;

    private final ConversationEventSink.FanOut sinks = new ConversationEventSink.FanOut();
    private final Map<ThreadKey, ThreadSlot> threads = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final ExecutorService turnExecutor = Executors.newCachedThreadPool(r -> {
        var t = new Thread(r, "TurnEngine-Turn");
        t.setDaemon(true);
        return t;
    });

    private final ScheduledExecutorService evictionScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        var t = new Thread(r, "TurnEngine-IdleEvictor");
        t.setDaemon(true);
        return t;
    });

    /** Per-thread state; every field is guarded by the slot's monitor. */
    private static final class ThreadSlot {
        final TurnOrchestrator orchestrator;
        final Map<Long, AtomicBoolean> cancelFlags = new HashMap<>();
        int turnsInFlight;

        ThreadSlot(TurnOrchestrator orchestrator) {
            this.orchestrator = orchestrator;
        }
    }

    public TurnEngine(
            ConversationLogStore store,
            AgentProcessPool pool,
            TurnRunner runner,
            WorktreeLocator worktrees,
            RunConfig defaultRunConfig,
            Duration idleTimeout,
            Duration evictionInterval) {
        this.store = store;
        this.pool = pool;
        this.runner = runner;
        this.worktrees = worktrees;
        this.defaultRunConfig = defaultRunConfig;
        this.idleTimeout = idleTimeout;
        this.evictionInterval = evictionInterval;
    }

    /** Open the store and build the production process pool and runner described by {@code config}. */
    public static TurnEngine create(EngineConfig config, WorktreeLocator worktrees, AttachmentResolver attachments)
            throws StoreException {
        var store = ConversationLogStore.open(config.dbPath());
        var pool = new AgentProcessPool(new StreamJsonProcessLauncher(config.agentBinary()));
        var runner = new TurnRunner(
                store,
                pool,
                new CodexOneShotLauncher(config.oneShotBinary()),
                attachments,
                config.extraDirs(),
                config.pollInterval(),
                config.turnTimeout());
        return new TurnEngine(
                store,
                pool,
                runner,
                worktrees,
                RunConfig.of(config.defaultRunner(), ""),
                config.idleTimeout(),
                config.evictionInterval());
    }

    /** Begin evicting idle agent processes in the background. */
    public void start() {
        evictionScheduler.scheduleAtFixedRate(
                () -> {
                    try {
                        var evicted = pool.evictIdle(idleTimeout);
                        if (evicted > 0) {
                            logger.info("Idle eviction cycle evicted {} agent process(es)", evicted);
                        }
                    } catch (Exception e) {
                        logger.warn("Error during idle eviction cycle", e);
                    }
                },
                evictionInterval.toMillis(),
                evictionInterval.toMillis(),
                TimeUnit.MILLISECONDS);
        logger.info("TurnEngine started (store={}, idleTimeout={})", store.dbFile(), idleTimeout);
    }

    public ConversationLogStore store() {
        return store;
    }

    public void addSink(ConversationEventSink sink) {
        sinks.add(sink);
    }

    public boolean removeSink(ConversationEventSink sink) {
        return sinks.remove(sink);
    }

    /**
     * Submit a prompt using the run configuration last saved for the thread, or the engine default.
     */
    public void submit(ThreadKey key, String text, List<AttachmentRef> attachments) throws StoreException {
        slot(key);
        var snapshot = store.loadConversation(key);
        var config = snapshot.runConfig() != null ? snapshot.runConfig() : defaultRunConfig;
        submit(key, text, attachments, config);
    }

    public void submit(ThreadKey key, String text, List<AttachmentRef> attachments, RunConfig runConfig)
            throws StoreException {
        checkOpen();
        var slot = slot(key);
        store.saveRunConfig(key, runConfig);
        transition(key, slot, o -> o.submit(text, attachments, runConfig));
    }

    /**
     * Cancel the running turn of a thread, if any.
     *
     * @return whether a turn was running
     */
    public boolean cancel(ThreadKey key) throws StoreException {
        var slot = slot(key);
        synchronized (slot) {
            var runId = slot.orchestrator.activeRunId();
            if (runId == null) {
                return false;
            }
            transition(key, slot, o -> o.cancel(runId));
            return true;
        }
    }

    public void resume(ThreadKey key) throws StoreException {
        checkOpen();
        transition(key, slot(key), TurnOrchestrator::resume);
    }

    public boolean removeQueued(ThreadKey key, long promptId) throws StoreException {
        return edit(key, o -> o.removeQueued(promptId));
    }

    public boolean updateQueued(ThreadKey key, long promptId, String text, List<AttachmentRef> attachments)
            throws StoreException {
        return edit(key, o -> o.updateQueued(promptId, text, attachments));
    }

    public boolean reorderQueued(ThreadKey key, long promptId, int newIndex) throws StoreException {
        return edit(key, o -> o.reorderQueued(promptId, newIndex));
    }

    public int clearQueue(ThreadKey key) throws StoreException {
        var slot = slot(key);
        synchronized (slot) {
            int removed = slot.orchestrator.clearQueue();
            persist(key, slot);
            notifyState(key, slot);
            return removed;
        }
    }

    /** Reload the thread from the store and reconcile it with the local copy. */
    public EntryReconciler.Decision reload(ThreadKey key) throws StoreException {
        var slot = slot(key);
        var snapshot = store.loadConversation(key);
        synchronized (slot) {
            return slot.orchestrator.applySnapshot(snapshot);
        }
    }

    public ThreadRunState state(ThreadKey key) throws StoreException {
        var slot = slot(key);
        synchronized (slot) {
            return slot.orchestrator.state();
        }
    }

    public List<QueuedPrompt> queued(ThreadKey key) throws StoreException {
        var slot = slot(key);
        synchronized (slot) {
            return slot.orchestrator.queued();
        }
    }

    /** The local, possibly optimistic, copy of the thread's entries. */
    public List<ConversationEntry> entries(ThreadKey key) throws StoreException {
        var slot = slot(key);
        synchronized (slot) {
            return slot.orchestrator.entries();
        }
    }

    /**
     * Wait until the thread has no active run and no turn still executing.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(ThreadKey key, Duration timeout) throws StoreException, InterruptedException {
        var slot = slot(key);
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (slot) {
            while (slot.orchestrator.activeRunId() != null || slot.turnsInFlight > 0) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                slot.wait(remainingMs);
            }
            return true;
        }
    }

    /** Stop the thread's warm agent process, for example when its tab is closed. */
    public boolean closeThread(ThreadKey key) {
        return pool.shutdown(key);
    }

    /**
     * Cancel the workspace's running turns, stop its agent processes and delete its threads from the store.
     *
     * @return the number of threads deleted from the store
     */
    public int deleteWorkspace(String project, String workspace) throws StoreException {
        for (var key : List.copyOf(threads.keySet())) {
            if (key.belongsTo(project, workspace)) {
                cancel(key);
                threads.remove(key);
            }
        }
        int stopped = pool.shutdownAllFor(project, workspace);
        int deleted = store.deleteWorkspace(project, workspace);
        logger.info(
                "Deleted workspace {}/{} ({} thread(s), {} agent process(es))", project, workspace, deleted, stopped);
        return deleted;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            evictionScheduler.shutdownNow();
        } catch (Exception e) {
            logger.warn("Error shutting down eviction scheduler", e);
        }
        for (var entry : threads.entrySet()) {
            var slot = entry.getValue();
            synchronized (slot) {
                if (slot.orchestrator.activeRunId() != null) {
                    slot.orchestrator.pause();
                    try {
                        persist(entry.getKey(), slot);
                    } catch (StoreException e) {
                        logger.warn("Could not save queue state of {} on shutdown", entry.getKey(), e);
                    }
                }
                slot.cancelFlags.values().forEach(flag -> flag.set(true));
            }
        }
        turnExecutor.shutdown();
        try {
            if (!turnExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Turns still running after 10 seconds; interrupting them");
                turnExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            turnExecutor.shutdownNow();
        }
        pool.shutdownAll();
        store.close();
        logger.info("TurnEngine stopped");
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("TurnEngine is closed");
        }
    }

    private ThreadSlot slot(ThreadKey key) throws StoreException {
        var existing = threads.get(key);
        if (existing != null) {
            return existing;
        }
        store.ensureConversation(key);
        var snapshot = store.loadConversation(key);
        var restored = new ThreadSlot(TurnOrchestrator.restore(key, snapshot));
        var winner = threads.putIfAbsent(key, restored);
        if (winner != null) {
            return winner;
        }
        if (snapshot.runInFlight()) {
            synchronized (restored) {
                persist(key, restored);
            }
        }
        return restored;
    }

    private boolean edit(ThreadKey key, Function<TurnOrchestrator, Boolean> change) throws StoreException {
        var slot = slot(key);
        synchronized (slot) {
            boolean changed = change.apply(slot.orchestrator);
            if (changed) {
                persist(key, slot);
                notifyState(key, slot);
            }
            return changed;
        }
    }

    private void transition(
            ThreadKey key, ThreadSlot slot, Function<TurnOrchestrator, List<OrchestratorEffect>> change)
            throws StoreException {
        synchronized (slot) {
            var effects = change.apply(slot.orchestrator);
            persist(key, slot);
            for (var effect : effects) {
                apply(key, slot, effect);
            }
            notifyState(key, slot);
            slot.notifyAll();
        }
    }

    private void persist(ThreadKey key, ThreadSlot slot) throws StoreException {
        var o = slot.orchestrator;
        store.saveQueueState(key, o.isQueuePaused(), o.runStartedAtUnixMs(), o.runFinishedAtUnixMs(), o.queued());
    }

    private void notifyState(ThreadKey key, ThreadSlot slot) {
        sinks.onRunStateChanged(key, slot.orchestrator.state(), slot.orchestrator.queued().size());
    }

    private void apply(ThreadKey key, ThreadSlot slot, OrchestratorEffect effect) {
        if (effect instanceof OrchestratorEffect.StartTurn start) {
            if (closed.get()) {
                logger.warn("Engine is closing; run {} for {} was not started", start.runId(), key);
                return;
            }
            var cancel = new AtomicBoolean(false);
            slot.cancelFlags.put(start.runId(), cancel);
            slot.turnsInFlight++;
            turnExecutor.execute(() -> executeTurn(key, slot, start.runId(), start.prompt(), cancel));
        } else if (effect instanceof OrchestratorEffect.CancelTurn cancelTurn) {
            var flag = slot.cancelFlags.get(cancelTurn.runId());
            if (flag != null) {
                flag.set(true);
            }
        }
    }

    private void executeTurn(ThreadKey key, ThreadSlot slot, long runId, QueuedPrompt prompt, AtomicBoolean cancel) {
        var observer = new TurnObserver() {
            @Override
            public void onEvent(AgentThreadEvent event) {
                boolean current;
                synchronized (slot) {
                    current = slot.orchestrator.onEvent(runId, event);
                }
                if (current) {
                    sinks.onAgentEvent(key, event);
                }
            }

            @Override
            public void onEntriesAppended(List<ConversationEntry> entries) {
                synchronized (slot) {
                    slot.orchestrator.onEntriesAppended(runId, entries);
                }
                sinks.onEntriesAppended(key, entries);
            }
        };

        try {
            var request = new TurnRequest(
                    key, prompt.runConfig(), prompt.text(), prompt.attachments(), worktrees.worktreeFor(key), null);
            var outcome = runner.run(request, cancel, observer);
            if (outcome.status() == TurnOutcome.Status.COMPLETED) {
                transition(key, slot, o -> o.onTurnCompleted(runId));
            } else {
                transition(key, slot, o -> o.cancel(runId));
            }
        } catch (TurnFailedException e) {
            fail(key, slot, runId, e.getMessage());
        } catch (StoreException e) {
            logger.error("Conversation log failed during run {} for {}", runId, key, e);
            fail(key, slot, runId, "conversation log unavailable: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected failure in run {} for {}", runId, key, e);
            fail(key, slot, runId, "internal error: " + e.getMessage());
        } finally {
            synchronized (slot) {
                slot.orchestrator.onRunExited(runId);
                slot.cancelFlags.remove(runId);
                slot.turnsInFlight--;
                slot.notifyAll();
            }
        }
    }

    private void fail(ThreadKey key, ThreadSlot slot, long runId, @Nullable String message) {
        try {
            transition(key, slot, o -> o.onTurnFailed(runId, message != null ? message : "turn failed"));
        } catch (StoreException e) {
            logger.error("Could not save queue state of {} after run {} failed", key, runId, e);
        }
    }
}
