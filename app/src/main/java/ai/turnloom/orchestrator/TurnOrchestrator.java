package ai.turnloom.orchestrator;

import ai.turnloom.model.AgentPayload;
import ai.turnloom.model.AgentThreadEvent;
import ai.turnloom.model.AttachmentRef;
import ai.turnloom.model.ConversationEntry;
import ai.turnloom.model.ConversationSnapshot;
import ai.turnloom.model.QueuedPrompt;
import ai.turnloom.model.RunConfig;
import ai.turnloom.model.ThreadKey;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Run and queue state of one thread.
 *
 * <p>Every transition is a method that mutates this object and returns the effects the owner has to carry out. At
 * most one run is active at a time; each run gets a fresh run id and any signal carrying an older id is ignored.
 * Prompts submitted while a turn runs join the tail of the queue and run in submission order. A failed or canceled
 * turn pauses the queue until {@link #resume()} is called.
 *
 * <p>Not thread-safe. The owner serializes all calls for a thread.
 */
public final class TurnOrchestrator {
    private static final Logger logger = LogManager.getLogger(TurnOrchestrator.class);

    private final ThreadKey key;
    private final LongSupplier clock;

    private final List<ConversationEntry> entries = new ArrayList<>();
    private long entriesStart;
    private @Nullable String remoteThreadId;

    private final List<QueuedPrompt> queue = new ArrayList<>();
    private boolean queuePaused;
    private long nextPromptId = 1;

    private @Nullable Long activeRunId;
    private @Nullable Long closingRunId;
    private long nextRunId = 1;
    private @Nullable Long runStartedAtUnixMs;
    private @Nullable Long runFinishedAtUnixMs;

    public TurnOrchestrator(ThreadKey key) {
        this(key, System::currentTimeMillis);
    }

    TurnOrchestrator(ThreadKey key, LongSupplier clock) {
        this.key = key;
        this.clock = clock;
    }

    /**
     * Rebuild the state of a thread from what the store holds. A run that was still in flight when the store was
     * last written did not survive the restart, so it is marked finished and the queue comes back paused.
     */
    public static TurnOrchestrator restore(ThreadKey key, ConversationSnapshot snapshot) {
        return restore(key, snapshot, System::currentTimeMillis);
    }

    static TurnOrchestrator restore(ThreadKey key, ConversationSnapshot snapshot, LongSupplier clock) {
        var orchestrator = new TurnOrchestrator(key, clock);
        orchestrator.entries.addAll(snapshot.entries());
        orchestrator.entriesStart = snapshot.entriesStart();
        orchestrator.remoteThreadId = snapshot.remoteThreadId();
        orchestrator.queue.addAll(snapshot.pendingPrompts());
        orchestrator.queuePaused = snapshot.queuePaused();
        orchestrator.runStartedAtUnixMs = snapshot.runStartedAtUnixMs();
        orchestrator.runFinishedAtUnixMs = snapshot.runFinishedAtUnixMs();
        long maxQueuedId = snapshot.pendingPrompts().stream()
                .mapToLong(QueuedPrompt::id)
                .max()
                .orElse(0);
        orchestrator.nextPromptId = Math.max(Math.max(1, snapshot.nextQueuedPromptId()), maxQueuedId + 1);
        if (snapshot.runInFlight()) {
            logger.warn("Thread {} had a run in flight when it was last saved; restoring it paused", key);
            orchestrator.queuePaused = true;
            orchestrator.runFinishedAtUnixMs = clock.getAsLong();
        }
        return orchestrator;
    }

    public ThreadKey key() {
        return key;
    }

    public ThreadRunState state() {
        if (activeRunId != null) {
            return new ThreadRunState.Running(activeRunId);
        }
        return queuePaused ? new ThreadRunState.QueuePaused() : new ThreadRunState.Idle();
    }

    public @Nullable Long activeRunId() {
        return activeRunId;
    }

    public boolean isCurrent(long runId) {
        return activeRunId != null && activeRunId == runId;
    }

    public List<QueuedPrompt> queued() {
        return List.copyOf(queue);
    }

    public boolean isQueuePaused() {
        return queuePaused;
    }

    public long nextQueuedPromptId() {
        return nextPromptId;
    }

    public List<ConversationEntry> entries() {
        return List.copyOf(entries);
    }

    /** Number of log entries that precede {@link #entries()}. */
    public long entriesStart() {
        return entriesStart;
    }

    public @Nullable String remoteThreadId() {
        return remoteThreadId;
    }

    public @Nullable Long runStartedAtUnixMs() {
        return runStartedAtUnixMs;
    }

    public @Nullable Long runFinishedAtUnixMs() {
        return runFinishedAtUnixMs;
    }

    /**
     * Submit a new prompt. While a turn runs it only joins the queue. Otherwise the pause is lifted and the oldest
     * waiting prompt starts, which is the new one only when nothing else was queued.
     */
    public List<OrchestratorEffect> submit(String text, List<AttachmentRef> attachments, RunConfig runConfig) {
        var prompt = new QueuedPrompt(nextPromptId++, text, attachments, runConfig);
        if (activeRunId != null) {
            queue.add(prompt);
            logger.debug("Queued prompt {} for {} behind run {}", prompt.id(), key, activeRunId);
            return List.of();
        }
        queuePaused = false;
        if (queue.isEmpty()) {
            return start(prompt);
        }
        queue.add(prompt);
        return startNext();
    }

    /**
     * Accept a vendor event of a run. Returns false, and changes nothing, when the run is not the active one.
     */
    public boolean onEvent(long runId, AgentThreadEvent event) {
        if (!isCurrent(runId)) {
            logger.debug("Dropping {} event of stale run {} for {}", event.getClass().getSimpleName(), runId, key);
            return false;
        }
        if (event instanceof AgentThreadEvent.ThreadStarted started && remoteThreadId == null) {
            remoteThreadId = started.threadId();
        }
        return true;
    }

    /**
     * Merge entries the store just wrote for a run into the local copy. A local entry that was added optimistically
     * and is the same as a written one is replaced by it, so it ends up with its assigned entry id. A written entry
     * without such a match goes in front of any optimistic entries still waiting at the tail.
     *
     * <p>A canceled run keeps writing its closing entries after it stopped being active; those are accepted until
     * {@link #onRunExited} is called for it.
     */
    public boolean onEntriesAppended(long runId, List<ConversationEntry> written) {
        if (!isCurrent(runId) && !isClosing(runId)) {
            logger.debug("Dropping {} entries of stale run {} for {}", written.size(), runId, key);
            return false;
        }
        written.forEach(this::merge);
        return true;
    }

    private void merge(ConversationEntry written) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            var local = entries.get(i);
            if (local.entryId().isEmpty() && local.isSameAs(written)) {
                entries.set(i, written);
                return;
            }
        }
        int insertAt = entries.size();
        while (insertAt > 0 && entries.get(insertAt - 1).entryId().isEmpty()) {
            insertAt--;
        }
        entries.add(insertAt, written);
    }

    private boolean isClosing(long runId) {
        return closingRunId != null && closingRunId == runId;
    }

    /** The runner of {@code runId} has returned; nothing more will be written for it. */
    public void onRunExited(long runId) {
        if (isClosing(runId)) {
            closingRunId = null;
        }
    }

    /** The active run finished normally; the next queued prompt starts unless the queue is paused. */
    public List<OrchestratorEffect> onTurnCompleted(long runId) {
        if (!isCurrent(runId)) {
            logger.debug("Ignoring completion of stale run {} for {}", runId, key);
            return List.of();
        }
        finishRun();
        return startNext();
    }

    /**
     * The active run failed. The queue is paused whether or not anything is waiting; the failure is added to the
     * local entries unless the runner already recorded it.
     */
    public List<OrchestratorEffect> onTurnFailed(long runId, String message) {
        if (!isCurrent(runId)) {
            logger.debug("Ignoring failure of stale run {} for {}", runId, key);
            return List.of();
        }
        finishRun();
        queuePaused = true;
        if (!endsWithError()) {
            entries.add(ConversationEntry.agent(new AgentPayload.TurnError(message)));
        }
        logger.info("Run {} for {} failed; {} queued prompt(s) paused", runId, key, queue.size());
        return List.of();
    }

    private boolean endsWithError() {
        if (entries.isEmpty()) {
            return false;
        }
        return entries.get(entries.size() - 1) instanceof ConversationEntry.AgentEvent agent
                && agent.event() instanceof AgentPayload.TurnError;
    }

    /** Cancel the active run. Does nothing unless {@code runId} is the active run. */
    public List<OrchestratorEffect> cancel(long runId) {
        if (!isCurrent(runId)) {
            logger.debug("Ignoring cancel of run {} for {}; active run is {}", runId, key, activeRunId);
            return List.of();
        }
        finishRun();
        closingRunId = runId;
        queuePaused = true;
        entries.add(ConversationEntry.agent(new AgentPayload.TurnCanceled()));
        logger.info("Canceled run {} for {}", runId, key);
        return List.of(new OrchestratorEffect.CancelTurn(runId));
    }

    /** Hold the queue after the current run without touching the run itself. */
    public void pause() {
        queuePaused = true;
    }

    /** Lift the pause and start the front of the queue if nothing is running. */
    public List<OrchestratorEffect> resume() {
        queuePaused = false;
        return startNext();
    }

    public boolean removeQueued(long promptId) {
        return queue.removeIf(p -> p.id() == promptId);
    }

    public boolean updateQueued(long promptId, String text, List<AttachmentRef> attachments) {
        for (int i = 0; i < queue.size(); i++) {
            if (queue.get(i).id() == promptId) {
                queue.set(i, queue.get(i).withContent(text, attachments));
                return true;
            }
        }
        return false;
    }

    /**
     * Move a queued prompt to {@code newIndex} (0 is the front).
     *
     * @return false if no prompt has that id
     * @throws IllegalArgumentException if the index is outside the queue
     */
    public boolean reorderQueued(long promptId, int newIndex) {
        if (newIndex < 0 || newIndex >= queue.size()) {
            throw new IllegalArgumentException("index " + newIndex + " outside queue of size " + queue.size());
        }
        for (int i = 0; i < queue.size(); i++) {
            if (queue.get(i).id() == promptId) {
                queue.add(newIndex, queue.remove(i));
                return true;
            }
        }
        return false;
    }

    /** @return the number of prompts removed */
    public int clearQueue() {
        int removed = queue.size();
        queue.clear();
        return removed;
    }

    /**
     * Reconcile the local entries against an authoritative snapshot of the log. The remote thread id is taken from
     * the snapshot only when none is known locally; the queue is left alone.
     */
    public EntryReconciler.Decision applySnapshot(ConversationSnapshot snapshot) {
        if (remoteThreadId == null) {
            remoteThreadId = snapshot.remoteThreadId();
        }
        var decision = EntryReconciler.decide(entries, snapshot.entries());
        switch (decision) {
            case ADOPT, REPLACE -> {
                entries.clear();
                entries.addAll(snapshot.entries());
                entriesStart = snapshot.entriesStart();
            }
            case KEEP_LOCAL -> logger.debug("Local entries of {} are at least as new as the snapshot", key);
            case DIVERGED -> logger.warn(
                    "Local entries of {} diverge from the stored log ({} local, {} stored); keeping local",
                    key,
                    entries.size(),
                    snapshot.entries().size());
        }
        return decision;
    }

    private List<OrchestratorEffect> startNext() {
        if (queuePaused || activeRunId != null || queue.isEmpty()) {
            return List.of();
        }
        return start(queue.remove(0));
    }

    private List<OrchestratorEffect> start(QueuedPrompt prompt) {
        long runId = nextRunId++;
        activeRunId = runId;
        runStartedAtUnixMs = clock.getAsLong();
        entries.add(ConversationEntry.userMessage(prompt.text(), prompt.attachments()));
        logger.debug("Starting run {} for {} with prompt {}", runId, key, prompt.id());
        return List.of(new OrchestratorEffect.StartTurn(runId, prompt));
    }

    private void finishRun() {
        activeRunId = null;
        runFinishedAtUnixMs = clock.getAsLong();
    }
}
