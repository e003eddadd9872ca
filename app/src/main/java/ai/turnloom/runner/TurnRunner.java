package ai.turnloom.runner;

import ai.turnloom.model.AgentItem;
import ai.turnloom.model.AgentPayload;
import ai.turnloom.model.AgentThreadEvent;
import ai.turnloom.model.AttachmentRef;
import ai.turnloom.model.ConversationEntry;
import ai.turnloom.model.ThreadKey;
import ai.turnloom.pool.AgentProcessPool;
import ai.turnloom.store.ConversationLogStore;
import ai.turnloom.store.StoreException;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Executes one agent turn end to end and records it in the conversation log.
 *
 * <p>Runners that reuse their process are driven through the {@link AgentProcessPool} and polled at a fixed
 * interval; every other runner gets a one-shot process per turn. Either way each vendor event is turn-scoped,
 * handed to the observer and, when it completes an item or ends the turn, appended to the log. A turn always ends
 * with exactly one duration entry, followed by a cancel or error entry when it did not succeed.
 */
public final class TurnRunner {
    private static final Logger logger = LogManager.getLogger(TurnRunner.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(20);
    public static final Duration DEFAULT_TURN_TIMEOUT = Duration.ofMinutes(10);
    static final String NO_FINAL_MESSAGE = "agent finished without a final message";

    private final ConversationLogStore store;
    private final AgentProcessPool pool;
    private final OneShotLauncher oneShotLauncher;
    private final AttachmentResolver attachmentResolver;
    private final List<Path> extraDirs;
    private final Duration pollInterval;
    private final Duration turnTimeout;

    public TurnRunner(
            ConversationLogStore store,
            AgentProcessPool pool,
            OneShotLauncher oneShotLauncher,
            AttachmentResolver attachmentResolver,
            List<Path> extraDirs,
            Duration pollInterval,
            Duration turnTimeout) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive, got: " + pollInterval);
        }
        if (turnTimeout.isNegative() || turnTimeout.isZero()) {
            throw new IllegalArgumentException("turnTimeout must be positive, got: " + turnTimeout);
        }
        this.store = store;
        this.pool = pool;
        this.oneShotLauncher = oneShotLauncher;
        this.attachmentResolver = attachmentResolver;
        this.extraDirs = List.copyOf(extraDirs);
        this.pollInterval = pollInterval;
        this.turnTimeout = turnTimeout;
    }

    /**
     * Run one turn. The user message is appended before the agent is contacted.
     *
     * @param cancel shared flag; once set the turn stops at the next poll and is recorded as canceled
     * @return how the turn ended when it completed or was canceled
     * @throws TurnFailedException if the turn failed; the failure is already in the log
     * @throws StoreException if the log could not be written
     */
    public TurnOutcome run(TurnRequest request, AtomicBoolean cancel, TurnObserver observer)
            throws TurnFailedException, StoreException {
        var key = request.key();
        var turn = new Turn(key, observer);
        var runner = request.runConfig().runner();
        logger.info(
                "Starting turn {} for {} (runner={}, model={})",
                turn.scopeId,
                key,
                runner,
                request.runConfig().modelId());

        store.ensureConversation(key);
        turn.append(ConversationEntry.userMessage(request.prompt(), request.attachments()));

        var resumeId = request.remoteThreadId() != null ? request.remoteThreadId() : store.getRemoteThreadId(key);
        var resolved = attachmentResolver.resolve(key, request.attachments());
        var prompt = PromptFormatter.format(request.prompt(), resolved);

        boolean interrupted = false;
        try {
            if (runner.reusesProcess()) {
                runPersistent(turn, request.workdir(), prompt, resumeId, cancel);
            } else {
                runOneShot(turn, request, prompt, resumeId, resolved, cancel);
            }
        } catch (InterruptedException e) {
            logger.info("Turn {} for {} interrupted; treating it as canceled", turn.scopeId, key);
            interrupted = true;
            cancel.set(true);
        }

        try {
            return finish(turn, cancel);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private TurnOutcome finish(Turn turn, AtomicBoolean cancel) throws TurnFailedException, StoreException {
        if (cancel.get()) {
            turn.recordDuration();
            turn.append(ConversationEntry.agent(new AgentPayload.TurnCanceled()));
            logger.info("Turn {} for {} canceled after {} ms", turn.scopeId, turn.key, turn.durationMs);
            return new TurnOutcome(turn.scopeId, TurnOutcome.Status.CANCELED, turn.durationMs);
        }
        if (turn.firstError != null) {
            throw new TurnFailedException(TurnFailedException.Reason.VENDOR_ERROR, turn.firstError);
        }
        if (!turn.sawAgentMessage) {
            throw turn.fail(TurnFailedException.Reason.NO_FINAL_MESSAGE, NO_FINAL_MESSAGE);
        }
        turn.recordDuration();
        logger.info("Turn {} for {} completed in {} ms", turn.scopeId, turn.key, turn.durationMs);
        return new TurnOutcome(turn.scopeId, TurnOutcome.Status.COMPLETED, turn.durationMs);
    }

    private void runPersistent(Turn turn, Path workdir, String prompt, @Nullable String resumeId, AtomicBoolean cancel)
            throws TurnFailedException, StoreException, InterruptedException {
        var key = turn.key;
        try {
            pool.ensure(key, workdir, resumeId, extraDirs);
            pool.send(key, prompt);
        } catch (AgentProcessPool.ProcessSpawnException e) {
            logger.error("Could not start agent process for {}", key, e);
            throw turn.fail(TurnFailedException.Reason.SPAWN_FAILED, "failed to start agent: " + e.getMessage());
        } catch (AgentProcessPool.ProcessNotFoundException e) {
            throw turn.fail(TurnFailedException.Reason.PROCESS_EXITED, e.getMessage());
        }

        long deadline = System.nanoTime() + turnTimeout.toNanos();
        while (true) {
            if (cancel.get()) {
                return;
            }
            var polled = pool.poll(key);
            for (var event : polled.events()) {
                turn.handle(event);
            }
            if (polled.turnCompleted() || (!polled.alive() && turn.firstError != null)) {
                return;
            }
            if (!polled.alive()) {
                throw turn.fail(
                        TurnFailedException.Reason.PROCESS_EXITED, "agent process exited before the turn completed");
            }
            if (System.nanoTime() - deadline > 0) {
                pool.shutdown(key);
                throw turn.fail(TurnFailedException.Reason.TIMEOUT, timeoutMessage());
            }
            Thread.sleep(pollInterval.toMillis());
        }
    }

    private void runOneShot(
            Turn turn,
            TurnRequest request,
            String prompt,
            @Nullable String resumeId,
            List<AttachmentResolver.ResolvedAttachment> resolved,
            AtomicBoolean cancel)
            throws TurnFailedException, StoreException, InterruptedException {
        var images = resolved.stream()
                .filter(a -> a.kind() == AttachmentRef.Kind.IMAGE)
                .map(AttachmentResolver.ResolvedAttachment::path)
                .toList();
        Process process;
        try {
            process = oneShotLauncher.launch(request, resumeId, images);
        } catch (IOException e) {
            logger.error("Could not start one-shot agent for {}", turn.key, e);
            throw turn.fail(TurnFailedException.Reason.SPAWN_FAILED, "failed to start agent: " + e.getMessage());
        }

        long deadline = System.nanoTime() + turnTimeout.toNanos();
        OneShotInvocation.Result result;
        try {
            result = OneShotInvocation.run(process, prompt, cancel, deadline, turn::handle);
        } catch (IOException e) {
            logger.error("Lost the one-shot agent stream for {}", turn.key, e);
            throw turn.fail(TurnFailedException.Reason.PROTOCOL_ERROR, "agent stream failed: " + e.getMessage());
        }

        if (cancel.get() || turn.firstError != null) {
            return;
        }
        if (result.timedOut()) {
            throw turn.fail(TurnFailedException.Reason.TIMEOUT, timeoutMessage());
        }
        if (result.exitCode() != 0) {
            throw turn.fail(TurnFailedException.Reason.PROCESS_EXITED, result.describeFailure());
        }
    }

    private String timeoutMessage() {
        return "turn timed out after " + turnTimeout.toSeconds() + " seconds";
    }

    /** Per-turn bookkeeping. Only touched by the thread running the turn. */
    private final class Turn {
        final ThreadKey key;
        final TurnObserver observer;
        final String scopeId = TurnScope.generate();
        final long startedNanos = System.nanoTime();
        final AtomicBoolean durationRecorded = new AtomicBoolean(false);
        final Set<String> appendedItemIds = new HashSet<>();
        long durationMs;
        boolean sawAgentMessage;
        int transientErrors;
        @Nullable String firstError;

        Turn(ThreadKey key, TurnObserver observer) {
            this.key = key;
            this.observer = observer;
        }

        void handle(AgentThreadEvent raw) throws StoreException {
            var event = TurnScope.qualify(scopeId, reclassify(raw));
            observer.onEvent(event);

            if (AgentThreadEvent.itemOf(event) instanceof AgentItem.AgentMessage) {
                sawAgentMessage = true;
            }

            if (event instanceof AgentThreadEvent.ThreadStarted started) {
                if (store.setRemoteThreadId(key, started.threadId())) {
                    logger.info("Thread {} is vendor thread {}", key, started.threadId());
                }
            } else if (event instanceof AgentThreadEvent.ItemCompleted completed) {
                var item = completed.item();
                if (appendedItemIds.add(item.id())) {
                    append(ConversationEntry.agent(AgentPayload.fromItem(item)));
                }
            } else if (event instanceof AgentThreadEvent.TurnCompleted done) {
                if (done.usage() != null) {
                    append(ConversationEntry.agent(new AgentPayload.TurnUsage(done.usage())));
                }
                recordDuration();
            } else if (event instanceof AgentThreadEvent.TurnFailed failed) {
                recordError(failed.error().message());
            } else if (event instanceof AgentThreadEvent.StreamError error) {
                recordError(error.message());
            }
        }

        private AgentThreadEvent reclassify(AgentThreadEvent event) {
            if (event instanceof AgentThreadEvent.StreamError error && ReconnectNotice.isTransient(error.message())) {
                transientErrors++;
                logger.debug("Transient reconnect notice for {}: {}", key, error.message());
                return new AgentThreadEvent.ItemCompleted(
                        new AgentItem.ErrorItem("transient-error-" + transientErrors, error.message()));
            }
            return event;
        }

        private void recordError(String message) throws StoreException {
            logger.error("Agent reported an error in turn {} for {}: {}", scopeId, key, message);
            if (firstError == null) {
                firstError = message;
            }
            recordDuration();
            append(ConversationEntry.agent(new AgentPayload.TurnError(message)));
        }

        /** Record the failure in the log and build the exception to throw. */
        TurnFailedException fail(TurnFailedException.Reason reason, String message) throws StoreException {
            logger.error("Turn {} for {} failed ({}): {}", scopeId, key, reason, message);
            recordDuration();
            append(ConversationEntry.agent(new AgentPayload.TurnError(message)));
            return new TurnFailedException(reason, message);
        }

        void recordDuration() throws StoreException {
            if (!durationRecorded.compareAndSet(false, true)) {
                return;
            }
            durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
            append(ConversationEntry.agent(new AgentPayload.TurnDuration(durationMs)));
            observer.onEvent(new AgentThreadEvent.TurnDuration(durationMs));
        }

        void append(ConversationEntry entry) throws StoreException {
            var written = store.appendEntries(key, List.of(entry));
            if (!written.isEmpty()) {
                observer.onEntriesAppended(written);
            }
        }
    }
}
