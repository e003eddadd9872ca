package ai.turnloom.pool;

import ai.turnloom.model.AgentThreadEvent;
import ai.turnloom.model.ThreadKey;
import ai.turnloom.util.Json;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Keeps at most one persistent agent process per thread so that successive turns reuse a warm process.
 *
 * <p>The process table is a concurrent map; no lock is held while talking to a process. A dead process found on
 * {@link #ensure} or {@link #send} is replaced by exactly one respawn attempt before an error is surfaced.
 */
public final class AgentProcessPool {
    private static final Logger logger = LogManager.getLogger(AgentProcessPool.class);

    /** How long a new turn waits for the vendor to finish a turn its caller abandoned. */
    public static final Duration DEFAULT_SETTLE_TIMEOUT = Duration.ofSeconds(30);

    private final ProcessLauncher launcher;
    private final Duration settleTimeout;
    private final Map<ThreadKey, AgentProcessHandle> processes = new ConcurrentHashMap<>();

    /**
     * Outcome of a non-blocking {@link #poll}.
     *
     * @param events events that arrived since the previous poll, in arrival order
     * @param turnCompleted whether the vendor has ended the current turn
     * @param alive whether the process is still running or still has output to drain
     */
    public record PollResult(List<AgentThreadEvent> events, boolean turnCompleted, boolean alive) {
        static PollResult gone() {
            return new PollResult(List.of(), false, false);
        }
    }

    public AgentProcessPool(ProcessLauncher launcher) {
        this(launcher, DEFAULT_SETTLE_TIMEOUT);
    }

    public AgentProcessPool(ProcessLauncher launcher, Duration settleTimeout) {
        if (launcher == null) {
            throw new IllegalArgumentException("launcher must not be null");
        }
        if (settleTimeout.isNegative()) {
            throw new IllegalArgumentException("settleTimeout must not be negative, got: " + settleTimeout);
        }
        this.launcher = launcher;
        this.settleTimeout = settleTimeout;
    }

    /**
     * Make sure a live process serves {@code key}. A live process is reused as is; a dead one is removed and
     * respawned; a missing one is spawned.
     *
     * @param resumeId vendor thread id to resume when a process has to be started
     * @throws ProcessSpawnException if no process could be started
     */
    public void ensure(ThreadKey key, Path workdir, @Nullable String resumeId, List<Path> extraDirs)
            throws ProcessSpawnException {
        var existing = processes.get(key);
        if (existing != null) {
            if (existing.isProcessAlive()) {
                existing.touch();
                return;
            }
            logger.warn("Agent process for {} (pid={}) has exited; respawning", key, existing.pid());
            discard(key, existing);
            var resume = existing.remoteThreadId() != null ? existing.remoteThreadId() : resumeId;
            spawn(key, workdir, resume, extraDirs);
            return;
        }
        spawn(key, workdir, resumeId, extraDirs);
    }

    /**
     * Send a prompt to the process serving {@code key}, starting a new turn.
     *
     * <p>If a previous turn is still streaming, for example because it was canceled, the prompt is held back until
     * that turn ends and its output is dropped. A process that does not end it within the settle timeout is replaced.
     *
     * @throws ProcessNotFoundException if {@link #ensure} was never called for {@code key}
     * @throws ProcessSpawnException if the process was dead and could not be respawned, or the write failed
     */
    public void send(ThreadKey key, String prompt)
            throws ProcessNotFoundException, ProcessSpawnException, InterruptedException {
        var handle = processes.get(key);
        if (handle == null) {
            throw new ProcessNotFoundException(key);
        }
        if (!handle.isTurnCompleted()) {
            logger.info("Agent process for {} is still finishing an earlier turn; waiting up to {}", key, settleTimeout);
            if (!handle.awaitOpenTurns(settleTimeout)) {
                logger.warn(
                        "Agent process for {} (pid={}) did not finish its earlier turn; restarting it",
                        key,
                        handle.pid());
                discard(key, handle);
                handle = spawn(key, handle.workdir(), handle.remoteThreadId(), handle.extraDirs());
            }
        }
        if (!handle.isProcessAlive()) {
            logger.warn("Agent process for {} (pid={}) died before send; respawning", key, handle.pid());
            discard(key, handle);
            handle = spawn(key, handle.workdir(), handle.remoteThreadId(), handle.extraDirs());
        }
        try {
            handle.send(promptFrame(prompt));
        } catch (IOException e) {
            throw new ProcessSpawnException("Failed to write prompt to agent process for " + key, e);
        }
        logger.debug("Sent prompt ({} chars) to agent process for {}", prompt.length(), key);
    }

    /** Drain the events that arrived since the last poll. Never blocks. An unknown key reports a dead process. */
    public PollResult poll(ThreadKey key) {
        var handle = processes.get(key);
        if (handle == null) {
            return PollResult.gone();
        }
        handle.touch();
        // read the flags before draining so that events queued before the reader stopped are included
        boolean alive = handle.isAlive();
        boolean completed = handle.isTurnCompleted();
        var events = handle.drainEvents();
        if (!events.isEmpty()) {
            logger.debug("Drained {} event(s) for {}", events.size(), key);
        }
        return new PollResult(events, completed, alive);
    }

    /** The vendor thread id announced by the process serving {@code key}, if any. */
    public @Nullable String remoteThreadId(ThreadKey key) {
        var handle = processes.get(key);
        return handle == null ? null : handle.remoteThreadId();
    }

    public boolean contains(ThreadKey key) {
        return processes.containsKey(key);
    }

    /**
     * Terminate and forget the process of {@code key}.
     *
     * @return true if a process was shut down, false if there was none
     */
    public boolean shutdown(ThreadKey key) {
        var handle = processes.remove(key);
        if (handle == null) {
            logger.debug("No agent process to shut down for {}", key);
            return false;
        }
        logger.info("Shutting down agent process for {} (pid={})", key, handle.pid());
        terminate(handle);
        return true;
    }

    /** Shut down every process of one workspace. */
    public int shutdownAllFor(String project, String workspace) {
        int count = 0;
        for (var key : processes.keySet().stream()
                .filter(k -> k.belongsTo(project, workspace))
                .toList()) {
            if (shutdown(key)) {
                count++;
            }
        }
        return count;
    }

    public void shutdownAll() {
        logger.info("Shutting down all agent processes (count={})", processes.size());
        for (var key : processes.keySet().stream().toList()) {
            shutdown(key);
        }
    }

    public int size() {
        return processes.size();
    }

    /** Mark the process of {@code key} as recently used, postponing idle eviction. */
    public void touch(ThreadKey key) {
        var handle = processes.get(key);
        if (handle != null) {
            handle.touch();
        }
    }

    /**
     * Shut down processes idle for longer than {@code maxIdle}. A process in the middle of a turn is never evicted.
     *
     * @return the number of processes evicted
     */
    public int evictIdle(Duration maxIdle) {
        var threshold = Instant.now().minus(maxIdle);
        var toEvict = processes.entrySet().stream()
                .filter(entry -> entry.getValue().isTurnCompleted())
                .filter(entry -> threshold.isAfter(entry.getValue().lastActiveAt()))
                .map(Map.Entry::getKey)
                .toList();

        int evicted = 0;
        for (var key : toEvict) {
            var handle = processes.get(key);
            if (handle != null) {
                logger.info("Evicting idle agent process for {} (lastActiveAt={})", key, handle.lastActiveAt());
                if (shutdown(key)) {
                    evicted++;
                }
            }
        }
        return evicted;
    }

    /** The stdin frame carrying one user prompt. */
    static String promptFrame(String prompt) {
        var frame = JsonNodeFactory.instance.objectNode();
        frame.put("type", "user");
        var message = frame.putObject("message");
        message.put("role", "user");
        message.put("content", prompt);
        return Json.write(frame);
    }

    private AgentProcessHandle spawn(ThreadKey key, Path workdir, @Nullable String resumeId, List<Path> extraDirs)
            throws ProcessSpawnException {
        Process process;
        try {
            process = launcher.launch(workdir, resumeId, extraDirs);
        } catch (IOException e) {
            throw new ProcessSpawnException("Failed to start agent process for " + key, e);
        }
        var handle = AgentProcessHandle.start(key, workdir, resumeId, extraDirs, process);
        var previous = processes.put(key, handle);
        if (previous != null && previous != handle) {
            logger.warn("Replaced a concurrently spawned agent process for {}", key);
            terminate(previous);
        }
        logger.info(
                "Started agent process for {} (pid={}, workdir={}, resume={})",
                key,
                process.pid(),
                workdir,
                resumeId);
        return handle;
    }

    private void discard(ThreadKey key, AgentProcessHandle dead) {
        processes.remove(key, dead);
        terminate(dead);
    }

    private static void terminate(AgentProcessHandle handle) {
        try {
            handle.destroy();
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for agent process of {} to terminate", handle.key(), e);
            Thread.currentThread().interrupt();
        }
    }

    /** Raised when a process is used before {@link #ensure} succeeded for its thread. */
    public static final class ProcessNotFoundException extends Exception {
        private final ThreadKey key;

        public ProcessNotFoundException(ThreadKey key) {
            super("No agent process for " + key);
            this.key = key;
        }

        public ThreadKey key() {
            return key;
        }
    }

    /** Raised when an agent process cannot be started or written to. */
    public static final class ProcessSpawnException extends Exception {
        public ProcessSpawnException(String message) {
            super(message);
        }

        public ProcessSpawnException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
