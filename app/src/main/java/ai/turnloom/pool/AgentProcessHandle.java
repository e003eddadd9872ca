package ai.turnloom.pool;

import ai.turnloom.model.AgentThreadEvent;
import ai.turnloom.model.ThreadKey;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * A running persistent agent process together with the threads that drain its output.
 *
 * <p>The stdout reader translates each line and queues the resulting events. Every {@link #send} opens a turn and
 * every terminal event the reader sees closes the oldest one, so a turn that was abandoned by its caller still
 * counts as open until the vendor actually ends it.
 */
final class AgentProcessHandle {
    private static final Logger logger = LogManager.getLogger(AgentProcessHandle.class);

    private final ThreadKey key;
    private final Path workdir;
    private final List<Path> extraDirs;
    private final Process process;
    private final BufferedWriter stdin;
    private final ConcurrentLinkedQueue<AgentThreadEvent> events = new ConcurrentLinkedQueue<>();
    private final AtomicInteger openTurns = new AtomicInteger();
    private final AtomicReference<String> remoteThreadId;
    private final Thread stdoutReader;
    private volatile Instant lastActiveAt;

    private AgentProcessHandle(
            ThreadKey key, Path workdir, @Nullable String resumeId, List<Path> extraDirs, Process process) {
        this.key = key;
        this.workdir = workdir;
        this.extraDirs = List.copyOf(extraDirs);
        this.process = process;
        this.stdin = process.outputWriter();
        this.remoteThreadId = new AtomicReference<>(resumeId);
        this.lastActiveAt = Instant.now();
        this.stdoutReader = new Thread(this::readStdout, "AgentOutput-" + key);
        this.stdoutReader.setDaemon(true);
    }

    static AgentProcessHandle start(
            ThreadKey key, Path workdir, @Nullable String resumeId, List<Path> extraDirs, Process process) {
        var handle = new AgentProcessHandle(key, workdir, resumeId, extraDirs, process);
        handle.stdoutReader.start();
        handle.drainStderr();
        return handle;
    }

    ThreadKey key() {
        return key;
    }

    Path workdir() {
        return workdir;
    }

    List<Path> extraDirs() {
        return extraDirs;
    }

    /** The vendor thread id this process was resumed with or has announced since. */
    @Nullable
    String remoteThreadId() {
        return remoteThreadId.get();
    }

    long pid() {
        return process.pid();
    }

    Instant lastActiveAt() {
        return lastActiveAt;
    }

    void touch() {
        lastActiveAt = Instant.now();
    }

    /** Alive while the process runs or its buffered output is still being drained. */
    boolean isAlive() {
        return process.isAlive() || stdoutReader.isAlive();
    }

    boolean isProcessAlive() {
        return process.isAlive();
    }

    boolean isTurnCompleted() {
        return openTurns.get() == 0;
    }

    /**
     * Wait until every turn sent earlier has ended. The output of those turns stays queued and is dropped by the
     * next {@link #send}.
     *
     * @return false if the process exited or {@code timeout} elapsed while a turn was still open
     */
    boolean awaitOpenTurns(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (openTurns.get() > 0) {
            if (!stdoutReader.isAlive() || System.nanoTime() - deadline > 0) {
                return openTurns.get() == 0;
            }
            Thread.sleep(20);
        }
        return true;
    }

    /** Write one line to the process stdin, starting a new turn. Callers first wait for open turns to end. */
    void send(String frame) throws IOException {
        // thread.started may arrive before the first prompt and belongs to the turn about to start
        var leftover = drainEvents();
        var kept = leftover.stream()
                .filter(e -> e instanceof AgentThreadEvent.ThreadStarted)
                .toList();
        events.addAll(kept);
        if (leftover.size() > kept.size()) {
            logger.debug(
                    "Discarded {} leftover event(s) of a previous turn for {}", leftover.size() - kept.size(), key);
        }
        openTurns.incrementAndGet();
        touch();
        synchronized (stdin) {
            stdin.write(frame);
            stdin.newLine();
            stdin.flush();
        }
    }

    List<AgentThreadEvent> drainEvents() {
        var drained = new ArrayList<AgentThreadEvent>();
        AgentThreadEvent event;
        while ((event = events.poll()) != null) {
            drained.add(event);
        }
        return drained;
    }

    void destroy() throws InterruptedException {
        try {
            synchronized (stdin) {
                stdin.close();
            }
        } catch (IOException e) {
            logger.debug("Closing stdin of agent process for {} failed: {}", key, e.getMessage());
        }
        process.destroy();
        if (!process.waitFor(5, TimeUnit.SECONDS)) {
            logger.warn("Agent process for {} did not terminate gracefully, forcing kill", key);
            process.destroyForcibly();
        }
    }

    private void readStdout() {
        var translator = new StreamJsonTranslator();
        try (var reader = process.inputReader()) {
            String line;
            while ((line = reader.readLine()) != null) {
                for (var event : translator.translate(line)) {
                    if (event instanceof AgentThreadEvent.ThreadStarted started) {
                        remoteThreadId.set(started.threadId());
                    }
                    events.add(event);
                    if (AgentThreadEvent.isTerminal(event)) {
                        openTurns.updateAndGet(n -> Math.max(0, n - 1));
                    }
                }
            }
        } catch (IOException e) {
            logger.warn("Error reading output of agent process for {}", key, e);
        }
        logger.debug("Agent output for {} reached end of stream", key);
    }

    private void drainStderr() {
        var stderrReader = new Thread(
                () -> {
                    try (var reader = process.errorReader()) {
                        reader.lines().forEach(line -> logger.debug("[agent:{}] {}", key, line));
                    } catch (IOException | UncheckedIOException e) {
                        logger.debug("Stopped reading stderr of agent process for {}: {}", key, e.getMessage());
                    }
                },
                "AgentStderr-" + key);
        stderrReader.setDaemon(true);
        stderrReader.start();
    }
}
