package ai.turnloom.runner;

import ai.turnloom.model.AgentThreadEvent;
import ai.turnloom.store.StoreException;
import ai.turnloom.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives one short-lived agent process: writes the prompt, closes stdin, then parses stdout line by line until the
 * process exits. A watcher thread kills the process when the turn is canceled or its deadline passes.
 */
final class OneShotInvocation {
    private static final Logger logger = LogManager.getLogger(OneShotInvocation.class);

    static final int MAX_NOISE_LINES = 64;
    private static final long WATCH_INTERVAL_MS = 25;

    @FunctionalInterface
    interface EventHandler {
        void handle(AgentThreadEvent event) throws StoreException;
    }

    /**
     * @param exitCode process exit code
     * @param stderr everything the process wrote to stderr
     * @param noise stdout lines that were not protocol events, at most {@link #MAX_NOISE_LINES}
     * @param timedOut whether the watcher killed the process for running past its deadline
     */
    record Result(int exitCode, String stderr, List<String> noise, boolean timedOut) {
        String describeFailure() {
            var message = new StringBuilder("agent failed (exit ")
                    .append(exitCode)
                    .append("):\nstderr:\n")
                    .append(stderr.trim());
            if (!noise.isEmpty()) {
                message.append("\nstdout (non-protocol):\n").append(String.join("\n", noise)).append('\n');
            }
            return message.toString();
        }
    }

    private OneShotInvocation() {}

    static Result run(Process process, String prompt, AtomicBoolean cancel, long deadlineNanos, EventHandler handler)
            throws IOException, StoreException, InterruptedException {
        var finished = new AtomicBoolean(false);
        var timedOut = new AtomicBoolean(false);
        var watcher = startWatcher(process, cancel, finished, timedOut, deadlineNanos);
        var stderr = new FutureTask<>(() -> readAll(process));
        var stderrReader = new Thread(stderr, "OneShotStderr-" + process.pid());
        stderrReader.setDaemon(true);
        stderrReader.start();

        try {
            try (var stdin = process.getOutputStream()) {
                stdin.write(prompt.getBytes(StandardCharsets.UTF_8));
            }

            var noise = new ArrayList<String>();
            try (var reader = process.inputReader()) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (cancel.get()) {
                        break;
                    }
                    var trimmed = line.trim();
                    if (trimmed.isEmpty()) {
                        continue;
                    }
                    AgentThreadEvent event;
                    try {
                        event = Json.read(trimmed, AgentThreadEvent.class);
                    } catch (JsonProcessingException e) {
                        logger.debug("Non-protocol agent output: {}", trimmed);
                        if (noise.size() < MAX_NOISE_LINES) {
                            noise.add(trimmed);
                        }
                        continue;
                    }
                    handler.handle(event);
                }
            } catch (IOException e) {
                if (!cancel.get() && !timedOut.get()) {
                    throw e;
                }
                logger.debug("Agent stdout closed after kill: {}", e.getMessage());
            }

            int exitCode = process.waitFor();
            return new Result(exitCode, awaitStderr(stderr), List.copyOf(noise), timedOut.get());
        } finally {
            finished.set(true);
            if (process.isAlive()) {
                process.destroyForcibly();
            }
            watcher.join(TimeUnit.SECONDS.toMillis(1));
        }
    }

    private static Thread startWatcher(
            Process process, AtomicBoolean cancel, AtomicBoolean finished, AtomicBoolean timedOut, long deadline) {
        var watcher = new Thread(
                () -> {
                    try {
                        while (!finished.get() && !cancel.get()) {
                            if (System.nanoTime() - deadline > 0) {
                                timedOut.set(true);
                                break;
                            }
                            Thread.sleep(WATCH_INTERVAL_MS);
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    if (!finished.get() && (cancel.get() || timedOut.get())) {
                        logger.info("Killing one-shot agent process (pid={})", process.pid());
                        process.destroyForcibly();
                    }
                },
                "OneShotWatcher-" + process.pid());
        watcher.setDaemon(true);
        watcher.start();
        return watcher;
    }

    private static String readAll(Process process) throws IOException {
        try (var reader = process.errorReader()) {
            return reader.lines().collect(Collectors.joining("\n"));
        }
    }

    private static String awaitStderr(FutureTask<String> stderr) throws InterruptedException {
        try {
            return stderr.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Could not collect agent stderr", e);
            return "";
        }
    }
}
