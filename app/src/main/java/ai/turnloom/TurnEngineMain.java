package ai.turnloom;

import ai.turnloom.model.AgentThreadEvent;
import ai.turnloom.model.ConversationEntry;
import ai.turnloom.model.RunConfig;
import ai.turnloom.model.RunnerKind;
import ai.turnloom.model.ThreadKey;
import ai.turnloom.orchestrator.ConversationEventSink;
import ai.turnloom.orchestrator.ThreadRunState;
import ai.turnloom.runner.AttachmentResolver;
import ai.turnloom.util.Json;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Command-line entry point: runs one prompt on one thread and prints every event as a JSON line on stdout.
 *
 * <pre>
 * --project p --workspace w [--thread 1] [--workdir .] --prompt "..." [--runner claude] [--model id]
 * </pre>
 */
public final class TurnEngineMain {
    private static final Logger logger = LogManager.getLogger(TurnEngineMain.class);

    private TurnEngineMain() {}

    /** Writes each sink callback as one JSON object per line. */
    static final class JsonLinePrinter implements ConversationEventSink {
        private final PrintStream out;

        JsonLinePrinter(PrintStream out) {
            this.out = out;
        }

        @Override
        public void onAgentEvent(ThreadKey key, AgentThreadEvent event) {
            print(key, "agent_event", Json.mapper().valueToTree(event));
        }

        @Override
        public void onEntriesAppended(ThreadKey key, List<ConversationEntry> entries) {
            print(key, "entries_appended", Json.mapper().valueToTree(entries));
        }

        @Override
        public void onRunStateChanged(ThreadKey key, ThreadRunState state, int queuedPrompts) {
            var node = Json.mapper().createObjectNode();
            node.put("status", state.toTurnStatus(queuedPrompts == 0).wireName());
            node.put("queued_prompts", queuedPrompts);
            print(key, "run_state", node);
        }

        private synchronized void print(ThreadKey key, String kind, Object payload) {
            var line = Json.mapper().createObjectNode();
            line.put("thread", key.toString());
            line.put("kind", kind);
            line.set("payload", Json.mapper().valueToTree(payload));
            out.println(Json.write(line));
            out.flush();
        }
    }

    public static void main(String[] args) {
        try {
            var parsedArgs = EngineConfig.parseArgs(args);
            var config = EngineConfig.fromArgs(args);

            var project = require(parsedArgs, "project");
            var workspace = require(parsedArgs, "workspace");
            var prompt = require(parsedArgs, "prompt");
            long threadId = parseThreadId(parsedArgs.get("thread"));
            var workdirStr = parsedArgs.get("workdir");
            var workdir = (workdirStr == null || workdirStr.isBlank())
                    ? Path.of("").toAbsolutePath()
                    : Path.of(workdirStr).toAbsolutePath();

            var runner = RunnerKind.parseOrNull(parsedArgs.get("runner"));
            var runConfig = RunConfig.of(
                    runner != null ? runner : config.defaultRunner(), parsedArgs.getOrDefault("model", ""));

            logger.info(
                    "Starting TurnEngine with config: db={}, runner={}, workdir={}, turnTimeout={}",
                    config.dbPath(),
                    runConfig.runner(),
                    workdir,
                    config.turnTimeout());

            var key = new ThreadKey(project, workspace, threadId);
            var engine = TurnEngine.create(config, WorktreeLocator.fixed(workdir), AttachmentResolver.none());
            Runtime.getRuntime()
                    .addShutdownHook(new Thread(
                            () -> {
                                logger.info("Shutdown signal received, stopping engine");
                                engine.close();
                            },
                            "TurnEngine-ShutdownHook"));

            engine.addSink(new JsonLinePrinter(System.out));
            engine.start();
            engine.submit(key, prompt, List.of(), runConfig);
            if (!engine.awaitIdle(key, config.turnTimeout().plus(Duration.ofSeconds(30)))) {
                logger.warn("Turn for {} did not finish in time; canceling it", key);
                engine.cancel(key);
                engine.awaitIdle(key, Duration.ofSeconds(10));
            }
            boolean paused = engine.state(key) instanceof ThreadRunState.QueuePaused;
            engine.close();
            System.exit(paused ? 2 : 0);
        } catch (InterruptedException e) {
            logger.info("TurnEngine interrupted", e);
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("Fatal error in TurnEngine", e);
            System.exit(1);
        }
    }

    private static String require(Map<String, String> parsedArgs, String key) {
        var value = parsedArgs.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("--" + key + " is required");
        }
        return value;
    }

    private static long parseThreadId(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return 1;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid --thread: " + raw, e);
        }
    }
}
