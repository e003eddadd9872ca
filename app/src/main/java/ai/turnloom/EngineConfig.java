package ai.turnloom;

import ai.turnloom.model.RunnerKind;
import com.google.common.base.Splitter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Engine settings, taken from {@code --key value} / {@code --key=value} arguments with an environment variable
 * fallback. An argument wins over the environment.
 */
public record EngineConfig(
        Path dbPath,
        String agentBinary,
        String oneShotBinary,
        RunnerKind defaultRunner,
        Duration pollInterval,
        Duration turnTimeout,
        Duration idleTimeout,
        Duration evictionInterval,
        List<Path> extraDirs) {
    private static final Logger logger = LogManager.getLogger(EngineConfig.class);

    public static final String DEFAULT_AGENT_BINARY = "claude";
    public static final String DEFAULT_ONE_SHOT_BINARY = "codex";
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(20);
    public static final Duration DEFAULT_TURN_TIMEOUT = Duration.ofSeconds(600);
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(1800);
    public static final Duration DEFAULT_EVICTION_INTERVAL = Duration.ofSeconds(60);

    public EngineConfig {
        extraDirs = List.copyOf(extraDirs);
    }

    public static Path defaultDbPath() {
        return Path.of(System.getProperty("user.home"), ".turnloom", "turnloom.db");
    }

    public static EngineConfig fromArgs(String[] args) {
        return resolve(parseArgs(args), System::getenv);
    }

    static EngineConfig resolve(Map<String, String> parsedArgs, Function<String, @Nullable String> env) {
        var dbPathStr = getConfigValue(parsedArgs, env, "db-path", "TURNLOOM_DB_PATH");
        var dbPath = isSet(dbPathStr) ? Path.of(dbPathStr) : defaultDbPath();

        var agentBinary = getConfigValue(parsedArgs, env, "agent-bin", "TURNLOOM_AGENT_BIN");
        var oneShotBinary = getConfigValue(parsedArgs, env, "oneshot-bin", "TURNLOOM_ONESHOT_BIN");

        var runnerStr = getConfigValue(parsedArgs, env, "runner", "TURNLOOM_AGENT_RUNNER");
        var runner = RunnerKind.parseOrNull(runnerStr);
        if (runner == null) {
            if (isSet(runnerStr)) {
                logger.warn("Unknown TURNLOOM_AGENT_RUNNER value '{}', using default {}", runnerStr, RunnerKind.CLAUDE);
            }
            runner = RunnerKind.CLAUDE;
        }

        var pollInterval = parseDuration(
                getConfigValue(parsedArgs, env, "poll-interval-ms", "TURNLOOM_POLL_INTERVAL_MS"),
                "TURNLOOM_POLL_INTERVAL_MS",
                Duration::ofMillis,
                DEFAULT_POLL_INTERVAL);
        var turnTimeout = parseDuration(
                getConfigValue(parsedArgs, env, "turn-timeout-seconds", "TURNLOOM_TURN_TIMEOUT_SECONDS"),
                "TURNLOOM_TURN_TIMEOUT_SECONDS",
                Duration::ofSeconds,
                DEFAULT_TURN_TIMEOUT);
        var idleTimeout = parseDuration(
                getConfigValue(parsedArgs, env, "idle-timeout-seconds", "TURNLOOM_IDLE_TIMEOUT_SECONDS"),
                "TURNLOOM_IDLE_TIMEOUT_SECONDS",
                Duration::ofSeconds,
                DEFAULT_IDLE_TIMEOUT);
        var evictionInterval = parseDuration(
                getConfigValue(parsedArgs, env, "eviction-interval-seconds", "TURNLOOM_EVICTION_INTERVAL_SECONDS"),
                "TURNLOOM_EVICTION_INTERVAL_SECONDS",
                Duration::ofSeconds,
                DEFAULT_EVICTION_INTERVAL);

        var addDirs = getConfigValue(parsedArgs, env, "add-dirs", "TURNLOOM_ADD_DIRS");
        List<Path> extraDirs = isSet(addDirs)
                ? Splitter.on(',').trimResults().omitEmptyStrings().splitToStream(addDirs)
                        .map(Path::of)
                        .toList()
                : List.of();

        return new EngineConfig(
                dbPath,
                isSet(agentBinary) ? agentBinary : DEFAULT_AGENT_BINARY,
                isSet(oneShotBinary) ? oneShotBinary : DEFAULT_ONE_SHOT_BINARY,
                runner,
                pollInterval,
                turnTimeout,
                idleTimeout,
                evictionInterval,
                extraDirs);
    }

    /**
     * Parse command-line arguments into a map of keys (without the leading dashes) to values. A flag followed by
     * another flag or by nothing maps to the empty string.
     */
    static Map<String, String> parseArgs(String[] args) {
        var result = new HashMap<String, String>();
        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            if (!arg.startsWith("--")) {
                continue;
            }
            var withoutPrefix = arg.substring(2);
            int eq = withoutPrefix.indexOf('=');
            if (eq >= 0) {
                result.put(withoutPrefix.substring(0, eq), withoutPrefix.substring(eq + 1));
            } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                result.put(withoutPrefix, args[++i]);
            } else {
                result.put(withoutPrefix, "");
            }
        }
        return result;
    }

    static @Nullable String getConfigValue(
            Map<String, String> parsedArgs, Function<String, @Nullable String> env, String argKey, String envVarName) {
        var argValue = parsedArgs.get(argKey);
        if (isSet(argValue)) {
            return argValue;
        }
        return env.apply(envVarName);
    }

    private static Duration parseDuration(
            @Nullable String raw, String name, Function<Long, Duration> unit, Duration defaultValue) {
        if (!isSet(raw)) {
            return defaultValue;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value > 0) {
                return unit.apply(value);
            }
            logger.warn("Non-positive {} value '{}', using default {}", name, raw, defaultValue);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", name, raw, defaultValue);
        }
        return defaultValue;
    }

    private static boolean isSet(@Nullable String value) {
        return value != null && !value.isBlank();
    }
}
