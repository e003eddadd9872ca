package ai.turnloom.pool;

import com.google.common.base.Joiner;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Launches the vendor binary in persistent stream-json mode. */
public final class StreamJsonProcessLauncher implements ProcessLauncher {
    private static final Logger logger = LogManager.getLogger(StreamJsonProcessLauncher.class);

    private final String agentBinary;

    public StreamJsonProcessLauncher(String agentBinary) {
        if (agentBinary == null || agentBinary.isBlank()) {
            throw new IllegalArgumentException("agentBinary must not be null or blank");
        }
        this.agentBinary = agentBinary;
    }

    @Override
    public Process launch(Path workdir, @Nullable String resumeId, List<Path> extraDirs) throws IOException {
        var command = buildCommand(resumeId, extraDirs);
        logger.debug("Launching agent in {}: {}", workdir, Joiner.on(' ').join(command));
        return new ProcessBuilder(command).directory(workdir.toFile()).start();
    }

    List<String> buildCommand(@Nullable String resumeId, List<Path> extraDirs) {
        var command = new ArrayList<String>(List.of(
                agentBinary,
                "--print",
                "--output-format",
                "stream-json",
                "--input-format",
                "stream-json",
                "--verbose",
                "--include-partial-messages",
                "--permission-mode",
                "bypassPermissions"));
        for (var dir : extraDirs) {
            command.add("--add-dir");
            command.add(dir.toString());
        }
        if (resumeId != null && !resumeId.isBlank()) {
            command.add("--resume");
            command.add(resumeId);
        }
        return command;
    }
}
