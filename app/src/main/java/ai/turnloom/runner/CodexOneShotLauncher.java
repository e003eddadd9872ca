package ai.turnloom.runner;

import com.google.common.base.Joiner;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Runs {@code <binary> exec --json} once per turn, reading the prompt from stdin. */
public final class CodexOneShotLauncher implements OneShotLauncher {
    private static final Logger logger = LogManager.getLogger(CodexOneShotLauncher.class);

    private final String binary;

    public CodexOneShotLauncher(String binary) {
        if (binary == null || binary.isBlank()) {
            throw new IllegalArgumentException("binary must not be null or blank");
        }
        this.binary = binary;
    }

    @Override
    public Process launch(TurnRequest request, @Nullable String resumeId, List<Path> imagePaths) throws IOException {
        var command = buildCommand(request, resumeId, imagePaths);
        logger.debug("Launching one-shot agent for {}: {}", request.key(), Joiner.on(' ').join(command));
        return new ProcessBuilder(command).directory(request.workdir().toFile()).start();
    }

    List<String> buildCommand(TurnRequest request, @Nullable String resumeId, List<Path> imagePaths) {
        var command = new ArrayList<String>(List.of(
                binary, "--sandbox", "danger-full-access", "--ask-for-approval", "never", "--search", "exec"));
        command.add("--json");
        command.add("-C");
        command.add(request.workdir().toString());
        if (!imagePaths.isEmpty()) {
            command.add("--image");
            imagePaths.forEach(p -> command.add(p.toString()));
        }
        var config = request.runConfig();
        if (!config.modelId().isBlank()) {
            command.add("--model");
            command.add(config.modelId());
        }
        command.add("-c");
        command.add("model_reasoning_effort=\"" + config.thinkingEffort().wireName() + "\"");
        if (resumeId != null && !resumeId.isBlank()) {
            command.add("resume");
            command.add(resumeId);
        }
        command.add("-");
        return command;
    }
}
