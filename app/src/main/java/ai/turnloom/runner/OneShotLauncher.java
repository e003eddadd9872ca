package ai.turnloom.runner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Starts a short-lived agent process for one turn. The process reads the prompt from stdin until EOF and writes one
 * JSON {@link ai.turnloom.model.AgentThreadEvent} per stdout line.
 */
@FunctionalInterface
public interface OneShotLauncher {

    /**
     * @param request the turn being run
     * @param resumeId vendor thread id to continue, or null for a new vendor thread
     * @param imagePaths resolved image attachments the vendor can take as files
     */
    Process launch(TurnRequest request, @Nullable String resumeId, List<Path> imagePaths) throws IOException;
}
