package ai.turnloom.pool;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Starts the persistent agent process for one thread. The returned process must read prompt frames from stdin and
 * write stream-json lines to stdout.
 */
@FunctionalInterface
public interface ProcessLauncher {

    /**
     * @param workdir working tree the agent operates in
     * @param resumeId vendor thread id to resume, or null for a fresh conversation
     * @param extraDirs additional directories the agent may read
     */
    Process launch(Path workdir, @Nullable String resumeId, List<Path> extraDirs) throws IOException;
}
