package ai.turnloom;

import ai.turnloom.model.ThreadKey;
import java.nio.file.Path;

/** Finds the working tree an agent should operate in for a thread. */
@FunctionalInterface
public interface WorktreeLocator {

    Path worktreeFor(ThreadKey key);

    static WorktreeLocator fixed(Path workdir) {
        return key -> workdir;
    }
}
