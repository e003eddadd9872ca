package ai.turnloom.model;

/**
 * Identifies one conversation thread: a lane inside a workspace of a project.
 *
 * @param project the project identifier (slug)
 * @param workspace the workspace identifier within the project
 * @param threadLocalId the thread number, unique within the workspace
 */
public record ThreadKey(String project, String workspace, long threadLocalId) {

    public ThreadKey {
        if (project.isBlank()) {
            throw new IllegalArgumentException("project must not be blank");
        }
        if (workspace.isBlank()) {
            throw new IllegalArgumentException("workspace must not be blank");
        }
        if (threadLocalId < 1) {
            throw new IllegalArgumentException("threadLocalId must be >= 1, got: " + threadLocalId);
        }
    }

    public boolean belongsTo(String project, String workspace) {
        return this.project.equals(project) && this.workspace.equals(workspace);
    }

    @Override
    public String toString() {
        return project + "/" + workspace + "#" + threadLocalId;
    }
}
