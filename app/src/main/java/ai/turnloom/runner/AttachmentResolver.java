package ai.turnloom.runner;

import ai.turnloom.model.AttachmentRef;
import ai.turnloom.model.ThreadKey;
import java.nio.file.Path;
import java.util.List;

/** Maps attachment references to files on disk the agent can read. */
@FunctionalInterface
public interface AttachmentResolver {

    /**
     * @param kind what the attachment holds
     * @param name display name, may be blank
     * @param path file the agent should read
     */
    record ResolvedAttachment(AttachmentRef.Kind kind, String name, Path path) {}

    /** Resolve the references that exist; unresolvable references are left out. */
    List<ResolvedAttachment> resolve(ThreadKey key, List<AttachmentRef> attachments);

    static AttachmentResolver none() {
        return (key, attachments) -> List.of();
    }
}
