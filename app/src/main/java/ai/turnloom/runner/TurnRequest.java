package ai.turnloom.runner;

import ai.turnloom.model.AttachmentRef;
import ai.turnloom.model.RunConfig;
import ai.turnloom.model.ThreadKey;
import java.nio.file.Path;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Everything needed to run one turn.
 *
 * @param key thread the turn belongs to
 * @param runConfig runner kind, model and effort for this turn
 * @param prompt the user's message
 * @param attachments references to attached blobs
 * @param workdir working tree the agent operates in
 * @param remoteThreadId vendor thread id to resume; when null the stored id is used, if any
 */
public record TurnRequest(
        ThreadKey key,
        RunConfig runConfig,
        String prompt,
        List<AttachmentRef> attachments,
        Path workdir,
        @Nullable String remoteThreadId) {
    public TurnRequest {
        if (prompt == null) {
            throw new IllegalArgumentException("prompt must not be null");
        }
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }
}
