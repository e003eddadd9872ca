package ai.turnloom.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.turnloom.model.AttachmentRef;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class PromptFormatterTest {

    @Test
    void promptWithoutAttachmentsIsUnchanged() {
        assertEquals("fix it  \n", PromptFormatter.format("fix it  \n", List.of()));
    }

    @Test
    void attachmentsAreListedAfterThePrompt() {
        var attachments = List.of(
                new AttachmentResolver.ResolvedAttachment(
                        AttachmentRef.Kind.IMAGE, "screenshot.png", Path.of("/tmp/a/1.png")),
                new AttachmentResolver.ResolvedAttachment(AttachmentRef.Kind.TEXT, "  ", Path.of("/tmp/a/2.txt")));

        assertEquals(
                "look at this\n\nAttached files:\n- screenshot.png: /tmp/a/1.png\n- text: /tmp/a/2.txt\n",
                PromptFormatter.format("look at this\n\n", attachments));
    }
}
