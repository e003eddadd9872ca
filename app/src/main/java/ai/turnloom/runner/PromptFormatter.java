package ai.turnloom.runner;

import java.util.List;
import java.util.Locale;

/** Builds the text actually sent to the agent. */
final class PromptFormatter {
    private PromptFormatter() {}

    /** Appends an "Attached files:" list naming each resolved attachment and its path. */
    static String format(String prompt, List<AttachmentResolver.ResolvedAttachment> attachments) {
        if (attachments.isEmpty()) {
            return prompt;
        }
        var out = new StringBuilder(prompt.stripTrailing());
        out.append("\n\nAttached files:\n");
        for (var attachment : attachments) {
            var name = attachment.name().trim();
            out.append("- ")
                    .append(name.isEmpty() ? attachment.kind().name().toLowerCase(Locale.ROOT) : name)
                    .append(": ")
                    .append(attachment.path())
                    .append('\n');
        }
        return out.toString();
    }
}
