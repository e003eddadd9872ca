package ai.turnloom.pool;

import ai.turnloom.model.AgentItem;
import ai.turnloom.model.AgentThreadEvent;
import ai.turnloom.model.ItemStatus;
import ai.turnloom.model.Usage;
import ai.turnloom.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Translates the line-delimited stream-json output of a persistent agent process into {@link AgentThreadEvent}s.
 *
 * <p>Instances are stateful: assistant text and thinking blocks accumulate into a single agent message and a single
 * reasoning item, and {@code tool_use} blocks are remembered until their {@code tool_result} arrives. The state is
 * reset whenever a {@code result} line ends the turn. Not thread-safe; each process reader owns one.
 */
public final class StreamJsonTranslator {
    static final String AGENT_MESSAGE_ID = "agent_message";
    static final String REASONING_ID = "reasoning";
    static final String MCP_SERVER = "claude";

    private static final Set<String> FILE_TOOLS =
            Set.of("edit_file", "create_file", "undo_edit", "edit", "write", "writefile", "write_file");

    private enum ToolKind {
        COMMAND,
        FILE_CHANGE,
        WEB_SEARCH,
        MCP
    }

    private record ToolUse(
            String name, JsonNode input, ToolKind kind, String summary, List<AgentItem.FileUpdate> changes) {}

    private final StringBuilder agentMessage = new StringBuilder();
    private final StringBuilder reasoning = new StringBuilder();
    private final Map<String, ToolUse> tools = new HashMap<>();

    /** Translate one raw output line. Blank and non-JSON lines yield no events. */
    public List<AgentThreadEvent> translate(String line) {
        var trimmed = stripAnsi(line).trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        var payload = Json.parseOrNull(trimmed);
        if (payload == null || !payload.isObject()) {
            return List.of();
        }
        return switch (lower(payload.path("type").asText(""))) {
            case "system" -> translateSystem(payload);
            case "assistant" -> translateAssistant(payload);
            case "user" -> translateToolResults(payload);
            case "result" -> translateResult(payload);
            case "error" -> List.of(new AgentThreadEvent.StreamError(
                    textOr(payload.get("message"), "claude error")));
            default -> List.of();
        };
    }

    /** Clear the accumulated message, reasoning and pending tool uses. */
    public void reset() {
        agentMessage.setLength(0);
        reasoning.setLength(0);
        tools.clear();
    }

    private List<AgentThreadEvent> translateSystem(JsonNode payload) {
        if (!"init".equals(lower(payload.path("subtype").asText("")))) {
            return List.of();
        }
        var threadId = firstString(payload, "session_id", "thread_id");
        return threadId == null ? List.of() : List.of(new AgentThreadEvent.ThreadStarted(threadId));
    }

    private List<AgentThreadEvent> translateAssistant(JsonNode payload) {
        var out = new ArrayList<AgentThreadEvent>();
        for (var block : contentArray(payload)) {
            switch (lower(block.path("type").asText(""))) {
                case "thinking" -> {
                    var text = textOr(block.has("thinking") ? block.get("thinking") : block.get("text"), "");
                    if (!text.isEmpty()) {
                        boolean first = reasoning.length() == 0;
                        reasoning.append(text);
                        var item = new AgentItem.Reasoning(REASONING_ID, reasoning.toString());
                        out.add(first ? new AgentThreadEvent.ItemStarted(item) : new AgentThreadEvent.ItemUpdated(item));
                    }
                }
                case "text" -> {
                    var text = textOr(block.get("text"), "");
                    if (!text.isEmpty()) {
                        boolean first = agentMessage.length() == 0;
                        agentMessage.append(text);
                        var item = new AgentItem.AgentMessage(AGENT_MESSAGE_ID, agentMessage.toString());
                        out.add(first ? new AgentThreadEvent.ItemStarted(item) : new AgentThreadEvent.ItemUpdated(item));
                    }
                }
                case "tool_use" -> {
                    var started = startTool(block);
                    if (started != null) {
                        out.add(new AgentThreadEvent.ItemStarted(started));
                    }
                }
                default -> {}
            }
        }
        return out;
    }

    private @Nullable AgentItem startTool(JsonNode block) {
        var id = textOr(block.get("id"), "");
        if (id.isEmpty()) {
            return null;
        }
        var name = textOr(block.get("name"), "tool");
        var input = block.has("input") ? block.get("input") : NullNode.getInstance();
        var tool = summarize(name, input);
        tools.put(id, tool);
        return switch (tool.kind()) {
            case COMMAND -> new AgentItem.CommandExecution(id, tool.summary(), "", null, ItemStatus.IN_PROGRESS);
            case WEB_SEARCH -> new AgentItem.WebSearch(id, tool.summary());
            case FILE_CHANGE -> new AgentItem.FileChange(id, tool.changes(), ItemStatus.IN_PROGRESS);
            case MCP -> new AgentItem.McpToolCall(id, MCP_SERVER, name, input, null, null, ItemStatus.IN_PROGRESS);
        };
    }

    private static ToolUse summarize(String name, JsonNode input) {
        var key = lower(name.trim());
        if (key.equals("bash")) {
            var command = firstString(input, "command", "cmd");
            return new ToolUse(name, input, ToolKind.COMMAND, command == null ? "bash" : command, List.of());
        }
        if (key.equals("web_search") || key.equals("websearch")) {
            var query = firstString(input, "query", "q");
            return new ToolUse(name, input, ToolKind.WEB_SEARCH, query == null ? "web_search" : query, List.of());
        }
        if (FILE_TOOLS.contains(key)) {
            var path = firstString(input, "path", "file_path", "filename");
            var kind = key.equals("create_file") ? AgentItem.ChangeKind.ADD : AgentItem.ChangeKind.UPDATE;
            var changes = path == null ? List.<AgentItem.FileUpdate>of() : List.of(new AgentItem.FileUpdate(path, kind));
            return new ToolUse(name, input, ToolKind.FILE_CHANGE, "", changes);
        }
        return new ToolUse(name, input, ToolKind.MCP, "", List.of());
    }

    private List<AgentThreadEvent> translateToolResults(JsonNode payload) {
        var out = new ArrayList<AgentThreadEvent>();
        for (var block : contentArray(payload)) {
            if (!"tool_result".equals(lower(block.path("type").asText("")))) {
                continue;
            }
            var toolUseId = textOr(block.get("tool_use_id"), "");
            var tool = toolUseId.isEmpty() ? null : tools.remove(toolUseId);
            if (tool == null) {
                continue;
            }
            var result = block.has("content") ? block.get("content") : NullNode.getInstance();
            boolean isError = block.path("is_error").asBoolean(false);
            var status = isError ? ItemStatus.FAILED : ItemStatus.COMPLETED;
            AgentItem item = switch (tool.kind()) {
                case COMMAND -> completedCommand(toolUseId, tool.summary(), result, status);
                case WEB_SEARCH -> new AgentItem.WebSearch(toolUseId, tool.summary());
                case FILE_CHANGE -> new AgentItem.FileChange(toolUseId, tool.changes(), status);
                case MCP -> new AgentItem.McpToolCall(
                        toolUseId,
                        MCP_SERVER,
                        tool.name(),
                        tool.input(),
                        isError ? null : result,
                        isError ? new AgentItem.ErrorDetail(valueAsString(result)) : null,
                        status);
            };
            out.add(new AgentThreadEvent.ItemCompleted(item));
        }
        return out;
    }

    private static AgentItem.CommandExecution completedCommand(
            String id, String command, JsonNode result, ItemStatus status) {
        if (!result.isObject()) {
            return new AgentItem.CommandExecution(id, command, valueAsString(result), null, status);
        }
        var stdout = textOr(result.has("stdout") ? result.get("stdout") : result.get("output"), "");
        var stderr = textOr(result.get("stderr"), "");
        String output;
        if (stdout.isEmpty() && stderr.isEmpty()) {
            output = valueAsString(result);
        } else if (stderr.isEmpty()) {
            output = stdout;
        } else if (stdout.isEmpty()) {
            output = stderr;
        } else {
            output = stdout + "\n" + stderr;
        }
        var exitNode = result.has("exitCode") ? result.get("exitCode") : result.get("exit_code");
        Integer exitCode = exitNode != null && exitNode.canConvertToInt() ? exitNode.intValue() : null;
        return new AgentItem.CommandExecution(id, command, output, exitCode, status);
    }

    private List<AgentThreadEvent> translateResult(JsonNode payload) {
        var out = new ArrayList<AgentThreadEvent>();
        if ("success".equals(lower(payload.path("subtype").asText("")))) {
            var finalText = textOr(payload.get("result"), "").trim();
            if (finalText.isEmpty()) {
                finalText = agentMessage.toString().trim();
            }
            if (!finalText.isEmpty()) {
                out.add(new AgentThreadEvent.ItemCompleted(new AgentItem.AgentMessage(AGENT_MESSAGE_ID, finalText)));
            }
            out.add(new AgentThreadEvent.TurnCompleted(Usage.empty()));
        } else {
            var message = firstString(payload, "error", "result");
            out.add(AgentThreadEvent.TurnFailed.of(message == null ? "claude result error" : message));
        }
        reset();
        return out;
    }

    private static List<JsonNode> contentArray(JsonNode payload) {
        var content = payload.at("/message/content");
        if (!content.isArray()) {
            content = payload.path("content");
        }
        var blocks = new ArrayList<JsonNode>();
        if (content.isArray()) {
            content.forEach(blocks::add);
        }
        return blocks;
    }

    private static @Nullable String firstString(JsonNode node, String... keys) {
        for (var key : keys) {
            var value = node.get(key);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    private static String textOr(@Nullable JsonNode node, String fallback) {
        return node != null && node.isTextual() ? node.asText() : fallback;
    }

    private static String valueAsString(JsonNode value) {
        if (value.isNull() || value.isMissingNode()) {
            return "";
        }
        if (value instanceof TextNode || value.isNumber() || value.isBoolean()) {
            return value.asText();
        }
        return value.toString();
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    /** Remove ANSI escape sequences: CSI sequences up to their final letter, any other ESC plus one char. */
    static String stripAnsi(String input) {
        if (input.indexOf('\u001b') < 0) {
            return input;
        }
        var out = new StringBuilder(input.length());
        int i = 0;
        while (i < input.length()) {
            char ch = input.charAt(i++);
            if (ch != '\u001b') {
                out.append(ch);
                continue;
            }
            if (i < input.length() && input.charAt(i) == '[') {
                i++;
                while (i < input.length() && !Character.isLetter(input.charAt(i))) {
                    i++;
                }
                i++;
                continue;
            }
            i++;
        }
        return out.toString();
    }
}
