package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/**
 * A structured unit of agent output (message, command, file change, tool call, ...), tagged by {@code type}.
 *
 * <p>Vendors add new item kinds over time, so any unrecognised {@code type} is kept verbatim as {@link Unknown}
 * instead of failing the stream.
 */
@JsonDeserialize(using = AgentItemDeserializer.class)
public sealed interface AgentItem
        permits AgentItem.AgentMessage,
                AgentItem.Reasoning,
                AgentItem.CommandExecution,
                AgentItem.FileChange,
                AgentItem.McpToolCall,
                AgentItem.WebSearch,
                AgentItem.TodoList,
                AgentItem.ErrorItem,
                AgentItem.Unknown {

    String id();

    String type();

    /** Returns a copy of this item carrying a different id. */
    AgentItem withId(String newId);

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonDeserialize(using = JsonDeserializer.None.class)
    record AgentMessage(@JsonProperty("id") String id, @JsonProperty("text") String text) implements AgentItem {
        @Override
        @JsonProperty("type")
        public String type() {
            return "agent_message";
        }

        @Override
        public AgentMessage withId(String newId) {
            return new AgentMessage(newId, text);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonDeserialize(using = JsonDeserializer.None.class)
    record Reasoning(@JsonProperty("id") String id, @JsonProperty("text") String text) implements AgentItem {
        @Override
        @JsonProperty("type")
        public String type() {
            return "reasoning";
        }

        @Override
        public Reasoning withId(String newId) {
            return new Reasoning(newId, text);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonDeserialize(using = JsonDeserializer.None.class)
    record CommandExecution(
            @JsonProperty("id") String id,
            @JsonProperty("command") String command,
            @JsonProperty("aggregated_output") String aggregatedOutput,
            @JsonProperty("exit_code") @Nullable Integer exitCode,
            @JsonProperty("status") ItemStatus status)
            implements AgentItem {
        public CommandExecution {
            if (aggregatedOutput == null) {
                aggregatedOutput = "";
            }
        }

        @Override
        @JsonProperty("type")
        public String type() {
            return "command_execution";
        }

        @Override
        public CommandExecution withId(String newId) {
            return new CommandExecution(newId, command, aggregatedOutput, exitCode, status);
        }
    }

    enum ChangeKind {
        ADD,
        DELETE,
        UPDATE;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FileUpdate(@JsonProperty("path") String path, @JsonProperty("kind") ChangeKind kind) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonDeserialize(using = JsonDeserializer.None.class)
    record FileChange(
            @JsonProperty("id") String id,
            @JsonProperty("changes") List<FileUpdate> changes,
            @JsonProperty("status") ItemStatus status)
            implements AgentItem {
        public FileChange {
            changes = changes == null ? List.of() : List.copyOf(changes);
        }

        @Override
        @JsonProperty("type")
        public String type() {
            return "file_change";
        }

        @Override
        public FileChange withId(String newId) {
            return new FileChange(newId, changes, status);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ErrorDetail(@JsonProperty("message") String message) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonDeserialize(using = JsonDeserializer.None.class)
    record McpToolCall(
            @JsonProperty("id") String id,
            @JsonProperty("server") String server,
            @JsonProperty("tool") String tool,
            @JsonProperty("arguments") @Nullable JsonNode arguments,
            @JsonProperty("result") @Nullable JsonNode result,
            @JsonProperty("error") @Nullable ErrorDetail error,
            @JsonProperty("status") ItemStatus status)
            implements AgentItem {
        @Override
        @JsonProperty("type")
        public String type() {
            return "mcp_tool_call";
        }

        @Override
        public McpToolCall withId(String newId) {
            return new McpToolCall(newId, server, tool, arguments, result, error, status);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonDeserialize(using = JsonDeserializer.None.class)
    record WebSearch(@JsonProperty("id") String id, @JsonProperty("query") String query) implements AgentItem {
        @Override
        @JsonProperty("type")
        public String type() {
            return "web_search";
        }

        @Override
        public WebSearch withId(String newId) {
            return new WebSearch(newId, query);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TodoEntry(@JsonProperty("text") String text, @JsonProperty("completed") boolean completed) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonDeserialize(using = JsonDeserializer.None.class)
    record TodoList(@JsonProperty("id") String id, @JsonProperty("items") List<TodoEntry> items)
            implements AgentItem {
        public TodoList {
            items = items == null ? List.of() : List.copyOf(items);
        }

        @Override
        @JsonProperty("type")
        public String type() {
            return "todo_list";
        }

        @Override
        public TodoList withId(String newId) {
            return new TodoList(newId, items);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonDeserialize(using = JsonDeserializer.None.class)
    record ErrorItem(@JsonProperty("id") String id, @JsonProperty("message") String message) implements AgentItem {
        @Override
        @JsonProperty("type")
        public String type() {
            return "error";
        }

        @Override
        public ErrorItem withId(String newId) {
            return new ErrorItem(newId, message);
        }
    }

    /**
     * An item kind this build does not model. Serializes back to exactly the JSON it was read from.
     *
     * @param type the vendor's type tag
     * @param id the item id, empty when the vendor sent none
     * @param raw the complete original object
     */
    @JsonDeserialize(using = JsonDeserializer.None.class)
    record Unknown(String type, String id, @JsonIgnore ObjectNode raw) implements AgentItem {
        @JsonValue
        public ObjectNode json() {
            return raw;
        }

        @Override
        public Unknown withId(String newId) {
            var copy = raw.deepCopy();
            copy.put("id", newId);
            return new Unknown(type, newId, copy);
        }
    }
}
