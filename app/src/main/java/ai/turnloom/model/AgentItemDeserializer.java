package ai.turnloom.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;

/** Dispatches on the {@code type} tag and falls back to {@link AgentItem.Unknown} for unmodelled kinds. */
public final class AgentItemDeserializer extends StdDeserializer<AgentItem> {

    public AgentItemDeserializer() {
        super(AgentItem.class);
    }

    @Override
    public AgentItem deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        if (node == null || !node.isObject()) {
            return ctxt.reportInputMismatch(AgentItem.class, "agent item must be a JSON object");
        }
        var type = node.path("type").asText("");
        Class<? extends AgentItem> target =
                switch (type) {
                    case "agent_message" -> AgentItem.AgentMessage.class;
                    case "reasoning" -> AgentItem.Reasoning.class;
                    case "command_execution" -> AgentItem.CommandExecution.class;
                    case "file_change" -> AgentItem.FileChange.class;
                    case "mcp_tool_call" -> AgentItem.McpToolCall.class;
                    case "web_search" -> AgentItem.WebSearch.class;
                    case "todo_list" -> AgentItem.TodoList.class;
                    case "error" -> AgentItem.ErrorItem.class;
                    default -> null;
                };
        if (target == null) {
            return new AgentItem.Unknown(type, node.path("id").asText(""), (ObjectNode) node);
        }
        return ctxt.readTreeAsValue(node, target);
    }
}
