package ai.turnloom.pool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.turnloom.model.AgentItem;
import ai.turnloom.model.AgentThreadEvent;
import ai.turnloom.model.ItemStatus;
import ai.turnloom.model.Usage;
import java.util.List;
import org.junit.jupiter.api.Test;

class StreamJsonTranslatorTest {

    private final StreamJsonTranslator translator = new StreamJsonTranslator();

    @Test
    void systemInitAnnouncesSession() {
        var events = translator.translate("{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"sess-42\"}");
        assertEquals(List.of(new AgentThreadEvent.ThreadStarted("sess-42")), events);
    }

    @Test
    void otherSystemLinesAreIgnored() {
        assertTrue(translator.translate("{\"type\":\"system\",\"subtype\":\"hook\"}").isEmpty());
    }

    @Test
    void textBlocksAccumulateIntoOneMessage() {
        var first = translator.translate(assistant("{\"type\":\"text\",\"text\":\"Hello \"}"));
        var second = translator.translate(assistant("{\"type\":\"text\",\"text\":\"world\"}"));

        assertEquals(
                List.of(new AgentThreadEvent.ItemStarted(new AgentItem.AgentMessage("agent_message", "Hello "))),
                first);
        assertEquals(
                List.of(new AgentThreadEvent.ItemUpdated(new AgentItem.AgentMessage("agent_message", "Hello world"))),
                second);
    }

    @Test
    void thinkingBecomesReasoning() {
        var events = translator.translate(assistant("{\"type\":\"thinking\",\"thinking\":\"let me see\"}"));
        assertEquals(
                List.of(new AgentThreadEvent.ItemStarted(new AgentItem.Reasoning("reasoning", "let me see"))), events);
    }

    @Test
    void bashToolRunsAsCommandUntilItsResult() {
        var started = translator.translate(assistant(
                "{\"type\":\"tool_use\",\"id\":\"tu_1\",\"name\":\"Bash\",\"input\":{\"command\":\"ls -la\"}}"));
        assertEquals(
                List.of(new AgentThreadEvent.ItemStarted(
                        new AgentItem.CommandExecution("tu_1", "ls -la", "", null, ItemStatus.IN_PROGRESS))),
                started);

        var completed = translator.translate("{\"type\":\"user\",\"message\":{\"content\":[{\"type\":\"tool_result\","
                + "\"tool_use_id\":\"tu_1\",\"content\":{\"stdout\":\"a.txt\",\"stderr\":\"warn\",\"exitCode\":0}}]}}");
        assertEquals(
                List.of(new AgentThreadEvent.ItemCompleted(
                        new AgentItem.CommandExecution("tu_1", "ls -la", "a.txt\nwarn", 0, ItemStatus.COMPLETED))),
                completed);
    }

    @Test
    void resultForUnknownToolIsDropped() {
        var events = translator.translate("{\"type\":\"user\",\"message\":{\"content\":[{\"type\":\"tool_result\","
                + "\"tool_use_id\":\"missing\",\"content\":\"x\"}]}}");
        assertTrue(events.isEmpty());
    }

    @Test
    void fileToolsBecomeFileChanges() {
        var started = translator.translate(assistant(
                "{\"type\":\"tool_use\",\"id\":\"tu_2\",\"name\":\"create_file\",\"input\":{\"path\":\"src/A.java\"}}"));
        var change = List.of(new AgentItem.FileUpdate("src/A.java", AgentItem.ChangeKind.ADD));
        assertEquals(
                List.of(new AgentThreadEvent.ItemStarted(
                        new AgentItem.FileChange("tu_2", change, ItemStatus.IN_PROGRESS))),
                started);

        var completed = translator.translate("{\"type\":\"user\",\"message\":{\"content\":[{\"type\":\"tool_result\","
                + "\"tool_use_id\":\"tu_2\",\"content\":\"ok\"}]}}");
        assertEquals(
                List.of(new AgentThreadEvent.ItemCompleted(
                        new AgentItem.FileChange("tu_2", change, ItemStatus.COMPLETED))),
                completed);
    }

    @Test
    void failedOtherToolBecomesMcpCallWithError() {
        translator.translate(assistant(
                "{\"type\":\"tool_use\",\"id\":\"tu_3\",\"name\":\"search_symbols\",\"input\":{\"q\":\"Foo\"}}"));
        var completed = translator.translate("{\"type\":\"user\",\"message\":{\"content\":[{\"type\":\"tool_result\","
                + "\"tool_use_id\":\"tu_3\",\"is_error\":true,\"content\":\"no index\"}]}}");

        assertEquals(1, completed.size());
        var item = assertInstanceOf(
                AgentItem.McpToolCall.class, ((AgentThreadEvent.ItemCompleted) completed.get(0)).item());
        assertEquals("search_symbols", item.tool());
        assertEquals(ItemStatus.FAILED, item.status());
        assertNull(item.result());
        assertEquals(new AgentItem.ErrorDetail("no index"), item.error());
    }

    @Test
    void successfulResultCompletesMessageAndTurn() {
        translator.translate(assistant("{\"type\":\"text\",\"text\":\"partial\"}"));
        var events = translator.translate("{\"type\":\"result\",\"subtype\":\"success\",\"result\":\"All done\"}");

        assertEquals(
                List.of(
                        new AgentThreadEvent.ItemCompleted(new AgentItem.AgentMessage("agent_message", "All done")),
                        new AgentThreadEvent.TurnCompleted(Usage.empty())),
                events);

        // the next turn starts a fresh message
        var next = translator.translate(assistant("{\"type\":\"text\",\"text\":\"again\"}"));
        assertInstanceOf(AgentThreadEvent.ItemStarted.class, next.get(0));
    }

    @Test
    void successWithoutResultTextFallsBackToAccumulatedMessage() {
        translator.translate(assistant("{\"type\":\"text\",\"text\":\" streamed \"}"));
        var events = translator.translate("{\"type\":\"result\",\"subtype\":\"success\"}");
        assertEquals(
                new AgentThreadEvent.ItemCompleted(new AgentItem.AgentMessage("agent_message", "streamed")),
                events.get(0));
    }

    @Test
    void failedResultFailsTurn() {
        var events = translator.translate(
                "{\"type\":\"result\",\"subtype\":\"error_max_turns\",\"error\":\"too many turns\"}");
        assertEquals(List.of(AgentThreadEvent.TurnFailed.of("too many turns")), events);
    }

    @Test
    void errorLineBecomesStreamError() {
        assertEquals(
                List.of(new AgentThreadEvent.StreamError("overloaded")),
                translator.translate("{\"type\":\"error\",\"message\":\"overloaded\"}"));
    }

    @Test
    void noiseYieldsNothing() {
        assertTrue(translator.translate("").isEmpty());
        assertTrue(translator.translate("Loading model...").isEmpty());
        assertTrue(translator.translate("[1,2,3]").isEmpty());
    }

    @Test
    void ansiSequencesAreStripped() {
        assertEquals("plain text", StreamJsonTranslator.stripAnsi("\u001b[1;32mplain\u001b[0m text"));
        var events = translator.translate(
                "\u001b[0m{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"s\"}\u001b[0m");
        assertEquals(List.of(new AgentThreadEvent.ThreadStarted("s")), events);
    }

    private static String assistant(String block) {
        return "{\"type\":\"assistant\",\"message\":{\"content\":[" + block + "]}}";
    }
}
