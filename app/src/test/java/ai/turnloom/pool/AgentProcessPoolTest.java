package ai.turnloom.pool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.turnloom.model.AgentItem;
import ai.turnloom.model.AgentThreadEvent;
import ai.turnloom.model.ThreadKey;
import ai.turnloom.testutil.FakeAgentScripts;
import ai.turnloom.util.Json;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AgentProcessPoolTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final ThreadKey KEY = new ThreadKey("proj", "ws", 1);

    @TempDir
    Path tempDir;

    private final List<String> resumeIds = new ArrayList<>();
    private AgentProcessPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownAll();
        }
    }

    private AgentProcessPool poolRunning(String script) throws IOException {
        var path = FakeAgentScripts.write(tempDir, "agent.sh", script);
        pool = new AgentProcessPool(FakeAgentScripts.shLauncher(path, resumeIds));
        return pool;
    }

    private List<AgentThreadEvent> collectTurn(ThreadKey key) throws InterruptedException {
        var events = new ArrayList<AgentThreadEvent>();
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (true) {
            var result = pool.poll(key);
            events.addAll(result.events());
            if (result.turnCompleted() || !result.alive()) {
                return events;
            }
            if (System.nanoTime() - deadline > 0) {
                throw new AssertionError("Turn did not complete; got " + events);
            }
            Thread.sleep(10);
        }
    }

    @Test
    void sendWithoutEnsureFails() throws IOException {
        poolRunning(FakeAgentScripts.ECHOING_STREAM_AGENT);
        var e = assertThrows(AgentProcessPool.ProcessNotFoundException.class, () -> pool.send(KEY, "hi"));
        assertEquals(KEY, e.key());
    }

    @Test
    void ensureReusesLiveProcess() throws Exception {
        poolRunning(FakeAgentScripts.ECHOING_STREAM_AGENT);
        pool.ensure(KEY, tempDir, null, List.of());
        pool.ensure(KEY, tempDir, null, List.of());

        assertEquals(1, resumeIds.size());
        assertEquals(1, pool.size());
        assertTrue(pool.contains(KEY));
    }

    @Test
    void turnsStreamTranslatedEvents() throws Exception {
        poolRunning(FakeAgentScripts.ECHOING_STREAM_AGENT);
        pool.ensure(KEY, tempDir, null, List.of());

        pool.send(KEY, "first");
        var first = collectTurn(KEY);
        assertEquals(new AgentThreadEvent.ThreadStarted("sess-1"), first.get(0));
        assertEquals(
                new AgentThreadEvent.ItemCompleted(new AgentItem.AgentMessage("agent_message", "done 1")),
                first.get(first.size() - 2));
        assertInstanceOf(AgentThreadEvent.TurnCompleted.class, first.get(first.size() - 1));
        assertEquals("sess-1", pool.remoteThreadId(KEY));

        pool.send(KEY, "second");
        var second = collectTurn(KEY);
        assertEquals(
                new AgentThreadEvent.ItemCompleted(new AgentItem.AgentMessage("agent_message", "done 2")),
                second.get(second.size() - 2));
        assertFalse(second.stream().anyMatch(e -> e instanceof AgentThreadEvent.ThreadStarted));
    }

    @Test
    void deadProcessIsRespawnedWithAnnouncedSession() throws Exception {
        poolRunning(FakeAgentScripts.SINGLE_TURN_STREAM_AGENT);
        pool.ensure(KEY, tempDir, null, List.of());
        pool.send(KEY, "once");
        collectTurn(KEY);
        FakeAgentScripts.await(() -> !pool.poll(KEY).alive(), TIMEOUT, "the agent process to exit");

        pool.ensure(KEY, tempDir, null, List.of());

        assertEquals(List.of("", "sess-1"), resumeIds);
        pool.send(KEY, "again");
        var events = collectTurn(KEY);
        assertInstanceOf(AgentThreadEvent.TurnCompleted.class, events.get(events.size() - 1));
    }

    @Test
    void pollOfUnknownKeyReportsGone() throws IOException {
        poolRunning(FakeAgentScripts.ECHOING_STREAM_AGENT);
        var result = pool.poll(KEY);
        assertTrue(result.events().isEmpty());
        assertFalse(result.alive());
    }

    @Test
    void shutdownForgetsProcess() throws Exception {
        poolRunning(FakeAgentScripts.ECHOING_STREAM_AGENT);
        pool.ensure(KEY, tempDir, null, List.of());

        assertTrue(pool.shutdown(KEY));
        assertFalse(pool.shutdown(KEY));
        assertFalse(pool.contains(KEY));
    }

    @Test
    void shutdownAllForOnlyTouchesOneWorkspace() throws Exception {
        poolRunning(FakeAgentScripts.ECHOING_STREAM_AGENT);
        var other = new ThreadKey("proj", "other", 1);
        pool.ensure(KEY, tempDir, null, List.of());
        pool.ensure(new ThreadKey("proj", "ws", 2), tempDir, null, List.of());
        pool.ensure(other, tempDir, null, List.of());

        assertEquals(2, pool.shutdownAllFor("proj", "ws"));
        assertEquals(1, pool.size());
        assertTrue(pool.contains(other));
    }

    @Test
    void evictIdleSparesProcessesMidTurn() throws Exception {
        poolRunning(FakeAgentScripts.SILENT_STREAM_AGENT);
        var idle = new ThreadKey("proj", "ws", 2);
        pool.ensure(KEY, tempDir, null, List.of());
        pool.ensure(idle, tempDir, null, List.of());
        pool.send(KEY, "never answered");
        Thread.sleep(50);

        assertEquals(1, pool.evictIdle(Duration.ofMillis(1)));
        assertTrue(pool.contains(KEY));
        assertFalse(pool.contains(idle));
    }

    @Test
    void abandonedTurnIsDrainedBeforeNextPrompt() throws Exception {
        poolRunning(FakeAgentScripts.SLOW_FIRST_REPLY_STREAM_AGENT);
        pool.ensure(KEY, tempDir, null, List.of());

        pool.send(KEY, "first");
        pool.poll(KEY);
        pool.send(KEY, "second");
        var events = collectTurn(KEY);

        var messages = events.stream()
                .filter(e -> e instanceof AgentThreadEvent.ItemCompleted)
                .map(e -> ((AgentThreadEvent.ItemCompleted) e).item())
                .filter(item -> item instanceof AgentItem.AgentMessage)
                .map(item -> ((AgentItem.AgentMessage) item).text())
                .toList();
        assertEquals(List.of("reply 2"), messages);
        assertEquals(
                1,
                events.stream()
                        .filter(e -> e instanceof AgentThreadEvent.TurnCompleted)
                        .count());
        assertEquals(1, resumeIds.size());
    }

    @Test
    void processStuckInAbandonedTurnIsReplaced() throws Exception {
        var path = FakeAgentScripts.write(tempDir, "agent.sh", FakeAgentScripts.HANGS_ON_FIRST_LAUNCH_STREAM_AGENT);
        pool = new AgentProcessPool(FakeAgentScripts.shLauncher(path, resumeIds), Duration.ofMillis(200));
        pool.ensure(KEY, tempDir, null, List.of());
        pool.send(KEY, "never answered");

        pool.send(KEY, "retry");
        var events = collectTurn(KEY);

        assertEquals(2, resumeIds.size());
        assertEquals(
                new AgentThreadEvent.ItemCompleted(new AgentItem.AgentMessage("agent_message", "done 1")),
                events.get(events.size() - 2));
        assertInstanceOf(AgentThreadEvent.TurnCompleted.class, events.get(events.size() - 1));
    }

    @Test
    void launchFailureIsReportedAsSpawnException() {
        pool = new AgentProcessPool((workdir, resumeId, extraDirs) -> {
            throw new IOException("no such binary");
        });
        var e = assertThrows(
                AgentProcessPool.ProcessSpawnException.class, () -> pool.ensure(KEY, tempDir, null, List.of()));
        assertInstanceOf(IOException.class, e.getCause());
        assertFalse(pool.contains(KEY));
    }

    @Test
    void promptFrameCarriesUserMessage() {
        var frame = Json.parseOrNull(AgentProcessPool.promptFrame("line one\nline \"two\""));
        assertEquals("user", frame.path("type").asText());
        assertEquals("user", frame.at("/message/role").asText());
        assertEquals("line one\nline \"two\"", frame.at("/message/content").asText());
    }
}
