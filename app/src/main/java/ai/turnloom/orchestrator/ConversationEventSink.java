package ai.turnloom.orchestrator;

import ai.turnloom.model.AgentThreadEvent;
import ai.turnloom.model.ConversationEntry;
import ai.turnloom.model.ThreadKey;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Receives everything that happens to a thread, synchronously, on the thread that produced it.
 *
 * <p>Implementations must be quick; a slow sink stalls the turn that is feeding it.
 */
public interface ConversationEventSink {

    void onAgentEvent(ThreadKey key, AgentThreadEvent event);

    void onEntriesAppended(ThreadKey key, List<ConversationEntry> entries);

    void onRunStateChanged(ThreadKey key, ThreadRunState state, int queuedPrompts);

    /** Sink that forwards to any number of delegates; a delegate that throws is logged and skipped. */
    final class FanOut implements ConversationEventSink {
        private static final Logger logger = LogManager.getLogger(FanOut.class);

        private final List<ConversationEventSink> sinks = new CopyOnWriteArrayList<>();

        public void add(ConversationEventSink sink) {
            sinks.add(sink);
        }

        public boolean remove(ConversationEventSink sink) {
            return sinks.remove(sink);
        }

        @Override
        public void onAgentEvent(ThreadKey key, AgentThreadEvent event) {
            for (var sink : sinks) {
                try {
                    sink.onAgentEvent(key, event);
                } catch (RuntimeException e) {
                    logger.warn("Event sink {} failed on agent event for {}", sink, key, e);
                }
            }
        }

        @Override
        public void onEntriesAppended(ThreadKey key, List<ConversationEntry> entries) {
            for (var sink : sinks) {
                try {
                    sink.onEntriesAppended(key, entries);
                } catch (RuntimeException e) {
                    logger.warn("Event sink {} failed on appended entries for {}", sink, key, e);
                }
            }
        }

        @Override
        public void onRunStateChanged(ThreadKey key, ThreadRunState state, int queuedPrompts) {
            for (var sink : sinks) {
                try {
                    sink.onRunStateChanged(key, state, queuedPrompts);
                } catch (RuntimeException e) {
                    logger.warn("Event sink {} failed on run state change for {}", sink, key, e);
                }
            }
        }
    }
}
