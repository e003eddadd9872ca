package ai.turnloom.store;

import ai.turnloom.model.ConversationEntry;
import ai.turnloom.model.ConversationSnapshot;
import ai.turnloom.model.QueuedPrompt;
import ai.turnloom.model.RunConfig;
import ai.turnloom.model.RunnerKind;
import ai.turnloom.model.TaskStatus;
import ai.turnloom.model.ThinkingEffort;
import ai.turnloom.model.ThreadKey;
import ai.turnloom.model.ThreadMeta;
import ai.turnloom.model.TurnResult;
import ai.turnloom.model.TurnStatus;
import ai.turnloom.model.UserPayload;
import ai.turnloom.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Durable, append-only conversation log backed by SQLite.
 *
 * <p>A single worker thread owns the JDBC connection. Every public operation is submitted to that worker and the
 * caller blocks until the reply is available, so the store needs no locking of its own.
 *
 * <p>Entries of a thread get sequence numbers 1, 2, 3, ... in append order. An entry whose (kind, item id) or entry
 * id already exists for the thread is silently skipped, which makes re-delivered agent events harmless.
 */
public final class ConversationLogStore implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ConversationLogStore.class);

    static final String DEFAULT_TITLE_PREFIX = "Thread ";
    static final int MAX_TITLE_CHARS = 48;
    static final String TASK_CREATED_ENTRY_ID = "sys_1";

    private static final String KEY_WHERE = "project_slug = ? AND workspace_name = ? AND thread_local_id = ?";
    private static final String TITLE_IS_PLACEHOLDER =
            "(title IS NULL OR title = '" + DEFAULT_TITLE_PREFIX + "' || thread_local_id)";

    @FunctionalInterface
    private interface Work<T> {
        T run(Connection conn) throws SQLException, StoreException;
    }

    private final Path dbFile;
    private final ExecutorService worker;
    private volatile boolean closed;

    // confined to the worker thread
    private @Nullable Connection connection;

    private ConversationLogStore(Path dbFile) {
        this.dbFile = dbFile;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "ConversationLogStore");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Open (creating if needed) the database at {@code dbFile} and bring its schema up to date.
     *
     * @throws SchemaVersionException if the database was written by a newer build
     * @throws StoreException if the database cannot be opened or migrated
     */
    public static ConversationLogStore open(Path dbFile) throws StoreException {
        var store = new ConversationLogStore(dbFile);
        try {
            store.await("open", store.worker.submit(() -> {
                var conn = openConnection(dbFile);
                store.connection = conn;
                Migrations.migrate(conn);
                return null;
            }));
        } catch (StoreException e) {
            store.close();
            throw e;
        }
        logger.info("Opened conversation store at {}", dbFile);
        return store;
    }

    public Path dbFile() {
        return dbFile;
    }

    public int schemaVersion() throws StoreException {
        return call("schemaVersion", Migrations::userVersion);
    }

    /**
     * Create the thread if it does not exist yet. The first creation also writes a task-created system entry.
     *
     * @return true if the thread was created by this call
     */
    public boolean ensureConversation(ThreadKey key) throws StoreException {
        return call("ensureConversation", c -> inTransaction(c, tx -> ensureInternal(tx, key)));
    }

    /**
     * Append entries to the end of a thread's log.
     *
     * @return the entries actually written, with their assigned entry ids, in order
     * @throws ConversationNotFoundException if the thread does not exist
     */
    public List<ConversationEntry> appendEntries(ThreadKey key, List<? extends ConversationEntry> entries)
            throws StoreException {
        if (entries.isEmpty()) {
            return List.of();
        }
        return call("appendEntries", c -> inTransaction(c, tx -> appendInternal(tx, key, entries)));
    }

    /** Load the thread with its whole log. */
    public ConversationSnapshot loadConversation(ThreadKey key) throws StoreException {
        return call("loadConversation", c -> {
            var row = readConversationRow(c, key);
            long total = countEntries(c, key);
            var entries = readEntries(c, key, 0, total);
            var prompts = readQueuedPrompts(c, key);
            return new ConversationSnapshot(
                    row.title(),
                    row.remoteThreadId(),
                    row.taskStatus(),
                    row.runConfig(),
                    entries,
                    total,
                    0,
                    prompts,
                    row.queuePaused(),
                    row.nextQueuedPromptId(),
                    row.runStartedAtUnixMs(),
                    row.runFinishedAtUnixMs());
        });
    }

    /**
     * Load up to {@code limit} entries immediately preceding {@code beforeSeq}, or the tail when it is null.
     *
     * <p>With N entries, {@code loadPage(key, N, k)} returns entries N-k+1..N and {@code start = N-k}.
     */
    public ConversationPage loadPage(ThreadKey key, @Nullable Long beforeSeq, int limit) throws StoreException {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        return call("loadPage", c -> {
            requireConversation(c, key);
            long total = countEntries(c, key);
            long end = beforeSeq == null ? total : Math.max(0, Math.min(beforeSeq, total));
            long start = Math.max(0, end - limit);
            return new ConversationPage(readEntries(c, key, start, end), total, start);
        });
    }

    public @Nullable String getRemoteThreadId(ThreadKey key) throws StoreException {
        return call("getRemoteThreadId", c -> readConversationRow(c, key).remoteThreadId());
    }

    /**
     * Record the vendor's id for this thread. The id is written at most once and never overwritten.
     *
     * @return true if the id was stored by this call
     */
    public boolean setRemoteThreadId(ThreadKey key, String remoteThreadId) throws StoreException {
        return call("setRemoteThreadId", c -> {
            requireConversation(c, key);
            try (var ps = c.prepareStatement(
                    "UPDATE conversations SET thread_id = ? WHERE " + KEY_WHERE + " AND thread_id IS NULL")) {
                ps.setString(1, remoteThreadId);
                bindKey(ps, 2, key);
                return ps.executeUpdate() > 0;
            }
        });
    }

    /**
     * Replace the title only if it is still unset, still the placeholder, or equal to {@code expectedCurrent}.
     * Two racing title suggestions therefore cannot overwrite one another.
     *
     * @return true if the title changed
     */
    public boolean updateTitleIfMatches(ThreadKey key, @Nullable String expectedCurrent, String newTitle)
            throws StoreException {
        var title = newTitle.trim();
        if (title.isEmpty()) {
            return false;
        }
        return call("updateTitleIfMatches", c -> {
            requireConversation(c, key);
            try (var ps = c.prepareStatement("UPDATE conversations SET title = ?, updated_at = ? WHERE " + KEY_WHERE
                    + " AND (" + TITLE_IS_PLACEHOLDER
                    + " OR title = ?) AND COALESCE(title, '') <> ?")) {
                ps.setString(1, title);
                ps.setLong(2, nowSeconds());
                bindKey(ps, 3, key);
                setNullableString(ps, 6, expectedCurrent);
                ps.setString(7, title);
                return ps.executeUpdate() > 0;
            }
        });
    }

    /**
     * List the threads of a workspace, most recently updated first. Turn status and last turn result are derived
     * from the queue columns and the newest terminal entry on every call.
     */
    public List<ThreadMeta> listThreads(String project, String workspace) throws StoreException {
        return call("listThreads", c -> {
            var sql = """
                    SELECT c.thread_local_id,
                           c.thread_id,
                           c.title,
                           c.created_at,
                           c.updated_at,
                           c.task_status,
                           c.queue_paused,
                           c.run_started_at_unix_ms,
                           c.run_finished_at_unix_ms,
                           (SELECT COALESCE(MAX(e.seq), 0)
                            FROM conversation_entries e
                            WHERE e.project_slug = c.project_slug
                              AND e.workspace_name = c.workspace_name
                              AND e.thread_local_id = c.thread_local_id
                              AND e.kind IN ('user_message', 'agent_item')) AS last_message_seq,
                           (SELECT COUNT(*)
                            FROM conversation_queued_prompts q
                            WHERE q.project_slug = c.project_slug
                              AND q.workspace_name = c.workspace_name
                              AND q.thread_local_id = c.thread_local_id) AS pending_prompt_count,
                           (SELECT e.kind
                            FROM conversation_entries e
                            WHERE e.project_slug = c.project_slug
                              AND e.workspace_name = c.workspace_name
                              AND e.thread_local_id = c.thread_local_id
                              AND e.kind IN ('turn_error', 'turn_canceled', 'turn_duration')
                            ORDER BY e.seq DESC
                            LIMIT 1) AS last_turn_kind
                    FROM conversations c
                    WHERE c.project_slug = ? AND c.workspace_name = ?
                    ORDER BY c.updated_at DESC, c.thread_local_id DESC
                    """;
            var threads = new ArrayList<ThreadMeta>();
            try (var ps = c.prepareStatement(sql)) {
                ps.setString(1, project);
                ps.setString(2, workspace);
                try (var rs = ps.executeQuery()) {
                    while (rs.next()) {
                        long threadLocalId = rs.getLong("thread_local_id");
                        var key = new ThreadKey(project, workspace, threadLocalId);
                        var title = rs.getString("title");
                        var runStarted = nullableLong(rs, "run_started_at_unix_ms");
                        var runFinished = nullableLong(rs, "run_finished_at_unix_ms");
                        threads.add(new ThreadMeta(
                                key,
                                rs.getString("thread_id"),
                                title == null ? DEFAULT_TITLE_PREFIX + threadLocalId : title,
                                rs.getLong("created_at"),
                                rs.getLong("updated_at"),
                                parseTaskStatus(rs.getString("task_status")),
                                rs.getLong("last_message_seq"),
                                deriveTurnStatus(
                                        runStarted,
                                        runFinished,
                                        rs.getLong("pending_prompt_count"),
                                        rs.getInt("queue_paused") != 0),
                                deriveTurnResult(rs.getString("last_turn_kind"))));
                    }
                }
            }
            return threads;
        });
    }

    /**
     * Persist the queue of a thread, replacing whatever was stored before.
     */
    public void saveQueueState(
            ThreadKey key,
            boolean queuePaused,
            @Nullable Long runStartedAtUnixMs,
            @Nullable Long runFinishedAtUnixMs,
            List<QueuedPrompt> prompts)
            throws StoreException {
        call("saveQueueState", c -> inTransaction(c, tx -> {
            requireConversation(tx, key);
            try (var ps = tx.prepareStatement("DELETE FROM conversation_queued_prompts WHERE " + KEY_WHERE)) {
                bindKey(ps, 1, key);
                ps.executeUpdate();
            }
            long now = nowSeconds();
            long maxId = 0;
            try (var ps = tx.prepareStatement(
                    "INSERT INTO conversation_queued_prompts (project_slug, workspace_name, thread_local_id,"
                            + " prompt_id, seq, payload_json, created_at) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                for (int i = 0; i < prompts.size(); i++) {
                    var prompt = prompts.get(i);
                    bindKey(ps, 1, key);
                    ps.setLong(4, prompt.id());
                    ps.setLong(5, i + 1);
                    ps.setString(6, Json.write(prompt));
                    ps.setLong(7, now);
                    ps.executeUpdate();
                    maxId = Math.max(maxId, prompt.id());
                }
            }
            try (var ps = tx.prepareStatement("UPDATE conversations SET queue_paused = ?,"
                    + " run_started_at_unix_ms = ?, run_finished_at_unix_ms = ?,"
                    + " next_queued_prompt_id = MAX(next_queued_prompt_id, ?) WHERE " + KEY_WHERE)) {
                ps.setInt(1, queuePaused ? 1 : 0);
                setNullableLong(ps, 2, runStartedAtUnixMs);
                setNullableLong(ps, 3, runFinishedAtUnixMs);
                ps.setLong(4, maxId + 1);
                bindKey(ps, 5, key);
                ps.executeUpdate();
            }
            return null;
        }));
    }

    public void saveRunConfig(ThreadKey key, RunConfig config) throws StoreException {
        call("saveRunConfig", c -> {
            requireConversation(c, key);
            try (var ps = c.prepareStatement("UPDATE conversations SET runner = ?, agent_model_id = ?,"
                    + " thinking_effort = ?, amp_mode = ? WHERE " + KEY_WHERE)) {
                ps.setString(1, config.runner().wireName());
                ps.setString(2, config.modelId());
                ps.setString(3, config.thinkingEffort().wireName());
                setNullableString(ps, 4, config.ampMode());
                bindKey(ps, 5, key);
                ps.executeUpdate();
            }
            return null;
        });
    }

    /**
     * Change the task status. A status-changed system entry is appended only when the status actually changes.
     *
     * @return true if the status changed
     */
    public boolean saveTaskStatus(ThreadKey key, TaskStatus status) throws StoreException {
        return call("saveTaskStatus", c -> inTransaction(c, tx -> {
            var current = readConversationRow(tx, key).taskStatus();
            if (current == status) {
                return false;
            }
            try (var ps = tx.prepareStatement("UPDATE conversations SET task_status = ? WHERE " + KEY_WHERE)) {
                ps.setString(1, status.wireName());
                bindKey(ps, 2, key);
                ps.executeUpdate();
            }
            appendInternal(tx, key, List.of(ConversationEntry.taskStatusChanged(current, status, nowMillis())));
            return true;
        }));
    }

    /**
     * Delete every thread of a workspace together with its entries and queued prompts.
     *
     * @return the number of threads deleted
     */
    public int deleteWorkspace(String project, String workspace) throws StoreException {
        return call("deleteWorkspace", c -> inTransaction(c, tx -> {
            var where = " WHERE project_slug = ? AND workspace_name = ?";
            for (var table : List.of("conversation_queued_prompts", "conversation_entries")) {
                try (var ps = tx.prepareStatement("DELETE FROM " + table + where)) {
                    ps.setString(1, project);
                    ps.setString(2, workspace);
                    ps.executeUpdate();
                }
            }
            int deleted;
            try (var ps = tx.prepareStatement("DELETE FROM conversations" + where)) {
                ps.setString(1, project);
                ps.setString(2, workspace);
                deleted = ps.executeUpdate();
            }
            logger.info("Deleted {} thread(s) of workspace {}/{}", deleted, project, workspace);
            return deleted;
        }));
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        Future<?> closing = worker.submit(() -> {
            if (connection != null) {
                try {
                    connection.close();
                } catch (SQLException e) {
                    logger.warn("Failed to close conversation store connection", e);
                }
                connection = null;
            }
        });
        try {
            closing.get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing conversation store", e);
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Error while closing conversation store", e);
        }
        worker.shutdown();
    }

    /** First line of {@code text}, trimmed and cut to the title length limit; empty when there is no text. */
    public static String deriveTitle(String text) {
        var firstLine = text.lines().findFirst().orElse("").trim();
        if (firstLine.codePointCount(0, firstLine.length()) <= MAX_TITLE_CHARS) {
            return firstLine;
        }
        return firstLine.substring(0, firstLine.offsetByCodePoints(0, MAX_TITLE_CHARS));
    }

    static TurnStatus deriveTurnStatus(
            @Nullable Long runStartedAtUnixMs, @Nullable Long runFinishedAtUnixMs, long pending, boolean queuePaused) {
        boolean running = runStartedAtUnixMs != null
                && (runFinishedAtUnixMs == null || runFinishedAtUnixMs < runStartedAtUnixMs);
        if (running) {
            return TurnStatus.RUNNING;
        }
        if (pending > 0) {
            return queuePaused ? TurnStatus.PAUSED : TurnStatus.AWAITING;
        }
        return TurnStatus.IDLE;
    }

    static @Nullable TurnResult deriveTurnResult(@Nullable String lastTurnKind) {
        if (lastTurnKind == null) {
            return null;
        }
        return switch (lastTurnKind) {
            case ConversationEntry.KIND_TURN_DURATION -> TurnResult.COMPLETED;
            case ConversationEntry.KIND_TURN_ERROR, ConversationEntry.KIND_TURN_CANCELED -> TurnResult.FAILED;
            default -> null;
        };
    }

    // ---------------------------------------------------------------------------------------------
    // worker plumbing

    private <T> T call(String operation, Work<T> work) throws StoreException {
        if (closed) {
            throw new StoreException("conversation store is closed");
        }
        Future<T> future;
        try {
            future = worker.submit(() -> work.run(requireConnection()));
        } catch (RejectedExecutionException e) {
            throw new StoreException("conversation store is closed", e);
        }
        return await(operation, future);
    }

    private <T> T await(String operation, Future<T> future) throws StoreException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("interrupted while waiting for " + operation, e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof StoreException se) {
                throw se;
            }
            if (cause instanceof SQLException sql) {
                throw new StoreException(operation + " failed: " + sql.getMessage(), sql);
            }
            throw new StoreException(operation + " failed", cause);
        }
    }

    private Connection requireConnection() throws StoreException {
        var conn = connection;
        if (conn == null) {
            throw new StoreException("conversation store is closed");
        }
        return conn;
    }

    private static <T> T inTransaction(Connection conn, Work<T> work) throws SQLException, StoreException {
        conn.setAutoCommit(false);
        try {
            T result = work.run(conn);
            conn.commit();
            return result;
        } catch (SQLException | StoreException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private static Connection openConnection(Path dbFile) throws SQLException, StoreException {
        var parent = dbFile.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new StoreException("cannot create directory " + parent, e);
            }
        }
        var conn = DriverManager.getConnection("jdbc:sqlite:" + dbFile.toAbsolutePath());
        try (var st = conn.createStatement()) {
            st.execute("PRAGMA foreign_keys = ON");
            st.execute("PRAGMA journal_mode = WAL");
            st.execute("PRAGMA synchronous = NORMAL");
            st.execute("PRAGMA busy_timeout = 5000");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    // ---------------------------------------------------------------------------------------------
    // statements; all of these run on the worker thread

    private static boolean ensureInternal(Connection conn, ThreadKey key) throws SQLException {
        long now = nowSeconds();
        int inserted;
        try (var ps = conn.prepareStatement("INSERT OR IGNORE INTO conversations (project_slug, workspace_name,"
                + " thread_local_id, thread_id, title, created_at, updated_at, task_status)"
                + " VALUES (?, ?, ?, NULL, ?, ?, ?, ?)")) {
            bindKey(ps, 1, key);
            ps.setString(4, DEFAULT_TITLE_PREFIX + key.threadLocalId());
            ps.setLong(5, now);
            ps.setLong(6, now);
            ps.setString(7, TaskStatus.BACKLOG.wireName());
            inserted = ps.executeUpdate();
        }
        if (inserted == 0) {
            return false;
        }
        insertEntry(conn, key, 1, ConversationEntry.taskCreated(TASK_CREATED_ENTRY_ID, nowMillis()), now);
        logger.info("Created conversation {}", key);
        return true;
    }

    private static List<ConversationEntry> appendInternal(
            Connection conn, ThreadKey key, List<? extends ConversationEntry> entries)
            throws SQLException, StoreException {
        requireConversation(conn, key);
        long nextSeq = maxSeq(conn, key) + 1;
        long now = nowSeconds();
        var inserted = new ArrayList<ConversationEntry>();
        for (var entry : entries) {
            var stored = entry.entryId().isEmpty() ? entry.withEntryId("e_" + nextSeq) : entry;
            if (insertEntry(conn, key, nextSeq, stored, now)) {
                inserted.add(stored);
                nextSeq++;
            } else {
                logger.debug("Ignored duplicate entry {} ({}) for {}", stored.entryId(), stored.kind(), key);
            }
        }
        if (!inserted.isEmpty()) {
            try (var ps = conn.prepareStatement("UPDATE conversations SET updated_at = ? WHERE " + KEY_WHERE)) {
                ps.setLong(1, now);
                bindKey(ps, 2, key);
                ps.executeUpdate();
            }
            deriveTitleFromFirstMessage(conn, key, inserted);
        }
        return inserted;
    }

    private static boolean insertEntry(Connection conn, ThreadKey key, long seq, ConversationEntry entry, long now)
            throws SQLException {
        try (var ps = conn.prepareStatement("INSERT OR IGNORE INTO conversation_entries (project_slug,"
                + " workspace_name, thread_local_id, seq, entry_id, kind, item_id, payload_json, created_at)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            bindKey(ps, 1, key);
            ps.setLong(4, seq);
            ps.setString(5, entry.entryId());
            ps.setString(6, entry.kind());
            setNullableString(ps, 7, entry.itemId());
            ps.setString(8, Json.write(entry));
            ps.setLong(9, now);
            return ps.executeUpdate() > 0;
        }
    }

    private static void deriveTitleFromFirstMessage(Connection conn, ThreadKey key, List<ConversationEntry> inserted)
            throws SQLException {
        for (var entry : inserted) {
            if (entry instanceof ConversationEntry.UserEvent user
                    && user.event() instanceof UserPayload.Message message) {
                var title = deriveTitle(message.text());
                if (title.isEmpty()) {
                    continue;
                }
                try (var ps = conn.prepareStatement("UPDATE conversations SET title = ? WHERE " + KEY_WHERE
                        + " AND " + TITLE_IS_PLACEHOLDER)) {
                    ps.setString(1, title);
                    bindKey(ps, 2, key);
                    ps.executeUpdate();
                }
                return;
            }
        }
    }

    private static void requireConversation(Connection conn, ThreadKey key)
            throws SQLException, ConversationNotFoundException {
        try (var ps = conn.prepareStatement("SELECT 1 FROM conversations WHERE " + KEY_WHERE)) {
            bindKey(ps, 1, key);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new ConversationNotFoundException(key);
                }
            }
        }
    }

    private static long maxSeq(Connection conn, ThreadKey key) throws SQLException {
        try (var ps = conn.prepareStatement(
                "SELECT COALESCE(MAX(seq), 0) FROM conversation_entries WHERE " + KEY_WHERE)) {
            bindKey(ps, 1, key);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        }
    }

    private static long countEntries(Connection conn, ThreadKey key) throws SQLException {
        try (var ps = conn.prepareStatement("SELECT COUNT(*) FROM conversation_entries WHERE " + KEY_WHERE)) {
            bindKey(ps, 1, key);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        }
    }

    private static List<ConversationEntry> readEntries(Connection conn, ThreadKey key, long afterSeq, long upToSeq)
            throws SQLException, StoreException {
        var entries = new ArrayList<ConversationEntry>();
        try (var ps = conn.prepareStatement("SELECT seq, payload_json FROM conversation_entries WHERE " + KEY_WHERE
                + " AND seq > ? AND seq <= ? ORDER BY seq ASC")) {
            bindKey(ps, 1, key);
            ps.setLong(4, afterSeq);
            ps.setLong(5, upToSeq);
            try (var rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(parse(rs.getString(2), ConversationEntry.class, key + " seq " + rs.getLong(1)));
                }
            }
        }
        return entries;
    }

    private static List<QueuedPrompt> readQueuedPrompts(Connection conn, ThreadKey key)
            throws SQLException, StoreException {
        var prompts = new ArrayList<QueuedPrompt>();
        try (var ps = conn.prepareStatement("SELECT prompt_id, payload_json FROM conversation_queued_prompts WHERE "
                + KEY_WHERE + " ORDER BY seq ASC")) {
            bindKey(ps, 1, key);
            try (var rs = ps.executeQuery()) {
                while (rs.next()) {
                    prompts.add(parse(rs.getString(2), QueuedPrompt.class, key + " prompt " + rs.getLong(1)));
                }
            }
        }
        return prompts;
    }

    private record ConversationRow(
            @Nullable String remoteThreadId,
            String title,
            TaskStatus taskStatus,
            boolean queuePaused,
            long nextQueuedPromptId,
            @Nullable Long runStartedAtUnixMs,
            @Nullable Long runFinishedAtUnixMs,
            @Nullable RunConfig runConfig) {}

    private static ConversationRow readConversationRow(Connection conn, ThreadKey key)
            throws SQLException, ConversationNotFoundException {
        try (var ps = conn.prepareStatement("SELECT thread_id, title, task_status, queue_paused,"
                + " next_queued_prompt_id, run_started_at_unix_ms, run_finished_at_unix_ms, runner,"
                + " agent_model_id, thinking_effort, amp_mode FROM conversations WHERE " + KEY_WHERE)) {
            bindKey(ps, 1, key);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new ConversationNotFoundException(key);
                }
                var title = rs.getString("title");
                return new ConversationRow(
                        rs.getString("thread_id"),
                        title == null ? DEFAULT_TITLE_PREFIX + key.threadLocalId() : title,
                        parseTaskStatus(rs.getString("task_status")),
                        rs.getInt("queue_paused") != 0,
                        rs.getLong("next_queued_prompt_id"),
                        nullableLong(rs, "run_started_at_unix_ms"),
                        nullableLong(rs, "run_finished_at_unix_ms"),
                        parseRunConfig(rs));
            }
        }
    }

    private static @Nullable RunConfig parseRunConfig(ResultSet rs) throws SQLException {
        var runner = RunnerKind.parseOrNull(rs.getString("runner"));
        if (runner == null) {
            return null;
        }
        var model = rs.getString("agent_model_id");
        var effortRaw = rs.getString("thinking_effort");
        ThinkingEffort effort = ThinkingEffort.MEDIUM;
        if (effortRaw != null) {
            try {
                effort = ThinkingEffort.parse(effortRaw);
            } catch (IllegalArgumentException e) {
                logger.warn("Unknown thinking effort '{}' in store, using {}", effortRaw, effort);
            }
        }
        return new RunConfig(runner, model == null ? "" : model, effort, rs.getString("amp_mode"));
    }

    private static TaskStatus parseTaskStatus(@Nullable String raw) {
        if (raw == null) {
            return TaskStatus.TODO;
        }
        try {
            return TaskStatus.parse(raw);
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown task status '{}' in store, using todo", raw);
            return TaskStatus.TODO;
        }
    }

    private static <T> T parse(String json, Class<T> type, String where) throws StoreException {
        try {
            return Json.read(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("unreadable " + type.getSimpleName() + " payload at " + where, e);
        }
    }

    private static void bindKey(PreparedStatement ps, int firstIndex, ThreadKey key) throws SQLException {
        ps.setString(firstIndex, key.project());
        ps.setString(firstIndex + 1, key.workspace());
        ps.setLong(firstIndex + 2, key.threadLocalId());
    }

    private static void setNullableString(PreparedStatement ps, int index, @Nullable String value)
            throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    private static void setNullableLong(PreparedStatement ps, int index, @Nullable Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private static @Nullable Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static long nowSeconds() {
        return System.currentTimeMillis() / 1000;
    }

    private static long nowMillis() {
        return System.currentTimeMillis();
    }
}
