package ai.turnloom.store;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Forward-only schema migrations gated on {@code PRAGMA user_version}.
 *
 * <p>All pending steps run inside one transaction together with the version bump.
 */
final class Migrations {
    private static final Logger logger = LogManager.getLogger(Migrations.class);

    /** Version at which flat legacy entry payloads are rewritten into the tagged shape. */
    static final int LEGACY_ENTRY_REWRITE_VERSION = 6;

    private static final List<Step> STEPS = List.of(
            new Step(1, "0001_conversations.sql"),
            new Step(2, "0002_entry_ids.sql"),
            new Step(3, "0003_conversation_queue.sql"),
            new Step(4, "0004_run_config.sql"),
            new Step(5, "0005_task_status.sql"),
            new Step(LEGACY_ENTRY_REWRITE_VERSION, null));

    static final int LATEST_VERSION = STEPS.get(STEPS.size() - 1).version();

    private static final Splitter STATEMENT_SPLITTER =
            Splitter.on(';').trimResults().omitEmptyStrings();

    /** A script under {@code db/migrations}, or a code step when {@code script} is null. */
    private record Step(int version, @Nullable String script) {}

    private Migrations() {}

    /** Brings the database to {@link #LATEST_VERSION}. */
    static void migrate(Connection conn) throws SQLException, StoreException {
        migrate(conn, LATEST_VERSION);
    }

    /** Applies pending steps up to and including {@code targetVersion}. */
    static void migrate(Connection conn, int targetVersion) throws SQLException, StoreException {
        int current = userVersion(conn);
        if (current > LATEST_VERSION) {
            throw new SchemaVersionException(current, LATEST_VERSION);
        }
        if (current >= targetVersion) {
            logger.debug("Schema is at version {}, nothing to migrate", current);
            return;
        }

        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            for (var step : STEPS) {
                if (step.version() <= current || step.version() > targetVersion) {
                    continue;
                }
                logger.info("Applying schema migration {} ({})", step.version(), describe(step));
                if (step.script() == null) {
                    LegacyEntryRewriter.rewriteAll(conn);
                } else {
                    runScript(conn, step.script());
                }
            }
            try (var st = conn.createStatement()) {
                st.execute("PRAGMA user_version = " + targetVersion);
            }
            conn.commit();
        } catch (SQLException | StoreException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
        logger.info("Schema migrated from version {} to {}", current, targetVersion);
    }

    static int userVersion(Connection conn) throws SQLException {
        try (var st = conn.createStatement();
                var rs = st.executeQuery("PRAGMA user_version")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private static String describe(Step step) {
        return step.script() == null ? "legacy entry rewrite" : step.script();
    }

    private static void runScript(Connection conn, String script) throws SQLException, StoreException {
        var sql = loadScript(script);
        try (var st = conn.createStatement()) {
            for (var statement : STATEMENT_SPLITTER.split(sql)) {
                st.execute(statement);
            }
        }
    }

    private static String loadScript(String script) throws StoreException {
        var resource = "/db/migrations/" + script;
        try (InputStream in = Migrations.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new StoreException("missing migration resource " + resource);
            }
            var text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return text.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new StoreException("failed to read migration resource " + resource, e);
        }
    }
}
