package ai.turnloom.pool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class StreamJsonProcessLauncherTest {

    @Test
    void freshSessionCommand() {
        var command = new StreamJsonProcessLauncher("claude").buildCommand(null, List.of());
        assertEquals("claude", command.get(0));
        assertEquals(List.of("--output-format", "stream-json", "--input-format", "stream-json"), command.subList(2, 6));
        assertFalse(command.contains("--resume"));
        assertFalse(command.contains("--add-dir"));
    }

    @Test
    void extraDirsAndResume() {
        var command = new StreamJsonProcessLauncher("claude")
                .buildCommand("sess-1", List.of(Path.of("/shared/a"), Path.of("/shared/b")));
        assertEquals(
                List.of("--add-dir", "/shared/a", "--add-dir", "/shared/b", "--resume", "sess-1"),
                command.subList(command.size() - 6, command.size()));
    }

    @Test
    void rejectsBlankBinary() {
        assertThrows(IllegalArgumentException.class, () -> new StreamJsonProcessLauncher(""));
    }
}
