package club.ppmc.flowdebug.debug;

import club.ppmc.flowdebug.model.debug.DebugLogEntry;
import club.ppmc.flowdebug.model.debug.LogLevel;
import club.ppmc.flowdebug.model.debug.OperationResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class DebugLogBufferTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T08:30:15Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private DebugLogBuffer buffer;

    @BeforeEach
    void setUp() {
        buffer = new DebugLogBuffer(10, CLOCK);
    }

    @Test
    void insertingBeyondMax_keepsMostRecentEntriesInOrder() {
        for (int i = 0; i < 15; i++) {
            buffer.add(LogLevel.INFO, "entry " + i);
        }

        List<DebugLogEntry> logs = buffer.getLogs();
        assertEquals(10, logs.size());
        for (int i = 0; i < 10; i++) {
            assertEquals("entry " + (i + 5), logs.get(i).message());
        }
    }

    @Test
    void getLogs_filtersByLevel() {
        buffer.add(LogLevel.INFO, "a");
        buffer.add(LogLevel.ERROR, "b");
        buffer.add(LogLevel.SUCCESS, "c");
        buffer.add(LogLevel.ERROR, "d");

        List<DebugLogEntry> errors = buffer.getLogs(LogLevel.ERROR);

        assertEquals(List.of("b", "d"), errors.stream().map(DebugLogEntry::message).toList());
        assertEquals(4, buffer.getLogs(null).size());
    }

    @Test
    void setMaxEntries_trimsOldestImmediately() {
        for (int i = 0; i < 8; i++) {
            buffer.add(LogLevel.DEBUG, String.valueOf(i));
        }

        buffer.setMaxEntries(3);

        assertEquals(3, buffer.size());
        assertEquals("5", buffer.getLogs().get(0).message());
        assertThrows(IllegalArgumentException.class, () -> buffer.setMaxEntries(0));
    }

    @Test
    void clear_emptiesBuffer() {
        buffer.add(LogLevel.INFO, "x");

        buffer.clear();

        assertEquals(0, buffer.size());
    }

    @Test
    void listener_receivesEveryNewEntry_andFailuresDoNotPropagate() {
        List<DebugLogEntry> received = new ArrayList<>();
        buffer.setListener(received::add);
        buffer.add(LogLevel.WARNING, "careful");
        assertEquals(1, received.size());
        assertEquals(LogLevel.WARNING, received.get(0).level());

        buffer.setListener(entry -> {
            throw new IllegalStateException("boom");
        });
        assertDoesNotThrow(() -> buffer.add(LogLevel.INFO, "still stored"));
        assertEquals(2, buffer.size());
    }

    @Test
    void exportText_writesOneFormattedLinePerEntry() throws IOException {
        buffer.add(LogLevel.INFO, "flow started");
        buffer.add(LogLevel.ERROR, "step failed");
        Path target = tempDir.resolve("logs/debug.txt");

        OperationResult result = buffer.exportText(target);

        assertTrue(result.success(), result.message());
        List<String> lines = Files.readAllLines(target, StandardCharsets.UTF_8);
        assertEquals(List.of(
                "[2024-03-01 08:30:15] [INFO] flow started",
                "[2024-03-01 08:30:15] [ERROR] step failed"), lines);
    }

    @Test
    void exportJson_writesArrayWithFormattedTime() throws IOException {
        buffer.add(LogLevel.SUCCESS, "done");
        Path target = tempDir.resolve("debug.json");

        OperationResult result = buffer.exportJson(target);

        assertTrue(result.success(), result.message());
        JsonNode root = new ObjectMapper().readTree(target.toFile());
        assertTrue(root.isArray());
        assertEquals(1, root.size());
        JsonNode entry = root.get(0);
        assertEquals("SUCCESS", entry.get("level").asText());
        assertEquals("done", entry.get("message").asText());
        assertEquals("2024-03-01 08:30:15", entry.get("formatted_time").asText());
        assertTrue(entry.has("timestamp"));
    }

    @Test
    void exportFailure_returnsFailureInsteadOfThrowing() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        buffer.add(LogLevel.INFO, "x");

        OperationResult text = buffer.exportText(blocker.resolve("nested/out.txt"));
        OperationResult json = buffer.exportJson(blocker.resolve("nested/out.json"));

        assertFalse(text.success());
        assertFalse(json.success());
    }
}
