package me.golemcore.agent.adapter.outbound.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.agent.domain.model.MemoryEntry;
import me.golemcore.agent.domain.model.MemoryWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonlMemoryStoreTest {

    private static final Instant CREATED_AT = Instant.parse("2026-03-01T10:15:30Z");

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Test
    void shouldWriteOneLinePerEntry() throws Exception {
        JsonlMemoryStore store = new JsonlMemoryStore(tempDir.toString(), objectMapper);

        store.append("s1", MemoryEntry.pending("input", "hello", "s1#1", CREATED_AT));
        store.append("s1", MemoryEntry.pending("answer", "hi", "s1#1", CREATED_AT));

        List<String> lines = Files.readAllLines(tempDir.resolve("s1.jsonl"), StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        MemoryEntry first = objectMapper.readValue(lines.get(0), MemoryEntry.class);
        assertEquals(1, first.getIndex());
        assertEquals("s1", first.getSessionId());
        assertEquals("s1#1", first.getTurnId());
        assertEquals(CREATED_AT, first.getCreatedAt());
    }

    @Test
    void shouldReplayLogAndContinueIndexes() {
        JsonlMemoryStore writer = new JsonlMemoryStore(tempDir.toString(), objectMapper);
        writer.append("s1", MemoryEntry.pending("input", "hello", "s1#1", CREATED_AT));
        writer.append("s1", MemoryEntry.pending("tool:datetime", "2026-03-01", "s1#1", CREATED_AT));

        JsonlMemoryStore reopened = new JsonlMemoryStore(tempDir.toString(), objectMapper);

        assertEquals(2, reopened.size("s1"));
        assertEquals("2026-03-01", reopened.latest("s1", "tool:datetime").orElseThrow().getValue());
        MemoryEntry next = reopened.append("s1", MemoryEntry.pending("answer", "done", "s1#2", CREATED_AT));
        assertEquals(3, next.getIndex());
        assertEquals(List.of("input", "tool:datetime", "answer"),
                reopened.query("s1", MemoryWindow.all()).stream().map(MemoryEntry::getKey).toList());
    }

    @Test
    void shouldRejectCorruptIndexSequence() throws Exception {
        Files.writeString(tempDir.resolve("broken.jsonl"),
                "{\"sessionId\":\"broken\",\"index\":2,\"key\":\"k\",\"value\":\"v\"}\n", StandardCharsets.UTF_8);
        JsonlMemoryStore store = new JsonlMemoryStore(tempDir.toString(), objectMapper);

        assertThrows(IllegalStateException.class, () -> store.size("broken"));
    }

    @Test
    void shouldDeleteLogFile() {
        JsonlMemoryStore store = new JsonlMemoryStore(tempDir.toString(), objectMapper);
        store.append("s1", MemoryEntry.pending("input", "hello", "s1#1", CREATED_AT));

        store.delete("s1");

        assertFalse(Files.exists(tempDir.resolve("s1.jsonl")));
        assertEquals(0, store.size("s1"));
    }

    @Test
    void shouldRejectSessionIdsThatEscapeBasePath() {
        JsonlMemoryStore store = new JsonlMemoryStore(tempDir.toString(), objectMapper);

        assertThrows(IllegalArgumentException.class,
                () -> store.append("../escape", MemoryEntry.pending("k", "v", "t", CREATED_AT)));
    }

    @Test
    void shouldReportNothingForUnknownSession() {
        JsonlMemoryStore store = new JsonlMemoryStore(tempDir.toString(), objectMapper);

        assertTrue(store.query("nobody", MemoryWindow.all()).isEmpty());
        assertTrue(store.latest("nobody", "k").isEmpty());
    }
}
