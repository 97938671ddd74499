package me.golemcore.agent.tools;

import me.golemcore.agent.adapter.outbound.memory.InMemoryMemoryStore;
import me.golemcore.agent.domain.model.MemoryEntry;
import me.golemcore.agent.domain.model.ToolExecutionContext;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolSchemaValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryRecallToolTest {

    private static final ToolExecutionContext CONTEXT = new ToolExecutionContext("s1", "s1#3", "c1", 1);

    private InMemoryMemoryStore memoryStore;
    private MemoryRecallTool tool;

    @BeforeEach
    void setUp() {
        memoryStore = new InMemoryMemoryStore();
        tool = new MemoryRecallTool(memoryStore);
    }

    @Test
    void shouldRequireKey() {
        assertEquals(List.of("key"), tool.getDescriptor().getInputSchema().get("required"));
        assertEquals("memory_recall", tool.getToolName());
    }

    @Test
    void shouldReturnLatestValueForKey() throws Exception {
        memoryStore.append("s1", MemoryEntry.pending("answer", "first", "s1#1", Instant.now()));
        memoryStore.append("s1", MemoryEntry.pending("answer", "second", "s1#2", Instant.now()));

        ToolResult result = tool.execute(CONTEXT, Map.of("key", "answer")).get();

        assertTrue(result.isSuccess());
        assertEquals("second", result.getOutput());
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals(true, data.get("found"));
        assertEquals(2L, data.get("index"));
        assertEquals("s1#2", data.get("turnId"));
        assertDoesNotThrow(() -> ToolSchemaValidator.validateOutput("memory_recall",
                tool.getDescriptor().getOutputSchema(), data));
    }

    @Test
    void shouldReportMissingKey() throws Exception {
        ToolResult result = tool.execute(CONTEXT, Map.of("key", "tool:weather")).get();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("Nothing remembered"));
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals(false, data.get("found"));
        assertDoesNotThrow(() -> ToolSchemaValidator.validateOutput("memory_recall",
                tool.getDescriptor().getOutputSchema(), data));
    }

    @Test
    void shouldNotSeeOtherSessions() throws Exception {
        memoryStore.append("other", MemoryEntry.pending("answer", "secret", "other#1", Instant.now()));

        ToolResult result = tool.execute(CONTEXT, Map.of("key", "answer")).get();

        assertFalse(result.getOutput().contains("secret"));
    }
}
