package me.golemcore.agent.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MemoryWindowTest {

    @Test
    void shouldKeepEverythingForAllWindow() {
        List<MemoryEntry> entries = entries(5, "value");

        assertEquals(0, MemoryWindow.all().startOffset(entries, entries.size()));
    }

    @Test
    void shouldKeepNewestEntriesForLastEntriesWindow() {
        List<MemoryEntry> entries = entries(5, "value");

        assertEquals(3, MemoryWindow.lastEntries(2).startOffset(entries, entries.size()));
        assertEquals(0, MemoryWindow.lastEntries(10).startOffset(entries, entries.size()));
        assertEquals(5, MemoryWindow.lastEntries(0).startOffset(entries, entries.size()));
    }

    @Test
    void shouldEstimateTokensAtFourCharsPerToken() {
        MemoryEntry entry = MemoryEntry.pending("key", "12345", "t", Instant.EPOCH);

        assertEquals(2, MemoryWindow.estimateTokens(entry));
        assertEquals(1, MemoryWindow.estimateTokens(MemoryEntry.pending("", "", "t", Instant.EPOCH)));
    }

    @Test
    void shouldKeepNewestEntriesWithinTokenBudget() {
        // "k" + 7 chars = 8 chars = 2 tokens each
        List<MemoryEntry> entries = entries(4, "1234567");

        assertEquals(2, MemoryWindow.tokenBudget(4).startOffset(entries, entries.size()));
        assertEquals(3, MemoryWindow.tokenBudget(3).startOffset(entries, entries.size()));
        assertEquals(4, MemoryWindow.tokenBudget(1).startOffset(entries, entries.size()));
        assertEquals(0, MemoryWindow.tokenBudget(100).startOffset(entries, entries.size()));
    }

    @Test
    void shouldRejectNegativeLimit() {
        assertThrows(IllegalArgumentException.class, () -> MemoryWindow.lastEntries(-1));
        assertThrows(IllegalArgumentException.class, () -> MemoryWindow.tokenBudget(-5));
    }

    private static List<MemoryEntry> entries(int count, String value) {
        List<MemoryEntry> entries = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            entries.add(new MemoryEntry("s1", i, "k", value, "s1#1", Instant.EPOCH));
        }
        return entries;
    }
}
