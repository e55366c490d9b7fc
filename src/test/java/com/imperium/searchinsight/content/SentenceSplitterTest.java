package com.imperium.searchinsight.content;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SentenceSplitterTest {

    @Test
    void splitsOnTerminatorsAndNewlines() {
        assertEquals(List.of("One.", "Two!", "Three?", "Four"), SentenceSplitter.split("One. Two! Three?\nFour"));
        assertEquals(List.of("第一句。", "第二句！"), SentenceSplitter.split("第一句。 第二句！"));
    }

    @Test
    void textWithoutTerminatorIsOneSentence() {
        assertEquals(List.of("no terminator here"), SentenceSplitter.split("no terminator here"));
        assertTrue(SentenceSplitter.split("  ").isEmpty());
    }

    @Test
    void truncateCutsAtWordBoundary() {
        String cut = SentenceSplitter.truncate("alpha beta gamma delta", 15);
        assertEquals("alpha beta...", cut);
        assertEquals("short", SentenceSplitter.truncate("short", 15));
    }
}
