package com.imperium.searchinsight.content;

import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LuceneEnhancedSummarizerTest {

    private final LuceneEnhancedSummarizer summarizer =
            new LuceneEnhancedSummarizer(new StandardAnalyzer(EnglishAnalyzer.ENGLISH_STOP_WORDS_SET));

    @AfterEach
    void tearDown() {
        summarizer.close();
    }

    @Test
    void termsAreLowercasedWithoutStopWords() {
        assertEquals(List.of("quick", "brown", "foxes", "running"),
                summarizer.terms("The Quick brown foxes are running."));
    }

    @Test
    void scoreIsLexicalDensity() {
        assertEquals(4f / 6f, summarizer.score("The quick brown foxes are running"), 0.0001f);
        assertEquals(0f, summarizer.score(""), 0.0001f);
        assertTrue(summarizer.score("it is in the") < summarizer.score("rockets launch satellites"));
    }
}
