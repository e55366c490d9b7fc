package com.imperium.searchinsight.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DotenvLoaderTest {

    private static final String KEY = "SEARCH_INSIGHT_TEST_KEY";
    private static final String OTHER = "SEARCH_INSIGHT_TEST_OTHER";

    @AfterEach
    void tearDown() {
        System.clearProperty(KEY);
        System.clearProperty(OTHER);
    }

    @Test
    void loadsKeyValuePairsWithoutOverriding(@TempDir Path dir) throws Exception {
        Path env = dir.resolve(".env");
        Files.writeString(env, """
                # comment
                SEARCH_INSIGHT_TEST_KEY="tvly-123"
                export SEARCH_INSIGHT_TEST_OTHER=plain
                not a pair
                """);
        System.setProperty(OTHER, "preset");

        assertEquals(1, DotenvLoader.load(env));
        assertEquals("tvly-123", System.getProperty(KEY));
        assertEquals("preset", System.getProperty(OTHER));
    }

    @Test
    void missingFileIsIgnored(@TempDir Path dir) {
        assertEquals(0, DotenvLoader.load(dir.resolve(".env")));
    }
}
