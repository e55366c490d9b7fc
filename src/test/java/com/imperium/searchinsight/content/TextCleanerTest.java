package com.imperium.searchinsight.content;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TextCleanerTest {

    @Test
    void stripsMarkup() {
        assertEquals("Hello world", TextCleaner.clean("<p>Hello <b>world</b></p>"));
        assertEquals("Tom & Jerry", TextCleaner.clean("Tom &amp; Jerry"));
    }

    @Test
    void removesBoilerplateCaseInsensitively() {
        assertEquals("Breaking news caption",
                TextCleaner.clean("LOGIN subscribe ePaper Breaking news Image 3: caption"));
        assertEquals("Read the today", TextCleaner.clean("Read the e-Paper today"));
    }

    @Test
    void keepsWordsThatOnlyContainBoilerplate() {
        assertEquals("Accountability matters", TextCleaner.clean("Accountability   matters"));
    }

    @Test
    void blankInputYieldsEmpty() {
        assertEquals("", TextCleaner.clean(null));
        assertEquals("", TextCleaner.clean("   "));
    }
}
