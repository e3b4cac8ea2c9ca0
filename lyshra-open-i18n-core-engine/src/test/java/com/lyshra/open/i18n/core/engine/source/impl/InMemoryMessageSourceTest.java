package com.lyshra.open.i18n.core.engine.source.impl;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMessageSourceTest {

    private static final Map<String, Map<String, String>> MESSAGES = Map.of(
            "de_DE", Map.of("Yes", "Ja"),
            "en_us", Map.of("Colour", "Color"));

    @Test
    void shouldTranslateRegardlessOfLanguageSpelling() {
        InMemoryMessageSource source = new InMemoryMessageSource("en_us", false, MESSAGES);

        assertEquals(Optional.of("Ja"), source.translate("common", "Yes", "de_de"));
        assertEquals(Optional.of("Ja"), source.translate("common", "Yes", "de-DE"));
        assertEquals(Optional.of("Ja"), source.translate("any/category", "Yes", "DE_DE"));
    }

    @Test
    void shouldMissUnknownKeyOrLanguage() {
        InMemoryMessageSource source = new InMemoryMessageSource("en_us", false, MESSAGES);

        assertTrue(source.translate("common", "No", "de_de").isEmpty());
        assertTrue(source.translate("common", "Yes", "de").isEmpty());
        assertTrue(source.translate("common", null, "de_de").isEmpty());
    }

    @Test
    void shouldSkipSourceLanguageUnlessForced() {
        assertTrue(new InMemoryMessageSource("en_us", false, MESSAGES).translate("common", "Colour", "en-US").isEmpty());
        assertEquals(Optional.of("Color"),
                new InMemoryMessageSource("en_us", true, MESSAGES).translate("common", "Colour", "en-US"));
    }

    @Test
    void shouldCopyMessages() {
        Map<String, String> german = new HashMap<>(Map.of("Yes", "Ja"));
        Map<String, Map<String, String>> messages = new HashMap<>(Map.of("de", german));
        InMemoryMessageSource source = new InMemoryMessageSource("en_us", false, messages);

        german.put("Yes", "Jawohl");

        assertEquals(Optional.of("Ja"), source.translate("common", "Yes", "de"));
    }

    @Test
    void shouldRequireSourceLanguage() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryMessageSource(null, false, MESSAGES));
        assertThrows(IllegalArgumentException.class, () -> new InMemoryMessageSource("", false, MESSAGES));
    }

    @Test
    void shouldAcceptMissingMessages() {
        InMemoryMessageSource source = new InMemoryMessageSource("en_us", false, null);

        assertTrue(source.translate("common", "Yes", "de").isEmpty());
        assertEquals("en_us", source.getSourceLanguage());
    }
}
