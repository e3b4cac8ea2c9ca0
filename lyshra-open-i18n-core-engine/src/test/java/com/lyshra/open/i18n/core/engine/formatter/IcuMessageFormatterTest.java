package com.lyshra.open.i18n.core.engine.formatter;

import com.lyshra.open.i18n.integration.exception.LyshraOpenI18nFormatException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class IcuMessageFormatterTest {

    private final IcuMessageFormatter formatter = new IcuMessageFormatter();

    @Test
    void shouldFormatPlural() throws Exception {
        String template = "{count, plural, one{1 item} other{# items}}";

        assertEquals("1 item", formatter.format(template, Map.of("count", 1), "en"));
        assertEquals("3 items", formatter.format(template, Map.of("count", 3), "en_us"));
    }

    @Test
    void shouldFormatSelect() throws Exception {
        String template = "{gender, select, female{She} male{He} other{They}} replied";

        assertEquals("She replied", formatter.format(template, Map.of("gender", "female"), "en"));
        assertEquals("They replied", formatter.format(template, Map.of("gender", "unknown"), "en"));
    }

    @Test
    void shouldApplyLanguagePluralRules() throws Exception {
        // Russian distinguishes one, few and many
        String template = "{count, plural, one{# файл} few{# файла} many{# файлов} other{# файла}}";

        assertEquals("1 файл", formatter.format(template, Map.of("count", 1), "ru_ru"));
        assertEquals("3 файла", formatter.format(template, Map.of("count", 3), "ru_ru"));
        assertEquals("5 файлов", formatter.format(template, Map.of("count", 5), "ru_ru"));
    }

    @Test
    void shouldFormatNumbersForLanguage() throws Exception {
        assertEquals("1.234,5", formatter.format("{amount, number}", Map.of("amount", 1234.5), "de_de"));
        assertEquals("1,234.5", formatter.format("{amount, number}", Map.of("amount", 1234.5), "en_us"));
    }

    @Test
    void shouldReportMalformedTemplate() {
        String malformed = "{count, plural, one{1 item} other{# items}";

        LyshraOpenI18nFormatException exception = assertThrows(LyshraOpenI18nFormatException.class,
                () -> formatter.format(malformed, Map.of("count", 3), "en"));

        assertEquals(malformed, exception.getTemplate());
        assertThat(exception.getCause()).isInstanceOf(IllegalArgumentException.class);
    }
}
