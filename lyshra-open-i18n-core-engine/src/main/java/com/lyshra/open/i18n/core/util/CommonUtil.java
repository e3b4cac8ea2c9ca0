package com.lyshra.open.i18n.core.util;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class CommonUtil {
    private static final char LANGUAGE_SEPARATOR = '_';
    private static final char LANGUAGE_TAG_SEPARATOR = '-';

    private CommonUtil() {
    }

    public static boolean isNullOrBlank(final String str) {
        return str == null || str.trim().isEmpty();
    }

    public static boolean isNotBlank(final String str) {
        return str != null && !str.trim().isEmpty();
    }

    public static <K, V> Map<K, V> nonNullMap(Map<K, V> map) {
        return Optional.ofNullable(map).orElse(Collections.emptyMap());
    }

    /**
     * Converts a language such as {@code en_us}, {@code en-US} or {@code de} into a locale.
     * A blank language maps to the JVM default locale.
     */
    public static Locale toLocale(String language) {
        if (isNullOrBlank(language)) {
            return Locale.getDefault();
        }
        return Locale.forLanguageTag(language.trim().replace(LANGUAGE_SEPARATOR, LANGUAGE_TAG_SEPARATOR));
    }

    // en_us, en-US and EN_US all name the same language
    public static boolean isSameLanguage(String language, String otherLanguage) {
        if (language == null || otherLanguage == null) {
            return language == null && otherLanguage == null;
        }
        return normalizeLanguage(language).equals(normalizeLanguage(otherLanguage));
    }

    private static String normalizeLanguage(String language) {
        return language.trim().replace(LANGUAGE_SEPARATOR, LANGUAGE_TAG_SEPARATOR).toLowerCase(Locale.ROOT);
    }
}
