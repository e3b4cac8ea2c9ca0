package com.lyshra.open.i18n.integration.contract;

import java.util.Optional;

/**
 * A provider of translated messages for a (category, key, language) triple.
 *
 * <p>An empty result means the source has no translation for the key. Callers
 * are expected to fall back to the key text itself, which is assumed to be
 * written in {@link #getSourceLanguage()}.</p>
 */
public interface ILyshraOpenI18nMessageSource {

    /**
     * Looks up the translation of a message.
     *
     * @param category the message category
     * @param key      the message key, usually the message text in the source language
     * @param language the target language, e.g. {@code en_us}, {@code de-DE}
     * @return the translated message, or empty when there is no translation
     */
    Optional<String> translate(String category, String key, String language);

    /**
     * @return the language the untranslated keys are written in
     */
    String getSourceLanguage();
}
