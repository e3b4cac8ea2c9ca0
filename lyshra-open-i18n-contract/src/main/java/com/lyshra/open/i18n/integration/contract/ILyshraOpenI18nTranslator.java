package com.lyshra.open.i18n.integration.contract;

import java.util.Map;

/**
 * Entry point for translating and formatting messages.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * String text = translator.translate("app/orders", "You have {count, plural, one{# order} other{# orders}}",
 *         Map.of("count", 3), "de_de");
 * }</pre>
 */
public interface ILyshraOpenI18nTranslator {

    /**
     * Translates a message and substitutes its parameters.
     * Never fails because a translation or a parameter is missing; on a miss the
     * key text is formatted with the source language of the resolved source.
     *
     * @param category the message category
     * @param message  the message key
     * @param params   named parameters, may be null or empty
     * @param language the requested language
     * @return the translated and formatted message
     */
    String translate(String category, String message, Map<String, ?> params, String language);

    /**
     * Substitutes parameters into a message without translating it.
     *
     * @param message  the message text
     * @param params   named parameters, may be null or empty
     * @param language the language used for locale sensitive formatting
     * @return the formatted message, or the message itself if formatting failed
     */
    String format(String message, Map<String, ?> params, String language);

    /**
     * @param category the message category
     * @return the message source bound to the category
     */
    ILyshraOpenI18nMessageSource resolveSource(String category);

    ILyshraOpenI18nMessageFormatter getFormatter();

    void setFormatter(ILyshraOpenI18nMessageFormatter formatter);
}
