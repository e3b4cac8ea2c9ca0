package com.lyshra.open.i18n.integration.exception;

import lombok.Getter;

/**
 * Reported by a formatter when a template cannot be formatted with the given parameters.
 */
@Getter
public class LyshraOpenI18nFormatException extends Exception {
    private final String template;

    public LyshraOpenI18nFormatException(String template, Throwable cause) {
        super("Failed to format message: [" + template + "]", cause);
        this.template = template;
    }
}
