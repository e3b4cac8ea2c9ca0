package com.lyshra.open.i18n.core.exception;

public class LyshraOpenI18nRuntimeException extends RuntimeException {
    public LyshraOpenI18nRuntimeException(String message) {
        super(message);
    }
    public LyshraOpenI18nRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
    public LyshraOpenI18nRuntimeException(Throwable cause) {
        super(cause);
    }
}
