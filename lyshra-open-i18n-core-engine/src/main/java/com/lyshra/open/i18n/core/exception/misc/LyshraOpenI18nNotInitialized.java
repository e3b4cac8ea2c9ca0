package com.lyshra.open.i18n.core.exception.misc;

import com.lyshra.open.i18n.core.exception.LyshraOpenI18nRuntimeException;

public class LyshraOpenI18nNotInitialized extends LyshraOpenI18nRuntimeException {
    public LyshraOpenI18nNotInitialized() {
        super("I18N Not Initialized. Call getInstance(config) first");
    }
}
