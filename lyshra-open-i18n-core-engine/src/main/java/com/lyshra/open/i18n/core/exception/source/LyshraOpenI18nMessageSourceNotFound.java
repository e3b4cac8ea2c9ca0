package com.lyshra.open.i18n.core.exception.source;

import com.lyshra.open.i18n.core.exception.LyshraOpenI18nRuntimeException;
import lombok.Data;

@Data
public class LyshraOpenI18nMessageSourceNotFound extends LyshraOpenI18nRuntimeException {
    private final String category;

    public LyshraOpenI18nMessageSourceNotFound(String category) {
        super("Message Source Not Found. Category: [" + category + "]");
        this.category = category;
    }
}
