package com.lyshra.open.i18n.core.engine.source.impl;

import com.lyshra.open.i18n.core.util.CommonUtil;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSource;
import lombok.Getter;

import java.util.Optional;

/**
 * Base class for message sources that treat the source language as already translated.
 *
 * <p>Unless {@code forceTranslation} is set, a lookup for the source language is a
 * miss without consulting the backing store: the key is the message in that language.</p>
 */
@Getter
public abstract class AbstractMessageSource implements ILyshraOpenI18nMessageSource {
    private final String sourceLanguage;
    private final boolean forceTranslation;

    protected AbstractMessageSource(String sourceLanguage, boolean forceTranslation) {
        if (CommonUtil.isNullOrBlank(sourceLanguage)) {
            throw new IllegalArgumentException("sourceLanguage cannot be blank");
        }
        this.sourceLanguage = sourceLanguage;
        this.forceTranslation = forceTranslation;
    }

    @Override
    public Optional<String> translate(String category, String key, String language) {
        if (!forceTranslation && CommonUtil.isSameLanguage(language, sourceLanguage)) {
            return Optional.empty();
        }
        return lookup(category, key, language);
    }

    protected abstract Optional<String> lookup(String category, String key, String language);
}
