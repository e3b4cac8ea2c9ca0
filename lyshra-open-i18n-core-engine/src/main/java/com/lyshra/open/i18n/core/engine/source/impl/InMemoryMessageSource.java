package com.lyshra.open.i18n.core.engine.source.impl;

import com.lyshra.open.i18n.core.util.CommonUtil;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSourceDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Message source holding its translations in memory, keyed by language then message key.
 * Categories are not distinguished; bind one instance per category pattern to separate them.
 */
@Slf4j
public class InMemoryMessageSource extends AbstractMessageSource {
    private final Map<String, Map<String, String>> messages;

    public InMemoryMessageSource(String sourceLanguage, boolean forceTranslation, Map<String, Map<String, String>> messages) {
        super(sourceLanguage, forceTranslation);
        this.messages = new HashMap<>();
        CommonUtil.nonNullMap(messages).forEach((language, translations) ->
                this.messages.put(normalize(language), Map.copyOf(CommonUtil.nonNullMap(translations))));
        log.debug("InMemoryMessageSource created with languages: {}", this.messages.keySet());
    }

    public InMemoryMessageSource(ILyshraOpenI18nMessageSourceDescriptor descriptor) {
        this(descriptor.getSourceLanguage(), descriptor.isForceTranslation(), descriptor.getMessages());
    }

    @Override
    protected Optional<String> lookup(String category, String key, String language) {
        if (language == null || key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(messages.get(normalize(language)))
                .map(translations -> translations.get(key));
    }

    private static String normalize(String language) {
        return CommonUtil.toLocale(language).toLanguageTag().toLowerCase(Locale.ROOT);
    }
}
