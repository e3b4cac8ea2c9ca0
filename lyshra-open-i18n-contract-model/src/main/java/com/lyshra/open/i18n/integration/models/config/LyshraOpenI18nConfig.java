package com.lyshra.open.i18n.integration.models.config;

import com.lyshra.open.i18n.integration.constant.LyshraOpenI18nConstants;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageFormatter;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSourceDescriptor;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.Map;

/**
 * Initial configuration of a translator.
 *
 * <p>{@code translations} maps category patterns to source descriptors. Iteration
 * order is registration order and decides which wildcard pattern wins when more
 * than one matches. Patterns are an exact category, {@code prefix*} or {@code *}.</p>
 */
@Data
@Builder
public class LyshraOpenI18nConfig {
    @Singular
    private final Map<String, ILyshraOpenI18nMessageSourceDescriptor> translations;
    @Builder.Default
    private final String defaultLanguage = LyshraOpenI18nConstants.DEFAULT_LANGUAGE;
    // optional, a default formatter is created lazily when absent
    private final ILyshraOpenI18nMessageFormatter formatter;

    /**
     * Binds a single source to every category.
     */
    public static LyshraOpenI18nConfig ofDefault(ILyshraOpenI18nMessageSourceDescriptor descriptor) {
        return LyshraOpenI18nConfig.builder()
                .translation(LyshraOpenI18nConstants.CATCH_ALL_PATTERN, descriptor)
                .build();
    }
}
