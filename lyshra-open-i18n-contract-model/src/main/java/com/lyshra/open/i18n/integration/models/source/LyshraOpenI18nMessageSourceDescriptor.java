package com.lyshra.open.i18n.integration.models.source;

import com.lyshra.open.i18n.integration.constant.LyshraOpenI18nConstants;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSourceDescriptor;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.Map;

/**
 * Configuration of a message source that has not been created yet.
 *
 * <p>{@code type} selects the factory that builds the source; the remaining
 * fields are read by that factory only:</p>
 * <ul>
 *   <li>{@code sourceLanguage}: language of the untranslated keys</li>
 *   <li>{@code basePath}: base name directory for bundle backed sources, e.g. {@code i18n}</li>
 *   <li>{@code fileMap}: category to bundle name, categories not listed use their own name</li>
 *   <li>{@code messages}: language to key to translation, for in-memory sources</li>
 *   <li>{@code forceTranslation}: translate even when the target language is the source language</li>
 * </ul>
 */
@Data
@Builder
public class LyshraOpenI18nMessageSourceDescriptor implements ILyshraOpenI18nMessageSourceDescriptor, Serializable {
    private final String type;
    @Builder.Default
    private final String sourceLanguage = LyshraOpenI18nConstants.DEFAULT_LANGUAGE;
    private final String basePath;
    @Builder.Default
    private final Map<String, String> fileMap = Map.of();
    @Builder.Default
    private final Map<String, Map<String, String>> messages = Map.of();
    private final boolean forceTranslation;

    public static LyshraOpenI18nMessageSourceDescriptor inMemory(String sourceLanguage, Map<String, Map<String, String>> messages) {
        return LyshraOpenI18nMessageSourceDescriptor.builder()
                .type(LyshraOpenI18nConstants.IN_MEMORY_SOURCE_TYPE)
                .sourceLanguage(sourceLanguage)
                .messages(messages)
                .build();
    }

    public static LyshraOpenI18nMessageSourceDescriptor resourceBundle(String sourceLanguage, String basePath) {
        return LyshraOpenI18nMessageSourceDescriptor.builder()
                .type(LyshraOpenI18nConstants.RESOURCE_BUNDLE_SOURCE_TYPE)
                .sourceLanguage(sourceLanguage)
                .basePath(basePath)
                .build();
    }
}
