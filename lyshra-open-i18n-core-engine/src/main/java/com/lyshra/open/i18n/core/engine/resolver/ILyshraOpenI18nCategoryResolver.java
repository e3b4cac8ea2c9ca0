package com.lyshra.open.i18n.core.engine.resolver;

import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSource;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSourceDescriptor;

import java.util.List;

/**
 * Maps message categories to message sources.
 *
 * <p>Bindings are keyed by a category pattern:</p>
 * <ul>
 *   <li>an exact category, e.g. {@code app/orders}</li>
 *   <li>a prefix wildcard, e.g. {@code app/*}, matching every category starting with {@code app/}</li>
 *   <li>the catch-all {@code *}, matching every category no other pattern matches</li>
 * </ul>
 */
public interface ILyshraOpenI18nCategoryResolver {

    /**
     * Resolves the source of a category. Exact bindings win over prefix wildcards, prefix wildcards
     * over the catch-all. Among prefix wildcards the first registered match wins.
     *
     * @param category the message category
     * @return the bound message source, created from its descriptor on first use
     * @throws com.lyshra.open.i18n.core.exception.source.LyshraOpenI18nMessageSourceNotFound if no pattern matches
     */
    ILyshraOpenI18nMessageSource resolve(String category);

    /**
     * Binds a source descriptor to a pattern. The source is created on the first resolution that needs it.
     */
    void register(String pattern, ILyshraOpenI18nMessageSourceDescriptor descriptor);

    void register(String pattern, ILyshraOpenI18nMessageSource source);

    /**
     * @return every registry key in scan order, including exact categories cached by earlier resolutions
     */
    List<String> getRegisteredPatterns();
}
