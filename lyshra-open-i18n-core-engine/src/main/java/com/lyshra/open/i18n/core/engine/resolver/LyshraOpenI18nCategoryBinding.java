package com.lyshra.open.i18n.core.engine.resolver;

import com.lyshra.open.i18n.core.exception.source.LyshraOpenI18nInvalidSourceDescriptor;
import com.lyshra.open.i18n.integration.constant.LyshraOpenI18nConstants;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSource;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSourceDescriptor;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSourceFactory;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * A registry entry: a category pattern and either a live source or the descriptor to create it from.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class LyshraOpenI18nCategoryBinding {
    private final String pattern;
    private final ILyshraOpenI18nMessageSourceDescriptor descriptor;
    private final ILyshraOpenI18nMessageSource source;

    public static LyshraOpenI18nCategoryBinding of(String pattern, ILyshraOpenI18nMessageSourceDescriptor descriptor) {
        return new LyshraOpenI18nCategoryBinding(pattern, descriptor, null);
    }

    public static LyshraOpenI18nCategoryBinding of(String pattern, ILyshraOpenI18nMessageSource source) {
        return new LyshraOpenI18nCategoryBinding(pattern, null, source);
    }

    public boolean isRealized() {
        return source != null;
    }

    // a leading '*' never makes a prefix pattern, so "*" and "*foo" are skipped
    public boolean isPrefixWildcard() {
        return pattern.indexOf(LyshraOpenI18nConstants.WILDCARD) > 0;
    }

    public String getPrefix() {
        int end = pattern.length();
        while (end > 0 && pattern.charAt(end - 1) == LyshraOpenI18nConstants.WILDCARD) {
            end--;
        }
        return pattern.substring(0, end);
    }

    public boolean matches(String category) {
        return isPrefixWildcard() && category.startsWith(getPrefix());
    }

    /**
     * @return a binding for the same pattern holding the created source, or this binding if already realized
     */
    LyshraOpenI18nCategoryBinding realize(ILyshraOpenI18nMessageSourceFactory factory) {
        if (isRealized()) {
            return this;
        }
        ILyshraOpenI18nMessageSource created = factory.create(descriptor);
        if (created == null) {
            throw new LyshraOpenI18nInvalidSourceDescriptor(descriptor, "factory returned no source");
        }
        return of(pattern, created);
    }
}
