package com.lyshra.open.i18n.core.engine.pipeline;

import com.lyshra.open.i18n.core.engine.formatter.IcuMessageFormatter;
import com.lyshra.open.i18n.core.engine.resolver.ILyshraOpenI18nCategoryResolver;
import com.lyshra.open.i18n.core.engine.resolver.LyshraOpenI18nCategoryResolver;
import com.lyshra.open.i18n.core.engine.source.LyshraOpenI18nMessageSourceFactory;
import com.lyshra.open.i18n.core.util.CommonUtil;
import com.lyshra.open.i18n.integration.constant.LyshraOpenI18nConstants;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageFormatter;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSource;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSourceDescriptor;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nTranslator;
import com.lyshra.open.i18n.integration.exception.LyshraOpenI18nFormatException;
import com.lyshra.open.i18n.integration.models.config.LyshraOpenI18nConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates messages through the category resolver and formats them.
 *
 * <p>Formatting has two tiers. Messages containing ICU syntax ({@code {name,}}) go to the
 * {@link ILyshraOpenI18nMessageFormatter}; all other messages get plain {@code {name}}
 * placeholder substitution. Formatting never fails: when the formatter rejects a message
 * the message is returned unformatted.</p>
 *
 * <pre>{@code
 * LyshraOpenI18nMessagePipeline i18n = new LyshraOpenI18nMessagePipeline(LyshraOpenI18nConfig.builder()
 *         .translation("app/*", LyshraOpenI18nMessageSourceDescriptor.resourceBundle("en_us", "i18n"))
 *         .translation("*", LyshraOpenI18nMessageSourceDescriptor.inMemory("en_us", Map.of()))
 *         .build());
 * i18n.translate("app/orders", "Hello, {username}!", Map.of("username", "Alexander"), "de_de");
 * }</pre>
 */
@Slf4j
public class LyshraOpenI18nMessagePipeline implements ILyshraOpenI18nTranslator {

    private static final Pattern ICU_SYNTAX = Pattern.compile("\\{\\s*\\w+\\s*,", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]*)}");

    private final ILyshraOpenI18nCategoryResolver resolver;
    private final Supplier<ILyshraOpenI18nMessageFormatter> defaultFormatterSupplier;
    @Getter
    private final String defaultLanguage;
    private volatile ILyshraOpenI18nMessageFormatter formatter;

    public LyshraOpenI18nMessagePipeline(LyshraOpenI18nConfig config) {
        this(
                new LyshraOpenI18nCategoryResolver(config.getTranslations(), LyshraOpenI18nMessageSourceFactory.getInstance()),
                IcuMessageFormatter::new,
                config.getDefaultLanguage());
        this.formatter = config.getFormatter();
    }

    public LyshraOpenI18nMessagePipeline(
            ILyshraOpenI18nCategoryResolver resolver,
            Supplier<ILyshraOpenI18nMessageFormatter> defaultFormatterSupplier,
            String defaultLanguage) {
        if (resolver == null || defaultFormatterSupplier == null) {
            throw new IllegalArgumentException("resolver and defaultFormatterSupplier cannot be null");
        }
        this.resolver = resolver;
        this.defaultFormatterSupplier = defaultFormatterSupplier;
        this.defaultLanguage = CommonUtil.isNotBlank(defaultLanguage) ? defaultLanguage : LyshraOpenI18nConstants.DEFAULT_LANGUAGE;
    }

    @Override
    public String translate(String category, String message, Map<String, ?> params, String language) {
        ILyshraOpenI18nMessageSource source = resolveSource(category);
        Optional<String> translation = source.translate(category, message, language);
        if (translation.isEmpty()) {
            log.trace("No translation for message: [{}], category: [{}], language: [{}]", message, category, language);
            // an untranslated message is written in the source language, format it as such
            return format(message, params, source.getSourceLanguage());
        }
        return format(translation.get(), params, language);
    }

    @Override
    public String format(String message, Map<String, ?> params, String language) {
        Map<String, Object> arguments = normalize(params);
        if (arguments.isEmpty() || message == null) {
            return message;
        }

        if (ICU_SYNTAX.matcher(message).find()) {
            try {
                return getFormatter().format(message, arguments, language);
            } catch (LyshraOpenI18nFormatException | RuntimeException e) {
                log.trace("Failed to format message: [{}], language: [{}], returning it unformatted", message, language, e);
                return message;
            }
        }

        return substitutePlaceholders(message, arguments);
    }

    // single pass, substituted values are never scanned again
    private static String substitutePlaceholders(String message, Map<String, Object> arguments) {
        Matcher matcher = PLACEHOLDER.matcher(message);
        StringBuilder result = new StringBuilder(message.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = arguments.containsKey(name) ? String.valueOf(arguments.get(name)) : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static Map<String, Object> normalize(Map<String, ?> params) {
        return new LinkedHashMap<String, Object>(CommonUtil.nonNullMap(params));
    }

    @Override
    public ILyshraOpenI18nMessageSource resolveSource(String category) {
        return resolver.resolve(category);
    }

    public void register(String pattern, ILyshraOpenI18nMessageSourceDescriptor descriptor) {
        resolver.register(pattern, descriptor);
    }

    public void register(String pattern, ILyshraOpenI18nMessageSource source) {
        resolver.register(pattern, source);
    }

    @Override
    public ILyshraOpenI18nMessageFormatter getFormatter() {
        if (formatter == null) {
            synchronized (this) {
                if (formatter == null) {
                    formatter = defaultFormatterSupplier.get();
                }
            }
        }
        return formatter;
    }

    /**
     * Replaces the formatter used from the next {@link #format} call on. Passing {@code null}
     * restores the lazily created default formatter.
     */
    @Override
    public void setFormatter(ILyshraOpenI18nMessageFormatter formatter) {
        this.formatter = formatter;
    }
}
