package com.lyshra.open.i18n.core.engine.source.impl;

import com.lyshra.open.i18n.core.util.CommonUtil;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSourceDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.context.support.ResourceBundleMessageSource;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ResourceBundle;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Message source reading {@code .properties} bundles from the classpath, one bundle per category.
 *
 * <p>The bundle of a category is {@code basePath.<file>} where {@code <file>} is taken from
 * the file map, or derived from the category name with {@code /} replaced by {@code .}.
 * For example with base path {@code i18n} the category {@code app/orders} reads
 * {@code i18n/app/orders_de.properties} for German.</p>
 */
@Slf4j
public class ResourceBundleBackedMessageSource extends AbstractMessageSource {
    private static final String PROPERTIES_SUFFIX = ".properties";
    private static final String PROPERTIES_FORMAT = "properties";
    private static final ResourceBundle.Control PROPERTIES_CONTROL =
            ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

    private final String basePath;
    private final Map<String, String> fileMap;
    private final ClassLoader bundleClassLoader;
    private final Map<String, MessageSource> bundles = new ConcurrentHashMap<>();
    private final Map<String, Boolean> bundlePresence = new ConcurrentHashMap<>();

    public ResourceBundleBackedMessageSource(
            String sourceLanguage,
            boolean forceTranslation,
            String basePath,
            Map<String, String> fileMap,
            ClassLoader bundleClassLoader) {
        super(sourceLanguage, forceTranslation);
        this.basePath = basePath;
        this.fileMap = Map.copyOf(CommonUtil.nonNullMap(fileMap));
        this.bundleClassLoader = bundleClassLoader != null
                ? bundleClassLoader
                : ResourceBundleBackedMessageSource.class.getClassLoader();
    }

    public ResourceBundleBackedMessageSource(ILyshraOpenI18nMessageSourceDescriptor descriptor) {
        this(
                descriptor.getSourceLanguage(),
                descriptor.isForceTranslation(),
                descriptor.getBasePath(),
                descriptor.getFileMap(),
                ResourceBundleBackedMessageSource.class.getClassLoader());
    }

    @Override
    protected Optional<String> lookup(String category, String key, String language) {
        if (CommonUtil.isNullOrBlank(key)) {
            return Optional.empty();
        }
        String baseName = getBundleBasename(category);
        Locale locale = CommonUtil.toLocale(language);
        if (!hasBundle(baseName, locale)) {
            return Optional.empty();
        }
        MessageSource bundle = bundles.computeIfAbsent(baseName, this::createMessageSource);
        // no args, the raw pattern is returned untouched and formatted by the pipeline
        String message = bundle.getMessage(key, null, null, locale);
        if (message == null) {
            log.trace("No translation for key: [{}], category: [{}], language: [{}]", key, category, language);
        }
        return Optional.ofNullable(message);
    }

    String getBundleBasename(String category) {
        String file = fileMap.getOrDefault(category, category.replace('/', '.'));
        if (file.endsWith(PROPERTIES_SUFFIX)) {
            file = file.substring(0, file.length() - PROPERTIES_SUFFIX.length());
        }
        return CommonUtil.isNotBlank(basePath) ? basePath + "." + file : file;
    }

    // a missing bundle is a plain miss; Spring is only asked for bundles found on the class loader
    private boolean hasBundle(String baseName, Locale locale) {
        return bundlePresence.computeIfAbsent(baseName + "_" + locale.toLanguageTag(), cacheKey -> {
            for (Locale candidate : PROPERTIES_CONTROL.getCandidateLocales(baseName, locale)) {
                String bundleName = PROPERTIES_CONTROL.toBundleName(baseName, candidate);
                if (bundleClassLoader.getResource(PROPERTIES_CONTROL.toResourceName(bundleName, PROPERTIES_FORMAT)) != null) {
                    return true;
                }
            }
            log.debug("No resource bundle for basename: [{}], locale: [{}]", baseName, locale);
            return false;
        });
    }

    private MessageSource createMessageSource(String baseName) {
        log.debug("Creating resource bundle message source for basename: [{}]", baseName);
        ResourceBundleMessageSource messageSource = new ResourceBundleMessageSource();
        messageSource.setBundleClassLoader(bundleClassLoader);
        messageSource.setDefaultEncoding(StandardCharsets.UTF_8.name());
        messageSource.setFallbackToSystemLocale(false);
        messageSource.setUseCodeAsDefaultMessage(false);
        messageSource.setBasename(baseName);
        return messageSource;
    }
}
