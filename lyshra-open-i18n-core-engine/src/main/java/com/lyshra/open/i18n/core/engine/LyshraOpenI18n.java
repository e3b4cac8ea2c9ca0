package com.lyshra.open.i18n.core.engine;

import com.lyshra.open.i18n.core.engine.pipeline.LyshraOpenI18nMessagePipeline;
import com.lyshra.open.i18n.core.exception.misc.LyshraOpenI18nNotInitialized;
import com.lyshra.open.i18n.core.util.CommonUtil;
import com.lyshra.open.i18n.integration.models.config.LyshraOpenI18nConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Optional process-wide holder of a default {@link LyshraOpenI18nMessagePipeline}.
 *
 * <p>Code that can receive a pipeline through its constructor should do so; this holder
 * is for call sites that need ambient access, e.g. {@code LyshraOpenI18n.t("app", "Hello")}.
 * The instance is created once by {@link #getInstance(LyshraOpenI18nConfig)} and dropped by
 * {@link #releaseInstance()}, after which a new one can be created.</p>
 */
@Slf4j
public final class LyshraOpenI18n {

    private static volatile LyshraOpenI18nMessagePipeline instance;

    private LyshraOpenI18n() {
    }

    /**
     * Returns the default instance, creating it from {@code config} if there is none yet.
     * The config is ignored when an instance already exists.
     */
    public static LyshraOpenI18nMessagePipeline getInstance(LyshraOpenI18nConfig config) {
        if (instance == null) {
            synchronized (LyshraOpenI18n.class) {
                if (instance == null) {
                    instance = new LyshraOpenI18nMessagePipeline(config);
                    log.info("Default I18N instance created, default language: [{}]", instance.getDefaultLanguage());
                }
            }
        }
        return instance;
    }

    public static LyshraOpenI18nMessagePipeline getInstance() {
        LyshraOpenI18nMessagePipeline current = instance;
        if (current == null) {
            throw new LyshraOpenI18nNotInitialized();
        }
        return current;
    }

    public static void releaseInstance() {
        synchronized (LyshraOpenI18n.class) {
            instance = null;
        }
        log.info("Default I18N instance released");
    }

    public static String t(String category, String message) {
        return t(category, message, Map.of(), null);
    }

    public static String t(String category, String message, Map<String, ?> params) {
        return t(category, message, params, null);
    }

    /**
     * Translates with the default instance. A blank language means the configured default language.
     */
    public static String t(String category, String message, Map<String, ?> params, String language) {
        LyshraOpenI18nMessagePipeline pipeline = getInstance();
        String targetLanguage = CommonUtil.isNotBlank(language) ? language : pipeline.getDefaultLanguage();
        return pipeline.translate(category, message, params, targetLanguage);
    }
}
