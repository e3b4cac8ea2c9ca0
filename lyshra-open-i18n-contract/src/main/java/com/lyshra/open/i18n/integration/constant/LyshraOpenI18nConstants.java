package com.lyshra.open.i18n.integration.constant;

public interface LyshraOpenI18nConstants {

    String CATCH_ALL_PATTERN = "*";
    char WILDCARD = '*';

    String DEFAULT_LANGUAGE = "en_us";

    // built-in message source type tags
    String IN_MEMORY_SOURCE_TYPE = "in-memory";
    String RESOURCE_BUNDLE_SOURCE_TYPE = "resource-bundle";
}
