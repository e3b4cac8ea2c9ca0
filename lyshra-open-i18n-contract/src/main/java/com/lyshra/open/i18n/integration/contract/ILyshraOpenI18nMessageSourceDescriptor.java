package com.lyshra.open.i18n.integration.contract;

import java.util.Map;

public interface ILyshraOpenI18nMessageSourceDescriptor {
    String getType();
    String getSourceLanguage();
    String getBasePath();
    Map<String, String> getFileMap();
    Map<String, Map<String, String>> getMessages();
    boolean isForceTranslation();
}
