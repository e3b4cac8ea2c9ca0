package com.lyshra.open.i18n.integration.contract;

import com.lyshra.open.i18n.integration.exception.LyshraOpenI18nFormatException;

import java.util.Map;

public interface ILyshraOpenI18nMessageFormatter {
    String format(String template, Map<String, Object> params, String language) throws LyshraOpenI18nFormatException;
}
