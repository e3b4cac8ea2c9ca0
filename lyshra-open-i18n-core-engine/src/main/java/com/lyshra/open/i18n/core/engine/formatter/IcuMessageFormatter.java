package com.lyshra.open.i18n.core.engine.formatter;

import com.ibm.icu.text.MessageFormat;
import com.lyshra.open.i18n.core.util.CommonUtil;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageFormatter;
import com.lyshra.open.i18n.integration.exception.LyshraOpenI18nFormatException;

import java.util.Map;

/**
 * Formats ICU message patterns with named arguments, e.g.
 * {@code {count, plural, one{# item} other{# items}}}.
 */
public class IcuMessageFormatter implements ILyshraOpenI18nMessageFormatter {

    @Override
    public String format(String template, Map<String, Object> params, String language) throws LyshraOpenI18nFormatException {
        try {
            MessageFormat mf = new MessageFormat(template, CommonUtil.toLocale(language));
            return mf.format(CommonUtil.nonNullMap(params));
        } catch (IllegalArgumentException e) {
            throw new LyshraOpenI18nFormatException(template, e);
        }
    }
}
