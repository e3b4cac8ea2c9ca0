package com.lyshra.open.i18n.integration.contract;

/**
 * Turns inert source configuration into a live {@link ILyshraOpenI18nMessageSource}.
 */
@FunctionalInterface
public interface ILyshraOpenI18nMessageSourceFactory {

    /**
     * @param descriptor the source configuration
     * @return a new message source
     * @throws RuntimeException if the descriptor cannot be turned into a source
     */
    ILyshraOpenI18nMessageSource create(ILyshraOpenI18nMessageSourceDescriptor descriptor);
}
