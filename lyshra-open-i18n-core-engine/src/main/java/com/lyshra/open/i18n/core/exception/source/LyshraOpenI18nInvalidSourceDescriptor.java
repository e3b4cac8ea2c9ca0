package com.lyshra.open.i18n.core.exception.source;

import com.lyshra.open.i18n.core.exception.LyshraOpenI18nRuntimeException;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSourceDescriptor;
import lombok.Data;

@Data
public class LyshraOpenI18nInvalidSourceDescriptor extends LyshraOpenI18nRuntimeException {
    private final ILyshraOpenI18nMessageSourceDescriptor descriptor;

    public LyshraOpenI18nInvalidSourceDescriptor(ILyshraOpenI18nMessageSourceDescriptor descriptor, String reason) {
        super("Invalid Message Source Descriptor: " + reason + ". Descriptor: [" + descriptor + "]");
        this.descriptor = descriptor;
    }

    public LyshraOpenI18nInvalidSourceDescriptor(ILyshraOpenI18nMessageSourceDescriptor descriptor, String reason, Throwable cause) {
        super("Invalid Message Source Descriptor: " + reason + ". Descriptor: [" + descriptor + "]", cause);
        this.descriptor = descriptor;
    }
}
