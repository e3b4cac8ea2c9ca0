package com.lyshra.open.i18n.core.engine.source;

import com.lyshra.open.i18n.core.engine.source.impl.InMemoryMessageSource;
import com.lyshra.open.i18n.core.engine.source.impl.ResourceBundleBackedMessageSource;
import com.lyshra.open.i18n.core.exception.source.LyshraOpenI18nInvalidSourceDescriptor;
import com.lyshra.open.i18n.core.util.CommonUtil;
import com.lyshra.open.i18n.integration.constant.LyshraOpenI18nConstants;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSource;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSourceDescriptor;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSourceFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Creates message sources from descriptors by looking up a creator registered for the descriptor type.
 *
 * <p>The {@code in-memory} and {@code resource-bundle} types are registered out of the box.
 * Further types can be added with {@link #register(String, Function)}.</p>
 */
@Slf4j
public class LyshraOpenI18nMessageSourceFactory implements ILyshraOpenI18nMessageSourceFactory {

    private final Map<String, Function<ILyshraOpenI18nMessageSourceDescriptor, ILyshraOpenI18nMessageSource>> registry;

    private LyshraOpenI18nMessageSourceFactory() {
        registry = new ConcurrentHashMap<>();
        registry.put(LyshraOpenI18nConstants.IN_MEMORY_SOURCE_TYPE, InMemoryMessageSource::new);
        registry.put(LyshraOpenI18nConstants.RESOURCE_BUNDLE_SOURCE_TYPE, ResourceBundleBackedMessageSource::new);
    }

    private static final class SingletonHelper {
        private static final LyshraOpenI18nMessageSourceFactory INSTANCE = new LyshraOpenI18nMessageSourceFactory();
    }

    public static LyshraOpenI18nMessageSourceFactory getInstance() {
        return SingletonHelper.INSTANCE;
    }

    /**
     * Creates a factory with only the built-in types registered (for testing).
     */
    public static LyshraOpenI18nMessageSourceFactory newInstance() {
        return new LyshraOpenI18nMessageSourceFactory();
    }

    public void register(String type, Function<ILyshraOpenI18nMessageSourceDescriptor, ILyshraOpenI18nMessageSource> creator) {
        if (CommonUtil.isNullOrBlank(type) || creator == null) {
            throw new IllegalArgumentException("type and creator cannot be null");
        }
        Function<ILyshraOpenI18nMessageSourceDescriptor, ILyshraOpenI18nMessageSource> previous = registry.put(type, creator);
        log.info("Registered message source type [{}], replaced existing: [{}]", type, previous != null);
    }

    public Set<String> getRegisteredTypes() {
        return Set.copyOf(registry.keySet());
    }

    @Override
    public ILyshraOpenI18nMessageSource create(ILyshraOpenI18nMessageSourceDescriptor descriptor) {
        if (descriptor == null || CommonUtil.isNullOrBlank(descriptor.getType())) {
            throw new LyshraOpenI18nInvalidSourceDescriptor(descriptor, "type is missing");
        }
        Function<ILyshraOpenI18nMessageSourceDescriptor, ILyshraOpenI18nMessageSource> creator = registry.get(descriptor.getType());
        if (creator == null) {
            throw new LyshraOpenI18nInvalidSourceDescriptor(descriptor, "unsupported type [" + descriptor.getType() + "]");
        }
        ILyshraOpenI18nMessageSource source;
        try {
            source = creator.apply(descriptor);
        } catch (IllegalArgumentException e) {
            throw new LyshraOpenI18nInvalidSourceDescriptor(descriptor, e.getMessage(), e);
        }
        if (source == null) {
            throw new LyshraOpenI18nInvalidSourceDescriptor(descriptor, "creator returned no source");
        }
        log.debug("Created message source [{}] of type [{}]", source.getClass().getSimpleName(), descriptor.getType());
        return source;
    }
}
