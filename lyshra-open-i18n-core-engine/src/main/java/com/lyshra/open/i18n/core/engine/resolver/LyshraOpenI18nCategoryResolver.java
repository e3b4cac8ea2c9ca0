package com.lyshra.open.i18n.core.engine.resolver;

import com.lyshra.open.i18n.core.exception.source.LyshraOpenI18nMessageSourceNotFound;
import com.lyshra.open.i18n.core.util.CommonUtil;
import com.lyshra.open.i18n.integration.constant.LyshraOpenI18nConstants;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSource;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSourceDescriptor;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSourceFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry backed category resolver.
 *
 * <p>Resolution order for a category:</p>
 * <ol>
 *   <li>the entry keyed exactly by the category</li>
 *   <li>the first registered prefix wildcard whose prefix starts the category</li>
 *   <li>the catch-all {@code *} entry</li>
 * </ol>
 *
 * <p>A descriptor is turned into a source at most once: the registry slot of the matched
 * pattern is replaced by the created source, and the category itself is cached so the next
 * resolution is a single map lookup. Entries are never removed.</p>
 *
 * <p>Thread-safe: cached hits are served under a read lock, scanning and caching run under
 * the write lock.</p>
 */
@Slf4j
public class LyshraOpenI18nCategoryResolver implements ILyshraOpenI18nCategoryResolver {

    private final Map<String, LyshraOpenI18nCategoryBinding> registry;
    private final ILyshraOpenI18nMessageSourceFactory sourceFactory;
    private final ReadWriteLock lock;

    public LyshraOpenI18nCategoryResolver(
            Map<String, ? extends ILyshraOpenI18nMessageSourceDescriptor> translations,
            ILyshraOpenI18nMessageSourceFactory sourceFactory) {
        if (sourceFactory == null) {
            throw new IllegalArgumentException("sourceFactory cannot be null");
        }
        this.registry = new LinkedHashMap<>();
        this.sourceFactory = sourceFactory;
        this.lock = new ReentrantReadWriteLock();
        CommonUtil.nonNullMap(translations).forEach((pattern, descriptor) -> {
            validatePattern(pattern);
            registry.put(pattern, LyshraOpenI18nCategoryBinding.of(pattern, descriptor));
        });
        log.info("LyshraOpenI18nCategoryResolver initialized with patterns: {}", registry.keySet());
    }

    @Override
    public ILyshraOpenI18nMessageSource resolve(String category) {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }

        lock.readLock().lock();
        try {
            LyshraOpenI18nCategoryBinding cached = registry.get(category);
            if (cached != null && cached.isRealized()) {
                return cached.getSource();
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            // another thread may have realized the category meanwhile, the exact lookup covers that
            LyshraOpenI18nCategoryBinding binding = findBinding(category);
            if (binding == null) {
                log.debug("No message source pattern matches category [{}]", category);
                throw new LyshraOpenI18nMessageSourceNotFound(category);
            }
            return realizeAndCache(binding, category);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private LyshraOpenI18nCategoryBinding findBinding(String category) {
        LyshraOpenI18nCategoryBinding exact = registry.get(category);
        if (exact != null) {
            return exact;
        }
        for (LyshraOpenI18nCategoryBinding binding : registry.values()) {
            if (binding.matches(category)) {
                log.debug("Category [{}] matched wildcard pattern [{}]", category, binding.getPattern());
                return binding;
            }
        }
        LyshraOpenI18nCategoryBinding catchAll = registry.get(LyshraOpenI18nConstants.CATCH_ALL_PATTERN);
        if (catchAll != null) {
            log.debug("Category [{}] falls back to the catch-all pattern", category);
        }
        return catchAll;
    }

    private ILyshraOpenI18nMessageSource realizeAndCache(LyshraOpenI18nCategoryBinding binding, String category) {
        LyshraOpenI18nCategoryBinding realized = binding;
        if (!binding.isRealized()) {
            log.debug("Creating message source for pattern [{}] requested by category [{}]", binding.getPattern(), category);
            realized = binding.realize(sourceFactory);
            registry.put(binding.getPattern(), realized);
        }
        if (!binding.getPattern().equals(category)) {
            registry.put(category, LyshraOpenI18nCategoryBinding.of(category, realized.getSource()));
        }
        return realized.getSource();
    }

    @Override
    public void register(String pattern, ILyshraOpenI18nMessageSourceDescriptor descriptor) {
        validatePattern(pattern);
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        put(LyshraOpenI18nCategoryBinding.of(pattern, descriptor));
    }

    @Override
    public void register(String pattern, ILyshraOpenI18nMessageSource source) {
        validatePattern(pattern);
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        put(LyshraOpenI18nCategoryBinding.of(pattern, source));
    }

    private void put(LyshraOpenI18nCategoryBinding binding) {
        lock.writeLock().lock();
        try {
            LyshraOpenI18nCategoryBinding previous = registry.put(binding.getPattern(), binding);
            log.info("Registered message source for pattern [{}], replaced existing: [{}]", binding.getPattern(), previous != null);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<String> getRegisteredPatterns() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(registry.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    private static void validatePattern(String pattern) {
        if (CommonUtil.isNullOrBlank(pattern)) {
            throw new IllegalArgumentException("pattern cannot be blank");
        }
    }
}
