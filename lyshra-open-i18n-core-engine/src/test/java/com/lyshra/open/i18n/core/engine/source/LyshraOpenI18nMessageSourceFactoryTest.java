package com.lyshra.open.i18n.core.engine.source;

import com.lyshra.open.i18n.core.engine.source.impl.InMemoryMessageSource;
import com.lyshra.open.i18n.core.engine.source.impl.ResourceBundleBackedMessageSource;
import com.lyshra.open.i18n.core.exception.source.LyshraOpenI18nInvalidSourceDescriptor;
import com.lyshra.open.i18n.integration.contract.ILyshraOpenI18nMessageSource;
import com.lyshra.open.i18n.integration.models.source.LyshraOpenI18nMessageSourceDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class LyshraOpenI18nMessageSourceFactoryTest {

    private LyshraOpenI18nMessageSourceFactory factory;

    @BeforeEach
    void setUp() {
        factory = LyshraOpenI18nMessageSourceFactory.newInstance();
    }

    @Test
    @DisplayName("should register the built-in source types")
    void shouldRegisterBuiltInTypes() {
        assertThat(factory.getRegisteredTypes()).containsExactlyInAnyOrder("in-memory", "resource-bundle");
    }

    @Test
    @DisplayName("should create an in-memory source with the descriptor fields applied")
    void shouldCreateInMemorySource() {
        LyshraOpenI18nMessageSourceDescriptor descriptor = LyshraOpenI18nMessageSourceDescriptor.inMemory(
                "en_us", Map.of("de", Map.of("Yes", "Ja")));

        ILyshraOpenI18nMessageSource source = factory.create(descriptor);

        assertInstanceOf(InMemoryMessageSource.class, source);
        assertEquals("en_us", source.getSourceLanguage());
        assertEquals("Ja", source.translate("common", "Yes", "de").orElseThrow());
    }

    @Test
    @DisplayName("should create a resource bundle source")
    void shouldCreateResourceBundleSource() {
        ILyshraOpenI18nMessageSource source = factory.create(
                LyshraOpenI18nMessageSourceDescriptor.resourceBundle("en_us", "i18n"));

        assertInstanceOf(ResourceBundleBackedMessageSource.class, source);
        assertEquals("en_us", source.getSourceLanguage());
    }

    @Test
    @DisplayName("should create a new source on every call")
    void shouldCreateNewSourceEveryCall() {
        LyshraOpenI18nMessageSourceDescriptor descriptor = LyshraOpenI18nMessageSourceDescriptor.inMemory("en_us", Map.of());

        assertNotSame(factory.create(descriptor), factory.create(descriptor));
    }

    @Test
    @DisplayName("should reject a descriptor without type")
    void shouldRejectMissingType() {
        LyshraOpenI18nMessageSourceDescriptor descriptor = LyshraOpenI18nMessageSourceDescriptor.builder()
                .sourceLanguage("en_us")
                .build();

        LyshraOpenI18nInvalidSourceDescriptor exception = assertThrows(LyshraOpenI18nInvalidSourceDescriptor.class,
                () -> factory.create(descriptor));

        assertSame(descriptor, exception.getDescriptor());
        assertThat(exception.getMessage()).contains("type is missing");
    }

    @Test
    @DisplayName("should reject a null descriptor")
    void shouldRejectNullDescriptor() {
        assertThrows(LyshraOpenI18nInvalidSourceDescriptor.class, () -> factory.create(null));
    }

    @Test
    @DisplayName("should reject an unknown type")
    void shouldRejectUnknownType() {
        LyshraOpenI18nMessageSourceDescriptor descriptor = LyshraOpenI18nMessageSourceDescriptor.builder()
                .type("database")
                .build();

        LyshraOpenI18nInvalidSourceDescriptor exception = assertThrows(LyshraOpenI18nInvalidSourceDescriptor.class,
                () -> factory.create(descriptor));

        assertThat(exception.getMessage()).contains("unsupported type [database]");
    }

    @Test
    @DisplayName("should reject a descriptor the source cannot be built from")
    void shouldRejectUnbuildableDescriptor() {
        LyshraOpenI18nMessageSourceDescriptor descriptor = LyshraOpenI18nMessageSourceDescriptor.builder()
                .type("in-memory")
                .sourceLanguage(" ")
                .build();

        LyshraOpenI18nInvalidSourceDescriptor exception = assertThrows(LyshraOpenI18nInvalidSourceDescriptor.class,
                () -> factory.create(descriptor));

        assertInstanceOf(IllegalArgumentException.class, exception.getCause());
    }

    @Test
    @DisplayName("should create sources of a registered custom type")
    void shouldCreateCustomType() {
        ILyshraOpenI18nMessageSource custom = mock(ILyshraOpenI18nMessageSource.class);
        factory.register("database", descriptor -> custom);

        ILyshraOpenI18nMessageSource source = factory.create(LyshraOpenI18nMessageSourceDescriptor.builder().type("database").build());

        assertSame(custom, source);
    }

    @Test
    @DisplayName("should reject a creator that returns nothing")
    void shouldRejectNullCreation() {
        factory.register("broken", descriptor -> null);

        assertThrows(LyshraOpenI18nInvalidSourceDescriptor.class,
                () -> factory.create(LyshraOpenI18nMessageSourceDescriptor.builder().type("broken").build()));
    }

    @Test
    @DisplayName("should not leak custom types into other factories")
    void shouldKeepRegistrationsPerFactory() {
        factory.register("database", descriptor -> mock(ILyshraOpenI18nMessageSource.class));

        assertFalse(LyshraOpenI18nMessageSourceFactory.newInstance().getRegisteredTypes().contains("database"));
    }
}
