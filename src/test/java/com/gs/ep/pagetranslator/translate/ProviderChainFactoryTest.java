package com.gs.ep.pagetranslator.translate;

import com.gs.ep.pagetranslator.model.translation.TranslationProvider;
import com.gs.ep.pagetranslator.model.translation.TranslationService;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class ProviderChainFactoryTest {

    private static TranslationConfig configOf(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return new TranslationConfig(properties);
    }

    @Test
    void createChain_allProviders_shouldPutChatFirstThenGooglePerCodeThenLibre() {
        TranslationConfig config = configOf(
                "api.key", "secret",
                "provider.google.codes", "sw,sw-KE",
                "provider.libre.enabled", "true",
                "provider.libre.url", "http://localhost:5000");

        ImmutableList<TranslationProvider> chain = ProviderChainFactory.createChain(config);

        assertEquals(Lists.immutable.with("chat", "google:sw", "google:sw-KE", "libre"),
                chain.collect(TranslationProvider::name));
    }

    @Test
    void createChain_chatWithoutKey_shouldBeSkipped() {
        ImmutableList<TranslationProvider> chain = ProviderChainFactory.createChain(configOf());

        assertEquals(Lists.immutable.with("google:sw"), chain.collect(TranslationProvider::name));
    }

    @Test
    void createChain_libreWithoutUrl_shouldBeSkipped() {
        TranslationConfig config = configOf("provider.google.enabled", "false", "api.key", "secret",
                "provider.libre.enabled", "true");

        assertEquals(Lists.immutable.with("chat"),
                ProviderChainFactory.createChain(config).collect(TranslationProvider::name));
    }

    @Test
    void createChain_nothingUsable_shouldThrow() {
        TranslationConfig config = configOf("provider.google.enabled", "false");

        assertThrows(IllegalStateException.class, () -> ProviderChainFactory.createChain(config));
    }

    @Test
    void createService_shouldCarryRetrySettings() {
        TranslationService service = ProviderChainFactory.createService(configOf("retry.max", "2"));

        assertEquals(2, service.getMaxRetries());
        assertEquals(1, service.getChain().size());
    }
}
