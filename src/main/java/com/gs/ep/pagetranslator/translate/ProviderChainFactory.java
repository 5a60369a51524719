package com.gs.ep.pagetranslator.translate;

import com.gs.ep.pagetranslator.model.translation.ChatCompletionProvider;
import com.gs.ep.pagetranslator.model.translation.GoogleWebProvider;
import com.gs.ep.pagetranslator.model.translation.LibreTranslateProvider;
import com.gs.ep.pagetranslator.model.translation.Sleeper;
import com.gs.ep.pagetranslator.model.translation.TranslationProvider;
import com.gs.ep.pagetranslator.model.translation.TranslationService;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the provider chain, primary first: chat completions, Google web (one provider per
 * language code convention), LibreTranslate.
 */
public final class ProviderChainFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderChainFactory.class);

    private ProviderChainFactory() {
    }

    public static ImmutableList<TranslationProvider> createChain(TranslationConfig config) {
        MutableList<TranslationProvider> chain = Lists.mutable.empty();
        int timeout = config.getHttpTimeoutSeconds();
        String sourceCode = config.getSourceLanguage();

        if (config.isChatProviderEnabled()) {
            if (config.getApiKey().isEmpty()) {
                LOGGER.warn("Chat completion provider enabled but api.key is empty; skipping it");
            } else {
                chain.add(new ChatCompletionProvider(config.getApiUrl(), config.getApiKey(), config.getModelName(),
                        sourceCode, config.getTargetLanguage(), timeout));
            }
        }
        if (config.isGoogleProviderEnabled()) {
            for (String code : config.getGoogleCodes()) {
                chain.add(new GoogleWebProvider(config.getGoogleUrl(), sourceCode, code, timeout));
            }
        }
        if (config.isLibreProviderEnabled()) {
            if (config.getLibreUrl().isEmpty()) {
                LOGGER.warn("LibreTranslate provider enabled but provider.libre.url is empty; skipping it");
            } else {
                chain.add(new LibreTranslateProvider(config.getLibreUrl(), config.getLibreApiKey(), sourceCode,
                        config.getTargetCode(), timeout));
            }
        }

        if (chain.isEmpty()) {
            throw new IllegalStateException("No translation provider is configured");
        }
        LOGGER.info("Translation provider chain: {}", chain.collect(TranslationProvider::name).makeString(" -> "));
        return chain.toImmutable();
    }

    public static TranslationService createService(TranslationConfig config) {
        return new TranslationService(createChain(config).castToList(), config.getMaxRetries(),
                config.getBackoffBaseSeconds(), Sleeper.THREAD);
    }
}
