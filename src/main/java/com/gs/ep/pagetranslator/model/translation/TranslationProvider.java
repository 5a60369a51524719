package com.gs.ep.pagetranslator.model.translation;

/**
 * One translation backend. Implementations never throw: every failure comes back as a
 * {@link ProviderResult#failure(ProviderError)}.
 */
public interface TranslationProvider {

    String name();

    ProviderResult translate(String text);
}
