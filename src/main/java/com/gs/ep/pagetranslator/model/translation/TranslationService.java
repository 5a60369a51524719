package com.gs.ep.pagetranslator.model.translation;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Translates text through an ordered chain of providers. The first provider is the primary and
 * is retried with exponential backoff; the rest are consulted when the primary degenerates and
 * once more, together with the primary, after the retries run out.
 * <p>
 * Stateless apart from its immutable chain, so one instance is shared by all pipeline workers.
 */
public class TranslationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationService.class);

    public static final int DEFAULT_MAX_RETRIES = 4;
    public static final double DEFAULT_BACKOFF_BASE_SECONDS = 1.5;

    private static final String NO_PROVIDER = "none";

    private final ImmutableList<TranslationProvider> chain;
    private final int maxRetries;
    private final double backoffBaseSeconds;
    private final Sleeper sleeper;

    public TranslationService(List<? extends TranslationProvider> providers) {
        this(providers, DEFAULT_MAX_RETRIES, DEFAULT_BACKOFF_BASE_SECONDS, Sleeper.THREAD);
    }

    public TranslationService(List<? extends TranslationProvider> providers, int maxRetries,
                              double backoffBaseSeconds, Sleeper sleeper) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("At least one translation provider is required");
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1, got " + maxRetries);
        }
        if (backoffBaseSeconds < 0) {
            throw new IllegalArgumentException("Backoff base must not be negative, got " + backoffBaseSeconds);
        }
        this.chain = Lists.immutable.withAll(providers);
        this.maxRetries = maxRetries;
        this.backoffBaseSeconds = backoffBaseSeconds;
        this.sleeper = sleeper;
    }

    public ListIterable<TranslationProvider> getChain() {
        return chain;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public String translate(String text) throws TranslationException {
        return translate(text, result -> { });
    }

    /**
     * @param attemptListener notified after every provider call, in call order
     * @return accepted translation; {@code ""} for blank input
     * @throws TranslationException when neither the retries nor the final sweep yield an
     *                              accepted result, or the worker is interrupted while backing off
     */
    public String translate(String text, Consumer<ProviderResult> attemptListener) throws TranslationException {
        if (text == null || text.trim().isEmpty()) {
            return "";
        }
        Attempts attempts = new Attempts(text, attemptListener);
        TranslationProvider primary = chain.getFirst();
        ListIterable<TranslationProvider> fallbacks = chain.drop(1);

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            ProviderResult result = attempts.call(primary);
            if (result.isSuccess()) {
                return result.getText();
            }
            if (result.getError().getKind() == ProviderError.Kind.DEGENERATE && fallbacks.notEmpty()) {
                LOGGER.debug("Primary provider {} degenerated on attempt {}, trying fallbacks",
                        primary.name(), attempt);
                ProviderResult corrected = attempts.sweep(fallbacks);
                if (corrected.isSuccess()) {
                    return corrected.getText();
                }
            }
            if (attempt < maxRetries) {
                backOff(attempt, attempts);
            }
        }

        ProviderResult last = attempts.sweep(chain);
        if (last.isSuccess()) {
            return last.getText();
        }
        throw new TranslationException("Translation failed after " + attempts.calls + " provider calls: "
                + attempts.lastError, attempts.lastError, attempts.calls);
    }

    /**
     * One pass over the full chain without backoff. Returns the first accepted result, or a
     * failure carrying the last error seen.
     */
    public ProviderResult sweep(String text) {
        if (text == null || text.trim().isEmpty()) {
            return ProviderResult.success("", NO_PROVIDER);
        }
        return new Attempts(text, result -> { }).sweep(chain);
    }

    long backoffMillis(int attempt) {
        return Math.round(backoffBaseSeconds * 1000.0 * Math.pow(2, attempt - 1));
    }

    private void backOff(int attempt, Attempts attempts) throws TranslationException {
        long millis = backoffMillis(attempt);
        LOGGER.debug("Backing off {} ms before attempt {}", millis, attempt + 1);
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Interrupted while backing off", attempts.lastError, attempts.calls);
        }
    }

    /**
     * Call bookkeeping for one translate or sweep invocation.
     */
    private static final class Attempts {
        private final String text;
        private final Consumer<ProviderResult> listener;
        private int calls;
        private ProviderError lastError;

        private Attempts(String text, Consumer<ProviderResult> listener) {
            this.text = text;
            this.listener = listener;
        }

        ProviderResult call(TranslationProvider provider) {
            ProviderResult result;
            try {
                result = provider.translate(text).judgedAgainst(text);
            } catch (RuntimeException e) {
                result = ProviderResult.failure(ProviderError.fatal(provider.name(), e.toString(), e));
            }
            calls++;
            if (!result.isSuccess()) {
                lastError = result.getError();
                LOGGER.debug("Provider call {} failed: {}", calls, lastError);
            }
            listener.accept(result);
            return result;
        }

        ProviderResult sweep(ListIterable<TranslationProvider> providers) {
            for (TranslationProvider provider : providers) {
                ProviderResult result = call(provider);
                if (result.isSuccess()) {
                    return result;
                }
            }
            return ProviderResult.failure(lastError != null
                    ? lastError
                    : ProviderError.fatal(NO_PROVIDER, "no provider consulted", null));
        }
    }
}
