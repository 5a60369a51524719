package com.gs.ep.pagetranslator.model.translation;

public class TranslationException extends Exception {

    private final ProviderError lastError;
    private final int attempts;

    public TranslationException(String message) {
        this(message, null, 0);
    }

    public TranslationException(String message, ProviderError lastError, int attempts) {
        super(message, lastError == null ? null : lastError.getCause());
        this.lastError = lastError;
        this.attempts = attempts;
    }

    public ProviderError getLastError() {
        return lastError;
    }

    /**
     * Provider calls made before giving up.
     */
    public int getAttempts() {
        return attempts;
    }
}
