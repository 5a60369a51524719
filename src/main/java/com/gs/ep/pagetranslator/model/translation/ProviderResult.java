package com.gs.ep.pagetranslator.model.translation;

import java.util.Objects;

/**
 * Outcome of a single provider call: either translated text or a {@link ProviderError}.
 * Never persisted.
 */
public final class ProviderResult {
    private final String text;
    private final String providerName;
    private final ProviderError error;

    private ProviderResult(String text, String providerName, ProviderError error) {
        this.text = text;
        this.providerName = providerName;
        this.error = error;
    }

    public static ProviderResult success(String text, String providerName) {
        return new ProviderResult(Objects.requireNonNull(text, "text"), providerName, null);
    }

    public static ProviderResult failure(ProviderError error) {
        Objects.requireNonNull(error, "error");
        return new ProviderResult(null, error.getProviderName(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String getText() {
        return text;
    }

    public String getProviderName() {
        return providerName;
    }

    public ProviderError getError() {
        return error;
    }

    /**
     * Accepted results are non-blank and differ from the input once both are trimmed.
     */
    public boolean isAcceptedFor(String input) {
        if (!isSuccess()) {
            return false;
        }
        String trimmed = text.trim();
        return !trimmed.isEmpty() && !trimmed.equals(input.trim());
    }

    /**
     * The same result seen against {@code input}: successes that echo the input or are blank
     * become {@link ProviderError.Kind#DEGENERATE} failures.
     */
    public ProviderResult judgedAgainst(String input) {
        if (!isSuccess() || isAcceptedFor(input)) {
            return this;
        }
        String reason = text.trim().isEmpty() ? "empty translation" : "translation identical to input";
        return failure(ProviderError.degenerate(providerName, reason));
    }

    @Override
    public String toString() {
        return isSuccess() ? "success from " + providerName : error.toString();
    }
}
