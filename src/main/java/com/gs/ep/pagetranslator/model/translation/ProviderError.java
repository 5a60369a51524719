package com.gs.ep.pagetranslator.model.translation;

/**
 * Why a provider attempt produced no usable translation.
 */
public final class ProviderError {

    public enum Kind {
        /**
         * Network failure, timeout, rate limit or server error; worth retrying later.
         */
        TRANSIENT,
        /**
         * The provider answered but echoed the input or returned nothing.
         */
        DEGENERATE,
        /**
         * Rejected request or unreadable response; retrying the same request will not help.
         */
        FATAL
    }

    private final Kind kind;
    private final String providerName;
    private final String message;
    private final Throwable cause;

    public ProviderError(Kind kind, String providerName, String message, Throwable cause) {
        this.kind = kind;
        this.providerName = providerName;
        this.message = message;
        this.cause = cause;
    }

    public static ProviderError transientError(String providerName, String message, Throwable cause) {
        return new ProviderError(Kind.TRANSIENT, providerName, message, cause);
    }

    public static ProviderError degenerate(String providerName, String message) {
        return new ProviderError(Kind.DEGENERATE, providerName, message, null);
    }

    public static ProviderError fatal(String providerName, String message, Throwable cause) {
        return new ProviderError(Kind.FATAL, providerName, message, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public String getProviderName() {
        return providerName;
    }

    public String getMessage() {
        return message;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return kind + " from " + providerName + ": " + message;
    }
}
