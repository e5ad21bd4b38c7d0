package com.caserag.provider;

/**
 * Failure of an embedding or completion call. Surfaced to the caller as-is; nothing in this codebase
 * retries it.
 */
public class ProviderException extends RuntimeException {
    private final String provider;
    private final int statusCode;

    public ProviderException(String provider, String message) {
        this(provider, message, -1, null);
    }

    public ProviderException(String provider, String message, Throwable cause) {
        this(provider, message, -1, cause);
    }

    public ProviderException(String provider, String message, int statusCode, Throwable cause) {
        super(provider + ": " + message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }

    public String provider() {
        return provider;
    }

    /**
     * HTTP status returned by the provider, or -1 when the call never produced one.
     */
    public int statusCode() {
        return statusCode;
    }
}
