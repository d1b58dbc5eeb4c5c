package com.chainoracle.source;

/**
 * A single provider call failed. Carries the provider id so fallback chains can report who was tried.
 */
public class UpstreamException extends RuntimeException {

    private final String provider;

    public UpstreamException(String provider, String message) {
        super(provider + ": " + message);
        this.provider = provider;
    }

    public UpstreamException(String provider, String message, Throwable cause) {
        super(provider + ": " + message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
