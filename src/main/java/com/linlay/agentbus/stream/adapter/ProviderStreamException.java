package com.linlay.agentbus.stream.adapter;

public class ProviderStreamException extends RuntimeException {

    private final Integer statusCode;

    public ProviderStreamException(String message) {
        this(message, null, null);
    }

    public ProviderStreamException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ProviderStreamException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status reported by the provider, when the failure came from an HTTP exchange.
     */
    public Integer statusCode() {
        return statusCode;
    }
}
