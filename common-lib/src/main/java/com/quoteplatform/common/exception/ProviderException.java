package com.quoteplatform.common.exception;

import com.quoteplatform.common.model.ErrorKind;

/**
 * Failure raised by, or on behalf of, a single quote provider.
 */
public class ProviderException extends RuntimeException {
    private final String providerName;
    private final ErrorKind kind;

    public ProviderException(String providerName, ErrorKind kind, String message) {
        super("[" + providerName + "] " + message);
        this.providerName = providerName;
        this.kind = kind;
    }

    public ProviderException(String providerName, ErrorKind kind, String message, Throwable cause) {
        super("[" + providerName + "] " + message, cause);
        this.providerName = providerName;
        this.kind = kind;
    }

    public static ProviderException malformed(String providerName, String detail) {
        return new ProviderException(providerName, ErrorKind.PROVIDER_ERROR, "malformed payload: " + detail);
    }

    public String getProviderName() {
        return providerName;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
