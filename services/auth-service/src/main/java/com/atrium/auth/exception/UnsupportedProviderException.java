package com.atrium.auth.exception;

/** Provider tag not known to this service (400). */
public class UnsupportedProviderException extends RuntimeException {

    public UnsupportedProviderException(String provider) {
        super("Unsupported provider: " + provider);
    }
}
