package com.stateset.local.auth;

/**
 * Configuration the issuer cannot work without is missing or unreadable.
 */
public class LocalAuthConfigException extends RuntimeException {

    public LocalAuthConfigException(String message) {
        super(message);
    }

    public LocalAuthConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
