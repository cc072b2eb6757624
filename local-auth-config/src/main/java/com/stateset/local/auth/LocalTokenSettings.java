package com.stateset.local.auth;

/**
 * Resolved signing secret and token lifetime for one invocation.
 */
public record LocalTokenSettings(String secret, long lifetimeSeconds) {

    public LocalTokenSettings {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("secret must not be empty");
        }
        if (lifetimeSeconds <= 0) {
            throw new IllegalArgumentException("lifetimeSeconds must be positive");
        }
    }

    @Override
    public String toString() {
        return "LocalTokenSettings[secret=<redacted>, lifetimeSeconds=" + lifetimeSeconds + "]";
    }
}
