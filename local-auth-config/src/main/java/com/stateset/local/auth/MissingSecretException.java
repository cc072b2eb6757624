package com.stateset.local.auth;

public class MissingSecretException extends LocalAuthConfigException {

    public MissingSecretException() {
        super("Unable to locate JWT secret. Set " + JwtSettingsResolver.SECRET_ENV
            + " or update config/default.toml.");
    }
}
