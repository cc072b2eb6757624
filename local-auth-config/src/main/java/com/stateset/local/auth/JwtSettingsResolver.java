package com.stateset.local.auth;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the JWT signing secret and lifetime the same way the API does:
 * namespaced env var, then the legacy env var, then {@code config/default.toml}.
 */
@Slf4j
public class JwtSettingsResolver {

    public static final String SECRET_KEY = "jwt_secret";
    public static final String SECRET_ENV = "APP__JWT_SECRET";
    public static final String SECRET_LEGACY_ENV = "JWT_SECRET";

    public static final String EXPIRATION_KEY = "jwt_expiration";
    public static final String EXPIRATION_ENV = "APP__JWT_EXPIRATION";
    public static final String EXPIRATION_LEGACY_ENV = "JWT_EXPIRATION";

    public static final long DEFAULT_LIFETIME_SECONDS = 3600L;

    /** Longest lifetime whose expiry still fits an {@link Instant} for any issue time before Instant.MAX / 2. */
    public static final long MAX_LIFETIME_SECONDS = Instant.MAX.getEpochSecond() / 2;

    /** The API refuses to boot with a shorter secret. */
    public static final int MIN_API_SECRET_LENGTH = 64;

    private final Map<String, ConfigSource> sources;

    public JwtSettingsResolver(Function<String, String> environment, TomlConfigFile file) {
        this.sources = Map.of(
            SECRET_KEY, ConfigSource.of(SECRET_KEY,
                ConfigLookup.env(environment, SECRET_ENV),
                ConfigLookup.env(environment, SECRET_LEGACY_ENV),
                ConfigLookup.file(file, SECRET_KEY)),
            EXPIRATION_KEY, ConfigSource.of(EXPIRATION_KEY,
                ConfigLookup.env(environment, EXPIRATION_ENV),
                ConfigLookup.env(environment, EXPIRATION_LEGACY_ENV),
                ConfigLookup.file(file, EXPIRATION_KEY)));
    }

    public static JwtSettingsResolver fromEnvironment() {
        return fromEnvironment(TomlConfigFile.DEFAULT_PATH);
    }

    public static JwtSettingsResolver fromEnvironment(Path configFile) {
        return new JwtSettingsResolver(System::getenv, new TomlConfigFile(configFile));
    }

    public Optional<String> resolve(String setting) {
        ConfigSource source = sources.get(setting);
        if (source == null) {
            throw new IllegalArgumentException("Unknown setting: " + setting);
        }
        return source.resolve();
    }

    public LocalTokenSettings resolve() {
        return new LocalTokenSettings(resolveSecret(), resolveLifetimeSeconds());
    }

    public String resolveSecret() {
        String secret = resolve(SECRET_KEY).orElseThrow(MissingSecretException::new);
        if (secret.length() < MIN_API_SECRET_LENGTH) {
            log.info("JWT secret is {} characters; the API rejects secrets shorter than {}",
                secret.length(), MIN_API_SECRET_LENGTH);
        }
        return secret;
    }

    public long resolveLifetimeSeconds() {
        Optional<String> raw = resolve(EXPIRATION_KEY);
        if (raw.isEmpty()) {
            return DEFAULT_LIFETIME_SECONDS;
        }
        try {
            long parsed = Long.parseLong(raw.get().trim());
            if (parsed <= 0 || parsed > MAX_LIFETIME_SECONDS) {
                log.debug("Ignoring out-of-range {}={}", EXPIRATION_KEY, parsed);
                return DEFAULT_LIFETIME_SECONDS;
            }
            return parsed;
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed {}={}", EXPIRATION_KEY, raw.get());
            return DEFAULT_LIFETIME_SECONDS;
        }
    }
}
