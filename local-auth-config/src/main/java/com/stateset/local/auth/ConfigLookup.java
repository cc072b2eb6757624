package com.stateset.local.auth;

import java.util.Optional;
import java.util.function.Function;

/**
 * One place a setting may come from. Implementations return empty when the
 * place has nothing for the setting; an empty string counts as nothing.
 */
@FunctionalInterface
public interface ConfigLookup {

    Optional<String> lookup();

    static ConfigLookup env(Function<String, String> environment, String variable) {
        return () -> nonEmpty(environment.apply(variable));
    }

    static ConfigLookup file(TomlConfigFile file, String key) {
        return () -> file.value(key);
    }

    private static Optional<String> nonEmpty(String value) {
        return (value == null || value.isEmpty()) ? Optional.empty() : Optional.of(value);
    }
}
