package com.stateset.local.auth;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered lookups for a named setting. The first lookup with a value wins.
 */
public record ConfigSource(String setting, List<ConfigLookup> lookups) {

    public ConfigSource {
        Objects.requireNonNull(setting, "setting");
        lookups = List.copyOf(lookups);
    }

    public static ConfigSource of(String setting, ConfigLookup... lookups) {
        return new ConfigSource(setting, List.of(lookups));
    }

    public Optional<String> resolve() {
        for (ConfigLookup lookup : lookups) {
            Optional<String> value = lookup.lookup();
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
