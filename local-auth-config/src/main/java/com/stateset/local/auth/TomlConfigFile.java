package com.stateset.local.auth;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Top-level keys of a local TOML file, read on first access and kept for the
 * rest of the invocation. A missing file reads as an empty document.
 */
@Slf4j
public class TomlConfigFile {

    public static final Path DEFAULT_PATH = Path.of("config", "default.toml");

    private final Path path;
    private final TomlMapper mapper;
    private JsonNode root;

    public TomlConfigFile(Path path) {
        this(path, new TomlMapper());
    }

    public TomlConfigFile(Path path, TomlMapper mapper) {
        this.path = Objects.requireNonNull(path, "path");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Optional<String> value(String key) {
        JsonNode node = document().get(key);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return Optional.empty();
        }
        String text = node.asText();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    private JsonNode document() {
        if (root == null) {
            root = load();
        }
        return root;
    }

    private JsonNode load() {
        if (!Files.exists(path)) {
            log.debug("No config file at {}", path.toAbsolutePath());
            return MissingNode.getInstance();
        }
        try (InputStream in = Files.newInputStream(path)) {
            JsonNode tree = mapper.readTree(in);
            return tree == null ? MissingNode.getInstance() : tree;
        } catch (NoSuchFileException e) {
            log.debug("Config file {} disappeared before it could be read", path);
            return MissingNode.getInstance();
        } catch (IOException e) {
            throw new LocalAuthConfigException("Failed to read config file " + path, e);
        }
    }
}
