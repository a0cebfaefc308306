package com.dcruver.organizer.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Shared parsing helpers for YAML/JSON configuration files.
 * Every structural problem becomes a {@link ConfigurationException}.
 */
final class ConfigFileSupport {

    private static final ObjectMapper JSON = JsonConfig.createMapper();
    private static final ObjectMapper YAML = JsonConfig.createYamlMapper();

    private ConfigFileSupport() {
    }

    static JsonNode readRoot(Path file, String kind) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ConfigurationException(kind + " file not found: " + file);
        }

        boolean json = file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
        JsonNode root;
        try {
            root = (json ? JSON : YAML).readTree(file.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot parse " + kind + " file " + file + ": " + e.getMessage(), e);
        }

        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ConfigurationException(kind + " file is empty: " + file);
        }
        if (!root.isObject()) {
            throw new ConfigurationException(kind + " file must contain a mapping at the top level: " + file);
        }
        return root;
    }

    static List<String> stringList(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigurationException("'" + field + "' must be a list");
        }

        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isValueNode() || item.isNull()) {
                throw new ConfigurationException("'" + field + "' must contain only scalar values");
            }
            values.add(item.asText());
        }
        return List.copyOf(values);
    }

    static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isValueNode()) {
            throw new ConfigurationException("'" + field + "' must be a scalar value");
        }
        return node.asText();
    }
}
