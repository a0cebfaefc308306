package com.dcruver.organizer.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Signal categories a rule weight can be attached to.
 */
public enum SignalCategory {
    EXTENSION("extension", "ext", "mimetype"),
    FILENAME("filename", "name"),
    DIRECTORY("directory", "dir"),
    CONTENT("content");

    private final List<String> keys;

    SignalCategory(String... keys) {
        this.keys = Arrays.asList(keys);
    }

    public String getKey() {
        return keys.get(0);
    }

    public static Optional<SignalCategory> fromKey(String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(c -> c.keys.contains(normalized))
            .findFirst();
    }
}
