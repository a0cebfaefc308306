package com.dcruver.organizer.domain;

import com.dcruver.organizer.config.ConfigurationException;

import java.util.Locale;

/**
 * Target-name disambiguation strategy. Only deterministic digest suffixing exists.
 */
public enum ConflictPolicy {
    VERSION;

    public static ConflictPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return VERSION;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("version") || normalized.equals("suffix")) {
            return VERSION;
        }
        throw new ConfigurationException("Unsupported conflict policy '" + value + "' (only 'version' is available)");
    }
}
