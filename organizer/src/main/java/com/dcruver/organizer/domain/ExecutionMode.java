package com.dcruver.organizer.domain;

import com.dcruver.organizer.config.ConfigurationException;

import java.util.Locale;

/**
 * How the executor relocates files.
 */
public enum ExecutionMode {
    MOVE(JournalStatus.MOVED),
    COPY(JournalStatus.COPIED);

    private final JournalStatus successStatus;

    ExecutionMode(JournalStatus successStatus) {
        this.successStatus = successStatus;
    }

    public JournalStatus getSuccessStatus() {
        return successStatus;
    }

    public static ExecutionMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Execution mode is required (move|copy)");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown execution mode '" + value + "' (expected move|copy)");
        }
    }
}
