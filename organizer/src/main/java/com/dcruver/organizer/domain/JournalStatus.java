package com.dcruver.organizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of one executed plan entry, as written to the journal.
 */
public enum JournalStatus {
    MOVED,
    COPIED,
    MISSING,   // source gone at execution time, nothing touched
    FAILED;    // move/copy primitive raised, nothing relocated

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JournalStatus fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Journal status is required");
        }
        for (JournalStatus status : values()) {
            if (status.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown journal status: " + value);
    }

    /**
     * Whether a file was actually relocated (and so may be rolled back)
     */
    public boolean isRelocation() {
        return this == MOVED || this == COPIED;
    }
}
