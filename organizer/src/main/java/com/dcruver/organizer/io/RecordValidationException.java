package com.dcruver.organizer.io;

/**
 * A persisted record (document, score, cluster, plan or journal entry) is missing
 * a required field or carries a value of the wrong shape.
 */
public class RecordValidationException extends RuntimeException {

    private final String recordType;
    private final String source;

    public RecordValidationException(String recordType, String source, String message) {
        super(recordType + " record in " + source + ": " + message);
        this.recordType = recordType;
        this.source = source;
    }

    public RecordValidationException(String recordType, String source, String message, Throwable cause) {
        super(recordType + " record in " + source + ": " + message, cause);
        this.recordType = recordType;
        this.source = source;
    }

    public String getRecordType() {
        return recordType;
    }

    public String getSource() {
        return source;
    }
}
