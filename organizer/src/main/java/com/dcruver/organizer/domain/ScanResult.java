package com.dcruver.organizer.domain;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one scan run. Documents are in discovery order.
 */
@Data
@Builder
public class ScanResult {
    private final List<Document> documents;
    private final List<Path> missingRoots;
    private final int discovered;
    private final int skippedOversize;
    private final int failed;

    public int getScanned() {
        return documents.size();
    }
}
