package com.dcruver.organizer.domain;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * The slice of a document the clusterer needs, with the bucket it was classified into.
 */
@Data
@Builder
public class ClusterCandidate {
    private final String docId;
    private final Path path;
    private final String name;
    private final String bucket;
    private final String dirHint;

    public static ClusterCandidate of(Document doc, String bucket) {
        return ClusterCandidate.builder()
            .docId(doc.getDocId())
            .path(doc.getFilePath())
            .name(doc.getName())
            .bucket(bucket)
            .dirHint(doc.getDirHint())
            .build();
    }
}
