package com.dcruver.organizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * One proposed relocation. Advisory only: the journal records what actually happened.
 */
@Data
@Builder
public class OrganizePlan {
    private final String docId;
    private final String projectId;
    private final String projectLabel;
    private final String bucket;
    private final String sourcePath;
    private final String targetPath;
    private final String hashSuffix;

    @JsonCreator
    public OrganizePlan(
            @JsonProperty("doc_id") String docId,
            @JsonProperty("project_id") String projectId,
            @JsonProperty("project_label") String projectLabel,
            @JsonProperty("bucket") String bucket,
            @JsonProperty("source_path") String sourcePath,
            @JsonProperty("target_path") String targetPath,
            @JsonProperty("hash_suffix") String hashSuffix) {
        this.docId = docId;
        this.projectId = projectId;
        this.projectLabel = projectLabel;
        this.bucket = bucket;
        this.sourcePath = sourcePath;
        this.targetPath = targetPath;
        this.hashSuffix = hashSuffix;
    }

    @JsonIgnore
    public Path getSource() {
        return Path.of(sourcePath);
    }

    @JsonIgnore
    public Path getTarget() {
        return Path.of(targetPath);
    }
}
