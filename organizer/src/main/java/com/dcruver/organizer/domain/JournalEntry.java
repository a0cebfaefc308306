package com.dcruver.organizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One executed (or attempted) relocation. Written once, never rewritten.
 */
@Data
@Builder
@JsonPropertyOrder({"original_path", "target_path", "doc_id", "content_digest",
    "project_id", "bucket", "status", "timestamp"})
public class JournalEntry {
    private final String originalPath;
    private final String targetPath;
    private final String docId;
    private final String contentDigest;
    private final String projectId;
    private final String bucket;
    private final JournalStatus status;
    private final Instant timestamp;

    @JsonCreator
    public JournalEntry(
            @JsonProperty("original_path") String originalPath,
            @JsonProperty("target_path") String targetPath,
            @JsonProperty("doc_id") String docId,
            @JsonProperty("content_digest") String contentDigest,
            @JsonProperty("project_id") String projectId,
            @JsonProperty("bucket") String bucket,
            @JsonProperty("status") JournalStatus status,
            @JsonProperty("timestamp") Instant timestamp) {
        this.originalPath = originalPath;
        this.targetPath = targetPath;
        this.docId = docId;
        this.contentDigest = contentDigest;
        this.projectId = projectId;
        this.bucket = bucket;
        this.status = status;
        this.timestamp = timestamp;
    }

    public static JournalEntry forPlan(OrganizePlan plan, String contentDigest, JournalStatus status) {
        return JournalEntry.builder()
            .originalPath(plan.getSourcePath())
            .targetPath(plan.getTargetPath())
            .docId(plan.getDocId())
            .contentDigest(contentDigest)
            .projectId(plan.getProjectId())
            .bucket(plan.getBucket())
            .status(status)
            .timestamp(Instant.now())
            .build();
    }

    @JsonIgnore
    public Path getOriginal() {
        return Path.of(originalPath);
    }

    @JsonIgnore
    public Path getTarget() {
        return Path.of(targetPath);
    }
}
