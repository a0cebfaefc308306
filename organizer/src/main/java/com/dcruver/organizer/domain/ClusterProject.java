package com.dcruver.organizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An inferred project: documents that share a path-derived label.
 */
@Data
@Builder
public class ClusterProject {
    private final String projectId;
    private final String projectLabel;
    private final List<String> docIds;  // membership, in input order
    private final Map<String, String> roleBucketMap;  // docId -> bucket
    private final double confidence;
    private final List<String> reasons;

    @JsonCreator
    public ClusterProject(
            @JsonProperty("project_id") String projectId,
            @JsonProperty("project_label") String projectLabel,
            @JsonProperty("doc_ids") List<String> docIds,
            @JsonProperty("role_bucket_map") Map<String, String> roleBucketMap,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("reasons") List<String> reasons) {
        this.projectId = projectId;
        this.projectLabel = projectLabel;
        this.docIds = docIds != null ? List.copyOf(docIds) : List.of();
        this.roleBucketMap = roleBucketMap != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(roleBucketMap))
            : Map.of();
        this.confidence = confidence;
        this.reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    public int size() {
        return docIds.size();
    }
}
