package com.dcruver.organizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Classifier output for a single document.
 */
@Data
@Builder
public class BucketScore {
    public static final String FALLBACK_BUCKET = "archive";
    public static final String FALLBACK_REASON = "fallback";

    private final String docId;
    private final String bucket;
    private final double score;
    private final List<String> reasons;

    @JsonCreator
    public BucketScore(
            @JsonProperty("doc_id") String docId,
            @JsonProperty("bucket") String bucket,
            @JsonProperty("score") double score,
            @JsonProperty("reasons") List<String> reasons) {
        this.docId = docId;
        this.bucket = bucket;
        this.score = score;
        this.reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    public static BucketScore fallback(String docId) {
        return new BucketScore(docId, FALLBACK_BUCKET, 0.0, List.of(FALLBACK_REASON));
    }

    @JsonIgnore
    public boolean isFallback() {
        return reasons.size() == 1 && FALLBACK_REASON.equals(reasons.get(0));
    }
}
