package com.dcruver.organizer.domain;

import lombok.Builder;
import lombok.Data;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bucket rules (in configured order), signal weights and project hints.
 */
@Data
@Builder
public class RuleConfig {
    public static final int DEFAULT_WEIGHT = 1;

    private final LinkedHashMap<String, BucketRule> buckets;
    @Builder.Default
    private final Map<SignalCategory, Integer> weights = new EnumMap<>(SignalCategory.class);
    @Builder.Default
    private final List<String> projectHints = List.of();

    public int weightOf(SignalCategory category) {
        return weights.getOrDefault(category, DEFAULT_WEIGHT);
    }
}
