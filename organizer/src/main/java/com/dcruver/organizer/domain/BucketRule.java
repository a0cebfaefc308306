package com.dcruver.organizer.domain;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Matching criteria for one bucket. Every list may be empty.
 */
@Data
@Builder
public class BucketRule {
    private final String name;
    @Builder.Default
    private final List<String> exts = List.of();  // lowercase, no dot
    @Builder.Default
    private final List<String> nameKeywords = List.of();
    @Builder.Default
    private final List<String> dirKeywords = List.of();
    @Builder.Default
    private final List<String> codeHints = List.of();
    @Builder.Default
    private final List<String> imports = List.of();
    @Builder.Default
    private final List<String> titleKeywords = List.of();
}
