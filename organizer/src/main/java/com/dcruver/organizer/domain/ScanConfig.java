package com.dcruver.organizer.domain;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Roots and limits for one scan run.
 */
@Data
@Builder
public class ScanConfig {
    public static final long DEFAULT_MAX_SIZE_BYTES = 500L * 1024 * 1024;
    public static final int DEFAULT_SAMPLE_BYTES = 4096;

    private final List<Path> paths;
    @Builder.Default
    private final long maxSizeBytes = DEFAULT_MAX_SIZE_BYTES;
    @Builder.Default
    private final int sampleBytes = DEFAULT_SAMPLE_BYTES;
    @Builder.Default
    private final int threads = Math.max(2, Runtime.getRuntime().availableProcessors());
    @Builder.Default
    private final Set<String> excludeDirs = Set.of();
}
