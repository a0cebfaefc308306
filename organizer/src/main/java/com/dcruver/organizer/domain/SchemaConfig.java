package com.dcruver.organizer.domain;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.nio.file.Path;
import java.util.List;

/**
 * Target layout for reorganized projects. Read-only to the core.
 */
@Data
@Builder
@With
public class SchemaConfig {
    private final Path targetRoot;
    private final List<String> structure;  // relative dirs pre-created per project
    private final ConflictPolicy conflictPolicy;
    private final ExecutionMode mode;
}
