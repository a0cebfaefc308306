package com.dcruver.organizer.config;

import com.dcruver.organizer.domain.ConflictPolicy;
import com.dcruver.organizer.domain.ExecutionMode;
import com.dcruver.organizer.domain.SchemaConfig;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads the target schema. Command-line overrides win over file values.
 *
 * Documented fallbacks: conflict_policy defaults to version, mode to move,
 * structure to no pre-created directories. target_root has no fallback.
 */
@Component
@Slf4j
public class SchemaConfigLoader {

    public SchemaConfig load(Path file) {
        return load(file, null, null, null);
    }

    public SchemaConfig load(Path file, Path targetOverride, String modeOverride, String conflictOverride) {
        JsonNode root = ConfigFileSupport.readRoot(file, "Schema configuration");

        Path targetRoot = targetOverride;
        if (targetRoot == null) {
            String configured = ConfigFileSupport.optionalText(root, "target_root");
            if (configured == null || configured.isBlank()) {
                throw new ConfigurationException("Schema configuration " + file + " is missing 'target_root'");
            }
            targetRoot = Path.of(configured);
        }

        List<String> structure = ConfigFileSupport.stringList(root.get("structure"), "structure");
        for (String relative : structure) {
            if (Path.of(relative).isAbsolute()) {
                throw new ConfigurationException("Schema structure entries must be relative: " + relative);
            }
        }

        String mode = modeOverride != null ? modeOverride : ConfigFileSupport.optionalText(root, "mode");
        String conflict = conflictOverride != null
            ? conflictOverride
            : ConfigFileSupport.optionalText(root, "conflict_policy");

        SchemaConfig schema = SchemaConfig.builder()
            .targetRoot(targetRoot.toAbsolutePath().normalize())
            .structure(structure)
            .conflictPolicy(ConflictPolicy.parse(conflict))
            .mode(mode == null ? ExecutionMode.MOVE : ExecutionMode.parse(mode))
            .build();

        log.info("Loaded schema from {}: target={}, mode={}, {} structure dirs",
            file, schema.getTargetRoot(), schema.getMode(), structure.size());
        return schema;
    }
}
