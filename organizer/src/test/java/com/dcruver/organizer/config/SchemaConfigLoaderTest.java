package com.dcruver.organizer.config;

import com.dcruver.organizer.domain.ConflictPolicy;
import com.dcruver.organizer.domain.ExecutionMode;
import com.dcruver.organizer.domain.SchemaConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final SchemaConfigLoader loader = new SchemaConfigLoader();

    @Test
    void testLoadSchema() throws Exception {
        Path target = tempDir.resolve("target");
        Path file = write("schema.yml", """
            target_root: %s
            structure: [src/core, docs]
            conflict_policy: version
            mode: copy
            """.formatted(target));

        SchemaConfig schema = loader.load(file);

        assertEquals(target.toAbsolutePath().normalize(), schema.getTargetRoot());
        assertEquals(List.of("src/core", "docs"), schema.getStructure());
        assertEquals(ConflictPolicy.VERSION, schema.getConflictPolicy());
        assertEquals(ExecutionMode.COPY, schema.getMode());
    }

    @Test
    void testDefaultsForModeAndConflictPolicy() throws Exception {
        Path file = write("schema.json", "{\"target_root\": \"out\"}");

        SchemaConfig schema = loader.load(file);

        assertEquals(ExecutionMode.MOVE, schema.getMode());
        assertEquals(ConflictPolicy.VERSION, schema.getConflictPolicy());
        assertTrue(schema.getStructure().isEmpty());
        assertTrue(schema.getTargetRoot().isAbsolute());
    }

    @Test
    void testOverridesWin() throws Exception {
        Path file = write("schema.yml", "target_root: out\nmode: move\n");
        Path override = tempDir.resolve("elsewhere");

        SchemaConfig schema = loader.load(file, override, "copy", "suffix");

        assertEquals(override.toAbsolutePath().normalize(), schema.getTargetRoot());
        assertEquals(ExecutionMode.COPY, schema.getMode());
    }

    @Test
    void testMissingTargetRootIsRejected() throws Exception {
        Path file = write("schema.yml", "structure: [docs]\n");

        assertThrows(ConfigurationException.class, () -> loader.load(file));
    }

    @Test
    void testMissingTargetRootAcceptedWithOverride() throws Exception {
        Path file = write("schema.yml", "structure: [docs]\n");

        SchemaConfig schema = loader.load(file, tempDir, null, null);

        assertEquals(tempDir.toAbsolutePath().normalize(), schema.getTargetRoot());
    }

    @Test
    void testUnknownModeIsRejected() throws Exception {
        Path file = write("schema.yml", "target_root: out\nmode: teleport\n");

        assertThrows(ConfigurationException.class, () -> loader.load(file));
    }

    @Test
    void testUnsupportedConflictPolicyIsRejected() throws Exception {
        Path file = write("schema.yml", "target_root: out\nconflict_policy: overwrite\n");

        assertThrows(ConfigurationException.class, () -> loader.load(file));
    }

    @Test
    void testAbsoluteStructureEntryIsRejected() throws Exception {
        Path file = write("schema.yml", "target_root: out\nstructure: [/etc]\n");

        assertThrows(ConfigurationException.class, () -> loader.load(file));
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
