package com.dcruver.organizer.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ContentIdentityTest {

    @TempDir
    Path tempDir;

    @Test
    void testDigestIsLowercaseSha256() throws Exception {
        Path file = tempDir.resolve("abc.txt");
        Files.writeString(file, "abc", StandardCharsets.UTF_8);

        String digest = new ContentIdentity().digest(file);

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", digest);
    }

    @Test
    void testDigestDoesNotDependOnChunkSize() throws Exception {
        byte[] content = new byte[20_000];
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) (i * 31);
        }
        Path file = tempDir.resolve("blob.bin");
        Files.write(file, content);

        String small = new ContentIdentity(1).digest(file);
        String odd = new ContentIdentity(7).digest(file);
        String standard = new ContentIdentity().digest(file);

        assertEquals(standard, small);
        assertEquals(standard, odd);
    }

    @Test
    void testEmptyFileHasWellKnownDigest() throws Exception {
        Path file = Files.createFile(tempDir.resolve("empty"));

        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
            new ContentIdentity().digest(file));
    }

    @Test
    void testDocumentIdIsStableForSamePathAndDigest() {
        ContentIdentity identity = new ContentIdentity();
        Path path = tempDir.resolve("a").resolve("..").resolve("file.txt");

        String first = identity.deriveId(path, "deadbeef");
        String second = identity.deriveId(tempDir.resolve("file.txt"), "deadbeef");

        assertEquals(first, second, "normalization should collapse '..'");
        assertEquals(5, UUID.fromString(first).version());
    }

    @Test
    void testDocumentIdChangesWithDigestOrPath() {
        ContentIdentity identity = new ContentIdentity();
        Path path = tempDir.resolve("file.txt");

        String base = identity.deriveId(path, "aaaa");

        assertNotEquals(base, identity.deriveId(path, "bbbb"));
        assertNotEquals(base, identity.deriveId(tempDir.resolve("other.txt"), "aaaa"));
    }

    @Test
    void testNameBasedUuidMatchesReferenceVector() {
        UUID dns = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

        UUID uuid = ContentIdentity.nameBasedUuid(dns, "python.org");

        assertEquals("886313e1-3b8a-5372-9b90-0c9aee199e5d", uuid.toString());
    }

    @Test
    void testNormalizedPathUsesForwardSlashes() {
        String normalized = ContentIdentity.normalizePath(tempDir.resolve("x").resolve("y.txt"));

        assertFalse(normalized.contains("\\"));
        assertTrue(normalized.endsWith("/x/y.txt"));
    }

    @Test
    void testUnreadableFileRaises() {
        Path missing = tempDir.resolve("missing.txt");

        assertThrows(java.io.IOException.class, () -> new ContentIdentity().digest(missing));
    }
}
