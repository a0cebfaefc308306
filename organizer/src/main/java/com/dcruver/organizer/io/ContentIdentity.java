package com.dcruver.organizer.io;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Content digests and document identifiers.
 *
 * The digest is SHA-256 over the file bytes, read in fixed-size chunks.
 * The document id is a name-based UUID (version 5, SHA-1) over
 * {@code <posix path>::<digest>} in a fixed namespace, so the same
 * (path, content) pair always maps to the same id.
 */
@Component
public class ContentIdentity {

    public static final UUID NAMESPACE = UUID.fromString("12345678-1234-5678-1234-567812345678");
    public static final int DEFAULT_CHUNK_SIZE = 8192;

    private final int chunkSize;

    public ContentIdentity() {
        this(DEFAULT_CHUNK_SIZE);
    }

    public ContentIdentity(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.chunkSize = chunkSize;
    }

    /**
     * Hex SHA-256 of the file content.
     */
    public String digest(Path file) throws IOException {
        MessageDigest md = newDigest("SHA-256");
        byte[] buf = new byte[chunkSize];
        try (InputStream in = Files.newInputStream(file)) {
            int r;
            while ((r = in.read(buf)) != -1) {
                md.update(buf, 0, r);
            }
        }
        return HexFormat.of().formatHex(md.digest());
    }

    public String deriveId(Path path, String digest) {
        return nameBasedUuid(NAMESPACE, normalizePath(path) + "::" + digest).toString();
    }

    /**
     * Absolute, normalized, forward-slash separated.
     */
    public static String normalizePath(Path path) {
        String normalized = path.toAbsolutePath().normalize().toString();
        return normalized.replace('\\', '/');
    }

    static UUID nameBasedUuid(UUID namespace, String name) {
        MessageDigest sha1 = newDigest("SHA-1");
        ByteBuffer ns = ByteBuffer.allocate(16);
        ns.putLong(namespace.getMostSignificantBits());
        ns.putLong(namespace.getLeastSignificantBits());
        sha1.update(ns.array());
        sha1.update(name.getBytes(StandardCharsets.UTF_8));
        byte[] hash = sha1.digest();

        hash[6] = (byte) ((hash[6] & 0x0f) | 0x50);  // version 5
        hash[8] = (byte) ((hash[8] & 0x3f) | 0x80);  // IETF variant

        ByteBuffer bb = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(bb.getLong(), bb.getLong());
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
