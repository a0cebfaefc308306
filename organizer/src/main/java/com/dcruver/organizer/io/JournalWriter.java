package com.dcruver.organizer.io;

import com.dcruver.organizer.domain.JournalEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Append-only JSON Lines journal. Each entry is flushed as soon as it is written
 * so an interrupted run still leaves every completed operation on disk.
 */
@Slf4j
public class JournalWriter implements Closeable {

    private final Path journalPath;
    private final ObjectMapper objectMapper;
    private final BufferedWriter writer;
    private int written;

    public JournalWriter(Path journalPath, ObjectMapper objectMapper) throws IOException {
        this.journalPath = journalPath;
        this.objectMapper = objectMapper;

        Path parent = journalPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        boolean torn = endsWithPartialLine(journalPath);
        this.writer = Files.newBufferedWriter(journalPath, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        if (torn) {
            // terminate the fragment so our first entry starts on its own line
            log.warn("Journal {} ends with a partial line; starting a new line", journalPath);
            writer.newLine();
            writer.flush();
        }
        log.debug("Opened journal {} for append", journalPath);
    }

    static boolean endsWithPartialLine(Path file) throws IOException {
        if (!Files.exists(file)) {
            return false;
        }
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size == 0) {
                return false;
            }
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.position(size - 1);
            channel.read(last);
            return last.get(0) != '\n';
        }
    }

    public synchronized void append(JournalEntry entry) throws IOException {
        writer.write(objectMapper.writeValueAsString(entry));
        writer.newLine();
        writer.flush();
        written++;
    }

    public Path getJournalPath() {
        return journalPath;
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
        log.debug("Closed journal {} after {} entries", journalPath, written);
    }
}
