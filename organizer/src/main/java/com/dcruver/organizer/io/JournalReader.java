package com.dcruver.organizer.io;

import com.dcruver.organizer.domain.JournalEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a journal back in file order.
 *
 * Lines that are not JSON at all (a torn final write, stray text) are skipped with a warning.
 * A JSON object that is missing required fields is a corrupt record and fails the read.
 */
@Component
@Slf4j
public class JournalReader {

    private final ObjectMapper objectMapper;

    public JournalReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<JournalEntry> read(Path journalPath) throws IOException {
        List<JournalEntry> entries = new ArrayList<>();
        if (!Files.exists(journalPath)) {
            log.warn("Journal not found: {}", journalPath);
            return entries;
        }

        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(journalPath, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }

                JsonNode node;
                try {
                    node = objectMapper.readTree(line);
                } catch (JsonProcessingException e) {
                    log.warn("Skipping unparseable journal line {} in {}: {}",
                        lineNumber, journalPath, e.getOriginalMessage());
                    continue;
                }

                entries.add(toEntry(node, journalPath + ":" + lineNumber));
            }
        }

        log.debug("Read {} journal entries from {}", entries.size(), journalPath);
        return entries;
    }

    private JournalEntry toEntry(JsonNode node, String source) {
        if (node == null || !node.isObject()) {
            throw new RecordValidationException("JournalEntry", source, "expected a JSON object");
        }
        JournalEntry entry;
        try {
            entry = objectMapper.treeToValue(node, JournalEntry.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RecordValidationException("JournalEntry", source, e.getMessage(), e);
        }
        return RecordValidator.validate(entry, source);
    }
}
