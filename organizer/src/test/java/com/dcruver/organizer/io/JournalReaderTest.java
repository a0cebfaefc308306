package com.dcruver.organizer.io;

import com.dcruver.organizer.config.JsonConfig;
import com.dcruver.organizer.domain.JournalEntry;
import com.dcruver.organizer.domain.JournalStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JournalReaderTest {

    private static final String VALID = "{\"original_path\": \"/src/a.py\", \"target_path\": \"/dst/a.py\", "
        + "\"doc_id\": \"d1\", \"content_digest\": \"abc\", \"project_id\": \"project_001\", "
        + "\"bucket\": \"src\", \"status\": \"moved\", \"timestamp\": 1700000000.25}";

    @TempDir
    Path tempDir;

    private JournalReader reader;

    @BeforeEach
    void setUp() {
        reader = new JournalReader(JsonConfig.createMapper());
    }

    @Test
    void testReadsEntriesInFileOrder() throws Exception {
        Path journal = write(VALID + "\n" + VALID.replace("\"d1\"", "\"d2\"").replace("moved", "copied") + "\n");

        List<JournalEntry> entries = reader.read(journal);

        assertEquals(2, entries.size());
        assertEquals("d1", entries.get(0).getDocId());
        assertEquals(JournalStatus.COPIED, entries.get(1).getStatus());
        assertEquals(Instant.ofEpochSecond(1_700_000_000L, 250_000_000L), entries.get(0).getTimestamp());
    }

    @Test
    void testTornTrailingLineIsSkipped() throws Exception {
        Path journal = write(VALID + "\n{\"original_path\": \"/src/b");

        assertEquals(1, reader.read(journal).size());
    }

    @Test
    void testBlankAndGarbageLinesAreSkipped() throws Exception {
        Path journal = write("\n" + "not json at all\n" + VALID + "\n\n");

        assertEquals(1, reader.read(journal).size());
    }

    @Test
    void testMissingRequiredFieldIsRejected() throws Exception {
        Path journal = write(VALID.replace("\"doc_id\": \"d1\", ", "") + "\n");

        RecordValidationException e = assertThrows(RecordValidationException.class, () -> reader.read(journal));
        assertEquals("JournalEntry", e.getRecordType());
        assertTrue(e.getMessage().contains("doc_id"));
    }

    @Test
    void testUnknownStatusIsRejected() throws Exception {
        Path journal = write(VALID.replace("moved", "teleported") + "\n");

        assertThrows(RecordValidationException.class, () -> reader.read(journal));
    }

    @Test
    void testNonObjectLineIsRejected() throws Exception {
        Path journal = write("[1, 2]\n");

        assertThrows(RecordValidationException.class, () -> reader.read(journal));
    }

    @Test
    void testMissingJournalReadsEmpty() throws Exception {
        assertTrue(reader.read(tempDir.resolve("nope.jsonl")).isEmpty());
    }

    private Path write(String content) throws Exception {
        Path journal = tempDir.resolve("journal.jsonl");
        Files.writeString(journal, content);
        return journal;
    }
}
