package com.dcruver.organizer.domain.planning;

import com.dcruver.organizer.config.JsonConfig;
import com.dcruver.organizer.domain.ExecutionMode;
import com.dcruver.organizer.domain.OrganizePlan;
import com.dcruver.organizer.domain.planning.RollbackEngine.RollbackResult;
import com.dcruver.organizer.io.JournalReader;
import com.dcruver.organizer.io.JournalWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RollbackEngineTest {

    @TempDir
    Path tempDir;

    private ObjectMapper mapper;
    private RollbackEngine engine;
    private Path journalPath;

    @BeforeEach
    void setUp() {
        mapper = JsonConfig.createMapper();
        engine = new RollbackEngine(new JournalReader(mapper));
        journalPath = tempDir.resolve("journal.jsonl");
    }

    @Test
    void testMoveThenRollbackRestoresOriginals() throws Exception {
        Path a = write("source/projA/run.py", "print('a')");
        Path b = write("source/projB/run.py", "print('b')");

        execute(ExecutionMode.MOVE,
            PlanExecutorTest.plan("d1", a, tempDir.resolve("target/proj/scripts/run.py")),
            PlanExecutorTest.plan("d2", b, tempDir.resolve("target/proj/scripts/run__abcdef1.py")));
        assertFalse(Files.exists(a));
        assertFalse(Files.exists(b));

        RollbackResult result = engine.rollback(journalPath);

        assertEquals(2, result.getRestored());
        assertEquals("print('a')", Files.readString(a));
        assertEquals("print('b')", Files.readString(b));
        assertFalse(Files.exists(tempDir.resolve("target/proj/scripts/run.py")));
    }

    @Test
    void testSecondRollbackIsANoOp() throws Exception {
        Path a = write("source/a.txt", "a");
        execute(ExecutionMode.MOVE, PlanExecutorTest.plan("d1", a, tempDir.resolve("target/a.txt")));

        engine.rollback(journalPath);
        RollbackResult second = engine.rollback(journalPath);

        assertEquals(0, second.getRestored());
        assertEquals(1, second.getSkipped());
        assertEquals("a", Files.readString(a));
    }

    @Test
    void testRollbackRecreatesMissingParentDirectories() throws Exception {
        Path a = write("source/deep/nested/a.txt", "a");
        execute(ExecutionMode.MOVE, PlanExecutorTest.plan("d1", a, tempDir.resolve("target/a.txt")));
        Files.delete(tempDir.resolve("source/deep/nested"));

        engine.rollback(journalPath);

        assertTrue(Files.exists(a));
    }

    @Test
    void testOccupiedOriginalIsAConflict() throws Exception {
        Path a = write("source/a.txt", "original");
        Path target = tempDir.resolve("target/a.txt");
        execute(ExecutionMode.MOVE, PlanExecutorTest.plan("d1", a, target));
        Files.writeString(a, "someone else");

        RollbackResult result = engine.rollback(journalPath);

        assertEquals(1, result.getConflicts());
        assertEquals(0, result.getRestored());
        assertEquals("someone else", Files.readString(a));
        assertTrue(Files.exists(target));
    }

    @Test
    void testCopiedEntriesReplaceTheOriginal() throws Exception {
        Path a = write("source/a.txt", "a");
        Path target = tempDir.resolve("target/a.txt");
        execute(ExecutionMode.COPY, PlanExecutorTest.plan("d1", a, target));

        RollbackResult result = engine.rollback(journalPath);

        assertEquals(1, result.getRestored());
        assertTrue(Files.exists(a));
        assertFalse(Files.exists(target));
    }

    @Test
    void testMissingEntriesAreSkipped() throws Exception {
        execute(ExecutionMode.MOVE,
            PlanExecutorTest.plan("d1", tempDir.resolve("source/never.txt"), tempDir.resolve("target/never.txt")));

        RollbackResult result = engine.rollback(journalPath);

        assertEquals(1, result.getSkipped());
        assertEquals(0, result.getRestored());
    }

    @Test
    void testJournalIsNotModified() throws Exception {
        Path a = write("source/a.txt", "a");
        execute(ExecutionMode.MOVE, PlanExecutorTest.plan("d1", a, tempDir.resolve("target/a.txt")));
        String before = Files.readString(journalPath);

        engine.rollback(journalPath);

        assertEquals(before, Files.readString(journalPath));
    }

    @Test
    void testRollbackAcrossTwoExecutionRuns() throws Exception {
        Path a = write("source/a.txt", "first");
        Path target = tempDir.resolve("target/a.txt");
        execute(ExecutionMode.MOVE, PlanExecutorTest.plan("d1", a, target));
        Path b = write("source/b.txt", "second");
        execute(ExecutionMode.MOVE, PlanExecutorTest.plan("d2", b, tempDir.resolve("target/b.txt")));

        RollbackResult result = engine.rollback(journalPath);

        assertEquals(2, result.getRestored());
        assertEquals("first", Files.readString(a));
        assertEquals("second", Files.readString(b));
    }

    @Test
    void testChainedMovesUnwindInReverseOrder() throws Exception {
        Path original = write("source/a.txt", "a");
        Path first = tempDir.resolve("stage1/a.txt");
        Path second = tempDir.resolve("stage2/a.txt");
        execute(ExecutionMode.MOVE, PlanExecutorTest.plan("d1", original, first));
        execute(ExecutionMode.MOVE, PlanExecutorTest.plan("d1", first, second));

        RollbackResult result = engine.rollback(journalPath);

        assertEquals(2, result.getRestored());
        assertEquals("a", Files.readString(original));
        assertFalse(Files.exists(first));
        assertFalse(Files.exists(second));
    }

    @Test
    void testMissingJournalRestoresNothing() throws Exception {
        RollbackResult result = engine.rollback(tempDir.resolve("absent.jsonl"));

        assertEquals(0, result.getEntries());
        assertEquals(0, result.getRestored());
    }

    private void execute(ExecutionMode mode, OrganizePlan... plans) throws Exception {
        try (JournalWriter journal = new JournalWriter(journalPath, mapper)) {
            new PlanExecutor().execute(List.of(plans), mode, Map.of(), journal);
        }
    }

    private Path write(String relative, String content) throws Exception {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
