package com.dcruver.organizer.io;

import com.dcruver.organizer.config.JsonConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSamplerTest {

    private FileSampler sampler;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        sampler = new FileSampler(JsonConfig.createMapper());
    }

    @Test
    void testMaskReplacesPathsEmailsAndLongNumbers() {
        assertEquals("open [PATH] now", FileSampler.mask("open /home/alice/notes.txt now"));
        assertEquals("mail [EMAIL] please", FileSampler.mask("mail bob.smith@example.com please"));
        assertEquals("id #### but not 123", FileSampler.mask("id 1234567 but not 123"));
        assertEquals("win [PATH] done", FileSampler.mask("win C:\\Users\\bob\\file.txt done"));
    }

    @Test
    void testMaskAppliesPathsBeforeDigits() {
        // digits inside a path vanish with the path
        assertEquals("[PATH]", FileSampler.mask("/data/2024/report.csv"));
    }

    @Test
    void testReadSampleIsBoundedAndMasked() throws Exception {
        Path file = tempDir.resolve("notes.txt");
        Files.writeString(file, "call 5551234 for help and more text after", StandardCharsets.UTF_8);

        String sample = sampler.readSample(file, 12);

        assertEquals("call ####", sample);
    }

    @Test
    void testInvalidUtf8FallsBackToLatin1() throws Exception {
        Path file = tempDir.resolve("latin.txt");
        Files.write(file, new byte[]{'c', 'a', 'f', (byte) 0xE9});

        String sample = sampler.readSample(file, 4096);

        assertEquals("caf\u00e9", sample);
    }

    @Test
    void testExtractImportsKeepsFirstFive() {
        String text = """
            import os
            import sys
            from pathlib import Path
            x = 1
            import json
            import re
            import csv
            """;

        List<String> imports = sampler.extractImports(text);

        assertEquals(List.of("import os", "import sys", "from pathlib import Path", "import json", "import re"), imports);
    }

    @Test
    void testTopCommentIsFirstNonBlankLineWhenItIsAComment() {
        assertEquals("# Build helper", sampler.extractTopComment("\n\n# Build helper\nprint(1)\n"));
        assertEquals("// entry point", sampler.extractTopComment("// entry point\nint main() {}"));
        assertNull(sampler.extractTopComment("print(1)\n# late comment\n"));
        assertNull(sampler.extractTopComment("   \n"));
    }

    @Test
    void testTopCommentIsTruncated() {
        String longComment = "#" + "x".repeat(500);

        assertEquals(200, sampler.extractTopComment(longComment).length());
    }

    @Test
    void testMarkdownHeadingsAreStripped() {
        String text = "# Title #\nbody\n## Usage\n### Notes  \n#\n";

        assertEquals(List.of("Title", "Usage", "Notes"), sampler.extractMarkdownHeadings(text));
    }

    @Test
    void testJsonRootKeysOnlyForObjects() {
        assertEquals(List.of("name", "version"), sampler.extractJsonRootKeys("{\"name\": \"x\", \"version\": 2}"));
        assertEquals(List.of(), sampler.extractJsonRootKeys("[1, 2, 3]"));
        assertEquals(List.of(), sampler.extractJsonRootKeys("{\"truncated\": "));
        assertEquals(List.of(), sampler.extractJsonRootKeys("not json"));
    }

    @Test
    void testJsonRootKeysCappedAtTen() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < 15; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append("\"k").append((char) ('a' + i)).append("\": ").append(i);
        }
        sb.append('}');

        assertEquals(10, sampler.extractJsonRootKeys(sb.toString()).size());
    }

    @Test
    void testCsvHeaderIsParsedAndMasked() throws Exception {
        Path file = tempDir.resolve("data.csv");
        Files.writeString(file, "id,\"name, full\",owner@example.com\n1,a,b\n", StandardCharsets.UTF_8);

        assertEquals(List.of("id", "name, full", "[EMAIL]"), sampler.extractCsvHeader(file));
    }

    @Test
    void testCsvHeaderOfEmptyFileIsEmpty() throws Exception {
        Path file = Files.createFile(tempDir.resolve("empty.csv"));

        assertTrue(sampler.extractCsvHeader(file).isEmpty());
    }

    @Test
    void testMimeTypeFallsBackToOctetStream() throws Exception {
        Path file = Files.createFile(tempDir.resolve("blob.zzzunknown"));

        assertEquals("application/octet-stream", sampler.detectMimeType(file));
    }

    @Test
    void testCsvHeaderCellMaySpanLines() throws Exception {
        Path file = tempDir.resolve("multi.csv");
        Files.writeString(file, "\"first\nname\",age\nbob,3\n", StandardCharsets.UTF_8);

        assertEquals(List.of("first\nname", "age"), sampler.extractCsvHeader(file));
    }

    @Test
    void testCsvHeaderHandlesEscapedQuotesAndByteOrderMark() throws Exception {
        Path file = tempDir.resolve("bom.csv");
        Files.writeString(file, "\uFEFFa,\"say \"\"hi\"\"\",\n1,2,3\n", StandardCharsets.UTF_8);

        assertEquals(List.of("a", "say \"hi\"", ""), sampler.extractCsvHeader(file));
    }

    @Test
    void testCsvHeaderOfUnterminatedQuoteIsEmpty() throws Exception {
        Path file = tempDir.resolve("broken.csv");
        Files.writeString(file, "\"never closed,b\n", StandardCharsets.UTF_8);

        assertTrue(sampler.extractCsvHeader(file).isEmpty());
    }

    @Test
    void testJsonWithTrailingTokensHasNoRootKeys() {
        assertTrue(sampler.extractJsonRootKeys("{\"a\": 1} trailing").isEmpty());
        assertEquals(List.of("a"), sampler.extractJsonRootKeys("{\"a\": 1}\n"));
    }
}
