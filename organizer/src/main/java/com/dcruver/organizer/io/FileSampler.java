package com.dcruver.organizer.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URLConnection;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads a bounded text sample from a file, masks sensitive substrings and
 * pulls out cheap structural hints (imports, top comment, headings, JSON keys, CSV header).
 * All hint extraction works on the masked sample.
 */
@Component
@Slf4j
public class FileSampler {

    static final int MAX_IMPORTS = 5;
    static final int MAX_HEADINGS = 5;
    static final int MAX_JSON_KEYS = 10;
    static final int MAX_CSV_COLUMNS = 20;
    static final int MAX_COMMENT_LENGTH = 200;

    private static final Pattern PATH_PATTERN = Pattern.compile("([A-Za-z]:\\\\[^\\s]+|/[^\\s]+)");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern DIGIT_PATTERN = Pattern.compile("\\d{4,}");

    private static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private final ObjectMapper objectMapper;

    public FileSampler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Read up to sampleBytes, decode (UTF-8, else ISO-8859-1) and mask.
     */
    public String readSample(Path file, int sampleBytes) throws IOException {
        byte[] raw;
        try (InputStream in = Files.newInputStream(file)) {
            raw = in.readNBytes(Math.max(0, sampleBytes));
        }
        return mask(decode(raw));
    }

    static String decode(byte[] raw) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(raw))
                .toString();
        } catch (CharacterCodingException e) {
            // every byte maps to a char in latin-1
            return new String(raw, StandardCharsets.ISO_8859_1);
        }
    }

    /**
     * Replace absolute paths, email addresses and long digit runs.
     * Order matters: paths first so emails inside paths vanish with them.
     */
    public static String mask(String value) {
        String masked = PATH_PATTERN.matcher(value).replaceAll("[PATH]");
        masked = EMAIL_PATTERN.matcher(masked).replaceAll("[EMAIL]");
        return DIGIT_PATTERN.matcher(masked).replaceAll("####");
    }

    public List<String> extractImports(String text) {
        List<String> imports = new ArrayList<>();
        Iterator<String> lines = text.lines().iterator();
        while (lines.hasNext() && imports.size() < MAX_IMPORTS) {
            String stripped = lines.next().strip();
            if (stripped.startsWith("import ")
                || (stripped.startsWith("from ") && stripped.contains(" import "))) {
                imports.add(stripped);
            }
        }
        return imports;
    }

    public String extractTopComment(String text) {
        String first = text.lines()
            .map(String::strip)
            .filter(line -> !line.isEmpty())
            .findFirst()
            .orElse(null);
        if (first == null) {
            return null;
        }

        if (first.startsWith("#") || first.startsWith("//") || first.startsWith("/*")
            || first.startsWith("\"\"") || first.startsWith("'''")) {
            return first.length() > MAX_COMMENT_LENGTH ? first.substring(0, MAX_COMMENT_LENGTH) : first;
        }
        return null;
    }

    public List<String> extractMarkdownHeadings(String text) {
        List<String> headings = new ArrayList<>();
        Iterator<String> lines = text.lines().iterator();
        while (lines.hasNext() && headings.size() < MAX_HEADINGS) {
            String line = lines.next();
            if (line.startsWith("#")) {
                String heading = stripChars(line, "# ");
                if (!heading.isEmpty()) {
                    headings.add(heading);
                }
            }
        }
        return headings;
    }

    public List<String> extractJsonRootKeys(String text) {
        if (text.isBlank()) {
            return List.of();
        }
        try {
            JsonNode node = objectMapper.reader()
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .readTree(text);
            if (node == null || !node.isObject()) {
                return List.of();
            }
            List<String> keys = new ArrayList<>();
            Iterator<String> names = node.fieldNames();
            while (names.hasNext() && keys.size() < MAX_JSON_KEYS) {
                keys.add(names.next());
            }
            return keys;
        } catch (JsonProcessingException e) {
            return List.of();
        }
    }

    /**
     * First record of a CSV file, masked. Quoted cells may span lines.
     * Empty when unreadable, malformed or not UTF-8.
     */
    public List<String> extractCsvHeader(Path file) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT.parse(skipByteOrderMark(reader))) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                return List.of();
            }
            return records.next().stream()
                .limit(MAX_CSV_COLUMNS)
                .map(FileSampler::mask)
                .toList();
        } catch (IOException | UncheckedIOException e) {
            log.debug("Could not read CSV header from {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    private static BufferedReader skipByteOrderMark(BufferedReader reader) throws IOException {
        reader.mark(1);
        if (reader.read() != '\uFEFF') {
            reader.reset();
        }
        return reader;
    }

    public String detectMimeType(Path file) {
        String guess = null;
        try {
            guess = Files.probeContentType(file);
        } catch (IOException e) {
            log.debug("Content type probe failed for {}: {}", file, e.getMessage());
        }
        if (guess == null) {
            guess = URLConnection.guessContentTypeFromName(file.getFileName().toString());
        }
        return guess != null ? guess : DEFAULT_MIME_TYPE;
    }

    private static String stripChars(String value, String chars) {
        int start = 0;
        int end = value.length();
        while (start < end && chars.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && chars.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }
}
