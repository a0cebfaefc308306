package com.dcruver.organizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Scanner's metadata record for one physical file.
 * Immutable once created; persisted keyed by docId.
 */
@Data
@Builder
public class Document {
    private final String docId;
    private final String path;  // absolute, normalized
    private final String name;
    private final String extension;  // lowercase, no dot
    private final long size;
    private final double modifiedTime;  // epoch seconds
    private final String contentDigest;
    private final String mimeType;
    private final String dirHint;  // parent directory name

    // Structural hints
    private final List<String> importsFirst;
    private final String topComment;
    private final List<String> markdownHeadings;
    private final List<String> jsonRootKeys;
    private final List<String> csvHeader;

    // Masked content sample
    private final String sampleText;

    @JsonCreator
    public Document(
            @JsonProperty("doc_id") String docId,
            @JsonProperty("path") String path,
            @JsonProperty("name") String name,
            @JsonProperty("extension") String extension,
            @JsonProperty("size") long size,
            @JsonProperty("modified_time") double modifiedTime,
            @JsonProperty("content_digest") String contentDigest,
            @JsonProperty("mime_type") String mimeType,
            @JsonProperty("dir_hint") String dirHint,
            @JsonProperty("imports_first") List<String> importsFirst,
            @JsonProperty("top_comment") String topComment,
            @JsonProperty("markdown_headings") List<String> markdownHeadings,
            @JsonProperty("json_root_keys") List<String> jsonRootKeys,
            @JsonProperty("csv_header") List<String> csvHeader,
            @JsonProperty("sample_text") String sampleText) {
        this.docId = docId;
        this.path = path;
        this.name = name;
        this.extension = extension;
        this.size = size;
        this.modifiedTime = modifiedTime;
        this.contentDigest = contentDigest;
        this.mimeType = mimeType;
        this.dirHint = dirHint;
        this.importsFirst = importsFirst != null ? List.copyOf(importsFirst) : List.of();
        this.topComment = topComment;
        this.markdownHeadings = markdownHeadings != null ? List.copyOf(markdownHeadings) : List.of();
        this.jsonRootKeys = jsonRootKeys != null ? List.copyOf(jsonRootKeys) : List.of();
        this.csvHeader = csvHeader != null ? List.copyOf(csvHeader) : List.of();
        this.sampleText = sampleText;
    }

    @JsonIgnore
    public Path getFilePath() {
        return Path.of(path);
    }

    /**
     * Whether the record still carries what planning needs
     */
    @JsonIgnore
    public boolean isRelocatable() {
        return path != null && !path.isBlank()
            && contentDigest != null && !contentDigest.isBlank();
    }
}
