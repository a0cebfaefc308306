package com.dcruver.organizer.reporting;

import com.dcruver.organizer.domain.BucketScore;
import com.dcruver.organizer.domain.ClusterProject;
import com.dcruver.organizer.domain.ClusterResult;
import com.dcruver.organizer.domain.JournalEntry;
import com.dcruver.organizer.io.JournalReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders the project summary as HTML, with JSON and CSV siblings next to it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SummaryReportGenerator {

    static final String UNKNOWN_PROJECT = "unknown";

    private final JournalReader journalReader;
    private final ObjectMapper objectMapper;

    /**
     * Write {@code <name>.html}, {@code <name>.json} and {@code <name>.csv}.
     */
    public ReportFiles generate(ClusterResult clusters, Path journalPath, Path htmlPath) throws IOException {
        List<JournalEntry> entries = journalReader.read(journalPath);
        SummaryData summary = summarize(clusters, entries);

        Path jsonPath = withExtension(htmlPath, ".json");
        Path csvPath = withExtension(htmlPath, ".csv");
        Path parent = htmlPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        objectMapper.writerWithDefaultPrettyPrinter().writeValue(jsonPath.toFile(), summary);
        Files.writeString(csvPath, renderCsv(summary), StandardCharsets.UTF_8);
        Files.writeString(htmlPath, renderHtml(summary), StandardCharsets.UTF_8);

        log.info("Generated summary report: {} ({} projects, {} journal entries)",
            htmlPath, summary.getProjects().size(), entries.size());

        return ReportFiles.builder()
            .html(htmlPath)
            .json(jsonPath)
            .csv(csvPath)
            .summary(summary)
            .build();
    }

    SummaryData summarize(ClusterResult clusters, List<JournalEntry> entries) {
        Map<String, String> labels = new HashMap<>();
        List<ProjectRow> rows = clusters.getProjects().stream()
            .map(project -> {
                labels.put(project.getProjectId(), project.getProjectLabel());
                return toRow(project);
            })
            .toList();

        Map<String, Integer> projectTotals = new TreeMap<>();
        Map<String, Integer> bucketTotals = new LinkedHashMap<>();
        for (JournalEntry entry : entries) {
            String label = labels.getOrDefault(entry.getProjectId(), UNKNOWN_PROJECT);
            projectTotals.merge(label, 1, Integer::sum);
            String bucket = entry.getBucket() != null ? entry.getBucket() : BucketScore.FALLBACK_BUCKET;
            bucketTotals.merge(bucket, 1, Integer::sum);
        }

        return SummaryData.builder()
            .projects(rows)
            .moves(entries)
            .projectTotals(projectTotals)
            .bucketTotals(bucketTotals)
            .build();
    }

    private static ProjectRow toRow(ClusterProject project) {
        return ProjectRow.builder()
            .projectId(project.getProjectId())
            .projectLabel(project.getProjectLabel())
            .docCount(project.size())
            .confidence(project.getConfidence())
            .build();
    }

    String renderCsv(SummaryData summary) {
        StringBuilder sb = new StringBuilder("project_label,count");
        summary.getProjectTotals().forEach((label, count) ->
            sb.append('\n').append(csvCell(label)).append(',').append(count));
        return sb.toString();
    }

    String renderHtml(SummaryData summary) {
        StringBuilder projectRows = new StringBuilder();
        for (ProjectRow row : summary.getProjects()) {
            projectRows.append(String.format(Locale.ROOT, "<tr><td>%s</td><td>%s</td><td>%d</td><td>%.2f</td></tr>",
                escape(row.getProjectId()), escape(row.getProjectLabel()), row.getDocCount(), row.getConfidence()));
        }
        if (projectRows.length() == 0) {
            projectRows.append("<tr><td colspan='4'>No projects</td></tr>");
        }

        StringBuilder bucketRows = new StringBuilder();
        summary.getBucketTotals().forEach((bucket, count) ->
            bucketRows.append(String.format(Locale.ROOT, "<tr><td>%s</td><td>%d</td></tr>", escape(bucket), count)));
        if (bucketRows.length() == 0) {
            bucketRows.append("<tr><td colspan='2'>No buckets</td></tr>");
        }

        return """
            <html>
              <head>
                <meta charset="utf-8" />
                <title>Project Summary</title>
                <style>
            body { background-color: #0B1220; color: #E5E7EB; font-family: Inter, sans-serif; }
            .container { max-width: 960px; margin: 0 auto; padding: 32px; }
            h1 { color: #60A5FA; }
            table { width: 100%%; border-collapse: collapse; margin-top: 24px; }
            th, td { border: 1px solid #111827; padding: 12px; text-align: left; }
            th { background-color: #111827; color: #22D3EE; }
            .card { background-color: #111827; border-radius: 12px; padding: 16px; margin-top: 16px; }
                </style>
              </head>
              <body>
                <div class="container">
                  <h1>Project Summary</h1>
                  <div class="card">
                    <h2>Projects</h2>
                    <table>
                      <thead>
                        <tr><th>ID</th><th>Label</th><th>Docs</th><th>Confidence</th></tr>
                      </thead>
                      <tbody>%s</tbody>
                    </table>
                  </div>
                  <div class="card">
                    <h2>Buckets</h2>
                    <table>
                      <thead>
                        <tr><th>Bucket</th><th>Count</th></tr>
                      </thead>
                      <tbody>%s</tbody>
                    </table>
                  </div>
                </div>
              </body>
            </html>
            """.formatted(projectRows, bucketRows);
    }

    static Path withExtension(Path file, String extension) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return file.resolveSibling(base + extension);
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&#39;");
    }

    private static String csvCell(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    @Data
    @Builder
    public static class ProjectRow {
        private final String projectId;
        private final String projectLabel;
        private final int docCount;
        private final double confidence;
    }

    /**
     * Serialized as the JSON report
     */
    @Data
    @Builder
    public static class SummaryData {
        private final List<ProjectRow> projects;
        private final List<JournalEntry> moves;
        private final Map<String, Integer> projectTotals;
        private final Map<String, Integer> bucketTotals;
    }

    @Data
    @Builder
    public static class ReportFiles {
        private final Path html;
        private final Path json;
        private final Path csv;
        private final SummaryData summary;
    }
}
