package com.dcruver.organizer.app;

import com.dcruver.organizer.app.OrganizerPipeline.OrganizeOutcome;
import com.dcruver.organizer.config.ConfigurationException;
import com.dcruver.organizer.config.OrganizerProperties;
import com.dcruver.organizer.config.SchemaConfigLoader;
import com.dcruver.organizer.domain.BucketScore;
import com.dcruver.organizer.domain.ClusterProject;
import com.dcruver.organizer.domain.ClusterResult;
import com.dcruver.organizer.domain.JournalEntry;
import com.dcruver.organizer.domain.JournalStatus;
import com.dcruver.organizer.domain.OrganizePlan;
import com.dcruver.organizer.domain.ScanConfig;
import com.dcruver.organizer.domain.ScanResult;
import com.dcruver.organizer.domain.SchemaConfig;
import com.dcruver.organizer.domain.planning.PlanExecutor.ExecutionSummary;
import com.dcruver.organizer.domain.planning.RollbackEngine.RollbackResult;
import com.dcruver.organizer.io.ArtifactStore;
import com.dcruver.organizer.io.JournalReader;
import com.dcruver.organizer.reporting.SummaryReportGenerator.ReportFiles;
import com.dcruver.organizer.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Spring Shell commands for the project organizer.
 * Every path option falls back to the organizer.* defaults.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class OrganizerShellCommands {

    private final OrganizerPipeline pipeline;
    private final OrganizerProperties properties;
    private final SchemaConfigLoader schemaConfigLoader;
    private final JournalReader journalReader;
    private final DocumentStore documentStore;
    private final ArtifactStore artifactStore;

    @ShellMethod(key = "scan", value = "Scan directory trees and store document metadata")
    public String scan(
        @ShellOption(value = "--paths", help = "Comma-separated roots to scan") String paths,
        @ShellOption(value = "--max-size", defaultValue = ShellOption.NULL, help = "Skip files larger than this many bytes") Long maxSize,
        @ShellOption(value = "--sample-bytes", defaultValue = ShellOption.NULL, help = "Bytes sampled per file") Integer sampleBytes,
        @ShellOption(value = "--threads", defaultValue = ShellOption.NULL, help = "Extraction worker threads") Integer threads,
        @ShellOption(value = "--exclude", defaultValue = ShellOption.NULL, help = "Comma-separated directory names to skip") String exclude,
        @ShellOption(value = "--out", defaultValue = ShellOption.NULL, help = "Snapshot JSON output") String out
    ) throws IOException {
        OrganizerProperties.Scan defaults = properties.getScan();
        List<Path> roots = splitList(paths).stream().map(Path::of).toList();
        if (roots.isEmpty()) {
            throw new ConfigurationException("At least one path is required for scan");
        }

        ScanConfig config = ScanConfig.builder()
            .paths(roots)
            .maxSizeBytes(maxSize != null ? maxSize : defaults.getMaxSizeBytes())
            .sampleBytes(sampleBytes != null ? sampleBytes : defaults.getSampleBytes())
            .threads(threads != null ? threads : defaults.getThreads())
            .excludeDirs(exclude != null ? Set.copyOf(splitList(exclude)) : Set.copyOf(defaults.getExcludeDirs()))
            .build();

        ScanResult result = pipeline.scan(config, pathOr(out, properties.getScanOutput()));

        StringBuilder sb = new StringBuilder();
        sb.append("Scan completed.\n\n");
        sb.append(String.format("- Files discovered: %d\n", result.getDiscovered()));
        sb.append(String.format("- Documents scanned: %d\n", result.getScanned()));
        sb.append(String.format("- Skipped (over size limit): %d\n", result.getSkippedOversize()));
        sb.append(String.format("- Failed: %d\n", result.getFailed()));
        if (!result.getMissingRoots().isEmpty()) {
            sb.append("- Missing roots:\n");
            result.getMissingRoots().forEach(root -> sb.append("    ").append(root).append("\n"));
        }
        return sb.toString();
    }

    @ShellMethod(key = "rules", value = "Classify scanned documents into buckets")
    public String rules(
        @ShellOption(value = "--config", defaultValue = ShellOption.NULL, help = "Rule configuration (YAML or JSON)") String config,
        @ShellOption(value = "--emit", defaultValue = ShellOption.NULL, help = "Scores JSON output") String emit
    ) throws IOException {
        List<BucketScore> scores = pipeline.classify(
            pathOr(config, properties.getRulesPath()),
            pathOr(emit, properties.getScoresPath()));

        Map<String, Long> perBucket = scores.stream()
            .collect(Collectors.groupingBy(BucketScore::getBucket, LinkedHashMap::new, Collectors.counting()));

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Classified %d documents.\n\n", scores.size()));
        perBucket.forEach((bucket, count) -> sb.append(String.format("- %s: %d\n", bucket, count)));
        return sb.toString();
    }

    @ShellMethod(key = "cluster", value = "Group classified documents into projects")
    public String cluster(
        @ShellOption(value = "--rules", defaultValue = ShellOption.NULL, help = "Rule configuration holding project_hints") String rules,
        @ShellOption(value = "--scores", defaultValue = ShellOption.NULL, help = "Scores JSON from the rules command") String scores,
        @ShellOption(value = "--out", defaultValue = ShellOption.NULL, help = "Projects JSON output") String out
    ) throws IOException {
        ClusterResult result = pipeline.cluster(
            pathOr(rules, properties.getRulesPath()),
            pathOr(scores, properties.getScoresPath()),
            pathOr(out, properties.getProjectsPath()));

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Clustered %d projects.\n\n", result.getProjects().size()));
        for (ClusterProject project : result.getProjects()) {
            sb.append(String.format("- %s %s: %d docs (confidence %.2f)\n",
                project.getProjectId(), project.getProjectLabel(), project.size(), project.getConfidence()));
        }
        return sb.toString();
    }

    @ShellMethod(key = "organize", value = "Plan and execute the reorganization")
    public String organize(
        @ShellOption(value = "--projects", defaultValue = ShellOption.NULL, help = "Projects JSON from the cluster command") String projects,
        @ShellOption(value = "--scores", defaultValue = ShellOption.NULL, help = "Scores JSON from the rules command") String scores,
        @ShellOption(value = "--schema", defaultValue = ShellOption.NULL, help = "Schema configuration (YAML or JSON)") String schema,
        @ShellOption(value = "--target", defaultValue = ShellOption.NULL, help = "Override the schema's target_root") String target,
        @ShellOption(value = "--mode", defaultValue = ShellOption.NULL, help = "move or copy") String mode,
        @ShellOption(value = "--conflict", defaultValue = ShellOption.NULL, help = "Conflict policy (version)") String conflict,
        @ShellOption(value = "--journal", defaultValue = ShellOption.NULL, help = "Journal file") String journal,
        @ShellOption(value = "--plans", defaultValue = ShellOption.NULL, help = "Plans JSON output for dry runs") String plans,
        @ShellOption(value = "--dry-run", defaultValue = "false", help = "Plan only, touch nothing") boolean dryRun
    ) throws IOException {
        SchemaConfig schemaConfig = schemaConfigLoader.load(
            pathOr(schema, properties.getSchemaPath()),
            target != null ? Path.of(target) : null,
            mode,
            conflict);

        Path journalPath = pathOr(journal, properties.getJournalPath());
        Path plansPath = pathOr(plans, properties.getPlansPath());
        OrganizeOutcome outcome = pipeline.organize(
            schemaConfig,
            pathOr(projects, properties.getProjectsPath()),
            pathOr(scores, properties.getScoresPath()),
            journalPath,
            plansPath,
            dryRun);

        StringBuilder sb = new StringBuilder();
        if (outcome.isDryRun()) {
            sb.append(String.format("Dry run: %d relocations planned under %s\n",
                outcome.getPlans().size(), schemaConfig.getTargetRoot()));
            sb.append("Plans written to ").append(plansPath).append("\n");
            return sb.toString();
        }

        ExecutionSummary summary = outcome.getExecution();
        sb.append(String.format("Organized %d plans under %s (%s mode)\n\n",
            summary.getTotal(), schemaConfig.getTargetRoot(), summary.getMode().name().toLowerCase(Locale.ROOT)));
        sb.append(String.format("- %s: %d\n", summary.getMode().getSuccessStatus().wireName(), summary.getRelocated()));
        sb.append(String.format("- missing: %d\n", summary.getMissing()));
        sb.append(String.format("- failed: %d\n", summary.getFailed()));
        sb.append("\nJournal: ").append(journalPath).append("\n");
        return sb.toString();
    }

    @ShellMethod(key = "report", value = "Write the HTML/JSON/CSV project summary")
    public String report(
        @ShellOption(value = "--clusters", defaultValue = ShellOption.NULL, help = "Projects JSON") String clusters,
        @ShellOption(value = "--journal", defaultValue = ShellOption.NULL, help = "Journal file") String journal,
        @ShellOption(value = "--out", defaultValue = ShellOption.NULL, help = "HTML output; JSON and CSV are written beside it") String out
    ) throws IOException {
        ReportFiles files = pipeline.report(
            pathOr(clusters, properties.getProjectsPath()),
            pathOr(journal, properties.getJournalPath()),
            pathOr(out, properties.getReportPath()));

        return String.format("Report generated:\n- %s\n- %s\n- %s\n", files.getHtml(), files.getJson(), files.getCsv());
    }

    @ShellMethod(key = "rollback", value = "Undo a reorganization by replaying its journal backwards")
    public String rollback(
        @ShellOption(value = "--journal", defaultValue = ShellOption.NULL, help = "Journal file") String journal
    ) throws IOException {
        Path journalPath = pathOr(journal, properties.getJournalPath());
        RollbackResult result = pipeline.rollback(journalPath);

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Rolled back %s (%d entries)\n\n", journalPath, result.getEntries()));
        sb.append(String.format("- Restored: %d\n", result.getRestored()));
        sb.append(String.format("- Skipped: %d\n", result.getSkipped()));
        sb.append(String.format("- Conflicts: %d\n", result.getConflicts()));
        sb.append(String.format("- Failed: %d\n", result.getFailed()));
        return sb.toString();
    }

    @ShellMethod(key = "journal show", value = "Summarize journal entries by status")
    public String journalShow(
        @ShellOption(value = "--journal", defaultValue = ShellOption.NULL, help = "Journal file") String journal
    ) throws IOException {
        Path journalPath = pathOr(journal, properties.getJournalPath());
        List<JournalEntry> entries = journalReader.read(journalPath);

        Map<JournalStatus, Integer> counts = new EnumMap<>(JournalStatus.class);
        entries.forEach(entry -> counts.merge(entry.getStatus(), 1, Integer::sum));

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Journal %s: %d entries\n\n", journalPath, entries.size()));
        for (JournalStatus status : JournalStatus.values()) {
            sb.append(String.format("- %s: %d\n", status.wireName(), counts.getOrDefault(status, 0)));
        }
        return sb.toString();
    }

    @ShellMethod(key = "plans show", value = "Summarize a dry-run plans file by project and bucket")
    public String plansShow(
        @ShellOption(value = "--plans", defaultValue = ShellOption.NULL, help = "Plans JSON from organize --dry-run") String plans
    ) throws IOException {
        Path plansPath = pathOr(plans, properties.getPlansPath());
        List<OrganizePlan> loaded = artifactStore.readPlans(plansPath);

        Map<String, Map<String, Long>> perProject = loaded.stream()
            .collect(Collectors.groupingBy(OrganizePlan::getProjectId, TreeMap::new,
                Collectors.groupingBy(OrganizePlan::getBucket, TreeMap::new, Collectors.counting())));

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Plans %s: %d relocations\n\n", plansPath, loaded.size()));
        perProject.forEach((projectId, buckets) -> {
            sb.append(String.format("- %s\n", projectId));
            buckets.forEach((bucket, count) -> sb.append(String.format("    %s: %d\n", bucket, count)));
        });
        return sb.toString();
    }

    @ShellMethod(key = "store stats", value = "Show document store statistics")
    public String storeStats() {
        return String.format("Document store %s: %d documents\n", properties.getCacheDb(), documentStore.count());
    }

    private static Path pathOr(String value, String fallback) {
        return Path.of(value != null ? value : fallback);
    }

    static List<String> splitList(String value) {
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }
}
