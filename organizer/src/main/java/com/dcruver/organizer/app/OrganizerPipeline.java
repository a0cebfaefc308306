package com.dcruver.organizer.app;

import com.dcruver.organizer.config.RuleConfigLoader;
import com.dcruver.organizer.domain.BucketScore;
import com.dcruver.organizer.domain.ClusterCandidate;
import com.dcruver.organizer.domain.ClusterResult;
import com.dcruver.organizer.domain.Document;
import com.dcruver.organizer.domain.FileScanner;
import com.dcruver.organizer.domain.OrganizePlan;
import com.dcruver.organizer.domain.ProjectClusterer;
import com.dcruver.organizer.domain.RuleClassifier;
import com.dcruver.organizer.domain.RuleConfig;
import com.dcruver.organizer.domain.ScanConfig;
import com.dcruver.organizer.domain.ScanResult;
import com.dcruver.organizer.domain.SchemaConfig;
import com.dcruver.organizer.domain.planning.OrganizePlanner;
import com.dcruver.organizer.domain.planning.PlanExecutor;
import com.dcruver.organizer.domain.planning.PlanExecutor.ExecutionSummary;
import com.dcruver.organizer.domain.planning.RollbackEngine;
import com.dcruver.organizer.domain.planning.RollbackEngine.RollbackResult;
import com.dcruver.organizer.io.ArtifactStore;
import com.dcruver.organizer.io.JournalWriter;
import com.dcruver.organizer.reporting.SummaryReportGenerator;
import com.dcruver.organizer.reporting.SummaryReportGenerator.ReportFiles;
import com.dcruver.organizer.store.DocumentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the stages in sequence, handing artifacts from one to the next through
 * the document store and the JSON files under the cache directory.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OrganizerPipeline {

    static final List<String> DEFAULT_PROJECT_HINTS = List.of("project");

    private final FileScanner fileScanner;
    private final DocumentStore documentStore;
    private final ArtifactStore artifactStore;
    private final RuleConfigLoader ruleConfigLoader;
    private final RuleClassifier ruleClassifier;
    private final ProjectClusterer projectClusterer;
    private final OrganizePlanner organizePlanner;
    private final PlanExecutor planExecutor;
    private final RollbackEngine rollbackEngine;
    private final SummaryReportGenerator reportGenerator;
    private final ObjectMapper objectMapper;

    public ScanResult scan(ScanConfig config, Path snapshotPath) throws IOException {
        return fileScanner.scanAndStore(config, snapshotPath);
    }

    public List<BucketScore> classify(Path rulesPath, Path scoresPath) throws IOException {
        RuleConfig rules = ruleConfigLoader.load(rulesPath);
        List<Document> documents = documentStore.findAll();
        if (documents.isEmpty()) {
            log.warn("No scanned documents in the store; run scan first");
        }
        List<BucketScore> scores = ruleClassifier.classify(documents, rules);
        artifactStore.writeScores(scoresPath, scores);
        return scores;
    }

    /**
     * Project hints come from the rules file when it exists.
     */
    public ClusterResult cluster(Path rulesPath, Path scoresPath, Path projectsPath) throws IOException {
        List<String> hints = DEFAULT_PROJECT_HINTS;
        if (rulesPath != null && Files.exists(rulesPath)) {
            List<String> configured = ruleConfigLoader.load(rulesPath).getProjectHints();
            if (!configured.isEmpty()) {
                hints = configured;
            }
        } else {
            log.info("No rules file at {}, clustering with default hints {}", rulesPath, hints);
        }

        Map<String, String> scoreMap = loadScoreMap(scoresPath);
        List<ClusterCandidate> candidates = documentStore.findAll().stream()
            .map(doc -> ClusterCandidate.of(doc,
                scoreMap.getOrDefault(doc.getDocId(), BucketScore.FALLBACK_BUCKET)))
            .toList();

        ClusterResult result = projectClusterer.cluster(candidates, hints, scoreMap);
        artifactStore.writeClusters(projectsPath, result);
        return result;
    }

    /**
     * Plan and, unless dryRun, execute against the journal.
     * A dry run writes the plans to plansPath and touches nothing else.
     */
    public OrganizeOutcome organize(SchemaConfig schema, Path projectsPath, Path scoresPath,
                                    Path journalPath, Path plansPath, boolean dryRun) throws IOException {
        ClusterResult clusters = artifactStore.readClusters(projectsPath);
        Map<String, Document> index = documentStore.findAllIndexed();
        Map<String, String> scoreMap = loadScoreMap(scoresPath);

        List<OrganizePlan> plans = organizePlanner.build(clusters, schema, scoreMap, index, !dryRun);
        if (dryRun) {
            artifactStore.writePlans(plansPath, plans);
            return OrganizeOutcome.builder().plans(plans).dryRun(true).build();
        }

        Map<String, String> digests = new LinkedHashMap<>();
        index.forEach((docId, doc) -> digests.put(docId, doc.getContentDigest()));

        ExecutionSummary summary;
        try (JournalWriter journal = new JournalWriter(journalPath, objectMapper)) {
            summary = planExecutor.execute(plans, schema.getMode(), digests, journal);
        }
        return OrganizeOutcome.builder().plans(plans).dryRun(false).execution(summary).build();
    }

    public RollbackResult rollback(Path journalPath) throws IOException {
        return rollbackEngine.rollback(journalPath);
    }

    public ReportFiles report(Path projectsPath, Path journalPath, Path htmlPath) throws IOException {
        return reportGenerator.generate(artifactStore.readClusters(projectsPath), journalPath, htmlPath);
    }

    private Map<String, String> loadScoreMap(Path scoresPath) throws IOException {
        if (scoresPath == null || !Files.exists(scoresPath)) {
            log.warn("No scores at {}; buckets fall back to {}", scoresPath, BucketScore.FALLBACK_BUCKET);
            return Map.of();
        }
        return artifactStore.readScoreMap(scoresPath);
    }

    @Data
    @Builder
    public static class OrganizeOutcome {
        private final List<OrganizePlan> plans;
        private final boolean dryRun;
        private final ExecutionSummary execution;  // null for dry runs
    }
}
