package com.dcruver.organizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Default locations and limits, bound from the organizer.* tree.
 */
@ConfigurationProperties(prefix = "organizer")
@Data
public class OrganizerProperties {
    private String cacheDb = ".cache/organizer_scan.db";
    private String scanOutput = ".cache/scan_results.json";
    private String scoresPath = ".cache/scores.json";
    private String projectsPath = ".cache/projects.json";
    private String plansPath = ".cache/plans.json";
    private String journalPath = ".cache/journal.jsonl";
    private String reportPath = "reports/projects_summary.html";
    private String rulesPath = "config/rules.yml";
    private String schemaPath = "config/schema.yml";

    private Scan scan = new Scan();

    @Data
    public static class Scan {
        private long maxSizeBytes = 500L * 1024 * 1024;
        private int sampleBytes = 4096;
        private int threads = Math.max(2, Runtime.getRuntime().availableProcessors());
        private List<String> excludeDirs = new ArrayList<>();
    }
}
