package com.dcruver.organizer.domain.planning;

import com.dcruver.organizer.domain.BucketScore;
import com.dcruver.organizer.domain.ClusterProject;
import com.dcruver.organizer.domain.ClusterResult;
import com.dcruver.organizer.domain.Document;
import com.dcruver.organizer.domain.OrganizePlan;
import com.dcruver.organizer.domain.SchemaConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns clusters into relocation plans under the schema's target root.
 *
 * Each project gets its own root ({@code target_root/<label>}); a document lands in
 * the subdirectory mapped from its bucket. Name collisions, either with a target
 * already allocated in the same project or with a file already on disk, are resolved
 * with a digest suffix and then an incrementing counter.
 */
@Component
@Slf4j
public class OrganizePlanner {

    static final String HASH_SEPARATOR = "__";
    static final int HASH_SUFFIX_LENGTH = 7;

    private static final Map<String, String> BUCKET_DIRECTORY_MAP = Map.of(
        "src", "src/core",
        "scripts", "scripts",
        "tests", "tests/unit",
        "docs", "docs",
        "reports", "reports",
        "configs", "configs",
        "data", "data/raw",
        "notebooks", "notebooks",
        "archive", "archive",
        "tmp", "tmp"
    );

    /**
     * @param materializeDirectories create the schema structure and bucket directories;
     *                               false for a dry run that must not touch the filesystem
     */
    public List<OrganizePlan> build(ClusterResult clusters, SchemaConfig schema, Map<String, String> scoreMap,
                                    Map<String, Document> scanIndex, boolean materializeDirectories)
            throws IOException {
        List<OrganizePlan> plans = new ArrayList<>();
        int skipped = 0;

        for (ClusterProject project : clusters.getProjects()) {
            Path projectRoot = schema.getTargetRoot().resolve(project.getProjectLabel());
            if (materializeDirectories) {
                for (String relative : schema.getStructure()) {
                    Files.createDirectories(projectRoot.resolve(relative));
                }
            }

            Set<Path> allocated = new HashSet<>();
            for (String docId : project.getDocIds()) {
                Document doc = scanIndex.get(docId);
                if (doc == null || !doc.isRelocatable()) {
                    log.warn("Skipping {} in {}: not in the scan index or missing path/digest",
                        docId, project.getProjectId());
                    skipped++;
                    continue;
                }

                String bucket = bucketFor(project, docId, scoreMap);
                Path bucketDir = projectRoot.resolve(directoryFor(bucket));
                if (materializeDirectories) {
                    Files.createDirectories(bucketDir);
                }

                Path source = doc.getFilePath();
                String digest = doc.getContentDigest();
                Path target = resolveTarget(bucketDir, source.getFileName().toString(), digest, allocated);

                plans.add(OrganizePlan.builder()
                    .docId(docId)
                    .projectId(project.getProjectId())
                    .projectLabel(project.getProjectLabel())
                    .bucket(bucket)
                    .sourcePath(source.toString())
                    .targetPath(target.toString())
                    .hashSuffix(hashSuffix(digest))
                    .build());
            }
        }

        log.info("Planned {} relocations across {} projects ({} documents skipped)",
            plans.size(), clusters.getProjects().size(), skipped);
        return plans;
    }

    static String bucketFor(ClusterProject project, String docId, Map<String, String> scoreMap) {
        String bucket = project.getRoleBucketMap().get(docId);
        if (bucket == null) {
            bucket = scoreMap.get(docId);
        }
        return bucket != null ? bucket : BucketScore.FALLBACK_BUCKET;
    }

    static String directoryFor(String bucket) {
        return BUCKET_DIRECTORY_MAP.getOrDefault(bucket, BUCKET_DIRECTORY_MAP.get(BucketScore.FALLBACK_BUCKET));
    }

    /**
     * First free name among {@code name}, {@code stem__hash.ext}, {@code stem__hash_1.ext}, ...
     * The winner is added to allocated.
     */
    static Path resolveTarget(Path dir, String fileName, String digest, Set<Path> allocated) {
        String stem = stemOf(fileName);
        String ext = fileName.substring(stem.length());
        String hash = hashSuffix(digest);

        Path candidate = dir.resolve(fileName);
        int attempt = 0;
        while (allocated.contains(candidate) || Files.exists(candidate)) {
            String suffix = attempt == 0 ? HASH_SEPARATOR + hash : HASH_SEPARATOR + hash + "_" + attempt;
            candidate = dir.resolve(stem + suffix + ext);
            attempt++;
        }
        allocated.add(candidate);
        return candidate;
    }

    static String hashSuffix(String digest) {
        return digest.length() > HASH_SUFFIX_LENGTH ? digest.substring(0, HASH_SUFFIX_LENGTH) : digest;
    }

    /**
     * Name without its last extension; dotfiles like ".env" keep their full name.
     */
    static String stemOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return fileName;
        }
        return fileName.substring(0, dot);
    }
}
