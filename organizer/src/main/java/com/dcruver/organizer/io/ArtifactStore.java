package com.dcruver.organizer.io;

import com.dcruver.organizer.domain.BucketScore;
import com.dcruver.organizer.domain.ClusterProject;
import com.dcruver.organizer.domain.ClusterResult;
import com.dcruver.organizer.domain.Document;
import com.dcruver.organizer.domain.OrganizePlan;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pretty-printed JSON artifacts passed between stages: the scan snapshot,
 * classifier scores, cluster results and dry-run plans.
 * Everything read back goes through {@link RecordValidator}.
 */
@Component
@Slf4j
public class ArtifactStore {

    private final ObjectMapper objectMapper;

    public ArtifactStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void writeSnapshot(Path file, List<Document> documents) throws IOException {
        write(file, documents);
        log.info("Wrote scan snapshot with {} documents to {}", documents.size(), file);
    }

    public List<Document> readSnapshot(Path file) throws IOException {
        List<Document> documents = readList(file, new TypeReference<List<Document>>() {}, "Document");
        String source = file.toString();
        documents.forEach(doc -> RecordValidator.validate(doc, source));
        return documents;
    }

    public void writeScores(Path file, List<BucketScore> scores) throws IOException {
        write(file, scores);
        log.info("Wrote {} bucket scores to {}", scores.size(), file);
    }

    public List<BucketScore> readScores(Path file) throws IOException {
        List<BucketScore> scores = readList(file, new TypeReference<List<BucketScore>>() {}, "BucketScore");
        String source = file.toString();
        scores.forEach(score -> RecordValidator.validate(score, source));
        return scores;
    }

    /**
     * doc_id -> bucket, in file order
     */
    public Map<String, String> readScoreMap(Path file) throws IOException {
        Map<String, String> scoreMap = new LinkedHashMap<>();
        for (BucketScore score : readScores(file)) {
            scoreMap.put(score.getDocId(), score.getBucket());
        }
        return scoreMap;
    }

    public void writeClusters(Path file, ClusterResult result) throws IOException {
        write(file, result);
        log.info("Wrote {} projects to {}", result.getProjects().size(), file);
    }

    public ClusterResult readClusters(Path file) throws IOException {
        JsonNode root = readTree(file);
        if (!root.isObject() || !root.has("projects")) {
            throw new RecordValidationException("ClusterResult", file.toString(),
                "expected an object with a 'projects' list");
        }
        ClusterResult result = convert(root, ClusterResult.class, "ClusterResult", file);
        String source = file.toString();
        for (ClusterProject project : result.getProjects()) {
            RecordValidator.validate(project, source);
        }
        return result;
    }

    public void writePlans(Path file, List<OrganizePlan> plans) throws IOException {
        write(file, plans);
        log.info("Wrote {} plans to {}", plans.size(), file);
    }

    public List<OrganizePlan> readPlans(Path file) throws IOException {
        List<OrganizePlan> plans = readList(file, new TypeReference<List<OrganizePlan>>() {}, "OrganizePlan");
        String source = file.toString();
        plans.forEach(plan -> RecordValidator.validate(plan, source));
        return plans;
    }

    private void write(Path file, Object value) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
    }

    private <T> List<T> readList(Path file, TypeReference<List<T>> type, String recordType) throws IOException {
        JsonNode root = readTree(file);
        if (!root.isArray()) {
            throw new RecordValidationException(recordType, file.toString(), "expected a JSON list");
        }
        try {
            return objectMapper.readerFor(type).readValue(root);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RecordValidationException(recordType, file.toString(), e.getMessage(), e);
        }
    }

    private <T> T convert(JsonNode node, Class<T> type, String recordType, Path file) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RecordValidationException(recordType, file.toString(), e.getMessage(), e);
        }
    }

    private JsonNode readTree(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Artifact not found: " + file);
        }
        return objectMapper.readTree(file.toFile());
    }
}
