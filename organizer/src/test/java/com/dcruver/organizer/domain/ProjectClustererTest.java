package com.dcruver.organizer.domain;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProjectClustererTest {

    private final ProjectClusterer clusterer = new ProjectClusterer();

    @Test
    void testHintMatchingASegmentWins() {
        assertEquals("sample", ProjectClusterer.inferLabel(Path.of("/home/user/sample/src/core"), List.of("sample")));
        assertEquals("sample", ProjectClusterer.inferLabel(Path.of("/home/user/Sample"), List.of("SAMPLE")));
    }

    @Test
    void testFirstConfiguredHintWins() {
        Path dir = Path.of("/work/alpha/beta");

        assertEquals("beta", ProjectClusterer.inferLabel(dir, List.of("missing", "beta", "alpha")));
    }

    @Test
    void testLastTwoSegmentsWithoutHint() {
        assertEquals("alpha_beta", ProjectClusterer.inferLabel(Path.of("/home/user/alpha/beta"), List.of()));
    }

    @Test
    void testShortSegmentsAreIgnored() {
        assertEquals("project", ProjectClusterer.inferLabel(Path.of("/ab/project/x"), List.of()));
        assertEquals("general_project", ProjectClusterer.inferLabel(Path.of("/ab/cd"), List.of()));
        assertEquals("general_project", ProjectClusterer.inferLabel(Path.of("/"), List.of()));
    }

    @Test
    void testNormalizeLabel() {
        assertEquals("my_project", ProjectClusterer.normalizeLabel("My Project!"));
        assertEquals("data-set_v2", ProjectClusterer.normalizeLabel("__data-set v2__"));
        assertEquals("a__b", ProjectClusterer.normalizeLabel("a.&b"));
    }

    @Test
    void testProjectsAreSortedByLabelAndNumbered() {
        List<ClusterCandidate> candidates = List.of(
            candidate("d1", "/work/zeta/code/app.py", "src"),
            candidate("d2", "/work/alpha/code/main.py", "src"),
            candidate("d3", "/work/zeta/code/util.py", "src"));

        ClusterResult result = clusterer.cluster(candidates, List.of(), Map.of());

        assertEquals(2, result.getProjects().size());
        ClusterProject first = result.getProjects().get(0);
        ClusterProject second = result.getProjects().get(1);
        assertEquals("project_001", first.getProjectId());
        assertEquals("alpha_code", first.getProjectLabel());
        assertEquals("project_002", second.getProjectId());
        assertEquals("zeta_code", second.getProjectLabel());
        assertEquals(List.of("d1", "d3"), second.getDocIds());
        assertEquals(List.of("grouped_by:zeta_code", "docs:2"), second.getReasons());
        assertEquals(3, result.getDocumentCount());
    }

    @Test
    void testRoleBucketPrefersScoreMap() {
        List<ClusterCandidate> candidates = List.of(
            candidate("d1", "/work/proj/app.py", "src"),
            candidate("d2", "/work/proj/notes.md", "docs"));

        ClusterResult result = clusterer.cluster(candidates, List.of("proj"), Map.of("d1", "scripts"));

        Map<String, String> roles = result.getProjects().get(0).getRoleBucketMap();
        assertEquals("scripts", roles.get("d1"));
        assertEquals("docs", roles.get("d2"));
    }

    @Test
    void testConfidenceGrowsWithSizeAndCaps() {
        assertEquals(0.65, ProjectClusterer.confidence(1));
        assertEquals(0.75, ProjectClusterer.confidence(3));
        assertEquals(1.0, ProjectClusterer.confidence(8));
        assertEquals(1.0, ProjectClusterer.confidence(50));
    }

    @Test
    void testClusteringIsDeterministic() {
        List<ClusterCandidate> candidates = List.of(
            candidate("d1", "/work/one/app.py", "src"),
            candidate("d2", "/work/two/app.py", "src"),
            candidate("d3", "/work/one/readme.md", "docs"));

        assertEquals(clusterer.cluster(candidates, List.of(), Map.of()),
            clusterer.cluster(candidates, List.of(), Map.of()));
    }

    private static ClusterCandidate candidate(String id, String path, String bucket) {
        Path p = Path.of(path);
        return ClusterCandidate.builder()
            .docId(id)
            .path(p)
            .name(p.getFileName().toString())
            .bucket(bucket)
            .dirHint(p.getParent().getFileName().toString())
            .build();
    }
}
