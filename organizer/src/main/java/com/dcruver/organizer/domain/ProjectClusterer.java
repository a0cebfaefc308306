package com.dcruver.organizer.domain;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups documents into inferred projects by a label taken from their parent path.
 */
@Component
@Slf4j
public class ProjectClusterer {

    static final String DEFAULT_LABEL = "general_project";

    public ClusterResult cluster(List<ClusterCandidate> candidates, List<String> hints,
                                 Map<String, String> scoreMap) {
        Map<String, List<ClusterCandidate>> groups = new TreeMap<>();
        for (ClusterCandidate candidate : candidates) {
            Path parent = candidate.getPath().getParent();
            String label = inferLabel(parent, hints);
            groups.computeIfAbsent(label, k -> new ArrayList<>()).add(candidate);
        }

        List<ClusterProject> projects = new ArrayList<>();
        int index = 1;
        for (Map.Entry<String, List<ClusterCandidate>> group : groups.entrySet()) {
            String label = group.getKey();
            List<ClusterCandidate> members = group.getValue();

            List<String> docIds = new ArrayList<>(members.size());
            Map<String, String> roles = new LinkedHashMap<>();
            for (ClusterCandidate member : members) {
                docIds.add(member.getDocId());
                roles.put(member.getDocId(), scoreMap.getOrDefault(member.getDocId(), member.getBucket()));
            }

            projects.add(ClusterProject.builder()
                .projectId(String.format("project_%03d", index++))
                .projectLabel(label)
                .docIds(docIds)
                .roleBucketMap(roles)
                .confidence(confidence(members.size()))
                .reasons(List.of("grouped_by:" + label, "docs:" + members.size()))
                .build());
        }

        log.info("Clustered {} documents into {} projects", candidates.size(), projects.size());
        return new ClusterResult(projects);
    }

    /**
     * Label from the segments of dir longer than two characters.
     */
    public static String inferLabel(Path dir, List<String> hints) {
        List<String> segments = new ArrayList<>();
        if (dir != null) {
            for (Path part : dir) {
                String segment = part.toString();
                if (segment.length() > 2) {
                    segments.add(segment.toLowerCase(Locale.ROOT));
                }
            }
        }

        for (String hint : hints) {
            if (segments.contains(hint.toLowerCase(Locale.ROOT))) {
                return normalizeLabel(hint);
            }
        }
        if (segments.size() >= 2) {
            return normalizeLabel(segments.get(segments.size() - 2) + "_" + segments.get(segments.size() - 1));
        }
        if (segments.size() == 1) {
            return normalizeLabel(segments.get(0));
        }
        return DEFAULT_LABEL;
    }

    public static String normalizeLabel(String label) {
        StringBuilder sb = new StringBuilder(label.length());
        label.codePoints().forEach(cp -> {
            if (Character.isLetterOrDigit(cp) || cp == '_' || cp == '-') {
                sb.appendCodePoint(cp);
            } else {
                sb.append('_');
            }
        });

        int start = 0;
        int end = sb.length();
        while (start < end && (sb.charAt(start) == '_' || sb.charAt(start) == ' ')) {
            start++;
        }
        while (end > start && (sb.charAt(end - 1) == '_' || sb.charAt(end - 1) == ' ')) {
            end--;
        }
        return sb.substring(start, end).toLowerCase(Locale.ROOT);
    }

    static double confidence(int size) {
        double raw = Math.min(1.0, 0.6 + size * 0.05);
        return Math.round(raw * 100) / 100.0;
    }
}
