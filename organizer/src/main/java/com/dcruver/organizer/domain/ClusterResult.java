package com.dcruver.organizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Optional;

/**
 * All projects produced by one clustering run, in project id order.
 */
@Data
public class ClusterResult {
    private final List<ClusterProject> projects;

    @JsonCreator
    public ClusterResult(@JsonProperty("projects") List<ClusterProject> projects) {
        this.projects = projects != null ? List.copyOf(projects) : List.of();
    }

    public Optional<ClusterProject> findProject(String projectId) {
        return projects.stream()
            .filter(p -> p.getProjectId().equals(projectId))
            .findFirst();
    }

    @JsonIgnore
    public int getDocumentCount() {
        return projects.stream().mapToInt(ClusterProject::size).sum();
    }
}
