package com.dcruver.organizer.io;

import com.dcruver.organizer.domain.BucketScore;
import com.dcruver.organizer.domain.ClusterProject;
import com.dcruver.organizer.domain.Document;
import com.dcruver.organizer.domain.JournalEntry;
import com.dcruver.organizer.domain.OrganizePlan;

/**
 * Required-field checks applied whenever records are read back from disk.
 * Missing fields are rejected, never defaulted.
 */
public final class RecordValidator {

    private RecordValidator() {
    }

    public static Document validate(Document doc, String source) {
        require("Document", source, "doc_id", doc.getDocId());
        require("Document", source, "path", doc.getPath());
        require("Document", source, "name", doc.getName());
        require("Document", source, "content_digest", doc.getContentDigest());
        return doc;
    }

    public static BucketScore validate(BucketScore score, String source) {
        require("BucketScore", source, "doc_id", score.getDocId());
        require("BucketScore", source, "bucket", score.getBucket());
        return score;
    }

    public static ClusterProject validate(ClusterProject project, String source) {
        require("ClusterProject", source, "project_id", project.getProjectId());
        require("ClusterProject", source, "project_label", project.getProjectLabel());
        if (project.getDocIds().isEmpty()) {
            throw new RecordValidationException("ClusterProject", source,
                "project " + project.getProjectId() + " has no doc_ids");
        }
        return project;
    }

    public static OrganizePlan validate(OrganizePlan plan, String source) {
        require("OrganizePlan", source, "doc_id", plan.getDocId());
        require("OrganizePlan", source, "project_id", plan.getProjectId());
        require("OrganizePlan", source, "bucket", plan.getBucket());
        require("OrganizePlan", source, "source_path", plan.getSourcePath());
        require("OrganizePlan", source, "target_path", plan.getTargetPath());
        return plan;
    }

    public static JournalEntry validate(JournalEntry entry, String source) {
        require("JournalEntry", source, "original_path", entry.getOriginalPath());
        require("JournalEntry", source, "target_path", entry.getTargetPath());
        require("JournalEntry", source, "doc_id", entry.getDocId());
        if (entry.getStatus() == null) {
            throw new RecordValidationException("JournalEntry", source, "missing required field 'status'");
        }
        if (entry.getTimestamp() == null) {
            throw new RecordValidationException("JournalEntry", source, "missing required field 'timestamp'");
        }
        return entry;
    }

    private static void require(String type, String source, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new RecordValidationException(type, source, "missing required field '" + field + "'");
        }
    }
}
