package com.dcruver.organizer.domain.planning;

import com.dcruver.organizer.domain.ExecutionMode;
import com.dcruver.organizer.domain.JournalEntry;
import com.dcruver.organizer.domain.JournalStatus;
import com.dcruver.organizer.domain.OrganizePlan;
import com.dcruver.organizer.io.JournalWriter;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Carries out relocation plans in order, journaling every attempt.
 *
 * A missing source is recorded and left alone. A move/copy that fails is recorded
 * as failed and execution goes on with the next plan.
 */
@Component
@Slf4j
public class PlanExecutor {

    /**
     * @param digests doc_id -> content digest, recorded in each journal entry
     */
    public ExecutionSummary execute(List<OrganizePlan> plans, ExecutionMode mode, Map<String, String> digests,
                                    JournalWriter journal) throws IOException {
        log.info("Executing {} plans in {} mode", plans.size(), mode);
        Map<JournalStatus, Integer> counts = new EnumMap<>(JournalStatus.class);

        for (OrganizePlan plan : plans) {
            JournalStatus status = relocate(plan, mode);
            journal.append(JournalEntry.forPlan(plan, digests.get(plan.getDocId()), status));
            counts.merge(status, 1, Integer::sum);
        }

        ExecutionSummary summary = ExecutionSummary.builder()
            .mode(mode)
            .relocated(counts.getOrDefault(mode.getSuccessStatus(), 0))
            .missing(counts.getOrDefault(JournalStatus.MISSING, 0))
            .failed(counts.getOrDefault(JournalStatus.FAILED, 0))
            .journalPath(journal.getJournalPath())
            .build();

        log.info("Execution complete: {} {}, {} missing, {} failed",
            summary.getRelocated(), mode.getSuccessStatus().wireName(), summary.getMissing(), summary.getFailed());
        return summary;
    }

    private JournalStatus relocate(OrganizePlan plan, ExecutionMode mode) {
        Path source = plan.getSource();
        Path target = plan.getTarget();

        if (!Files.exists(source)) {
            log.warn("Source missing, nothing to do: {}", source);
            return JournalStatus.MISSING;
        }

        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (mode == ExecutionMode.MOVE) {
                Files.move(source, target);
            } else {
                Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
            }
            log.debug("{} {} -> {}", mode.getSuccessStatus().wireName(), source, target);
            return mode.getSuccessStatus();
        } catch (IOException e) {
            log.error("Failed to {} {} -> {}", mode.name().toLowerCase(Locale.ROOT), source, target, e);
            return JournalStatus.FAILED;
        }
    }

    @Data
    @Builder
    public static class ExecutionSummary {
        private final ExecutionMode mode;
        private final int relocated;
        private final int missing;
        private final int failed;
        private final Path journalPath;

        public int getTotal() {
            return relocated + missing + failed;
        }
    }
}
