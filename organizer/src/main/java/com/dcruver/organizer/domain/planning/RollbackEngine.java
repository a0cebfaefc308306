package com.dcruver.organizer.domain.planning;

import com.dcruver.organizer.domain.JournalEntry;
import com.dcruver.organizer.domain.JournalStatus;
import com.dcruver.organizer.io.JournalReader;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Replays a journal backwards to put files back where they came from.
 *
 * The journal itself is only read. Running twice is harmless: after the first
 * pass no target exists any more and every entry is skipped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RollbackEngine {

    private final JournalReader journalReader;

    public RollbackResult rollback(Path journalPath) throws IOException {
        List<JournalEntry> entries = journalReader.read(journalPath);
        if (entries.isEmpty()) {
            log.warn("No journal entries to roll back in {}", journalPath);
        }

        int restored = 0;
        int skipped = 0;
        int conflicts = 0;
        int failed = 0;

        for (int i = entries.size() - 1; i >= 0; i--) {
            JournalEntry entry = entries.get(i);
            if (!entry.getStatus().isRelocation()) {
                skipped++;
                continue;
            }

            Path target = entry.getTarget();
            Path original = entry.getOriginal();
            if (!Files.exists(target)) {
                log.debug("Target gone, skipping: {}", target);
                skipped++;
                continue;
            }

            if (entry.getStatus() == JournalStatus.MOVED && Files.exists(original)) {
                log.warn("Original path is occupied, not overwriting: {}", original);
                conflicts++;
                continue;
            }

            try {
                Path parent = original.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                if (entry.getStatus() == JournalStatus.COPIED) {
                    Files.move(target, original, StandardCopyOption.REPLACE_EXISTING);
                } else {
                    Files.move(target, original);
                }
                restored++;
            } catch (IOException e) {
                log.error("Failed to restore {} -> {}", target, original, e);
                failed++;
            }
        }

        RollbackResult result = RollbackResult.builder()
            .entries(entries.size())
            .restored(restored)
            .skipped(skipped)
            .conflicts(conflicts)
            .failed(failed)
            .build();
        log.info("Rollback of {}: {} restored, {} skipped, {} conflicts, {} failed",
            journalPath, restored, skipped, conflicts, failed);
        return result;
    }

    @Data
    @Builder
    public static class RollbackResult {
        private final int entries;
        private final int restored;
        private final int skipped;
        private final int conflicts;
        private final int failed;
    }
}
