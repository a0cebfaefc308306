package com.dcruver.organizer.domain;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores documents against weighted bucket rules and picks the best bucket.
 *
 * Buckets are visited in configured order and only a strictly higher score
 * replaces the current best, so ties go to the earlier bucket. A document that
 * matches nothing lands in {@value BucketScore#FALLBACK_BUCKET}.
 */
@Component
@Slf4j
public class RuleClassifier {

    public List<BucketScore> classify(List<Document> documents, RuleConfig rules) {
        List<BucketScore> scores = documents.parallelStream()
            .map(doc -> score(doc, rules))
            .toList();

        long fallbacks = scores.stream().filter(BucketScore::isFallback).count();
        log.info("Classified {} documents ({} fell back to {})",
            scores.size(), fallbacks, BucketScore.FALLBACK_BUCKET);
        return scores;
    }

    public BucketScore score(Document doc, RuleConfig rules) {
        String bestBucket = null;
        double bestScore = 0;
        List<String> bestReasons = List.of();

        int extWeight = rules.weightOf(SignalCategory.EXTENSION);
        int nameWeight = rules.weightOf(SignalCategory.FILENAME);
        int dirWeight = rules.weightOf(SignalCategory.DIRECTORY);
        int contentWeight = rules.weightOf(SignalCategory.CONTENT);

        String imports = String.join(" ", doc.getImportsFirst());
        String headings = String.join(" ", doc.getMarkdownHeadings());

        for (Map.Entry<String, BucketRule> entry : rules.getBuckets().entrySet()) {
            BucketRule rule = entry.getValue();
            double total = 0;
            List<String> reasons = new ArrayList<>();

            String ext = nullToEmpty(doc.getExtension());
            if (!ext.isEmpty() && rule.getExts().contains(ext)) {
                total += extWeight;
                reasons.add("ext:" + ext);
            }
            total += signal("name", doc.getName(), rule.getNameKeywords(), nameWeight, reasons);
            total += signal("dir", doc.getDirHint(), rule.getDirKeywords(), dirWeight, reasons);
            total += signal("content", doc.getSampleText(), rule.getCodeHints(), contentWeight, reasons);
            total += signal("imports", imports, rule.getImports(), contentWeight, reasons);
            total += signal("titles", headings, rule.getTitleKeywords(), contentWeight, reasons);

            if (total > bestScore) {
                bestScore = total;
                bestBucket = entry.getKey();
                bestReasons = reasons;
            }
        }

        if (bestBucket == null) {
            return BucketScore.fallback(doc.getDocId());
        }
        return BucketScore.builder()
            .docId(doc.getDocId())
            .bucket(bestBucket)
            .score(bestScore)
            .reasons(bestReasons)
            .build();
    }

    /**
     * Keywords found (case-insensitive substring) in value, times weight.
     * Adds a "prefix:kw1,kw2" reason when anything matched.
     */
    private static double signal(String prefix, String value, List<String> keywords, int weight,
                                 List<String> reasons) {
        List<String> matches = matchKeywords(value, keywords);
        if (matches.isEmpty()) {
            return 0;
        }
        reasons.add(prefix + ":" + String.join(",", matches));
        return (double) matches.size() * weight;
    }

    static List<String> matchKeywords(String value, List<String> keywords) {
        if (value == null || value.isEmpty() || keywords.isEmpty()) {
            return List.of();
        }
        String lowered = value.toLowerCase(Locale.ROOT);
        List<String> matches = new ArrayList<>();
        for (String keyword : keywords) {
            if (lowered.contains(keyword.toLowerCase(Locale.ROOT))) {
                matches.add(keyword);
            }
        }
        return matches;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
