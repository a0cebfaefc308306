package com.dcruver.organizer.config;

import com.dcruver.organizer.domain.BucketRule;
import com.dcruver.organizer.domain.RuleConfig;
import com.dcruver.organizer.domain.SignalCategory;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads bucket rules, weights and project hints from a YAML or JSON file.
 *
 * Bucket order in the file is preserved: it decides score ties.
 */
@Component
@Slf4j
public class RuleConfigLoader {

    private static final Set<String> RULE_FIELDS = Set.of(
        "exts", "name_keywords", "dir_keywords", "code_hints", "imports", "title_keywords");

    public RuleConfig load(Path file) {
        JsonNode root = ConfigFileSupport.readRoot(file, "Rule configuration");

        LinkedHashMap<String, BucketRule> buckets = parseBuckets(root.get("buckets"));
        Map<SignalCategory, Integer> weights = parseWeights(root.get("weights"));
        List<String> hints = ConfigFileSupport.stringList(root.get("project_hints"), "project_hints");

        log.info("Loaded {} bucket rules from {} (weights: {}, hints: {})",
            buckets.size(), file, weights, hints);

        return RuleConfig.builder()
            .buckets(buckets)
            .weights(weights)
            .projectHints(hints)
            .build();
    }

    private LinkedHashMap<String, BucketRule> parseBuckets(JsonNode node) {
        LinkedHashMap<String, BucketRule> buckets = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            log.warn("Rule configuration defines no buckets; every document will fall back to archive");
            return buckets;
        }
        if (!node.isObject()) {
            throw new ConfigurationException("'buckets' must be a mapping of bucket name to rule");
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            buckets.put(entry.getKey(), parseRule(entry.getKey(), entry.getValue()));
        }
        return buckets;
    }

    private BucketRule parseRule(String name, JsonNode node) {
        if (node == null || node.isNull()) {
            return BucketRule.builder().name(name).build();
        }
        if (!node.isObject()) {
            throw new ConfigurationException("Bucket '" + name + "' must be a mapping");
        }

        node.fieldNames().forEachRemaining(field -> {
            if (!RULE_FIELDS.contains(field)) {
                throw new ConfigurationException("Bucket '" + name + "' has unknown field '" + field + "'");
            }
        });

        List<String> exts = ConfigFileSupport.stringList(node.get("exts"), name + ".exts").stream()
            .map(RuleConfigLoader::normalizeExtension)
            .filter(ext -> !ext.isEmpty())
            .toList();

        return BucketRule.builder()
            .name(name)
            .exts(exts)
            .nameKeywords(ConfigFileSupport.stringList(node.get("name_keywords"), name + ".name_keywords"))
            .dirKeywords(ConfigFileSupport.stringList(node.get("dir_keywords"), name + ".dir_keywords"))
            .codeHints(ConfigFileSupport.stringList(node.get("code_hints"), name + ".code_hints"))
            .imports(ConfigFileSupport.stringList(node.get("imports"), name + ".imports"))
            .titleKeywords(ConfigFileSupport.stringList(node.get("title_keywords"), name + ".title_keywords"))
            .build();
    }

    private Map<SignalCategory, Integer> parseWeights(JsonNode node) {
        Map<SignalCategory, Integer> weights = new EnumMap<>(SignalCategory.class);
        if (node == null || node.isNull()) {
            return weights;
        }
        if (!node.isObject()) {
            throw new ConfigurationException("'weights' must be a mapping of signal category to integer");
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            SignalCategory category = SignalCategory.fromKey(entry.getKey())
                .orElseThrow(() -> new ConfigurationException("Unknown weight category '" + entry.getKey()
                    + "' (expected extension, filename, directory or content)"));
            JsonNode value = entry.getValue();
            if (!value.isIntegralNumber() || !value.canConvertToInt()) {
                throw new ConfigurationException("Weight '" + entry.getKey() + "' must be an integer");
            }
            weights.put(category, value.intValue());
        }
        return weights;
    }

    static String normalizeExtension(String ext) {
        String normalized = ext.trim().toLowerCase(Locale.ROOT);
        while (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }
}
