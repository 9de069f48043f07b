package com.example.coverage.config;

import com.example.coverage.model.ExclusionReason;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads a tenant vocabulary document (YAML, snake_case keys) and validates it.
 * <p>
 * Any problem is reported as a {@link VocabularyException}; a vocabulary that cannot be
 * loaded is never replaced by an empty one.
 */
public class VocabularyLoader {

    private static final Logger log = LoggerFactory.getLogger(VocabularyLoader.class);

    static final List<String> REQUIRED_SECTIONS = List.of("components", "rules", "keywords", "parts");

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    private final ResourceLoader resourceLoader;

    public VocabularyLoader() {
        this(new DefaultResourceLoader());
    }

    public VocabularyLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * @param location Spring resource location, e.g. {@code classpath:vocabulary/nsa-default.yaml}
     */
    public TenantVocabulary load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new VocabularyException("Vocabulary not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = yamlMapper.readTree(in);
            TenantVocabulary vocabulary = parse(root, location);
            log.info("Loaded vocabulary '{}' from {}: {} synonyms, {} patterns, {} keyword mappings, {} part numbers",
                    vocabulary.version(), location,
                    vocabulary.components().componentSynonyms().size(),
                    vocabulary.rules().allPatterns().count(),
                    vocabulary.keywords().mappings().size(),
                    vocabulary.parts().byPartNumber().size());
            return vocabulary;
        } catch (IOException e) {
            throw new VocabularyException("Cannot read vocabulary " + location + ": " + e.getMessage(), e);
        }
    }

    TenantVocabulary parse(JsonNode root, String location) {
        if (root == null || !root.isObject()) {
            throw new VocabularyException("Vocabulary " + location + " is not a YAML mapping");
        }
        List<String> missing = REQUIRED_SECTIONS.stream().filter(s -> !root.hasNonNull(s)).toList();
        if (!missing.isEmpty()) {
            throw new VocabularyException("Vocabulary " + location + " is missing sections " + missing);
        }

        TenantVocabulary vocabulary;
        try {
            vocabulary = yamlMapper.treeToValue(root, TenantVocabulary.class);
        } catch (IOException e) {
            throw new VocabularyException("Malformed vocabulary " + location + ": " + e.getMessage(), e);
        }

        List<String> problems = validate(vocabulary);
        if (!problems.isEmpty()) {
            throw new VocabularyException("Invalid vocabulary " + location + ": " + String.join("; ", problems));
        }
        return vocabulary;
    }

    List<String> validate(TenantVocabulary vocabulary) {
        List<String> problems = new ArrayList<>();

        vocabulary.rules().allPatterns().forEach(rule -> {
            if (rule.pattern() == null || rule.pattern().isBlank()) {
                problems.add("empty rule pattern (label " + rule.label() + ")");
                return;
            }
            try {
                Pattern.compile(rule.pattern());
            } catch (PatternSyntaxException e) {
                problems.add("pattern '" + rule.pattern() + "' does not compile: " + e.getDescription());
            }
        });

        for (KeywordDictionary.KeywordMapping mapping : vocabulary.keywords().mappings()) {
            if (isBlank(mapping.category())) {
                problems.add("keyword mapping " + mapping.keywords() + " has no category");
            }
            if (mapping.keywords().isEmpty()) {
                problems.add("keyword mapping for " + mapping.category() + "/" + mapping.component() + " has no keywords");
            }
            if (mapping.confidence() <= 0.0 || mapping.confidence() > 1.0) {
                problems.add("keyword mapping for " + mapping.category() + " has confidence "
                        + mapping.confidence() + " outside (0, 1]");
            }
        }

        for (Map.Entry<String, PartCatalog.PartEntry> entry : vocabulary.parts().byPartNumber().entrySet()) {
            PartCatalog.PartEntry part = entry.getValue();
            if (part == null || isBlank(part.component()) || isBlank(part.category())) {
                problems.add("part " + entry.getKey() + " must name a component and a category");
            }
        }
        for (PartCatalog.PartKeyword keyword : vocabulary.parts().byKeyword()) {
            if (isBlank(keyword.keyword()) || isBlank(keyword.component()) || isBlank(keyword.category())) {
                problems.add("part keyword '" + keyword.keyword() + "' must name a keyword, component and category");
            }
        }

        vocabulary.components().repairContextKeywords().forEach((phrase, target) -> {
            if (target == null || isBlank(target.component()) || isBlank(target.category())) {
                problems.add("repair context keyword '" + phrase + "' must name a component and a category");
            }
        });

        ExplanationTemplates explanations = vocabulary.explanations();
        explanations.templates().keySet().stream()
                .filter(reason -> ExclusionReason.fromValue(reason) == null)
                .forEach(reason -> problems.add("explanation template for unknown reason '" + reason + "'"));
        explanations.categorySubgroupReasons().stream()
                .filter(reason -> ExclusionReason.fromValue(reason) == null)
                .forEach(reason -> problems.add("unknown category subgroup reason '" + reason + "'"));
        return problems;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
