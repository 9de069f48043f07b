package com.example.coverage.service;

import com.example.coverage.config.ComponentVocabulary;
import com.example.coverage.model.ItemType;
import com.example.coverage.model.LineItem;
import com.example.coverage.model.RepairContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the repair being performed from labor descriptions, before item-level matching.
 * The first labor line naming a repair-context keyword sets the primary component.
 */
@Service
public class RepairContextExtractor {

    private static final Logger log = LoggerFactory.getLogger(RepairContextExtractor.class);

    public RepairContext extract(List<LineItem> items, PolicyMatcher matcher) {
        Map<String, ComponentVocabulary.RepairKeyword> keywords = matcher.vocabulary().repairContextKeywords();
        if (keywords.isEmpty()) {
            return RepairContext.none();
        }

        String component = null;
        String category = null;
        String source = null;
        Set<String> detected = new LinkedHashSet<>();

        for (LineItem item : items) {
            if (item.itemType() != ItemType.LABOR) continue;
            for (Map.Entry<String, ComponentVocabulary.RepairKeyword> entry : keywords.entrySet()) {
                if (!TermMatcher.containsTerm(item.description(), entry.getKey())) continue;
                detected.add(entry.getValue().component());
                if (component == null) {
                    component = entry.getValue().component();
                    category = entry.getValue().category();
                    source = item.description();
                }
                break;
            }
        }

        if (component == null) {
            return RepairContext.none();
        }

        Boolean covered;
        PolicyMatcher.ListCheck check = matcher.componentInPolicyList(component, category, source, true);
        if (check.listed()) {
            covered = Boolean.TRUE;
        } else if (matcher.isCategoryCovered(category) && !matcher.isExcluded(component, category, source)) {
            log.info("Repair context '{}' in '{}': category covered, part not listed, not excluded -> uncertain",
                    component, category);
            covered = null;
        } else {
            covered = Boolean.FALSE;
        }

        log.info("Extracted repair context: {} ({}), covered={} from '{}'", component, category, covered, source);
        return new RepairContext(component, category, covered, source, new ArrayList<>(detected));
    }
}
