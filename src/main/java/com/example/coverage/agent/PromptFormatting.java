package com.example.coverage.agent;

import com.example.coverage.model.LineItemCoverage;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shared rendering of policy lists and line items for prompts.
 */
final class PromptFormatting {

    private static final int MAX_PARTS_PER_CATEGORY = 40;

    private PromptFormatting() {
    }

    static String componentLists(Map<String, List<String>> lists) {
        String text = lists.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(e -> {
                    List<String> parts = e.getValue();
                    String joined = parts.stream().limit(MAX_PARTS_PER_CATEGORY).collect(Collectors.joining(", "));
                    if (parts.size() > MAX_PARTS_PER_CATEGORY) {
                        joined += ", ... (" + parts.size() + " total)";
                    }
                    return "  - " + e.getKey() + ": " + joined;
                })
                .collect(Collectors.joining("\n"));
        return text.isEmpty() ? "  (none)" : text;
    }

    static String itemLine(LineItemCoverage item) {
        String line = "  [%d] %s | type=%s | price=%s | category=%s | status=%s".formatted(
                item.index(), item.description(), item.itemType().value(), item.totalPrice().toPlainString(),
                item.coverageCategory() != null ? item.coverageCategory() : "N/A",
                item.coverageStatus().name().toLowerCase());
        if (item.matchedComponent() != null) {
            line += " | identified_as=" + item.matchedComponent();
        }
        return line;
    }

    static String itemLines(List<LineItemCoverage> items) {
        return items.stream().map(PromptFormatting::itemLine).collect(Collectors.joining("\n"));
    }
}
