package com.example.coverage.service;

/**
 * What an earlier stage learned about an item it declined to resolve, handed to later stages.
 *
 * @param category  category the item was identified in
 * @param component component it was identified as
 * @param source    stage that left the hint
 * @param note      why the stage deferred
 */
public record StageHint(String category, String component, String source, String note) {

    public String describe() {
        return "Pre-identified as '" + component + "' in category '" + category + "' by " + source
                + (note != null ? " (" + note + ")" : "");
    }
}
