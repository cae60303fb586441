package org.catalogsearch.ranking.model;

/**
 * Signal families combined by a variant's weights.
 */
public enum SignalCategory {

    SIMILARITY("similarity"),
    BUSINESS("business"),
    PERSONALIZATION("personalization"),
    GEOGRAPHIC("geographic");

    private final String key;

    SignalCategory(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Returns whether the category can be scored for every request, whatever optional
     * context is missing.
     */
    public boolean alwaysApplicable() {
        return this == SIMILARITY || this == BUSINESS;
    }
}
