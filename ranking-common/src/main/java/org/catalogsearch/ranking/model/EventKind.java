package org.catalogsearch.ranking.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of experiment events. {@code view} is accepted as a synonym of {@code impression}.
 */
public enum EventKind {

    IMPRESSION("impression"),
    CLICK("click"),
    PURCHASE("purchase");

    private final String value;

    EventKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static EventKind fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Event kind is required");
        }
        String normalized = value.trim().toLowerCase();
        return switch (normalized) {
            case "impression", "view" -> IMPRESSION;
            case "click" -> CLICK;
            case "purchase" -> PURCHASE;
            default -> throw new IllegalArgumentException("Unknown event kind: " + value);
        };
    }
}
