package org.catalogsearch.ranking.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Individual sub-signals produced by the scorers, grouped by category.
 *
 * <p>Declaration order within a category is the priority used when picking explanation
 * reasons.</p>
 */
public enum Signal {

    VISUAL(SignalCategory.SIMILARITY, "visual", "visually similar"),
    TEXTUAL(SignalCategory.SIMILARITY, "textual", "title matches query"),
    CATEGORICAL(SignalCategory.SIMILARITY, "categorical", "matches category"),
    SHOPPING_HISTORY(SignalCategory.SIMILARITY, "behavioral", "similar to what you shop for"),

    POPULARITY(SignalCategory.BUSINESS, "popularity", "highly rated"),
    STOCK(SignalCategory.BUSINESS, "stock", "in stock"),
    PRICE(SignalCategory.BUSINESS, "price", "competitive price"),
    CONVERSION(SignalCategory.BUSINESS, "conversion", "frequently purchased"),
    GEOGRAPHIC(SignalCategory.BUSINESS, "geographic", "available in your region"),

    PREFERENCE(SignalCategory.PERSONALIZATION, "preference", "matches your preferences"),
    ACTIVITY(SignalCategory.PERSONALIZATION, "behavioral", "based on your activity"),
    SESSION(SignalCategory.PERSONALIZATION, "session", "relevant to your search"),
    TEMPORAL(SignalCategory.PERSONALIZATION, "temporal", "trending this season");

    private final SignalCategory category;
    private final String key;
    private final String reason;

    Signal(SignalCategory category, String key, String reason) {
        this.category = category;
        this.key = key;
        this.reason = reason;
    }

    public SignalCategory category() {
        return category;
    }

    /** Name used in configuration and in score breakdowns (unique within a category). */
    public String key() {
        return key;
    }

    /** Human-readable explanation shown when this signal is strong. */
    public String reason() {
        return reason;
    }

    public static List<Signal> of(SignalCategory category) {
        List<Signal> signals = new ArrayList<>();
        for (Signal signal : values()) {
            if (signal.category == category) {
                signals.add(signal);
            }
        }
        return signals;
    }

    public static Signal fromKey(SignalCategory category, String key) {
        for (Signal signal : values()) {
            if (signal.category == category
                    && (signal.key.equalsIgnoreCase(key) || signal.name().equalsIgnoreCase(key))) {
                return signal;
            }
        }
        throw new IllegalArgumentException("Unknown " + category.key() + " signal: " + key);
    }
}
