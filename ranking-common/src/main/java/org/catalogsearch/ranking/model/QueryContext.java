package org.catalogsearch.ranking.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Input of one ranking request.
 *
 * <p>Every field is optional: a query may carry free text, a dense vector produced by the
 * embedding provider, or both. The engine only reads it.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryContext {

    /** Free-text query as typed by the user. */
    private String text;

    /** Query vector in the same space as {@link Candidate#getVector()}. */
    private List<Double> vector;

    /** Category the user is browsing or filtering on. */
    private String targetCategory;

    /** Sub-category the user is browsing or filtering on. */
    private String targetSubcategory;

    /** Lower bound of the price filter (inclusive). */
    private Double minPrice;

    /** Upper bound of the price filter (inclusive). */
    private Double maxPrice;

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public boolean hasVector() {
        return vector != null && !vector.isEmpty();
    }

    /**
     * Returns whether a candidate price passes the price filter. Unknown prices always pass.
     */
    public boolean acceptsPrice(Double price) {
        if (price == null) {
            return true;
        }
        if (minPrice != null && price < minPrice) {
            return false;
        }
        return maxPrice == null || price <= maxPrice;
    }
}
