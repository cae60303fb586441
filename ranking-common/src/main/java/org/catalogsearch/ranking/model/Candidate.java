package org.catalogsearch.ranking.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One product under consideration, as supplied by the candidate source.
 *
 * <p>Numeric attributes are boxed so that a missing value can be told apart from zero;
 * scorers degrade a sub-score to 0 when the attribute they need is missing.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Candidate {

    private String id;

    /** Product vector (same space as the query vector). */
    private List<Double> vector;

    // ---- Textual fields ----

    private String title;
    private String description;
    private String brand;
    private String category;
    private String subcategory;
    private List<String> tags;

    /** Free-form specification sheet (e.g. "screen" -> "6.1in"). */
    private Map<String, String> specifications;

    // ---- Commerce attributes ----

    private Double price;
    private Double originalPrice;

    /** Average price of the candidate's category, used for price competitiveness. */
    private Double categoryAveragePrice;

    private Integer stockQuantity;

    @Builder.Default
    private boolean backorderable = false;

    /** Catalog popularity score in [0,1]. */
    private Double popularityScore;

    private Long viewCount;
    private Long purchaseCount;
    private Long returnCount;

    /** Average rating on a 0-5 scale. */
    private Double rating;
    private Long reviewCount;

    private Double conversionRate;
    private Double addToCartRate;
    private Double returnRate;

    @Builder.Default
    private boolean trending = false;

    // ---- Geographic attributes ----

    /** Countries or regions where the product can be delivered. */
    private Set<String> availableRegions;

    private Double shippingCost;
    private Integer shippingDays;

    /** Popularity in [0,1] keyed by country or region. */
    private Map<String, Double> regionalPopularity;

    public boolean hasVector() {
        return vector != null && !vector.isEmpty();
    }

    public boolean hasSpecifications() {
        return specifications != null && !specifications.isEmpty();
    }
}
