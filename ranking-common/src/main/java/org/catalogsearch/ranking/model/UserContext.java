package org.catalogsearch.ranking.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;

/**
 * Optional profile of the requesting user, supplied by the user-profile store.
 *
 * <p>Absence of a profile is a valid input: personalization is then skipped and its
 * weight redistributed.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserContext {

    private String userId;

    private Set<String> preferredCategories;
    private Set<String> preferredBrands;

    /** Preferred price band; either bound may be missing. */
    private Double preferredPriceMin;
    private Double preferredPriceMax;

    /** Interaction counts per category (views, clicks and purchases summarized). */
    private Map<String, Integer> categoryFrequencies;

    /** Purchase counts per brand. */
    private Map<String, Integer> brandFrequencies;

    private Set<String> viewedProductIds;

    /** Hours of day (0-23) at which the user habitually purchases. */
    private Set<Integer> purchaseHours;

    /** Device type of the current session, e.g. {@code mobile} or {@code desktop}. */
    private String deviceType;

    /** Local hour of day (0-23) of the request, when known to the caller. */
    private Integer hourOfDay;

    public boolean hasPriceBand() {
        return preferredPriceMin != null || preferredPriceMax != null;
    }
}
