package org.catalogsearch.ranking.service.facet;

import java.util.Map;

/**
 * Value counts over a ranked result list.
 *
 * @param brands      count per brand, most frequent first
 * @param categories  count per category, most frequent first
 * @param priceRanges count per price range, in ascending range order
 * @param ratings     count per rounded rating, "1" to "5"
 */
public record Facets(
        Map<String, Long> brands,
        Map<String, Long> categories,
        Map<String, Long> priceRanges,
        Map<String, Long> ratings
) {
}
