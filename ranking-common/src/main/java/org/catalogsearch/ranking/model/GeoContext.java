package org.catalogsearch.ranking.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Requester location, used only for geographic relevance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GeoContext {

    private String country;
    private String region;
    private String city;

    @Builder.Default
    private String currency = "USD";
}
