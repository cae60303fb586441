package org.catalogsearch.ranking.app.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariantSummary {

    private String name;

    private Map<String, Double> weights;

    private double trafficShare;
}
