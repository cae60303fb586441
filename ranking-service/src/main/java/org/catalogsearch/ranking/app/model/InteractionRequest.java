package org.catalogsearch.ranking.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A shopper interaction with a ranked result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InteractionRequest {

    private String sessionId;

    /** Variant that produced the result; looked up from the session assignment when absent. */
    private String variant;

    private String productId;

    /** {@code impression} (or {@code view}), {@code click} or {@code purchase}. */
    private String eventType;

    /** 1-based position of the product in the result list. */
    private Integer position;

    /** When the interaction happened; the receive time when absent. */
    private Instant timestamp;
}
