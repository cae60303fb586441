package org.catalogsearch.ranking.model;

/**
 * Current search session.
 *
 * @param sessionId    session identifier, also used for variant assignment
 * @param searchIntent inferred intent ({@code purchase}, {@code browse}, {@code research},
 *                     {@code compare}); may be {@code null}
 */
public record SessionContext(String sessionId, String searchIntent) {
}
