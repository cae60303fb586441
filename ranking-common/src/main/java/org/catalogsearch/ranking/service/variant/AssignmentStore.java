package org.catalogsearch.ranking.service.variant;

import java.util.Optional;
import java.util.function.Function;

/**
 * Remembers which variant a session or user was assigned to.
 */
public interface AssignmentStore {

    Optional<String> find(String id);

    /**
     * Returns the stored assignment for {@code id}, computing and storing it atomically when absent.
     */
    String computeIfAbsent(String id, Function<String, String> assignment);

    int size();
}
