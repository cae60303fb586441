package org.catalogsearch.ranking.service.variant;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Process-local {@link AssignmentStore} backed by a bounded Caffeine cache.
 *
 * <p>Entries idle longer than {@code expireAfterAccess} are evicted, as are the least recently
 * used ones beyond {@code maximumSize}. Bucketing is deterministic, so an evicted id is assigned
 * the same variant again while the configuration is unchanged.</p>
 */
public class InMemoryAssignmentStore implements AssignmentStore {

    public static final long DEFAULT_MAXIMUM_SIZE = 100_000L;
    public static final Duration DEFAULT_EXPIRE_AFTER_ACCESS = Duration.ofDays(7);

    private final Cache<String, String> assignments;

    public InMemoryAssignmentStore() {
        this(DEFAULT_MAXIMUM_SIZE, DEFAULT_EXPIRE_AFTER_ACCESS);
    }

    public InMemoryAssignmentStore(long maximumSize, Duration expireAfterAccess) {
        this(maximumSize, expireAfterAccess, Ticker.systemTicker());
    }

    InMemoryAssignmentStore(long maximumSize, Duration expireAfterAccess, Ticker ticker) {
        this.assignments = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterAccess(expireAfterAccess)
                .ticker(ticker)
                // maintenance on the calling thread keeps size() exact after cleanUp
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Optional<String> find(String id) {
        return Optional.ofNullable(assignments.getIfPresent(id));
    }

    @Override
    public String computeIfAbsent(String id, Function<String, String> assignment) {
        return assignments.get(id, assignment);
    }

    @Override
    public int size() {
        assignments.cleanUp();
        return (int) assignments.estimatedSize();
    }
}
