package org.catalogsearch.ranking.service.variant;

import lombok.extern.slf4j.Slf4j;
import org.catalogsearch.ranking.config.RankingConfig;
import org.catalogsearch.ranking.model.Variant;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Deterministically assigns sessions or users to ranking variants.
 *
 * <p>The id is hashed with SHA-256 into one of {@value #BUCKETS} buckets; buckets are split
 * between variants in proportion to their traffic shares, in configuration order. Assignments
 * are kept in the {@link AssignmentStore} so an id keeps its variant for the lifetime of the
 * configuration.</p>
 */
@Slf4j
public class VariantSelector {

    static final int BUCKETS = 10_000;

    private static final String ANONYMOUS = "anonymous";

    private final RankingConfig config;
    private final AssignmentStore store;
    private final List<Variant> ordered;
    private final int[] upperBounds;

    public VariantSelector(RankingConfig config, AssignmentStore store) {
        this.config = config;
        this.store = store;
        this.ordered = new ArrayList<>(config.variants().values());
        this.upperBounds = bucketBounds(ordered);
    }

    /**
     * Returns the variant for a session or user id. A {@code null} or blank id is treated as
     * one shared anonymous id.
     */
    public Variant assign(String id) {
        String key = id == null || id.isBlank() ? ANONYMOUS : id;
        String name = store.computeIfAbsent(key, k -> {
            Variant variant = byBucket(bucketOf(k));
            log.debug("Assigned {} to variant {}", k, variant.name());
            return variant.name();
        });
        Variant variant = config.variant(name);
        if (variant == null) {
            // stored by an earlier configuration
            variant = byBucket(bucketOf(key));
        }
        return variant;
    }

    /**
     * Resolves a variant by name.
     *
     * @throws IllegalArgumentException when no such variant is configured
     */
    public Variant variant(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown ranking variant: " + name
                + " (configured: " + String.join(", ", config.variantNames()) + ")"));
    }

    public Optional<Variant> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(config.variant(name));
    }

    /**
     * Returns the variant already assigned to {@code id}, without assigning one.
     */
    public Optional<Variant> lookup(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return store.find(id).map(config::variant);
    }

    public Collection<Variant> variants() {
        return config.variants().values();
    }

    public int assignmentCount() {
        return store.size();
    }

    /**
     * Bucket in [0, {@value #BUCKETS}) for an id.
     */
    static int bucketOf(String id) {
        byte[] digest = sha256(id.getBytes(StandardCharsets.UTF_8));
        long value = 0L;
        for (int i = 0; i < 8; i++) {
            value = (value << 8) | (digest[i] & 0xFFL);
        }
        return (int) Long.remainderUnsigned(value, BUCKETS);
    }

    private Variant byBucket(int bucket) {
        for (int i = 0; i < upperBounds.length; i++) {
            if (bucket < upperBounds[i]) {
                return ordered.get(i);
            }
        }
        return ordered.get(ordered.size() - 1);
    }

    private static int[] bucketBounds(List<Variant> variants) {
        double total = 0.0d;
        for (Variant variant : variants) {
            total += variant.trafficShare();
        }
        int[] bounds = new int[variants.size()];
        double cumulative = 0.0d;
        for (int i = 0; i < variants.size(); i++) {
            cumulative += variants.get(i).trafficShare();
            bounds[i] = (int) Math.round(cumulative / total * BUCKETS);
        }
        bounds[bounds.length - 1] = BUCKETS;
        return bounds;
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
