package com.perfhub.ticketsync.model.jira;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable status-bucket definition for one tracker project prefix.
 *
 * <p>Status literals keep their configured casing for display; matching is
 * case-insensitive.</p>
 */
public final class BucketConfig {

    private static final String UNCONFIGURED_NAME = "<unconfigured>";
    private static final BucketConfig UNCONFIGURED = new BucketConfig(UNCONFIGURED_NAME, Map.of(), Set.of());

    private final String name;
    private final Map<StatusBucket, Set<String>> bucketStatuses;
    private final Set<String> closedStatuses;

    // lowercase views used for matching
    private final Map<StatusBucket, Set<String>> bucketKeys;
    private final Set<String> closedKeys;
    private final Set<String> mappedKeys;

    public BucketConfig(String name, Map<StatusBucket, ? extends Collection<String>> bucketStatuses,
                        Collection<String> closedStatuses) {
        this.name = name;

        Map<StatusBucket, Set<String>> statuses = new EnumMap<>(StatusBucket.class);
        Map<StatusBucket, Set<String>> keys = new EnumMap<>(StatusBucket.class);
        Set<String> mapped = new LinkedHashSet<>();
        for (StatusBucket bucket : StatusBucket.values()) {
            Collection<String> configured = bucketStatuses.get(bucket);
            Set<String> literals = copyOf(configured);
            Set<String> lowered = lowerAll(literals);
            statuses.put(bucket, literals);
            keys.put(bucket, lowered);
            mapped.addAll(lowered);
        }
        this.bucketStatuses = Collections.unmodifiableMap(statuses);
        this.bucketKeys = Collections.unmodifiableMap(keys);

        this.closedStatuses = copyOf(closedStatuses);
        this.closedKeys = lowerAll(this.closedStatuses);
        mapped.addAll(closedKeys);
        this.mappedKeys = Collections.unmodifiableSet(mapped);
    }

    /**
     * The permissive default used when no active configuration matches a ticket prefix:
     * every bucket and the closed set are empty, so such tickets never reach a closure
     * timestamp and are skipped instead of failing the sync.
     */
    public static BucketConfig unconfigured() {
        return UNCONFIGURED;
    }

    public boolean isUnconfiguredDefault() {
        return this == UNCONFIGURED;
    }

    public String getName() { return name; }

    public Set<String> statusesFor(StatusBucket bucket) {
        return bucketStatuses.get(bucket);
    }

    public Set<String> getClosedStatuses() { return closedStatuses; }

    public boolean matches(StatusBucket bucket, String status) {
        return status != null && bucketKeys.get(bucket).contains(normalize(status));
    }

    public boolean isClosedStatus(String status) {
        return status != null && closedKeys.contains(normalize(status));
    }

    /** True when the status appears in any bucket or in the closed set. */
    public boolean isMapped(String status) {
        return status != null && mappedKeys.contains(normalize(status));
    }

    public static String normalize(String status) {
        return status.toLowerCase(Locale.ROOT);
    }

    private static Set<String> copyOf(Collection<String> values) {
        if (values == null || values.isEmpty()) return Set.of();
        Set<String> copy = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                copy.add(value.trim());
            }
        }
        return Collections.unmodifiableSet(copy);
    }

    private static Set<String> lowerAll(Set<String> values) {
        Set<String> lowered = new LinkedHashSet<>();
        for (String value : values) {
            lowered.add(normalize(value));
        }
        return Collections.unmodifiableSet(lowered);
    }

    @Override
    public String toString() {
        return "BucketConfig{" + name + "}";
    }
}
