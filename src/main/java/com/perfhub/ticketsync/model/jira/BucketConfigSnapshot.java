package com.perfhub.ticketsync.model.jira;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The set of active bucket configurations captured once at the start of a sync run.
 * Read-only, so it can be shared by concurrent extraction.
 *
 * <p>When several configuration names prefix the same ticket identifier, the longest
 * name wins; equal lengths fall back to name order.</p>
 */
public final class BucketConfigSnapshot {

    private static final Comparator<BucketConfig> LONGEST_PREFIX_FIRST =
            Comparator.comparingInt((BucketConfig c) -> c.getName().length()).reversed()
                    .thenComparing(BucketConfig::getName);

    private final List<BucketConfig> configs;

    public BucketConfigSnapshot(List<BucketConfig> configs) {
        List<BucketConfig> sorted = new ArrayList<>();
        for (BucketConfig config : configs) {
            if (config.getName() != null && !config.getName().isEmpty()) {
                sorted.add(config);
            }
        }
        sorted.sort(LONGEST_PREFIX_FIRST);
        this.configs = List.copyOf(sorted);
    }

    public static BucketConfigSnapshot empty() {
        return new BucketConfigSnapshot(List.of());
    }

    /**
     * The configuration whose name is a prefix of the ticket identifier, if any.
     */
    public Optional<BucketConfig> configFor(String ticketId) {
        if (ticketId == null) return Optional.empty();
        for (BucketConfig config : configs) {
            if (ticketId.startsWith(config.getName())) {
                return Optional.of(config);
            }
        }
        return Optional.empty();
    }

    /**
     * Like {@link #configFor(String)} but falls back to {@link BucketConfig#unconfigured()}.
     */
    public BucketConfig resolve(String ticketId) {
        return configFor(ticketId).orElse(BucketConfig.unconfigured());
    }

    public int size() {
        return configs.size();
    }
}
