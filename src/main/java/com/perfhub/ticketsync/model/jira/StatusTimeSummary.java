package com.perfhub.ticketsync.model.jira;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of aggregating a ticket's intervals against its bucket configuration.
 * {@code closedAt} is null when the ticket never entered a closed status.
 */
public record StatusTimeSummary(Map<StatusBucket, Long> secondsByBucket, Instant closedAt,
                                List<String> unmappedStatuses) {

    public StatusTimeSummary {
        Map<StatusBucket, Long> copy = new EnumMap<>(StatusBucket.class);
        for (StatusBucket bucket : StatusBucket.values()) {
            copy.put(bucket, secondsByBucket.getOrDefault(bucket, 0L));
        }
        secondsByBucket = Collections.unmodifiableMap(copy);
        unmappedStatuses = List.copyOf(unmappedStatuses);
    }

    public long seconds(StatusBucket bucket) {
        return secondsByBucket.get(bucket);
    }

    public boolean isClosed() {
        return closedAt != null;
    }
}
