package com.perfhub.ticketsync.model.jira;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated view of one closed ticket, ready to be upserted by its Jira key.
 */
public record ExtractedTicket(
        String jiraId,
        String link,
        String title,
        String priority,
        String status,
        Instant createDate,
        Instant endDate,
        Long originalEstimate,
        List<String> components,
        LocalDate dueDate,
        String assignee,
        String reporter,
        Map<StatusBucket, Long> secondsByBucket,
        List<String> unmappedStatuses) {

    public ExtractedTicket {
        Objects.requireNonNull(jiraId, "jiraId");
        Objects.requireNonNull(endDate, "endDate");
        components = components == null ? List.of() : List.copyOf(components);
        unmappedStatuses = unmappedStatuses == null ? List.of() : List.copyOf(unmappedStatuses);
        Map<StatusBucket, Long> copy = new EnumMap<>(StatusBucket.class);
        for (StatusBucket bucket : StatusBucket.values()) {
            copy.put(bucket, secondsByBucket == null ? 0L : secondsByBucket.getOrDefault(bucket, 0L));
        }
        secondsByBucket = Collections.unmodifiableMap(copy);
    }

    public long seconds(StatusBucket bucket) {
        return secondsByBucket.get(bucket);
    }
}
