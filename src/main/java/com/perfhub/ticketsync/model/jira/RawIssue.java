package com.perfhub.ticketsync.model.jira;

import java.util.List;

/**
 * Issue payload returned by the bulk fetch, reduced to the fields the sync engine reads.
 * Exists only for the duration of one sync run.
 */
public record RawIssue(
        String id,
        String key,
        String summary,
        String priority,
        String status,
        String created,
        String resolutionDate,
        String dueDate,
        Long originalEstimateSeconds,
        List<String> components,
        String assignee,
        String reporter,
        List<ChangelogEntry> changelog) {

    public RawIssue {
        components = components == null ? List.of() : List.copyOf(components);
        changelog = changelog == null ? List.of() : List.copyOf(changelog);
    }
}
