package com.perfhub.ticketsync.model.jira;

import java.util.List;

/**
 * A changelog history entry as Jira reports it. The timestamp is kept as the raw
 * string so a malformed value fails the ticket's extraction, not the whole batch.
 */
public record ChangelogEntry(String created, List<ChangelogItem> items) {

    public ChangelogEntry {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
