package com.perfhub.ticketsync.model.jira;

/**
 * One field change inside a changelog history entry.
 */
public record ChangelogItem(String field, String fromValue, String toValue) {

    public static final String STATUS_FIELD = "status";

    public boolean isStatusChange() {
        return STATUS_FIELD.equals(field);
    }
}
