package com.perfhub.ticketsync.model.jira;

/**
 * A per-ticket problem recorded during a sync run.
 */
public record SyncError(String ticketId, Stage stage, String message) {

    public enum Stage {
        EXTRACTION,
        PERSISTENCE
    }

    public static SyncError extraction(String ticketId, String message) {
        return new SyncError(ticketId, Stage.EXTRACTION, message);
    }

    public static SyncError persistence(String ticketId, String message) {
        return new SyncError(ticketId, Stage.PERSISTENCE, message);
    }
}
