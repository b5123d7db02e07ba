package com.perfhub.ticketsync.model.jira;

public enum SyncPhase {
    IDLE,
    COLLECTING_IDS,
    FETCHING_DETAILS,
    EXTRACTING,
    PERSISTING,
    DONE
}
