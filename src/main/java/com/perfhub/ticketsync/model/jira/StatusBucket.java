package com.perfhub.ticketsync.model.jira;

/**
 * Named categories of workflow statuses whose cumulative time is tracked per ticket.
 * The "closed" set is not a bucket: it only decides the closure timestamp.
 */
public enum StatusBucket {
    IN_PROGRESS,
    BLOCKED,
    REVIEW,
    PROMOTION,
    REFINEMENT,
    READY_FOR_DEVELOPMENT
}
