package com.perfhub.ticketsync.model.jira;

import java.util.List;

/**
 * Issues returned by the bulk detail phase plus the batches that failed.
 */
public record DetailFetchResult(List<RawIssue> issues, List<BatchFailure> failedBatches) {

    public DetailFetchResult {
        issues = List.copyOf(issues);
        failedBatches = List.copyOf(failedBatches);
    }
}
