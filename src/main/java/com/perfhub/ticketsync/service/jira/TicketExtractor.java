package com.perfhub.ticketsync.service.jira;

import com.perfhub.ticketsync.config.JiraSyncConfig;
import com.perfhub.ticketsync.model.jira.BucketConfig;
import com.perfhub.ticketsync.model.jira.BucketConfigSnapshot;
import com.perfhub.ticketsync.model.jira.ExtractedTicket;
import com.perfhub.ticketsync.model.jira.ExtractionResult;
import com.perfhub.ticketsync.model.jira.RawIssue;
import com.perfhub.ticketsync.model.jira.StatusInterval;
import com.perfhub.ticketsync.model.jira.StatusTimeSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Turns one fetched issue into an {@link ExtractionResult}: configuration lookup,
 * interval reconstruction, aggregation and the closed-ticket rule. Never throws.
 */
@Component
public class TicketExtractor {

    private static final Logger log = LoggerFactory.getLogger(TicketExtractor.class);

    static final String UNKNOWN = "Unknown";

    private final ChangelogIntervalReconstructor reconstructor;
    private final TimeInStatusAggregator aggregator;
    private final JiraSyncConfig config;

    public TicketExtractor(ChangelogIntervalReconstructor reconstructor, TimeInStatusAggregator aggregator,
                           JiraSyncConfig config) {
        this.reconstructor = reconstructor;
        this.aggregator = aggregator;
        this.config = config;
    }

    public ExtractionResult extract(RawIssue issue, BucketConfigSnapshot snapshot, String serverUrl, Instant now) {
        String key = issue.key() != null ? issue.key() : issue.id();
        try {
            if (issue.key() == null || issue.key().isBlank()) {
                throw new IllegalArgumentException("issue " + issue.id() + " has no key");
            }

            Optional<BucketConfig> match = snapshot.configFor(key);
            BucketConfig buckets = match.orElseGet(BucketConfig::unconfigured);
            if (match.isEmpty()) {
                log.warn("No configuration found for ticket {}, using default empty mappings", key);
            } else {
                log.debug("Found configuration for ticket {}: {}", key, buckets.getName());
            }

            List<StatusInterval> intervals = reconstructor.reconstruct(issue.changelog(), now);
            StatusTimeSummary summary = aggregator.aggregate(intervals, buckets);

            if (!summary.isClosed()) {
                log.debug("Skipping ticket {} - never entered a closed status", key);
                return ExtractionResult.notClosed(key, buckets.isUnconfiguredDefault());
            }

            if (!summary.unmappedStatuses().isEmpty()) {
                log.info("Ticket {} has unmapped statuses: {}", key, String.join(", ", summary.unmappedStatuses()));
            }
            log.debug("Ticket {} status times {} closed at {}", key, summary.secondsByBucket(), summary.closedAt());

            ExtractedTicket ticket = new ExtractedTicket(
                    key,
                    config.buildBrowseUrl(serverUrl, key),
                    issue.summary(),
                    orUnknown(issue.priority()),
                    orUnknown(issue.status()),
                    JiraTimestamps.parseOptionalInstant(issue.created()),
                    summary.closedAt(),
                    issue.originalEstimateSeconds(),
                    issue.components(),
                    JiraTimestamps.parseOptionalDate(issue.dueDate()),
                    issue.assignee(),
                    issue.reporter(),
                    summary.secondsByBucket(),
                    summary.unmappedStatuses());
            return ExtractionResult.extracted(ticket, buckets.isUnconfiguredDefault());

        } catch (RuntimeException e) {
            log.warn("Failed to extract ticket {}: {}", key, e.getMessage());
            return ExtractionResult.failed(key, describe(e));
        }
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
