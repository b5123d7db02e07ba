package com.perfhub.ticketsync.service.jira;

import com.perfhub.ticketsync.config.JiraSyncConfig;
import com.perfhub.ticketsync.model.jira.BucketConfigSnapshot;
import com.perfhub.ticketsync.model.jira.DetailFetchResult;
import com.perfhub.ticketsync.model.jira.ExtractedTicket;
import com.perfhub.ticketsync.model.jira.ExtractionResult;
import com.perfhub.ticketsync.model.jira.JiraConfiguration;
import com.perfhub.ticketsync.model.jira.JiraCredentials;
import com.perfhub.ticketsync.model.jira.RawIssue;
import com.perfhub.ticketsync.model.jira.SyncError;
import com.perfhub.ticketsync.model.jira.SyncPhase;
import com.perfhub.ticketsync.model.jira.SyncSummary;
import com.perfhub.ticketsync.repository.jira.JiraTicketStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Drives a full ticket sync: collect ids, fetch details, extract each ticket against one
 * configuration snapshot, then upsert every closed ticket.
 *
 * <p>Only setup problems (bad credentials, unreachable tracker during id collection) throw.
 * Failed batches, per-ticket extraction errors and per-ticket persistence errors are recorded
 * in the returned {@link SyncSummary} and the run carries on.</p>
 */
@Service
public class TicketSyncService {

    private static final Logger log = LoggerFactory.getLogger(TicketSyncService.class);

    private final JiraIssueFetcher fetcher;
    private final StatusBucketRegistry registry;
    private final TicketExtractor extractor;
    private final JiraTicketStore store;
    private final JiraSyncConfig config;
    private final Clock clock;

    public TicketSyncService(JiraIssueFetcher fetcher, StatusBucketRegistry registry, TicketExtractor extractor,
                             JiraTicketStore store, JiraSyncConfig config, Clock clock) {
        this.fetcher = fetcher;
        this.registry = registry;
        this.extractor = extractor;
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    public SyncSummary syncTickets(String jql, JiraCredentials credentials) {
        return syncTickets(jql, credentials, () -> false);
    }

    /**
     * Run a sync that stops early once {@code cancellation} reports true or the configured
     * maximum duration elapses. Work already persisted stays persisted; the summary is
     * flagged as cancelled.
     *
     * @throws IllegalArgumentException when the query is blank
     * @throws JiraApiException         when identifier collection fails
     */
    public SyncSummary syncTickets(String jql, JiraCredentials credentials, BooleanSupplier cancellation) {
        if (jql == null || jql.isBlank()) {
            throw new IllegalArgumentException("JQL query is required");
        }

        SyncSummary summary = new SyncSummary();
        Instant startedAt = clock.instant();
        summary.setStartedAt(startedAt);
        BooleanSupplier stop = stopCondition(startedAt, cancellation);

        log.info("Starting Jira ticket sync against {} as {}", credentials.getServerUrl(), credentials.getUsername());
        log.debug("JQL: {}", jql);

        // configuration is read once; every ticket in this run resolves against the same snapshot
        BucketConfigSnapshot snapshot = registry.loadSnapshot();

        enterPhase(summary, SyncPhase.COLLECTING_IDS);
        List<String> ids = fetcher.collectIssueIds(jql, credentials);
        summary.setIdsCollected(ids.size());

        if (stopIfRequested(summary, stop)) return finish(summary);
        enterPhase(summary, SyncPhase.FETCHING_DETAILS);
        DetailFetchResult details = fetcher.fetchDetails(ids, credentials, stop);
        summary.setIssuesFetched(details.issues().size());
        summary.addFailedBatches(details.failedBatches());

        if (stopIfRequested(summary, stop)) return finish(summary);
        enterPhase(summary, SyncPhase.EXTRACTING);
        Instant now = clock.instant();
        List<ExtractedTicket> extracted = new ArrayList<>();
        for (RawIssue issue : details.issues()) {
            ExtractionResult result = extractor.extract(issue, snapshot, credentials.getServerUrl(), now);
            if (result.isUnconfigured()) {
                summary.incrementUnconfiguredTickets();
            }
            switch (result.getOutcome()) {
                case EXTRACTED -> {
                    extracted.add(result.getTicket());
                    summary.incrementTicketsExtracted();
                }
                case NOT_CLOSED -> summary.incrementTicketsSkippedNotClosed();
                case FAILED -> summary.addError(SyncError.extraction(result.getIssueKey(), result.getReason()));
            }
        }
        log.info("Extracted {} closed ticket(s) from {} issue(s); {} not closed, {} failed",
                summary.getTicketsExtracted(), details.issues().size(),
                summary.getTicketsSkippedNotClosed(), summary.getErrors().size());

        enterPhase(summary, SyncPhase.PERSISTING);
        for (ExtractedTicket ticket : extracted) {
            if (stopIfRequested(summary, stop)) return finish(summary);
            try {
                store.upsert(ticket);
                summary.incrementTicketsPersisted();
            } catch (RuntimeException e) {
                log.error("Error storing ticket {} in database: {}", ticket.jiraId(), e.getMessage());
                summary.addError(SyncError.persistence(ticket.jiraId(),
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            }
        }

        enterPhase(summary, SyncPhase.DONE);
        return finish(summary);
    }

    /**
     * Sync using the server, user, token and JQL stored on an active configuration record.
     *
     * @throws IllegalArgumentException when no active configuration has that name
     */
    public SyncSummary syncConfiguration(String configurationName) {
        JiraConfiguration configuration = registry.findActiveConfiguration(configurationName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "No active Jira configuration named " + configurationName));
        JiraCredentials credentials = JiraCredentials.of(configuration.getServerUrl(), configuration.getUsername(),
                null, configuration.getApiToken());
        return syncTickets(configuration.getJql(), credentials);
    }

    private BooleanSupplier stopCondition(Instant startedAt, BooleanSupplier cancellation) {
        Duration maxDuration = config.getMaxSyncDuration();
        if (maxDuration == null) {
            return cancellation;
        }
        Instant deadline = startedAt.plus(maxDuration);
        return () -> cancellation.getAsBoolean() || clock.instant().isAfter(deadline);
    }

    // an interrupted thread counts as a cancellation
    private boolean stopIfRequested(SyncSummary summary, BooleanSupplier stop) {
        if (!summary.isCancelled() && (Thread.currentThread().isInterrupted() || stop.getAsBoolean())) {
            log.warn("Sync cancelled during phase {}", summary.getPhase());
            summary.setCancelled(true);
        }
        return summary.isCancelled();
    }

    private void enterPhase(SyncSummary summary, SyncPhase phase) {
        log.info("Sync phase {} -> {}", summary.getPhase(), phase);
        summary.setPhase(phase);
    }

    private SyncSummary finish(SyncSummary summary) {
        summary.setFinishedAt(clock.instant());
        log.info("Jira ticket sync finished: {}", summary);
        return summary;
    }
}
