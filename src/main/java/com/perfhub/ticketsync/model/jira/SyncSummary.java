package com.perfhub.ticketsync.model.jira;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one sync run. Partial failures never throw; they show up here.
 */
public class SyncSummary {

    private int idsCollected;
    private int issuesFetched;
    private int ticketsExtracted;
    private int ticketsSkippedNotClosed;
    private int ticketsPersisted;
    private int unconfiguredTickets;
    private final List<BatchFailure> failedBatches = new ArrayList<>();
    private final List<SyncError> errors = new ArrayList<>();
    private SyncPhase phase = SyncPhase.IDLE;
    private boolean cancelled;
    private Instant startedAt;
    private Instant finishedAt;

    public int getIdsCollected() { return idsCollected; }
    public void setIdsCollected(int idsCollected) { this.idsCollected = idsCollected; }

    public int getIssuesFetched() { return issuesFetched; }
    public void setIssuesFetched(int issuesFetched) { this.issuesFetched = issuesFetched; }

    public int getTicketsExtracted() { return ticketsExtracted; }
    public void incrementTicketsExtracted() { ticketsExtracted++; }

    public int getTicketsSkippedNotClosed() { return ticketsSkippedNotClosed; }
    public void incrementTicketsSkippedNotClosed() { ticketsSkippedNotClosed++; }

    public int getTicketsPersisted() { return ticketsPersisted; }
    public void incrementTicketsPersisted() { ticketsPersisted++; }

    public int getUnconfiguredTickets() { return unconfiguredTickets; }
    public void incrementUnconfiguredTickets() { unconfiguredTickets++; }

    public List<BatchFailure> getFailedBatches() { return Collections.unmodifiableList(failedBatches); }
    public void addFailedBatches(List<BatchFailure> batches) { failedBatches.addAll(batches); }

    public List<SyncError> getErrors() { return Collections.unmodifiableList(errors); }
    public void addError(SyncError error) { errors.add(error); }

    public SyncPhase getPhase() { return phase; }
    public void setPhase(SyncPhase phase) { this.phase = phase; }

    public boolean isCancelled() { return cancelled; }
    public void setCancelled(boolean cancelled) { this.cancelled = cancelled; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }

    @Override
    public String toString() {
        return String.format("ids=%d fetched=%d extracted=%d notClosed=%d persisted=%d unconfigured=%d "
                        + "failedBatches=%d errors=%d phase=%s cancelled=%s",
                idsCollected, issuesFetched, ticketsExtracted, ticketsSkippedNotClosed, ticketsPersisted,
                unconfiguredTickets, failedBatches.size(), errors.size(), phase, cancelled);
    }
}
