package com.perfhub.ticketsync.model.jira;

/**
 * Outcome of extracting one fetched issue. Skips and failures are ordinary values
 * so the orchestrator can tally them without exception-driven control flow.
 */
public final class ExtractionResult {

    public enum Outcome {
        /** Reached a closed status; ready to persist. */
        EXTRACTED,
        /** Never entered a closed status; silently excluded from the output. */
        NOT_CLOSED,
        /** Unexpected data; recorded as a per-ticket error. */
        FAILED
    }

    private final Outcome outcome;
    private final String issueKey;
    private final ExtractedTicket ticket;
    private final String reason;
    private final boolean unconfigured;

    private ExtractionResult(Outcome outcome, String issueKey, ExtractedTicket ticket,
                             String reason, boolean unconfigured) {
        this.outcome = outcome;
        this.issueKey = issueKey;
        this.ticket = ticket;
        this.reason = reason;
        this.unconfigured = unconfigured;
    }

    public static ExtractionResult extracted(ExtractedTicket ticket, boolean unconfigured) {
        return new ExtractionResult(Outcome.EXTRACTED, ticket.jiraId(), ticket, null, unconfigured);
    }

    public static ExtractionResult notClosed(String issueKey, boolean unconfigured) {
        return new ExtractionResult(Outcome.NOT_CLOSED, issueKey, null, null, unconfigured);
    }

    public static ExtractionResult failed(String issueKey, String reason) {
        return new ExtractionResult(Outcome.FAILED, issueKey, null, reason, false);
    }

    public Outcome getOutcome() { return outcome; }
    public String getIssueKey() { return issueKey; }
    public ExtractedTicket getTicket() { return ticket; }
    public String getReason() { return reason; }

    /** Whether the issue was processed with the empty fallback configuration. */
    public boolean isUnconfigured() { return unconfigured; }
}
