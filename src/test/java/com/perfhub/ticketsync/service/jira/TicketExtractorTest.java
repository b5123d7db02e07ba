package com.perfhub.ticketsync.service.jira;

import com.perfhub.ticketsync.config.JiraSyncConfig;
import com.perfhub.ticketsync.model.jira.BucketConfig;
import com.perfhub.ticketsync.model.jira.BucketConfigSnapshot;
import com.perfhub.ticketsync.model.jira.ChangelogEntry;
import com.perfhub.ticketsync.model.jira.ChangelogItem;
import com.perfhub.ticketsync.model.jira.ExtractedTicket;
import com.perfhub.ticketsync.model.jira.ExtractionResult;
import com.perfhub.ticketsync.model.jira.RawIssue;
import com.perfhub.ticketsync.model.jira.StatusBucket;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TicketExtractorTest {

    private static final Instant NOW = Instant.parse("2024-04-01T00:00:00Z");
    private static final String SERVER = "https://acme.atlassian.net/";

    private final JiraSyncConfig config = new JiraSyncConfig(5000, 100, 30, 1, false);
    private final TicketExtractor extractor = new TicketExtractor(
            new ChangelogIntervalReconstructor(), new TimeInStatusAggregator(config), config);

    private final BucketConfigSnapshot snapshot = new BucketConfigSnapshot(List.of(
            new BucketConfig("PROJ",
                    Map.of(StatusBucket.IN_PROGRESS, List.of("In Progress"),
                            StatusBucket.BLOCKED, List.of("Blocked")),
                    List.of("Done"))));

    private static final List<ChangelogEntry> CLOSED_HISTORY = List.of(
            status("2024-03-01T09:00:00.000+0000", "In Progress"),
            status("2024-03-01T10:00:00.000+0000", "Blocked"),
            status("2024-03-01T12:00:00.000+0000", "Done"));

    @Test
    void extractsClosedTicket() {
        RawIssue issue = new RawIssue("10001", "PROJ-1", "Fix login", "High", "Done",
                "2024-02-28T08:00:00.000+0000", "2024-03-01T12:00:00.000+0000", "2024-03-15",
                7200L, List.of("Backend"), "Dana", "Lee", CLOSED_HISTORY);

        ExtractionResult result = extractor.extract(issue, snapshot, SERVER, NOW);

        assertThat(result.getOutcome()).isEqualTo(ExtractionResult.Outcome.EXTRACTED);
        assertThat(result.isUnconfigured()).isFalse();
        ExtractedTicket ticket = result.getTicket();
        assertThat(ticket.jiraId()).isEqualTo("PROJ-1");
        assertThat(ticket.link()).isEqualTo("https://acme.atlassian.net/browse/PROJ-1");
        assertThat(ticket.endDate()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
        assertThat(ticket.createDate()).isEqualTo(Instant.parse("2024-02-28T08:00:00Z"));
        assertThat(ticket.dueDate()).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(ticket.seconds(StatusBucket.IN_PROGRESS)).isEqualTo(3600L);
        assertThat(ticket.seconds(StatusBucket.BLOCKED)).isEqualTo(7200L);
        assertThat(ticket.components()).containsExactly("Backend");
        assertThat(ticket.originalEstimate()).isEqualTo(7200L);
    }

    @Test
    void ticketThatNeverClosedIsSkipped() {
        RawIssue issue = new RawIssue("10002", "PROJ-2", "Still open", "Low", "Blocked",
                null, null, null, null, null, null, null,
                List.of(status("2024-03-01T09:00:00.000+0000", "In Progress"),
                        status("2024-03-01T10:00:00.000+0000", "Blocked")));

        ExtractionResult result = extractor.extract(issue, snapshot, SERVER, NOW);

        assertThat(result.getOutcome()).isEqualTo(ExtractionResult.Outcome.NOT_CLOSED);
        assertThat(result.getTicket()).isNull();
    }

    @Test
    void missingPriorityAndStatusDefaultToUnknown() {
        RawIssue issue = new RawIssue("10003", "PROJ-3", null, null, " ",
                null, null, null, null, null, null, null, CLOSED_HISTORY);

        ExtractedTicket ticket = extractor.extract(issue, snapshot, SERVER, NOW).getTicket();

        assertThat(ticket.priority()).isEqualTo("Unknown");
        assertThat(ticket.status()).isEqualTo("Unknown");
        assertThat(ticket.createDate()).isNull();
        assertThat(ticket.dueDate()).isNull();
        assertThat(ticket.originalEstimate()).isNull();
    }

    @Test
    void unconfiguredTicketIsFlaggedAndNotExtracted() {
        RawIssue issue = new RawIssue("10004", "OTHER-1", "Elsewhere", "High", "Done",
                null, null, null, null, null, null, null, CLOSED_HISTORY);

        ExtractionResult result = extractor.extract(issue, snapshot, SERVER, NOW);

        assertThat(result.isUnconfigured()).isTrue();
        assertThat(result.getOutcome()).isEqualTo(ExtractionResult.Outcome.NOT_CLOSED);
    }

    @Test
    void malformedChangelogTimestampFailsOnlyThatTicket() {
        RawIssue issue = new RawIssue("10005", "PROJ-5", "Bad data", "High", "Done",
                null, null, null, null, null, null, null,
                List.of(status("not-a-date", "Done")));

        ExtractionResult result = extractor.extract(issue, snapshot, SERVER, NOW);

        assertThat(result.getOutcome()).isEqualTo(ExtractionResult.Outcome.FAILED);
        assertThat(result.getIssueKey()).isEqualTo("PROJ-5");
        assertThat(result.getReason()).isNotBlank();
    }

    @Test
    void missingKeyFails() {
        RawIssue issue = new RawIssue("10006", null, "No key", null, null,
                null, null, null, null, null, null, null, CLOSED_HISTORY);

        ExtractionResult result = extractor.extract(issue, snapshot, SERVER, NOW);

        assertThat(result.getOutcome()).isEqualTo(ExtractionResult.Outcome.FAILED);
        assertThat(result.getIssueKey()).isEqualTo("10006");
    }

    private static ChangelogEntry status(String created, String to) {
        return new ChangelogEntry(created, List.of(new ChangelogItem("status", null, to)));
    }
}
