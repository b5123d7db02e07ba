package com.perfhub.ticketsync.service.jira;

import com.perfhub.ticketsync.config.JiraSyncConfig;
import com.perfhub.ticketsync.model.jira.JiraConfiguration;
import com.perfhub.ticketsync.model.jira.JiraCredentials;
import com.perfhub.ticketsync.model.jira.JiraTicketRecord;
import com.perfhub.ticketsync.model.jira.SyncSummary;
import com.perfhub.ticketsync.repository.jira.JiraConfigurationRepository;
import com.perfhub.ticketsync.repository.jira.JiraTicketFilter;
import com.perfhub.ticketsync.repository.jira.JiraTicketStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import javax.net.ssl.SSLSession;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

@SpringBootTest(properties = {
    "spring.datasource.tickets.url=jdbc:h2:mem:ticketsync;DB_CLOSE_DELAY=-1",
    "spring.datasource.tickets.driver-class-name=org.h2.Driver",
    "spring.jpa.hibernate.ddl-auto=create-drop"
})
@ActiveProfiles("test")
class TicketSyncServiceIntegrationTest {

    private static final JiraCredentials CREDENTIALS =
            JiraCredentials.of("https://acme.atlassian.net", "dev@acme.io", null, "token");

    private static final String SEARCH_PAGE = """
            {"issues": [{"id": "101"}, {"id": "102"}, {"id": "103"}], "isLast": true}
            """;

    private static final String BULK_PAGE = """
            {"issues": [
              {"id": "101", "key": "PROJ-1", "fields": {
                 "summary": "Closed ticket", "priority": {"name": "High"}, "status": {"name": "Done"},
                 "created": "2024-02-28T08:00:00.000+0000", "assignee": {"displayName": "Dana"}},
               "changelog": {"histories": [
                 {"created": "2024-03-01T09:00:00.000+0000", "items": [{"field": "status", "fromString": "Open", "toString": "In Progress"}]},
                 {"created": "2024-03-01T10:00:00.000+0000", "items": [{"field": "status", "fromString": "In Progress", "toString": "Blocked"}]},
                 {"created": "2024-03-01T12:00:00.000+0000", "items": [{"field": "status", "fromString": "Blocked", "toString": "Done"}]}
               ]}},
              {"id": "102", "key": "PROJ-2", "fields": {"summary": "Still open", "status": {"name": "Blocked"}},
               "changelog": {"histories": [
                 {"created": "2024-03-01T09:00:00.000+0000", "items": [{"field": "status", "fromString": "Open", "toString": "Blocked"}]}
               ]}},
              {"id": "103", "key": "OTHER-3", "fields": {"summary": "No configuration", "status": {"name": "Done"}},
               "changelog": {"histories": [
                 {"created": "2024-03-01T09:00:00.000+0000", "items": [{"field": "status", "fromString": "Open", "toString": "Done"}]}
               ]}}
            ]}
            """;

    @Autowired private StatusBucketRegistry registry;
    @Autowired private TicketExtractor extractor;
    @Autowired private JiraTicketStore store;
    @Autowired private JiraSyncConfig config;
    @Autowired private JiraIssueParser parser;
    @Autowired private Clock clock;
    @Autowired private JiraConfigurationRepository configurationRepository;

    private TicketSyncService service;

    @BeforeEach
    void setUp() throws Exception {
        store.deleteAll();
        configurationRepository.deleteAll();

        JiraConfiguration configuration = new JiraConfiguration("PROJ");
        configuration.setInProgressStatuses(List.of("In Progress"));
        configuration.setBlockedStatuses(List.of("Blocked"));
        configuration.setTicketClosesStatuses(List.of("Done"));
        configurationRepository.save(configuration);

        HttpClient httpClient = mock(HttpClient.class);
        doAnswer(invocation -> {
            HttpRequest request = invocation.getArgument(0);
            String body = request.uri().getPath().equals(JiraIssueFetcher.SEARCH_PATH) ? SEARCH_PAGE : BULK_PAGE;
            return new JsonResponse(request, body);
        }).when(httpClient).send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());

        JiraIssueFetcher fetcher = new JiraIssueFetcher(config, parser, httpClient);
        service = new TicketSyncService(fetcher, registry, extractor, store, config, clock);
    }

    @Test
    void persistsOnlyClosedTicketsAndRerunLeavesSameRows() {
        SyncSummary first = service.syncTickets("project in (PROJ, OTHER)", CREDENTIALS);

        assertThat(first.getIssuesFetched()).isEqualTo(3);
        assertThat(first.getTicketsExtracted()).isEqualTo(1);
        assertThat(first.getTicketsSkippedNotClosed()).isEqualTo(2);
        assertThat(first.getUnconfiguredTickets()).isEqualTo(1);
        assertThat(first.getTicketsPersisted()).isEqualTo(1);
        assertThat(first.getErrors()).isEmpty();

        List<JiraTicketRecord> afterFirst = storedTickets();
        assertThat(afterFirst).extracting(JiraTicketRecord::getJiraId).containsExactly("PROJ-1");
        JiraTicketRecord closed = afterFirst.get(0);
        assertThat(closed.getEndDate()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
        assertThat(closed.getInProgressTime()).isEqualTo(3600L);
        assertThat(closed.getBlockedTime()).isEqualTo(7200L);
        assertThat(closed.getLink()).isEqualTo("https://acme.atlassian.net/browse/PROJ-1");

        SyncSummary second = service.syncTickets("project in (PROJ, OTHER)", CREDENTIALS);

        assertThat(second.getTicketsPersisted()).isEqualTo(1);
        assertThat(storedTickets())
                .usingRecursiveFieldByFieldElementComparatorIgnoringFields("updatedAt")
                .containsExactlyElementsOf(afterFirst);
    }

    private List<JiraTicketRecord> storedTickets() {
        return store.findPage(JiraTicketFilter.none(), 1, 50).getContent();
    }

    private record JsonResponse(HttpRequest request, String body) implements HttpResponse<String> {

        @Override
        public int statusCode() {
            return 200;
        }

        @Override
        public Optional<HttpResponse<String>> previousResponse() {
            return Optional.empty();
        }

        @Override
        public HttpHeaders headers() {
            return HttpHeaders.of(Map.of(), (name, value) -> true);
        }

        @Override
        public Optional<SSLSession> sslSession() {
            return Optional.empty();
        }

        @Override
        public URI uri() {
            return request.uri();
        }

        @Override
        public HttpClient.Version version() {
            return HttpClient.Version.HTTP_1_1;
        }
    }
}
