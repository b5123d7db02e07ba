package com.perfhub.ticketsync.repository.jira;

import com.perfhub.ticketsync.model.jira.ExtractedTicket;
import com.perfhub.ticketsync.model.jira.JiraTicketRecord;
import com.perfhub.ticketsync.model.jira.StatusBucket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.Page;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "spring.datasource.tickets.url=jdbc:h2:mem:ticketsync;DB_CLOSE_DELAY=-1",
    "spring.datasource.tickets.driver-class-name=org.h2.Driver",
    "spring.jpa.hibernate.ddl-auto=create-drop"
})
@ActiveProfiles("test")
class JiraTicketStoreTest {

    @Autowired private JiraTicketStore store;
    @Autowired private JiraTicketRepository repository;

    @BeforeEach
    void cleanUp() {
        store.deleteAll();
    }

    @Test
    void upsertIsIdempotentPerJiraKey() {
        store.upsert(ticket("PROJ-1", "First title", "Dana", 3600L));
        JiraTicketRecord created = store.findByJiraId("PROJ-1").orElseThrow();

        store.upsert(ticket("PROJ-1", "Renamed", "Lee", 7200L));

        assertThat(repository.count()).isEqualTo(1);
        JiraTicketRecord updated = store.findByJiraId("PROJ-1").orElseThrow();
        assertThat(updated.getId()).isEqualTo(created.getId());
        assertThat(updated.getTitle()).isEqualTo("Renamed");
        assertThat(updated.getAssignee()).isEqualTo("Lee");
        assertThat(updated.getInProgressTime()).isEqualTo(7200L);
        assertThat(updated.getCreatedAt()).isEqualTo(created.getCreatedAt());
        assertThat(updated.getUpdatedAt()).isAfterOrEqualTo(created.getUpdatedAt());
    }

    @Test
    void storesEveryColumn() {
        store.upsert(ticket("PROJ-2", "Columns", "Dana", 60L));

        JiraTicketRecord record = store.findByJiraId("PROJ-2").orElseThrow();
        assertThat(record.getLink()).isEqualTo("https://acme.atlassian.net/browse/PROJ-2");
        assertThat(record.getPriority()).isEqualTo("High");
        assertThat(record.getEndDate()).isEqualTo(Instant.parse("2024-03-05T12:00:00Z"));
        assertThat(record.getDueDate()).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(record.getComponents()).containsExactly("Backend", "API");
        assertThat(record.getBlockedTime()).isEqualTo(120L);
        assertThat(record.getReviewTime()).isZero();
        assertThat(record.getUnmappedStatuses()).containsExactly("Triage");
    }

    @Test
    void pagesNewestFirstWithFilters() {
        store.upsert(ticket("PROJ-1", "a", "Dana Smith", 1L));
        store.upsert(ticket("PROJ-2", "b", "Lee Jones", 1L));
        store.upsert(ticket("PROJ-3", "c", "dana smith", 1L));

        Page<JiraTicketRecord> all = store.findPage(JiraTicketFilter.none(), 1, 2);
        assertThat(all.getTotalElements()).isEqualTo(3);
        assertThat(all.getTotalPages()).isEqualTo(2);
        assertThat(all.getContent()).extracting(JiraTicketRecord::getJiraId).containsExactly("PROJ-3", "PROJ-2");

        Page<JiraTicketRecord> dana = store.findPage(
                new JiraTicketFilter("DANA", null, "High", null, null), 1, 50);
        assertThat(dana.getContent()).extracting(JiraTicketRecord::getJiraId).containsExactly("PROJ-3", "PROJ-1");

        Page<JiraTicketRecord> none = store.findPage(
                new JiraTicketFilter(null, null, null, Instant.parse("2030-01-01T00:00:00Z"), null), 1, 50);
        assertThat(none.getContent()).isEmpty();
    }

    @Test
    void deletesSingleAndAll() {
        store.upsert(ticket("PROJ-1", "a", "Dana", 1L));
        store.upsert(ticket("PROJ-2", "b", "Dana", 1L));

        assertThat(store.delete("PROJ-1")).isPresent();
        assertThat(store.delete("PROJ-1")).isEmpty();
        assertThat(store.deleteAll()).isEqualTo(1);
        assertThat(repository.count()).isZero();
    }

    private static ExtractedTicket ticket(String key, String title, String assignee, long inProgress) {
        return new ExtractedTicket(key, "https://acme.atlassian.net/browse/" + key, title, "High", "Done",
                Instant.parse("2024-03-01T08:00:00Z"), Instant.parse("2024-03-05T12:00:00Z"), 28800L,
                List.of("Backend", "API"), LocalDate.of(2024, 3, 15), assignee, "Reporter",
                Map.of(StatusBucket.IN_PROGRESS, inProgress, StatusBucket.BLOCKED, 120L),
                List.of("Triage"));
    }
}
