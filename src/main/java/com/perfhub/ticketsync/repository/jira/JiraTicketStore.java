package com.perfhub.ticketsync.repository.jira;

import com.perfhub.ticketsync.model.jira.ExtractedTicket;
import com.perfhub.ticketsync.model.jira.JiraTicketRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Ticket store keyed by the Jira issue key. Every upsert replaces all synced columns
 * in one transaction, so a ticket row is never half-updated.
 */
@Repository
public class JiraTicketStore {

    private static final Logger logger = LoggerFactory.getLogger(JiraTicketStore.class);

    private final JiraTicketRepository repository;
    private final Clock clock;

    public JiraTicketStore(JiraTicketRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Create the row for {@code ticket.jiraId()} or replace the existing one.
     *
     * @return the stored row
     */
    @Transactional
    public JiraTicketRecord upsert(ExtractedTicket ticket) {
        Instant now = clock.instant();
        Optional<JiraTicketRecord> existing = repository.findByJiraId(ticket.jiraId());

        JiraTicketRecord record = existing.orElseGet(JiraTicketRecord::new);
        record.applyFrom(ticket);
        if (existing.isEmpty()) {
            record.setCreatedAt(now);
        }
        record.setUpdatedAt(now);

        JiraTicketRecord saved = repository.saveAndFlush(record);
        logger.debug("{} ticket {}", existing.isPresent() ? "Updated" : "Created", ticket.jiraId());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<JiraTicketRecord> findByJiraId(String jiraId) {
        return repository.findByJiraId(jiraId);
    }

    /**
     * Page through stored tickets, newest rows first.
     *
     * @param page  1-based page number
     * @param limit page size
     */
    @Transactional(readOnly = true)
    public Page<JiraTicketRecord> findPage(JiraTicketFilter filter, int page, int limit) {
        PageRequest request = PageRequest.of(Math.max(0, page - 1), Math.max(1, limit),
                Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by("id").descending()));
        return repository.findAll(filter.toSpecification(), request);
    }

    /**
     * @return the deleted row, or empty when no ticket has that key
     */
    @Transactional
    public Optional<JiraTicketRecord> delete(String jiraId) {
        Optional<JiraTicketRecord> existing = repository.findByJiraId(jiraId);
        existing.ifPresent(repository::delete);
        return existing;
    }

    @Transactional
    public long deleteAll() {
        long count = repository.count();
        repository.deleteAllInBatch();
        logger.info("Deleted all {} stored Jira tickets", count);
        return count;
    }
}
