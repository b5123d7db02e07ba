package com.perfhub.ticketsync.repository.jira;

import com.perfhub.ticketsync.model.jira.JiraTicketRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Optional;

public interface JiraTicketRepository extends JpaRepository<JiraTicketRecord, Long>,
        JpaSpecificationExecutor<JiraTicketRecord> {

    Optional<JiraTicketRecord> findByJiraId(String jiraId);
}
