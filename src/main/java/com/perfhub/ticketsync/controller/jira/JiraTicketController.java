package com.perfhub.ticketsync.controller.jira;

import com.fasterxml.jackson.databind.JsonNode;
import com.perfhub.ticketsync.model.jira.JiraCredentials;
import com.perfhub.ticketsync.model.jira.JiraTicketRecord;
import com.perfhub.ticketsync.model.jira.SyncRequest;
import com.perfhub.ticketsync.model.jira.SyncSummary;
import com.perfhub.ticketsync.repository.jira.JiraTicketFilter;
import com.perfhub.ticketsync.repository.jira.JiraTicketStore;
import com.perfhub.ticketsync.service.jira.JiraApiException;
import com.perfhub.ticketsync.service.jira.JiraIssueFetcher;
import com.perfhub.ticketsync.service.jira.TicketSyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/jira-tickets")
public class JiraTicketController {

    private static final Logger log = LoggerFactory.getLogger(JiraTicketController.class);

    private final TicketSyncService syncService;
    private final JiraIssueFetcher fetcher;
    private final JiraTicketStore store;

    public JiraTicketController(TicketSyncService syncService, JiraIssueFetcher fetcher, JiraTicketStore store) {
        this.syncService = syncService;
        this.fetcher = fetcher;
        this.store = store;
    }

    /**
     * GET /api/jira-tickets/test-connection?server=...&username=...&apiToken=...
     */
    @GetMapping("/test-connection")
    public ResponseEntity<Map<String, Object>> testConnection(
            @RequestParam(required = false) String server,
            @RequestParam(required = false) String username,
            @RequestParam(required = false) String password,
            @RequestParam(required = false) String apiToken) {
        JiraCredentials credentials;
        try {
            credentials = JiraCredentials.of(server, username, password, apiToken);
        } catch (IllegalArgumentException e) {
            return failure(HttpStatus.BAD_REQUEST, e.getMessage(), null);
        }

        try {
            JsonNode user = fetcher.testConnection(credentials);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("user", user);
            data.put("server", credentials.getServerUrl());
            data.put("authenticated", true);
            return success("Jira connection successful", data);
        } catch (JiraApiException e) {
            log.error("Jira connection test failed: {}", e.getMessage());
            HttpStatus status = e.getStatusCode() > 0
                    ? Optional.ofNullable(HttpStatus.resolve(e.getStatusCode())).orElse(HttpStatus.BAD_GATEWAY)
                    : HttpStatus.INTERNAL_SERVER_ERROR;
            return failure(status, e.getMessage(), e.getCause() != null ? e.getCause().getMessage() : null);
        } catch (RuntimeException e) {
            return serverError("Failed to test Jira connection", e);
        }
    }

    /**
     * POST /api/jira-tickets/extract
     * Body: { jql, server, username, password?, apiToken? }
     */
    @PostMapping("/extract")
    public ResponseEntity<Map<String, Object>> extract(@RequestBody SyncRequest request) {
        log.info("POST /api/jira-tickets/extract {}", request);
        if (request.getJql() == null || request.getJql().isBlank()) {
            return failure(HttpStatus.BAD_REQUEST, "Validation failed", "JQL query is required");
        }
        try {
            SyncSummary summary = syncService.syncTickets(request.getJql(), request.toCredentials());
            return success("Jira tickets extracted and stored successfully", summaryData(summary));
        } catch (IllegalArgumentException e) {
            return failure(HttpStatus.BAD_REQUEST, "Validation failed", e.getMessage());
        } catch (JiraApiException e) {
            log.error("Error in Jira ticket extraction: {}", e.getMessage());
            return failure(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to extract Jira tickets", e.getMessage());
        } catch (RuntimeException e) {
            return serverError("Failed to extract Jira tickets", e);
        }
    }

    /**
     * POST /api/jira-tickets/sync/{configurationName}
     * Runs the sync with the server, credentials and JQL stored on that configuration.
     */
    @PostMapping("/sync/{configurationName}")
    public ResponseEntity<Map<String, Object>> syncConfiguration(@PathVariable String configurationName) {
        log.info("POST /api/jira-tickets/sync/{}", configurationName);
        try {
            SyncSummary summary = syncService.syncConfiguration(configurationName);
            return success("Jira tickets extracted and stored successfully", summaryData(summary));
        } catch (IllegalArgumentException e) {
            return failure(HttpStatus.BAD_REQUEST, "Validation failed", e.getMessage());
        } catch (JiraApiException e) {
            log.error("Error syncing configuration {}: {}", configurationName, e.getMessage());
            return failure(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to extract Jira tickets", e.getMessage());
        } catch (RuntimeException e) {
            return serverError("Failed to extract Jira tickets", e);
        }
    }

    /**
     * GET /api/jira-tickets?page=1&limit=50&assignee=&reporter=&priority=&startDate=&endDate=
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> list(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) String assignee,
            @RequestParam(required = false) String reporter,
            @RequestParam(required = false) String priority,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate) {
        JiraTicketFilter filter;
        try {
            filter = new JiraTicketFilter(assignee, reporter, priority,
                    parseDateParam(startDate, false), parseDateParam(endDate, true));
        } catch (DateTimeParseException e) {
            return failure(HttpStatus.BAD_REQUEST, "Invalid date filter", e.getParsedString());
        }

        Page<JiraTicketRecord> result;
        try {
            result = store.findPage(filter, page, limit);
        } catch (RuntimeException e) {
            return serverError("Failed to fetch Jira tickets", e);
        }

        Map<String, Object> pagination = new LinkedHashMap<>();
        pagination.put("page", Math.max(1, page));
        pagination.put("limit", Math.max(1, limit));
        pagination.put("total", result.getTotalElements());
        pagination.put("totalPages", result.getTotalPages());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tickets", result.getContent());
        data.put("pagination", pagination);
        return success(null, data);
    }

    /**
     * GET /api/jira-tickets/{jiraId}
     */
    @GetMapping("/{jiraId}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String jiraId) {
        try {
            return store.findByJiraId(jiraId)
                    .map(ticket -> success(null, ticket))
                    .orElseGet(() -> failure(HttpStatus.NOT_FOUND, "Jira ticket not found", null));
        } catch (RuntimeException e) {
            return serverError("Failed to fetch Jira ticket", e);
        }
    }

    /**
     * DELETE /api/jira-tickets/{jiraId}
     */
    @DeleteMapping("/{jiraId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String jiraId) {
        try {
            return store.delete(jiraId)
                    .map(ticket -> {
                        log.info("Jira ticket {} deleted", jiraId);
                        return success("Jira ticket deleted successfully", ticket);
                    })
                    .orElseGet(() -> failure(HttpStatus.NOT_FOUND, "Jira ticket not found", null));
        } catch (RuntimeException e) {
            return serverError("Failed to delete Jira ticket", e);
        }
    }

    /**
     * DELETE /api/jira-tickets
     */
    @DeleteMapping
    public ResponseEntity<Map<String, Object>> deleteAll() {
        try {
            long deleted = store.deleteAll();
            return success("All Jira tickets deleted successfully", Map.of("deletedCount", deleted));
        } catch (RuntimeException e) {
            return serverError("Failed to delete Jira tickets", e);
        }
    }

    // --- helpers ---

    private Map<String, Object> summaryData(SyncSummary summary) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("totalTickets", summary.getIssuesFetched());
        data.put("extractedTickets", summary.getTicketsExtracted());
        data.put("storedTickets", summary.getTicketsPersisted());
        data.put("errors", summary.getErrors());
        data.put("summary", summary);
        return data;
    }

    /** A bare date means start of day (from) or end of day (to), in UTC. */
    private static Instant parseDateParam(String value, boolean endOfDay) {
        if (value == null || value.isBlank()) return null;
        if (value.length() == 10) {
            LocalDate date = LocalDate.parse(value);
            return endOfDay
                    ? date.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC).minusMillis(1)
                    : date.atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        return Instant.parse(value);
    }

    private static ResponseEntity<Map<String, Object>> success(String message, Object data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        if (message != null) body.put("message", message);
        body.put("data", data);
        return ResponseEntity.ok(body);
    }

    private static ResponseEntity<Map<String, Object>> serverError(String message, RuntimeException e) {
        log.error("{}: {}", message, e.getMessage(), e);
        String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, message, error);
    }

    private static ResponseEntity<Map<String, Object>> failure(HttpStatus status, String message, String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("message", message);
        if (error != null) body.put("error", error);
        return ResponseEntity.status(status).body(body);
    }
}
