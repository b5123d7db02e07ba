package com.perfhub.ticketsync.model.jira;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A row of jira_configurations. Managed by the admin screens; the sync engine only reads it.
 * {@code name} is the ticket-key prefix the configuration applies to (e.g. "PROJ").
 */
@Entity
@Table(name = "jira_configurations")
public class JiraConfiguration {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "server_url")
    private String serverUrl;

    private String username;

    @Column(name = "api_token")
    private String apiToken;

    @Column(length = 4000)
    private String jql;

    @Convert(converter = StatusListConverter.class)
    @Column(name = "in_progress_statuses", length = 4000)
    private List<String> inProgressStatuses = new ArrayList<>();

    @Convert(converter = StatusListConverter.class)
    @Column(name = "blocked_statuses", length = 4000)
    private List<String> blockedStatuses = new ArrayList<>();

    @Convert(converter = StatusListConverter.class)
    @Column(name = "review_statuses", length = 4000)
    private List<String> reviewStatuses = new ArrayList<>();

    @Convert(converter = StatusListConverter.class)
    @Column(name = "promotion_statuses", length = 4000)
    private List<String> promotionStatuses = new ArrayList<>();

    @Convert(converter = StatusListConverter.class)
    @Column(name = "refinement_statuses", length = 4000)
    private List<String> refinementStatuses = new ArrayList<>();

    @Convert(converter = StatusListConverter.class)
    @Column(name = "ready_for_development_statuses", length = 4000)
    private List<String> readyForDevelopmentStatuses = new ArrayList<>();

    @Convert(converter = StatusListConverter.class)
    @Column(name = "ticket_closes_statuses", length = 4000)
    private List<String> ticketClosesStatuses = new ArrayList<>();

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public JiraConfiguration() {}

    public JiraConfiguration(String name) {
        this.name = name;
    }

    /**
     * Immutable bucket view used during a sync run.
     */
    public BucketConfig toBucketConfig() {
        Map<StatusBucket, List<String>> buckets = new EnumMap<>(StatusBucket.class);
        buckets.put(StatusBucket.IN_PROGRESS, inProgressStatuses);
        buckets.put(StatusBucket.BLOCKED, blockedStatuses);
        buckets.put(StatusBucket.REVIEW, reviewStatuses);
        buckets.put(StatusBucket.PROMOTION, promotionStatuses);
        buckets.put(StatusBucket.REFINEMENT, refinementStatuses);
        buckets.put(StatusBucket.READY_FOR_DEVELOPMENT, readyForDevelopmentStatuses);
        return new BucketConfig(name, buckets, ticketClosesStatuses);
    }

    // Getters and Setters

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getServerUrl() { return serverUrl; }
    public void setServerUrl(String serverUrl) { this.serverUrl = serverUrl; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getApiToken() { return apiToken; }
    public void setApiToken(String apiToken) { this.apiToken = apiToken; }

    public String getJql() { return jql; }
    public void setJql(String jql) { this.jql = jql; }

    public List<String> getInProgressStatuses() { return inProgressStatuses; }
    public void setInProgressStatuses(List<String> inProgressStatuses) { this.inProgressStatuses = inProgressStatuses; }

    public List<String> getBlockedStatuses() { return blockedStatuses; }
    public void setBlockedStatuses(List<String> blockedStatuses) { this.blockedStatuses = blockedStatuses; }

    public List<String> getReviewStatuses() { return reviewStatuses; }
    public void setReviewStatuses(List<String> reviewStatuses) { this.reviewStatuses = reviewStatuses; }

    public List<String> getPromotionStatuses() { return promotionStatuses; }
    public void setPromotionStatuses(List<String> promotionStatuses) { this.promotionStatuses = promotionStatuses; }

    public List<String> getRefinementStatuses() { return refinementStatuses; }
    public void setRefinementStatuses(List<String> refinementStatuses) { this.refinementStatuses = refinementStatuses; }

    public List<String> getReadyForDevelopmentStatuses() { return readyForDevelopmentStatuses; }
    public void setReadyForDevelopmentStatuses(List<String> readyForDevelopmentStatuses) {
        this.readyForDevelopmentStatuses = readyForDevelopmentStatuses;
    }

    public List<String> getTicketClosesStatuses() { return ticketClosesStatuses; }
    public void setTicketClosesStatuses(List<String> ticketClosesStatuses) { this.ticketClosesStatuses = ticketClosesStatuses; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
