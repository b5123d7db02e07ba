package com.perfhub.ticketsync.model.jira;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted ticket row, unique by Jira key. Durations are whole seconds.
 */
@Entity
@Table(name = "jira_tickets", uniqueConstraints = @UniqueConstraint(name = "uk_jira_tickets_jira_id", columnNames = "jira_id"))
public class JiraTicketRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "jira_id", nullable = false, length = 64)
    private String jiraId;

    @Column(length = 1024)
    private String link;

    @Column(length = 1024)
    private String title;

    private String priority;

    private String status;

    @Column(name = "create_date")
    private Instant createDate;

    @Column(name = "end_date", nullable = false)
    private Instant endDate;

    @Column(name = "original_estimate")
    private Long originalEstimate;

    @Convert(converter = StatusListConverter.class)
    @Column(length = 4000)
    private List<String> components = new ArrayList<>();

    @Column(name = "due_date")
    private LocalDate dueDate;

    private String assignee;

    private String reporter;

    @Column(name = "in_progress_time")
    private Long inProgressTime;

    @Column(name = "blocked_time")
    private Long blockedTime;

    @Column(name = "review_time")
    private Long reviewTime;

    @Column(name = "promotion_time")
    private Long promotionTime;

    @Column(name = "refinement_time")
    private Long refinementTime;

    @Column(name = "ready_for_development_time")
    private Long readyForDevelopmentTime;

    @Convert(converter = StatusListConverter.class)
    @Column(name = "unmapped_statuses", length = 4000)
    private List<String> unmappedStatuses = new ArrayList<>();

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public JiraTicketRecord() {}

    /**
     * Overwrite every synced column from an extraction result.
     */
    public void applyFrom(ExtractedTicket ticket) {
        this.jiraId = ticket.jiraId();
        this.link = ticket.link();
        this.title = ticket.title();
        this.priority = ticket.priority();
        this.status = ticket.status();
        this.createDate = ticket.createDate();
        this.endDate = ticket.endDate();
        this.originalEstimate = ticket.originalEstimate();
        this.components = new ArrayList<>(ticket.components());
        this.dueDate = ticket.dueDate();
        this.assignee = ticket.assignee();
        this.reporter = ticket.reporter();
        this.inProgressTime = ticket.seconds(StatusBucket.IN_PROGRESS);
        this.blockedTime = ticket.seconds(StatusBucket.BLOCKED);
        this.reviewTime = ticket.seconds(StatusBucket.REVIEW);
        this.promotionTime = ticket.seconds(StatusBucket.PROMOTION);
        this.refinementTime = ticket.seconds(StatusBucket.REFINEMENT);
        this.readyForDevelopmentTime = ticket.seconds(StatusBucket.READY_FOR_DEVELOPMENT);
        this.unmappedStatuses = new ArrayList<>(ticket.unmappedStatuses());
    }

    // Getters and Setters

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getJiraId() { return jiraId; }
    public void setJiraId(String jiraId) { this.jiraId = jiraId; }

    public String getLink() { return link; }
    public void setLink(String link) { this.link = link; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getPriority() { return priority; }
    public void setPriority(String priority) { this.priority = priority; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public Instant getCreateDate() { return createDate; }
    public void setCreateDate(Instant createDate) { this.createDate = createDate; }

    public Instant getEndDate() { return endDate; }
    public void setEndDate(Instant endDate) { this.endDate = endDate; }

    public Long getOriginalEstimate() { return originalEstimate; }
    public void setOriginalEstimate(Long originalEstimate) { this.originalEstimate = originalEstimate; }

    public List<String> getComponents() { return components; }
    public void setComponents(List<String> components) { this.components = components; }

    public LocalDate getDueDate() { return dueDate; }
    public void setDueDate(LocalDate dueDate) { this.dueDate = dueDate; }

    public String getAssignee() { return assignee; }
    public void setAssignee(String assignee) { this.assignee = assignee; }

    public String getReporter() { return reporter; }
    public void setReporter(String reporter) { this.reporter = reporter; }

    public Long getInProgressTime() { return inProgressTime; }
    public void setInProgressTime(Long inProgressTime) { this.inProgressTime = inProgressTime; }

    public Long getBlockedTime() { return blockedTime; }
    public void setBlockedTime(Long blockedTime) { this.blockedTime = blockedTime; }

    public Long getReviewTime() { return reviewTime; }
    public void setReviewTime(Long reviewTime) { this.reviewTime = reviewTime; }

    public Long getPromotionTime() { return promotionTime; }
    public void setPromotionTime(Long promotionTime) { this.promotionTime = promotionTime; }

    public Long getRefinementTime() { return refinementTime; }
    public void setRefinementTime(Long refinementTime) { this.refinementTime = refinementTime; }

    public Long getReadyForDevelopmentTime() { return readyForDevelopmentTime; }
    public void setReadyForDevelopmentTime(Long readyForDevelopmentTime) { this.readyForDevelopmentTime = readyForDevelopmentTime; }

    public List<String> getUnmappedStatuses() { return unmappedStatuses; }
    public void setUnmappedStatuses(List<String> unmappedStatuses) { this.unmappedStatuses = unmappedStatuses; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
