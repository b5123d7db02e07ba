package com.perfhub.ticketsync.repository.jira;

import com.perfhub.ticketsync.model.jira.JiraTicketRecord;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Optional filters for listing stored tickets. Null or blank values are ignored.
 * Assignee and reporter match case-insensitively on a substring; priority matches exactly;
 * the date range applies to the ticket's create date.
 */
public record JiraTicketFilter(String assignee, String reporter, String priority,
                               Instant createdFrom, Instant createdTo) {

    public static JiraTicketFilter none() {
        return new JiraTicketFilter(null, null, null, null, null);
    }

    public Specification<JiraTicketRecord> toSpecification() {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (hasText(assignee)) {
                predicates.add(cb.like(cb.lower(root.get("assignee")), containsPattern(assignee)));
            }
            if (hasText(reporter)) {
                predicates.add(cb.like(cb.lower(root.get("reporter")), containsPattern(reporter)));
            }
            if (hasText(priority)) {
                predicates.add(cb.equal(root.get("priority"), priority));
            }
            if (createdFrom != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("createDate"), createdFrom));
            }
            if (createdTo != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<Instant>get("createDate"), createdTo));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String containsPattern(String value) {
        return "%" + value.trim().toLowerCase(Locale.ROOT) + "%";
    }
}
