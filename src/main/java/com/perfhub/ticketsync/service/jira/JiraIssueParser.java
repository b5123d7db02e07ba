package com.perfhub.ticketsync.service.jira;

import com.fasterxml.jackson.databind.JsonNode;
import com.perfhub.ticketsync.model.jira.ChangelogEntry;
import com.perfhub.ticketsync.model.jira.ChangelogItem;
import com.perfhub.ticketsync.model.jira.RawIssue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a bulk-fetch issue node onto {@link RawIssue}. Lenient about shape: absent or null
 * fields become null so that data problems surface during extraction of that one ticket.
 */
@Component
public class JiraIssueParser {

    public RawIssue parse(JsonNode issue) {
        JsonNode fields = issue.path("fields");

        List<String> components = new ArrayList<>();
        JsonNode componentsNode = fields.get("components");
        if (componentsNode != null && componentsNode.isArray()) {
            for (JsonNode component : componentsNode) {
                String name = textOrNull(component, "name");
                if (name != null) components.add(name);
            }
        }

        JsonNode estimate = fields.get("timeoriginalestimate");
        Long originalEstimate = estimate != null && estimate.isNumber() ? estimate.asLong() : null;

        return new RawIssue(
                textOrNull(issue, "id"),
                textOrNull(issue, "key"),
                textOrNull(fields, "summary"),
                nestedText(fields, "priority", "name"),
                nestedText(fields, "status", "name"),
                textOrNull(fields, "created"),
                textOrNull(fields, "resolutiondate"),
                textOrNull(fields, "duedate"),
                originalEstimate,
                components,
                nestedText(fields, "assignee", "displayName"),
                nestedText(fields, "reporter", "displayName"),
                parseChangelog(issue.get("changelog")));
    }

    private List<ChangelogEntry> parseChangelog(JsonNode changelog) {
        List<ChangelogEntry> entries = new ArrayList<>();
        if (changelog == null) return entries;
        JsonNode histories = changelog.get("histories");
        if (histories == null || !histories.isArray()) return entries;

        for (JsonNode history : histories) {
            List<ChangelogItem> items = new ArrayList<>();
            JsonNode itemsNode = history.get("items");
            if (itemsNode != null && itemsNode.isArray()) {
                for (JsonNode item : itemsNode) {
                    items.add(new ChangelogItem(
                            textOrNull(item, "field"),
                            textOrNull(item, "fromString"),
                            textOrNull(item, "toString")));
                }
            }
            entries.add(new ChangelogEntry(textOrNull(history, "created"), items));
        }
        return entries;
    }

    // --- JSON helpers ---

    private String textOrNull(JsonNode node, String field) {
        if (node == null || !node.has(field) || node.get(field).isNull()) return null;
        return node.get(field).asText();
    }

    private String nestedText(JsonNode node, String field, String subField) {
        if (node == null || !node.has(field) || node.get(field).isNull()) return null;
        return textOrNull(node.get(field), subField);
    }
}
