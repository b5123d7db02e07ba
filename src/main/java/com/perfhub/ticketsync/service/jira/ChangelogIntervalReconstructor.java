package com.perfhub.ticketsync.service.jira;

import com.perfhub.ticketsync.model.jira.ChangelogEntry;
import com.perfhub.ticketsync.model.jira.ChangelogItem;
import com.perfhub.ticketsync.model.jira.StatusInterval;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rebuilds the sequence of status intervals from a ticket's changelog.
 *
 * <p>Entries are ordered by timestamp (stable, so items sharing one entry keep their order).
 * Every status item opens a new interval and closes the previous one at the same instant.
 * The final interval stays open and is measured up to {@code now}. The status a ticket had
 * before its first recorded transition is not represented.</p>
 */
@Component
public class ChangelogIntervalReconstructor {

    public List<StatusInterval> reconstruct(List<ChangelogEntry> changelog, Instant now) {
        List<TimedEntry> timed = new ArrayList<>();
        for (ChangelogEntry entry : changelog) {
            if (entry.items().stream().anyMatch(ChangelogItem::isStatusChange)) {
                timed.add(new TimedEntry(JiraTimestamps.parseInstant(entry.created()), entry));
            }
        }
        // List.sort is stable
        timed.sort(Comparator.comparing(TimedEntry::at));

        List<String> labels = new ArrayList<>();
        List<Instant> starts = new ArrayList<>();
        for (TimedEntry timedEntry : timed) {
            for (ChangelogItem item : timedEntry.entry().items()) {
                if (!item.isStatusChange()) continue;
                if (item.toValue() == null) {
                    throw new IllegalArgumentException(
                            "status change at " + timedEntry.entry().created() + " has no target status");
                }
                labels.add(item.toValue());
                starts.add(timedEntry.at());
            }
        }

        List<StatusInterval> intervals = new ArrayList<>(labels.size());
        for (int i = 0; i < labels.size(); i++) {
            Instant start = starts.get(i);
            boolean last = i == labels.size() - 1;
            Instant end = last ? latest(start, now) : starts.get(i + 1);
            intervals.add(new StatusInterval(labels.get(i), start, end, last));
        }
        return List.copyOf(intervals);
    }

    private static Instant latest(Instant a, Instant b) {
        return b.isAfter(a) ? b : a;
    }

    private record TimedEntry(Instant at, ChangelogEntry entry) {
    }
}
