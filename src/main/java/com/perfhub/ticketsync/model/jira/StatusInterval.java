package com.perfhub.ticketsync.model.jira;

import java.time.Duration;
import java.time.Instant;

/**
 * A span during which a ticket held one status. The last interval of a ticket is
 * {@code open}: its end is the measurement instant, not a recorded transition.
 */
public record StatusInterval(String status, Instant start, Instant end, boolean open) {

    public Duration duration() {
        return Duration.between(start, end);
    }
}
