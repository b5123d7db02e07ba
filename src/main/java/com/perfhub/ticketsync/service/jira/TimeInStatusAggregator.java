package com.perfhub.ticketsync.service.jira;

import com.perfhub.ticketsync.config.JiraSyncConfig;
import com.perfhub.ticketsync.model.jira.BucketConfig;
import com.perfhub.ticketsync.model.jira.StatusBucket;
import com.perfhub.ticketsync.model.jira.StatusInterval;
import com.perfhub.ticketsync.model.jira.StatusTimeSummary;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sums interval time per bucket and finds the closure timestamp.
 *
 * <p>Only completed intervals count toward buckets unless open-interval counting is
 * switched on, in which case the current status accrues time up to the measurement instant.
 * A status listed in several buckets counts toward each of them.</p>
 */
@Component
public class TimeInStatusAggregator {

    private final boolean countOpenIntervals;

    @Autowired
    public TimeInStatusAggregator(JiraSyncConfig config) {
        this(config.isCountOpenIntervals());
    }

    public TimeInStatusAggregator(boolean countOpenIntervals) {
        this.countOpenIntervals = countOpenIntervals;
    }

    public StatusTimeSummary aggregate(List<StatusInterval> intervals, BucketConfig config) {
        Map<StatusBucket, Long> millisByBucket = new EnumMap<>(StatusBucket.class);
        Instant closedAt = null;
        Map<String, String> unmapped = new LinkedHashMap<>();

        for (StatusInterval interval : intervals) {
            String status = interval.status();

            if (closedAt == null && config.isClosedStatus(status)) {
                closedAt = interval.start();
            }
            if (!config.isMapped(status)) {
                unmapped.putIfAbsent(BucketConfig.normalize(status), status);
            }
            if (interval.open() && !countOpenIntervals) {
                continue;
            }

            long millis = interval.duration().toMillis();
            for (StatusBucket bucket : StatusBucket.values()) {
                if (config.matches(bucket, status)) {
                    millisByBucket.merge(bucket, millis, Long::sum);
                }
            }
        }

        Map<StatusBucket, Long> secondsByBucket = new EnumMap<>(StatusBucket.class);
        for (StatusBucket bucket : StatusBucket.values()) {
            secondsByBucket.put(bucket, Math.round(millisByBucket.getOrDefault(bucket, 0L) / 1000.0));
        }
        return new StatusTimeSummary(secondsByBucket, closedAt, new ArrayList<>(unmapped.values()));
    }
}
