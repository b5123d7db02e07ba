package com.perfhub.ticketsync.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class JiraSyncConfig {

    // Jira's enhanced search accepts up to 5000 ids per page when no fields are requested
    @Value("${perfhub.jira.id-page-size:5000}")
    private int idPageSize;

    // Bulk fetch caps a single call at 100 issues
    @Value("${perfhub.jira.detail-batch-size:100}")
    private int detailBatchSize;

    @Value("${perfhub.jira.connect-timeout-seconds:30}")
    private int connectTimeoutSeconds;

    @Value("${perfhub.jira.request-timeout-seconds:30}")
    private int requestTimeoutSeconds;

    @Value("${perfhub.jira.test-connection-timeout-seconds:10}")
    private int testConnectionTimeoutSeconds;

    @Value("${perfhub.jira.detail-fetch-parallelism:1}")
    private int detailFetchParallelism;

    @Value("${perfhub.jira.count-open-intervals:false}")
    private boolean countOpenIntervals;

    @Value("${perfhub.jira.max-sync-duration-seconds:0}")
    private long maxSyncDurationSeconds;

    public JiraSyncConfig() {
    }

    public JiraSyncConfig(int idPageSize, int detailBatchSize, int requestTimeoutSeconds,
                          int detailFetchParallelism, boolean countOpenIntervals) {
        this.idPageSize = idPageSize;
        this.detailBatchSize = detailBatchSize;
        this.connectTimeoutSeconds = requestTimeoutSeconds;
        this.requestTimeoutSeconds = requestTimeoutSeconds;
        this.testConnectionTimeoutSeconds = requestTimeoutSeconds;
        this.detailFetchParallelism = detailFetchParallelism;
        this.countOpenIntervals = countOpenIntervals;
    }

    public int getIdPageSize() { return Math.max(1, idPageSize); }
    public int getDetailBatchSize() { return Math.max(1, detailBatchSize); }
    public Duration getConnectTimeout() { return Duration.ofSeconds(connectTimeoutSeconds); }
    public Duration getRequestTimeout() { return Duration.ofSeconds(requestTimeoutSeconds); }
    public Duration getTestConnectionTimeout() { return Duration.ofSeconds(testConnectionTimeoutSeconds); }
    public int getDetailFetchParallelism() { return Math.max(1, detailFetchParallelism); }
    public boolean isCountOpenIntervals() { return countOpenIntervals; }

    /**
     * Upper bound for a single sync run, or {@code null} when runs are unbounded.
     */
    public Duration getMaxSyncDuration() {
        return maxSyncDurationSeconds > 0 ? Duration.ofSeconds(maxSyncDurationSeconds) : null;
    }

    public void setMaxSyncDurationSeconds(long maxSyncDurationSeconds) {
        this.maxSyncDurationSeconds = maxSyncDurationSeconds;
    }

    /**
     * Build the browse link stored with every ticket.
     * Mirrors the link format the review UI expects: {server}/browse/{key}
     */
    public String buildBrowseUrl(String serverUrl, String jiraKey) {
        return String.format("%s/browse/%s", normalizeServerUrl(serverUrl), jiraKey);
    }

    /**
     * Strip trailing slashes so path concatenation never produces "//rest".
     */
    public static String normalizeServerUrl(String serverUrl) {
        if (serverUrl == null) return "";
        String trimmed = serverUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
