package com.perfhub.ticketsync.service.jira;

/**
 * A Jira call that failed outright: a non-2xx answer, a timeout, or an unreachable host.
 * {@link #getStatusCode()} is 0 when no HTTP response was received.
 */
public class JiraApiException extends RuntimeException {

    private final int statusCode;

    public JiraApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public JiraApiException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
