package com.perfhub.ticketsync.model.jira;

/**
 * Request body for POST /api/jira-tickets/extract.
 */
public class SyncRequest {

    private String jql;
    private String server;
    private String username;
    private String password;
    private String apiToken;

    public SyncRequest() {
    }

    public SyncRequest(String jql, String server, String username, String password, String apiToken) {
        this.jql = jql;
        this.server = server;
        this.username = username;
        this.password = password;
        this.apiToken = apiToken;
    }

    public String getJql() { return jql; }
    public void setJql(String jql) { this.jql = jql; }

    public String getServer() { return server; }
    public void setServer(String server) { this.server = server; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getApiToken() { return apiToken; }
    public void setApiToken(String apiToken) { this.apiToken = apiToken; }

    public JiraCredentials toCredentials() {
        return JiraCredentials.of(server, username, password, apiToken);
    }

    @Override
    public String toString() {
        return "SyncRequest{server=" + server + ", username=" + username + ", jqlLength="
                + (jql == null ? 0 : jql.length()) + "}";
    }
}
