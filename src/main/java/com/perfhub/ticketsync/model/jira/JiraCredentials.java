package com.perfhub.ticketsync.model.jira;

import com.perfhub.ticketsync.config.JiraSyncConfig;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Server endpoint plus the single Basic-Auth credential used for every call of a sync run.
 * An API token takes precedence over a legacy password when both are supplied.
 */
public final class JiraCredentials {

    public enum AuthMethod { API_TOKEN, PASSWORD }

    private final String serverUrl;
    private final String username;
    private final String secret;
    private final AuthMethod authMethod;

    private JiraCredentials(String serverUrl, String username, String secret, AuthMethod authMethod) {
        this.serverUrl = serverUrl;
        this.username = username;
        this.secret = secret;
        this.authMethod = authMethod;
    }

    /**
     * @throws IllegalArgumentException when the server, the username or both secrets are missing
     */
    public static JiraCredentials of(String serverUrl, String username, String password, String apiToken) {
        String server = JiraSyncConfig.normalizeServerUrl(serverUrl);
        if (server.isEmpty()) {
            throw new IllegalArgumentException("Jira server URL is required");
        }
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Jira username is required");
        }
        if (apiToken != null && !apiToken.isEmpty()) {
            return new JiraCredentials(server, username, apiToken, AuthMethod.API_TOKEN);
        }
        if (password != null && !password.isEmpty()) {
            return new JiraCredentials(server, username, password, AuthMethod.PASSWORD);
        }
        throw new IllegalArgumentException("Either apiToken or password must be provided for authentication");
    }

    public String getServerUrl() { return serverUrl; }
    public String getUsername() { return username; }
    public AuthMethod getAuthMethod() { return authMethod; }

    public String authorizationHeader() {
        String credentials = username + ":" + secret;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        // never expose the secret
        return "JiraCredentials{" + username + "@" + serverUrl + ", " + authMethod + "}";
    }
}
