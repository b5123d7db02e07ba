package com.perfhub.ticketsync.service.jira;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.perfhub.ticketsync.config.JiraSyncConfig;
import com.perfhub.ticketsync.model.jira.BatchFailure;
import com.perfhub.ticketsync.model.jira.DetailFetchResult;
import com.perfhub.ticketsync.model.jira.JiraCredentials;
import com.perfhub.ticketsync.model.jira.RawIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;

/**
 * Two-phase retrieval against the Jira Cloud REST API.
 *
 * <ol>
 *   <li>Identifier collection through the enhanced JQL search
 *       ({@code POST /rest/api/3/search/jql}), paging on {@code nextPageToken} and asking
 *       for ids only so large result sets stay cheap.</li>
 *   <li>Bulk detail fetch ({@code POST /rest/api/3/issue/bulkfetch}) of all fields plus the
 *       changelog, one call per batch of identifiers.</li>
 * </ol>
 *
 * Phase 1 failures are fatal and thrown as {@link JiraApiException}. A failing detail batch is
 * logged and reported as a {@link BatchFailure}; the remaining batches still run. Nothing is
 * retried here, retry policy belongs to the caller.
 */
@Service
public class JiraIssueFetcher {

    private static final Logger log = LoggerFactory.getLogger(JiraIssueFetcher.class);

    static final String SEARCH_PATH = "/rest/api/3/search/jql";
    static final String BULK_FETCH_PATH = "/rest/api/3/issue/bulkfetch";
    static final String MYSELF_PATH = "/rest/api/3/myself";

    private final JiraSyncConfig config;
    private final JiraIssueParser parser;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    @Autowired
    public JiraIssueFetcher(JiraSyncConfig config, JiraIssueParser parser) {
        this(config, parser, HttpClient.newBuilder()
                .connectTimeout(config.getConnectTimeout())
                .build());
    }

    public JiraIssueFetcher(JiraSyncConfig config, JiraIssueParser parser, HttpClient httpClient) {
        this.config = config;
        this.parser = parser;
        this.objectMapper = new ObjectMapper();
        this.httpClient = httpClient;
    }

    /**
     * Collect ids then fetch details, dropping failed batches.
     */
    public List<RawIssue> fetchAll(String jql, JiraCredentials credentials) {
        List<String> ids = collectIssueIds(jql, credentials);
        return fetchDetails(ids, credentials, () -> false).issues();
    }

    // -----------------------------------------------------------------
    // Phase 1: identifier collection
    // -----------------------------------------------------------------

    /**
     * @throws JiraApiException when any search page fails; no partial list is returned
     */
    public List<String> collectIssueIds(String jql, JiraCredentials credentials) {
        List<String> ids = new ArrayList<>();
        String nextPageToken = null;
        int page = 0;

        while (true) {
            page++;
            log.info("Collecting issue IDs (page {}) from {}", page, credentials.getServerUrl());

            JsonNode root = send(credentials, SEARCH_PATH, searchRequestBody(jql, nextPageToken),
                    config.getRequestTimeout(), "issue search page " + page);

            JsonNode issues = root.get("issues");
            int pageCount = 0;
            if (issues != null && issues.isArray()) {
                for (JsonNode issue : issues) {
                    String id = issue.hasNonNull("id") ? issue.get("id").asText() : issue.path("key").asText(null);
                    if (id != null && !id.isEmpty()) {
                        ids.add(id);
                        pageCount++;
                    }
                }
            }
            log.info("Collected {} issue IDs (total: {})", pageCount, ids.size());

            String token = root.hasNonNull("nextPageToken") ? root.get("nextPageToken").asText() : null;
            boolean isLast = root.path("isLast").asBoolean(false);
            if (token == null || token.isEmpty() || isLast) {
                break;
            }
            if (token.equals(nextPageToken)) {
                log.warn("Jira returned the same page token twice; stopping identifier collection at {} ids", ids.size());
                break;
            }
            nextPageToken = token;
        }

        log.info("Identifier collection complete. Total issue IDs collected: {}", ids.size());
        return ids;
    }

    ObjectNode searchRequestBody(String jql, String nextPageToken) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("jql", jql);
        body.put("maxResults", config.getIdPageSize());
        body.putArray("fields").add("id");
        if (nextPageToken != null) {
            body.put("nextPageToken", nextPageToken);
        }
        return body;
    }

    // -----------------------------------------------------------------
    // Phase 2: bulk detail fetch
    // -----------------------------------------------------------------

    /**
     * Fetch full issues for the given ids in fixed-size batches. With a parallelism of 1 the
     * batches run strictly in order on the calling thread; otherwise a bounded pool is used.
     *
     * @param stopRequested polled before each batch; once true the remaining batches are skipped
     */
    public DetailFetchResult fetchDetails(List<String> ids, JiraCredentials credentials, BooleanSupplier stopRequested) {
        List<List<String>> batches = partition(ids, config.getDetailBatchSize());
        log.info("Fetching details for {} issues in {} batch(es)", ids.size(), batches.size());

        List<RawIssue> issues = new ArrayList<>();
        List<BatchFailure> failures = new ArrayList<>();

        if (config.getDetailFetchParallelism() <= 1 || batches.size() <= 1) {
            for (int i = 0; i < batches.size(); i++) {
                if (stopRequested.getAsBoolean()) {
                    log.warn("Stop requested; skipping {} remaining batch(es)", batches.size() - i);
                    break;
                }
                BatchOutcome outcome = runBatch(i, batches, credentials);
                collect(outcome, issues, failures);
                if (outcome.interrupted()) break;
            }
        } else {
            fetchInParallel(batches, credentials, stopRequested, issues, failures);
        }

        log.info("Detail fetch complete. Retrieved {} issues, {} batch(es) failed", issues.size(), failures.size());
        return new DetailFetchResult(issues, failures);
    }

    private void fetchInParallel(List<List<String>> batches, JiraCredentials credentials, BooleanSupplier stopRequested,
                                 List<RawIssue> issues, List<BatchFailure> failures) {
        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(config.getDetailFetchParallelism(), batches.size()));
        try {
            List<Future<BatchOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < batches.size(); i++) {
                final int index = i;
                futures.add(executor.submit(() -> stopRequested.getAsBoolean()
                        ? null
                        : runBatch(index, batches, credentials)));
            }
            // collect in submission order so the result keeps batch order
            for (int i = 0; i < futures.size(); i++) {
                try {
                    BatchOutcome outcome = futures.get(i).get();
                    if (outcome != null) {
                        collect(outcome, issues, failures);
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    failures.add(failure(i, batches, describe(cause)));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failures.add(failure(i, batches, "interrupted"));
                    break;
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private BatchOutcome runBatch(int index, List<List<String>> batches, JiraCredentials credentials) {
        List<String> batch = batches.get(index);
        int batchNumber = index + 1;
        log.info("Processing batch {}/{} ({} issues)", batchNumber, batches.size(), batch.size());
        try {
            JsonNode root = sendChecked(credentials, BULK_FETCH_PATH, bulkFetchRequestBody(batch),
                    config.getRequestTimeout());
            List<RawIssue> parsed = new ArrayList<>();
            JsonNode issues = root.get("issues");
            if (issues != null && issues.isArray()) {
                for (JsonNode issue : issues) {
                    parsed.add(parser.parse(issue));
                }
            }
            log.info("Batch {} complete. Retrieved {} detailed tickets", batchNumber, parsed.size());
            return BatchOutcome.success(parsed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Batch {} interrupted", batchNumber);
            return BatchOutcome.failed(failure(index, batches, "interrupted"), true);
        } catch (IOException | RuntimeException e) {
            log.error("Error processing batch {}: {}", batchNumber, describe(e));
            return BatchOutcome.failed(failure(index, batches, describe(e)), false);
        }
    }

    ObjectNode bulkFetchRequestBody(List<String> batch) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode idsNode = body.putArray("issueIdsOrKeys");
        batch.forEach(idsNode::add);
        body.putArray("fields").add("*all");
        body.putArray("expand").add("changelog");
        return body;
    }

    private BatchFailure failure(int index, List<List<String>> batches, String reason) {
        int firstIndex = index * config.getDetailBatchSize();
        return new BatchFailure(index + 1, firstIndex, batches.get(index).size(), reason);
    }

    private static void collect(BatchOutcome outcome, List<RawIssue> issues, List<BatchFailure> failures) {
        if (outcome.failure() != null) {
            failures.add(outcome.failure());
        } else {
            issues.addAll(outcome.issues());
        }
    }

    static List<List<String>> partition(List<String> ids, int size) {
        List<List<String>> batches = new ArrayList<>();
        for (int i = 0; i < ids.size(); i += size) {
            batches.add(List.copyOf(ids.subList(i, Math.min(ids.size(), i + size))));
        }
        return batches;
    }

    // -----------------------------------------------------------------
    // Connectivity test
    // -----------------------------------------------------------------

    /**
     * Call {@code /rest/api/3/myself} with the short test timeout.
     *
     * @return the authenticated user's profile as Jira reports it
     * @throws JiraApiException with a human-readable reason on any failure
     */
    public JsonNode testConnection(JiraCredentials credentials) {
        String url = credentials.getServerUrl() + MYSELF_PATH;
        log.info("Testing Jira connection: {} ({})", url, credentials.getAuthMethod());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Authorization", credentials.authorizationHeader())
                .header("Accept", "application/json")
                .timeout(config.getTestConnectionTimeout())
                .GET()
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (!isSuccess(response.statusCode())) {
                throw new JiraApiException(response.statusCode(), describeStatus(response.statusCode(), response.body()));
            }
            log.info("Jira connection test successful");
            return objectMapper.readTree(response.body());
        } catch (HttpTimeoutException e) {
            throw new JiraApiException(0, "Connection test timed out after "
                    + config.getTestConnectionTimeout().toSeconds() + "s", e);
        } catch (IOException e) {
            throw new JiraApiException(0, describeConnectFailure(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JiraApiException(0, "Connection test interrupted", e);
        }
    }

    // -----------------------------------------------------------------
    // HTTP helpers
    // -----------------------------------------------------------------

    private JsonNode send(JiraCredentials credentials, String path, JsonNode body, Duration timeout, String label) {
        try {
            return sendChecked(credentials, path, body, timeout);
        } catch (HttpTimeoutException e) {
            throw new JiraApiException(0, "Jira " + label + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new JiraApiException(0, "Jira " + label + " failed: " + describeConnectFailure(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JiraApiException(0, "Jira " + label + " interrupted", e);
        }
    }

    private JsonNode sendChecked(JiraCredentials credentials, String path, JsonNode body, Duration timeout)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(credentials.getServerUrl() + path))
                .header("Authorization", credentials.authorizationHeader())
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (!isSuccess(response.statusCode())) {
            log.error("Jira API returned status {} for {}", response.statusCode(), path);
            throw new JiraApiException(response.statusCode(), describeStatus(response.statusCode(), response.body()));
        }
        return objectMapper.readTree(response.body());
    }

    private static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Turn a non-2xx answer into a message, preferring Jira's own errorMessages.
     */
    String describeStatus(int statusCode, String body) {
        String message;
        switch (statusCode) {
            case 401 -> message = "Authentication failed - check username and API token/password";
            case 403 -> message = "Access forbidden - check API token permissions";
            case 404 -> message = "Jira server not found - check server URL";
            default -> message = "Jira API returned status " + statusCode;
        }
        try {
            JsonNode errorNode = objectMapper.readTree(body == null ? "" : body);
            List<String> msgs = new ArrayList<>();
            if (errorNode != null && errorNode.has("errorMessages")) {
                errorNode.get("errorMessages").forEach(m -> msgs.add(m.asText()));
            }
            if (errorNode != null && errorNode.has("errors") && errorNode.get("errors").isObject()) {
                errorNode.get("errors").forEach(m -> msgs.add(m.asText()));
            }
            if (!msgs.isEmpty()) message += ": " + String.join("; ", msgs);
        } catch (IOException e) {
            log.debug("Jira error body is not JSON: {}", e.getMessage());
        }
        return message;
    }

    private static String describeConnectFailure(IOException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof UnknownHostException || t instanceof UnresolvedAddressException) {
                return "Jira server not found - check server URL";
            }
            if (t instanceof ConnectException) {
                return "Cannot connect to Jira server - check server URL and network";
            }
        }
        return describe(e);
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private record BatchOutcome(List<RawIssue> issues, BatchFailure failure, boolean interrupted) {

        static BatchOutcome success(List<RawIssue> issues) {
            return new BatchOutcome(issues, null, false);
        }

        static BatchOutcome failed(BatchFailure failure, boolean interrupted) {
            return new BatchOutcome(List.of(), failure, interrupted);
        }
    }
}
