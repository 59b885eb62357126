package com.scanfleet.core.sonar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * HTTP client for the SonarQube Web API.
 *
 * <p>Each instance wraps its own connection-pooled {@link HttpClient}. Transport errors and
 * 5xx responses are retried up to {@code maxRetries} times; 4xx responses are not.
 * Authentication uses the token as a bearer credential.
 */
public class SonarClient implements SonarApi {

    private static final Logger log = LoggerFactory.getLogger(SonarClient.class);

    static final String SEARCH_PATH = "/api/projects/search";
    static final String CREATE_PATH = "/api/projects/create";
    static final String RENAME_BRANCH_PATH = "/api/project_branches/rename";

    private final String baseUrl;
    private final String token;
    private final int maxRetries;
    private final Duration requestTimeout;
    private final Duration retryPause;
    private final String metadataEndpoint;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private SonarClient(Builder builder) {
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(builder.baseUrl, "baseUrl"));
        this.token = Objects.requireNonNull(builder.token, "token");
        this.maxRetries = Math.max(0, builder.maxRetries);
        this.requestTimeout = builder.requestTimeout;
        this.retryPause = builder.retryPause;
        this.metadataEndpoint = builder.metadataEndpoint;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean projectExists(String projectKey) {
        var response = get(SEARCH_PATH + "?projects=" + encode(projectKey));
        int total = response.path("paging").path("total").asInt(0);
        log.debug("Project {} search returned total={}", projectKey, total);
        return total > 0;
    }

    @Override
    public void createProject(String projectKey, String name) {
        post(CREATE_PATH, form("project", projectKey, "name", name));
        log.info("Created project {} ({})", projectKey, name);
    }

    @Override
    public void renameDefaultBranch(String projectKey, String branch) {
        post(RENAME_BRANCH_PATH, form("project", projectKey, "name", branch));
        log.info("Renamed default branch of {} to {}", projectKey, branch);
    }

    @Override
    public void updateMetadata(String projectKey, String name, String description) {
        post(metadataEndpoint, form("project", projectKey, "name", name, "description", description));
        log.info("Updated metadata of {} to '{}'", projectKey, name);
    }

    private JsonNode get(String pathAndQuery) {
        var request = requestBuilder(pathAndQuery).GET().build();
        String body = send(request);
        try {
            return body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (IOException e) {
            throw new SonarApiException("Unparseable response from " + pathAndQuery, e);
        }
    }

    private void post(String path, String formBody) {
        var request = requestBuilder(path)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(formBody))
                .build();
        send(request);
    }

    private HttpRequest.Builder requestBuilder(String pathAndQuery) {
        return HttpRequest.newBuilder(URI.create(baseUrl + pathAndQuery))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json");
    }

    /**
     * Sends the request, retrying transport failures and server errors.
     */
    private String send(HttpRequest request) {
        String target = request.method() + " " + request.uri().getPath();
        SonarApiException last = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                log.debug("Retrying {} (attempt {}/{})", target, attempt, maxRetries);
                pause();
            }
            try {
                var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                if (status >= 200 && status < 300) {
                    return response.body();
                }
                last = new SonarApiException(
                        "%s returned HTTP %d: %s".formatted(target, status, response.body()), status);
                if (status < 500) {
                    throw last;
                }
            } catch (IOException e) {
                last = new SonarApiException(target + " failed: " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SonarApiException(target + " interrupted", e);
            }
        }
        throw last;
    }

    private void pause() {
        if (retryPause.isZero()) {
            return;
        }
        try {
            Thread.sleep(retryPause.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SonarApiException("Interrupted between retries", e);
        }
    }

    static String form(String... keyValues) {
        var params = new LinkedHashMap<String, String>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            params.put(keyValues[i], keyValues[i + 1] == null ? "" : keyValues[i + 1]);
        }
        return params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static final class Builder {
        private String baseUrl;
        private String token;
        private int maxRetries = 3;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration retryPause = Duration.ofMillis(500);
        private String metadataEndpoint = "/api/projects/update";
        private ObjectMapper objectMapper;

        private Builder() {}

        public Builder baseUrl(String baseUrl) { this.baseUrl = baseUrl; return this; }
        public Builder token(String token) { this.token = token; return this; }
        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder connectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; return this; }
        public Builder requestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; return this; }
        public Builder retryPause(Duration retryPause) { this.retryPause = retryPause; return this; }
        public Builder metadataEndpoint(String metadataEndpoint) { this.metadataEndpoint = metadataEndpoint; return this; }
        public Builder objectMapper(ObjectMapper objectMapper) { this.objectMapper = objectMapper; return this; }

        public SonarClient build() {
            return new SonarClient(this);
        }
    }
}
