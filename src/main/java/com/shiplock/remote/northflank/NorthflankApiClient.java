package com.shiplock.remote.northflank;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shiplock.core.model.BuildHandle;
import com.shiplock.core.model.BuildRecord;
import com.shiplock.core.model.Revision;
import com.shiplock.remote.RemoteControlClient;
import com.shiplock.remote.RemoteRejectedException;
import com.shiplock.remote.RemoteTransportException;
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
import java.util.List;

/**
 * HTTP client for the Northflank v1 REST API.
 *
 * <p>Talks to one service, identified by {@link NorthflankProperties#getProjectId()}
 * and {@link NorthflankProperties#getServiceId()}, authenticating with the
 * bearer token from {@link NorthflankProperties#getApiToken()}.
 *
 * <p>HTTP 5xx, 429 and I/O failures surface as {@link RemoteTransportException};
 * other 4xx responses and unusable bodies as {@link RemoteRejectedException}.
 */
public class NorthflankApiClient implements RemoteControlClient {

    private static final Logger log = LoggerFactory.getLogger(NorthflankApiClient.class);

    private final NorthflankProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public NorthflankApiClient(NorthflankProperties properties) {
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public BuildHandle submitBuild(Revision revision) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("sha", revision.value());

        var response = apiPost(servicePath("/build"), body.toString());

        var buildId = NorthflankResponses.buildId(response);
        if (buildId.isEmpty()) {
            throw new RemoteRejectedException("build id missing in acknowledgement: " + response);
        }
        log.info("Started Northflank build {} for sha {}", buildId, revision);
        return new BuildHandle(buildId);
    }

    @Override
    public List<BuildRecord> listRecentBuilds(int limit) {
        var response = apiGet(servicePath("/build?per_page=" + limit));
        return NorthflankResponses.builds(response);
    }

    @Override
    public void requestDeployment(Revision revision) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode internal = body.putObject("internal");
        internal.put("branch", properties.getBranch());
        internal.put("buildSHA", revision.value());

        apiPost(servicePath("/deployment"), body.toString());
        log.info("Requested Northflank deployment of sha {} (branch {})", revision, properties.getBranch());
    }

    @Override
    public String getDeployedRevision() {
        return NorthflankResponses.deployedRevision(apiGet(servicePath("/deployment")));
    }

    @Override
    public String describe() {
        return "northflank-api %s (%s/%s)".formatted(
                properties.getApiUrl(), properties.getProjectId(), properties.getServiceId());
    }

    String servicePath(String suffix) {
        var projectId = properties.getProjectId();
        var serviceId = properties.getServiceId();
        if (projectId == null || projectId.isBlank() || serviceId == null || serviceId.isBlank()) {
            throw new RemoteRejectedException(
                    "Northflank project/service not configured. Set PROJECT_ID and SERVICE_ID.");
        }
        return "/v1/projects/%s/services/%s%s".formatted(encode(projectId), encode(serviceId), suffix);
    }

    JsonNode apiGet(String path) {
        var request = authorized(path)
                .header("Accept", "application/json")
                .GET()
                .build();
        return send("GET", path, request);
    }

    JsonNode apiPost(String path, String body) {
        var request = authorized(path)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return send("POST", path, request);
    }

    private HttpRequest.Builder authorized(String path) {
        var token = properties.getApiToken();
        if (token == null || token.isBlank()) {
            throw new RemoteRejectedException(
                    "Northflank API token not configured. Set NORTHFLANK_API_TOKEN.");
        }
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder().uri(URI.create(properties.getApiUrl() + path));
        } catch (IllegalArgumentException e) {
            throw new RemoteRejectedException("Invalid Northflank API URL '%s': %s"
                    .formatted(properties.getApiUrl(), e.getMessage()), e);
        }
        return builder
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("Authorization", "Bearer " + token);
    }

    private JsonNode send(String method, String path, HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteTransportException("Northflank API request failed: %s %s".formatted(method, path), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteTransportException("Interrupted during Northflank API call: %s %s".formatted(method, path), e);
        }

        int status = response.statusCode();
        log.debug("Northflank {} {} -> HTTP {}", method, path, status);
        if (status >= 500 || status == 429) {
            throw new RemoteTransportException("Northflank API %s %s failed (HTTP %d): %s"
                    .formatted(method, path, status, response.body()));
        }
        if (status >= 400) {
            throw new RemoteRejectedException("Northflank API %s %s rejected (HTTP %d): %s"
                    .formatted(method, path, status, response.body()));
        }
        return parse(response.body(), method + " " + path);
    }

    JsonNode parse(String body, String context) {
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new RemoteRejectedException("Unparseable Northflank response to " + context, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
