package io.mcoda.routing;

import com.fasterxml.jackson.core.type.TypeReference;
import io.mcoda.util.Jsons;
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
import java.util.Optional;

/**
 * Routing served by the mcoda routing API.
 *
 * <pre>
 * POST /routing/preview               body PreviewRequest, returns RoutingPreview
 * GET  /workspaces/{id}/defaults      returns [RoutingDefault]
 * PUT  /workspaces/{id}/defaults      body RoutingDefaultsUpdate, returns [RoutingDefault]
 * GET  /agents/{idOrSlug}             returns Agent, 404 when unknown
 * </pre>
 */
public final class RemoteRoutingBackend implements RoutingBackend {
    private static final Logger log = LoggerFactory.getLogger(RemoteRoutingBackend.class);
    private static final TypeReference<List<RoutingDefault>> DEFAULT_LIST = new TypeReference<>() {
    };

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient http;

    public RemoteRoutingBackend(String baseUrl, Duration timeout) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("routing API base URL must not be blank");
        }
        String trimmed = baseUrl.trim();
        this.baseUrl = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public RoutingPreview preview(PreviewRequest request) {
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/routing/preview"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(request), StandardCharsets.UTF_8)));
        requireSuccess(response, "routing preview");
        RoutingPreview preview = read(response, RoutingPreview.class);
        if (preview == null) {
            throw new RoutingException("Empty routing preview from " + response.uri());
        }
        for (RoutingCandidate candidate : preview.candidates()) {
            if (candidate.source() == null) {
                throw new RoutingException("Routing preview from " + response.uri() + " has a candidate without source"
                        + " (agent " + candidate.agentRef() + ", command " + candidate.commandName() + ")");
            }
        }
        return preview;
    }

    @Override
    public List<RoutingDefault> getWorkspaceDefaults(String workspaceId) {
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/workspaces/" + encode(workspaceId) + "/defaults")).GET());
        if (response.statusCode() == 404) {
            return List.of();
        }
        requireSuccess(response, "read routing defaults");
        return readDefaults(response);
    }

    @Override
    public List<RoutingDefault> updateWorkspaceDefaults(String workspaceId, RoutingDefaultsUpdate update) {
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/workspaces/" + encode(workspaceId) + "/defaults"))
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(update), StandardCharsets.UTF_8)));
        requireSuccess(response, "update routing defaults");
        return readDefaults(response);
    }

    @Override
    public Optional<Agent> getAgent(String idOrSlug) {
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/agents/" + encode(idOrSlug))).GET());
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess(response, "read agent " + idOrSlug);
        return Optional.of(read(response, Agent.class));
    }

    private HttpResponse<String> send(HttpRequest.Builder builder) {
        HttpRequest request = builder.timeout(timeout).header("Accept", "application/json").build();
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RoutingException("Routing API request failed: " + request.method() + " " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoutingException("Interrupted calling routing API: " + request.uri(), e);
        }
    }

    private void requireSuccess(HttpResponse<String> response, String action) {
        if (response.statusCode() / 100 != 2) {
            log.warn("Routing API {} failed with status {}", action, response.statusCode());
            throw new RoutingException("Routing API " + action + " failed status=" + response.statusCode()
                    + (response.body() == null || response.body().isBlank() ? "" : ": " + response.body()));
        }
    }

    private <T> T read(HttpResponse<String> response, Class<T> type) {
        try {
            return Jsons.mapper().readValue(response.body(), type);
        } catch (IOException e) {
            throw new RoutingException("Malformed routing API response from " + response.uri(), e);
        }
    }

    private List<RoutingDefault> readDefaults(HttpResponse<String> response) {
        if (response.body() == null || response.body().isBlank()) {
            return List.of();
        }
        try {
            return Jsons.mapper().readValue(response.body(), DEFAULT_LIST);
        } catch (IOException e) {
            throw new RoutingException("Malformed routing API response from " + response.uri(), e);
        }
    }

    private URI uri(String path) {
        return URI.create(baseUrl + path);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
