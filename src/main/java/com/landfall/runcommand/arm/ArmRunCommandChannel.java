package com.landfall.runcommand.arm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.landfall.core.model.ClusterHandle;
import com.landfall.runcommand.ClusterUnreachableException;
import com.landfall.runcommand.CommandChannel;
import com.landfall.runcommand.CommandRejectedException;
import com.landfall.runcommand.CommandRequest;
import com.landfall.runcommand.OperationCancelledException;
import com.landfall.runcommand.OperationHandle;
import com.landfall.runcommand.OperationState;
import com.landfall.runcommand.OperationStatus;
import com.landfall.runcommand.TransportFailureException;
import com.landfall.runcommand.credential.CredentialProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.UUID;

/**
 * HTTP client for the managed-cluster run-command API.
 *
 * <p>{@code POST <cluster id>/runCommand} starts {@code kubectl} inside the cluster's
 * control plane with an optional zipped context. The service answers {@code 202}
 * with a {@code Location} to poll (and usually {@code Retry-After}); polling answers
 * {@code 202} until the command finishes and then {@code 200} with
 * {@code properties.provisioningState}, {@code exitCode} and {@code logs}.
 *
 * <p>The credential is injected at construction and consulted per request.
 */
public class ArmRunCommandChannel implements CommandChannel {

    private static final Logger log = LoggerFactory.getLogger(ArmRunCommandChannel.class);

    private final String endpoint;
    private final String apiVersion;
    private final Duration requestTimeout;
    private final CredentialProvider credentials;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ArmRunCommandChannel(ArmProperties properties, CredentialProvider credentials, HttpClient httpClient) {
        var base = properties.getEndpoint();
        this.endpoint = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.apiVersion = properties.getApiVersion();
        this.requestTimeout = properties.getRequestTimeout();
        this.credentials = credentials;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public OperationHandle submit(ClusterHandle cluster, CommandRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("command", request.command());
        if (request.hasContext()) {
            body.put("context", request.contextPayload());
        }

        var uri = URI.create(endpoint + cluster.id() + "/runCommand?api-version=" + apiVersion);
        var httpRequest = authorized(uri)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();

        var response = send(httpRequest, "POST runCommand on " + cluster.name());
        int status = response.statusCode();
        if (status >= 500) {
            throw new ClusterUnreachableException("run command on %s failed (HTTP %d): %s"
                    .formatted(cluster.name(), status, response.body()));
        }
        if (status >= 400) {
            throw new CommandRejectedException("run command on %s rejected (HTTP %d): %s"
                    .formatted(cluster.name(), status, response.body()), status);
        }

        var retryAfter = parseRetryAfter(response);
        if (status == 200) {
            var result = parseResult(response.body());
            var id = result.path("id").asText(UUID.randomUUID().toString());
            var operationStatus = toStatus(result, retryAfter);
            if (operationStatus.state().isTerminal()) {
                return OperationHandle.completed(id, operationStatus);
            }
        }

        var location = response.headers().firstValue("Location")
                .or(() -> response.headers().firstValue("Azure-AsyncOperation"))
                .orElseThrow(() -> new TransportFailureException(
                        "run command on %s accepted (HTTP %d) without a Location to poll".formatted(cluster.name(), status)));
        var locationUri = URI.create(location);
        var id = lastSegment(locationUri);
        log.info("Run command on {} accepted as {} (retry after {})", cluster.name(), id, retryAfter);
        return OperationHandle.pending(id, locationUri, retryAfter);
    }

    @Override
    public OperationStatus poll(OperationHandle handle) {
        if (handle.location() == null) {
            throw new TransportFailureException("operation " + handle.id() + " has no poll location");
        }
        var httpRequest = authorized(handle.location()).GET().build();
        var response = send(httpRequest, "GET command result " + handle.id());
        int status = response.statusCode();

        if (status == 202 || status == 204) {
            return OperationStatus.running(parseRetryAfter(response));
        }
        if (status >= 500) {
            throw new ClusterUnreachableException("polling %s failed (HTTP %d): %s"
                    .formatted(handle.id(), status, response.body()));
        }
        if (status >= 400) {
            throw new TransportFailureException("operation %s can no longer be tracked (HTTP %d): %s"
                    .formatted(handle.id(), status, response.body()));
        }
        return toStatus(parseResult(response.body()), parseRetryAfter(response));
    }

    private HttpRequest.Builder authorized(URI uri) {
        return HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + credentials.token().token())
                .header("Accept", "application/json");
    }

    private HttpResponse<String> send(HttpRequest request, String what) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ClusterUnreachableException("request failed: " + what, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("interrupted during " + what, e);
        }
    }

    private JsonNode parseResult(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new TransportFailureException("unreadable command result: " + body, e);
        }
    }

    static OperationStatus toStatus(JsonNode result, Duration retryAfter) {
        var properties = result.path("properties");
        var state = OperationState.fromProvisioningState(properties.path("provisioningState").asText(null));
        if (!state.isTerminal()) {
            return OperationStatus.running(retryAfter);
        }
        var exitNode = properties.get("exitCode");
        Integer exitCode = exitNode == null || exitNode.isNull() ? null : exitNode.asInt();
        var logs = properties.path("logs").asText("");
        if (state == OperationState.SUCCEEDED && exitCode != null) {
            return OperationStatus.succeeded(logs, exitCode);
        }
        var reason = properties.path("reason").asText("");
        return new OperationStatus(state, null, appendReason(logs, reason), exitCode);
    }

    // the reason goes on its own line after whatever the command printed
    static String appendReason(String logs, String reason) {
        if (reason.isEmpty()) {
            return logs;
        }
        if (logs.isEmpty() || logs.endsWith("\n")) {
            return logs + reason;
        }
        return logs + "\n" + reason;
    }

    static Duration parseRetryAfter(HttpResponse<?> response) {
        return response.headers().firstValue("Retry-After")
                .map(String::trim)
                .filter(v -> v.matches("\\d+"))
                .map(v -> Duration.ofSeconds(Long.parseLong(v)))
                .orElse(null);
    }

    private static String lastSegment(URI uri) {
        var path = uri.getPath();
        if (path == null || path.isEmpty()) {
            return uri.toString();
        }
        var trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }
}
