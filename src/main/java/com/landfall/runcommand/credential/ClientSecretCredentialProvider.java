package com.landfall.runcommand.credential;

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
import java.time.Clock;
import java.time.Duration;

/**
 * OAuth2 client-credentials flow against the identity platform's v2 token endpoint.
 *
 * <p>Tokens are cached and refreshed one minute before they expire. Failures are
 * reported as {@link CredentialException} and never retried.
 */
public class ClientSecretCredentialProvider implements CredentialProvider {

    private static final Logger log = LoggerFactory.getLogger(ClientSecretCredentialProvider.class);

    static final Duration REFRESH_MARGIN = Duration.ofSeconds(60);

    private final URI tokenUri;
    private final String clientId;
    private final String clientSecret;
    private final String scope;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private AccessToken cached;

    public ClientSecretCredentialProvider(String authorityHost, String tenantId, String clientId,
                                          String clientSecret, String scope, HttpClient httpClient) {
        this(authorityHost, tenantId, clientId, clientSecret, scope, httpClient, Clock.systemUTC());
    }

    ClientSecretCredentialProvider(String authorityHost, String tenantId, String clientId,
                                   String clientSecret, String scope, HttpClient httpClient, Clock clock) {
        if (isBlank(tenantId) || isBlank(clientId) || isBlank(clientSecret)) {
            throw new CredentialException(
                    "client credentials not configured. Set landfall.arm.credential.tenant-id, client-id and client-secret.");
        }
        var host = authorityHost.endsWith("/") ? authorityHost.substring(0, authorityHost.length() - 1) : authorityHost;
        this.tokenUri = URI.create(host + "/" + tenantId + "/oauth2/v2.0/token");
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.scope = scope;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.clock = clock;
    }

    @Override
    public synchronized AccessToken token() {
        var now = clock.instant();
        if (cached != null && cached.isValidAt(now.plus(REFRESH_MARGIN))) {
            return cached;
        }

        var body = "grant_type=client_credentials&client_id=%s&client_secret=%s&scope=%s"
                .formatted(encode(clientId), encode(clientSecret), encode(scope));
        try {
            var request = HttpRequest.newBuilder()
                    .uri(tokenUri)
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new CredentialException("token request failed (HTTP %d): %s"
                        .formatted(response.statusCode(), response.body()));
            }

            var json = objectMapper.readTree(response.body());
            var accessToken = json.path("access_token").asText("");
            if (accessToken.isEmpty()) {
                throw new CredentialException("token response carried no access_token");
            }
            long expiresIn = json.path("expires_in").asLong(0);
            cached = new AccessToken(accessToken, now.plusSeconds(expiresIn));
            log.info("Obtained access token for client {} (expires in {}s)", clientId, expiresIn);
            return cached;
        } catch (IOException e) {
            throw new CredentialException("requesting access token from " + tokenUri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CredentialException("interrupted while requesting access token", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
