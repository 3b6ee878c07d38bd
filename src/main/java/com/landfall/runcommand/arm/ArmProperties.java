package com.landfall.runcommand.arm;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Managed-cluster API settings bound from {@code landfall.arm.*}.
 * <p>
 * Not annotated with {@code @Component}; enabled by {@code ArmChannelConfig}
 * when the arm channel is active.
 */
@ConfigurationProperties(prefix = "landfall.arm")
public class ArmProperties {

    /** Resource manager endpoint */
    private String endpoint = "https://management.azure.com";

    /** API version of the managedClusters run-command operations */
    private String apiVersion = "2023-08-01";

    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Per-request timeout for submit and poll calls (not the command's own runtime) */
    private Duration requestTimeout = Duration.ofSeconds(60);

    private Credential credential = new Credential();

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Credential getCredential() {
        return credential;
    }

    public void setCredential(Credential credential) {
        this.credential = credential;
    }

    public static class Credential {

        /** Pre-issued bearer token; takes precedence over client credentials when set */
        private String accessToken = "";

        private String authorityHost = "https://login.microsoftonline.com";
        private String tenantId = "";
        private String clientId = "";
        private String clientSecret = "";

        public String getAccessToken() {
            return accessToken;
        }

        public void setAccessToken(String accessToken) {
            this.accessToken = accessToken;
        }

        public String getAuthorityHost() {
            return authorityHost;
        }

        public void setAuthorityHost(String authorityHost) {
            this.authorityHost = authorityHost;
        }

        public String getTenantId() {
            return tenantId;
        }

        public void setTenantId(String tenantId) {
            this.tenantId = tenantId;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public void setClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
        }
    }
}
