package com.landfall.runcommand.arm;

import com.landfall.runcommand.CommandChannel;
import com.landfall.runcommand.credential.ClientSecretCredentialProvider;
import com.landfall.runcommand.credential.CredentialProvider;
import com.landfall.runcommand.credential.StaticCredentialProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.net.http.HttpClient;

/**
 * Spring configuration for the managed-cluster run-command channel.
 * Active unless {@code landfall.channel.provider} selects another channel.
 */
@Configuration
@ConditionalOnProperty(name = "landfall.channel.provider", havingValue = "arm", matchIfMissing = true)
@EnableConfigurationProperties(ArmProperties.class)
public class ArmChannelConfig {

    private static final Logger log = LoggerFactory.getLogger(ArmChannelConfig.class);

    @Bean
    public HttpClient armHttpClient(ArmProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Lazy so commands that never reach the cluster (help, classify) run without credentials.
     */
    @Bean
    @Lazy
    public CredentialProvider credentialProvider(ArmProperties properties, HttpClient armHttpClient) {
        var credential = properties.getCredential();
        if (credential.getAccessToken() != null && !credential.getAccessToken().isBlank()) {
            log.info("Using static access token for {}", properties.getEndpoint());
            return new StaticCredentialProvider(credential.getAccessToken());
        }
        log.info("Using client credentials for client {} in tenant {}", credential.getClientId(), credential.getTenantId());
        return new ClientSecretCredentialProvider(
                credential.getAuthorityHost(), credential.getTenantId(), credential.getClientId(),
                credential.getClientSecret(), scope(properties.getEndpoint()), armHttpClient);
    }

    @Bean
    public CommandChannel armRunCommandChannel(ArmProperties properties, @Lazy CredentialProvider credentialProvider,
                                               HttpClient armHttpClient) {
        return new ArmRunCommandChannel(properties, credentialProvider, armHttpClient);
    }

    static String scope(String endpoint) {
        var base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        return base + "/.default";
    }
}
