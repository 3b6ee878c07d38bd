package com.landfall.runcommand.credential;

import java.time.Instant;

/**
 * Serves a pre-issued bearer token, e.g. from {@code az account get-access-token}.
 */
public class StaticCredentialProvider implements CredentialProvider {

    private final AccessToken token;

    public StaticCredentialProvider(String token) {
        if (token == null || token.isBlank()) {
            throw new CredentialException("static access token is empty");
        }
        this.token = new AccessToken(token, Instant.MAX);
    }

    @Override
    public AccessToken token() {
        return token;
    }
}
