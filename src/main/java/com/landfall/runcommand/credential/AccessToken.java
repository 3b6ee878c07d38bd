package com.landfall.runcommand.credential;

import java.time.Instant;
import java.util.Objects;

/**
 * Bearer token with a known lifetime.
 *
 * @param token     the bearer value
 * @param expiresAt instant after which the token must not be used; {@link Instant#MAX} when unbounded
 */
public record AccessToken(String token, Instant expiresAt) {

    public AccessToken {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public boolean isValidAt(Instant instant) {
        return instant.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "AccessToken[expiresAt=" + expiresAt + "]";
    }
}
