package com.stateset.local.auth.issuer;

import java.time.Instant;

/**
 * Issues admin JWTs that the API accepts, without calling the API.
 */
public interface LocalTokenIssuer {
    record Issued(String token, long expiresInSeconds, Instant expiresAt){}

    Issued issueAdminToken();
}
