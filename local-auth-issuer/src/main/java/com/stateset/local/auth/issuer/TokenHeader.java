package com.stateset.local.auth.issuer;

import java.util.Map;

/**
 * JOSE header of an issued token.
 */
public record TokenHeader(String alg, String typ) {
    public static final TokenHeader HS256_JWT = new TokenHeader("HS256", "JWT");

    public Map<String, Object> toMembers() {
        return Map.of("alg", alg, "typ", typ);
    }
}
