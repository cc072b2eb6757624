package com.stateset.local.auth.issuer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Payload of a local admin token. Field names follow the API's claim schema;
 * {@link #toMembers()} maps them to their JWT member names.
 */
public record AdminClaims(
    String subject,
    String displayName,
    String email,
    List<String> roles,
    List<String> permissions,
    String tenantId,
    String tokenId,
    long issuedAt,
    long expiresAt,
    long notBefore,
    String issuer,
    String audience,
    String scope
) {
    public static final String ISSUER = "stateset-auth";
    public static final String AUDIENCE = "stateset-api";
    public static final String DISPLAY_NAME = "Local Admin";
    public static final String EMAIL = "admin@example.com";
    public static final List<String> ROLES = List.of("admin");

    public AdminClaims {
        roles = List.copyOf(roles);
        permissions = List.copyOf(permissions);
    }

    public static AdminClaims localAdmin(UUID subject, UUID tokenId, long issuedAt, long lifetimeSeconds) {
        return new AdminClaims(
            subject.toString(),
            DISPLAY_NAME,
            EMAIL,
            ROLES,
            DefaultPermissions.ALL,
            null,
            tokenId.toString(),
            issuedAt,
            issuedAt + lifetimeSeconds,
            issuedAt,
            ISSUER,
            AUDIENCE,
            null);
    }

    /** All members, absent optional ones as explicit nulls. */
    public Map<String, Object> toMembers() {
        Map<String, Object> members = new HashMap<>();
        members.put("sub", subject);
        members.put("name", displayName);
        members.put("email", email);
        members.put("roles", roles);
        members.put("permissions", permissions);
        members.put("tenant_id", tenantId);
        members.put("jti", tokenId);
        members.put("iat", issuedAt);
        members.put("exp", expiresAt);
        members.put("nbf", notBefore);
        members.put("iss", issuer);
        members.put("aud", audience);
        members.put("scope", scope);
        return members;
    }
}
