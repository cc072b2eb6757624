package com.stateset.local.auth.issuer;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

import com.stateset.local.auth.LocalTokenSettings;
import com.stateset.local.auth.issuer.sign.Base64Url;
import com.stateset.local.auth.issuer.sign.HmacSha256Signer;

import lombok.extern.slf4j.Slf4j;

/**
 * HS256 implementation. Header and claims are written as canonical JSON so the
 * same claims and secret always produce the same token.
 */
@Slf4j
public final class HmacLocalTokenIssuer implements LocalTokenIssuer {
    private final HmacSha256Signer signer;
    private final long lifetimeSeconds;
    private final Clock clock;
    private final Supplier<UUID> ids;

    public HmacLocalTokenIssuer(String secret, long lifetimeSeconds, Clock clock, Supplier<UUID> ids) {
        if (lifetimeSeconds <= 0) {
            throw new IllegalArgumentException("lifetimeSeconds must be positive");
        }
        this.signer = HmacSha256Signer.forSecret(secret);
        this.lifetimeSeconds = lifetimeSeconds;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    public HmacLocalTokenIssuer(LocalTokenSettings settings, Clock clock) {
        this(settings.secret(), settings.lifetimeSeconds(), clock, UUID::randomUUID);
    }

    @Override
    public Issued issueAdminToken() {
        return issue(clock.instant());
    }

    public Issued issue(Instant now) {
        long iat = now.getEpochSecond();
        if (lifetimeSeconds > Instant.MAX.getEpochSecond() - iat) {
            throw new IllegalArgumentException("Token lifetime of " + lifetimeSeconds
                + " seconds expires after " + Instant.MAX);
        }
        AdminClaims claims = AdminClaims.localAdmin(ids.get(), ids.get(), iat, lifetimeSeconds);

        String jwt = sign(TokenHeader.HS256_JWT, claims);
        log.debug("Issued local admin token jti={} exp={}", claims.tokenId(), claims.expiresAt());

        return new Issued(jwt, lifetimeSeconds, Instant.ofEpochSecond(claims.expiresAt()));
    }

    public String sign(TokenHeader header, AdminClaims claims) {
        String headerSegment = Base64Url.encode(CanonicalJson.encode(header.toMembers()));
        String payloadSegment = Base64Url.encode(CanonicalJson.encode(claims.toMembers()));
        return headerSegment + "." + payloadSegment + "." + signer.signSegments(headerSegment, payloadSegment);
    }

    /** One-shot form for callers that already hold the raw values. */
    public static String issue(String secret, long lifetimeSeconds, Instant now) {
        return new HmacLocalTokenIssuer(secret, lifetimeSeconds, Clock.systemUTC(), UUID::randomUUID)
            .issue(now)
            .token();
    }
}
