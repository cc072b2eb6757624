package com.stateset.local.auth.issuer.sign;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HS256 signatures over a JWS signing input.
 */
public final class HmacSha256Signer {
    public static final String JCA_ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public HmacSha256Signer(byte[] secret) {
        if (secret == null || secret.length == 0) {
            throw new IllegalArgumentException("HMAC secret must not be empty");
        }
        this.key = new SecretKeySpec(Arrays.copyOf(secret, secret.length), JCA_ALGORITHM);
    }

    public static HmacSha256Signer forSecret(String secret) {
        if (secret == null) {
            throw new IllegalArgumentException("HMAC secret must not be empty");
        }
        return new HmacSha256Signer(secret.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] sign(byte[] signingInput) {
        try {
            Mac mac = Mac.getInstance(JCA_ALGORITHM);
            mac.init(key);
            return mac.doFinal(signingInput);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(JCA_ALGORITHM + " not available", e);
        } catch (InvalidKeyException e) {
            throw new IllegalStateException("Failed to initialise " + JCA_ALGORITHM, e);
        }
    }

    /** Signs {@code headerSegment.payloadSegment} and returns the encoded signature segment. */
    public String signSegments(String headerSegment, String payloadSegment) {
        String signingInput = headerSegment + "." + payloadSegment;
        return Base64Url.encode(sign(signingInput.getBytes(StandardCharsets.US_ASCII)));
    }
}
