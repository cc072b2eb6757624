package com.stateset.local.auth.issuer.sign;

import java.util.Base64;

/**
 * URL-safe base64 without trailing padding, as used by every JWS segment.
 */
public final class Base64Url {
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private Base64Url() {}

    public static String encode(byte[] data) {
        return ENCODER.encodeToString(data);
    }

    public static byte[] decode(String segment) {
        return DECODER.decode(segment);
    }
}
