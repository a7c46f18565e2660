package com.atrium.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;

/**
 * HMAC algorithms accepted for administrator tokens.
 * <p>
 * The minimum secret length follows RFC 7518 §3.2: a key at least as long as the hash output.
 */
public enum SigningAlgorithm {

    HS256(Jwts.SIG.HS256, "HmacSHA256", 32),
    HS384(Jwts.SIG.HS384, "HmacSHA384", 48),
    HS512(Jwts.SIG.HS512, "HmacSHA512", 64);

    private final MacAlgorithm macAlgorithm;
    private final String jcaName;
    private final int minimumSecretBytes;

    SigningAlgorithm(MacAlgorithm macAlgorithm, String jcaName, int minimumSecretBytes) {
        this.macAlgorithm = macAlgorithm;
        this.jcaName = jcaName;
        this.minimumSecretBytes = minimumSecretBytes;
    }

    MacAlgorithm macAlgorithm() {
        return macAlgorithm;
    }

    String jcaName() {
        return jcaName;
    }

    /** JOSE header value, e.g. {@code HS256}. */
    public String headerName() {
        return macAlgorithm.getId();
    }

    public int minimumSecretBytes() {
        return minimumSecretBytes;
    }
}
