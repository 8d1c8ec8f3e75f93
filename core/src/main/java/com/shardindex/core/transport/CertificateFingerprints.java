package com.shardindex.core.transport;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.cert.Certificate;
import java.security.cert.CertificateEncodingException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * SHA-256 certificate fingerprints as used by the worker allowlists.
 */
public final class CertificateFingerprints {
    private CertificateFingerprints() {
    }

    private static final String OPENSSL_PREFIX = "sha256 fingerprint=";
    private static final int SHA256_HEX_LENGTH = 64;

    /**
     * Lower-case hex SHA-256 over the DER encoding of {@code certificate}.
     */
    public static String sha256Hex(Certificate certificate) {
        try {
            return sha256Hex(certificate.getEncoded());
        } catch (CertificateEncodingException e) {
            throw new IllegalArgumentException("certificate cannot be encoded", e);
        }
    }

    public static String sha256Hex(byte[] der) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(der));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Normalises a configured fingerprint.
     * <p>
     * Accepts the plain hex form, the colon-separated form and the {@code openssl x509
     * -fingerprint -sha256} output ({@code SHA256 Fingerprint=AB:CD:...}).
     * </p>
     *
     * @param raw Configured value
     * @return 64 lower-case hex digits
     * @throws IllegalArgumentException if the value is not a SHA-256 fingerprint
     */
    public static String normalize(String raw) {
        String value = raw.trim();
        if (value.toLowerCase(Locale.ROOT).startsWith(OPENSSL_PREFIX)) {
            value = value.substring(OPENSSL_PREFIX.length());
        }
        StringBuilder hex = new StringBuilder(SHA256_HEX_LENGTH);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == ':' || Character.isWhitespace(c)) {
                continue;
            }
            if (Character.digit(c, 16) < 0) {
                throw new IllegalArgumentException("invalid character '" + c + "' in fingerprint: " + raw);
            }
            hex.append(Character.toLowerCase(c));
        }
        if (hex.length() != SHA256_HEX_LENGTH) {
            throw new IllegalArgumentException("SHA-256 fingerprint must have 64 hex digits, got "
                    + hex.length() + ": " + raw);
        }
        return hex.toString();
    }
}
