package com.alertrelay.core.driver;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stable fingerprint derivation.
 *
 * <p>
 * The digest input is {@code name + ":" + sortedPairs} where
 * {@code sortedPairs} renders the label entries sorted by key as
 * {@code [('k1', 'v1'), ('k2', 'v2')]}. This keeps fingerprints identical to
 * those already stored by earlier deployments of the relay. The first
 * {@value #LENGTH} hex characters of the SHA-256 digest are kept.
 * </p>
 *
 * @since 1.0.0
 */
public final class Fingerprints {

    public static final int LENGTH = 16;

    private Fingerprints() {
        // utility class
    }

    /**
     * @param labels alert labels, may be {@code null}
     * @param name   alert name
     * @return 16 lowercase hex characters, independent of label iteration order
     */
    public static String generate(Map<String, String> labels, String name) {
        StringBuilder pairs = new StringBuilder("[");
        if (labels != null) {
            boolean first = true;
            for (Map.Entry<String, String> e : new TreeMap<>(labels).entrySet()) {
                if (!first) {
                    pairs.append(", ");
                }
                pairs.append('(').append(quote(e.getKey())).append(", ").append(quote(e.getValue())).append(')');
                first = false;
            }
        }
        pairs.append(']');
        return sha256Prefix(name + ":" + pairs);
    }

    /**
     * @return first {@value #LENGTH} hex characters of the SHA-256 of {@code input}
     */
    public static String sha256Prefix(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String quote(String value) {
        if (value == null) {
            return "None";
        }
        String v = value;
        char quote = v.indexOf('\'') >= 0 && v.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder().append(quote);
        for (char c : v.toCharArray()) {
            if (c == '\\' || c == quote) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append(quote).toString();
    }
}
