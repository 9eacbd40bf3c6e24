package com.phillippitts.airplay.service.fingerprint;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Exact-match key of a fingerprint: lower-case hex SHA-256 over the raw sub-fingerprints
 * in big-endian order.
 */
public final class FingerprintDigest {

    private FingerprintDigest() {}

    public static String of(int[] raw) {
        ByteBuffer buffer = ByteBuffer.allocate(raw.length * Integer.BYTES);
        for (int value : raw) {
            buffer.putInt(value);
        }
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(buffer.array()));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
