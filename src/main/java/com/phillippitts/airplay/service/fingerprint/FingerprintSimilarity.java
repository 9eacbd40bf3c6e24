package com.phillippitts.airplay.service.fingerprint;

/**
 * Bit-error-rate comparison of raw Chromaprint fingerprints.
 *
 * <p>Each element of a raw fingerprint is a 32-bit sub-fingerprint covering ~0.12s of audio.
 * Two captures of the same recording differ by a time shift and by noise flipping a few bits,
 * so the score is the best {@code 1 - differingBits / comparedBits} over alignment offsets.
 */
public final class FingerprintSimilarity {

    /** Bits of a sub-fingerprint dropped when deriving its index key. */
    static final int KEY_SHIFT = 12;

    private FingerprintSimilarity() {}

    /**
     * Index key of a sub-fingerprint: its top 20 bits, which survive moderate noise.
     */
    public static int indexKey(int subFingerprint) {
        return subFingerprint >>> KEY_SHIFT;
    }

    /**
     * Best similarity over offsets in {@code [-maxOffset, maxOffset]}. Alignments whose overlap is
     * shorter than half of the shorter fingerprint are ignored.
     *
     * @return similarity in [0, 1]; 0 when either fingerprint is empty
     */
    public static double similarity(int[] a, int[] b, int maxOffset) {
        if (a.length == 0 || b.length == 0) {
            return 0.0;
        }
        int minOverlap = Math.max(1, Math.min(a.length, b.length) / 2);
        double best = 0.0;
        for (int offset = -maxOffset; offset <= maxOffset; offset++) {
            int startA = Math.max(0, offset);
            int startB = Math.max(0, -offset);
            int overlap = Math.min(a.length - startA, b.length - startB);
            if (overlap < minOverlap) {
                continue;
            }
            long errors = 0;
            for (int i = 0; i < overlap; i++) {
                errors += Integer.bitCount(a[startA + i] ^ b[startB + i]);
            }
            double score = 1.0 - (double) errors / (32.0 * overlap);
            if (score > best) {
                best = score;
                if (best == 1.0) {
                    break;
                }
            }
        }
        return best;
    }
}
