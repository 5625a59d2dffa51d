package com.krishnamouli.cohort.core;

import com.krishnamouli.cohort.exception.ConfigurationException;

import java.nio.charset.StandardCharsets;

/**
 * Deterministic bucketing of a (subject, experiment) pair into [0, 1).
 *
 * <p>
 * The hash is FNV-1a 64 over the UTF-8 bytes of {@code subject + "::" + experiment},
 * finished with the MurmurHash3 64-bit mixer so that keys differing in a single
 * trailing character still spread across the whole range. The experiment key is
 * part of the input, so a subject's position in one experiment says nothing
 * about its position in another.
 *
 * <p>
 * The output is part of the persisted contract: changing the hash or the
 * separator reshuffles every running experiment.
 */
public final class BucketingFunction {
    static final String SEPARATOR = "::";

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;
    private static final double UNIT_SCALE = 0x1.0p-53;

    private BucketingFunction() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Maps a subject and experiment to a value uniformly spread over [0, 1).
     */
    public static double bucket(String subjectKey, String experimentKey) {
        long hash = hash64(subjectKey + SEPARATOR + experimentKey);
        // Top 53 bits fill a double mantissa exactly
        return (hash >>> 11) * UNIT_SCALE;
    }

    /**
     * Picks the equal-width interval of [0, 1) that contains {@code value}.
     *
     * @param value        a bucket value in [0, 1)
     * @param variantCount number of variants, must be positive
     * @return index in [0, variantCount)
     */
    public static int chooseVariant(double value, int variantCount) {
        if (variantCount <= 0) {
            throw new ConfigurationException("Variant count must be positive, got " + variantCount);
        }
        if (!(value >= 0.0 && value < 1.0)) {
            throw new IllegalArgumentException("Bucket value must be within [0, 1), got " + value);
        }
        int index = (int) (value * variantCount);
        // Guards against rounding up at the top of the range
        return Math.min(index, variantCount - 1);
    }

    static long hash64(String input) {
        byte[] bytes = input.getBytes(StandardCharsets.UTF_8);
        long hash = FNV_OFFSET_BASIS;
        for (byte b : bytes) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return fmix64(hash);
    }

    private static long fmix64(long k) {
        k ^= k >>> 33;
        k *= 0xff51afd7ed558ccdL;
        k ^= k >>> 33;
        k *= 0xc4ceb9fe1a85ec53L;
        k ^= k >>> 33;
        return k;
    }
}
