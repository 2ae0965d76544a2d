/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.common;

import io.fabric8.kubernetes.api.model.IntOrString;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Class with various utility methods
 */
public final class Util {
    /**
     * Length of the hash stubs used in generated names and labels
     */
    public static final int HASH_STUB_LENGTH = 8;

    private Util() { }

    /**
     * Gets the first 8 characters from a SHA-1 hash of the provided String
     *
     * @param   toBeHashed   String for which the hash will be returned
     * @return              First 8 characters of the SHA-1 hash
     */
    public static String hashStub(String toBeHashed)   {
        return hashStub(toBeHashed.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Gets the first 8 characters from a SHA-1 hash of the provided byte array
     *
     * @param   toBeHashed  Byte array for which the hash will be returned
     * @return              First 8 characters of the SHA-1 hash
     */
    public static String hashStub(byte[] toBeHashed)   {
        byte[] digest = sha1Digest(toBeHashed);
        return String.format("%040x", new BigInteger(1, digest)).substring(0, HASH_STUB_LENGTH);
    }

    /**
     * Get a SHA-1 hash of the provided byte array
     *
     * @param toBeHashed    Byte array for which the hash will be returned
     * @return              SHA-1 hash
     */
    public static byte[] sha1Digest(byte[] toBeHashed) {
        try {
            // Only used to tell template generations apart, not for security
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            return sha1.digest(toBeHashed);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("Failed to get SHA-1 hash", e);
        }
    }

    /**
     * Resolves a value which is either an absolute number or a percentage (for example {@code 25%}) of a total.
     *
     * @param value         Integer or percentage. Null is treated as 0.
     * @param total         Total the percentage is relative to
     * @param roundUp       Whether fractions of percentages should be rounded up (otherwise they are rounded down)
     *
     * @return  The absolute value
     *
     * @throws IllegalArgumentException if the value is neither a number nor a valid percentage
     */
    public static int scaledValueFromIntOrPercent(IntOrString value, int total, boolean roundUp) {
        if (value == null) {
            return 0;
        } else if (value.getIntVal() != null) {
            return value.getIntVal();
        }

        String str = value.getStrVal();
        if (str == null || !str.endsWith("%")) {
            throw new IllegalArgumentException("Invalid value " + str + ": expected an integer or a percentage");
        }

        int percent;
        try {
            percent = Integer.parseInt(str.substring(0, str.length() - 1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid percentage " + str, e);
        }

        if (percent < 0) {
            throw new IllegalArgumentException("Invalid percentage " + str + ": must not be negative");
        }

        long scaled = (long) percent * total;
        return (int) (roundUp ? (scaled + 99) / 100 : scaled / 100);
    }
}
