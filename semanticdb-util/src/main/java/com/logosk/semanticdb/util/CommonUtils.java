package com.logosk.semanticdb.util;

import com.google.common.base.Strings;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

public class CommonUtils {

    /**
     * Builds an identifier of the form {@code prefix + first n hex chars of a random UUID}.
     * Dashes are dropped so the suffix is always {@code length} hex characters.
     *
     * @param prefix the prefix to prepend, may be empty
     * @param length number of hex characters to keep, 1..32
     * @return the generated identifier
     */
    public static String shortId(String prefix, int length) {
        if (length < 1 || length > 32) {
            throw new IllegalArgumentException("length must be between 1 and 32, was " + length);
        }
        String hex = UUID.randomUUID().toString().replace("-", "");
        return Strings.nullToEmpty(prefix) + hex.substring(0, length);
    }

    /**
     * Hashes the UTF-8 bytes of the input with the named algorithm and returns lower-case hex.
     *
     * @param algorithm a {@link MessageDigest} algorithm name such as {@code SHA3-256}
     * @param input the text to digest
     * @return the hex digest
     */
    public static String digestHex(String algorithm, String input) {
        if (input == null) {
            throw new IllegalArgumentException("input can not be null");
        }

        try {
            MessageDigest messageDigest = MessageDigest.getInstance(algorithm);
            byte[] array = messageDigest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(array);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Digest algorithm not available: " + algorithm, e);
        }
    }

    public static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
