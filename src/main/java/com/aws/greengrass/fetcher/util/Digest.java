/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Content digests of the form {@code <algorithm>:<hex>}.
 */
public final class Digest {
    // Every implementation of the Java platform is required to support SHA-256.
    public static final String SHA_256 = "SHA-256";
    public static final String SHA256_PREFIX = "sha256";
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    // <algorithm+hex> ; example digest - sha256:c4ffb87b09eba99383ee89b309d6d521
    // algorithm components may be joined by + . _ or -, as in sha256+b64
    public static final Pattern DIGEST_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9]*(?:[+._-][A-Za-z][A-Za-z0-9]*)*"
            + ":[0-9a-fA-F]{32,}$");

    private Digest() {
    }

    public static boolean isDigest(String s) {
        return s != null && DIGEST_PATTERN.matcher(s).matches();
    }

    /**
     * Create a message digest able to verify the given content digest, if its algorithm is one the JVM knows.
     *
     * @param contentDigest digest in {@code <algorithm>:<hex>} form
     * @return message digest, empty for algorithms that are not verified
     */
    public static Optional<MessageDigest> messageDigestFor(String contentDigest) {
        if (!isDigest(contentDigest)) {
            return Optional.empty();
        }
        String algorithm = contentDigest.substring(0, contentDigest.indexOf(':')).toLowerCase(Locale.ROOT);
        if (!SHA256_PREFIX.equals(algorithm)) {
            return Optional.empty();
        }
        try {
            return Optional.of(MessageDigest.getInstance(SHA_256));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(SHA_256 + " is not available on this JVM", e);
        }
    }

    /**
     * Render a finished message digest in the content digest form.
     *
     * @param messageDigest digest that has consumed all the content
     * @return {@code sha256:<hex>}
     */
    public static String toContentDigest(MessageDigest messageDigest) {
        byte[] hash = messageDigest.digest();
        StringBuilder sb = new StringBuilder(SHA256_PREFIX.length() + 1 + hash.length * 2).append(SHA256_PREFIX)
                .append(':');
        for (byte b : hash) {
            sb.append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
        }
        return sb.toString();
    }

    /**
     * Compare two digest strings, ignoring the case of the hex part.
     * @param digest1 first digest to compare
     * @param digest2 second digest to compare
     * @return whether two digests are equal
     */
    public static boolean isEqual(String digest1, String digest2) {
        return MessageDigest.isEqual(digest1.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8),
                digest2.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
    }
}
