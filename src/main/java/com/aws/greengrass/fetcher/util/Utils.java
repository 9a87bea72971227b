/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.util;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class Utils {
    public static final Path HOME_PATH = Paths.get(System.getProperty("user.home"));

    private Utils() {
    }

    /**
     * Returns true if the given string is null, empty, or only whitespace.
     *
     * @param s string to check.
     * @return true if it is null, empty, or only whitespace.
     */
    public static boolean isEmpty(String s) {
        if (s == null) {
            return true;
        }
        int len = s.length();
        for (int i = 0; i < len; i++) {
            if (!Character.isSpaceChar(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isNotEmpty(String s) {
        return !isEmpty(s);
    }

    /**
     * Get the last cause in the chain of causes (the first cause which happened).
     *
     * @param t throwable to get the cause of.
     * @return Throwable the ultimate cause.
     */
    public static Throwable getUltimateCause(Throwable t) {
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Expand a leading {@code ~/} to the user's home directory.
     *
     * @param s path string
     * @return path with the home directory substituted
     */
    public static String deTilde(String s) {
        if (s.startsWith("~/")) {
            return HOME_PATH.resolve(s.substring(2)).toString();
        }
        return s;
    }
}
