/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.util;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import static com.aws.greengrass.fetcher.util.Utils.isEmpty;

/**
 * Lenient conversions of loosely typed configuration values.
 */
public final class Coerce {
    private static final Pattern SEPARATORS = Pattern.compile(" *, *");

    private Coerce() {
    }

    /**
     * Get an object as an integer.
     *
     * @param o object to convert.
     * @return resulting int.
     * @throws IllegalArgumentException if the value is not a number
     */
    public static int toInt(Object o) {
        if (o instanceof Number) {
            return ((Number) o).intValue();
        }
        if (o != null) {
            try {
                return Integer.parseInt(o.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not an integer: " + o, e);
            }
        }
        throw new IllegalArgumentException("Not an integer: null");
    }

    /**
     * Get an object as a duration. Numbers are seconds, strings are either ISO-8601 ({@code PT30S}) or seconds.
     *
     * @param o object to convert.
     * @return resulting duration.
     * @throws IllegalArgumentException if the value is neither form or is negative
     */
    public static Duration toDuration(Object o) {
        Duration d;
        if (o instanceof Duration) {
            d = (Duration) o;
        } else if (o instanceof Number) {
            d = Duration.ofMillis(Math.round(((Number) o).doubleValue() * 1000));
        } else if (o != null && !isEmpty(o.toString())) {
            String s = o.toString().trim();
            try {
                d = s.toUpperCase(Locale.ROOT).startsWith("P") ? Duration.parse(s)
                        : Duration.ofMillis(Math.round(Double.parseDouble(s) * 1000));
            } catch (DateTimeParseException | NumberFormatException e) {
                throw new IllegalArgumentException("Not a duration: " + s, e);
            }
        } else {
            throw new IllegalArgumentException("Not a duration: " + o);
        }
        if (d.isNegative()) {
            throw new IllegalArgumentException("Duration must not be negative: " + o);
        }
        return d;
    }

    /**
     * Convert an object to a list of strings. Collections are converted element by element, anything else
     * is split on commas.
     *
     * @param o object to convert.
     * @return list of non-empty strings, never null.
     */
    public static List<String> toStringList(Object o) {
        if (o == null) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        if (o instanceof Collection) {
            for (Object element : (Collection<?>) o) {
                if (element != null && !isEmpty(element.toString())) {
                    result.add(element.toString().trim());
                }
            }
            return result;
        }
        for (String s : SEPARATORS.split(o.toString().trim())) {
            if (!isEmpty(s)) {
                result.add(s);
            }
        }
        return result;
    }
}
