/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CoerceTest {

    @Test
    void GIVEN_duration_forms_WHEN_to_duration_THEN_parsed() {
        assertEquals(Duration.ofSeconds(30), Coerce.toDuration("PT30S"));
        assertEquals(Duration.ofSeconds(30), Coerce.toDuration("30"));
        assertEquals(Duration.ofSeconds(30), Coerce.toDuration(30));
        assertEquals(Duration.ofMillis(1500), Coerce.toDuration(1.5));
        assertEquals(Duration.ofMinutes(2), Coerce.toDuration(Duration.ofMinutes(2)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "soon", "-5", "PT-1S"})
    void GIVEN_bad_duration_WHEN_to_duration_THEN_rejected(String value) {
        assertThrows(IllegalArgumentException.class, () -> Coerce.toDuration(value));
    }

    @Test
    void GIVEN_numbers_WHEN_to_int_THEN_parsed() {
        assertEquals(4, Coerce.toInt(4));
        assertEquals(4, Coerce.toInt(" 4 "));
        assertThrows(IllegalArgumentException.class, () -> Coerce.toInt("four"));
    }

    @Test
    void GIVEN_list_or_csv_WHEN_to_string_list_THEN_split() {
        assertEquals(Arrays.asList("a:5000", "b"), Coerce.toStringList("a:5000, b"));
        assertEquals(Arrays.asList("a", "b"), Coerce.toStringList(Arrays.asList("a", " b ", "")));
        assertEquals(Collections.emptyList(), Coerce.toStringList(null));
    }
}
