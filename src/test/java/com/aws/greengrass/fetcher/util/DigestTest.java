/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.util;

import com.aws.greengrass.fetcher.models.DockerNames;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DigestTest {
    private static final String HEX_64 = "abababababababababababababababababababababababababababababababab"; // "ab" x 32

    @ParameterizedTest
    @ValueSource(strings = {"sha256:" + "ab", "sha256", "sha256:" + "zz" + "ab" + "cdef0123456789abcdef0123456789ab",
            ":abababababababababababababababababab", "256sha:" + "abababababababababababababababababab", ""})
    void GIVEN_malformed_digest_WHEN_checked_THEN_rejected_everywhere(String digest) {
        assertFalse(Digest.isDigest(digest));
        assertFalse(DockerNames.isDigest(digest));
    }

    @ParameterizedTest
    @ValueSource(strings = {"sha256:" + HEX_64, "SHA512:" + HEX_64 + HEX_64, "sha256+b64:" + HEX_64,
            "multihash.sha256:" + HEX_64})
    void GIVEN_well_formed_digest_WHEN_checked_THEN_accepted_by_both_grammars(String digest) {
        assertTrue(Digest.isDigest(digest));
        assertTrue(DockerNames.isDigest(digest));
        assertTrue(DockerNames.isReference(digest));
    }

    @Test
    void GIVEN_content_WHEN_digested_THEN_lower_case_sha256_form() {
        MessageDigest md = Digest.messageDigestFor("sha256:" + HEX_64).get();
        md.update("hello".getBytes(StandardCharsets.UTF_8));

        assertThat(Digest.toContentDigest(md),
                is("sha256:2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824"));
    }

    @Test
    void GIVEN_unverifiable_algorithm_WHEN_message_digest_for_THEN_empty() {
        assertThat(Digest.messageDigestFor("sha512:" + HEX_64 + HEX_64), is(Optional.empty()));
        assertThat(Digest.messageDigestFor("not a digest"), is(Optional.empty()));
    }

    @Test
    void GIVEN_digests_differing_in_hex_case_WHEN_compared_THEN_equal() {
        assertTrue(Digest.isEqual("sha256:" + HEX_64.toUpperCase(), "sha256:" + HEX_64));
        assertFalse(Digest.isEqual("sha256:" + HEX_64, "sha256:" + "cd".repeat(32)));
    }
}
