/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.exceptions;

import lombok.Getter;

import static com.aws.greengrass.fetcher.exceptions.FetchErrorCode.INTEGRITY_ERROR;

@Getter
@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class ArtifactIntegrityException extends FetchException {
    static final long serialVersionUID = 8805630473612986601L;

    private final String expected;
    private final String actual;

    public ArtifactIntegrityException(String message, String expected, String actual) {
        super(String.format("%s. Expected %s, actual %s", message, expected, actual), INTEGRITY_ERROR);
        this.expected = expected;
        this.actual = actual;
    }

    public static ArtifactIntegrityException sizeMismatch(String artifact, long expected, long actual) {
        return new ArtifactIntegrityException("Size of " + artifact + " does not match", Long.toString(expected),
                Long.toString(actual));
    }
}
