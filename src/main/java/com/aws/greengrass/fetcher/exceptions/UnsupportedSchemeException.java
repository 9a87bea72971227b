/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.exceptions;

import static com.aws.greengrass.fetcher.exceptions.FetchErrorCode.UNSUPPORTED_SCHEME;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class UnsupportedSchemeException extends FetchException {
    static final long serialVersionUID = 1786123690845234452L;

    public UnsupportedSchemeException(String message) {
        super(message, UNSUPPORTED_SCHEME);
    }

    public UnsupportedSchemeException(String message, Throwable cause) {
        super(message, cause, UNSUPPORTED_SCHEME);
    }
}
