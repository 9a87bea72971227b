/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.exceptions;

import static com.aws.greengrass.fetcher.exceptions.FetchErrorCode.INVALID_ARGUMENT;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class InvalidUriException extends FetchException {
    static final long serialVersionUID = -4407150285939207311L;

    public InvalidUriException(String message) {
        super(message, INVALID_ARGUMENT);
    }

    public InvalidUriException(String message, Throwable cause) {
        super(message, cause, INVALID_ARGUMENT);
    }
}
