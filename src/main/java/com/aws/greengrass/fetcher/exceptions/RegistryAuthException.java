/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.exceptions;

import static com.aws.greengrass.fetcher.exceptions.FetchErrorCode.AUTH_ERROR;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class RegistryAuthException extends FetchException {
    static final long serialVersionUID = 7419082313456291730L;

    public RegistryAuthException(String message) {
        super(message, AUTH_ERROR);
    }

    public RegistryAuthException(String message, Throwable cause) {
        super(message, cause, AUTH_ERROR);
    }
}
