/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.exceptions;

import static com.aws.greengrass.fetcher.exceptions.FetchErrorCode.TIMEOUT;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class DownloadTimeoutException extends FetchException {
    static final long serialVersionUID = 5209377613208934467L;

    public DownloadTimeoutException(String message) {
        super(message, TIMEOUT);
    }

    public DownloadTimeoutException(String message, Throwable cause) {
        super(message, cause, TIMEOUT);
    }
}
