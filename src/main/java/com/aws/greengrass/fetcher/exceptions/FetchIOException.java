/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.exceptions;

import java.io.IOException;

import static com.aws.greengrass.fetcher.exceptions.FetchErrorCode.IO_ERROR;

/**
 * Local filesystem failure: directory creation, write or rename.
 */
@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class FetchIOException extends FetchException {
    static final long serialVersionUID = -3110487298465210358L;

    public FetchIOException(String message, IOException cause) {
        super(message, cause, IO_ERROR);
    }

    public FetchIOException(String message, IOException cause, FetchErrorCode errorCode) {
        super(message, cause, IO_ERROR);
        addErrorCode(errorCode);
    }
}
