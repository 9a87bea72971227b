/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.exceptions;

import lombok.Getter;

import java.util.OptionalInt;

import static com.aws.greengrass.fetcher.exceptions.FetchErrorCode.HTTP_REQUEST_ERROR;
import static com.aws.greengrass.fetcher.exceptions.FetchErrorCode.PROCESS_EXIT_ERROR;
import static com.aws.greengrass.fetcher.exceptions.FetchErrorCode.TRANSPORT_ERROR;

/**
 * Non-success answer from a network or external-process back end.
 */
@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class TransportException extends FetchException {
    static final long serialVersionUID = -5810402117243977042L;

    // HTTP status or process exit code, -1 when the transport failed before producing one
    @Getter
    private final int status;

    public TransportException(String message, Throwable cause) {
        super(message, cause, TRANSPORT_ERROR);
        this.status = -1;
    }

    private TransportException(String message, int status, FetchErrorCode errorCode) {
        super(message, TRANSPORT_ERROR);
        addErrorCode(errorCode);
        this.status = status;
    }

    public static TransportException forHttpStatus(String message, int httpStatus) {
        return new TransportException(message, httpStatus, HTTP_REQUEST_ERROR);
    }

    public static TransportException forExitCode(String message, int exitCode) {
        return new TransportException(message, exitCode, PROCESS_EXIT_ERROR);
    }

    public OptionalInt getStatusCode() {
        return status < 0 ? OptionalInt.empty() : OptionalInt.of(status);
    }
}
