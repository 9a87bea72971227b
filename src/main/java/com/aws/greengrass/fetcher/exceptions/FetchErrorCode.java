/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.exceptions;

import lombok.Getter;

public enum FetchErrorCode {
    /* Generic types */
    FETCH_FAILURE(FetchErrorType.NONE),

    /* Request errors, fetch never starts */
    INVALID_ARGUMENT(FetchErrorType.REQUEST_ERROR),
    CONFIGURATION_ERROR(FetchErrorType.REQUEST_ERROR),
    UNSUPPORTED_SCHEME(FetchErrorType.REQUEST_ERROR),
    UNKNOWN_PLUGIN(FetchErrorType.REQUEST_ERROR),

    /* Back end errors */
    NOT_FOUND(FetchErrorType.REQUEST_ERROR),
    TRANSPORT_ERROR(FetchErrorType.NETWORK_ERROR),
    HTTP_REQUEST_ERROR(FetchErrorType.HTTP_ERROR),
    PROCESS_EXIT_ERROR(FetchErrorType.SERVER_ERROR),
    AUTH_ERROR(FetchErrorType.PERMISSION_ERROR),
    TIMEOUT(FetchErrorType.NETWORK_ERROR),

    /* Content errors */
    PARSE_ERROR(FetchErrorType.SERVER_ERROR),
    INTEGRITY_ERROR(FetchErrorType.SERVER_ERROR),

    /* Local file issues */
    IO_ERROR(FetchErrorType.DEVICE_ERROR),
    IO_WRITE_ERROR(FetchErrorType.DEVICE_ERROR),
    IO_READ_ERROR(FetchErrorType.DEVICE_ERROR);

    @Getter
    private final FetchErrorType errorType;

    FetchErrorCode(FetchErrorType errorType) {
        this.errorType = errorType;
    }
}
