/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.exceptions;

public enum FetchErrorType {
    NONE,
    REQUEST_ERROR,
    NETWORK_ERROR,
    HTTP_ERROR,
    SERVER_ERROR,
    DEVICE_ERROR,
    PERMISSION_ERROR
}
