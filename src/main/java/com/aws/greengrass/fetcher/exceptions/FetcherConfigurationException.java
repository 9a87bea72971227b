/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.exceptions;

import static com.aws.greengrass.fetcher.exceptions.FetchErrorCode.CONFIGURATION_ERROR;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class FetcherConfigurationException extends FetchException {
    static final long serialVersionUID = 6523007710471361248L;

    public FetcherConfigurationException(String message) {
        super(message, CONFIGURATION_ERROR);
    }

    public FetcherConfigurationException(String message, Throwable cause) {
        super(message, cause, CONFIGURATION_ERROR);
    }
}
