/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.exceptions;

import static com.aws.greengrass.fetcher.exceptions.FetchErrorCode.UNKNOWN_PLUGIN;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class UnknownPluginException extends FetchException {
    static final long serialVersionUID = -8233309117004372265L;

    public UnknownPluginException(String message) {
        super(message, UNKNOWN_PLUGIN);
    }

    public UnknownPluginException(String message, Throwable cause) {
        super(message, cause, UNKNOWN_PLUGIN);
    }
}
