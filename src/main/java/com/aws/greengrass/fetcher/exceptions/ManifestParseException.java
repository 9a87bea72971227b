/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.exceptions;

import static com.aws.greengrass.fetcher.exceptions.FetchErrorCode.PARSE_ERROR;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class ManifestParseException extends FetchException {
    static final long serialVersionUID = -1338902764539821040L;

    public ManifestParseException(String message) {
        super(message, PARSE_ERROR);
    }

    public ManifestParseException(String message, Throwable cause) {
        super(message, cause, PARSE_ERROR);
    }
}
