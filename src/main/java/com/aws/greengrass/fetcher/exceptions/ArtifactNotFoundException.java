/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.exceptions;

import static com.aws.greengrass.fetcher.exceptions.FetchErrorCode.NOT_FOUND;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class ArtifactNotFoundException extends FetchException {
    static final long serialVersionUID = 3150432788760016623L;

    public ArtifactNotFoundException(String message) {
        super(message, NOT_FOUND);
    }

    public ArtifactNotFoundException(String message, Throwable cause) {
        super(message, cause, NOT_FOUND);
    }
}
