/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.exceptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// root class for all fetch failures, hosting the error codes that classify them
@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class FetchException extends Exception {
    static final long serialVersionUID = -2761823157307251127L;

    protected final List<FetchErrorCode> errorCodes = new ArrayList<>();

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public FetchException(String message, FetchErrorCode errorCode) {
        super(message);
        addErrorCode(errorCode);
    }

    public FetchException(String message, Throwable cause, FetchErrorCode errorCode) {
        super(message, cause);
        addErrorCode(errorCode);
    }

    public List<FetchErrorCode> getErrorCodes() {
        return Collections.unmodifiableList(errorCodes);
    }

    /**
     * The most specific error code, i.e. the last one that was attached.
     *
     * @return error code, {@link FetchErrorCode#FETCH_FAILURE} when none was attached
     */
    public FetchErrorCode getErrorCode() {
        return errorCodes.isEmpty() ? FetchErrorCode.FETCH_FAILURE : errorCodes.get(errorCodes.size() - 1);
    }

    protected void addErrorCode(FetchErrorCode errorCode) {
        errorCodes.add(errorCode);
    }
}
