/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins.docker;

import com.aws.greengrass.fetcher.models.Uri;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import javax.annotation.Nullable;

/**
 * What a {@code docker://} URI asks for: a manifest, a blob, or a whole image, in a repository of a registry.
 */
@Getter
@ToString
@AllArgsConstructor
public class DockerReference {
    private final Kind kind;
    private final Registry registry;
    private final String repository;
    @Nullable
    private final String tag;
    @Nullable
    private final String digest;
    private final Uri uri;

    /**
     * Tag or digest to request the manifest by; the digest wins when both are known.
     *
     * @return reference
     */
    public String getReference() {
        return digest == null ? tag : digest;
    }

    public boolean isDigestReference() {
        return digest != null;
    }

    public enum Kind {
        MANIFEST, BLOB, IMAGE
    }
}
