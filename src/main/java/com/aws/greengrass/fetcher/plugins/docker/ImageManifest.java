/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins.docker;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A parsed registry manifest of either schema generation.
 */
public interface ImageManifest {

    int getSchemaVersion();

    /**
     * Layer blobs in the order the document lists them. Schema 1 lists the most recent layer first; the order is
     * kept as is.
     *
     * @return layer descriptors, sizes unknown for schema 1
     */
    List<Descriptor> layerDescriptors();

    default List<String> layerDigests() {
        return layerDescriptors().stream().map(Descriptor::getDigest).collect(Collectors.toList());
    }
}
