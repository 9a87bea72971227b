/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins.docker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Schema 2 image manifest, docker or OCI flavored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ImageManifestV2 implements ImageManifest {
    private int schemaVersion;
    private String mediaType;
    private Descriptor config;
    private List<Descriptor> layers;

    @Override
    public List<Descriptor> layerDescriptors() {
        return layers;
    }
}
