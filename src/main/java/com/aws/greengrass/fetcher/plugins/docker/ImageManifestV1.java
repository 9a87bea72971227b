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
import java.util.stream.Collectors;

/**
 * Schema 1 image manifest. The detached {@code signatures} block of signed manifests is not read.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ImageManifestV1 implements ImageManifest {
    private int schemaVersion;
    private String name;
    private String tag;
    private String architecture;
    private List<FsLayer> fsLayers;

    @Override
    public List<Descriptor> layerDescriptors() {
        return fsLayers.stream().map(l -> new Descriptor(null, l.getBlobSum(), null)).collect(Collectors.toList());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FsLayer {
        private String blobSum;
    }
}
