/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins.docker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * Schema 2 manifest list (OCI image index): one image manifest per platform. It references no layers itself.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ManifestList implements ImageManifest {
    public static final String DEFAULT_OS = "linux";
    public static final String DEFAULT_ARCHITECTURE = "amd64";

    private int schemaVersion;
    private String mediaType;
    private List<Entry> manifests;

    @Override
    public List<Descriptor> layerDescriptors() {
        return Collections.emptyList();
    }

    /**
     * Pick the manifest for a platform, falling back to the first entry.
     *
     * @param os           operating system, e.g. linux
     * @param architecture architecture, e.g. amd64
     * @return the matching entry
     */
    public Entry select(String os, String architecture) {
        for (Entry e : manifests) {
            Platform p = e.getPlatform();
            if (p != null && os.equals(p.getOs()) && architecture.equals(p.getArchitecture())) {
                return e;
            }
        }
        return manifests.get(0);
    }

    @Data
    @NoArgsConstructor
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry extends Descriptor {
        private Platform platform;

        public Entry(String mediaType, String digest, Long size, Platform platform) {
            super(mediaType, digest, size);
            this.platform = platform;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Platform {
        private String architecture;
        private String os;
        private String variant;
    }
}
