/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins.docker;

import com.aws.greengrass.fetcher.exceptions.ManifestParseException;
import com.aws.greengrass.fetcher.models.DockerNames;
import com.aws.greengrass.fetcher.util.SerializerFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Decodes manifest documents. The schema is chosen by the {@code schemaVersion} field alone, never by trying one
 * decoder after the other.
 */
public final class ManifestParser {
    public static final String MEDIA_TYPE_V1 = "application/vnd.docker.distribution.manifest.v1+json";
    public static final String MEDIA_TYPE_V1_SIGNED = "application/vnd.docker.distribution.manifest.v1+prettyjws";
    public static final String MEDIA_TYPE_V2 = "application/vnd.docker.distribution.manifest.v2+json";
    public static final String MEDIA_TYPE_LIST = "application/vnd.docker.distribution.manifest.list.v2+json";
    public static final String MEDIA_TYPE_OCI_MANIFEST = "application/vnd.oci.image.manifest.v1+json";
    public static final String MEDIA_TYPE_OCI_INDEX = "application/vnd.oci.image.index.v1+json";
    public static final List<String> ACCEPTED_MEDIA_TYPES = Collections.unmodifiableList(Arrays.asList(
            MEDIA_TYPE_V2, MEDIA_TYPE_LIST, MEDIA_TYPE_OCI_MANIFEST, MEDIA_TYPE_OCI_INDEX, MEDIA_TYPE_V1_SIGNED,
            MEDIA_TYPE_V1));

    private static final String SCHEMA_VERSION = "schemaVersion";
    private static final ObjectMapper MAPPER = SerializerFactory.getFailSafeJsonObjectMapper();

    private ManifestParser() {
    }

    /**
     * Decode a manifest.
     *
     * @param body raw document
     * @return {@link ImageManifestV1}, {@link ImageManifestV2} or {@link ManifestList}
     * @throws ManifestParseException if the document is not JSON, has no integral schemaVersion, has an unknown
     *                                schemaVersion or lacks the fields its schema requires
     */
    public static ImageManifest parse(byte[] body) throws ManifestParseException {
        JsonNode tree;
        try {
            tree = MAPPER.readTree(body);
        } catch (IOException e) {
            throw new ManifestParseException("Manifest is not valid JSON", e);
        }
        if (tree == null || !tree.isObject()) {
            throw new ManifestParseException("Manifest is not a JSON object");
        }
        JsonNode version = tree.get(SCHEMA_VERSION);
        if (version == null || !version.isIntegralNumber()) {
            throw new ManifestParseException("Manifest has no integral schemaVersion");
        }
        switch (version.asInt()) {
            case 1:
                return validate(decode(tree, ImageManifestV1.class));
            case 2:
                if (isManifestList(tree)) {
                    return validate(decode(tree, ManifestList.class));
                }
                return validate(decode(tree, ImageManifestV2.class));
            default:
                throw new ManifestParseException("Unsupported manifest schemaVersion " + version.asText());
        }
    }

    private static boolean isManifestList(JsonNode tree) {
        String mediaType = tree.path("mediaType").asText("");
        if (MEDIA_TYPE_LIST.equals(mediaType) || MEDIA_TYPE_OCI_INDEX.equals(mediaType)) {
            return true;
        }
        // OCI indexes may leave out their media type
        return mediaType.isEmpty() && tree.has("manifests") && !tree.has("layers");
    }

    private static <T> T decode(JsonNode tree, Class<T> type) throws ManifestParseException {
        try {
            return MAPPER.treeToValue(tree, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ManifestParseException("Manifest does not match " + type.getSimpleName(), e);
        }
    }

    private static ImageManifestV1 validate(ImageManifestV1 manifest) throws ManifestParseException {
        if (manifest.getName() == null || manifest.getName().isEmpty()) {
            throw new ManifestParseException("Schema 1 manifest has no name");
        }
        if (manifest.getFsLayers() == null) {
            throw new ManifestParseException("Schema 1 manifest has no fsLayers");
        }
        for (ImageManifestV1.FsLayer layer : manifest.getFsLayers()) {
            if (layer == null || !DockerNames.isDigest(layer.getBlobSum())) {
                throw new ManifestParseException("Schema 1 manifest has an fsLayer without a valid blobSum");
            }
        }
        return manifest;
    }

    private static ImageManifestV2 validate(ImageManifestV2 manifest) throws ManifestParseException {
        if (manifest.getLayers() == null) {
            throw new ManifestParseException("Schema 2 manifest has no layers");
        }
        for (Descriptor layer : manifest.getLayers()) {
            validate(layer, "layer");
        }
        if (manifest.getConfig() != null) {
            validate(manifest.getConfig(), "config");
        }
        return manifest;
    }

    private static ManifestList validate(ManifestList list) throws ManifestParseException {
        if (list.getManifests() == null || list.getManifests().isEmpty()) {
            throw new ManifestParseException("Manifest list has no manifests");
        }
        for (ManifestList.Entry entry : list.getManifests()) {
            validate(entry, "manifest list entry");
        }
        return list;
    }

    private static void validate(Descriptor descriptor, String what) throws ManifestParseException {
        if (descriptor == null || !DockerNames.isDigest(descriptor.getDigest())) {
            throw new ManifestParseException("Manifest has a " + what + " without a valid digest");
        }
        if (descriptor.getSize() == null || descriptor.getSize() < 0) {
            throw new ManifestParseException("Manifest has a " + what + " without a valid size");
        }
    }
}
