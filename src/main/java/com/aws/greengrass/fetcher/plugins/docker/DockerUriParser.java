/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins.docker;

import com.aws.greengrass.fetcher.FetcherFlags;
import com.aws.greengrass.fetcher.exceptions.InvalidUriException;
import com.aws.greengrass.fetcher.models.DockerNames;
import com.aws.greengrass.fetcher.models.Uri;
import com.aws.greengrass.fetcher.models.Uris;
import com.aws.greengrass.fetcher.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interprets and validates {@code docker://<registry>/<repository>?<kind>=<reference>} URIs.
 */
public final class DockerUriParser {
    public static final String INVALID_DOCKER_URI_MESSAGE = "Invalid docker URI %s. URI should follow the format of "
            + "`docker://[registry]/repository?manifest=<tag|digest>|blob=<digest>|image=<tag|digest>`";
    private static final Logger logger = LoggerFactory.getLogger(DockerUriParser.class);

    private DockerUriParser() {
    }

    /**
     * Extract the registry, repository and reference a docker URI points at.
     *
     * @param uri   docker URI
     * @param flags flags supplying the default registry and the registries spoken to over plain HTTP
     * @return reference
     * @throws InvalidUriException if the URI does not follow the docker grammar
     */
    public static DockerReference parse(Uri uri, FetcherFlags flags) throws InvalidUriException {
        if (!Uris.DOCKER.equals(uri.getScheme())) {
            throw new InvalidUriException(String.format(INVALID_DOCKER_URI_MESSAGE, uri));
        }

        // If no registry is specified, the default is docker hub's registry server
        String endpoint = Utils.isEmpty(uri.getHost()) ? flags.getDockerRegistry() : uri.getAuthority();
        if (!DockerNames.isRegistry(endpoint)) {
            throw new InvalidUriException(String.format(INVALID_DOCKER_URI_MESSAGE, uri) + ": bad registry "
                    + endpoint);
        }

        String repository = uri.getPath().startsWith("/") ? uri.getPath().substring(1) : uri.getPath();
        if (repository.isEmpty() || !DockerNames.isRepository(repository)) {
            throw new InvalidUriException(String.format(INVALID_DOCKER_URI_MESSAGE, uri) + ": bad repository '"
                    + repository + "'");
        }
        repository = DockerNames.canonicalRepository(endpoint, repository);

        DockerReference.Kind kind = null;
        String reference = null;
        for (DockerReference.Kind k : DockerReference.Kind.values()) {
            String value = uri.getQuery().get(queryKey(k));
            if (value != null) {
                if (kind != null) {
                    throw new InvalidUriException(String.format(INVALID_DOCKER_URI_MESSAGE, uri)
                            + ": more than one of manifest, blob and image");
                }
                kind = k;
                reference = value;
            }
        }
        if (kind == null) {
            throw new InvalidUriException(String.format(INVALID_DOCKER_URI_MESSAGE, uri)
                    + ": one of manifest, blob or image is required");
        }

        String tag = null;
        String digest = null;
        if (kind == DockerReference.Kind.BLOB) {
            if (!DockerNames.isDigest(reference)) {
                throw new InvalidUriException(String.format(INVALID_DOCKER_URI_MESSAGE, uri)
                        + ": blobs are addressed by digest");
            }
            digest = reference;
        } else if (Utils.isEmpty(reference)) {
            logger.atWarn().addKeyValue("uri", uri)
                    .log("An image version is not present, using the latest tag. Specify a tag or digest "
                            + "to consistently fetch the same content");
            tag = DockerNames.DEFAULT_TAG;
        } else if (DockerNames.isDigest(reference)) {
            digest = reference;
        } else if (DockerNames.isTag(reference)) {
            tag = reference;
        } else {
            throw new InvalidUriException(String.format(INVALID_DOCKER_URI_MESSAGE, uri) + ": bad reference "
                    + reference);
        }
        Registry registry = new Registry(endpoint, flags.isInsecureRegistry(endpoint));
        return new DockerReference(kind, registry, repository, tag, digest, uri);
    }

    static String queryKey(DockerReference.Kind kind) {
        switch (kind) {
            case MANIFEST:
                return Uris.Docker.MANIFEST;
            case BLOB:
                return Uris.Docker.BLOB;
            default:
                return Uris.Docker.IMAGE;
        }
    }
}
