/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.models;

import com.aws.greengrass.fetcher.exceptions.InvalidUriException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import javax.annotation.Nullable;

import static com.aws.greengrass.fetcher.util.Utils.isEmpty;

/**
 * Builders for well-formed URIs of every supported scheme.
 */
public final class Uris {
    public static final String FILE = "file";
    public static final String HTTP = "http";
    public static final String HTTPS = "https";
    public static final String HDFS = "hdfs";
    public static final String DOCKER = "docker";

    private Uris() {
    }

    /**
     * URI of a local file.
     *
     * @param path file path, made absolute against the working directory
     * @return {@code file://} URI
     * @throws InvalidUriException if the path is empty
     */
    public static Uri file(Path path) throws InvalidUriException {
        if (path == null || path.toString().isEmpty()) {
            throw new InvalidUriException("File path must not be empty");
        }
        return Uri.builder().scheme(FILE).path(path.toAbsolutePath().toString()).build();
    }

    public static Uri http(String host, String path) throws InvalidUriException {
        return http(host, path, null);
    }

    public static Uri http(String host, String path, @Nullable Integer port) throws InvalidUriException {
        return network(HTTP, host, path, port);
    }

    public static Uri https(String host, String path) throws InvalidUriException {
        return https(host, path, null);
    }

    public static Uri https(String host, String path, @Nullable Integer port) throws InvalidUriException {
        return network(HTTPS, host, path, port);
    }

    /**
     * URI of an HDFS object on the client's default file system.
     *
     * @param path absolute or client relative path
     * @return {@code hdfs://} URI without authority
     * @throws InvalidUriException if the path is empty
     */
    public static Uri hdfs(String path) throws InvalidUriException {
        if (isEmpty(path)) {
            throw new InvalidUriException("HDFS path must not be empty");
        }
        return Uri.builder().scheme(HDFS).path(path).build();
    }

    public static Uri hdfs(String host, @Nullable Integer port, String path) throws InvalidUriException {
        return network(HDFS, host, path, port);
    }

    private static Uri network(String scheme, String host, String path, @Nullable Integer port)
            throws InvalidUriException {
        if (isEmpty(host)) {
            throw new InvalidUriException(scheme + " URI requires a host");
        }
        if (port != null && (port < 1 || port > 65_535)) {
            throw new InvalidUriException("Port out of range: " + port);
        }
        String p = path == null ? "" : path;
        if (!p.isEmpty() && p.charAt(0) != '/') {
            p = '/' + p;
        }
        return Uri.builder().scheme(scheme).host(host).port(port).path(p).build();
    }

    /**
     * Locators of registry objects: {@code docker://<registry>/<repository>?<kind>=<reference>}.
     */
    public static final class Docker {
        public static final String MANIFEST = "manifest";
        public static final String BLOB = "blob";
        public static final String IMAGE = "image";

        private static final Logger logger = LoggerFactory.getLogger(Docker.class);

        private Docker() {
        }

        public static Uri manifest(String repository, @Nullable String reference) throws InvalidUriException {
            return manifest(repository, reference, null);
        }

        /**
         * URI of an image manifest.
         *
         * @param repository   repository name, e.g. {@code library/busybox}
         * @param reference    tag or digest, {@code latest} when absent
         * @param registryHost {@code host[:port]}, the public registry when absent
         * @return manifest URI
         * @throws InvalidUriException if a component violates the registry grammar
         */
        public static Uri manifest(String repository, @Nullable String reference, @Nullable String registryHost)
                throws InvalidUriException {
            return build(MANIFEST, repository, defaultReference(repository, reference), registryHost);
        }

        public static Uri blob(String repository, String digest) throws InvalidUriException {
            return blob(repository, digest, null);
        }

        /**
         * URI of a single blob.
         *
         * @param repository   repository name
         * @param digest       content digest {@code <algorithm>:<hex>}
         * @param registryHost {@code host[:port]}, the public registry when absent
         * @return blob URI
         * @throws InvalidUriException if the digest is malformed or a component violates the registry grammar
         */
        public static Uri blob(String repository, String digest, @Nullable String registryHost)
                throws InvalidUriException {
            if (!DockerNames.isDigest(digest)) {
                throw new InvalidUriException("Blob reference must be a digest of the form <algorithm>:<hex>, got "
                        + digest);
            }
            return build(BLOB, repository, digest, registryHost);
        }

        public static Uri image(String repository, @Nullable String reference) throws InvalidUriException {
            return image(repository, reference, null);
        }

        /**
         * URI of a whole image: its manifest plus every layer blob the manifest references.
         *
         * @param repository   repository name
         * @param reference    tag or digest, {@code latest} when absent
         * @param registryHost {@code host[:port]}, the public registry when absent
         * @return image URI
         * @throws InvalidUriException if a component violates the registry grammar
         */
        public static Uri image(String repository, @Nullable String reference, @Nullable String registryHost)
                throws InvalidUriException {
            return build(IMAGE, repository, defaultReference(repository, reference), registryHost);
        }

        static String defaultReference(String repository, @Nullable String reference) {
            if (isEmpty(reference)) {
                logger.atWarn().addKeyValue("repository", repository)
                        .log("An image version is not present, using the latest tag. Specify a tag or digest "
                                + "to consistently fetch the same content");
                return DockerNames.DEFAULT_TAG;
            }
            return reference;
        }

        private static Uri build(String kind, String repository, String reference, @Nullable String registryHost)
                throws InvalidUriException {
            if (isEmpty(repository)) {
                throw new InvalidUriException("Repository must not be empty");
            }
            if (!DockerNames.isRepository(repository)) {
                throw new InvalidUriException("Invalid repository name " + repository);
            }
            if (!DockerNames.isReference(reference)) {
                throw new InvalidUriException("Invalid tag or digest " + reference);
            }
            String registry = isEmpty(registryHost) ? DockerNames.DEFAULT_REGISTRY : registryHost;
            if (!DockerNames.isRegistry(registry)) {
                throw new InvalidUriException("Invalid registry host " + registry);
            }
            String host = registry;
            Integer port = null;
            int colon = registry.indexOf(':');
            if (colon >= 0) {
                host = registry.substring(0, colon);
                try {
                    port = Integer.parseInt(registry.substring(colon + 1));
                } catch (NumberFormatException e) {
                    throw new InvalidUriException("Invalid registry port in " + registry, e);
                }
            }
            return Uri.builder().scheme(DOCKER).host(host).port(port).path('/' + repository)
                    .queryParameter(kind, reference).build();
        }
    }
}
