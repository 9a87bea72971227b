/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.models;

import com.aws.greengrass.fetcher.util.Digest;

import java.util.regex.Pattern;

/**
 * Docker's grammar for registry hosts, repository names, tags and digests.
 * Reference - https://github.com/distribution/distribution/blob/main/reference/reference.go#L6
 */
public final class DockerNames {
    public static final String DEFAULT_REGISTRY = "registry-1.docker.io";
    public static final String DEFAULT_TAG = "latest";
    // single component repositories of the public registry live under this namespace
    public static final String OFFICIAL_REPOSITORY_PREFIX = "library/";

    // Example domain - www.amazon-us.com:8080
    private static final String DOMAIN_COMPONENT_REGEX = "([a-zA-Z0-9]|[a-zA-Z0-9][a-zA-Z0-9-]*[a-zA-Z0-9])";
    private static final Pattern DOMAIN_PATTERN = Pattern.compile(
            String.format("^%s(\\.%s)*(:[0-9]+)?$", DOMAIN_COMPONENT_REGEX, DOMAIN_COMPONENT_REGEX));

    private static final String PATH_COMPONENT_REGEX = "([a-z0-9]+)(([_.]|__|[-]*)([a-z0-9]+))*";
    private static final Pattern PATH_PATTERN = Pattern.compile(
            String.format("^(%s(/%s)*)$", PATH_COMPONENT_REGEX, PATH_COMPONENT_REGEX));

    // Example tag - v1.12.1
    private static final Pattern TAG_PATTERN = Pattern.compile("^([\\w][\\w.-]{0,127})$");

    private DockerNames() {
    }

    public static boolean isRegistry(String s) {
        return s != null && DOMAIN_PATTERN.matcher(s).matches();
    }

    public static boolean isRepository(String s) {
        return s != null && PATH_PATTERN.matcher(s).matches();
    }

    public static boolean isTag(String s) {
        return s != null && TAG_PATTERN.matcher(s).matches();
    }

    public static boolean isDigest(String s) {
        return Digest.isDigest(s);
    }

    public static boolean isReference(String s) {
        return isTag(s) || isDigest(s);
    }

    /**
     * Expand a repository name the way the docker CLI does: {@code busybox} on the public registry is
     * {@code library/busybox}.
     *
     * @param registry registry host
     * @param repository repository name
     * @return canonical repository name
     */
    public static String canonicalRepository(String registry, String repository) {
        if (DEFAULT_REGISTRY.equals(registry) && repository.indexOf('/') < 0) {
            return OFFICIAL_REPOSITORY_PREFIX + repository;
        }
        return repository;
    }
}
