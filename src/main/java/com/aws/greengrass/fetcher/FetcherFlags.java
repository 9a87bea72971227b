/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher;

import com.aws.greengrass.fetcher.exceptions.FetcherConfigurationException;
import com.aws.greengrass.fetcher.models.DockerNames;
import com.aws.greengrass.fetcher.util.Coerce;
import com.aws.greengrass.fetcher.util.SerializerFactory;
import com.aws.greengrass.fetcher.util.Utils;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Options controlling how the fetcher and its plugins are built. Immutable; a copy with other values is made
 * through {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class FetcherFlags {
    public static final String HADOOP_CLIENT_KEY = "hadoop_client";
    public static final String DOCKER_CONFIG_KEY = "docker_config";
    public static final String DOCKER_REGISTRY_KEY = "docker_registry";
    public static final String DOCKER_AUTH_SERVER_KEY = "docker_auth_server";
    public static final String STALL_TIMEOUT_KEY = "stall_timeout";
    public static final String CONNECTION_TIMEOUT_KEY = "connection_timeout";
    public static final String FETCH_THREADS_KEY = "fetch_threads";
    public static final String DOCKER_INSECURE_REGISTRIES_KEY = "docker_insecure_registries";

    public static final Duration DEFAULT_STALL_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_FETCH_THREADS = 8;

    // resolved from HADOOP_HOME or PATH when absent
    @Nullable
    Path hadoopClient;
    // docker CLI config.json holding registry credentials
    @Nullable
    Path dockerConfig;
    @NonNull
    @Builder.Default
    String dockerRegistry = DockerNames.DEFAULT_REGISTRY;
    // token endpoint override, otherwise the realm advertised by the registry challenge is used
    @Nullable
    String dockerAuthServer;
    @NonNull
    @Builder.Default
    Duration stallTimeout = DEFAULT_STALL_TIMEOUT;
    @NonNull
    @Builder.Default
    Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
    @Builder.Default
    int fetchThreads = DEFAULT_FETCH_THREADS;
    @Singular("dockerInsecureRegistry")
    Set<String> dockerInsecureRegistries;

    public static FetcherFlags defaults() {
        return builder().build();
    }

    /**
     * Load flags from a flat YAML (or JSON) document such as
     * <pre>
     * hadoop_client: /opt/hadoop/bin/hadoop
     * stall_timeout: PT2M
     * </pre>
     *
     * @param file document to read
     * @return flags, defaults for every key the document leaves out
     * @throws FetcherConfigurationException if the file cannot be read or holds an unknown key or bad value
     */
    public static FetcherFlags fromYaml(Path file) throws FetcherConfigurationException {
        Map<String, Object> values;
        try {
            if (Files.size(file) == 0) {
                return defaults();
            }
            values = SerializerFactory.getYamlObjectMapper().readValue(file.toFile(),
                    new TypeReference<Map<String, Object>>() {
                    });
        } catch (IOException e) {
            throw new FetcherConfigurationException("Unable to read fetcher configuration " + file, e);
        }
        return values == null ? defaults() : fromMap(values);
    }

    /**
     * Build flags from the flat key table.
     *
     * @param values option values keyed by their configuration name
     * @return flags, defaults for every key the map leaves out
     * @throws FetcherConfigurationException on an unknown key or a value of the wrong shape
     */
    @SuppressWarnings("PMD.CyclomaticComplexity")
    public static FetcherFlags fromMap(Map<String, ?> values) throws FetcherConfigurationException {
        FetcherFlagsBuilder builder = builder();
        for (Map.Entry<String, ?> e : values.entrySet()) {
            Object value = e.getValue();
            if (value == null) {
                continue;
            }
            try {
                switch (e.getKey()) {
                    case HADOOP_CLIENT_KEY:
                        builder.hadoopClient(Paths.get(Utils.deTilde(value.toString())));
                        break;
                    case DOCKER_CONFIG_KEY:
                        builder.dockerConfig(Paths.get(Utils.deTilde(value.toString())));
                        break;
                    case DOCKER_REGISTRY_KEY:
                        if (!DockerNames.isRegistry(value.toString())) {
                            throw new IllegalArgumentException("Invalid registry host " + value);
                        }
                        builder.dockerRegistry(value.toString());
                        break;
                    case DOCKER_AUTH_SERVER_KEY:
                        builder.dockerAuthServer(value.toString());
                        break;
                    case STALL_TIMEOUT_KEY:
                        builder.stallTimeout(Coerce.toDuration(value));
                        break;
                    case CONNECTION_TIMEOUT_KEY:
                        builder.connectionTimeout(Coerce.toDuration(value));
                        break;
                    case FETCH_THREADS_KEY:
                        int threads = Coerce.toInt(value);
                        if (threads < 1) {
                            throw new IllegalArgumentException("At least one fetch thread is required");
                        }
                        builder.fetchThreads(threads);
                        break;
                    case DOCKER_INSECURE_REGISTRIES_KEY:
                        builder.dockerInsecureRegistries(Coerce.toStringList(value));
                        break;
                    default:
                        throw new FetcherConfigurationException("Unknown fetcher option " + e.getKey());
                }
            } catch (IllegalArgumentException ex) {
                throw new FetcherConfigurationException(
                        String.format("Invalid value for %s: %s", e.getKey(), ex.getMessage()), ex);
            }
        }
        return builder.build();
    }

    public boolean isInsecureRegistry(String registry) {
        return dockerInsecureRegistries.contains(registry);
    }
}
