/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher;

import com.aws.greengrass.fetcher.exceptions.FetchErrorCode;
import com.aws.greengrass.fetcher.exceptions.FetcherConfigurationException;
import com.aws.greengrass.fetcher.models.DockerNames;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FetcherFlagsTest {
    @TempDir
    Path temp;

    @Test
    void GIVEN_nothing_WHEN_defaults_THEN_documented_values() {
        FetcherFlags flags = FetcherFlags.defaults();
        assertThat(flags.getHadoopClient(), nullValue());
        assertThat(flags.getDockerConfig(), nullValue());
        assertThat(flags.getDockerRegistry(), is(DockerNames.DEFAULT_REGISTRY));
        assertThat(flags.getStallTimeout(), is(Duration.ofSeconds(60)));
        assertThat(flags.getConnectionTimeout(), is(Duration.ofSeconds(30)));
        assertThat(flags.getFetchThreads(), is(8));
        assertThat(flags.getDockerInsecureRegistries(), empty());
    }

    @Test
    void GIVEN_yaml_file_WHEN_from_yaml_THEN_every_key_applied() throws Exception {
        Path file = temp.resolve("fetcher.yaml");
        Files.write(file, String.join("\n",
                "hadoop_client: /opt/hadoop/bin/hadoop",
                "docker_config: /etc/docker/config.json",
                "docker_registry: localhost:5000",
                "docker_auth_server: https://auth.example.com/token",
                "stall_timeout: PT2M",
                "connection_timeout: 5",
                "fetch_threads: 3",
                "docker_insecure_registries:",
                "  - localhost:5000",
                "  - mirror.local").getBytes(StandardCharsets.UTF_8));

        FetcherFlags flags = FetcherFlags.fromYaml(file);
        assertThat(flags.getHadoopClient(), is(Paths.get("/opt/hadoop/bin/hadoop")));
        assertThat(flags.getDockerConfig(), is(Paths.get("/etc/docker/config.json")));
        assertThat(flags.getDockerRegistry(), is("localhost:5000"));
        assertThat(flags.getDockerAuthServer(), is("https://auth.example.com/token"));
        assertThat(flags.getStallTimeout(), is(Duration.ofMinutes(2)));
        assertThat(flags.getConnectionTimeout(), is(Duration.ofSeconds(5)));
        assertThat(flags.getFetchThreads(), is(3));
        assertThat(flags.getDockerInsecureRegistries(), containsInAnyOrder("localhost:5000", "mirror.local"));
        assertTrue(flags.isInsecureRegistry("mirror.local"));
        assertFalse(flags.isInsecureRegistry(DockerNames.DEFAULT_REGISTRY));
    }

    @Test
    void GIVEN_empty_yaml_file_WHEN_from_yaml_THEN_defaults() throws Exception {
        Path file = temp.resolve("empty.yaml");
        Files.createFile(file);
        assertThat(FetcherFlags.fromYaml(file), is(FetcherFlags.defaults()));
    }

    @Test
    void GIVEN_unknown_key_WHEN_from_map_THEN_configuration_error() {
        FetcherConfigurationException e = assertThrows(FetcherConfigurationException.class,
                () -> FetcherFlags.fromMap(Collections.singletonMap("hadoop_clinet", "/bin/hadoop")));
        assertThat(e.getMessage(), containsString("hadoop_clinet"));
        assertThat(e.getErrorCode(), is(FetchErrorCode.CONFIGURATION_ERROR));
    }

    @Test
    void GIVEN_bad_values_WHEN_from_map_THEN_configuration_error() {
        Map<String, Object> badTimeout = new HashMap<>();
        badTimeout.put(FetcherFlags.STALL_TIMEOUT_KEY, "whenever");
        assertThrows(FetcherConfigurationException.class, () -> FetcherFlags.fromMap(badTimeout));

        Map<String, Object> badThreads = new HashMap<>();
        badThreads.put(FetcherFlags.FETCH_THREADS_KEY, 0);
        assertThrows(FetcherConfigurationException.class, () -> FetcherFlags.fromMap(badThreads));

        Map<String, Object> badRegistry = new HashMap<>();
        badRegistry.put(FetcherFlags.DOCKER_REGISTRY_KEY, "not a host");
        assertThrows(FetcherConfigurationException.class, () -> FetcherFlags.fromMap(badRegistry));
    }

    @Test
    void GIVEN_missing_file_WHEN_from_yaml_THEN_configuration_error() {
        assertThrows(FetcherConfigurationException.class, () -> FetcherFlags.fromYaml(temp.resolve("nope.yaml")));
    }

    @Test
    void GIVEN_flags_WHEN_to_builder_THEN_other_values_kept() {
        FetcherFlags flags = FetcherFlags.builder().dockerRegistry("localhost:5000")
                .dockerInsecureRegistry("localhost:5000").build();
        FetcherFlags changed = flags.toBuilder().stallTimeout(Duration.ofSeconds(1)).build();
        assertThat(changed.getDockerRegistry(), is("localhost:5000"));
        assertTrue(changed.isInsecureRegistry("localhost:5000"));
        assertThat(changed.getStallTimeout(), is(Duration.ofSeconds(1)));
    }
}
