/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins.docker;

import com.aws.greengrass.fetcher.exceptions.FetcherConfigurationException;
import com.aws.greengrass.fetcher.models.DockerNames;
import com.aws.greengrass.fetcher.util.SerializerFactory;
import com.aws.greengrass.fetcher.util.Utils;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Registry credentials from a docker CLI {@code config.json}:
 * <pre>
 * {"auths": {"registry.example.com": {"auth": "dXNlcjpwYXNz"}}}
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DockerConfig {
    // the docker CLI files docker hub credentials under its legacy index address
    static final String DOCKER_HUB_INDEX = "https://index.docker.io/v1/";
    private static final Logger logger = LoggerFactory.getLogger(DockerConfig.class);

    private Map<String, AuthEntry> auths = Collections.emptyMap();

    public static DockerConfig empty() {
        return new DockerConfig();
    }

    /**
     * Read a config file.
     *
     * @param file config.json, null for no credentials at all
     * @return parsed config
     * @throws FetcherConfigurationException if the file cannot be read or parsed
     */
    public static DockerConfig load(@Nullable Path file) throws FetcherConfigurationException {
        if (file == null) {
            return empty();
        }
        try {
            DockerConfig config = SerializerFactory.getFailSafeJsonObjectMapper().readValue(file.toFile(),
                    DockerConfig.class);
            if (config.getAuths() == null) {
                config.setAuths(Collections.emptyMap());
            }
            return config;
        } catch (IOException e) {
            throw new FetcherConfigurationException("Unable to read docker config " + file, e);
        }
    }

    /**
     * Credentials stored for a registry.
     *
     * @param registry registry endpoint
     * @return credentials if the config holds usable ones
     */
    public Optional<Registry.Credentials> getCredentials(String registry) {
        List<String> keys = DockerNames.DEFAULT_REGISTRY.equals(registry)
                ? Arrays.asList(registry, "https://" + registry, DOCKER_HUB_INDEX, "docker.io")
                : Arrays.asList(registry, "https://" + registry, "http://" + registry);
        for (String key : keys) {
            AuthEntry entry = auths.get(key);
            if (entry != null) {
                Optional<Registry.Credentials> credentials = entry.toCredentials();
                if (credentials.isPresent()) {
                    return credentials;
                }
            }
        }
        return Optional.empty();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AuthEntry {
        private String auth;
        private String username;
        private String password;

        Optional<Registry.Credentials> toCredentials() {
            if (Utils.isNotEmpty(username) && password != null) {
                return Optional.of(new Registry.Credentials(username, password));
            }
            if (Utils.isEmpty(auth)) {
                return Optional.empty();
            }
            String decoded;
            try {
                decoded = new String(Base64.getDecoder().decode(auth.trim()), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                logger.atWarn().setCause(e).log("Ignoring docker config entry whose auth is not base64");
                return Optional.empty();
            }
            int colon = decoded.indexOf(':');
            if (colon <= 0) {
                return Optional.empty();
            }
            return Optional.of(new Registry.Credentials(decoded.substring(0, colon), decoded.substring(colon + 1)));
        }
    }
}
