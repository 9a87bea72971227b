/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins.docker;

import com.aws.greengrass.fetcher.exceptions.FetcherConfigurationException;
import com.aws.greengrass.fetcher.models.DockerNames;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DockerConfigTest {
    @TempDir
    Path temp;

    private static String auth(String user, String password) {
        return Base64.getEncoder().encodeToString((user + ':' + password).getBytes(StandardCharsets.UTF_8));
    }

    private DockerConfig load(String json) throws Exception {
        Path file = temp.resolve("config.json");
        Files.write(file, json.getBytes(StandardCharsets.UTF_8));
        return DockerConfig.load(file);
    }

    @Test
    void GIVEN_docker_cli_config_WHEN_load_THEN_credentials_per_registry() throws Exception {
        DockerConfig config = load("{\"auths\": {"
                + "\"https://index.docker.io/v1/\": {\"auth\": \"" + auth("hubuser", "hubpass") + "\"},"
                + "\"localhost:5000\": {\"auth\": \"" + auth("local", "p:with:colons") + "\"},"
                + "\"https://mirror.local\": {\"username\": \"mirror\", \"password\": \"secret\"}"
                + "}, \"credsStore\": \"desktop\"}");

        Registry.Credentials hub = config.getCredentials(DockerNames.DEFAULT_REGISTRY).get();
        assertThat(hub.getUsername(), is("hubuser"));
        assertThat(hub.getPassword(), is("hubpass"));

        Registry.Credentials local = config.getCredentials("localhost:5000").get();
        assertThat(local.getUsername(), is("local"));
        assertThat(local.getPassword(), is("p:with:colons"));

        assertThat(config.getCredentials("mirror.local").get().getUsername(), is("mirror"));
        assertFalse(config.getCredentials("other.example").isPresent());
    }

    @Test
    void GIVEN_entry_with_bad_auth_WHEN_get_credentials_THEN_none() throws Exception {
        DockerConfig config = load("{\"auths\": {"
                + "\"a.example\": {\"auth\": \"%%% not base64 %%%\"},"
                + "\"b.example\": {\"auth\": \"" + auth("", "nouser") + "\"},"
                + "\"c.example\": {}}}");
        assertFalse(config.getCredentials("a.example").isPresent());
        assertFalse(config.getCredentials("b.example").isPresent());
        assertFalse(config.getCredentials("c.example").isPresent());
    }

    @Test
    void GIVEN_config_without_auths_WHEN_load_THEN_empty() throws Exception {
        assertFalse(load("{}").getCredentials("localhost:5000").isPresent());
        assertFalse(load("{\"auths\": null}").getCredentials("localhost:5000").isPresent());
        assertFalse(DockerConfig.load(null).getCredentials(DockerNames.DEFAULT_REGISTRY).isPresent());
    }

    @Test
    void GIVEN_unreadable_config_WHEN_load_THEN_configuration_error() {
        assertThrows(FetcherConfigurationException.class, () -> load("{not json"));
        assertThrows(FetcherConfigurationException.class, () -> DockerConfig.load(temp.resolve("missing.json")));
    }

    @Test
    void GIVEN_credentials_WHEN_basic_authorization_THEN_base64_of_user_and_password() {
        assertThat(new Registry.Credentials("user", "pass").toBasicAuthorization(),
                is("Basic " + auth("user", "pass")));
    }
}
