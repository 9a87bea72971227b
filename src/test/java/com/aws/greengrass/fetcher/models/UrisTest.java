/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.models;

import com.aws.greengrass.fetcher.exceptions.InvalidUriException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UrisTest {
    private static final String DIGEST = "sha256:c4ffb87b09eba99383ee89b309d6d521c4ffb87b09eba99383ee89b309d6d521";

    @TempDir
    Path temp;

    @Test
    void GIVEN_path_WHEN_file_THEN_absolute_file_uri() throws Exception {
        Uri uri = Uris.file(temp.resolve("a.txt"));
        assertThat(uri.getScheme(), is(Uris.FILE));
        assertThat(uri.getPath(), is(temp.resolve("a.txt").toAbsolutePath().toString()));
        assertThat(uri.getLastPathSegment(), is("a.txt"));
    }

    @Test
    void GIVEN_host_and_path_WHEN_http_THEN_network_uri() throws Exception {
        Uri uri = Uris.http("localhost", "x", 8080);
        assertThat(uri.toString(), is("http://localhost:8080/x"));
        assertThat(Uris.https("example.com", "/a/b.bin").toString(), is("https://example.com/a/b.bin"));
    }

    @Test
    void GIVEN_bad_network_arguments_WHEN_http_THEN_invalid_uri() {
        assertThrows(InvalidUriException.class, () -> Uris.http("", "/x"));
        assertThrows(InvalidUriException.class, () -> Uris.http("h", "/x", 70_000));
    }

    @Test
    void GIVEN_hdfs_forms_WHEN_built_THEN_authority_only_when_given() throws Exception {
        assertThat(Uris.hdfs("/data/file").getHost(), nullValue());
        assertThat(Uris.hdfs("namenode", 8020, "/data/file").toString(), is("hdfs://namenode:8020/data/file"));
        assertThrows(InvalidUriException.class, () -> Uris.hdfs(""));
    }

    @Test
    void GIVEN_repository_and_tag_WHEN_docker_manifest_THEN_manifest_query() throws Exception {
        Uri uri = Uris.Docker.manifest("library/busybox", "1.36", "localhost:5000");
        assertThat(uri.getScheme(), is(Uris.DOCKER));
        assertThat(uri.getHost(), is("localhost"));
        assertThat(uri.getPort(), is(5000));
        assertThat(uri.getPath(), is("/library/busybox"));
        assertThat(uri.getQueryParameter(Uris.Docker.MANIFEST), is(Optional.of("1.36")));
    }

    @Test
    void GIVEN_no_registry_WHEN_docker_image_THEN_public_registry() throws Exception {
        Uri uri = Uris.Docker.image("library/busybox", DIGEST);
        assertThat(uri.getHost(), is(DockerNames.DEFAULT_REGISTRY));
        assertThat(uri.getQueryParameter(Uris.Docker.IMAGE), is(Optional.of(DIGEST)));
    }

    @Test
    void GIVEN_no_reference_WHEN_docker_manifest_THEN_latest() throws Exception {
        assertThat(Uris.Docker.manifest("busybox", null).getQueryParameter(Uris.Docker.MANIFEST),
                is(Optional.of(DockerNames.DEFAULT_TAG)));
    }

    @Test
    void GIVEN_digest_WHEN_docker_blob_THEN_blob_query() throws Exception {
        Uri uri = Uris.Docker.blob("library/busybox", DIGEST, "registry.example.com");
        assertThat(uri.getQueryParameter(Uris.Docker.BLOB), is(Optional.of(DIGEST)));
    }

    @Test
    void GIVEN_tag_instead_of_digest_WHEN_docker_blob_THEN_invalid_uri() {
        assertThrows(InvalidUriException.class, () -> Uris.Docker.blob("library/busybox", "latest"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "UpperCase", "trailing/", "/leading", "double//slash"})
    void GIVEN_bad_repository_WHEN_docker_manifest_THEN_invalid_uri(String repository) {
        assertThrows(InvalidUriException.class, () -> Uris.Docker.manifest(repository, "latest"));
    }

    @Test
    void GIVEN_bad_reference_or_registry_WHEN_docker_image_THEN_invalid_uri() {
        assertThrows(InvalidUriException.class, () -> Uris.Docker.image("busybox", "-bad-tag"));
        assertThrows(InvalidUriException.class, () -> Uris.Docker.image("busybox", "latest", "bad_host"));
    }
}
