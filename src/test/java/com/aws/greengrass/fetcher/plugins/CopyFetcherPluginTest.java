/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins;

import com.aws.greengrass.fetcher.Fetcher;
import com.aws.greengrass.fetcher.FetcherFlags;
import com.aws.greengrass.fetcher.exceptions.ArtifactNotFoundException;
import com.aws.greengrass.fetcher.exceptions.FetchErrorCode;
import com.aws.greengrass.fetcher.exceptions.FetchException;
import com.aws.greengrass.fetcher.exceptions.InvalidUriException;
import com.aws.greengrass.fetcher.models.Uri;
import com.aws.greengrass.fetcher.models.Uris;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CopyFetcherPluginTest {
    @TempDir
    Path source;
    @TempDir
    Path destination;

    private ExecutorService executor;
    private CopyFetcherPlugin plugin;

    @BeforeEach
    void beforeEach() {
        executor = Executors.newCachedThreadPool();
        plugin = new CopyFetcherPlugin(FetcherFlags.defaults(), executor);
    }

    @AfterEach
    void afterEach() {
        executor.shutdownNow();
    }

    private static FetchException failureOf(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
        assertThat(e.getCause(), instanceOf(FetchException.class));
        return (FetchException) e.getCause();
    }

    @Test
    void GIVEN_existing_file_WHEN_fetch_THEN_copied_under_same_name() throws Exception {
        Path file = source.resolve("data.bin");
        Files.write(file, "some content".getBytes(StandardCharsets.UTF_8));

        plugin.fetch(Uris.file(file), destination).get(10, TimeUnit.SECONDS);

        assertThat(new String(Files.readAllBytes(destination.resolve("data.bin")), StandardCharsets.UTF_8),
                is("some content"));
        assertFalse(Files.exists(destination.resolve("data.bin+")));
    }

    @Test
    void GIVEN_existing_target_WHEN_fetch_THEN_target_replaced() throws Exception {
        Path file = source.resolve("data.bin");
        Files.write(file, "new".getBytes(StandardCharsets.UTF_8));
        Files.write(destination.resolve("data.bin"), "old and longer".getBytes(StandardCharsets.UTF_8));

        plugin.fetch(Uris.file(file), destination).get(10, TimeUnit.SECONDS);

        assertThat(new String(Files.readAllBytes(destination.resolve("data.bin")), StandardCharsets.UTF_8),
                is("new"));
    }

    @Test
    void GIVEN_missing_file_WHEN_fetch_THEN_not_found() throws Exception {
        FetchException e = failureOf(plugin.fetch(Uris.file(source.resolve("missing")), destination));
        assertThat(e, instanceOf(ArtifactNotFoundException.class));
        assertThat(e.getErrorCode(), is(FetchErrorCode.NOT_FOUND));
        assertFalse(Files.exists(destination.resolve("missing")));
    }

    @Test
    void GIVEN_directory_WHEN_fetch_THEN_not_found() throws Exception {
        Path dir = Files.createDirectory(source.resolve("dir"));
        assertThat(failureOf(plugin.fetch(Uris.file(dir), destination)), instanceOf(ArtifactNotFoundException.class));
    }

    @Test
    void GIVEN_remote_host_WHEN_fetch_THEN_invalid_uri() throws Exception {
        Uri uri = Uri.parse("file://elsewhere/etc/hosts");
        FetchException e = failureOf(plugin.fetch(uri, destination));
        assertThat(e, instanceOf(InvalidUriException.class));
        assertThat(e.getErrorCode(), is(FetchErrorCode.INVALID_ARGUMENT));
    }

    @Test
    void GIVEN_uri_of_other_scheme_WHEN_fetch_THEN_invalid_uri() throws Exception {
        assertThat(failureOf(plugin.fetch(Uri.parse("http://localhost/file"), destination)),
                instanceOf(InvalidUriException.class));
    }

    @Test
    void GIVEN_fetcher_WHEN_fetch_file_uri_by_plugin_name_THEN_copied() throws Exception {
        Path file = source.resolve("by-name.txt");
        Files.write(file, "x".getBytes(StandardCharsets.UTF_8));
        try (Fetcher fetcher = Fetcher.create()) {
            fetcher.fetch(Uris.file(file), destination.resolve("out"), CopyFetcherPlugin.NAME, null)
                    .get(10, TimeUnit.SECONDS);
        }
        assertThat(Files.readAllLines(destination.resolve("out").resolve("by-name.txt")).get(0), is("x"));
    }
}
