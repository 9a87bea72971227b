/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins;

import com.aws.greengrass.fetcher.FetcherFlags;
import com.aws.greengrass.fetcher.exceptions.ArtifactNotFoundException;
import com.aws.greengrass.fetcher.exceptions.FetchErrorCode;
import com.aws.greengrass.fetcher.exceptions.FetchException;
import com.aws.greengrass.fetcher.exceptions.FetchIOException;
import com.aws.greengrass.fetcher.exceptions.InvalidUriException;
import com.aws.greengrass.fetcher.models.Uri;
import com.aws.greengrass.fetcher.models.Uris;
import com.aws.greengrass.fetcher.util.CommitableFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Copies local files.
 */
public class CopyFetcherPlugin extends AbstractFetcherPlugin {
    public static final String NAME = "copy";
    private static final Set<String> SCHEMES = Collections.singleton(Uris.FILE);

    public CopyFetcherPlugin(FetcherFlags flags, Executor executor) {
        super(flags, executor);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<String> getSchemes() {
        return SCHEMES;
    }

    @Override
    protected CompletableFuture<Void> doFetch(Uri uri, Path directory, FetcherFlags flags) {
        return runAsync(() -> {
            copy(uri, directory);
            return null;
        });
    }

    private void copy(Uri uri, Path directory) throws FetchException {
        String host = uri.getHost();
        if (host != null && !host.isEmpty() && !"localhost".equalsIgnoreCase(host)) {
            throw new InvalidUriException(getErrorString(uri, "only local files can be copied"));
        }
        Path source;
        try {
            source = Paths.get(uri.getPath());
        } catch (InvalidPathException e) {
            throw new InvalidUriException(getErrorString(uri, "not a valid path"), e);
        }
        if (source.getFileName() == null) {
            throw new InvalidUriException(getErrorString(uri, "path has no file name"));
        }
        if (!Files.exists(source)) {
            throw new ArtifactNotFoundException(getErrorString(uri, source + " does not exist"));
        }
        if (!Files.isRegularFile(source)) {
            throw new ArtifactNotFoundException(getErrorString(uri, source + " is not a regular file"));
        }

        Path target = directory.resolve(source.getFileName().toString());
        try (CommitableFile file = openTarget(target)) {
            try {
                Files.copy(source, file);
            } catch (IOException e) {
                throw new FetchIOException(getErrorString(uri, "copy failed"), e, FetchErrorCode.IO_READ_ERROR);
            }
            commit(file);
        } catch (IOException e) {
            throw new FetchIOException(getErrorString(uri, "unable to close " + target), e);
        }
    }
}
