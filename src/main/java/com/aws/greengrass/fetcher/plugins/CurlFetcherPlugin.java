/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins;

import com.aws.greengrass.fetcher.FetcherFlags;
import com.aws.greengrass.fetcher.exceptions.FetchException;
import com.aws.greengrass.fetcher.exceptions.FetchIOException;
import com.aws.greengrass.fetcher.exceptions.InvalidUriException;
import com.aws.greengrass.fetcher.models.Uri;
import com.aws.greengrass.fetcher.models.Uris;
import com.aws.greengrass.fetcher.util.CommitableFile;
import software.amazon.awssdk.http.HttpExecuteResponse;
import software.amazon.awssdk.http.SdkHttpClient;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Downloads HTTP and HTTPS resources. A transfer that stops making progress for longer than the stall timeout
 * is abandoned.
 */
public class CurlFetcherPlugin extends AbstractFetcherPlugin {
    public static final String NAME = "curl";
    private static final Set<String> SCHEMES = Set.of(Uris.HTTP, Uris.HTTPS);

    public CurlFetcherPlugin(FetcherFlags flags, Executor executor) {
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
            download(uri, directory, flags);
            return null;
        });
    }

    private void download(Uri uri, Path directory, FetcherFlags flags) throws FetchException {
        String fileName = uri.getLastPathSegment();
        if (fileName.isEmpty()) {
            throw new InvalidUriException(getErrorString(uri, "the URI path does not name a file"));
        }
        Path target = directory.resolve(fileName);

        try (SdkHttpClient client = getSdkHttpClient(flags)) {
            HttpExecuteResponse response = HttpTransport.get(client, uri.toJavaUri(), Collections.emptyMap());
            if (!response.httpResponse().isSuccessful()) {
                throw HttpTransport.failure(response, uri.toString());
            }
            try (InputStream body = HttpTransport.body(response); CommitableFile file = openTarget(target)) {
                download(body, file, null);
                commit(file);
            } catch (IOException e) {
                throw new FetchIOException(getErrorString(uri, "unable to close " + target), e);
            }
        }
    }
}
