/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins;

import com.aws.greengrass.fetcher.FetcherFlags;
import com.aws.greengrass.fetcher.exceptions.DownloadTimeoutException;
import com.aws.greengrass.fetcher.exceptions.FetchErrorCode;
import com.aws.greengrass.fetcher.exceptions.FetchException;
import com.aws.greengrass.fetcher.exceptions.FetchIOException;
import com.aws.greengrass.fetcher.exceptions.InvalidUriException;
import com.aws.greengrass.fetcher.exceptions.TransportException;
import com.aws.greengrass.fetcher.models.Uri;
import com.aws.greengrass.fetcher.util.CommitableFile;
import com.aws.greengrass.fetcher.util.CrashableSupplier;
import com.aws.greengrass.fetcher.util.Futures;
import com.aws.greengrass.fetcher.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.apache.ApacheHttpClient;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import javax.annotation.Nullable;

/**
 * Plumbing shared by the built-in plugins: flag overrides, logging of each fetch, streaming into a
 * {@link CommitableFile}, and HTTP client construction.
 */
public abstract class AbstractFetcherPlugin implements FetcherPlugin {
    public static final String URI_LOG_KEY = "uri";
    public static final String PLUGIN_LOG_KEY = "plugin";
    public static final String DESTINATION_LOG_KEY = "destination";
    static final String FETCH_EXCEPTION_FMT = "Failed to fetch '%s' with plugin %s, reason: ";
    private static final int DOWNLOAD_BUFFER_SIZE = 8192;

    protected final Logger logger;
    protected final FetcherFlags flags;
    protected final Executor executor;

    protected AbstractFetcherPlugin(FetcherFlags flags, Executor executor) {
        this.flags = flags;
        this.executor = executor;
        this.logger = LoggerFactory.getLogger(this.getClass());
    }

    @Override
    public CompletableFuture<Void> fetch(Uri uri, Path directory) {
        return fetch(uri, directory, null);
    }

    @Override
    public CompletableFuture<Void> fetch(Uri uri, Path directory, @Nullable FetcherFlags overrides) {
        FetcherFlags effective = overrides == null ? flags : overrides;
        logger.atDebug().addKeyValue(URI_LOG_KEY, uri).addKeyValue(DESTINATION_LOG_KEY, directory).log("Fetching");
        CompletableFuture<Void> result;
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (getSchemes().contains(scheme)) {
            Uri normalized = scheme.equals(uri.getScheme()) ? uri : uri.toBuilder().scheme(scheme).build();
            result = Futures.unwrapped(doFetch(normalized, directory, effective));
        } else {
            result = CompletableFuture.failedFuture(new InvalidUriException(
                    getErrorString(uri, "scheme " + uri.getScheme() + " is not handled by this plugin")));
        }
        return result.whenComplete((v, t) -> {
            if (t == null) {
                logger.atInfo().addKeyValue(URI_LOG_KEY, uri).addKeyValue(DESTINATION_LOG_KEY, directory)
                        .log("Fetched");
            } else {
                logger.atError().addKeyValue(URI_LOG_KEY, uri).addKeyValue(DESTINATION_LOG_KEY, directory)
                        .setCause(t).log("Fetch failed");
            }
        });
    }

    /**
     * Start fetching. The returned future may complete exceptionally with the {@link FetchException} wrapped in a
     * {@link java.util.concurrent.CompletionException}; it is unwrapped before reaching callers.
     *
     * @param uri       URI whose scheme this plugin handles
     * @param directory existing destination directory
     * @param flags     flags in effect for this call
     * @return completion of the fetch
     */
    protected abstract CompletableFuture<Void> doFetch(Uri uri, Path directory, FetcherFlags flags);

    /**
     * Run blocking fetch work on the shared executor.
     *
     * @param work work to run
     * @return completion of the work
     */
    protected CompletableFuture<Void> runAsync(CrashableSupplier<Void, ? extends Exception> work) {
        return Futures.supplyAsync(work, executor);
    }

    /**
     * Stream everything from an input into a pending file, optionally hashing it on the way.
     *
     * @param inputStream   source, read to its end
     * @param file          pending destination file
     * @param messageDigest digest to update, may be null
     * @return number of bytes copied
     * @throws FetchException if reading stalls or fails, or the file cannot be written
     */
    protected long download(InputStream inputStream, CommitableFile file, @Nullable MessageDigest messageDigest)
            throws FetchException {
        long totalReadBytes = 0;
        byte[] buffer = new byte[DOWNLOAD_BUFFER_SIZE];
        while (true) {
            int readBytes;
            try {
                readBytes = inputStream.read(buffer);
            } catch (IOException e) {
                throw readFailure(file.getTarget(), totalReadBytes, e);
            }
            if (readBytes < 0) {
                return totalReadBytes;
            }
            try {
                file.write(buffer, 0, readBytes);
            } catch (IOException e) {
                throw new FetchIOException("Error writing " + file.getTarget(), e, FetchErrorCode.IO_WRITE_ERROR);
            }
            if (messageDigest != null) {
                messageDigest.update(buffer, 0, readBytes);
            }
            totalReadBytes += readBytes;
        }
    }

    private FetchException readFailure(Path target, long bytesRead, IOException e) {
        if (Utils.getUltimateCause(e) instanceof SocketTimeoutException) {
            return new DownloadTimeoutException(String.format("Download of %s stalled after %d bytes", target,
                    bytesRead), e);
        }
        return new TransportException(String.format("Download of %s broke off after %d bytes", target, bytesRead),
                e);
    }

    protected CommitableFile openTarget(Path target) throws FetchIOException {
        try {
            return CommitableFile.abandonOnClose(target);
        } catch (IOException e) {
            throw new FetchIOException("Unable to create " + target, e, FetchErrorCode.IO_WRITE_ERROR);
        }
    }

    protected void commit(CommitableFile file) throws FetchIOException {
        try {
            file.commit();
        } catch (IOException e) {
            throw new FetchIOException("Unable to move the download into place at " + file.getTarget(), e);
        }
    }

    /**
     * HTTP client for one fetch call; callers close it once the call is done.
     *
     * @param flags flags in effect for the call
     * @return new client
     */
    protected SdkHttpClient getSdkHttpClient(FetcherFlags flags) {
        return ApacheHttpClient.builder().socketTimeout(flags.getStallTimeout())
                .connectionTimeout(flags.getConnectionTimeout()).build();
    }

    protected String getErrorString(Uri uri, String reason) {
        return String.format(FETCH_EXCEPTION_FMT, uri, getName()) + reason;
    }
}
