/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins;

import com.aws.greengrass.fetcher.FetcherFlags;
import com.aws.greengrass.fetcher.exceptions.DownloadTimeoutException;
import com.aws.greengrass.fetcher.exceptions.FetchException;
import com.aws.greengrass.fetcher.exceptions.FetchIOException;
import com.aws.greengrass.fetcher.exceptions.FetcherConfigurationException;
import com.aws.greengrass.fetcher.exceptions.InvalidUriException;
import com.aws.greengrass.fetcher.exceptions.TransportException;
import com.aws.greengrass.fetcher.models.Uri;
import com.aws.greengrass.fetcher.models.Uris;
import com.aws.greengrass.fetcher.util.CommitableFile;
import com.aws.greengrass.fetcher.util.Exec;
import com.aws.greengrass.fetcher.util.Futures;
import lombok.Getter;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Copies HDFS objects to local disk by running {@code <client> fs -copyToLocal <source> <destination>}. A fresh
 * client process is started for every fetch; waiting for it does not hold a thread.
 */
public class HadoopFetcherPlugin extends AbstractFetcherPlugin {
    public static final String NAME = "hadoop";
    public static final String HADOOP_HOME_ENV = "HADOOP_HOME";
    static final String HADOOP_COMMAND = "hadoop";
    // the client streams into <destination>._COPYING_ and renames it when done
    static final String COPYING_SUFFIX = "._COPYING_";
    private static final long MAX_POLL_MILLIS = 1000;
    private static final long MIN_POLL_MILLIS = 10;
    private static final Set<String> SCHEMES = Collections.singleton(Uris.HDFS);
    private static final Logger staticLogger = LoggerFactory.getLogger(HadoopFetcherPlugin.class);

    @Getter
    private final Path client;

    HadoopFetcherPlugin(Path client, FetcherFlags flags, Executor executor) {
        super(flags, executor);
        this.client = client;
    }

    /**
     * Build the plugin around the configured client, making sure the client actually runs.
     *
     * @param flags    flags naming the client
     * @param executor executor fetches complete on
     * @return plugin
     * @throws FetcherConfigurationException if no client is configured or the client fails its version probe
     */
    public static HadoopFetcherPlugin create(FetcherFlags flags, Executor executor)
            throws FetcherConfigurationException {
        Path client = flags.getHadoopClient();
        if (client == null) {
            client = defaultClient().orElseThrow(() -> new FetcherConfigurationException(
                    "No hadoop client configured and none found through " + HADOOP_HOME_ENV + " or PATH"));
        }
        probe(client, flags);
        return new HadoopFetcherPlugin(client, flags, executor);
    }

    /**
     * Locate the client the way the hadoop scripts do: {@code $HADOOP_HOME/bin/hadoop}, else {@code hadoop} on the
     * PATH.
     *
     * @return client path if one exists
     */
    public static Optional<Path> defaultClient() {
        String home = System.getenv(HADOOP_HOME_ENV);
        if (home != null && !home.isEmpty()) {
            Path p = Paths.get(home, "bin", HADOOP_COMMAND);
            return Files.isExecutable(p) ? Optional.of(p) : Optional.empty();
        }
        return Optional.ofNullable(Exec.which(HADOOP_COMMAND));
    }

    private static void probe(Path client, FetcherFlags flags) throws FetcherConfigurationException {
        StringBuilder err = new StringBuilder();
        try (Exec exec = new Exec().withExec(client.toString(), "version").withErr(err::append)
                .withTimeout(flags.getStallTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
            Optional<Integer> exit = exec.exec();
            if (!exit.isPresent()) {
                throw new FetcherConfigurationException(String.format("Hadoop client %s did not answer the version "
                        + "probe within %s", client, flags.getStallTimeout()));
            }
            if (exit.get() != 0) {
                throw new FetcherConfigurationException(String.format("Hadoop client %s failed the version probe with"
                        + " exit code %d: %s", client, exit.get(), err.toString().trim()));
            }
        } catch (IOException e) {
            throw new FetcherConfigurationException("Unable to run hadoop client " + client, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetcherConfigurationException("Interrupted probing hadoop client " + client, e);
        }
        staticLogger.atDebug().addKeyValue("client", client).log("Hadoop client is usable");
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
    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    protected CompletableFuture<Void> doFetch(Uri uri, Path directory, FetcherFlags flags) {
        String fileName = FilenameUtils.getName(uri.getPath());
        if (fileName.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new InvalidUriException(getErrorString(uri, "the path does not name a file")));
        }
        Path target = directory.resolve(fileName);
        Path partial = CommitableFile.getNewFile(target);
        StringBuffer err = new StringBuffer();
        Exec exec = new Exec().withExec(client.toString(), "fs", "-copyToLocal", source(uri), partial.toString())
                .withOut(line -> logger.atDebug().addKeyValue(URI_LOG_KEY, uri)
                        .log("hadoop client: {}", line.toString().trim()))
                .withErr(err::append).logger(logger);

        CompletableFuture<Integer> exit;
        try {
            Files.deleteIfExists(partial);
            exit = exec.execAsync(executor);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new TransportException(getErrorString(uri, "unable to run hadoop client " + client), e));
        }

        CompletableFuture<Integer> watched = new CompletableFuture<>();
        exit.whenComplete((code, t) -> {
            if (t == null) {
                watched.complete(code);
            } else {
                watched.completeExceptionally(t);
            }
        });
        new StallWatch(watched, flags.getStallTimeout(), partial, err).schedule();

        CompletableFuture<Void> result = new CompletableFuture<>();
        watched.whenCompleteAsync((code, t) -> {
            try {
                finish(uri, exec, code, t, err, partial, target, flags);
                result.complete(null);
            } catch (FetchException | RuntimeException e) {
                deletePartial(partial);
                result.completeExceptionally(e);
            }
        }, executor);
        return result;
    }

    private void finish(Uri uri, Exec exec, Integer exitCode, Throwable failure, StringBuffer err, Path partial,
                        Path target, FetcherFlags flags) throws FetchException {
        if (failure != null) {
            Throwable cause = Futures.unwrap(failure);
            if (cause instanceof TimeoutException) {
                try {
                    exec.close();
                } catch (IOException e) {
                    logger.atWarn().addKeyValue(URI_LOG_KEY, uri).setCause(e).log("Unable to stop hadoop client");
                }
                throw new DownloadTimeoutException(getErrorString(uri,
                        "hadoop client made no progress for " + flags.getStallTimeout()), cause);
            }
            throw new TransportException(getErrorString(uri, "hadoop client failed"), cause);
        }
        if (exitCode != 0) {
            logger.atDebug().addKeyValue(URI_LOG_KEY, uri).addKeyValue("exitCode", exitCode)
                    .log("Hadoop client exited with an error");
            throw TransportException.forExitCode(getErrorString(uri, String.format(
                    "hadoop client exited with code %d: %s", exitCode, err.toString().trim())), exitCode);
        }
        if (!Files.exists(partial)) {
            throw new TransportException(getErrorString(uri, "hadoop client reported success but wrote no file"),
                    null);
        }
        try {
            CommitableFile.move(partial, target);
        } catch (IOException e) {
            throw new FetchIOException(getErrorString(uri, "unable to move the download into place"), e);
        }
    }

    private void deletePartial(Path partial) {
        for (Path p : new Path[]{partial, copying(partial)}) {
            try {
                Files.deleteIfExists(p);
            } catch (IOException e) {
                logger.atWarn().addKeyValue("file", p).setCause(e).log("Unable to delete partial download");
            }
        }
    }

    static Path copying(Path partial) {
        return partial.resolveSibling(partial.getFileName() + COPYING_SUFFIX);
    }

    /**
     * Fails the client's exit future with a {@link TimeoutException} once neither the downloaded files nor the
     * client's error output have grown for the stall timeout. A copy that keeps writing is never cut off.
     */
    private final class StallWatch implements Runnable {
        private final CompletableFuture<Integer> exit;
        private final Duration stallTimeout;
        private final long pollMillis;
        private final Path partial;
        private final Path copying;
        private final StringBuffer err;
        private long lastProgress = -1;
        private long lastProgressAt = System.nanoTime();

        StallWatch(CompletableFuture<Integer> exit, Duration stallTimeout, Path partial, StringBuffer err) {
            this.exit = exit;
            this.stallTimeout = stallTimeout;
            this.pollMillis = Math.max(MIN_POLL_MILLIS, Math.min(MAX_POLL_MILLIS, stallTimeout.toMillis() / 4));
            this.partial = partial;
            this.copying = copying(partial);
            this.err = err;
        }

        void schedule() {
            if (!exit.isDone()) {
                CompletableFuture.runAsync(this,
                        CompletableFuture.delayedExecutor(pollMillis, TimeUnit.MILLISECONDS, executor));
            }
        }

        @Override
        public void run() {
            if (exit.isDone()) {
                return;
            }
            // File.length is 0 for files the client has not created yet
            long progress = partial.toFile().length() + copying.toFile().length() + err.length();
            long now = System.nanoTime();
            if (progress != lastProgress) {
                lastProgress = progress;
                lastProgressAt = now;
            } else if (now - lastProgressAt >= stallTimeout.toNanos()) {
                exit.completeExceptionally(new TimeoutException("No progress for " + stallTimeout));
                return;
            }
            schedule();
        }
    }

    /**
     * Source argument for the client: full {@code hdfs://host:port/path} when the URI names a name node, the bare
     * path otherwise so the client's default file system applies.
     *
     * @param uri hdfs URI
     * @return source argument
     */
    static String source(Uri uri) {
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            return uri.getPath();
        }
        return Uris.HDFS + "://" + uri.getAuthority() + uri.getPath();
    }
}
