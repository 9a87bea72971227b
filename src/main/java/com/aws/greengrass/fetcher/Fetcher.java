/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher;

import com.aws.greengrass.fetcher.exceptions.FetchErrorCode;
import com.aws.greengrass.fetcher.exceptions.FetchIOException;
import com.aws.greengrass.fetcher.exceptions.FetcherConfigurationException;
import com.aws.greengrass.fetcher.exceptions.UnknownPluginException;
import com.aws.greengrass.fetcher.exceptions.UnsupportedSchemeException;
import com.aws.greengrass.fetcher.models.Uri;
import com.aws.greengrass.fetcher.plugins.CopyFetcherPlugin;
import com.aws.greengrass.fetcher.plugins.CurlFetcherPlugin;
import com.aws.greengrass.fetcher.plugins.FetcherPlugin;
import com.aws.greengrass.fetcher.plugins.HadoopFetcherPlugin;
import com.aws.greengrass.fetcher.plugins.docker.DockerFetcherPlugin;
import com.aws.greengrass.fetcher.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;

/**
 * Fetches URIs into local directories by handing each one to the plugin registered for its scheme, or to a plugin
 * picked by name. The plugin registry is fixed at construction.
 * <pre>
 * try (Fetcher fetcher = Fetcher.create(FetcherFlags.defaults())) {
 *     fetcher.fetch(Uris.Docker.image("library/busybox", "latest"), dir).get();
 * }
 * </pre>
 */
public class Fetcher implements Closeable {
    public static final String PLUGIN_LOG_KEY = "plugin";
    public static final String URI_LOG_KEY = "uri";
    static final String THREAD_NAME_FORMAT = "uri-fetcher-%d";
    private static final Logger logger = LoggerFactory.getLogger(Fetcher.class);

    private final Map<String, FetcherPlugin> pluginsByScheme;
    private final Map<String, FetcherPlugin> pluginsByName;
    @Nullable
    private final ExecutorService executor;

    /**
     * Build a fetcher over the given plugins. The plugins' own lifecycles are left to the caller.
     *
     * @param plugins plugins to register
     * @throws FetcherConfigurationException if two plugins share a name or claim the same scheme
     */
    public Fetcher(Collection<? extends FetcherPlugin> plugins) throws FetcherConfigurationException {
        this(plugins, null);
    }

    private Fetcher(Collection<? extends FetcherPlugin> plugins, @Nullable ExecutorService executor)
            throws FetcherConfigurationException {
        Map<String, FetcherPlugin> byScheme = new LinkedHashMap<>();
        Map<String, FetcherPlugin> byName = new LinkedHashMap<>();
        for (FetcherPlugin plugin : plugins) {
            FetcherPlugin sameName = byName.putIfAbsent(plugin.getName(), plugin);
            if (sameName != null) {
                throw new FetcherConfigurationException("More than one plugin is named " + plugin.getName());
            }
            for (String scheme : plugin.getSchemes()) {
                FetcherPlugin sameScheme = byScheme.putIfAbsent(scheme.toLowerCase(Locale.ROOT), plugin);
                if (sameScheme != null) {
                    throw new FetcherConfigurationException(String.format("Plugins %s and %s both claim scheme %s",
                            sameScheme.getName(), plugin.getName(), scheme));
                }
            }
        }
        this.pluginsByScheme = Collections.unmodifiableMap(byScheme);
        this.pluginsByName = Collections.unmodifiableMap(byName);
        this.executor = executor;
        logger.atDebug().addKeyValue("plugins", byName.keySet()).addKeyValue("schemes", byScheme.keySet())
                .log("Fetcher created");
    }

    public static Fetcher create() throws FetcherConfigurationException {
        return create(FetcherFlags.defaults());
    }

    /**
     * Build a fetcher with the built-in plugins plus the given ones. The built-in plugins share a worker pool that
     * {@link #close()} shuts down.
     *
     * @param flags        flags for the built-in plugins
     * @param extraPlugins additional plugins
     * @return fetcher
     * @throws FetcherConfigurationException if a plugin cannot be built from the flags, or plugins collide
     */
    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    public static Fetcher create(FetcherFlags flags, FetcherPlugin... extraPlugins)
            throws FetcherConfigurationException {
        ExecutorService executor = Executors.newFixedThreadPool(flags.getFetchThreads(), new FetchThreadFactory());
        try {
            List<FetcherPlugin> plugins = new ArrayList<>(builtinPlugins(flags, executor));
            plugins.addAll(Arrays.asList(extraPlugins));
            return new Fetcher(plugins, executor);
        } catch (FetcherConfigurationException | RuntimeException e) {
            executor.shutdownNow();
            throw e;
        }
    }

    private static List<FetcherPlugin> builtinPlugins(FetcherFlags flags, ExecutorService executor)
            throws FetcherConfigurationException {
        List<FetcherPlugin> plugins = new ArrayList<>();
        plugins.add(new CopyFetcherPlugin(flags, executor));
        plugins.add(new CurlFetcherPlugin(flags, executor));
        if (flags.getHadoopClient() == null) {
            Optional<Path> client = HadoopFetcherPlugin.defaultClient();
            if (client.isPresent()) {
                try {
                    plugins.add(HadoopFetcherPlugin.create(flags.toBuilder().hadoopClient(client.get()).build(),
                            executor));
                } catch (FetcherConfigurationException e) {
                    logger.atWarn().addKeyValue("client", client.get()).setCause(e)
                            .log("Hadoop client is not usable, hdfs URIs will not be fetched");
                }
            } else {
                logger.atWarn().log("No hadoop client found, hdfs URIs will not be fetched");
            }
        } else {
            // an explicitly configured client has to work
            plugins.add(HadoopFetcherPlugin.create(flags, executor));
        }
        plugins.add(DockerFetcherPlugin.create(flags, executor));
        return plugins;
    }

    /**
     * Fetch a URI with the plugin registered for its scheme.
     *
     * @param uri       what to fetch
     * @param directory where to put it, created if missing
     * @return future completing once the content is in place, or exceptionally with a
     *     {@link com.aws.greengrass.fetcher.exceptions.FetchException}
     */
    public CompletableFuture<Void> fetch(Uri uri, Path directory) {
        FetcherPlugin plugin = pluginsByScheme.get(uri.getScheme().toLowerCase(Locale.ROOT));
        if (plugin == null) {
            return CompletableFuture.failedFuture(new UnsupportedSchemeException(
                    String.format("No plugin handles scheme %s of %s", uri.getScheme(), uri)));
        }
        return dispatch(plugin, uri, directory, null);
    }

    /**
     * Fetch a URI with a plugin picked by name, whatever the URI's scheme.
     *
     * @param uri        what to fetch
     * @param directory  where to put it, created if missing
     * @param pluginName name of the plugin
     * @param overrides  flags replacing the plugin's own for this call, may be null
     * @return future completing once the content is in place
     */
    public CompletableFuture<Void> fetch(Uri uri, Path directory, String pluginName,
                                         @Nullable FetcherFlags overrides) {
        FetcherPlugin plugin = pluginsByName.get(pluginName);
        if (plugin == null) {
            return CompletableFuture.failedFuture(new UnknownPluginException(
                    String.format("No plugin named %s, registered plugins are %s", pluginName,
                            pluginsByName.keySet())));
        }
        return dispatch(plugin, uri, directory, overrides);
    }

    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    private CompletableFuture<Void> dispatch(FetcherPlugin plugin, Uri uri, Path directory,
                                             @Nullable FetcherFlags overrides) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new FetchIOException("Unable to create directory " + directory, e,
                    FetchErrorCode.IO_WRITE_ERROR));
        }
        logger.atDebug().addKeyValue(URI_LOG_KEY, uri).addKeyValue(PLUGIN_LOG_KEY, plugin.getName())
                .log("Dispatching fetch");
        try {
            return Futures.unwrapped(overrides == null ? plugin.fetch(uri, directory)
                    : plugin.fetch(uri, directory, overrides));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public Set<String> getPluginNames() {
        return pluginsByName.keySet();
    }

    public Set<String> getSchemes() {
        return pluginsByScheme.keySet();
    }

    public Optional<FetcherPlugin> getPlugin(String name) {
        return Optional.ofNullable(pluginsByName.get(name));
    }

    /**
     * Shut down the worker pool of the built-in plugins. Fetches still running are interrupted.
     */
    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private static class FetchThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, String.format(THREAD_NAME_FORMAT, count.incrementAndGet()));
            t.setDaemon(true);
            return t;
        }
    }
}
