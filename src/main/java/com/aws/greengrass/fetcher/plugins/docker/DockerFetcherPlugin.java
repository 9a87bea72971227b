/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins.docker;

import com.aws.greengrass.fetcher.FetcherFlags;
import com.aws.greengrass.fetcher.exceptions.ArtifactIntegrityException;
import com.aws.greengrass.fetcher.exceptions.FetchException;
import com.aws.greengrass.fetcher.exceptions.FetchIOException;
import com.aws.greengrass.fetcher.exceptions.FetcherConfigurationException;
import com.aws.greengrass.fetcher.exceptions.InvalidUriException;
import com.aws.greengrass.fetcher.exceptions.ManifestParseException;
import com.aws.greengrass.fetcher.exceptions.TransportException;
import com.aws.greengrass.fetcher.models.Uri;
import com.aws.greengrass.fetcher.models.Uris;
import com.aws.greengrass.fetcher.plugins.AbstractFetcherPlugin;
import com.aws.greengrass.fetcher.plugins.HttpTransport;
import com.aws.greengrass.fetcher.util.CommitableFile;
import com.aws.greengrass.fetcher.util.Digest;
import com.aws.greengrass.fetcher.util.Futures;
import software.amazon.awssdk.http.HttpExecuteResponse;
import software.amazon.awssdk.http.SdkHttpClient;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;

/**
 * Fetches manifests, blobs and whole images from docker registries.
 * <ul>
 *     <li>{@code manifest}: the raw manifest is written to a file named {@value #MANIFEST_FILE}.</li>
 *     <li>{@code blob}: the blob is written to a file named by its digest, after its size and digest were
 *     verified.</li>
 *     <li>{@code image}: the manifest, then every layer blob it lists, concurrently.</li>
 * </ul>
 */
public class DockerFetcherPlugin extends AbstractFetcherPlugin {
    public static final String NAME = "docker";
    public static final String MANIFEST_FILE = "manifest";
    public static final String CONTENT_DIGEST_HEADER = "Docker-Content-Digest";
    private static final Set<String> SCHEMES = Collections.singleton(Uris.DOCKER);

    private final DockerConfig dockerConfig;

    DockerFetcherPlugin(FetcherFlags flags, Executor executor, DockerConfig dockerConfig) {
        super(flags, executor);
        this.dockerConfig = dockerConfig;
    }

    /**
     * Build the plugin, reading the credential file the flags name.
     *
     * @param flags    plugin flags
     * @param executor executor fetches run on
     * @return plugin
     * @throws FetcherConfigurationException if the credential file cannot be read
     */
    public static DockerFetcherPlugin create(FetcherFlags flags, Executor executor)
            throws FetcherConfigurationException {
        return new DockerFetcherPlugin(flags, executor, DockerConfig.load(flags.getDockerConfig()));
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
        DockerReference reference;
        DockerConfig config;
        try {
            reference = DockerUriParser.parse(uri, flags);
            config = flags == this.flags ? dockerConfig : DockerConfig.load(flags.getDockerConfig());
        } catch (InvalidUriException | FetcherConfigurationException e) {
            return CompletableFuture.failedFuture(e);
        }
        Registry registry = reference.getRegistry();
        config.getCredentials(registry.getEndpoint()).ifPresent(registry::setCredentials);

        SdkHttpClient httpClient = getSdkHttpClient(flags);
        RegistryClient client = new RegistryClient(httpClient, registry, flags);
        CompletableFuture<Void> result;
        switch (reference.getKind()) {
            case MANIFEST:
                result = runAsync(() -> {
                    fetchManifest(client, reference, directory);
                    return null;
                });
                break;
            case BLOB:
                result = runAsync(() -> {
                    fetchBlob(client, reference.getRepository(), reference.getDigest(), null, directory);
                    return null;
                });
                break;
            default:
                result = fetchImage(client, reference, directory);
                break;
        }
        return result.whenComplete((v, t) -> httpClient.close());
    }

    /**
     * Fetch the manifest and then every layer blob it lists. Blob fetches run concurrently; once one fails, the
     * ones that have not started yet are skipped and the failure is reported after the running ones finished.
     */
    private CompletableFuture<Void> fetchImage(RegistryClient client, DockerReference reference, Path directory) {
        return Futures.supplyAsync(() -> fetchManifest(client, reference, directory), executor)
                .thenCompose(manifest -> {
                    // schema 1 repeats layers, the empty one in particular
                    Map<String, Long> blobs = new LinkedHashMap<>();
                    for (Descriptor layer : manifest.layerDescriptors()) {
                        blobs.putIfAbsent(layer.getDigest(), layer.getSize());
                    }
                    AtomicBoolean failed = new AtomicBoolean(false);
                    List<CompletableFuture<Void>> fetches = new ArrayList<>(blobs.size());
                    blobs.forEach((digest, size) -> fetches.add(Futures.supplyAsync(() -> {
                        if (failed.get()) {
                            logger.atDebug().addKeyValue("digest", digest).log("Skipping blob, the image already "
                                    + "failed");
                            return null;
                        }
                        try {
                            fetchBlob(client, reference.getRepository(), digest, size, directory);
                        } catch (FetchException | RuntimeException e) {
                            failed.set(true);
                            throw e;
                        }
                        return null;
                    }, executor)));
                    return Futures.allOfFailFast(fetches);
                });
    }

    /**
     * Fetch a manifest, resolving a manifest list to the image manifest of this platform, and write it to
     * {@value #MANIFEST_FILE}.
     *
     * @return the parsed image manifest
     */
    ImageManifest fetchManifest(RegistryClient client, DockerReference reference, Path directory)
            throws FetchException {
        String repository = reference.getRepository();
        byte[] body = getManifest(client, repository, reference.getReference(), reference.isDigestReference());
        ImageManifest manifest = ManifestParser.parse(body);
        if (manifest instanceof ManifestList) {
            ManifestList.Entry entry = ((ManifestList) manifest).select(ManifestList.DEFAULT_OS,
                    ManifestList.DEFAULT_ARCHITECTURE);
            logger.atDebug().addKeyValue("repository", repository).addKeyValue("digest", entry.getDigest())
                    .log("Resolved manifest list");
            body = getManifest(client, repository, entry.getDigest(), true);
            manifest = ManifestParser.parse(body);
            if (manifest instanceof ManifestList) {
                throw new ManifestParseException("Manifest list " + entry.getDigest() + " refers to another list");
            }
        }

        Path target = directory.resolve(MANIFEST_FILE);
        try (CommitableFile file = openTarget(target)) {
            file.write(body);
            commit(file);
        } catch (IOException e) {
            throw new FetchIOException("Unable to write manifest to " + target, e);
        }
        logger.atDebug().addKeyValue("repository", repository).addKeyValue("schemaVersion",
                manifest.getSchemaVersion()).addKeyValue("layers", manifest.layerDescriptors().size())
                .log("Fetched manifest");
        return manifest;
    }

    private byte[] getManifest(RegistryClient client, String repository, String reference, boolean byDigest)
            throws FetchException {
        HttpExecuteResponse response = client.getManifest(repository, reference);
        String what = String.format("manifest %s of %s", reference, repository);
        if (!response.httpResponse().isSuccessful()) {
            throw HttpTransport.failure(response, what);
        }
        byte[] body;
        try (InputStream in = HttpTransport.body(response)) {
            body = in.readAllBytes();
        } catch (IOException e) {
            throw new TransportException("Unable to read " + what, e);
        }
        if (byDigest) {
            Optional<String> served = HttpTransport.header(response, CONTENT_DIGEST_HEADER);
            if (served.isPresent() && !Digest.isEqual(served.get().trim(), reference)) {
                throw new ArtifactIntegrityException("Registry served another manifest than requested", reference,
                        served.get().trim());
            }
        }
        return body;
    }

    /**
     * Download a blob to a file named by its digest, verifying its size and, for sha256 digests, its content.
     *
     * @param expectedSize size the manifest declares, null to go by the response's Content-Length
     */
    void fetchBlob(RegistryClient client, String repository, String digest, @Nullable Long expectedSize,
                   Path directory) throws FetchException {
        Path target = directory.resolve(digest);
        HttpExecuteResponse response = client.getBlob(repository, digest);
        if (!response.httpResponse().isSuccessful()) {
            throw HttpTransport.failure(response, String.format("blob %s of %s", digest, repository));
        }
        long expected = expectedSize == null ? HttpTransport.getContentLengthLong(response.httpResponse())
                : expectedSize;
        MessageDigest messageDigest = Digest.messageDigestFor(digest).orElse(null);

        try (InputStream body = HttpTransport.body(response); CommitableFile file = openTarget(target)) {
            long size = download(body, file, messageDigest);
            if (expected >= 0 && size != expected) {
                throw ArtifactIntegrityException.sizeMismatch("blob " + digest, expected, size);
            }
            if (messageDigest != null) {
                String actual = Digest.toContentDigest(messageDigest);
                if (!Digest.isEqual(actual, digest)) {
                    throw new ArtifactIntegrityException("Content of blob does not match its digest", digest,
                            actual);
                }
            }
            commit(file);
        } catch (IOException e) {
            throw new FetchIOException("Unable to close " + target, e);
        }
        logger.atDebug().addKeyValue("digest", digest).addKeyValue("repository", repository).log("Fetched blob");
    }
}
