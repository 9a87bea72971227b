/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins;

import com.aws.greengrass.fetcher.FetcherFlags;
import com.aws.greengrass.fetcher.models.Uri;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nullable;

/**
 * A back end able to materialize the content of some URIs in a local directory.
 */
public interface FetcherPlugin {

    /**
     * Unique name the plugin can be invoked by.
     *
     * @return plugin name
     */
    String getName();

    /**
     * URI schemes routed to this plugin by default.
     *
     * @return lower case schemes
     */
    Set<String> getSchemes();

    /**
     * Fetch the content of a URI into a directory. On failure no partially written file is left under the final
     * name of the content.
     *
     * @param uri       what to fetch
     * @param directory existing directory to put the content in
     * @return future completing once the content is in place, or exceptionally with a
     *     {@link com.aws.greengrass.fetcher.exceptions.FetchException}
     */
    CompletableFuture<Void> fetch(Uri uri, Path directory);

    /**
     * Fetch with flags that replace the plugin's own for this call only.
     *
     * @param uri       what to fetch
     * @param directory existing directory to put the content in
     * @param overrides flags for this call, null to use the plugin's flags
     * @return future completing once the content is in place
     */
    default CompletableFuture<Void> fetch(Uri uri, Path directory, @Nullable FetcherFlags overrides) {
        return fetch(uri, directory);
    }
}
