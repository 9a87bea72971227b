/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins.docker;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import lombok.ToString;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * A docker registry, addressed by {@code host[:port]}.
 */
@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Registry {

    @EqualsAndHashCode.Include
    private final String endpoint;
    // plain HTTP instead of HTTPS
    private final boolean insecure;
    @Setter
    @ToString.Exclude
    private Credentials credentials;

    public Registry(String endpoint, boolean insecure) {
        this.endpoint = endpoint;
        this.insecure = insecure;
    }

    /**
     * Base of the registry API: {@code https://host[:port]}.
     *
     * @return base URI string without a trailing slash
     */
    public String getBaseUri() {
        return (insecure ? "http" : "https") + "://" + endpoint;
    }

    /**
     * Registry credentials.
     */
    @Getter
    public static class Credentials {
        @NonNull
        private final String username;
        @NonNull
        private final String password;

        public Credentials(@NonNull String username, @NonNull String password) {
            this.username = username;
            this.password = password;
        }

        /**
         * Value of an HTTP Basic {@code Authorization} header for these credentials.
         *
         * @return header value
         */
        public String toBasicAuthorization() {
            return "Basic " + Base64.getEncoder()
                    .encodeToString((username + ':' + password).getBytes(StandardCharsets.UTF_8));
        }
    }
}
