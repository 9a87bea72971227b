/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins.docker;

import lombok.Value;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * A {@code WWW-Authenticate} challenge, e.g.
 * {@code Bearer realm="https://auth.docker.io/token",service="registry.docker.io",scope="repository:x:pull"}.
 */
@Value
public class AuthChallenge {
    public static final String BEARER = "bearer";
    public static final String BASIC = "basic";
    private static final Pattern SCHEME = Pattern.compile("^\\s*([A-Za-z][A-Za-z0-9._-]*)\\s*(.*)$");
    private static final Pattern PARAM = Pattern.compile("([A-Za-z][A-Za-z0-9._-]*)\\s*=\\s*(?:\"([^\"]*)\"|([^,\\s]+))");

    // lower case
    String scheme;
    @Nullable
    String realm;
    @Nullable
    String service;
    @Nullable
    String scope;

    /**
     * Parse a challenge header.
     *
     * @param header header value
     * @return challenge, empty if the header is not a challenge
     */
    public static Optional<AuthChallenge> parse(@Nullable String header) {
        if (header == null) {
            return Optional.empty();
        }
        Matcher m = SCHEME.matcher(header);
        if (!m.matches()) {
            return Optional.empty();
        }
        Map<String, String> params = new HashMap<>();
        Matcher p = PARAM.matcher(m.group(2));
        while (p.find()) {
            params.put(p.group(1).toLowerCase(Locale.ROOT), p.group(2) == null ? p.group(3) : p.group(2));
        }
        return Optional.of(new AuthChallenge(m.group(1).toLowerCase(Locale.ROOT), params.get("realm"),
                params.get("service"), params.get("scope")));
    }

    public boolean isBearer() {
        return BEARER.equals(scheme);
    }

    public boolean isBasic() {
        return BASIC.equals(scheme);
    }
}
