/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.models;

import com.aws.greengrass.fetcher.exceptions.InvalidUriException;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.apache.commons.io.FilenameUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

import static com.aws.greengrass.fetcher.util.Utils.isEmpty;

/**
 * Immutable, scheme-tagged locator of something to fetch. Instances are made by {@link Uris} or {@link #parse}.
 */
@Value
@Builder(toBuilder = true)
public class Uri {
    // RFC 3986 pchar minus pct-encoded, plus '/'
    private static final String PATH_CHARS = "-._~!$&'()*+,;=:@/";
    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    @NonNull
    String scheme;
    @Nullable
    String host;
    @Nullable
    Integer port;
    @NonNull
    @Builder.Default
    String path = "";
    // insertion ordered
    @Singular("queryParameter")
    Map<String, String> query;
    @Nullable
    String fragment;

    /**
     * Parse a URI string such as {@code docker://registry-1.docker.io/library/busybox?image=latest}.
     *
     * @param uri string form
     * @return parsed URI
     * @throws InvalidUriException if the string is not a URI with a scheme
     */
    public static Uri parse(String uri) throws InvalidUriException {
        URI parsed;
        try {
            parsed = new URI(uri);
        } catch (URISyntaxException e) {
            throw new InvalidUriException("Malformed URI " + uri, e);
        }
        if (isEmpty(parsed.getScheme())) {
            throw new InvalidUriException("URI has no scheme: " + uri);
        }
        UriBuilder builder = Uri.builder().scheme(parsed.getScheme().toLowerCase(Locale.ROOT))
                .host(parsed.getHost())
                .port(parsed.getPort() < 0 ? null : parsed.getPort())
                .path(parsed.getPath() == null ? "" : parsed.getPath())
                .fragment(parsed.getFragment());
        String rawQuery = parsed.getRawQuery();
        if (!isEmpty(rawQuery)) {
            for (String pair : rawQuery.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String key = eq < 0 ? pair : pair.substring(0, eq);
                String value = eq < 0 ? "" : pair.substring(eq + 1);
                builder.queryParameter(URLDecoder.decode(key, StandardCharsets.UTF_8),
                        URLDecoder.decode(value, StandardCharsets.UTF_8));
            }
        }
        return builder.build();
    }

    public Optional<String> getQueryParameter(String key) {
        return Optional.ofNullable(query.get(key));
    }

    /**
     * Base name of the path, empty when the path ends with a separator.
     *
     * @return last path segment
     */
    public String getLastPathSegment() {
        return FilenameUtils.getName(path);
    }

    /**
     * Registry style authority: {@code host} or {@code host:port}.
     *
     * @return authority, empty string when there is no host
     */
    public String getAuthority() {
        if (host == null) {
            return "";
        }
        return port == null ? host : host + ':' + port;
    }

    /**
     * Convert to a {@link URI} for handing to transports. The path and fragment are percent-encoded.
     *
     * @return java.net form of this URI
     * @throws InvalidUriException if the components do not make a valid URI
     */
    public URI toJavaUri() throws InvalidUriException {
        try {
            return new URI(toString());
        } catch (URISyntaxException e) {
            throw new InvalidUriException("Malformed URI " + this, e);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(scheme).append("://").append(getAuthority()).append(encode(path, ""));
        if (!query.isEmpty()) {
            char separator = '?';
            for (Map.Entry<String, String> e : query.entrySet()) {
                sb.append(separator).append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)).append('=')
                        .append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
                separator = '&';
            }
        }
        if (fragment != null) {
            sb.append('#').append(encode(fragment, "?"));
        }
        return sb.toString();
    }

    private static String encode(String decoded, String alsoAllowed) {
        StringBuilder sb = new StringBuilder(decoded.length());
        for (byte b : decoded.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if (c < 0x80 && (Character.isLetterOrDigit(c) || PATH_CHARS.indexOf(c) >= 0
                    || alsoAllowed.indexOf(c) >= 0)) {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX_DIGITS[c >> 4]).append(HEX_DIGITS[c & 0xF]);
            }
        }
        return sb.toString();
    }
}
