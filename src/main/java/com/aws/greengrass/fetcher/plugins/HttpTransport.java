/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins;

import com.aws.greengrass.fetcher.exceptions.ArtifactNotFoundException;
import com.aws.greengrass.fetcher.exceptions.DownloadTimeoutException;
import com.aws.greengrass.fetcher.exceptions.FetchException;
import com.aws.greengrass.fetcher.exceptions.TransportException;
import com.aws.greengrass.fetcher.util.Utils;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.http.HttpExecuteRequest;
import software.amazon.awssdk.http.HttpExecuteResponse;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.SdkHttpFullRequest;
import software.amazon.awssdk.http.SdkHttpMethod;
import software.amazon.awssdk.http.SdkHttpResponse;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * GET requests over an {@link SdkHttpClient}, following redirects.
 */
public final class HttpTransport {
    public static final String USER_AGENT = "greengrass-uri-fetcher/1.0";
    public static final String AUTHORIZATION_HEADER = "Authorization";
    public static final String CONTENT_LENGTH_HEADER = "Content-Length";
    static final int MAX_REDIRECTS = 5;
    private static final int MAX_ERROR_BODY_LENGTH = 4096;
    private static final Logger logger = LoggerFactory.getLogger(HttpTransport.class);

    private HttpTransport() {
    }

    /**
     * Send a GET request and follow redirects to the final response. Credentials are only sent to the host they
     * were meant for.
     *
     * @param client  client to send with
     * @param uri     request URI
     * @param headers request headers
     * @return the first response that is not a redirect; the caller owns its body
     * @throws FetchException if the request cannot be sent, stalls or redirects too often
     */
    public static HttpExecuteResponse get(SdkHttpClient client, URI uri, Map<String, String> headers)
            throws FetchException {
        URI current = uri;
        Map<String, String> currentHeaders = new LinkedHashMap<>(headers);
        for (int redirects = 0; ; redirects++) {
            HttpExecuteResponse response = send(client, current, currentHeaders);
            int status = response.httpResponse().statusCode();
            Optional<String> location = response.httpResponse().firstMatchingHeader("Location");
            if (!isRedirect(status) || !location.isPresent()) {
                return response;
            }
            closeBody(response);
            if (redirects >= MAX_REDIRECTS) {
                throw TransportException.forHttpStatus("Too many redirects fetching " + uri, status);
            }
            URI next = current.resolve(location.get());
            if (!Objects.equals(next.getHost(), current.getHost())) {
                currentHeaders.remove(AUTHORIZATION_HEADER);
            }
            logger.atDebug().addKeyValue("uri", current).addKeyValue("location", next).log("Following redirect");
            current = next;
        }
    }

    private static HttpExecuteResponse send(SdkHttpClient client, URI uri, Map<String, String> headers)
            throws FetchException {
        SdkHttpFullRequest.Builder request = SdkHttpFullRequest.builder().uri(uri).method(SdkHttpMethod.GET)
                .putHeader("User-Agent", USER_AGENT);
        headers.forEach(request::putHeader);
        try {
            return client.prepareRequest(HttpExecuteRequest.builder().request(request.build()).build()).call();
        } catch (IOException e) {
            if (Utils.getUltimateCause(e) instanceof SocketTimeoutException) {
                throw new DownloadTimeoutException("No response from " + uri, e);
            }
            throw new TransportException("Request to " + uri + " failed", e);
        }
    }

    static boolean isRedirect(int status) {
        return status == HttpURLConnection.HTTP_MOVED_PERM || status == HttpURLConnection.HTTP_MOVED_TEMP
                || status == HttpURLConnection.HTTP_SEE_OTHER || status == 307 || status == 308;
    }

    public static InputStream body(HttpExecuteResponse response) {
        return response.responseBody().map(InputStream.class::cast).orElseGet(InputStream::nullInputStream);
    }

    /**
     * Read a small response body, such as a token or an error document.
     *
     * @param response response to read
     * @return body text
     * @throws FetchException if the body cannot be read
     */
    public static String readBody(HttpExecuteResponse response) throws FetchException {
        try (InputStream in = body(response)) {
            return IOUtils.toString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TransportException("Unable to read the response body", e);
        }
    }

    /**
     * Release a response whose body is not needed.
     *
     * @param response response to release
     */
    public static void closeBody(HttpExecuteResponse response) {
        response.responseBody().ifPresent(body -> {
            try {
                body.close();
            } catch (IOException e) {
                logger.atDebug().setCause(e).log("Unable to close response body");
            }
        });
    }

    /**
     * Map an unsuccessful response to the matching failure, consuming its body.
     *
     * @param response unsuccessful response
     * @param what     what was requested, for the message
     * @return failure to throw
     */
    public static FetchException failure(HttpExecuteResponse response, String what) {
        int status = response.httpResponse().statusCode();
        String detail = errorDetail(response);
        if (status == HttpURLConnection.HTTP_NOT_FOUND) {
            return new ArtifactNotFoundException(what + " not found" + detail);
        }
        return TransportException.forHttpStatus(String.format("Unexpected HTTP status %d for %s%s", status, what,
                detail), status);
    }

    private static String errorDetail(HttpExecuteResponse response) {
        try (InputStream in = body(response)) {
            byte[] bytes = in.readNBytes(MAX_ERROR_BODY_LENGTH);
            String text = new String(bytes, StandardCharsets.UTF_8).trim();
            return text.isEmpty() ? "" : ": " + text;
        } catch (IOException e) {
            logger.atDebug().setCause(e).log("Unable to read error response body");
            return "";
        }
    }

    public static Optional<String> header(HttpExecuteResponse response, String name) {
        return response.httpResponse().firstMatchingHeader(name);
    }

    /**
     * Content-Length of a response.
     *
     * @param sdkHttpResponse response
     * @return length, -1 when absent or malformed
     */
    public static long getContentLengthLong(SdkHttpResponse sdkHttpResponse) {
        long length = -1L;
        Optional<String> value = sdkHttpResponse.firstMatchingHeader(CONTENT_LENGTH_HEADER);
        try {
            if (value.isPresent()) {
                length = Long.parseLong(value.get().trim());
            }
        } catch (NumberFormatException e) {
            logger.atWarn().setCause(e).log("Failed to parse content-length from http response");
        }
        return length;
    }
}
