/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins;

import com.aws.greengrass.fetcher.exceptions.ArtifactNotFoundException;
import com.aws.greengrass.fetcher.exceptions.DownloadTimeoutException;
import com.aws.greengrass.fetcher.exceptions.FetchException;
import com.aws.greengrass.fetcher.exceptions.TransportException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.http.ExecutableHttpRequest;
import software.amazon.awssdk.http.HttpExecuteRequest;
import software.amazon.awssdk.http.HttpExecuteResponse;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.SdkHttpResponse;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HttpTransportTest {
    private static final String AUTH = "Bearer secret";

    @Mock
    SdkHttpClient client;
    @Mock
    ExecutableHttpRequest request;

    private static HttpExecuteResponse response(int status, String body, String... headers) {
        SdkHttpResponse.Builder builder = SdkHttpResponse.builder().statusCode(status);
        for (int i = 0; i < headers.length; i += 2) {
            builder.putHeader(headers[i], headers[i + 1]);
        }
        return HttpExecuteResponse.builder().response(builder.build()).responseBody(AbortableInputStream.create(
                new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)))).build();
    }

    private List<HttpExecuteRequest> sentRequests(int count) {
        ArgumentCaptor<HttpExecuteRequest> captor = ArgumentCaptor.forClass(HttpExecuteRequest.class);
        verify(client, times(count)).prepareRequest(captor.capture());
        return captor.getAllValues();
    }

    @Test
    void GIVEN_success_WHEN_get_THEN_response_returned_with_user_agent() throws Exception {
        when(client.prepareRequest(any())).thenReturn(request);
        when(request.call()).thenReturn(response(200, "body"));

        HttpExecuteResponse result = HttpTransport.get(client, URI.create("https://a.example/f"),
                Collections.singletonMap(HttpTransport.AUTHORIZATION_HEADER, AUTH));

        assertThat(HttpTransport.readBody(result), is("body"));
        HttpExecuteRequest sent = sentRequests(1).get(0);
        assertThat(sent.httpRequest().firstMatchingHeader("User-Agent").get(), is(HttpTransport.USER_AGENT));
        assertThat(sent.httpRequest().firstMatchingHeader(HttpTransport.AUTHORIZATION_HEADER).get(), is(AUTH));
    }

    @Test
    void GIVEN_redirect_to_same_host_WHEN_get_THEN_authorization_kept() throws Exception {
        when(client.prepareRequest(any())).thenReturn(request);
        when(request.call()).thenReturn(response(307, "", "Location", "/other"), response(200, "moved"));

        HttpTransport.get(client, URI.create("https://a.example/f"),
                Collections.singletonMap(HttpTransport.AUTHORIZATION_HEADER, AUTH));

        HttpExecuteRequest second = sentRequests(2).get(1);
        assertThat(second.httpRequest().getUri(), is(URI.create("https://a.example/other")));
        assertThat(second.httpRequest().firstMatchingHeader(HttpTransport.AUTHORIZATION_HEADER).get(), is(AUTH));
    }

    @Test
    void GIVEN_redirect_to_other_host_WHEN_get_THEN_authorization_dropped() throws Exception {
        when(client.prepareRequest(any())).thenReturn(request);
        when(request.call()).thenReturn(response(302, "", "Location", "https://cdn.example/blob?sig=x"),
                response(200, "blob"));

        HttpExecuteResponse result = HttpTransport.get(client, URI.create("https://a.example/f"),
                Collections.singletonMap(HttpTransport.AUTHORIZATION_HEADER, AUTH));

        assertThat(HttpTransport.readBody(result), is("blob"));
        HttpExecuteRequest second = sentRequests(2).get(1);
        assertThat(second.httpRequest().host(), is("cdn.example"));
        assertFalse(second.httpRequest().firstMatchingHeader(HttpTransport.AUTHORIZATION_HEADER).isPresent());
    }

    @Test
    void GIVEN_endless_redirects_WHEN_get_THEN_transport_error() throws Exception {
        when(client.prepareRequest(any())).thenReturn(request);
        when(request.call()).thenAnswer(invocation -> response(301, "", "Location", "/again"));

        TransportException e = assertThrows(TransportException.class,
                () -> HttpTransport.get(client, URI.create("http://a.example/f"), Collections.emptyMap()));
        assertThat(e.getStatus(), is(301));
        sentRequests(HttpTransport.MAX_REDIRECTS + 1);
    }

    @Test
    void GIVEN_socket_timeout_WHEN_get_THEN_download_timeout() throws Exception {
        when(client.prepareRequest(any())).thenReturn(request);
        when(request.call()).thenThrow(new SocketTimeoutException("Read timed out"));

        assertThrows(DownloadTimeoutException.class,
                () -> HttpTransport.get(client, URI.create("http://a.example/f"), Collections.emptyMap()));
    }

    @Test
    void GIVEN_connection_refused_WHEN_get_THEN_transport_error() throws Exception {
        when(client.prepareRequest(any())).thenReturn(request);
        when(request.call()).thenThrow(new IOException("Connection refused"));

        TransportException e = assertThrows(TransportException.class,
                () -> HttpTransport.get(client, URI.create("http://a.example/f"), Collections.emptyMap()));
        assertFalse(e.getStatusCode().isPresent());
    }

    @Test
    void GIVEN_error_responses_WHEN_failure_THEN_mapped_with_body_detail() {
        FetchException notFound = HttpTransport.failure(response(404, "{\"errors\":[\"MANIFEST_UNKNOWN\"]}"), "x");
        assertThat(notFound, instanceOf(ArtifactNotFoundException.class));
        assertThat(notFound.getMessage(), containsString("MANIFEST_UNKNOWN"));

        FetchException denied = HttpTransport.failure(response(403, ""), "x");
        assertThat(denied, instanceOf(TransportException.class));
        assertThat(((TransportException) denied).getStatus(), is(403));
    }

    @Test
    void GIVEN_content_length_headers_WHEN_get_content_length_THEN_parsed_or_minus_one() {
        assertThat(HttpTransport.getContentLengthLong(SdkHttpResponse.builder().statusCode(200)
                .putHeader("Content-Length", "42").build()), is(42L));
        assertThat(HttpTransport.getContentLengthLong(SdkHttpResponse.builder().statusCode(200)
                .putHeader("Content-Length", "lots").build()), is(-1L));
        assertThat(HttpTransport.getContentLengthLong(SdkHttpResponse.builder().statusCode(200).build()), is(-1L));
        assertTrue(HttpTransport.isRedirect(308));
        assertFalse(HttpTransport.isRedirect(304));
    }
}
