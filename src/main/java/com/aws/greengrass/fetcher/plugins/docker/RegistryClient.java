/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.plugins.docker;

import com.aws.greengrass.fetcher.FetcherFlags;
import com.aws.greengrass.fetcher.exceptions.FetchException;
import com.aws.greengrass.fetcher.exceptions.InvalidUriException;
import com.aws.greengrass.fetcher.exceptions.RegistryAuthException;
import com.aws.greengrass.fetcher.plugins.HttpTransport;
import com.aws.greengrass.fetcher.util.SerializerFactory;
import com.aws.greengrass.fetcher.util.Utils;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.http.HttpExecuteResponse;
import software.amazon.awssdk.http.SdkHttpClient;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Speaks the registry HTTP API for the duration of one fetch call. Requests go out unauthenticated until the
 * registry challenges; the challenge is then answered once with a token (or Basic credentials) and the token is
 * reused by every later request of the call.
 */
public class RegistryClient {
    public static final String WWW_AUTHENTICATE_HEADER = "WWW-Authenticate";
    private static final Logger logger = LoggerFactory.getLogger(RegistryClient.class);

    private final SdkHttpClient client;
    private final Registry registry;
    private final FetcherFlags flags;
    // Authorization header value answering the last challenge
    private volatile String authorization;

    public RegistryClient(SdkHttpClient client, Registry registry, FetcherFlags flags) {
        this.client = client;
        this.registry = registry;
        this.flags = flags;
    }

    public HttpExecuteResponse getManifest(String repository, String reference) throws FetchException {
        return get(repository, "/manifests/" + reference,
                Collections.singletonMap("Accept", String.join(", ", ManifestParser.ACCEPTED_MEDIA_TYPES)));
    }

    public HttpExecuteResponse getBlob(String repository, String digest) throws FetchException {
        return get(repository, "/blobs/" + digest, Collections.emptyMap());
    }

    /**
     * GET a path below {@code /v2/<repository>}, answering one authentication challenge if the registry sends one.
     *
     * @param repository repository name
     * @param path       path below the repository, starting with a slash
     * @param headers    extra request headers
     * @return the response, the caller owns its body
     * @throws FetchException if the request fails or the registry still refuses access after authentication
     */
    HttpExecuteResponse get(String repository, String path, Map<String, String> headers) throws FetchException {
        URI uri = toUri(registry.getBaseUri() + "/v2/" + repository + path);
        String used = authorization;
        HttpExecuteResponse response = HttpTransport.get(client, uri, withAuthorization(headers, used));
        if (response.httpResponse().statusCode() != HttpURLConnection.HTTP_UNAUTHORIZED) {
            return response;
        }
        Optional<String> challenge = HttpTransport.header(response, WWW_AUTHENTICATE_HEADER);
        HttpTransport.closeBody(response);

        String answer = authenticate(repository, challenge.flatMap(AuthChallenge::parse), used);
        logger.atInfo().addKeyValue("repository", repository).addKeyValue("registry", registry.getEndpoint())
                .log("Registry requested authentication, retrying the request once");
        response = HttpTransport.get(client, uri, withAuthorization(headers, answer));
        if (response.httpResponse().statusCode() == HttpURLConnection.HTTP_UNAUTHORIZED) {
            HttpTransport.closeBody(response);
            throw new RegistryAuthException(String.format("Registry %s refused access to %s after authentication",
                    registry.getEndpoint(), repository));
        }
        return response;
    }

    private synchronized String authenticate(String repository, Optional<AuthChallenge> challenge, String used)
            throws FetchException {
        // another request of this call may have answered a challenge already
        if (authorization != null && !authorization.equals(used)) {
            return authorization;
        }
        if (!challenge.isPresent()) {
            throw new RegistryAuthException(String.format("Registry %s requires authentication but sent no "
                    + "challenge", registry.getEndpoint()));
        }
        AuthChallenge c = challenge.get();
        if (c.isBasic()) {
            if (registry.getCredentials() == null) {
                throw new RegistryAuthException(String.format("Registry %s requires credentials and none are "
                        + "configured", registry.getEndpoint()));
            }
            authorization = registry.getCredentials().toBasicAuthorization();
        } else if (c.isBearer()) {
            authorization = "Bearer " + requestToken(repository, c);
        } else {
            throw new RegistryAuthException(String.format("Registry %s asks for unsupported authentication scheme %s",
                    registry.getEndpoint(), c.getScheme()));
        }
        return authorization;
    }

    private String requestToken(String repository, AuthChallenge challenge) throws FetchException {
        String realm = Utils.isEmpty(flags.getDockerAuthServer()) ? challenge.getRealm() : flags.getDockerAuthServer();
        if (Utils.isEmpty(realm)) {
            throw new RegistryAuthException("Bearer challenge of " + registry.getEndpoint() + " has no realm");
        }
        Map<String, String> params = new LinkedHashMap<>();
        if (challenge.getService() != null) {
            params.put("service", challenge.getService());
        }
        params.put("scope", challenge.getScope() == null ? "repository:" + repository + ":pull"
                : challenge.getScope());
        StringBuilder url = new StringBuilder(realm);
        char separator = realm.indexOf('?') < 0 ? '?' : '&';
        for (Map.Entry<String, String> e : params.entrySet()) {
            url.append(separator).append(e.getKey()).append('=')
                    .append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
            separator = '&';
        }

        Map<String, String> headers = registry.getCredentials() == null ? Collections.emptyMap()
                : Collections.singletonMap(HttpTransport.AUTHORIZATION_HEADER,
                        registry.getCredentials().toBasicAuthorization());
        HttpExecuteResponse response = HttpTransport.get(client, toUri(url.toString()), headers);
        if (!response.httpResponse().isSuccessful()) {
            int status = response.httpResponse().statusCode();
            HttpTransport.closeBody(response);
            throw new RegistryAuthException(String.format("Token request to %s failed with HTTP status %d", realm,
                    status));
        }
        String body = HttpTransport.readBody(response);
        JsonNode json;
        try {
            json = SerializerFactory.getFailSafeJsonObjectMapper().readTree(body);
        } catch (IOException e) {
            throw new RegistryAuthException("Token response of " + realm + " is not JSON", e);
        }
        String token = json.path("token").asText("");
        if (token.isEmpty()) {
            token = json.path("access_token").asText("");
        }
        if (token.isEmpty()) {
            throw new RegistryAuthException("Token response of " + realm + " holds no token");
        }
        return token;
    }

    private static Map<String, String> withAuthorization(Map<String, String> headers, String authorization) {
        if (authorization == null) {
            return headers;
        }
        Map<String, String> result = new LinkedHashMap<>(headers);
        result.put(HttpTransport.AUTHORIZATION_HEADER, authorization);
        return result;
    }

    private static URI toUri(String s) throws InvalidUriException {
        try {
            return new URI(s);
        } catch (URISyntaxException e) {
            throw new InvalidUriException("Malformed registry URL " + s, e);
        }
    }
}
