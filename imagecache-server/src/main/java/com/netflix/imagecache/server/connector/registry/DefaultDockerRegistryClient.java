/*
 * Copyright 2026 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.imagecache.server.connector.registry;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.netflix.imagecache.api.json.ObjectMappers;
import com.netflix.imagecache.common.network.client.WebClientAddOns;
import com.netflix.imagecache.common.network.client.WebClientExt;
import com.netflix.imagecache.common.network.client.internal.WebClientMetric;
import com.netflix.imagecache.common.runtime.ImageCacheRuntime;
import com.netflix.imagecache.common.util.StringExt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

/**
 * This {@link DefaultDockerRegistryClient} implementation of {@link RegistryClient} connects to
 * Docker V2 REST API compatible registry endpoints. Requests are sent anonymously first. On a 401 response
 * the <code>WWW-Authenticate</code> challenge is answered with Basic credentials or a Bearer token obtained
 * from the token realm, and the authorization is cached per registry and repository.
 */
@Singleton
public class DefaultDockerRegistryClient implements RegistryClient {

    private static final Logger logger = LoggerFactory.getLogger(DefaultDockerRegistryClient.class);

    static final String DOCKER_DIGEST_HEADER = "Docker-Content-Digest";

    private static final String MANIFEST_TYPES = Joiner.on(", ").join(
            "application/vnd.docker.distribution.manifest.v2+json",
            "application/vnd.docker.distribution.manifest.list.v2+json",
            "application/vnd.oci.image.manifest.v1+json",
            "application/vnd.oci.image.index.v1+json"
    );
    private static final String JSON_TYPE = "application/json";

    private static final Pattern LINK_NEXT_PATTERN = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"?next\"?");
    private static final Pattern CHALLENGE_PARAM_PATTERN = Pattern.compile("(\\w+)=\"([^\"]*)\"");

    private final RegistryClientConfiguration configuration;
    private final DockerCredentials credentials;
    private final ImageCacheRuntime runtime;
    private final WebClientMetric webClientMetrics;

    private final ConcurrentMap<String, WebClient> clientsByBaseUrl = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> authorizations = new ConcurrentHashMap<>();

    @Inject
    public DefaultDockerRegistryClient(RegistryClientConfiguration configuration, ImageCacheRuntime runtime) {
        this(configuration, DockerCredentials.load(configuration.getCredentialsFile()), runtime);
    }

    public DefaultDockerRegistryClient(RegistryClientConfiguration configuration,
                                       DockerCredentials credentials,
                                       ImageCacheRuntime runtime) {
        this.configuration = configuration;
        this.credentials = credentials;
        this.runtime = runtime;
        this.webClientMetrics = new WebClientMetric(DefaultDockerRegistryClient.class.getSimpleName(), runtime.getRegistry(), DefaultDockerRegistryClient::toOperation);
    }

    @Override
    public String getDefaultRegistryHost() {
        return configuration.getDefaultRegistryHost();
    }

    @Override
    public Mono<List<String>> getTags(String registryHost, String repository) {
        return fetchTagPage(registryHost, repository, "/v2/" + repository + "/tags/list")
                .expand(page -> page.getNextPath()
                        .map(next -> fetchTagPage(registryHost, repository, next))
                        .orElse(Mono.empty())
                )
                .take(configuration.getMaxTagPages())
                .<String>flatMapIterable(TagPage::getTags)
                .collectList();
    }

    /**
     * Gets the content digest for the provided repository and reference. The reference may be an image tag or
     * digest value. If the image does not exist or another error is encountered, an onError value is emitted.
     */
    @Override
    public Mono<String> getImageDigest(String registryHost, String repository, String reference) {
        return execute(registryHost, repository, HttpMethod.HEAD, "/v2/" + repository + "/manifests/" + reference, MANIFEST_TYPES)
                .flatMap(response -> {
                    if (response.getStatusCode() == HttpStatus.NOT_FOUND) {
                        return Mono.error(RegistryException.imageNotFound(repository, reference));
                    }
                    if (!response.getStatusCode().is2xxSuccessful()) {
                        return Mono.error(RegistryException.internalError(repository, reference, response.getStatusCode()));
                    }
                    String digest = response.getHeaders().getFirst(DOCKER_DIGEST_HEADER);
                    if (StringExt.isEmpty(digest)) {
                        return Mono.error(RegistryException.headerMissing(repository, reference, DOCKER_DIGEST_HEADER));
                    }
                    return Mono.just(digest);
                })
                .transform(mono -> withDefaults(mono, HttpMethod.HEAD));
    }

    private Mono<TagPage> fetchTagPage(String registryHost, String repository, String pathAndQuery) {
        return execute(registryHost, repository, HttpMethod.GET, pathAndQuery, JSON_TYPE)
                .flatMap(response -> {
                    if (response.getStatusCode() == HttpStatus.NOT_FOUND) {
                        return Mono.error(RegistryException.imageNotFound(repository, "tags"));
                    }
                    if (!response.getStatusCode().is2xxSuccessful()) {
                        return Mono.error(RegistryException.internalError(repository, "tags", response.getStatusCode()));
                    }
                    return Mono.just(TagPage.parse(
                            repository,
                            response.getBody(),
                            response.getHeaders().getFirst(HttpHeaders.LINK)
                    ));
                })
                .transform(mono -> withDefaults(mono, HttpMethod.GET));
    }

    private <T> Mono<T> withDefaults(Mono<T> mono, HttpMethod method) {
        return mono
                .timeout(Duration.ofMillis(configuration.getRegistryTimeoutMs()))
                .transformDeferred(WebClientExt.latencyMonoOperator(runtime.getClock(), webClientMetrics, method))
                .retryWhen(WebClientAddOns.retryer(
                        Duration.ofMillis(configuration.getRegistryRetryDelayMs()),
                        configuration.getRegistryRetryCount(),
                        error -> !(error instanceof RegistryException),
                        logger
                ));
    }

    private Mono<ResponseEntity<String>> execute(String registryHost,
                                                 String repository,
                                                 HttpMethod method,
                                                 String pathAndQuery,
                                                 String acceptType) {
        String baseUrl = toBaseUrl(registryHost);
        String authorizationKey = baseUrl + '|' + repository;
        return Mono.defer(() -> send(baseUrl, method, pathAndQuery, acceptType, authorizations.get(authorizationKey)))
                .flatMap(response -> {
                    if (response.getStatusCode() != HttpStatus.UNAUTHORIZED) {
                        return Mono.just(response);
                    }
                    String challenge = response.getHeaders().getFirst(HttpHeaders.WWW_AUTHENTICATE);
                    return authorize(baseUrl, repository, challenge)
                            .flatMap(authorization -> {
                                authorizations.put(authorizationKey, authorization);
                                return send(baseUrl, method, pathAndQuery, acceptType, authorization);
                            })
                            .flatMap(retried -> {
                                if (retried.getStatusCode() == HttpStatus.UNAUTHORIZED) {
                                    authorizations.remove(authorizationKey);
                                    return Mono.error(RegistryException.authenticationFailed(
                                            registryHost, repository, "authorization rejected by the registry"
                                    ));
                                }
                                return Mono.just(retried);
                            });
                });
    }

    private Mono<ResponseEntity<String>> send(String baseUrl,
                                              HttpMethod method,
                                              String pathAndQuery,
                                              String acceptType,
                                              String authorization) {
        return clientFor(baseUrl)
                .method(method)
                .uri(URI.create(baseUrl + pathAndQuery))
                .headers(headers -> {
                    headers.set(HttpHeaders.ACCEPT, acceptType);
                    if (authorization != null) {
                        headers.set(HttpHeaders.AUTHORIZATION, authorization);
                    }
                })
                .exchangeToMono(response -> response.toEntity(String.class));
    }

    private Mono<String> authorize(String baseUrl, String repository, String challenge) {
        String host = stripScheme(baseUrl);
        if (StringExt.isEmpty(challenge)) {
            return Mono.error(RegistryException.authenticationFailed(host, repository, "missing " + HttpHeaders.WWW_AUTHENTICATE + " header"));
        }
        String trimmed = challenge.trim();
        int schemeEnd = trimmed.indexOf(' ');
        String scheme = (schemeEnd < 0 ? trimmed : trimmed.substring(0, schemeEnd)).toLowerCase(Locale.ROOT);
        Map<String, String> params = parseChallengeParams(schemeEnd < 0 ? "" : trimmed.substring(schemeEnd + 1));

        switch (scheme) {
            case "basic":
                return credentials.getBasicAuthorization(host)
                        .map(Mono::just)
                        .orElseGet(() -> Mono.error(RegistryException.authenticationFailed(host, repository, "no credentials configured")));
            case "bearer":
                return fetchBearerToken(host, repository, params);
            default:
                return Mono.error(RegistryException.authenticationFailed(host, repository, "unsupported authentication scheme " + scheme));
        }
    }

    private Mono<String> fetchBearerToken(String host, String repository, Map<String, String> params) {
        String realm = params.get("realm");
        if (StringExt.isEmpty(realm)) {
            return Mono.error(RegistryException.authenticationFailed(host, repository, "bearer challenge without realm"));
        }
        URI realmUri;
        try {
            UriComponentsBuilder uriBuilder = UriComponentsBuilder.fromHttpUrl(realm);
            Optional.ofNullable(params.get("service")).ifPresent(service -> uriBuilder.queryParam("service", service));
            uriBuilder.queryParam("scope", params.getOrDefault("scope", "repository:" + repository + ":pull"));
            realmUri = uriBuilder.encode().build().toUri();
        } catch (IllegalArgumentException e) {
            return Mono.error(RegistryException.authenticationFailed(host, repository, "invalid token realm " + realm));
        }

        Optional<String> basicAuthorization = credentials.getBasicAuthorization(host);
        String realmBaseUrl = realmUri.getScheme() + "://" + realmUri.getRawAuthority();
        return clientFor(realmBaseUrl)
                .get()
                .uri(realmUri)
                .headers(headers -> basicAuthorization.ifPresent(value -> headers.set(HttpHeaders.AUTHORIZATION, value)))
                .exchangeToMono(response -> response.toEntity(String.class))
                .flatMap(response -> {
                    if (!response.getStatusCode().is2xxSuccessful()) {
                        return Mono.error(RegistryException.authenticationFailed(
                                host, repository, "token endpoint returned " + response.getStatusCode()
                        ));
                    }
                    return parseToken(response.getBody())
                            .map(token -> Mono.just("Bearer " + token))
                            .orElseGet(() -> Mono.error(RegistryException.authenticationFailed(host, repository, "no token in token endpoint response")));
                });
    }

    private WebClient clientFor(String baseUrl) {
        return clientsByBaseUrl.computeIfAbsent(baseUrl, url -> WebClient.builder()
                .baseUrl(url)
                .apply(b -> WebClientAddOns.addDefaults(b, url.startsWith("https://"), webClientMetrics))
                .build()
        );
    }

    /**
     * Registry request paths embed repository names and tags, so metrics are tagged with the API operation instead.
     */
    @VisibleForTesting
    static String toOperation(String path) {
        if (path.contains("/manifests/")) {
            return "manifests";
        }
        if (path.endsWith("/tags/list")) {
            return "tags";
        }
        return "auth";
    }

    @VisibleForTesting
    String toBaseUrl(String registryHost) {
        String trimmed = registryHost.endsWith("/") ? registryHost.substring(0, registryHost.length() - 1) : registryHost;
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        return (configuration.isSecure() ? "https://" : "http://") + trimmed;
    }

    private static String stripScheme(String baseUrl) {
        int idx = baseUrl.indexOf("://");
        return idx < 0 ? baseUrl : baseUrl.substring(idx + 3);
    }

    @VisibleForTesting
    static Map<String, String> parseChallengeParams(String paramText) {
        Map<String, String> params = new HashMap<>();
        Matcher matcher = CHALLENGE_PARAM_PATTERN.matcher(paramText);
        while (matcher.find()) {
            params.put(matcher.group(1).toLowerCase(Locale.ROOT), matcher.group(2));
        }
        return params;
    }

    private static Optional<String> parseToken(String body) {
        if (StringExt.isEmpty(body)) {
            return Optional.empty();
        }
        try {
            JsonNode root = ObjectMappers.defaultMapper().readTree(body);
            String token = root.path("token").asText("");
            if (token.isEmpty()) {
                token = root.path("access_token").asText("");
            }
            return token.isEmpty() ? Optional.empty() : Optional.of(token);
        } catch (IOException e) {
            logger.warn("Cannot parse token endpoint response: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * One page of the tag list, with the path of the next page taken from the <code>Link</code> header.
     */
    static class TagPage {

        private final List<String> tags;
        private final Optional<String> nextPath;

        TagPage(List<String> tags, Optional<String> nextPath) {
            this.tags = tags;
            this.nextPath = nextPath;
        }

        List<String> getTags() {
            return tags;
        }

        Optional<String> getNextPath() {
            return nextPath;
        }

        static TagPage parse(String repository, String body, String linkHeader) {
            List<String> tags = new ArrayList<>();
            if (StringExt.isNotEmpty(body)) {
                JsonNode root;
                try {
                    root = ObjectMappers.defaultMapper().readTree(body);
                } catch (IOException e) {
                    throw RegistryException.invalidResponse(repository, "tags", e.getMessage());
                }
                root.path("tags").forEach(tag -> tags.add(tag.asText()));
            }
            return new TagPage(Collections.unmodifiableList(tags), parseNextLink(linkHeader));
        }

        @VisibleForTesting
        static Optional<String> parseNextLink(String linkHeader) {
            if (StringExt.isEmpty(linkHeader)) {
                return Optional.empty();
            }
            Matcher matcher = LINK_NEXT_PATTERN.matcher(linkHeader);
            if (!matcher.find()) {
                return Optional.empty();
            }
            String next = matcher.group(1);
            if (next.startsWith("http://") || next.startsWith("https://")) {
                URI uri = URI.create(next);
                next = uri.getRawPath() + (uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery());
            }
            return Optional.of(next);
        }
    }
}
