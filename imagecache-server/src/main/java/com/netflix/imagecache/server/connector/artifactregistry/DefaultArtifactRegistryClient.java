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

package com.netflix.imagecache.server.connector.artifactregistry;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import com.netflix.imagecache.api.json.ObjectMappers;
import com.netflix.imagecache.common.network.client.WebClientAddOns;
import com.netflix.imagecache.common.network.client.WebClientExt;
import com.netflix.imagecache.common.network.client.internal.WebClientMetric;
import com.netflix.imagecache.common.runtime.ImageCacheRuntime;
import com.netflix.imagecache.common.util.StringExt;
import com.netflix.imagecache.server.connector.registry.RegistryException;
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
 * {@link ArtifactRegistryClient} calling the Artifact Registry v1 REST API. Requests are authorized with the
 * access token of the instance service account, obtained from the GCE metadata server and cached until shortly
 * before it expires.
 */
@Singleton
public class DefaultArtifactRegistryClient implements ArtifactRegistryClient {

    private static final Logger logger = LoggerFactory.getLogger(DefaultArtifactRegistryClient.class);

    static final String METADATA_FLAVOR_HEADER = "Metadata-Flavor";

    private static final String LIST_OPERATION = "dockerImages";

    private final ArtifactRegistryClientConfiguration configuration;
    private final ImageCacheRuntime runtime;
    private final WebClientMetric webClientMetrics;

    private final ConcurrentMap<String, WebClient> clientsByBaseUrl = new ConcurrentHashMap<>();
    private final AtomicReference<AccessToken> accessTokenRef = new AtomicReference<>();

    @Inject
    public DefaultArtifactRegistryClient(ArtifactRegistryClientConfiguration configuration, ImageCacheRuntime runtime) {
        this.configuration = configuration;
        this.runtime = runtime;
        this.webClientMetrics = new WebClientMetric(DefaultArtifactRegistryClient.class.getSimpleName(), runtime.getRegistry(), DefaultArtifactRegistryClient::toOperation);
    }

    @Override
    public Mono<List<ArtifactRegistryImage>> listDockerImages(String projectId, String location, String repository) {
        String parent = "projects/" + projectId + "/locations/" + location + "/repositories/" + repository;
        return fetchPage(parent, Optional.empty())
                .expand(page -> page.getNextPageToken()
                        .map(pageToken -> fetchPage(parent, Optional.of(pageToken)))
                        .orElse(Mono.empty())
                )
                .take(configuration.getMaxPages())
                .<ArtifactRegistryImage>flatMapIterable(ImagePage::getImages)
                .collectList();
    }

    private Mono<ImagePage> fetchPage(String parent, Optional<String> pageToken) {
        UriComponentsBuilder uriBuilder = UriComponentsBuilder.fromHttpUrl(configuration.getApiUrl())
                .path("/v1/" + parent + "/dockerImages")
                .queryParam("pageSize", configuration.getPageSize());
        pageToken.ifPresent(token -> uriBuilder.queryParam("pageToken", token));
        URI uri = uriBuilder.encode().build().toUri();

        Mono<ImagePage> page = getAccessToken()
                .flatMap(token -> clientFor(configuration.getApiUrl())
                        .get()
                        .uri(uri)
                        .headers(headers -> {
                            headers.set(HttpHeaders.ACCEPT, "application/json");
                            headers.setBearerAuth(token);
                        })
                        .exchangeToMono(response -> response.toEntity(String.class))
                )
                .flatMap(response -> {
                    if (response.getStatusCode() == HttpStatus.UNAUTHORIZED || response.getStatusCode() == HttpStatus.FORBIDDEN) {
                        accessTokenRef.set(null);
                        return Mono.error(RegistryException.authenticationFailed(
                                configuration.getApiUrl(), parent, "request rejected with " + response.getStatusCode()
                        ));
                    }
                    if (response.getStatusCode() == HttpStatus.NOT_FOUND) {
                        return Mono.error(RegistryException.imageNotFound(parent, LIST_OPERATION));
                    }
                    if (!response.getStatusCode().is2xxSuccessful()) {
                        return Mono.error(RegistryException.internalError(parent, LIST_OPERATION, response.getStatusCode()));
                    }
                    return Mono.just(ImagePage.parse(parent, response.getBody()));
                });
        return withDefaults(page);
    }

    private Mono<String> getAccessToken() {
        return Mono.defer(() -> {
            AccessToken current = accessTokenRef.get();
            if (current != null && !runtime.getClock().isPast(current.getRefreshAfter())) {
                return Mono.just(current.getValue());
            }
            return fetchAccessToken().map(token -> {
                accessTokenRef.set(token);
                return token.getValue();
            });
        });
    }

    private Mono<AccessToken> fetchAccessToken() {
        URI tokenUri = URI.create(configuration.getTokenUrl());
        String baseUrl = tokenUri.getScheme() + "://" + tokenUri.getRawAuthority();
        return clientFor(baseUrl)
                .get()
                .uri(tokenUri)
                .header(METADATA_FLAVOR_HEADER, "Google")
                .exchangeToMono(response -> response.toEntity(String.class))
                .flatMap(response -> {
                    if (!response.getStatusCode().is2xxSuccessful()) {
                        return Mono.error(RegistryException.authenticationFailed(
                                configuration.getApiUrl(), "*", "token endpoint returned " + response.getStatusCode()
                        ));
                    }
                    return parseAccessToken(response)
                            .map(Mono::just)
                            .orElseGet(() -> Mono.error(RegistryException.authenticationFailed(
                                    configuration.getApiUrl(), "*", "no access_token in token endpoint response"
                            )));
                });
    }

    private Optional<AccessToken> parseAccessToken(ResponseEntity<String> response) {
        if (StringExt.isEmpty(response.getBody())) {
            return Optional.empty();
        }
        try {
            JsonNode root = ObjectMappers.defaultMapper().readTree(response.getBody());
            String value = root.path("access_token").asText("");
            if (value.isEmpty()) {
                return Optional.empty();
            }
            long expiresInMs = root.path("expires_in").asLong(0) * 1000;
            long refreshAfter = runtime.getClock().wallTime() + Math.max(0, expiresInMs - configuration.getTokenRefreshMarginMs());
            return Optional.of(new AccessToken(value, refreshAfter));
        } catch (IOException e) {
            logger.warn("Cannot parse token endpoint response: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private <T> Mono<T> withDefaults(Mono<T> mono) {
        return mono
                .timeout(Duration.ofMillis(configuration.getRequestTimeoutMs()))
                .transformDeferred(WebClientExt.latencyMonoOperator(runtime.getClock(), webClientMetrics, HttpMethod.GET))
                .retryWhen(WebClientAddOns.retryer(
                        Duration.ofMillis(configuration.getRetryDelayMs()),
                        configuration.getRetryCount(),
                        error -> !(error instanceof RegistryException),
                        logger
                ));
    }

    private WebClient clientFor(String baseUrl) {
        return clientsByBaseUrl.computeIfAbsent(baseUrl, url -> WebClient.builder()
                .baseUrl(url)
                .apply(b -> WebClientAddOns.addDefaults(b, url.startsWith("https://"), webClientMetrics))
                .build()
        );
    }

    @VisibleForTesting
    static String toOperation(String path) {
        return path.endsWith("/" + LIST_OPERATION) ? LIST_OPERATION : "token";
    }

    private static class AccessToken {

        private final String value;
        private final long refreshAfter;

        private AccessToken(String value, long refreshAfter) {
            this.value = value;
            this.refreshAfter = refreshAfter;
        }

        private String getValue() {
            return value;
        }

        private long getRefreshAfter() {
            return refreshAfter;
        }
    }

    /**
     * One page of the image list.
     */
    static class ImagePage {

        private final List<ArtifactRegistryImage> images;
        private final Optional<String> nextPageToken;

        ImagePage(List<ArtifactRegistryImage> images, Optional<String> nextPageToken) {
            this.images = images;
            this.nextPageToken = nextPageToken;
        }

        List<ArtifactRegistryImage> getImages() {
            return images;
        }

        Optional<String> getNextPageToken() {
            return nextPageToken;
        }

        static ImagePage parse(String parent, String body) {
            List<ArtifactRegistryImage> images = new ArrayList<>();
            if (StringExt.isEmpty(body)) {
                return new ImagePage(Collections.emptyList(), Optional.empty());
            }
            JsonNode root;
            try {
                root = ObjectMappers.defaultMapper().readTree(body);
            } catch (IOException e) {
                throw RegistryException.invalidResponse(parent, LIST_OPERATION, e.getMessage());
            }
            for (JsonNode image : root.path("dockerImages")) {
                String uri = image.path("uri").asText("");
                if (uri.isEmpty()) {
                    continue;
                }
                List<String> tags = new ArrayList<>();
                image.path("tags").forEach(tag -> tags.add(tag.asText()));
                images.add(new ArtifactRegistryImage(uri, tags));
            }
            String nextPageToken = root.path("nextPageToken").asText("");
            return new ImagePage(
                    Collections.unmodifiableList(images),
                    nextPageToken.isEmpty() ? Optional.empty() : Optional.of(nextPageToken)
            );
        }
    }
}
