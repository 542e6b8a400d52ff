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

package com.netflix.imagecache.server.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.base.Stopwatch;
import com.netflix.imagecache.api.policy.model.DesiredImage;
import com.netflix.imagecache.api.policy.model.source.TagClassifyingSourceConfig;
import com.netflix.imagecache.api.policy.service.CachePolicyValidator;
import com.netflix.imagecache.api.policy.service.ImageCacheException;
import com.netflix.imagecache.api.policy.service.ImageSourceStrategy;
import com.netflix.imagecache.server.connector.registry.RegistryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

/**
 * Selects the most recent release, weekly and daily images of a repository, plus the recommended image.
 * Tags are read from the registry on each {@link #resolve()} call.
 */
public class TagClassifyingStrategy implements ImageSourceStrategy {

    private static final Logger logger = LoggerFactory.getLogger(TagClassifyingStrategy.class);

    private static final int DIGEST_CONCURRENCY = 4;

    private final TagClassifyingSourceConfig configuration;
    private final RegistryClient registryClient;
    private final String registryHost;
    private final String name;
    private final TagSelector selector;

    public TagClassifyingStrategy(TagClassifyingSourceConfig configuration, RegistryClient registryClient) {
        CachePolicyValidator.validateStrategy(configuration);
        this.configuration = configuration;
        this.registryClient = registryClient;
        this.registryHost = configuration.getRegistryUrl().orElse(registryClient.getDefaultRegistryHost());
        this.name = "TagClassifyingStrategy(" + configuration.getRepo() + ')';
        this.selector = new TagSelector(name, configuration.getAliasTags(), configuration.getRecommendedTag(), configuration.getCycle(),
                configuration.getNumReleases(), configuration.getNumWeeklies(), configuration.getNumDailies());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<DesiredImage> resolve() {
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<String> tags;
        try {
            tags = registryClient.getTags(registryHost, configuration.getRepo()).block();
        } catch (RuntimeException e) {
            throw ImageCacheException.sourceUnavailable(name, e);
        }
        List<String> listed = tags == null ? Collections.emptyList() : tags;
        Optional<String> recommended = configuration.getRecommendedTag().filter(listed::contains);
        if (configuration.getRecommendedTag().isPresent() && !recommended.isPresent()) {
            logger.debug("[{}] Recommended tag {} not in the registry; skipping it", name, configuration.getRecommendedTag().get());
        }

        List<ImageTag> ordered = selector.select(listed);
        List<String> digestTags = ordered.stream().map(ImageTag::getTag).collect(Collectors.toList());
        recommended.ifPresent(digestTags::add);
        Map<String, String> digests = resolveDigests(digestTags);

        List<DesiredImage> result = TagSelector.toDesiredImages(ordered, recommended, digests, this::toImageReference);
        logger.debug("[{}] Resolved {} images from {} registry tags in {}ms", name, result.size(), listed.size(), stopwatch.elapsed().toMillis());
        return result;
    }

    private Map<String, String> resolveDigests(List<String> tags) {
        Map<String, String> digests = new LinkedHashMap<>();
        try {
            Flux.fromIterable(new ArrayList<>(new HashSet<>(tags)))
                    .flatMap(tag -> registryClient.getImageDigest(registryHost, configuration.getRepo(), tag)
                                    .map(digest -> Collections.singletonMap(tag, digest)),
                            DIGEST_CONCURRENCY
                    )
                    .doOnNext(digests::putAll)
                    .blockLast();
        } catch (RuntimeException e) {
            throw ImageCacheException.sourceUnavailable(name, e);
        }
        return digests;
    }

    private String toImageReference(String tag) {
        int schemeIdx = registryHost.indexOf("://");
        String host = schemeIdx < 0 ? registryHost : registryHost.substring(schemeIdx + 3);
        return host + '/' + configuration.getRepo() + ':' + tag;
    }
}
