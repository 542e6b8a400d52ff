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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Stopwatch;
import com.netflix.imagecache.api.policy.model.DesiredImage;
import com.netflix.imagecache.api.policy.model.source.ArtifactRegistrySourceConfig;
import com.netflix.imagecache.api.policy.service.CachePolicyValidator;
import com.netflix.imagecache.api.policy.service.ImageCacheException;
import com.netflix.imagecache.api.policy.service.ImageSourceStrategy;
import com.netflix.imagecache.server.connector.artifactregistry.ArtifactRegistryClient;
import com.netflix.imagecache.server.connector.artifactregistry.ArtifactRegistryImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tag classifying strategy for images hosted in Google Artifact Registry. A single list call returns every image
 * of the repository with its digest and tags, so no per tag digest lookups are made.
 */
public class ArtifactRegistryStrategy implements ImageSourceStrategy {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactRegistryStrategy.class);

    private final ArtifactRegistrySourceConfig configuration;
    private final ArtifactRegistryClient client;
    private final String imageBase;
    private final String name;
    private final TagSelector selector;

    public ArtifactRegistryStrategy(ArtifactRegistrySourceConfig configuration, ArtifactRegistryClient client) {
        CachePolicyValidator.validateStrategy(configuration);
        this.configuration = configuration;
        this.client = client;
        this.imageBase = configuration.getImageBase();
        this.name = "ArtifactRegistryStrategy(" + imageBase + ')';
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
        List<ArtifactRegistryImage> images;
        try {
            images = client.listDockerImages(configuration.getProjectId(), configuration.getLocation(), configuration.getRepository()).block();
        } catch (RuntimeException e) {
            throw ImageCacheException.sourceUnavailable(name, e);
        }

        // The repository may hold other images, so only entries of the configured image are used.
        Map<String, String> digestsByTag = new HashMap<>();
        for (ArtifactRegistryImage image : images == null ? Collections.<ArtifactRegistryImage>emptyList() : images) {
            if (!imageBase.equals(image.getImageBase())) {
                continue;
            }
            Optional<String> digest = image.getDigest();
            if (!digest.isPresent()) {
                logger.debug("[{}] Ignoring image without digest {}", name, image.getUri());
                continue;
            }
            image.getTags().forEach(tag -> digestsByTag.put(tag, digest.get()));
        }

        Optional<String> recommended = configuration.getRecommendedTag().filter(digestsByTag::containsKey);
        if (configuration.getRecommendedTag().isPresent() && !recommended.isPresent()) {
            logger.debug("[{}] Recommended tag {} not in the repository; skipping it", name, configuration.getRecommendedTag().get());
        }

        List<ImageTag> selected = selector.select(digestsByTag.keySet());
        List<DesiredImage> result = TagSelector.toDesiredImages(selected, recommended, digestsByTag, tag -> imageBase + ':' + tag);
        logger.debug("[{}] Resolved {} images from {} tags in {}ms", name, result.size(), digestsByTag.size(), stopwatch.elapsed().toMillis());
        return result;
    }
}
