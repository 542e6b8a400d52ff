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

import java.util.List;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.imagecache.api.policy.model.CachePolicy;
import com.netflix.imagecache.api.policy.model.source.ArtifactRegistrySourceConfig;
import com.netflix.imagecache.api.policy.model.source.ImageSourceConfig;
import com.netflix.imagecache.api.policy.model.source.PinnedListSourceConfig;
import com.netflix.imagecache.api.policy.model.source.TagClassifyingSourceConfig;
import com.netflix.imagecache.api.policy.service.ImageCacheException;
import com.netflix.imagecache.api.policy.service.ImageSourceStrategy;
import com.netflix.imagecache.server.connector.artifactregistry.ArtifactRegistryClient;
import com.netflix.imagecache.server.connector.registry.RegistryClient;

/**
 * Builds {@link ImageSourceStrategy} instances from their configuration.
 */
@Singleton
public class ImageSourceStrategyFactory {

    private final RegistryClient registryClient;
    private final ArtifactRegistryClient artifactRegistryClient;

    @Inject
    public ImageSourceStrategyFactory(RegistryClient registryClient, ArtifactRegistryClient artifactRegistryClient) {
        this.registryClient = registryClient;
        this.artifactRegistryClient = artifactRegistryClient;
    }

    public List<ImageSourceStrategy> create(CachePolicy policy) {
        return policy.getStrategies().stream().map(this::create).collect(Collectors.toList());
    }

    public ImageSourceStrategy create(ImageSourceConfig configuration) {
        if (configuration instanceof PinnedListSourceConfig) {
            return new PinnedListStrategy((PinnedListSourceConfig) configuration);
        }
        if (configuration instanceof TagClassifyingSourceConfig) {
            return new TagClassifyingStrategy((TagClassifyingSourceConfig) configuration, registryClient);
        }
        if (configuration instanceof ArtifactRegistrySourceConfig) {
            return new ArtifactRegistryStrategy((ArtifactRegistrySourceConfig) configuration, artifactRegistryClient);
        }
        throw ImageCacheException.configError("Unknown strategy type '%s'", configuration.getType());
    }
}
