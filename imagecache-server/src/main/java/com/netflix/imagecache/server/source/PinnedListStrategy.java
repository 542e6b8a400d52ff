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

import com.netflix.imagecache.api.policy.model.DesiredImage;
import com.netflix.imagecache.api.policy.model.source.PinnedListSourceConfig;
import com.netflix.imagecache.api.policy.service.CachePolicyValidator;
import com.netflix.imagecache.api.policy.service.ImageSourceStrategy;

/**
 * Fixed list of images, returned as configured.
 */
public class PinnedListStrategy implements ImageSourceStrategy {

    private final List<DesiredImage> images;

    public PinnedListStrategy(PinnedListSourceConfig configuration) {
        CachePolicyValidator.validateStrategy(configuration);
        this.images = configuration.getImages().stream()
                .map(image -> DesiredImage.newBuilder()
                        .withDisplayName(image.getName())
                        .withImageReference(image.getImageUrl())
                        .build()
                )
                .collect(Collectors.toList());
    }

    @Override
    public String getName() {
        return "PinnedListStrategy";
    }

    @Override
    public List<DesiredImage> resolve() {
        return images;
    }
}
