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

package com.netflix.imagecache.api.policy.model.source;

/**
 * Base class of image source strategy configurations. The JSON form carries a 'type' property naming the
 * strategy.
 */
public abstract class ImageSourceConfig {

    public static final String PINNED_LIST_STRATEGY = "PinnedListStrategy";
    public static final String TAG_CLASSIFYING_STRATEGY = "TagClassifyingStrategy";
    public static final String ARTIFACT_REGISTRY_STRATEGY = "ArtifactRegistryStrategy";

    public abstract String getType();
}
