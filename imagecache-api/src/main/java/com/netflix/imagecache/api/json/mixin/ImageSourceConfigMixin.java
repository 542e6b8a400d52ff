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

package com.netflix.imagecache.api.json.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.netflix.imagecache.api.policy.model.source.ArtifactRegistrySourceConfig;
import com.netflix.imagecache.api.policy.model.source.ImageSourceConfig;
import com.netflix.imagecache.api.policy.model.source.PinnedListSourceConfig;
import com.netflix.imagecache.api.policy.model.source.TagClassifyingSourceConfig;

@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PinnedListSourceConfig.class, name = ImageSourceConfig.PINNED_LIST_STRATEGY),
        @JsonSubTypes.Type(value = TagClassifyingSourceConfig.class, name = ImageSourceConfig.TAG_CLASSIFYING_STRATEGY),
        @JsonSubTypes.Type(value = ArtifactRegistrySourceConfig.class, name = ImageSourceConfig.ARTIFACT_REGISTRY_STRATEGY),
})
public abstract class ImageSourceConfigMixin {

    @JsonIgnore
    public abstract String getType();
}
