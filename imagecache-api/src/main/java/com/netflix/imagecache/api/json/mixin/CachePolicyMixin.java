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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.netflix.imagecache.api.policy.model.LabelSelector;
import com.netflix.imagecache.api.policy.model.source.ImageSourceConfig;

public abstract class CachePolicyMixin {

    @JsonCreator
    public CachePolicyMixin(@JsonProperty("name") String name,
                            @JsonProperty("labelSelector") LabelSelector labelSelector,
                            @JsonProperty("strategies") List<ImageSourceConfig> strategies) {
    }
}
