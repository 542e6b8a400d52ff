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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public abstract class TagClassifyingSourceConfigMixin {

    @JsonCreator
    public TagClassifyingSourceConfigMixin(@JsonProperty(value = "repo", required = true) String repo,
                                           @JsonProperty("registryUrl") String registryUrl,
                                           @JsonProperty("recommendedTag") String recommendedTag,
                                           @JsonProperty(value = "numReleases", required = true) int numReleases,
                                           @JsonProperty(value = "numWeeklies", required = true) int numWeeklies,
                                           @JsonProperty(value = "numDailies", required = true) int numDailies,
                                           @JsonProperty("cycle") Integer cycle,
                                           @JsonProperty("aliasTags") List<String> aliasTags) {
    }

    @JsonIgnore
    public abstract String getType();
}
