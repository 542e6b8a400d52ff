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

package com.netflix.imagecache.api.json;

import java.io.IOException;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.netflix.imagecache.api.json.mixin.ArtifactRegistrySourceConfigMixin;
import com.netflix.imagecache.api.json.mixin.CachePolicyMixin;
import com.netflix.imagecache.api.json.mixin.ImageSourceConfigMixin;
import com.netflix.imagecache.api.json.mixin.LabelSelectorMixin;
import com.netflix.imagecache.api.json.mixin.PinnedImageMixin;
import com.netflix.imagecache.api.json.mixin.PinnedListSourceConfigMixin;
import com.netflix.imagecache.api.json.mixin.TagClassifyingSourceConfigMixin;
import com.netflix.imagecache.api.policy.model.CachePolicy;
import com.netflix.imagecache.api.policy.model.LabelSelector;
import com.netflix.imagecache.api.policy.model.source.ArtifactRegistrySourceConfig;
import com.netflix.imagecache.api.policy.model.source.ImageSourceConfig;
import com.netflix.imagecache.api.policy.model.source.PinnedImage;
import com.netflix.imagecache.api.policy.model.source.PinnedListSourceConfig;
import com.netflix.imagecache.api.policy.model.source.TagClassifyingSourceConfig;
import reactor.core.Exceptions;

/**
 * Jackson's {@link ObjectMapper} is thread safe, and its creation is expensive, so shared pre-configured
 * instances are provided here.
 */
public final class ObjectMappers {

    private static final ObjectMapper DEFAULT = createDefaultMapper();
    private static final ObjectMapper POLICY = createPolicyMapper();

    private ObjectMappers() {
    }

    /**
     * Mapper for status and model objects, used for reporting.
     */
    public static ObjectMapper defaultMapper() {
        return DEFAULT;
    }

    /**
     * Strict mapper for cache policy definitions. Unknown properties are rejected.
     */
    public static ObjectMapper policyMapper() {
        return POLICY;
    }

    public static String writeValueAsString(ObjectMapper objectMapper, Object object) {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw Exceptions.propagate(e);
        }
    }

    public static <T> T readValue(ObjectMapper objectMapper, String json, Class<T> clazz) {
        try {
            return objectMapper.readValue(json, clazz);
        } catch (IOException e) {
            throw Exceptions.propagate(e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new Jdk8Module());
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_ABSENT);
        addPolicyMixIns(objectMapper);
        return objectMapper;
    }

    private static ObjectMapper createPolicyMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new Jdk8Module());
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_ABSENT);
        addPolicyMixIns(objectMapper);
        return objectMapper;
    }

    private static void addPolicyMixIns(ObjectMapper objectMapper) {
        objectMapper.addMixIn(CachePolicy.class, CachePolicyMixin.class);
        objectMapper.addMixIn(LabelSelector.class, LabelSelectorMixin.class);
        objectMapper.addMixIn(ImageSourceConfig.class, ImageSourceConfigMixin.class);
        objectMapper.addMixIn(PinnedListSourceConfig.class, PinnedListSourceConfigMixin.class);
        objectMapper.addMixIn(PinnedImage.class, PinnedImageMixin.class);
        objectMapper.addMixIn(TagClassifyingSourceConfig.class, TagClassifyingSourceConfigMixin.class);
        objectMapper.addMixIn(ArtifactRegistrySourceConfig.class, ArtifactRegistrySourceConfigMixin.class);
    }
}
