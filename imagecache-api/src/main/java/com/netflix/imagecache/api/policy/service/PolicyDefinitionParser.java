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

package com.netflix.imagecache.api.policy.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.netflix.imagecache.api.json.ObjectMappers;
import com.netflix.imagecache.api.policy.model.CachePolicy;
import com.netflix.imagecache.common.util.StringExt;

/**
 * Reads cache policy definitions from their JSON form:
 * <pre>
 * {"name": "jupyter",
 *  "labelSelector": {"arch": "amd64"},
 *  "strategies": [{"type": "PinnedListStrategy", "images": [{"name": "Weekly 35", "imageUrl": "registry/sciplat-lab:w_2020_35"}]}]}
 * </pre>
 */
public final class PolicyDefinitionParser {

    private PolicyDefinitionParser() {
    }

    /**
     * Parses and validates the policy definition.
     *
     * @throws ImageCacheException ConfigError if the JSON is malformed, or the policy is not valid
     */
    public static CachePolicy parse(String json) {
        if (StringExt.isEmpty(StringExt.safeTrim(json))) {
            throw ImageCacheException.configError("Empty policy definition");
        }
        CachePolicy policy;
        try {
            policy = ObjectMappers.policyMapper().readValue(json, CachePolicy.class);
        } catch (InvalidTypeIdException e) {
            if (e.getTypeId() == null) {
                throw ImageCacheException.configError(e, "Strategy type missing: %s", e.getOriginalMessage());
            }
            throw ImageCacheException.configError(e, "Unknown strategy type '%s'", e.getTypeId());
        } catch (JsonProcessingException e) {
            throw ImageCacheException.configError(e, "Malformed policy definition: %s", e.getOriginalMessage());
        }
        if (policy == null) {
            throw ImageCacheException.configError("Empty policy definition");
        }
        CachePolicyValidator.validate(policy);
        return policy;
    }

    public static String toJson(CachePolicy policy) {
        return ObjectMappers.writeValueAsString(ObjectMappers.policyMapper(), policy);
    }
}
