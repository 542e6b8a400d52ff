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

import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.netflix.imagecache.api.policy.model.CachePolicy;
import com.netflix.imagecache.api.policy.model.CachePolicyStatus;
import com.netflix.imagecache.api.policy.model.LabelSelector;

/**
 * Lifecycle and status operations on cache policies. Each existing policy has exactly one reconciliation loop
 * running for it.
 */
public interface CachePolicyService {

    /**
     * Creates a new policy and starts its reconciliation loop.
     *
     * @throws ImageCacheException ConfigError if the policy is invalid, PolicyAlreadyExists if a policy with the
     *                             same name exists
     */
    void createPolicy(CachePolicy policy);

    /**
     * Parses the policy JSON definition, and creates the policy.
     */
    CachePolicy createPolicy(String policyDefinitionJson);

    Optional<CachePolicy> findPolicy(String name);

    List<CachePolicy> getPolicies();

    /**
     * @throws ImageCacheException PolicyNotFound if there is no policy with the given name
     */
    CachePolicyStatus getStatus(String name);

    Optional<CachePolicyStatus> findStatus(String name);

    /**
     * Stops the policy loop, and abandons its in-flight pulls. Returns false if the policy did not exist.
     */
    boolean deletePolicy(String name);

    /**
     * Images present on every node matching the selector, independent of any policy.
     */
    Set<String> imagesAvailableFor(LabelSelector labelSelector);
}
