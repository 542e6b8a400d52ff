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

package com.netflix.imagecache.server.controller;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import javax.annotation.PreDestroy;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.imagecache.api.node.service.NodeInventory;
import com.netflix.imagecache.api.policy.model.CachePolicy;
import com.netflix.imagecache.api.policy.model.CachePolicyStatus;
import com.netflix.imagecache.api.policy.model.LabelSelector;
import com.netflix.imagecache.api.policy.service.CachePolicyService;
import com.netflix.imagecache.api.policy.service.CachePolicyValidator;
import com.netflix.imagecache.api.policy.service.ImageCacheException;
import com.netflix.imagecache.api.policy.service.ImageSourceStrategy;
import com.netflix.imagecache.api.policy.service.PolicyDefinitionParser;
import com.netflix.imagecache.api.pull.service.PullOrchestrator;
import com.netflix.imagecache.common.runtime.ImageCacheRuntime;
import com.netflix.imagecache.server.source.ImageSourceStrategyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process wide registry of running {@link CachePolicyController}s, one per cache policy name. Policies live
 * in memory only, and are gone after a restart.
 */
@Singleton
public class ControllerRegistry implements CachePolicyService {

    private static final Logger logger = LoggerFactory.getLogger(ControllerRegistry.class);

    private final CachePolicyControllerConfiguration configuration;
    private final ImageSourceStrategyFactory strategyFactory;
    private final NodeInventory nodeInventory;
    private final PullOrchestrator pullOrchestrator;
    private final ImageCacheRuntime runtime;

    private final ConcurrentMap<String, CachePolicyController> controllers = new ConcurrentHashMap<>();

    @Inject
    public ControllerRegistry(CachePolicyControllerConfiguration configuration,
                              ImageSourceStrategyFactory strategyFactory,
                              NodeInventory nodeInventory,
                              PullOrchestrator pullOrchestrator,
                              ImageCacheRuntime runtime) {
        this.configuration = configuration;
        this.strategyFactory = strategyFactory;
        this.nodeInventory = nodeInventory;
        this.pullOrchestrator = pullOrchestrator;
        this.runtime = runtime;
    }

    @Override
    public void createPolicy(CachePolicy policy) {
        CachePolicyValidator.validate(policy);
        List<ImageSourceStrategy> strategies = strategyFactory.create(policy);
        CachePolicyController controller = new CachePolicyController(policy, strategies, nodeInventory, pullOrchestrator, configuration, runtime);
        if (controllers.putIfAbsent(policy.getName(), controller) != null) {
            throw ImageCacheException.policyAlreadyExists(policy.getName());
        }
        controller.start();
        logger.info("Created cache policy {}: selector={}, strategies={}", policy.getName(), policy.getLabelSelector(),
                strategies.stream().map(ImageSourceStrategy::getName).collect(Collectors.toList()));
    }

    @Override
    public CachePolicy createPolicy(String policyDefinitionJson) {
        CachePolicy policy = PolicyDefinitionParser.parse(policyDefinitionJson);
        createPolicy(policy);
        return policy;
    }

    @Override
    public Optional<CachePolicy> findPolicy(String name) {
        return Optional.ofNullable(controllers.get(name)).map(CachePolicyController::getPolicy);
    }

    @Override
    public List<CachePolicy> getPolicies() {
        return controllers.values().stream()
                .map(CachePolicyController::getPolicy)
                .sorted(Comparator.comparing(CachePolicy::getName))
                .collect(Collectors.toList());
    }

    @Override
    public CachePolicyStatus getStatus(String name) {
        return findStatus(name).orElseThrow(() -> ImageCacheException.policyNotFound(name));
    }

    @Override
    public Optional<CachePolicyStatus> findStatus(String name) {
        return Optional.ofNullable(controllers.get(name)).map(CachePolicyController::getStatus);
    }

    @Override
    public boolean deletePolicy(String name) {
        CachePolicyController controller = controllers.remove(name);
        if (controller == null) {
            return false;
        }
        controller.shutdown();
        logger.info("Deleted cache policy {}", name);
        return true;
    }

    @Override
    public Set<String> imagesAvailableFor(LabelSelector labelSelector) {
        return nodeInventory.imagesAvailableFor(labelSelector);
    }

    @PreDestroy
    public void shutdown() {
        for (String name : new ArrayList<>(controllers.keySet())) {
            deletePolicy(name);
        }
    }
}
