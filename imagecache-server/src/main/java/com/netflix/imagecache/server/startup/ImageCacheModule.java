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

package com.netflix.imagecache.server.startup;

import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.netflix.archaius.api.Config;
import com.netflix.imagecache.api.node.service.NodeInventory;
import com.netflix.imagecache.api.policy.service.CachePolicyService;
import com.netflix.imagecache.api.pull.service.PullOrchestrator;
import com.netflix.imagecache.common.runtime.ImageCacheRuntime;
import com.netflix.imagecache.common.runtime.internal.DefaultImageCacheRuntime;
import com.netflix.imagecache.common.util.archaius2.Archaius2Ext;
import com.netflix.imagecache.server.connector.artifactregistry.ArtifactRegistryClient;
import com.netflix.imagecache.server.connector.artifactregistry.ArtifactRegistryClientConfiguration;
import com.netflix.imagecache.server.connector.artifactregistry.DefaultArtifactRegistryClient;
import com.netflix.imagecache.server.connector.kubernetes.DefaultKubeClusterConnector;
import com.netflix.imagecache.server.connector.kubernetes.Fabric8IOClients;
import com.netflix.imagecache.server.connector.kubernetes.KubeClusterConnector;
import com.netflix.imagecache.server.connector.kubernetes.KubeConnectorConfiguration;
import com.netflix.imagecache.server.connector.registry.DefaultDockerRegistryClient;
import com.netflix.imagecache.server.connector.registry.RegistryClient;
import com.netflix.imagecache.server.connector.registry.RegistryClientConfiguration;
import com.netflix.imagecache.server.controller.CachePolicyControllerConfiguration;
import com.netflix.imagecache.server.controller.ControllerRegistry;
import com.netflix.imagecache.server.inventory.DefaultNodeInventory;
import com.netflix.imagecache.server.inventory.NodeInventoryConfiguration;
import com.netflix.imagecache.server.pull.DefaultPullOrchestrator;
import com.netflix.imagecache.server.pull.PullOrchestratorConfiguration;
import io.fabric8.kubernetes.client.KubernetesClient;

public class ImageCacheModule extends AbstractModule {

    private final Config config;

    public ImageCacheModule(Config config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(Config.class).toInstance(config);
        bind(ImageCacheRuntime.class).to(DefaultImageCacheRuntime.class);
        bind(RegistryClient.class).to(DefaultDockerRegistryClient.class);
        bind(ArtifactRegistryClient.class).to(DefaultArtifactRegistryClient.class);
        bind(KubeClusterConnector.class).to(DefaultKubeClusterConnector.class);
        bind(NodeInventory.class).to(DefaultNodeInventory.class);
        bind(PullOrchestrator.class).to(DefaultPullOrchestrator.class);
        bind(CachePolicyService.class).to(ControllerRegistry.class);
    }

    @Provides
    @Singleton
    public DefaultImageCacheRuntime getImageCacheRuntime() {
        return DefaultImageCacheRuntime.newBuilder().build();
    }

    @Provides
    @Singleton
    public KubernetesClient getKubernetesClient(KubeConnectorConfiguration configuration) {
        KubernetesClient client = Fabric8IOClients.createFabric8IOClient();
        return configuration.isConnectivityCheckEnabled() ? Fabric8IOClients.mustHaveKubeConnectivity(client) : client;
    }

    @Provides
    @Singleton
    public CachePolicyControllerConfiguration getCachePolicyControllerConfiguration() {
        return Archaius2Ext.newConfiguration(CachePolicyControllerConfiguration.class, config);
    }

    @Provides
    @Singleton
    public PullOrchestratorConfiguration getPullOrchestratorConfiguration() {
        return Archaius2Ext.newConfiguration(PullOrchestratorConfiguration.class, config);
    }

    @Provides
    @Singleton
    public NodeInventoryConfiguration getNodeInventoryConfiguration() {
        return Archaius2Ext.newConfiguration(NodeInventoryConfiguration.class, config);
    }

    @Provides
    @Singleton
    public RegistryClientConfiguration getRegistryClientConfiguration() {
        return Archaius2Ext.newConfiguration(RegistryClientConfiguration.class, config);
    }

    @Provides
    @Singleton
    public ArtifactRegistryClientConfiguration getArtifactRegistryClientConfiguration() {
        return Archaius2Ext.newConfiguration(ArtifactRegistryClientConfiguration.class, config);
    }

    @Provides
    @Singleton
    public KubeConnectorConfiguration getKubeConnectorConfiguration() {
        return Archaius2Ext.newConfiguration(KubeConnectorConfiguration.class, config);
    }
}
