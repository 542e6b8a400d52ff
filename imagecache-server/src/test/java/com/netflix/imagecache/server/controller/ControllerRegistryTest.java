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

import java.util.Collections;

import com.netflix.imagecache.api.node.service.NodeInventory;
import com.netflix.imagecache.api.policy.model.CachePolicy;
import com.netflix.imagecache.api.policy.model.LabelSelector;
import com.netflix.imagecache.api.policy.model.source.PinnedImage;
import com.netflix.imagecache.api.policy.model.source.PinnedListSourceConfig;
import com.netflix.imagecache.api.policy.service.ImageCacheException;
import com.netflix.imagecache.api.pull.service.PullOrchestrator;
import com.netflix.imagecache.common.runtime.ImageCacheRuntimes;
import com.netflix.imagecache.common.util.archaius2.Archaius2Ext;
import com.netflix.imagecache.server.connector.artifactregistry.ArtifactRegistryClient;
import com.netflix.imagecache.server.connector.registry.RegistryClient;
import com.netflix.imagecache.server.source.ImageSourceStrategyFactory;
import org.junit.After;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ControllerRegistryTest {

    private static final LabelSelector AMD64 = LabelSelector.of("arch", "amd64");

    private final NodeInventory nodeInventory = mock(NodeInventory.class);
    private final PullOrchestrator pullOrchestrator = mock(PullOrchestrator.class);

    private final ControllerRegistry registry = new ControllerRegistry(
            Archaius2Ext.newConfiguration(CachePolicyControllerConfiguration.class, "imagecache.controller.controllerEnabled", "false"),
            new ImageSourceStrategyFactory(mock(RegistryClient.class), mock(ArtifactRegistryClient.class)),
            nodeInventory,
            pullOrchestrator,
            ImageCacheRuntimes.test()
    );

    @After
    public void tearDown() {
        registry.shutdown();
    }

    @Test
    public void testCreateAndDeletePolicy() {
        CachePolicy policy = newPolicy("jupyter");
        registry.createPolicy(policy);

        assertThat(registry.findPolicy("jupyter")).contains(policy);
        assertThat(registry.getStatus("jupyter").getPolicyName()).isEqualTo("jupyter");
        assertThat(registry.getStatus("jupyter").getDesired()).isEmpty();

        assertThat(registry.deletePolicy("jupyter")).isTrue();
        verify(pullOrchestrator).abandon("jupyter");
        assertThat(registry.findPolicy("jupyter")).isEmpty();
        assertThat(registry.findStatus("jupyter")).isEmpty();

        // Second delete is a no-op
        assertThat(registry.deletePolicy("jupyter")).isFalse();
    }

    @Test
    public void testDuplicatePolicyIsRejected() {
        registry.createPolicy(newPolicy("jupyter"));
        assertThatThrownBy(() -> registry.createPolicy(newPolicy("jupyter")))
                .matches(e -> ImageCacheException.hasErrorCode(e, ImageCacheException.ErrorCode.PolicyAlreadyExists));
        assertThat(registry.getPolicies()).hasSize(1);
    }

    @Test
    public void testInvalidPolicyIsRejected() {
        assertThatThrownBy(() -> registry.createPolicy(newPolicy("Not_A_DNS_Label")))
                .matches(e -> ImageCacheException.hasErrorCode(e, ImageCacheException.ErrorCode.ConfigError));
        assertThat(registry.getPolicies()).isEmpty();
    }

    @Test
    public void testStatusOfUnknownPolicy() {
        assertThatThrownBy(() -> registry.getStatus("missing"))
                .matches(e -> ImageCacheException.hasErrorCode(e, ImageCacheException.ErrorCode.PolicyNotFound));
    }

    @Test
    public void testCreatePolicyFromJson() {
        CachePolicy policy = registry.createPolicy("{\"name\": \"jupyter\", \"labelSelector\": {\"arch\": \"amd64\"},"
                + " \"strategies\": [{\"type\": \"PinnedListStrategy\", \"images\": [{\"name\": \"Weekly 35\", \"imageUrl\": \"registry/sciplat-lab:w_2020_35\"}]}]}");

        assertThat(policy.getLabelSelector()).isEqualTo(AMD64);
        assertThat(registry.findPolicy("jupyter")).contains(policy);
    }

    @Test
    public void testPoliciesAreListedByName() {
        registry.createPolicy(newPolicy("zeta"));
        registry.createPolicy(newPolicy("alpha"));

        assertThat(registry.getPolicies()).extracting(CachePolicy::getName).containsExactly("alpha", "zeta");
    }

    @Test
    public void testImagesAvailableForDelegatesToInventory() {
        when(nodeInventory.imagesAvailableFor(AMD64)).thenReturn(Collections.singleton("registry/a:1"));
        assertThat(registry.imagesAvailableFor(AMD64)).containsExactly("registry/a:1");
    }

    private static CachePolicy newPolicy(String name) {
        return CachePolicy.newBuilder()
                .withName(name)
                .withLabelSelector(AMD64)
                .withStrategy(new PinnedListSourceConfig(Collections.singletonList(new PinnedImage("Weekly 35", "registry/sciplat-lab:w_2020_35"))))
                .build();
    }
}
