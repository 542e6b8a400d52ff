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

import java.util.Collections;

import com.netflix.imagecache.api.policy.model.CachePolicy;
import com.netflix.imagecache.api.policy.model.LabelSelector;
import com.netflix.imagecache.api.policy.model.source.ArtifactRegistrySourceConfig;
import com.netflix.imagecache.api.policy.model.source.TagClassifyingSourceConfig;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CachePolicyValidatorTest {

    @Test
    public void testParseLabelSelector() {
        assertThat(CachePolicyValidator.parseLabelSelector("arch=amd64, node.kubernetes.io/role=worker"))
                .isEqualTo(LabelSelector.of("arch", "amd64", "node.kubernetes.io/role", "worker"));
        assertThat(CachePolicyValidator.parseLabelSelector("")).isEqualTo(LabelSelector.empty());
        assertThat(CachePolicyValidator.parseLabelSelector("gpu=")).isEqualTo(LabelSelector.of("gpu", ""));
    }

    @Test
    public void testInvalidLabelSelector() {
        assertThatThrownBy(() -> CachePolicyValidator.parseLabelSelector("-bad=x")).isInstanceOf(ImageCacheException.class);
        assertThatThrownBy(() -> CachePolicyValidator.parseLabelSelector("arch=amd 64")).isInstanceOf(ImageCacheException.class);
        assertThatThrownBy(() -> CachePolicyValidator.parseLabelSelector("UPPER.Prefix/x=y")).isInstanceOf(ImageCacheException.class);
    }

    @Test
    public void testInvalidPolicyNameAndNegativeCounts() {
        CachePolicy policy = CachePolicy.newBuilder()
                .withName("Not_A_Dns_Label")
                .withStrategy(TagClassifyingSourceConfig.newBuilder().withRepo("a/b").withNumReleases(-1).build())
                .build();

        assertThatThrownBy(() -> CachePolicyValidator.validate(policy))
                .isInstanceOf(ImageCacheException.class)
                .hasMessageContaining("DNS label")
                .hasMessageContaining("must not be negative");
    }

    @Test
    public void testArtifactRegistryStrategyRequiresRepositoryCoordinates() {
        ArtifactRegistrySourceConfig config = ArtifactRegistrySourceConfig.newBuilder()
                .withProjectId("science-platform")
                .withLocation(" ")
                .withImage("sciplat-lab")
                .withNumWeeklies(-2)
                .build();

        assertThatThrownBy(() -> CachePolicyValidator.validateStrategy(config))
                .isInstanceOf(ImageCacheException.class)
                .hasMessageContaining("ArtifactRegistryStrategy location is empty")
                .hasMessageContaining("ArtifactRegistryStrategy repository is empty")
                .hasMessageContaining("must not be negative");

        CachePolicyValidator.validateStrategy(ArtifactRegistrySourceConfig.newBuilder()
                .withProjectId("science-platform")
                .withLocation("us-central1")
                .withRepository("sciplat")
                .withImage("sciplat-lab")
                .withNumWeeklies(2)
                .build());
    }

    @Test
    public void testPolicyWithoutStrategiesIsValid() {
        CachePolicyValidator.validate(new CachePolicy("empty", LabelSelector.empty(), Collections.emptyList()));
    }
}
