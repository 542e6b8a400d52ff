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

import com.netflix.imagecache.api.policy.model.CachePolicy;
import com.netflix.imagecache.api.policy.model.LabelSelector;
import com.netflix.imagecache.api.policy.model.source.ArtifactRegistrySourceConfig;
import com.netflix.imagecache.api.policy.model.source.PinnedImage;
import com.netflix.imagecache.api.policy.model.source.PinnedListSourceConfig;
import com.netflix.imagecache.api.policy.model.source.TagClassifyingSourceConfig;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PolicyDefinitionParserTest {

    private static final String JUPYTER_POLICY = "{\"name\": \"jupyter\","
            + " \"labelSelector\": {\"arch\": \"amd64\"},"
            + " \"strategies\": ["
            + "   {\"type\": \"PinnedListStrategy\", \"images\": [{\"name\": \"Weekly 35\", \"imageUrl\": \"registry/sciplat-lab:w_2020_35\"}]},"
            + "   {\"type\": \"TagClassifyingStrategy\", \"repo\": \"lsstsqre/sciplat-lab\", \"recommendedTag\": \"recommended\","
            + "    \"numReleases\": 1, \"numWeeklies\": 2, \"numDailies\": 3, \"cycle\": 20, \"aliasTags\": [\"latest\"]}"
            + " ]}";

    @Test
    public void testParsePolicyWithBothStrategies() {
        CachePolicy policy = PolicyDefinitionParser.parse(JUPYTER_POLICY);

        assertThat(policy.getName()).isEqualTo("jupyter");
        assertThat(policy.getLabelSelector()).isEqualTo(LabelSelector.of("arch", "amd64"));
        assertThat(policy.getStrategies()).hasSize(2);

        PinnedListSourceConfig pinned = (PinnedListSourceConfig) policy.getStrategies().get(0);
        assertThat(pinned.getImages()).containsExactly(new PinnedImage("Weekly 35", "registry/sciplat-lab:w_2020_35"));

        TagClassifyingSourceConfig tagConfig = (TagClassifyingSourceConfig) policy.getStrategies().get(1);
        assertThat(tagConfig.getRepo()).isEqualTo("lsstsqre/sciplat-lab");
        assertThat(tagConfig.getRegistryUrl()).isEmpty();
        assertThat(tagConfig.getRecommendedTag()).contains("recommended");
        assertThat(tagConfig.getNumReleases()).isEqualTo(1);
        assertThat(tagConfig.getNumWeeklies()).isEqualTo(2);
        assertThat(tagConfig.getNumDailies()).isEqualTo(3);
        assertThat(tagConfig.getCycle()).contains(20);
        assertThat(tagConfig.getAliasTags()).containsExactly("latest");
    }

    @Test
    public void testPolicyJsonFormIsReadBack() {
        CachePolicy policy = PolicyDefinitionParser.parse(JUPYTER_POLICY);
        assertThat(PolicyDefinitionParser.parse(PolicyDefinitionParser.toJson(policy))).isEqualTo(policy);
    }

    @Test
    public void testParseArtifactRegistryStrategy() {
        CachePolicy policy = PolicyDefinitionParser.parse("{\"name\": \"gar\", \"labelSelector\": {},"
                + " \"strategies\": [{\"type\": \"ArtifactRegistryStrategy\", \"projectId\": \"science-platform\","
                + " \"location\": \"us-central1\", \"repository\": \"sciplat\", \"image\": \"sciplat-lab\","
                + " \"recommendedTag\": \"recommended\", \"numReleases\": 1, \"numWeeklies\": 2, \"numDailies\": 3}]}");

        ArtifactRegistrySourceConfig config = (ArtifactRegistrySourceConfig) policy.getStrategies().get(0);
        assertThat(config.getImageBase()).isEqualTo("us-central1-docker.pkg.dev/science-platform/sciplat/sciplat-lab");
        assertThat(config.getRecommendedTag()).contains("recommended");
        assertThat(config.getCycle()).isEmpty();
        assertThat(config.getAliasTags()).isEmpty();
        assertThat(PolicyDefinitionParser.parse(PolicyDefinitionParser.toJson(policy))).isEqualTo(policy);
    }

    @Test
    public void testArtifactRegistryStrategyWithoutProjectIsRejected() {
        expectConfigError("{\"name\": \"p\", \"labelSelector\": {}, \"strategies\": [{\"type\": \"ArtifactRegistryStrategy\","
                        + " \"location\": \"us-central1\", \"repository\": \"sciplat\", \"image\": \"sciplat-lab\","
                        + " \"numReleases\": 1, \"numWeeklies\": 1, \"numDailies\": 1}]}",
                "Malformed");
    }

    @Test
    public void testEmptyNameIsRejected() {
        expectConfigError("{\"name\": \"\", \"labelSelector\": {}, \"strategies\": []}", "policy name is empty");
    }

    @Test
    public void testUnknownStrategyTypeIsRejected() {
        expectConfigError("{\"name\": \"p\", \"labelSelector\": {}, \"strategies\": [{\"type\": \"FancyStrategy\"}]}", "FancyStrategy");
    }

    @Test
    public void testInvalidLabelSelectorIsRejected() {
        expectConfigError("{\"name\": \"p\", \"labelSelector\": {\"bad key!\": \"x\"}, \"strategies\": []}", "invalid label key");
        expectConfigError("{\"name\": \"p\", \"labelSelector\": [\"arch\"], \"strategies\": []}", "Malformed");
    }

    @Test
    public void testEmptyPinnedListIsRejected() {
        expectConfigError("{\"name\": \"p\", \"labelSelector\": {}, \"strategies\": [{\"type\": \"PinnedListStrategy\", \"images\": []}]}",
                "image list is empty");
    }

    @Test
    public void testMissingImageCountIsRejected() {
        expectConfigError("{\"name\": \"p\", \"labelSelector\": {}, \"strategies\": [{\"type\": \"TagClassifyingStrategy\", \"repo\": \"a/b\"}]}",
                "Malformed");
    }

    @Test
    public void testMalformedJsonIsRejected() {
        expectConfigError("{\"name\": ", "Malformed");
        expectConfigError("   ", "Empty");
    }

    private void expectConfigError(String json, String messageFragment) {
        assertThatThrownBy(() -> PolicyDefinitionParser.parse(json))
                .isInstanceOf(ImageCacheException.class)
                .hasMessageContaining(messageFragment)
                .matches(e -> ImageCacheException.hasErrorCode(e, ImageCacheException.ErrorCode.ConfigError));
    }
}
