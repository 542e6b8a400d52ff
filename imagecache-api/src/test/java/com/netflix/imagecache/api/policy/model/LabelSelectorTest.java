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

package com.netflix.imagecache.api.policy.model;

import java.util.Map;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class LabelSelectorTest {

    @Test
    public void testMatchesRequiresAllLabels() {
        LabelSelector selector = LabelSelector.of("arch", "amd64", "pool", "lab");

        assertThat(selector.matches(Map.of("arch", "amd64", "pool", "lab", "extra", "x"))).isTrue();
        assertThat(selector.matches(Map.of("arch", "amd64"))).isFalse();
        assertThat(selector.matches(Map.of("arch", "arm64", "pool", "lab"))).isFalse();
        assertThat(selector.matches(null)).isFalse();
    }

    @Test
    public void testEmptySelectorMatchesAllNodes() {
        assertThat(LabelSelector.empty().matches(Map.of("any", "label"))).isTrue();
        assertThat(LabelSelector.empty().matches(Map.of())).isTrue();
    }

    @Test
    public void testEqualityIgnoresLabelOrder() {
        assertThat(LabelSelector.of("a", "1", "b", "2")).isEqualTo(LabelSelector.of("b", "2", "a", "1"));
        assertThat(LabelSelector.of("a", "1", "b", "2").hashCode()).isEqualTo(LabelSelector.of("b", "2", "a", "1").hashCode());
    }
}
