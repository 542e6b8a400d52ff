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

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class DesiredImageTest {

    @Test
    public void testDigestReference() {
        DesiredImage image = DesiredImage.newBuilder()
                .withDisplayName("Weekly 2021_13")
                .withImageReference("registry.hub.docker.com/lsstsqre/sciplat-lab:w_2021_13")
                .withCategory(ImageCategory.Weekly)
                .withDigest("sha256:abc")
                .build();

        assertThat(image.getRepository()).isEqualTo("registry.hub.docker.com/lsstsqre/sciplat-lab");
        assertThat(image.getDigestReference()).contains("registry.hub.docker.com/lsstsqre/sciplat-lab@sha256:abc");
    }

    @Test
    public void testRepositoryWithRegistryPort() {
        DesiredImage image = DesiredImage.newBuilder()
                .withDisplayName("local")
                .withImageReference("localhost:5000/lab")
                .build();

        assertThat(image.getRepository()).isEqualTo("localhost:5000/lab");
        assertThat(image.getDigestReference()).isEmpty();
        assertThat(image.getCategory()).isEmpty();
    }
}
