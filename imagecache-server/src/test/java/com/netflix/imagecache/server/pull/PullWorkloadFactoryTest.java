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

package com.netflix.imagecache.server.pull;

import com.netflix.imagecache.api.policy.model.LabelSelector;
import com.netflix.imagecache.common.util.archaius2.Archaius2Ext;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

public class PullWorkloadFactoryTest {

    private static final String IMAGE = "registry.hub.docker.com/lsstsqre/sciplat-lab:w_2021_13";

    @Test
    public void testWorkloadNameIsValidDnsLabel() {
        String name = PullWorkloadFactory.buildWorkloadName("jupyter", IMAGE, 1);
        assertThat(name).startsWith("imagecache-jupyter-").endsWith("-1").matches("[a-z0-9]([-a-z0-9]*[a-z0-9])?");

        String longName = PullWorkloadFactory.buildWorkloadName("a-very-long-policy-name-which-uses-all-of-the-sixty-three-chars", IMAGE, 123);
        assertThat(longName).hasSizeLessThanOrEqualTo(63).endsWith("-123").matches("[a-z0-9]([-a-z0-9]*[a-z0-9])?");
    }

    @Test
    public void testWorkloadNameDependsOnImageAndAttempt() {
        String name = PullWorkloadFactory.buildWorkloadName("jupyter", IMAGE, 1);
        assertThat(PullWorkloadFactory.buildWorkloadName("jupyter", IMAGE, 1)).isEqualTo(name);
        assertThat(PullWorkloadFactory.buildWorkloadName("jupyter", IMAGE, 2)).isNotEqualTo(name);
        assertThat(PullWorkloadFactory.buildWorkloadName("jupyter", IMAGE + "x", 1)).isNotEqualTo(name);
    }

    @Test
    public void testDaemonSetSpec() {
        PullWorkloadFactory factory = new PullWorkloadFactory(Archaius2Ext.newConfiguration(PullOrchestratorConfiguration.class));
        DaemonSet daemonSet = factory.newPullDaemonSet("imagecache-jupyter-abc-1", "jupyter", IMAGE, LabelSelector.of("arch", "amd64"));

        assertThat(daemonSet.getMetadata().getName()).isEqualTo("imagecache-jupyter-abc-1");
        assertThat(daemonSet.getMetadata().getLabels())
                .containsEntry(PullWorkloadFactory.LABEL_IMAGECACHE, PullWorkloadFactory.LABEL_IMAGECACHE_PULL_VALUE)
                .containsEntry(PullWorkloadFactory.LABEL_POLICY, "jupyter");
        assertThat(daemonSet.getSpec().getSelector().getMatchLabels()).isEqualTo(PullWorkloadFactory.buildSelectorLabels("imagecache-jupyter-abc-1"));
        assertThat(daemonSet.getSpec().getTemplate().getMetadata().getLabels()).containsAllEntriesOf(daemonSet.getSpec().getSelector().getMatchLabels());

        PodSpec podSpec = daemonSet.getSpec().getTemplate().getSpec();
        assertThat(podSpec.getNodeSelector()).containsExactly(entry("arch", "amd64"));
        assertThat(podSpec.getAutomountServiceAccountToken()).isFalse();
        assertThat(podSpec.getSecurityContext().getRunAsNonRoot()).isTrue();
        assertThat(podSpec.getSecurityContext().getRunAsUser()).isEqualTo(1000L);
        assertThat(podSpec.getImagePullSecrets()).isNullOrEmpty();

        Container container = podSpec.getContainers().get(0);
        assertThat(container.getImage()).isEqualTo(IMAGE);
        assertThat(container.getImagePullPolicy()).isEqualTo("Always");
        assertThat(container.getCommand()).containsExactly("/bin/sh", "-c", "sleep 1200");
        assertThat(container.getSecurityContext().getAllowPrivilegeEscalation()).isFalse();
        assertThat(container.getSecurityContext().getReadOnlyRootFilesystem()).isTrue();
        assertThat(container.getSecurityContext().getCapabilities().getDrop()).containsExactly("ALL");
    }

    @Test
    public void testPullSecret() {
        PullWorkloadFactory factory = new PullWorkloadFactory(Archaius2Ext.newConfiguration(PullOrchestratorConfiguration.class,
                "imagecache.pull.pullSecretName", "pull-secret"
        ));
        DaemonSet daemonSet = factory.newPullDaemonSet("imagecache-jupyter-abc-1", "jupyter", IMAGE, LabelSelector.empty());

        PodSpec podSpec = daemonSet.getSpec().getTemplate().getSpec();
        assertThat(podSpec.getImagePullSecrets()).hasSize(1);
        assertThat(podSpec.getImagePullSecrets().get(0).getName()).isEqualTo("pull-secret");
        assertThat(podSpec.getNodeSelector()).isNullOrEmpty();
    }
}
