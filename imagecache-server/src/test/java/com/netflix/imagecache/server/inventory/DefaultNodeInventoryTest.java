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

package com.netflix.imagecache.server.inventory;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

import com.netflix.imagecache.api.node.model.NodeRecord;
import com.netflix.imagecache.api.policy.model.LabelSelector;
import com.netflix.imagecache.api.policy.service.ImageCacheException;
import com.netflix.imagecache.common.runtime.ImageCacheRuntimes;
import com.netflix.imagecache.common.util.archaius2.Archaius2Ext;
import com.netflix.imagecache.common.util.time.Clocks;
import com.netflix.imagecache.common.util.time.TestClock;
import com.netflix.imagecache.server.connector.kubernetes.StubKubeClusterConnector;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DefaultNodeInventoryTest {

    private static final LabelSelector AMD64 = LabelSelector.of("arch", "amd64");

    private final TestClock clock = Clocks.test();

    private final StubKubeClusterConnector kube = new StubKubeClusterConnector();

    private final DefaultNodeInventory inventory = new DefaultNodeInventory(
            Archaius2Ext.newConfiguration(NodeInventoryConfiguration.class, "imagecache.inventory.minRefreshIntervalMs", "10000"),
            kube,
            ImageCacheRuntimes.test(clock)
    );

    @Test
    public void testEmptyInventoryHasNoImages() {
        inventory.refresh();
        assertThat(inventory.getNodes()).isEmpty();
        assertThat(inventory.imagesAvailableFor(AMD64)).isEmpty();
        assertThat(inventory.imagesAvailableFor(LabelSelector.empty())).isEmpty();
    }

    @Test
    public void testImagesAvailableIsIntersectionOfTargetedNodes() {
        kube.addNode("a", Collections.singletonMap("arch", "amd64"), "x", "y")
                .addNode("b", Collections.singletonMap("arch", "amd64"), "y")
                .addNode("c", Collections.singletonMap("arch", "arm64"), "z");
        inventory.refresh();

        assertThat(inventory.imagesAvailableFor(AMD64)).containsExactly("y");
        assertThat(inventory.imagesPresentOnAny(AMD64)).containsExactlyInAnyOrder("x", "y");
        assertThat(inventory.getTargetNodes(AMD64)).extracting(NodeRecord::getNodeName).containsExactlyInAnyOrder("a", "b");
        assertThat(inventory.imagesAvailableFor(LabelSelector.of("arch", "ppc64"))).isEmpty();
        assertThat(inventory.imagesAvailableFor(LabelSelector.empty())).isEmpty();
    }

    @Test
    public void testUnschedulableAndTaintedNodesAreNotTargeted() {
        kube.addNode("a", Collections.singletonMap("arch", "amd64"), "x", "y")
                .addNode("b", Collections.singletonMap("arch", "amd64"), "y")
                .addNode("c", Collections.singletonMap("arch", "amd64"))
                .addNode("d", Collections.singletonMap("arch", "amd64"))
                .cordon("c")
                .taint("d", "NoExecute");
        inventory.refresh();

        assertThat(inventory.getNodes()).hasSize(4);
        assertThat(inventory.getTargetNodes(AMD64)).extracting(NodeRecord::getNodeName).containsExactlyInAnyOrder("a", "b");
        assertThat(inventory.imagesAvailableFor(AMD64)).containsExactly("y");
    }

    @Test
    public void testPreferNoScheduleTaintDoesNotExcludeNode() {
        kube.addNode("a", Collections.singletonMap("arch", "amd64"), "x").taint("a", "PreferNoSchedule");
        inventory.refresh();

        assertThat(inventory.getTargetNodes(AMD64)).hasSize(1);
    }

    @Test
    public void testNoneImageNamesAreSkipped() {
        kube.addNode("a", Collections.singletonMap("arch", "amd64"), "x", "<none>@<none>", "<none>:<none>");
        inventory.refresh();

        assertThat(inventory.getNodes().get(0).getPresentImages()).containsExactly("x");
    }

    @Test
    public void testRefreshIsCoalescedUnlessForced() {
        kube.addNode("a", Collections.singletonMap("arch", "amd64"), "x");
        inventory.refresh();
        long firstRefresh = inventory.getLastRefreshTimestamp();

        kube.addImage("a", "y");
        inventory.refresh();
        assertThat(inventory.imagesAvailableFor(AMD64)).containsExactly("x");
        assertThat(inventory.getLastRefreshTimestamp()).isEqualTo(firstRefresh);

        clock.advanceTime(10, TimeUnit.SECONDS);
        inventory.refresh();
        assertThat(inventory.imagesAvailableFor(AMD64)).containsExactlyInAnyOrder("x", "y");

        kube.addImage("a", "z");
        inventory.forceRefresh();
        assertThat(inventory.imagesAvailableFor(AMD64)).containsExactlyInAnyOrder("x", "y", "z");
    }

    @Test
    public void testClusterApiErrorKeepsPreviousSnapshot() {
        kube.addNode("a", Collections.singletonMap("arch", "amd64"), "x");
        inventory.refresh();

        kube.withFailNodeListing(true);
        assertThatThrownBy(inventory::forceRefresh)
                .matches(e -> ImageCacheException.hasErrorCode(e, ImageCacheException.ErrorCode.ClusterApiError));
        assertThat(inventory.imagesAvailableFor(AMD64)).containsExactly("x");
    }
}
