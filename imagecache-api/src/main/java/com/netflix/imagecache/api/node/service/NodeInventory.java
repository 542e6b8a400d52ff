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

package com.netflix.imagecache.api.node.service;

import java.util.List;
import java.util.Set;

import com.netflix.imagecache.api.node.model.NodeRecord;
import com.netflix.imagecache.api.policy.model.LabelSelector;

/**
 * Snapshot of cluster nodes and the images present on them. The snapshot is replaced as a whole on refresh,
 * so readers always see a consistent view.
 */
public interface NodeInventory {

    /**
     * Re-reads the nodes from the cluster, unless a refresh happened very recently.
     *
     * @throws com.netflix.imagecache.api.policy.service.ImageCacheException ClusterApiError if the nodes cannot be read.
     *                                                                      The previous snapshot is retained.
     */
    void refresh();

    /**
     * Re-reads the nodes from the cluster unconditionally.
     */
    void forceRefresh();

    List<NodeRecord> getNodes();

    /**
     * Nodes matching the selector, which can receive new pods.
     */
    List<NodeRecord> getTargetNodes(LabelSelector labelSelector);

    /**
     * Images present on every targeted node. Empty if no node is targeted.
     */
    Set<String> imagesAvailableFor(LabelSelector labelSelector);

    /**
     * Images present on at least one targeted node.
     */
    Set<String> imagesPresentOnAny(LabelSelector labelSelector);

    long getLastRefreshTimestamp();
}
