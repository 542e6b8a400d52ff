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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.netflix.imagecache.api.node.model.NodeRecord;
import com.netflix.imagecache.api.node.service.NodeInventory;
import com.netflix.imagecache.api.policy.model.LabelSelector;
import com.netflix.imagecache.api.policy.service.ImageCacheException;
import com.netflix.imagecache.common.runtime.ImageCacheRuntime;
import com.netflix.imagecache.common.util.time.Clock;
import com.netflix.imagecache.server.MetricConstants;
import com.netflix.imagecache.server.connector.kubernetes.KubeApiException;
import com.netflix.imagecache.server.connector.kubernetes.KubeClusterConnector;
import com.netflix.spectator.api.Counter;
import com.netflix.spectator.api.Gauge;
import com.netflix.spectator.api.Registry;
import io.fabric8.kubernetes.api.model.ContainerImage;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Taint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class DefaultNodeInventory implements NodeInventory {

    private static final Logger logger = LoggerFactory.getLogger(DefaultNodeInventory.class);

    private static final String METRIC_ROOT = MetricConstants.METRIC_INVENTORY;

    private static final Set<String> NONE_IMAGES = new HashSet<>(Arrays.asList("<none>@<none>", "<none>:<none>"));
    private static final Set<String> BLOCKING_TAINT_EFFECTS = new HashSet<>(Arrays.asList("NoSchedule", "NoExecute"));

    private final NodeInventoryConfiguration configuration;
    private final KubeClusterConnector kubeClusterConnector;
    private final Clock clock;

    private final Object refreshLock = new Object();
    private final AtomicReference<Snapshot> snapshotRef = new AtomicReference<>(Snapshot.NOT_LOADED);

    private final Gauge nodeCountGauge;
    private final Counter refreshCounter;
    private final Counter refreshErrorCounter;

    @Inject
    public DefaultNodeInventory(NodeInventoryConfiguration configuration,
                                KubeClusterConnector kubeClusterConnector,
                                ImageCacheRuntime runtime) {
        this.configuration = configuration;
        this.kubeClusterConnector = kubeClusterConnector;
        this.clock = runtime.getClock();

        Registry registry = runtime.getRegistry();
        this.nodeCountGauge = registry.gauge(METRIC_ROOT + "nodes");
        this.refreshCounter = registry.counter(METRIC_ROOT + "refresh", "status", "success");
        this.refreshErrorCounter = registry.counter(METRIC_ROOT + "refresh", "status", "error");
    }

    @Override
    public void refresh() {
        synchronized (refreshLock) {
            Snapshot current = snapshotRef.get();
            if (current.isLoaded() && clock.wallTime() - current.getTimestamp() < configuration.getMinRefreshIntervalMs()) {
                return;
            }
            doRefresh();
        }
    }

    @Override
    public void forceRefresh() {
        synchronized (refreshLock) {
            doRefresh();
        }
    }

    private void doRefresh() {
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<Node> nodes;
        try {
            nodes = kubeClusterConnector.getNodes();
        } catch (KubeApiException e) {
            refreshErrorCounter.increment();
            logger.warn("Cannot refresh node inventory; keeping the previous snapshot: {}", e.getMessage());
            throw ImageCacheException.clusterApiError("listNodes", e);
        }
        List<NodeRecord> records = nodes.stream().map(DefaultNodeInventory::toNodeRecord).collect(Collectors.toList());
        snapshotRef.set(new Snapshot(records, clock.wallTime(), true));

        nodeCountGauge.set(records.size());
        refreshCounter.increment();
        logger.debug("Node inventory refreshed: nodes={}, elapsedMs={}", records.size(), stopwatch.elapsed().toMillis());
    }

    @Override
    public List<NodeRecord> getNodes() {
        return snapshotRef.get().getNodes();
    }

    @Override
    public List<NodeRecord> getTargetNodes(LabelSelector labelSelector) {
        boolean schedulableOnly = configuration.isSchedulableOnly();
        return snapshotRef.get().getNodes().stream()
                .filter(node -> labelSelector.matches(node.getLabels()))
                .filter(node -> !schedulableOnly || node.isSchedulable())
                .collect(Collectors.toList());
    }

    @Override
    public Set<String> imagesAvailableFor(LabelSelector labelSelector) {
        List<NodeRecord> targets = getTargetNodes(labelSelector);
        if (targets.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> common = new HashSet<>(targets.get(0).getPresentImages());
        for (int i = 1; i < targets.size() && !common.isEmpty(); i++) {
            common.retainAll(targets.get(i).getPresentImages());
        }
        return Collections.unmodifiableSet(common);
    }

    @Override
    public Set<String> imagesPresentOnAny(LabelSelector labelSelector) {
        Set<String> all = new HashSet<>();
        getTargetNodes(labelSelector).forEach(node -> all.addAll(node.getPresentImages()));
        return Collections.unmodifiableSet(all);
    }

    @Override
    public long getLastRefreshTimestamp() {
        Snapshot snapshot = snapshotRef.get();
        return snapshot.isLoaded() ? snapshot.getTimestamp() : -1;
    }

    @VisibleForTesting
    static NodeRecord toNodeRecord(Node node) {
        Map<String, String> labels = node.getMetadata() == null ? null : node.getMetadata().getLabels();

        Set<String> images = new HashSet<>();
        if (node.getStatus() != null && node.getStatus().getImages() != null) {
            for (ContainerImage image : node.getStatus().getImages()) {
                if (image.getNames() != null) {
                    image.getNames().stream().filter(name -> !NONE_IMAGES.contains(name)).forEach(images::add);
                }
            }
        }

        boolean schedulable = true;
        if (node.getSpec() != null) {
            if (Boolean.TRUE.equals(node.getSpec().getUnschedulable())) {
                schedulable = false;
            }
            List<Taint> taints = node.getSpec().getTaints();
            if (taints != null && taints.stream().anyMatch(taint -> BLOCKING_TAINT_EFFECTS.contains(taint.getEffect()))) {
                schedulable = false;
            }
        }

        return NodeRecord.newBuilder()
                .withNodeName(node.getMetadata().getName())
                .withLabels(labels == null ? Collections.emptyMap() : labels)
                .withPresentImages(images)
                .withSchedulable(schedulable)
                .build();
    }

    private static class Snapshot {

        private static final Snapshot NOT_LOADED = new Snapshot(Collections.emptyList(), 0, false);

        private final List<NodeRecord> nodes;
        private final long timestamp;
        private final boolean loaded;

        private Snapshot(List<NodeRecord> nodes, long timestamp, boolean loaded) {
            this.nodes = Collections.unmodifiableList(nodes);
            this.timestamp = timestamp;
            this.loaded = loaded;
        }

        private List<NodeRecord> getNodes() {
            return nodes;
        }

        private long getTimestamp() {
            return timestamp;
        }

        private boolean isLoaded() {
            return loaded;
        }
    }
}
