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

package com.netflix.imagecache.server.connector.kubernetes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import com.google.common.util.concurrent.Uninterruptibles;
import io.fabric8.kubernetes.api.model.ContainerImageBuilder;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeBuilder;
import io.fabric8.kubernetes.api.model.Taint;
import io.fabric8.kubernetes.api.model.TaintBuilder;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import io.fabric8.kubernetes.api.model.apps.DaemonSetStatusBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;

/**
 * In-memory cluster. Pull workloads complete after a configurable number of status reads, adding their image
 * to the nodes they target, the way the kubelet would.
 */
public class StubKubeClusterConnector implements KubeClusterConnector {

    private final Map<String, NodeState> nodes = new ConcurrentHashMap<>();
    private final Map<String, DaemonSet> daemonSets = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> statusReads = new ConcurrentHashMap<>();
    private final Map<String, String> imageDigests = new ConcurrentHashMap<>();
    private final List<String> createdDaemonSets = new CopyOnWriteArrayList<>();
    private final List<String> deletedDaemonSets = new CopyOnWriteArrayList<>();

    private volatile boolean pullsEnabled = true;
    private volatile int readsBeforeCompletion = 1;
    private volatile boolean failCreate;
    private volatile boolean failNodeListing;
    private volatile CountDownLatch createGate;

    public StubKubeClusterConnector addNode(String name, Map<String, String> labels, String... images) {
        nodes.put(name, new NodeState(name, labels, new LinkedHashSet<>(Arrays.asList(images))));
        return this;
    }

    public StubKubeClusterConnector cordon(String name) {
        nodes.get(name).unschedulable = true;
        return this;
    }

    public StubKubeClusterConnector taint(String name, String effect) {
        nodes.get(name).taints.add(new TaintBuilder().withKey("dedicated").withValue("other").withEffect(effect).build());
        return this;
    }

    public StubKubeClusterConnector addImage(String nodeName, String image) {
        nodes.get(nodeName).images.add(image);
        return this;
    }

    /**
     * Pulling the given image also records its 'repository@digest' name on the nodes.
     */
    public StubKubeClusterConnector withImageDigest(String imageReference, String digest) {
        imageDigests.put(imageReference, digest);
        return this;
    }

    public StubKubeClusterConnector withPullsEnabled(boolean pullsEnabled) {
        this.pullsEnabled = pullsEnabled;
        return this;
    }

    public StubKubeClusterConnector withReadsBeforeCompletion(int readsBeforeCompletion) {
        this.readsBeforeCompletion = readsBeforeCompletion;
        return this;
    }

    public StubKubeClusterConnector withFailCreate(boolean failCreate) {
        this.failCreate = failCreate;
        return this;
    }

    /**
     * Workload creation blocks until the gate opens, ignoring interrupts like an in-flight API call would.
     */
    public StubKubeClusterConnector withCreateGate(CountDownLatch createGate) {
        this.createGate = createGate;
        return this;
    }

    public StubKubeClusterConnector withFailNodeListing(boolean failNodeListing) {
        this.failNodeListing = failNodeListing;
        return this;
    }

    public Set<String> getNodeImages(String nodeName) {
        return Collections.unmodifiableSet(nodes.get(nodeName).images);
    }

    public List<String> getCreatedDaemonSets() {
        return createdDaemonSets;
    }

    public List<String> getDeletedDaemonSets() {
        return deletedDaemonSets;
    }

    public Map<String, DaemonSet> getDaemonSets() {
        return daemonSets;
    }

    /**
     * Adds a workload as if it was left by a previous process.
     */
    public void addDaemonSet(DaemonSet daemonSet) {
        daemonSets.put(daemonSet.getMetadata().getName(), daemonSet);
    }

    /**
     * Removes a workload behind the back of its owner.
     */
    public void removeDaemonSet(String name) {
        daemonSets.remove(name);
    }

    @Override
    public String getNamespace() {
        return "imagecache";
    }

    @Override
    public List<Node> getNodes() {
        if (failNodeListing) {
            throw new KubeApiException("listNodes", new KubernetesClientException("API server unavailable", 503, null));
        }
        return nodes.values().stream().map(NodeState::toNode).collect(Collectors.toList());
    }

    @Override
    public DaemonSet createDaemonSet(DaemonSet daemonSet) {
        String name = daemonSet.getMetadata().getName();
        CountDownLatch gate = createGate;
        if (gate != null) {
            Uninterruptibles.awaitUninterruptibly(gate);
        }
        if (failCreate) {
            throw new KubeApiException("createDaemonSet", new KubernetesClientException("quota exceeded", 403, null));
        }
        if (daemonSets.putIfAbsent(name, daemonSet) != null) {
            throw new KubeApiException("createDaemonSet", new KubernetesClientException("already exists", 409, null));
        }
        createdDaemonSets.add(name);
        return daemonSet;
    }

    @Override
    public Optional<DaemonSet> findDaemonSet(String name) {
        DaemonSet daemonSet = daemonSets.get(name);
        if (daemonSet == null) {
            return Optional.empty();
        }
        int reads = statusReads.computeIfAbsent(name, k -> new AtomicInteger()).incrementAndGet();
        if (pullsEnabled && reads >= readsBeforeCompletion) {
            completePull(daemonSet);
        }
        return Optional.of(daemonSet);
    }

    @Override
    public boolean deleteDaemonSet(String name) {
        deletedDaemonSets.add(name);
        return daemonSets.remove(name) != null;
    }

    @Override
    public List<DaemonSet> findDaemonSets(Map<String, String> labels) {
        return daemonSets.values().stream()
                .filter(daemonSet -> daemonSet.getMetadata().getLabels().entrySet().containsAll(labels.entrySet()))
                .collect(Collectors.toList());
    }

    private void completePull(DaemonSet daemonSet) {
        Map<String, String> nodeSelector = daemonSet.getSpec().getTemplate().getSpec().getNodeSelector();
        String image = daemonSet.getSpec().getTemplate().getSpec().getContainers().get(0).getImage();
        List<NodeState> targets = nodes.values().stream()
                .filter(node -> node.schedulable() && node.labels.entrySet().containsAll(
                        nodeSelector == null ? Collections.<Map.Entry<String, String>>emptySet() : nodeSelector.entrySet()
                ))
                .collect(Collectors.toList());
        for (NodeState node : targets) {
            node.images.add(image);
            String digest = imageDigests.get(image);
            if (digest != null) {
                node.images.add(repositoryOf(image) + '@' + digest);
            }
        }
        daemonSet.setStatus(new DaemonSetStatusBuilder()
                .withObservedGeneration(1L)
                .withDesiredNumberScheduled(targets.size())
                .withCurrentNumberScheduled(targets.size())
                .withNumberReady(targets.size())
                .withNumberAvailable(targets.size())
                .build()
        );
    }

    private static String repositoryOf(String imageReference) {
        int tagIdx = imageReference.lastIndexOf(':');
        return tagIdx > imageReference.lastIndexOf('/') ? imageReference.substring(0, tagIdx) : imageReference;
    }

    private static class NodeState {

        private final String name;
        private final Map<String, String> labels;
        private final Set<String> images;
        private final List<Taint> taints = new CopyOnWriteArrayList<>();
        private volatile boolean unschedulable;

        private NodeState(String name, Map<String, String> labels, Set<String> images) {
            this.name = name;
            this.labels = new HashMap<>(labels);
            this.images = ConcurrentHashMap.newKeySet();
            this.images.addAll(images);
        }

        private boolean schedulable() {
            return !unschedulable && taints.stream().noneMatch(taint -> "NoSchedule".equals(taint.getEffect()) || "NoExecute".equals(taint.getEffect()));
        }

        private Node toNode() {
            List<String> names = new ArrayList<>(images);
            return new NodeBuilder()
                    .withNewMetadata()
                    .withName(name)
                    .withLabels(new HashMap<>(labels))
                    .endMetadata()
                    .withNewSpec()
                    .withUnschedulable(unschedulable)
                    .withTaints(new ArrayList<>(taints))
                    .endSpec()
                    .withNewStatus()
                    .withImages(names.stream()
                            .map(imageName -> new ContainerImageBuilder().withNames(imageName).withSizeBytes(1024L).build())
                            .collect(Collectors.toList())
                    )
                    .endStatus()
                    .build();
        }
    }
}
