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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.netflix.imagecache.api.node.service.NodeInventory;
import com.netflix.imagecache.api.policy.model.LabelSelector;
import com.netflix.imagecache.api.pull.model.PullJob;
import com.netflix.imagecache.api.pull.model.PullJobState;
import com.netflix.imagecache.api.pull.service.PullJobHandle;
import com.netflix.imagecache.common.runtime.ImageCacheRuntimes;
import com.netflix.imagecache.common.util.archaius2.Archaius2Ext;
import com.netflix.imagecache.server.connector.kubernetes.StubKubeClusterConnector;
import org.junit.Before;
import org.junit.Test;
import reactor.core.scheduler.Schedulers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class DefaultPullOrchestratorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private static final String POLICY = "jupyter";
    private static final String IMAGE = "registry.hub.docker.com/lsstsqre/sciplat-lab:w_2021_13";
    private static final LabelSelector AMD64 = LabelSelector.of("arch", "amd64");

    private final PullOrchestratorConfiguration configuration = Archaius2Ext.newConfiguration(PullOrchestratorConfiguration.class,
            "imagecache.pull.pollIntervalMs", "10",
            "imagecache.pull.pullTimeoutMs", "2000"
    );

    private final StubKubeClusterConnector kube = new StubKubeClusterConnector();
    private final NodeInventory nodeInventory = mock(NodeInventory.class);

    private DefaultPullOrchestrator orchestrator;

    @Before
    public void setUp() {
        kube.addNode("node1", Collections.singletonMap("arch", "amd64"))
                .addNode("node2", Collections.singletonMap("arch", "amd64"))
                .addNode("node3", Collections.singletonMap("arch", "arm64"));
        orchestrator = new DefaultPullOrchestrator(configuration, kube, nodeInventory, ImageCacheRuntimes.test(), Schedulers.parallel());
    }

    @Test
    public void testPullCompletes() {
        kube.withReadsBeforeCompletion(3);

        PullJobHandle handle = orchestrator.ensurePulled(POLICY, IMAGE, AMD64, 2);
        PullJob result = handle.completion().block(TIMEOUT);

        assertThat(result.getState()).isEqualTo(PullJobState.Done);
        assertThat(result.getLastError()).isEmpty();
        assertThat(result.getCompletedNodeCount()).isEqualTo(2);
        assertThat(result.getTargetNodeCount()).isEqualTo(2);
        assertThat(kube.getNodeImages("node1")).contains(IMAGE);
        assertThat(kube.getNodeImages("node3")).doesNotContain(IMAGE);

        assertThat(kube.getDeletedDaemonSets()).containsExactly(handle.getId());
        assertThat(kube.getDaemonSets()).isEmpty();
        await().atMost(TIMEOUT).untilAsserted(() -> verify(nodeInventory).forceRefresh());
        await().atMost(TIMEOUT).until(() -> !orchestrator.findActivePull(IMAGE, AMD64).isPresent());
        assertThat(orchestrator.getActivePulls(POLICY)).isEmpty();
    }

    @Test
    public void testConcurrentRequestsShareOneJob() {
        kube.withPullsEnabled(false);

        PullJobHandle first = orchestrator.ensurePulled(POLICY, IMAGE, AMD64, 2);
        PullJobHandle second = orchestrator.ensurePulled("other-policy", IMAGE, AMD64, 2);

        assertThat(second).isSameAs(first);
        assertThat(orchestrator.findActivePull(IMAGE, AMD64)).contains(first);
        assertThat(orchestrator.getActivePulls(POLICY)).hasSize(1);
        assertThat(orchestrator.getActivePulls("other-policy")).hasSize(1);
        await().atMost(TIMEOUT).until(() -> first.getJob().getState() == PullJobState.Waiting);
        assertThat(kube.getCreatedDaemonSets()).containsExactly(first.getId());

        // Different selector is a different job
        PullJobHandle third = orchestrator.ensurePulled(POLICY, IMAGE, LabelSelector.of("arch", "arm64"), 1);
        assertThat(third).isNotSameAs(first);
    }

    @Test
    public void testConcurrentEnsurePulledFromManyThreadsStartsOneJob() throws Exception {
        kube.withPullsEnabled(false);
        int threadCount = 8;
        CountDownLatch startGate = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        try {
            List<Future<PullJobHandle>> futures = new ArrayList<>();
            for (int i = 0; i < threadCount; i++) {
                String policyName = "policy-" + i;
                futures.add(executor.submit(() -> {
                    startGate.await();
                    return orchestrator.ensurePulled(policyName, IMAGE, AMD64, 2);
                }));
            }
            startGate.countDown();

            Set<PullJobHandle> handles = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Future<PullJobHandle> future : futures) {
                handles.add(future.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
            }
            assertThat(handles).hasSize(1);

            PullJobHandle handle = handles.iterator().next();
            await().atMost(TIMEOUT).until(() -> handle.getJob().getState() == PullJobState.Waiting);
            assertThat(kube.getCreatedDaemonSets()).containsExactly(handle.getId());
            for (int i = 0; i < threadCount; i++) {
                assertThat(orchestrator.getActivePulls("policy-" + i)).extracting(PullJob::getId).containsExactly(handle.getId());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testCreateFailureEndsInFailedStateAndNextAttemptUsesNewWorkload() {
        kube.withFailCreate(true);

        PullJobHandle failed = orchestrator.ensurePulled(POLICY, IMAGE, AMD64, 2);
        PullJob failedJob = failed.completion().block(TIMEOUT);
        assertThat(failedJob.getState()).isEqualTo(PullJobState.Failed);
        assertThat(failedJob.getLastError()).hasValueSatisfying(error -> assertThat(error).contains("cannot create pull workload"));
        await().atMost(TIMEOUT).until(() -> !orchestrator.findActivePull(IMAGE, AMD64).isPresent());

        kube.withFailCreate(false);
        PullJobHandle retried = orchestrator.ensurePulled(POLICY, IMAGE, AMD64, 2);
        assertThat(retried.getId()).isNotEqualTo(failed.getId()).endsWith("-2");
        assertThat(retried.completion().block(TIMEOUT).getState()).isEqualTo(PullJobState.Done);
    }

    @Test
    public void testWorkloadRemovedByOthersFailsJob() {
        kube.withPullsEnabled(false);

        PullJobHandle handle = orchestrator.ensurePulled(POLICY, IMAGE, AMD64, 2);
        await().atMost(TIMEOUT).until(() -> handle.getJob().getState() == PullJobState.Waiting);
        kube.removeDaemonSet(handle.getId());

        PullJob result = handle.completion().block(TIMEOUT);
        assertThat(result.getState()).isEqualTo(PullJobState.Failed);
        assertThat(result.getLastError()).hasValueSatisfying(error -> assertThat(error).contains("disappeared"));
    }

    @Test
    public void testPullTimeout() {
        kube.withPullsEnabled(false);
        DefaultPullOrchestrator fastTimeout = new DefaultPullOrchestrator(
                Archaius2Ext.newConfiguration(PullOrchestratorConfiguration.class,
                        "imagecache.pull.pollIntervalMs", "10",
                        "imagecache.pull.pullTimeoutMs", "200"
                ),
                kube, nodeInventory, ImageCacheRuntimes.test(), Schedulers.parallel()
        );

        PullJobHandle handle = fastTimeout.ensurePulled(POLICY, IMAGE, AMD64, 2);
        PullJob result = handle.completion().block(TIMEOUT);

        assertThat(result.getState()).isEqualTo(PullJobState.Failed);
        assertThat(result.getLastError()).hasValueSatisfying(error -> assertThat(error).contains("not completed within 200ms"));
        await().atMost(TIMEOUT).untilAsserted(() -> assertThat(kube.getDaemonSets()).doesNotContainKey(handle.getId()));
    }

    @Test
    public void testAbandon() {
        kube.withPullsEnabled(false);

        PullJobHandle handle = orchestrator.ensurePulled(POLICY, IMAGE, AMD64, 2);
        await().atMost(TIMEOUT).until(() -> handle.getJob().getState() == PullJobState.Waiting);

        orchestrator.abandon(POLICY);

        PullJob result = handle.completion().block(TIMEOUT);
        assertThat(result.getState()).isEqualTo(PullJobState.Done);
        assertThat(result.getLastError()).contains(DefaultPullOrchestrator.ABANDONED_MESSAGE);
        assertThat(kube.getDaemonSets()).isEmpty();
        assertThat(orchestrator.getActivePulls(POLICY)).isEmpty();
        assertThat(orchestrator.getAttemptCounterCount()).isZero();
    }

    @Test
    public void testSharedJobKeptUntilLastPolicyAbandonsIt() {
        kube.withPullsEnabled(false);

        PullJobHandle handle = orchestrator.ensurePulled(POLICY, IMAGE, AMD64, 2);
        assertThat(orchestrator.ensurePulled("other-policy", IMAGE, AMD64, 2)).isSameAs(handle);
        await().atMost(TIMEOUT).until(() -> handle.getJob().getState() == PullJobState.Waiting);

        orchestrator.abandon(POLICY);
        assertThat(handle.getJob().getState()).isEqualTo(PullJobState.Waiting);
        assertThat(kube.getDaemonSets()).containsOnlyKeys(handle.getId());
        assertThat(orchestrator.getActivePulls(POLICY)).isEmpty();
        assertThat(orchestrator.getActivePulls("other-policy")).extracting(PullJob::getId).containsExactly(handle.getId());

        orchestrator.abandon("other-policy");
        PullJob result = handle.completion().block(TIMEOUT);
        assertThat(result.getState()).isEqualTo(PullJobState.Done);
        assertThat(result.getLastError()).contains(DefaultPullOrchestrator.ABANDONED_MESSAGE);
        assertThat(kube.getDaemonSets()).isEmpty();
        assertThat(orchestrator.findActivePull(IMAGE, AMD64)).isEmpty();
    }

    @Test
    public void testAbandonWhileWorkloadIsBeingCreatedLeavesNoWorkload() {
        CountDownLatch createGate = new CountDownLatch(1);
        kube.withPullsEnabled(false).withCreateGate(createGate);

        PullJobHandle handle = orchestrator.ensurePulled(POLICY, IMAGE, AMD64, 2);
        await().atMost(TIMEOUT).until(() -> handle.getJob().getState() == PullJobState.Creating);

        orchestrator.abandon(POLICY);
        assertThat(handle.completion().block(TIMEOUT).getState()).isEqualTo(PullJobState.Done);

        // The create call returns after the abandon already deleted the (then missing) workload
        createGate.countDown();
        await().atMost(TIMEOUT).until(() -> kube.getCreatedDaemonSets().contains(handle.getId()));
        await().atMost(TIMEOUT).untilAsserted(() -> assertThat(kube.getDaemonSets()).isEmpty());
        assertThat(handle.getJob().getState()).isEqualTo(PullJobState.Done);
    }

    @Test
    public void testAttemptCounterReleasedWhenPullCompletes() {
        PullJobHandle first = orchestrator.ensurePulled(POLICY, IMAGE, AMD64, 2);
        assertThat(first.getId()).endsWith("-1");
        assertThat(orchestrator.getAttemptCounterCount()).isEqualTo(1);

        assertThat(first.completion().block(TIMEOUT).getState()).isEqualTo(PullJobState.Done);
        await().atMost(TIMEOUT).until(() -> orchestrator.getAttemptCounterCount() == 0);

        PullJobHandle next = orchestrator.ensurePulled(POLICY, IMAGE, AMD64, 2);
        assertThat(next.getId()).endsWith("-1");
        assertThat(next.completion().block(TIMEOUT).getState()).isEqualTo(PullJobState.Done);
    }

    @Test
    public void testCleanupOrphanedWorkloads() {
        kube.withPullsEnabled(false);
        PullWorkloadFactory factory = new PullWorkloadFactory(configuration);
        kube.addDaemonSet(factory.newPullDaemonSet("imagecache-old-0123456789-1", "old", "repo/old:1", AMD64));

        PullJobHandle active = orchestrator.ensurePulled(POLICY, IMAGE, AMD64, 2);
        await().atMost(TIMEOUT).until(() -> kube.getDaemonSets().containsKey(active.getId()));

        assertThat(orchestrator.cleanupOrphanedWorkloads()).isEqualTo(1);
        assertThat(kube.getDaemonSets()).containsOnlyKeys(active.getId());
        assertThat(orchestrator.cleanupOrphanedWorkloads()).isZero();
    }
}
