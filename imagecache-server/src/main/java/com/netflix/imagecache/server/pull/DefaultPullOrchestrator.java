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
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.netflix.imagecache.api.node.service.NodeInventory;
import com.netflix.imagecache.api.policy.model.LabelSelector;
import com.netflix.imagecache.api.policy.service.ImageCacheException;
import com.netflix.imagecache.api.pull.model.PullJob;
import com.netflix.imagecache.api.pull.model.PullJobState;
import com.netflix.imagecache.api.pull.service.PullJobHandle;
import com.netflix.imagecache.api.pull.service.PullOrchestrator;
import com.netflix.imagecache.common.runtime.ImageCacheRuntime;
import com.netflix.imagecache.common.util.ExceptionExt;
import com.netflix.imagecache.common.util.time.Clock;
import com.netflix.imagecache.server.MetricConstants;
import com.netflix.imagecache.server.connector.kubernetes.KubeApiException;
import com.netflix.imagecache.server.connector.kubernetes.KubeClusterConnector;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import com.netflix.spectator.api.patterns.PolledMeter;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import io.fabric8.kubernetes.api.model.apps.DaemonSetStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * {@link PullOrchestrator} running one DaemonSet per pull job. Each job goes through the
 * Pending, Creating, Waiting, Deleting and Done states, or ends in Failed. Lifecycle steps run on a Reactor
 * scheduler, independently of the caller.
 */
@Singleton
public class DefaultPullOrchestrator implements PullOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(DefaultPullOrchestrator.class);

    static final String ABANDONED_MESSAGE = "Pull abandoned";

    private static final String METRIC_ROOT = MetricConstants.METRIC_PULL;

    private final PullOrchestratorConfiguration configuration;
    private final KubeClusterConnector kubeClusterConnector;
    private final NodeInventory nodeInventory;
    private final PullWorkloadFactory workloadFactory;
    private final Clock clock;
    private final Scheduler scheduler;

    private final ConcurrentMap<PullKey, DefaultPullJobHandle> activeJobs = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AtomicInteger> attemptCounters = new ConcurrentHashMap<>();

    private final Registry registry;
    private final Id jobsFinishedId;

    @Inject
    public DefaultPullOrchestrator(PullOrchestratorConfiguration configuration,
                                   KubeClusterConnector kubeClusterConnector,
                                   NodeInventory nodeInventory,
                                   ImageCacheRuntime runtime) {
        this(configuration, kubeClusterConnector, nodeInventory, runtime, Schedulers.boundedElastic());
    }

    @VisibleForTesting
    DefaultPullOrchestrator(PullOrchestratorConfiguration configuration,
                            KubeClusterConnector kubeClusterConnector,
                            NodeInventory nodeInventory,
                            ImageCacheRuntime runtime,
                            Scheduler scheduler) {
        this.configuration = configuration;
        this.kubeClusterConnector = kubeClusterConnector;
        this.nodeInventory = nodeInventory;
        this.workloadFactory = new PullWorkloadFactory(configuration);
        this.clock = runtime.getClock();
        this.scheduler = scheduler;

        this.registry = runtime.getRegistry();
        this.jobsFinishedId = registry.createId(METRIC_ROOT + "jobsFinished");
        PolledMeter.using(registry).withName(METRIC_ROOT + "activeJobs").monitorSize(activeJobs);
    }

    @Override
    public PullJobHandle ensurePulled(String policyName, String imageReference, LabelSelector labelSelector, int targetNodeCount) {
        PullKey key = new PullKey(imageReference, labelSelector);
        DefaultPullJobHandle[] created = new DefaultPullJobHandle[1];
        DefaultPullJobHandle handle = activeJobs.compute(key, (k, existing) -> {
            if (existing != null && !existing.isFinished() && existing.attach(policyName)) {
                return existing;
            }
            created[0] = newHandle(policyName, imageReference, labelSelector, targetNodeCount);
            return created[0];
        });
        if (created[0] != null) {
            logger.info("Starting pull job {}: policy={}, image={}, selector={}", created[0].getId(), policyName, imageReference, labelSelector);
            start(key, created[0]);
        } else {
            logger.debug("Pull of {} for selector {} already in progress: {}", imageReference, labelSelector, handle.getId());
        }
        return handle;
    }

    @Override
    public Optional<PullJobHandle> findActivePull(String imageReference, LabelSelector labelSelector) {
        DefaultPullJobHandle handle = activeJobs.get(new PullKey(imageReference, labelSelector));
        return handle == null || handle.isFinished() ? Optional.empty() : Optional.of(handle);
    }

    @Override
    public List<PullJob> getActivePulls(String policyName) {
        return activeJobs.values().stream()
                .filter(handle -> !handle.isFinished() && handle.isAttached(policyName))
                .map(DefaultPullJobHandle::getJob)
                .collect(Collectors.toList());
    }

    @Override
    public void abandon(String policyName) {
        for (Map.Entry<PullKey, DefaultPullJobHandle> entry : new ArrayList<>(activeJobs.entrySet())) {
            DefaultPullJobHandle handle = entry.getValue();
            if (handle.isFinished() || !handle.isAttached(policyName)) {
                continue;
            }
            if (!handle.detach(policyName)) {
                logger.info("Policy {} detached from pull job {}, still used by other policies", policyName, handle.getId());
                continue;
            }
            // Finished before the workload is deleted, so a create still in flight removes what it made
            if (handle.finish(job -> toTerminal(job, PullJobState.Done, ABANDONED_MESSAGE))) {
                logger.info("Abandoned pull job {} of policy {}", handle.getId(), policyName);
                registry.counter(jobsFinishedId.withTag("state", "abandoned")).increment();
            }
            handle.cancelLifecycle();
            deleteWorkload(handle.getId());
            activeJobs.remove(entry.getKey(), handle);
            attemptCounters.remove(attemptKey(handle.getJob()));
        }
    }

    @Override
    public int cleanupOrphanedWorkloads() {
        List<DaemonSet> daemonSets;
        try {
            daemonSets = kubeClusterConnector.findDaemonSets(
                    Collections.singletonMap(PullWorkloadFactory.LABEL_IMAGECACHE, PullWorkloadFactory.LABEL_IMAGECACHE_PULL_VALUE)
            );
        } catch (KubeApiException e) {
            throw ImageCacheException.clusterApiError("listDaemonSets", e);
        }
        int removed = 0;
        for (DaemonSet daemonSet : daemonSets) {
            String name = daemonSet.getMetadata().getName();
            boolean owned = activeJobs.values().stream().anyMatch(handle -> handle.getId().equals(name));
            if (!owned && deleteWorkload(name)) {
                logger.info("Removed orphaned pull workload {}", name);
                removed++;
            }
        }
        return removed;
    }

    private DefaultPullJobHandle newHandle(String policyName, String imageReference, LabelSelector labelSelector, int targetNodeCount) {
        int attempt = attemptCounters.computeIfAbsent(attemptKey(policyName, imageReference), k -> new AtomicInteger()).incrementAndGet();
        long now = clock.wallTime();
        return new DefaultPullJobHandle(PullJob.newBuilder()
                .withId(PullWorkloadFactory.buildWorkloadName(policyName, imageReference, attempt))
                .withPolicyName(policyName)
                .withImageReference(imageReference)
                .withLabelSelector(labelSelector)
                .withState(PullJobState.Pending)
                .withTargetNodeCount(targetNodeCount)
                .withCreatedTimestamp(now)
                .withStateTimestamp(now)
                .build()
        );
    }

    private void start(PullKey key, DefaultPullJobHandle handle) {
        Mono<Boolean> pollOnce = Mono.fromCallable(() -> poll(handle)).filter(done -> done);
        Mono<Boolean> lifecycle = Mono.fromRunnable(() -> createWorkload(handle))
                .then(pollOnce.repeatWhenEmpty(Integer.MAX_VALUE, ticks -> ticks.delayElements(Duration.ofMillis(configuration.getPollIntervalMs()), scheduler)))
                .timeout(Duration.ofMillis(configuration.getPullTimeoutMs()), scheduler)
                .subscribeOn(scheduler);

        handle.setLifecycle(lifecycle.subscribe(
                done -> onCompleted(key, handle),
                error -> onFailed(key, handle, error)
        ));
    }

    private void createWorkload(DefaultPullJobHandle handle) {
        if (handle.isFinished()) {
            throw ImageCacheException.pullFailed(handle.getJob().getImageReference(), "pull job " + handle.getId() + " finished before its workload was created");
        }
        PullJob job = changeState(handle, PullJobState.Creating);
        DaemonSet daemonSet = workloadFactory.newPullDaemonSet(job.getId(), job.getPolicyName(), job.getImageReference(), job.getLabelSelector());
        try {
            kubeClusterConnector.createDaemonSet(daemonSet);
        } catch (KubeApiException e) {
            throw ImageCacheException.pullFailed(job.getImageReference(), "cannot create pull workload " + job.getId() + ": " + e.getMessage());
        }
        if (handle.isFinished()) {
            deleteWorkload(job.getId());
            throw ImageCacheException.pullFailed(job.getImageReference(), "pull job " + job.getId() + " finished while its workload was created");
        }
        changeState(handle, PullJobState.Waiting);
    }

    /**
     * Reads the workload status and records the progress.
     *
     * @return true if the image is on all targeted nodes
     */
    private boolean poll(DefaultPullJobHandle handle) {
        PullJob job = handle.getJob();
        Optional<DaemonSet> daemonSet;
        try {
            daemonSet = kubeClusterConnector.findDaemonSet(job.getId());
        } catch (KubeApiException e) {
            logger.warn("Cannot read status of pull workload {}; retrying on the next poll: {}", job.getId(), e.getMessage());
            return false;
        }
        if (!daemonSet.isPresent()) {
            throw ImageCacheException.pullFailed(job.getImageReference(), "pull workload " + job.getId() + " disappeared");
        }

        DaemonSetStatus status = daemonSet.get().getStatus();
        if (status == null || status.getObservedGeneration() == null) {
            return false;
        }
        int target = status.getDesiredNumberScheduled() == null ? job.getTargetNodeCount() : status.getDesiredNumberScheduled();
        int completed = status.getNumberAvailable() == null ? 0 : status.getNumberAvailable();
        PullJob updated = handle.update(current -> current.toBuilder()
                .withTargetNodeCount(target)
                .withCompletedNodeCount(completed)
                .build()
        );
        logger.debug("Pull job {} progress: {}/{}", updated.getId(), completed, target);
        return completed == target;
    }

    private void onCompleted(PullKey key, DefaultPullJobHandle handle) {
        changeState(handle, PullJobState.Deleting);
        deleteWorkload(handle.getId());
        if (handle.finish(job -> toTerminal(job, PullJobState.Done, null))) {
            logger.info("Pull job {} completed: image={}, nodes={}", handle.getId(), handle.getJob().getImageReference(), handle.getJob().getCompletedNodeCount());
            registry.counter(jobsFinishedId.withTag("state", "done")).increment();
        }
        activeJobs.remove(key, handle);
        attemptCounters.remove(attemptKey(handle.getJob()));
        ExceptionExt.doCatchAndLog(nodeInventory::forceRefresh, logger, "Node inventory refresh after pull job %s failed", handle.getId());
    }

    private void onFailed(PullKey key, DefaultPullJobHandle handle, Throwable error) {
        String reason = error instanceof TimeoutException
                ? "pull not completed within " + configuration.getPullTimeoutMs() + "ms"
                : error instanceof ImageCacheException ? error.getMessage() : ExceptionExt.toMessage(error);
        deleteWorkload(handle.getId());
        if (handle.finish(job -> toTerminal(job, PullJobState.Failed, reason))) {
            logger.warn("Pull job {} failed: image={}, reason={}", handle.getId(), handle.getJob().getImageReference(), reason);
            registry.counter(jobsFinishedId.withTag("state", "failed")).increment();
        }
        activeJobs.remove(key, handle);
    }

    private PullJob changeState(DefaultPullJobHandle handle, PullJobState state) {
        long now = clock.wallTime();
        return handle.update(job -> job.toBuilder().withState(state).withStateTimestamp(now).build());
    }

    private PullJob toTerminal(PullJob job, PullJobState state, String error) {
        PullJob.Builder builder = job.toBuilder().withState(state).withStateTimestamp(clock.wallTime());
        if (error != null) {
            builder.withLastError(error);
        }
        return builder.build();
    }

    private static String attemptKey(PullJob job) {
        return attemptKey(job.getPolicyName(), job.getImageReference());
    }

    private static String attemptKey(String policyName, String imageReference) {
        return policyName + '|' + imageReference;
    }

    @VisibleForTesting
    int getAttemptCounterCount() {
        return attemptCounters.size();
    }

    /**
     * Best effort delete. A workload that does not exist counts as deleted.
     */
    private boolean deleteWorkload(String name) {
        try {
            kubeClusterConnector.deleteDaemonSet(name);
            return true;
        } catch (KubeApiException e) {
            if (e.getErrorCode() == KubeApiException.ErrorCode.NOT_FOUND) {
                return true;
            }
            logger.warn("Cannot delete pull workload {}: {}", name, e.getMessage());
            return false;
        }
    }

    private static class PullKey {

        private final String imageReference;
        private final LabelSelector labelSelector;

        private PullKey(String imageReference, LabelSelector labelSelector) {
            this.imageReference = imageReference;
            this.labelSelector = labelSelector;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            PullKey pullKey = (PullKey) o;
            return Objects.equals(imageReference, pullKey.imageReference) &&
                    Objects.equals(labelSelector, pullKey.labelSelector);
        }

        @Override
        public int hashCode() {
            return Objects.hash(imageReference, labelSelector);
        }
    }
}
